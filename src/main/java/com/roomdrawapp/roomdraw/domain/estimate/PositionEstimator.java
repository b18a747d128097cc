package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.common.exception.EstimationFailureException;
import com.roomdrawapp.common.exception.EstimationFailureReason;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public final class PositionEstimator {

    private PositionEstimator() {}

    /**
     * Finds the target in the primary ranking and filters the records ahead of it.
     *
     * Rules:
     * - Target match: first record whose trimmed first and last names equal the input, ignoring case.
     * - Each record ahead is tested against the sub-pool set first, then the cross-pool set.
     * - Every matching record is removed. Category tallies count an identity once, in the first
     *   category it was removed under.
     * - Records without an identity cannot be matched and stay ahead (reported).
     *
     * @throws EstimationFailureException TARGET_NOT_FOUND when no record matches
     */
    public static PositionEstimate estimate(
            Ranking primary,
            String firstName,
            String lastName,
            ClaimantSet subPool,
            ClaimantSet crossPool,
            AnomalyLog anomalies
    ) {
        int index = primary.indexOfName(firstName, lastName).orElseThrow(() -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("firstName", firstName);
            details.put("lastName", lastName);
            details.put("source", primary.sourceName());
            details.put("rankingSize", primary.size());
            return new EstimationFailureException(
                    "User '" + firstName + " " + lastName + "' not found in " + primary.sourceName(),
                    EstimationFailureReason.TARGET_NOT_FOUND,
                    details
            );
        });

        DrawRecord target = primary.records().get(index);
        List<DrawRecord> ahead = primary.records().subList(0, index);

        ClaimantSet sub = subPool == null ? ClaimantSet.empty(SubPoolClaimantSetBuilder.LABEL) : subPool;
        ClaimantSet cross = crossPool == null ? ClaimantSet.empty(CrossPoolClaimantSetBuilder.LABEL) : crossPool;

        List<DrawRecord> remaining = new ArrayList<>();
        Set<String> alreadyRemoved = new HashSet<>();
        int removedSub = 0;
        int removedCross = 0;

        for (DrawRecord r : ahead) {
            if (!r.hasIdentity()) {
                anomalies.report(
                        AnomalyKind.MISSING_IDENTITY,
                        primary.sourceName(),
                        "Person ahead (" + r.displayName() + ") has no identity; cannot filter, keeping",
                        r.snapshot()
                );
                remaining.add(r);
                continue;
            }

            String id = r.identity();
            if (sub.contains(id)) {
                if (alreadyRemoved.add(id)) removedSub++;
            } else if (cross.contains(id)) {
                if (alreadyRemoved.add(id)) removedCross++;
            } else {
                remaining.add(r);
            }
        }

        PositionEstimate estimate = new PositionEstimate(
                target, index + 1, primary.size(), ahead.size(), removedSub, removedCross, remaining);

        log.info("Target {} at raw rank {}/{}: {} ahead, {} removed ({} {}, {} {}), {} remaining",
                target.displayName(), estimate.rawRank(), estimate.rankingSize(), estimate.initialAhead(),
                estimate.totalRemoved(), removedSub, sub.label(), removedCross, cross.label(), estimate.filteredAhead());

        return estimate;
    }
}
