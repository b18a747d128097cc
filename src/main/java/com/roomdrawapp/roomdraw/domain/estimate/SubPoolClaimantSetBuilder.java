package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Whoever ranks within a unit's own capacity is assumed to take a spot there instead of
 * competing in the primary draw.
 */
@Slf4j
public final class SubPoolClaimantSetBuilder {

    public static final String LABEL = "sub-pool";

    private SubPoolClaimantSetBuilder() {}

    /**
     * Identities of the first {@code capacity} identified records of the unit ranking.
     * Records without an identity are reported and do not use up a slot.
     */
    public static ClaimantSet build(Ranking unitRanking, int capacity, AnomalyLog anomalies) {
        if (unitRanking == null) {
            log.info("No unit ranking; sub-pool exclusion is inactive");
            return ClaimantSet.empty(LABEL);
        }
        if (capacity <= 0) {
            anomalies.report(
                    AnomalyKind.NON_POSITIVE_CAPACITY,
                    unitRanking.sourceName(),
                    "Unit capacity is " + capacity + "; no sub-pool drawers will be filtered"
            );
            return ClaimantSet.empty(LABEL);
        }

        Set<String> ids = new LinkedHashSet<>();
        for (DrawRecord r : unitRanking.records()) {
            if (ids.size() >= capacity) break;
            if (!r.hasIdentity()) {
                anomalies.report(
                        AnomalyKind.MISSING_IDENTITY,
                        unitRanking.sourceName(),
                        "Unit ranking row has no identity; skipped for claimant check",
                        r.snapshot()
                );
                continue;
            }
            ids.add(r.identity());
        }

        log.info("Sub-pool claimants: top {} identities of {} (capacity {})", ids.size(), unitRanking.sourceName(), capacity);
        return new ClaimantSet(LABEL, ids);
    }
}
