package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Front-runners of parallel, independently ranked pools are assumed to take a spot in their own pool.
 */
@Slf4j
public final class CrossPoolClaimantSetBuilder {

    public static final String LABEL = "cross-pool";

    private CrossPoolClaimantSetBuilder() {}

    /**
     * Union over all pools of each pool's first {@code topN} identified records.
     * A null entry stands for a pool that failed to load and contributes nothing.
     */
    public static ClaimantSet build(List<Ranking> pools, int topN, AnomalyLog anomalies) {
        if (pools == null || pools.isEmpty() || topN <= 0) {
            log.info("No cross-pool claimants (pools={}, topN={})", pools == null ? 0 : pools.size(), topN);
            return ClaimantSet.empty(LABEL);
        }

        Set<String> ids = new LinkedHashSet<>();
        for (int i = 0; i < pools.size(); i++) {
            Ranking pool = pools.get(i);
            if (pool == null) {
                anomalies.report(AnomalyKind.SOURCE_SKIPPED, "pool#" + (i + 1), "Pool failed to load; contributes no claimants");
                continue;
            }

            int taken = 0;
            for (DrawRecord r : pool.records()) {
                if (taken >= topN) break;
                if (!r.hasIdentity()) {
                    anomalies.report(
                            AnomalyKind.MISSING_IDENTITY,
                            pool.sourceName(),
                            "Pool row has no identity; skipped for early drawer check",
                            r.snapshot()
                    );
                    continue;
                }
                ids.add(r.identity());
                taken++;
            }
            log.info("Added identities for the top {} drawers from {}", taken, pool.sourceName());
        }

        log.info("Cross-pool claimants: {} unique identities from {} pools (top {})", ids.size(), pools.size(), topN);
        return new ClaimantSet(LABEL, ids);
    }
}
