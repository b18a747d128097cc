package com.roomdrawapp.roomdraw.config;

import com.roomdrawapp.roomdraw.domain.estimate.EstimationPolicy;
import com.roomdrawapp.roomdraw.domain.estimate.RankBasis;
import com.roomdrawapp.roomdraw.domain.room.OccupancyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Configuration
public class EstimatorConfig {

    @Bean
    public EstimationPolicy estimationPolicy(
            @Value("${estimator.policy.cross-pool-top-n:50}") int crossPoolTopN,
            @Value("${estimator.policy.scarce-group:Upperclass}") String scarceGroup,
            @Value("${estimator.policy.scarce-unit:Spelman}") String scarceUnit,
            @Value("${estimator.policy.scarce-occupancy-type:SINGLE}") String scarceOccupancyType,
            @Value("${estimator.policy.rank-basis:RANK_AMONG_COMPETITORS}") String rankBasis,
            @Value("${estimator.policy.occupancy-overrides:}") List<String> occupancyOverrides
    ) {
        EstimationPolicy policy = new EstimationPolicy(
                crossPoolTopN,
                occupancySpots(occupancyOverrides),
                scarceGroup,
                scarceUnit,
                scarceOccupancyType,
                RankBasis.valueOf(rankBasis.trim().toUpperCase(Locale.ROOT))
        );
        log.info("Estimation policy: {}", policy);
        return policy;
    }

    /**
     * Default occupancy map with {@code TYPE=spots} entries layered on top.
     */
    static Map<String, Integer> occupancySpots(List<String> overrides) {
        Map<String, Integer> spots = new LinkedHashMap<>(OccupancyType.defaultSpotMap());
        if (overrides == null) return spots;

        for (String entry : overrides) {
            if (entry == null || entry.isBlank()) continue;
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new IllegalArgumentException("Occupancy override must look like TYPE=spots: " + entry);
            }
            String code = entry.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            int n;
            try {
                n = Integer.parseInt(entry.substring(eq + 1).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Occupancy override has a non-numeric spot count: " + entry, e);
            }
            spots.put(code, n);
        }
        return spots;
    }
}
