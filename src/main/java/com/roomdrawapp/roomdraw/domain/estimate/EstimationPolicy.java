package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.room.OccupancyType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tunable constants of one estimation run. Passed explicitly to every engine call so runs with
 * different policies never interfere.
 *
 * @param crossPoolTopN       how many front-runners of each parallel pool are assumed to claim a spot there
 * @param occupancySpots      occupancy code (upper-case) to spot count
 * @param scarceGroup         housing group of the primary draw, e.g. {@code Upperclass}
 * @param scarceUnit          unit inside that group with its own ranking, e.g. {@code Spelman}
 * @param scarceOccupancyType occupancy code whose rooms are the scarce spots, e.g. {@code SINGLE}
 * @param rankBasis           divisor used by the probability model
 */
public record EstimationPolicy(
        int crossPoolTopN,
        Map<String, Integer> occupancySpots,
        String scarceGroup,
        String scarceUnit,
        String scarceOccupancyType,
        RankBasis rankBasis
) {

    public static final int DEFAULT_CROSS_POOL_TOP_N = 50;

    public EstimationPolicy {
        if (crossPoolTopN < 0) throw new IllegalArgumentException("crossPoolTopN must be >= 0");
        if (scarceGroup == null || scarceGroup.isBlank()) throw new IllegalArgumentException("scarceGroup is required");
        if (scarceUnit == null || scarceUnit.isBlank()) throw new IllegalArgumentException("scarceUnit is required");
        if (scarceOccupancyType == null || scarceOccupancyType.isBlank()) {
            throw new IllegalArgumentException("scarceOccupancyType is required");
        }

        Map<String, Integer> spots = new LinkedHashMap<>();
        if (occupancySpots != null) {
            occupancySpots.forEach((k, v) -> {
                if (k == null || k.isBlank()) throw new IllegalArgumentException("occupancy code must not be blank");
                if (v == null || v < 0) throw new IllegalArgumentException("spots for " + k + " must be >= 0");
                spots.put(normCode(k), v);
            });
        }

        occupancySpots = Collections.unmodifiableMap(spots);
        scarceGroup = scarceGroup.trim();
        scarceUnit = scarceUnit.trim();
        scarceOccupancyType = normCode(scarceOccupancyType);
        rankBasis = rankBasis == null ? RankBasis.RANK_AMONG_COMPETITORS : rankBasis;
    }

    public static EstimationPolicy defaults() {
        return new EstimationPolicy(
                DEFAULT_CROSS_POOL_TOP_N,
                OccupancyType.defaultSpotMap(),
                "Upperclass",
                "Spelman",
                OccupancyType.SINGLE.code(),
                RankBasis.RANK_AMONG_COMPETITORS
        );
    }

    public EstimationPolicy withCrossPoolTopN(int topN) {
        return new EstimationPolicy(topN, occupancySpots, scarceGroup, scarceUnit, scarceOccupancyType, rankBasis);
    }

    public EstimationPolicy withRankBasis(RankBasis basis) {
        return new EstimationPolicy(crossPoolTopN, occupancySpots, scarceGroup, scarceUnit, scarceOccupancyType, basis);
    }

    public Optional<Integer> spotsFor(String occupancyCode) {
        if (occupancyCode == null) return Optional.empty();
        return Optional.ofNullable(occupancySpots.get(normCode(occupancyCode)));
    }

    public boolean isScarceType(String occupancyCode) {
        return occupancyCode != null && scarceOccupancyType.equals(normCode(occupancyCode));
    }

    private static String normCode(String s) {
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
