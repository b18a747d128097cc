package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.common.exception.EstimationFailureException;
import com.roomdrawapp.common.exception.EstimationFailureReason;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;

/**
 * Runs the estimation stages in order: capacity, claimant sets, position, probability.
 * Pure function of its arguments apart from logging.
 */
@Slf4j
public final class DrawEstimator {

    private DrawEstimator() {}

    public static EstimationResult estimate(EstimationInput input, EstimationPolicy policy, AnomalyLog anomalies, Instant generatedAt) {
        if (input.primary() == null || input.primary().isEmpty()) {
            throw new EstimationFailureException(
                    "Primary ranking is unavailable",
                    EstimationFailureReason.PRIMARY_RANKING_UNAVAILABLE,
                    Map.of("source", input.primary() == null ? "-" : input.primary().sourceName())
            );
        }

        CapacitySummary capacity = CapacityResolver.resolve(input.rooms(), policy, input.roomsSourceName(), anomalies);

        ClaimantSet subPool = capacity.roomDataAvailable()
                ? SubPoolClaimantSetBuilder.build(input.unitRanking(), capacity.unitCapacity(), anomalies)
                : ClaimantSet.empty(SubPoolClaimantSetBuilder.LABEL);

        ClaimantSet crossPool = CrossPoolClaimantSetBuilder.build(input.crossPools(), policy.crossPoolTopN(), anomalies);

        PositionEstimate position = PositionEstimator.estimate(
                input.primary(), input.firstName(), input.lastName(), subPool, crossPool, anomalies);

        if (policy.rankBasis() != RankBasis.RANK_AMONG_COMPETITORS) {
            log.warn("Using deprecated rank basis {}; probability will be one place optimistic", policy.rankBasis());
        }

        int rank = policy.rankBasis().rankFor(position.filteredAhead());
        int probability = ProbabilityModel.percent(capacity.scarceSpotCount(), rank);

        EstimationResult result = EstimationResult.builder()
                .displayName(position.target().displayName())
                .identity(position.target().identity())
                .drawTime(position.target().drawTimeText())
                .rawRank(position.rawRank())
                .rankingSize(position.rankingSize())
                .initialAhead(position.initialAhead())
                .removedBySubPool(position.removedBySubPool())
                .subPoolCapacity(capacity.unitCapacity())
                .removedByCrossPool(position.removedByCrossPool())
                .crossPoolTopN(policy.crossPoolTopN())
                .totalRemoved(position.totalRemoved())
                .filteredAhead(position.filteredAhead())
                .competitorRank(rank)
                .rankBasis(policy.rankBasis())
                .availableScarceSpots(capacity.scarceSpotCount())
                .probabilityPercent(probability)
                .chanceRating(ChanceRating.fromPercent(probability))
                .remainingAhead(position.remainingAhead())
                .generatedAt(generatedAt)
                .build();

        log.info("Estimate for {}: {} competitors ahead, rank {}, {} scarce spots, {}% ({})",
                result.getDisplayName(), result.getFilteredAhead(), rank,
                result.getAvailableScarceSpots(), probability, result.getChanceRating());

        return result;
    }
}
