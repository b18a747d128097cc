package com.roomdrawapp.roomdraw.service;

import com.roomdrawapp.common.exception.BadRequestException;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.estimate.DrawEstimator;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationInput;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationPolicy;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationResult;
import com.roomdrawapp.roomdraw.dto.common.ApiResponse;
import com.roomdrawapp.roomdraw.dto.estimate.request.EstimateRequest;
import com.roomdrawapp.roomdraw.dto.estimate.response.CompetitorResponse;
import com.roomdrawapp.roomdraw.dto.estimate.response.EstimationResponse;
import com.roomdrawapp.roomdraw.dto.estimate.response.PolicyResponse;
import com.roomdrawapp.roomdraw.ingestion.IngestionService;
import com.roomdrawapp.roomdraw.ingestion.model.IngestedPools;
import com.roomdrawapp.roomdraw.snapshot.EstimationResultSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class EstimationService {

    private final IngestionService ingestionService;
    private final EstimationResultSink resultSink;
    private final EstimationPolicy estimationPolicy;

    public ApiResponse<EstimationResponse> estimate(EstimateRequest request) {
        String first = trimToNull(request.getFirstName());
        String last = trimToNull(request.getLastName());
        if (first == null || last == null) {
            throw new BadRequestException("firstName and lastName are required");
        }

        EstimationPolicy policy = resolvePolicy(request);
        AnomalyLog anomalies = new AnomalyLog();

        log.info("Estimating draw position for {} {}", first, last);
        IngestedPools pools = ingestionService.ingest(request.getAdditionalPools(), anomalies);

        EstimationInput input = EstimationInput.builder()
                .primary(pools.primary())
                .rooms(pools.rooms().rooms())
                .roomsSourceName(pools.rooms().sourceName())
                .unitRanking(pools.unitRanking())
                .crossPools(pools.crossPools())
                .firstName(first)
                .lastName(last)
                .build();

        EstimationResult result = DrawEstimator.estimate(input, policy, anomalies, Instant.now());
        resultSink.publish(result, anomalies);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("primarySource", pools.primary().sourceName());
        meta.put("roomSource", pools.rooms().available() ? pools.rooms().sourceName() : null);
        meta.put("subPoolSource", pools.unitRanking() == null ? null : pools.unitRanking().sourceName());
        meta.put("crossPoolSources", pools.crossPools().stream().map(r -> r.sourceName()).toList());
        meta.put("anomalyCount", anomalies.size());
        meta.put("anomaliesByKind", anomalies.countsByKind());

        return ApiResponse.ok(
                "Estimate computed",
                toResponse(result, request.isIncludeCompetitors()),
                anomalies.describeAll(),
                meta
        );
    }

    public ApiResponse<PolicyResponse> getPolicy() {
        return ApiResponse.ok("Policy loaded", PolicyResponse.builder()
                .crossPoolTopN(estimationPolicy.crossPoolTopN())
                .scarceGroup(estimationPolicy.scarceGroup())
                .scarceUnit(estimationPolicy.scarceUnit())
                .scarceOccupancyType(estimationPolicy.scarceOccupancyType())
                .rankBasis(estimationPolicy.rankBasis().name())
                .occupancySpots(estimationPolicy.occupancySpots())
                .build());
    }

    private EstimationPolicy resolvePolicy(EstimateRequest request) {
        Integer topN = request.getCrossPoolTopN();
        if (topN == null) return estimationPolicy;
        if (topN < 0) {
            throw new BadRequestException("crossPoolTopN must be >= 0", Map.of("crossPoolTopN", topN));
        }
        return estimationPolicy.withCrossPoolTopN(topN);
    }

    private EstimationResponse toResponse(EstimationResult r, boolean includeCompetitors) {
        return EstimationResponse.builder()
                .name(r.getDisplayName())
                .puid(r.getIdentity())
                .drawTime(r.getDrawTime())
                .rawRank(r.getRawRank())
                .rankingSize(r.getRankingSize())
                .initialAhead(r.getInitialAhead())
                .removedBySubPool(r.getRemovedBySubPool())
                .subPoolCapacity(r.getSubPoolCapacity())
                .removedByCrossPool(r.getRemovedByCrossPool())
                .crossPoolTopN(r.getCrossPoolTopN())
                .totalRemoved(r.getTotalRemoved())
                .filteredAhead(r.getFilteredAhead())
                .competitorRank(r.getCompetitorRank())
                .rankBasis(r.getRankBasis().name())
                .availableScarceSpots(r.getAvailableScarceSpots())
                .probabilityPercent(r.getProbabilityPercent())
                .chanceRating(r.getChanceRating().name())
                .competitorsAhead(includeCompetitors ? competitors(r.getRemainingAhead()) : null)
                .generatedAt(r.getGeneratedAt())
                .build();
    }

    private static List<CompetitorResponse> competitors(List<DrawRecord> records) {
        List<CompetitorResponse> out = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            DrawRecord d = records.get(i);
            out.add(CompetitorResponse.builder()
                    .position(i + 1)
                    .name(d.displayName())
                    .puid(d.identity())
                    .drawTime(d.drawTimeText())
                    .build());
        }
        return out;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
