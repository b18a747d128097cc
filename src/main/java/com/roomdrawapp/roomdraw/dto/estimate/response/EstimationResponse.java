package com.roomdrawapp.roomdraw.dto.estimate.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EstimationResponse {
    private String name;
    private String puid;
    private String drawTime;

    private int rawRank;
    private int rankingSize;
    private int initialAhead;

    private int removedBySubPool;
    private int subPoolCapacity;
    private int removedByCrossPool;
    private int crossPoolTopN;
    private int totalRemoved;

    private int filteredAhead;
    private int competitorRank;
    private String rankBasis;

    private int availableScarceSpots;
    private int probabilityPercent;
    private String chanceRating;

    private List<CompetitorResponse> competitorsAhead;

    private Instant generatedAt;
}
