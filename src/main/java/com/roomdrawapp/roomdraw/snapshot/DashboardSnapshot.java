package com.roomdrawapp.roomdraw.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationResult;
import lombok.*;

/**
 * Wire shape read by the dashboard. Field names are that consumer's contract; new fields are
 * additive only.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardSnapshot {
    private String userName;
    private String puid;
    private String drawTime;
    private int rawPosition;
    private int initialAhead;
    private int removedSpelman;
    private int spelmanCapacity;
    private int removedOtherRes;
    private int otherResTopN;
    private int totalRemoved;
    private int finalPositionEstimate;
    private int availableSingles;
    private int probabilitySingle;
    private String lastUpdated;

    private int competitorRank;
    private String chanceRating;

    public static DashboardSnapshot from(EstimationResult r) {
        return DashboardSnapshot.builder()
                .userName(r.getDisplayName())
                .puid(r.getIdentity())
                .drawTime(r.getDrawTime())
                .rawPosition(r.getRawRank())
                .initialAhead(r.getInitialAhead())
                .removedSpelman(r.getRemovedBySubPool())
                .spelmanCapacity(r.getSubPoolCapacity())
                .removedOtherRes(r.getRemovedByCrossPool())
                .otherResTopN(r.getCrossPoolTopN())
                .totalRemoved(r.getTotalRemoved())
                .finalPositionEstimate(r.getFilteredAhead())
                .availableSingles(r.getAvailableScarceSpots())
                .probabilitySingle(r.getProbabilityPercent())
                .lastUpdated(r.getGeneratedAt() == null ? null : r.getGeneratedAt().toString())
                .competitorRank(r.getCompetitorRank())
                .chanceRating(r.getChanceRating() == null ? null : r.getChanceRating().name())
                .build();
    }
}
