package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
@ToString(exclude = "remainingAhead")
public class EstimationResult {

    private final String displayName;
    private final String identity;
    private final String drawTime;

    private final int rawRank;
    private final int rankingSize;
    private final int initialAhead;

    private final int removedBySubPool;
    private final int subPoolCapacity;
    private final int removedByCrossPool;
    private final int crossPoolTopN;
    private final int totalRemoved;

    private final int filteredAhead;
    private final int competitorRank;
    private final RankBasis rankBasis;

    private final int availableScarceSpots;
    private final int probabilityPercent;
    private final ChanceRating chanceRating;

    private final List<DrawRecord> remainingAhead;

    private final Instant generatedAt;
}
