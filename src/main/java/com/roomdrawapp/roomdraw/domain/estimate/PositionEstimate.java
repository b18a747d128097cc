package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;

import java.util.List;

/**
 * Where the target stands in the primary ranking before and after removing predicted claimants.
 *
 * @param rawRank            1-based position in the primary ranking
 * @param removedBySubPool   unique identities attributed to the sub-pool
 * @param removedByCrossPool unique identities attributed to the cross-pool set
 * @param remainingAhead     records still ahead after removal, in draw order
 */
public record PositionEstimate(
        DrawRecord target,
        int rawRank,
        int rankingSize,
        int initialAhead,
        int removedBySubPool,
        int removedByCrossPool,
        List<DrawRecord> remainingAhead
) {

    public PositionEstimate {
        remainingAhead = remainingAhead == null ? List.of() : List.copyOf(remainingAhead);
        if (remainingAhead.size() > initialAhead) {
            throw new IllegalArgumentException("remainingAhead cannot exceed initialAhead");
        }
    }

    public int filteredAhead() {
        return remainingAhead.size();
    }

    /** Physical records removed from the ahead list. Always initialAhead - filteredAhead. */
    public int totalRemoved() {
        return initialAhead - remainingAhead.size();
    }
}
