package com.roomdrawapp.roomdraw.domain.estimate;

/**
 * Which number the probability model divides by.
 */
public enum RankBasis {

    /** Competitors still ahead plus the target: the target's own rank among remaining competitors. */
    RANK_AMONG_COMPETITORS,

    /**
     * Competitors still ahead only. Overstates the chance by one place.
     *
     * @deprecated kept so older snapshots can be reproduced; use {@link #RANK_AMONG_COMPETITORS}
     */
    @Deprecated
    PEOPLE_AHEAD;

    public int rankFor(int filteredAhead) {
        return this == RANK_AMONG_COMPETITORS ? filteredAhead + 1 : filteredAhead;
    }
}
