package com.roomdrawapp.roomdraw.domain.estimate;

/**
 * Linear heuristic for the chance of getting a scarce spot. This is an estimate, not a guarantee:
 * it ignores preferences, group pulls and every allocation round after the first.
 */
public final class ProbabilityModel {

    private ProbabilityModel() {}

    /**
     * @param available scarce spots in the group
     * @param rank      target's adjusted rank (see {@link RankBasis})
     * @return whole percent in [0, 100]
     */
    public static int percent(int available, int rank) {
        if (available <= 0) return 0;
        if (rank <= 0) return 100;
        if (available >= rank) return 100;
        long pct = Math.round(100.0 * available / rank);
        return (int) Math.max(0, Math.min(100, pct));
    }
}
