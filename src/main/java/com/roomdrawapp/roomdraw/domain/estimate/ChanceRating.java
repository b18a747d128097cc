package com.roomdrawapp.roomdraw.domain.estimate;

/** Verbal band shown next to the percentage on the dashboard. */
public enum ChanceRating {
    EXCELLENT(90),
    GOOD(70),
    FAIR(50),
    LIMITED(30),
    POOR(0);

    private final int minPercent;

    ChanceRating(int minPercent) {
        this.minPercent = minPercent;
    }

    public static ChanceRating fromPercent(int percent) {
        for (ChanceRating r : values()) {
            if (percent >= r.minPercent) return r;
        }
        return POOR;
    }
}
