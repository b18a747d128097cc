package com.roomdrawapp.roomdraw.domain.anomaly;

public enum AnomalyKind {
    // row level
    UNPARSEABLE_DRAW_TIME,
    MISSING_REQUIRED_FIELD,
    MISSING_IDENTITY,
    UNKNOWN_OCCUPANCY_TYPE,

    // source level
    SOURCE_UNAVAILABLE,
    SOURCE_SKIPPED,
    NON_POSITIVE_CAPACITY,
    SNAPSHOT_NOT_WRITTEN
}
