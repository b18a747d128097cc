package com.roomdrawapp.common.exception;

public enum EstimationFailureReason {
    /** Primary ranking file missing, unreadable, malformed or empty. */
    PRIMARY_RANKING_UNAVAILABLE,
    /** No record in the primary ranking matches the requested first/last name. */
    TARGET_NOT_FOUND
}
