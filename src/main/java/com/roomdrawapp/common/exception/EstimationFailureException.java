package com.roomdrawapp.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Fatal condition for a single estimation run. No result is produced when this is thrown.
 */
@Getter
public class EstimationFailureException extends RuntimeException {

    private final EstimationFailureReason reason;
    private final String errorCode;
    private final Map<String, Object> details;

    public EstimationFailureException(String message, EstimationFailureReason reason, Map<String, Object> details) {
        this(message, reason, details, null);
    }

    public EstimationFailureException(String message, EstimationFailureReason reason, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null) ? EstimationFailureReason.PRIMARY_RANKING_UNAVAILABLE : reason;
        this.errorCode = this.reason.name();
        this.details = (details == null) ? Collections.emptyMap() : details;
    }
}
