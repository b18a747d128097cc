package com.roomdrawapp.common.exception;

import lombok.Getter;

/**
 * A whole input source could not be used: file missing or unreadable, or required columns absent.
 * Callers decide whether this degrades the run or ends it.
 */
@Getter
public class SourceLoadException extends RuntimeException {

    private final String sourceName;

    public SourceLoadException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceLoadException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }
}
