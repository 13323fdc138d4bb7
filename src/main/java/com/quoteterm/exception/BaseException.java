package com.quoteterm.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the terminal's unchecked exceptions. Every subclass is tagged with an {@link ErrorCode}
 * so that boundaries can decide between absorbing (log, keep stale data) and propagating.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    /** True when the failure can be absorbed at the component boundary. */
    public boolean isRecoverable() {
        return errorCode.isRecoverable();
    }
}
