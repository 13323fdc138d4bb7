package com.quoteterm.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error classes surfaced by the terminal. {@code recoverable} tells the caller whether the
 * condition can be absorbed at the component boundary (logged, stale data kept) or must be
 * propagated to the owning subsystem.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", true),
    NOT_FOUND("NOT_FOUND", true),
    UPSTREAM_ERROR("UPSTREAM_ERROR", true),
    RATE_LIMITED("RATE_LIMITED", true),
    RATE_LIMIT_EXHAUSTED("RATE_LIMIT_EXHAUSTED", true),
    DECODE_ERROR("DECODE_ERROR", true),
    STORAGE_ERROR("STORAGE_ERROR", true),
    STREAM_LOST("STREAM_LOST", false),
    INSTANCE_LOCKED("INSTANCE_LOCKED", false);

    private final String code;
    private final boolean recoverable;
}
