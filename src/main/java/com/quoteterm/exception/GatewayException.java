package com.quoteterm.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Failure reported by the external market-data/trading API.
 *
 * <p>{@code statusCode} carries the vendor's HTTP-like status when one is known (0 otherwise).
 * A status of 429 marks the failure as rate limited; the {@link com.quoteterm.ratelimit.RateGovernor}
 * also recognises rate limiting by message text for vendors that only report it there.
 */
@Getter
public class GatewayException extends BaseException {

    public static final int STATUS_TOO_MANY_REQUESTS = 429;

    private final int statusCode;

    public GatewayException(String message) {
        this(0, message);
    }

    public GatewayException(int statusCode, String message) {
        super(codeFor(statusCode), message, Map.of("statusCode", statusCode));
        this.statusCode = statusCode;
    }

    public GatewayException(int statusCode, String message, Throwable cause) {
        super(codeFor(statusCode), message, Map.of("statusCode", statusCode), cause);
        this.statusCode = statusCode;
    }

    private static ErrorCode codeFor(int statusCode) {
        return statusCode == STATUS_TOO_MANY_REQUESTS ? ErrorCode.RATE_LIMITED : ErrorCode.UPSTREAM_ERROR;
    }
}
