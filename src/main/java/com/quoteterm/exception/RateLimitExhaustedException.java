package com.quoteterm.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Thrown by the rate governor once every retry of a rate-limited call has failed.
 * The last upstream error is preserved as the cause.
 */
@Getter
public class RateLimitExhaustedException extends BaseException {

    private final String requestName;
    private final int attempts;

    public RateLimitExhaustedException(String requestName, int attempts, Throwable lastError) {
        super(
                ErrorCode.RATE_LIMIT_EXHAUSTED,
                "Rate limit exhausted for '" + requestName + "' after " + attempts + " attempts: "
                        + lastError.getMessage(),
                Map.of("request", requestName, "attempts", attempts),
                lastError);
        this.requestName = requestName;
        this.attempts = attempts;
    }
}
