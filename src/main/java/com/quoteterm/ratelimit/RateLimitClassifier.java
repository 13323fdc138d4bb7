package com.quoteterm.ratelimit;

import com.quoteterm.exception.GatewayException;
import java.util.Locale;

/**
 * Decides whether a failed upstream call was rejected for exceeding the vendor's rate limit.
 * Checks the explicit status code first, then the message text of the whole cause chain.
 */
public final class RateLimitClassifier {

    private static final String[] PATTERNS = {"429", "rate limit", "too many requests"};

    private RateLimitClassifier() {}

    public static boolean isRateLimited(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 8) {
            if (current instanceof GatewayException gatewayException
                    && gatewayException.getStatusCode() == GatewayException.STATUS_TOO_MANY_REQUESTS) {
                return true;
            }
            if (matchesMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean matchesMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
