package com.quoteterm.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Last known quote for one instrument. Replaced as a whole on every quote push or snapshot
 * refresh; never patched field by field.
 *
 * <p>{@code prevClose} is only delivered by snapshot queries, so push updates carry over the
 * previous value (see {@code PushEventDecoder}). Change figures are derived from it.
 */
@Value
@Builder(toBuilder = true)
public class Quote {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal lastPrice;
    BigDecimal prevClose;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;

    /** Cumulative session volume. */
    long volume;

    BigDecimal turnover;
    Instant timestamp;
    String tradeStatus;
    String tradeSession;

    /** Absolute change against the previous close. */
    public Optional<BigDecimal> change() {
        if (lastPrice == null || prevClose == null) {
            return Optional.empty();
        }
        return Optional.of(lastPrice.subtract(prevClose));
    }

    /** Change against the previous close in percent; empty without a positive previous close. */
    public Optional<BigDecimal> changePercent() {
        if (lastPrice == null || prevClose == null || prevClose.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(lastPrice.subtract(prevClose)
                .multiply(HUNDRED)
                .divide(prevClose, 6, RoundingMode.HALF_UP));
    }
}
