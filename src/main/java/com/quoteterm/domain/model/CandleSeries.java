package com.quoteterm.domain.model;

import com.quoteterm.domain.enums.ChartPeriod;
import java.time.Instant;
import java.util.List;
import lombok.Value;

/**
 * The candle fragment currently held for one instrument and chart period. {@code timestamp} is
 * the time of the newest candle and is what the store's monotonicity check compares.
 */
@Value
public class CandleSeries {

    ChartPeriod period;
    List<Candle> candles;
    Instant timestamp;

    public CandleSeries(ChartPeriod period, List<Candle> candles) {
        this.period = period;
        this.candles = candles == null ? List.of() : List.copyOf(candles);
        this.timestamp = this.candles.isEmpty()
                ? Instant.EPOCH
                : this.candles.get(this.candles.size() - 1).getTimestamp();
    }
}
