package com.quoteterm.domain.model;

import java.time.Instant;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of everything known about one instrument. Built by the
 * {@link com.quoteterm.store.MarketStateStore}; all parts are immutable, so a snapshot can be
 * handed to the renderer or the alert engine without locking.
 *
 * <p>Each part is individually consistent. Parts may come from different pushes: the quote can be
 * newer than the depth book.
 */
@Value
@Builder
public class MarketSnapshot {

    InstrumentId instrument;
    Quote quote;
    DepthBook depth;
    TradeTape trades;
    CandleSeries candles;

    /** Wall-clock time of the most recent update applied to any part. */
    Instant lastUpdated;

    public Optional<Quote> quote() {
        return Optional.ofNullable(quote);
    }

    public Optional<DepthBook> depth() {
        return Optional.ofNullable(depth);
    }

    public Optional<TradeTape> trades() {
        return Optional.ofNullable(trades);
    }

    public Optional<CandleSeries> candles() {
        return Optional.ofNullable(candles);
    }
}
