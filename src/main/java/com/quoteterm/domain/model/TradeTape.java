package com.quoteterm.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Value;

/**
 * Most recent trades for one instrument, newest last. Capped at {@link #MAX_TRADES}; older
 * prints are dropped when a longer list is supplied.
 */
@Value
public class TradeTape {

    public static final int MAX_TRADES = 50;

    List<TradePrint> trades;
    Instant timestamp;

    public TradeTape(List<TradePrint> trades, Instant timestamp) {
        List<TradePrint> source = trades == null ? List.of() : trades;
        int from = Math.max(0, source.size() - MAX_TRADES);
        this.trades = List.copyOf(source.subList(from, source.size()));
        this.timestamp = timestamp;
    }
}
