package com.quoteterm.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Screen regions the drawing layer can redraw independently.
 *
 * <p>The static helpers map each kind of change to the regions that display it. A quote
 * also dirties the aggregated views (watch list, index carousel, status bar) because they show
 * the last price too.
 */
public enum DirtyRegion {
    WATCHLIST,
    STOCK_DETAIL,
    PORTFOLIO,
    INDEXES,
    QUOTE,
    DEPTH,
    TRADES,
    CHART,
    NAVIGATION,
    STATUS_BAR,
    ALERTS,
    POPUP;

    public static Set<DirtyRegion> all() {
        return EnumSet.allOf(DirtyRegion.class);
    }

    public static Set<DirtyRegion> forUpdate(UpdateCategory category) {
        return switch (category) {
            case QUOTE -> EnumSet.of(WATCHLIST, STOCK_DETAIL, QUOTE, INDEXES, STATUS_BAR);
            case DEPTH -> EnumSet.of(STOCK_DETAIL, DEPTH);
            case TRADES -> EnumSet.of(STOCK_DETAIL, TRADES);
            case CANDLES -> EnumSet.of(STOCK_DETAIL, CHART);
        };
    }
}
