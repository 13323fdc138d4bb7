package com.quoteterm.domain.enums;

/**
 * Candle period shown by the chart panel. {@link #next()} and {@link #prev()} step through the
 * periods in order and stop at either end.
 */
public enum ChartPeriod {
    MINUTE_1("1m"),
    MINUTE_5("5m"),
    MINUTE_15("15m"),
    MINUTE_30("30m"),
    HOUR_1("1h"),
    DAY("Day"),
    WEEK("Week"),
    MONTH("Month"),
    YEAR("Year");

    private final String label;

    ChartPeriod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public ChartPeriod next() {
        ChartPeriod[] all = values();
        return all[Math.min(ordinal() + 1, all.length - 1)];
    }

    public ChartPeriod prev() {
        return values()[Math.max(ordinal() - 1, 0)];
    }
}
