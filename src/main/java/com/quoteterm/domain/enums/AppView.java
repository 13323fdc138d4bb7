package com.quoteterm.domain.enums;

/** Top-level screen the terminal is showing. */
public enum AppView {
    WATCHLIST,
    STOCK,
    WATCHLIST_STOCK,
    PORTFOLIO
}
