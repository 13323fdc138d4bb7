package com.quoteterm.domain.enums;

/**
 * Freshness of the data on screen, shown in the status bar.
 */
public enum FeedStatus {
    /** Push stream connected and the last refresh succeeded. */
    LIVE,
    /** A refresh failed; the last good data is still displayed. */
    STALE,
    /** The push stream was lost; prices no longer move. */
    DISCONNECTED
}
