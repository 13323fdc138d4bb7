package com.quoteterm.service;

import com.quoteterm.domain.enums.FeedStatus;
import java.time.Instant;
import java.util.Optional;

/**
 * Read-only feed freshness for the status bar: the current status and when data last arrived
 * successfully.
 */
public interface FeedStatusView {

    FeedStatus getFeedStatus();

    Optional<Instant> getLastSuccessAt();

    /** Message of the failure that made the feed STALE or DISCONNECTED, if any. */
    Optional<String> getLastError();
}
