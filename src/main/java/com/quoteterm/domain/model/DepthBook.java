package com.quoteterm.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Bid/ask ladder for one instrument. Lists are copied on construction so a published book can
 * never change underneath a reader.
 */
@Value
public class DepthBook {

    List<DepthLevel> bids;
    List<DepthLevel> asks;
    Instant timestamp;

    @Builder
    public DepthBook(List<DepthLevel> bids, List<DepthLevel> asks, Instant timestamp) {
        this.bids = bids == null ? List.of() : List.copyOf(bids);
        this.asks = asks == null ? List.of() : List.copyOf(asks);
        this.timestamp = timestamp;
    }
}
