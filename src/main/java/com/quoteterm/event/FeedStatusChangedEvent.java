package com.quoteterm.event;

import com.quoteterm.domain.enums.FeedStatus;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the feed moves between LIVE, STALE and DISCONNECTED.
 */
public class FeedStatusChangedEvent extends ApplicationEvent {

    private final FeedStatus previousStatus;
    private final FeedStatus currentStatus;
    private final Instant lastSuccessAt;

    public FeedStatusChangedEvent(
            Object source, FeedStatus previousStatus, FeedStatus currentStatus, Instant lastSuccessAt) {
        super(source);
        this.previousStatus = previousStatus;
        this.currentStatus = currentStatus;
        this.lastSuccessAt = lastSuccessAt;
    }

    public FeedStatus getPreviousStatus() {
        return previousStatus;
    }

    public FeedStatus getCurrentStatus() {
        return currentStatus;
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }
}
