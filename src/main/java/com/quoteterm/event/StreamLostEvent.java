package com.quoteterm.event;

import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published once when the push stream fails unrecoverably and the ingestion loop terminates.
 * The terminal keeps running on last-known state; the feed is shown as disconnected.
 */
public class StreamLostEvent extends ApplicationEvent {

    private final Throwable error;
    private final Instant lostAt;

    public StreamLostEvent(Object source, Throwable error, Instant lostAt) {
        super(source);
        this.error = error;
        this.lostAt = lostAt;
    }

    public Throwable getError() {
        return error;
    }

    public Instant getLostAt() {
        return lostAt;
    }
}
