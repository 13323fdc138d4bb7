package com.quoteterm.event;

import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.store.ChangeNotification;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the push ingestion loop after the store accepts an update. This is the
 * highest-frequency event in the terminal, one per accepted push frame.
 *
 * <p>Listeners run synchronously on the {@code push-ingest} thread and must be fast:
 * <ol>
 *   <li>AlertEngine: inline rule evaluation for QUOTE changes, @Order(1)</li>
 *   <li>RenderScheduler: enqueues a DATA_UPDATE input, @Order(2)</li>
 *   <li>TerminalMetrics: frame counter, @Order(10)</li>
 * </ol>
 *
 * <p>{@code receivedAt} is the nanoTime at publication, for end-to-end latency measurement.
 */
public class MarketChangeEvent extends ApplicationEvent {

    private final ChangeNotification notification;
    private final long receivedAt;

    public MarketChangeEvent(Object source, ChangeNotification notification) {
        super(source);
        this.notification = notification;
        this.receivedAt = System.nanoTime();
    }

    public ChangeNotification getNotification() {
        return notification;
    }

    public InstrumentId getInstrument() {
        return notification.instrument();
    }

    public UpdateCategory getCategory() {
        return notification.category();
    }

    public long getReceivedAt() {
        return receivedAt;
    }
}
