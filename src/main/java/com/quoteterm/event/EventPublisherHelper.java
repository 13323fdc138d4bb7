package com.quoteterm.event;

import com.quoteterm.domain.enums.FeedStatus;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.domain.model.Position;
import com.quoteterm.store.ChangeNotification;
import java.time.Instant;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the terminal's
 * events. Delivery is synchronous unless a listener opts into async.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishMarketChange(Object source, ChangeNotification notification) {
        applicationEventPublisher.publishEvent(new MarketChangeEvent(source, notification));
    }

    public void publishAlertTriggered(Object source, AlertEvent alertEvent) {
        applicationEventPublisher.publishEvent(new AlertTriggeredEvent(source, alertEvent));
    }

    public void publishStreamLost(Object source, Throwable error, Instant lostAt) {
        applicationEventPublisher.publishEvent(new StreamLostEvent(source, error, lostAt));
    }

    public void publishFeedStatusChanged(
            Object source, FeedStatus previousStatus, FeedStatus currentStatus, Instant lastSuccessAt) {
        applicationEventPublisher.publishEvent(
                new FeedStatusChangedEvent(source, previousStatus, currentStatus, lastSuccessAt));
    }

    public void publishPortfolioUpdated(Object source, List<Position> positions) {
        applicationEventPublisher.publishEvent(new PortfolioUpdatedEvent(source, positions));
    }
}
