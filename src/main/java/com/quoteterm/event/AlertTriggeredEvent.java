package com.quoteterm.event;

import com.quoteterm.domain.model.AlertEvent;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an alert rule fires. The alert has already been logged and queued for the UI
 * by the time listeners see it; this event only marks the ALERTS region dirty and feeds metrics.
 */
public class AlertTriggeredEvent extends ApplicationEvent {

    private final AlertEvent alertEvent;

    public AlertTriggeredEvent(Object source, AlertEvent alertEvent) {
        super(source);
        this.alertEvent = alertEvent;
    }

    public AlertEvent getAlertEvent() {
        return alertEvent;
    }
}
