package com.quoteterm.alert;

import com.quoteterm.config.StorageConfig;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.persistence.JsonFileStore;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Durable history of fired alerts in {@code alerts.log}, one JSON object per line. Append-only;
 * the terminal never truncates or rewrites it.
 */
@Component
public class AlertEventLog {

    private final JsonFileStore jsonFileStore;
    private final StorageConfig storageConfig;

    public AlertEventLog(JsonFileStore jsonFileStore, StorageConfig storageConfig) {
        this.jsonFileStore = jsonFileStore;
        this.storageConfig = storageConfig;
    }

    public void append(AlertEvent alertEvent) {
        jsonFileStore.appendLine(storageConfig.alertLogPath(), alertEvent);
    }

    /** Every logged alert, oldest first. */
    public List<AlertEvent> readAll() {
        return jsonFileStore.readLines(storageConfig.alertLogPath(), AlertEvent.class);
    }

    /** The last {@code limit} logged alerts, oldest first. */
    public List<AlertEvent> readRecent(int limit) {
        List<AlertEvent> all = readAll();
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }
}
