package com.quoteterm.alert;

import com.quoteterm.config.StorageConfig;
import com.quoteterm.domain.model.AlertRule;
import com.quoteterm.persistence.JsonFileStore;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Reads and writes the rule set as one JSON document. Every save rewrites the whole file
 * atomically.
 */
@Repository
public class AlertRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleRepository.class);

    private final JsonFileStore jsonFileStore;
    private final StorageConfig storageConfig;

    public AlertRuleRepository(JsonFileStore jsonFileStore, StorageConfig storageConfig) {
        this.jsonFileStore = jsonFileStore;
        this.storageConfig = storageConfig;
    }

    /** All stored rules; empty when the file is missing or had to be backed up as corrupt. */
    public List<AlertRule> findAll() {
        Path path = storageConfig.alertsPath();
        return jsonFileStore
                .read(path, AlertRuleDocument.class)
                .map(document -> {
                    if (document.getVersion() != AlertRuleDocument.CURRENT_VERSION) {
                        log.warn("Alert rule file {} has version {}, reading anyway", path, document.getVersion());
                    }
                    return document.getRules() == null ? List.<AlertRule>of() : document.getRules();
                })
                .orElse(List.of());
    }

    public void saveAll(Collection<AlertRule> rules) {
        jsonFileStore.write(
                storageConfig.alertsPath(),
                AlertRuleDocument.builder().rules(List.copyOf(rules)).build());
    }
}
