package com.quoteterm.alert;

import com.quoteterm.domain.enums.AlertRuleKind;
import com.quoteterm.domain.enums.AlertRuleStatus;
import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.domain.model.AlertRule;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.MarketSnapshot;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.event.EventPublisherHelper;
import com.quoteterm.event.MarketChangeEvent;
import com.quoteterm.exception.ResourceNotFoundException;
import com.quoteterm.exception.StorageException;
import com.quoteterm.exception.ValidationException;
import com.quoteterm.store.MarketStateReader;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Evaluates user-defined threshold rules against incoming quotes and raises alerts.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Rules live in memory keyed by id; enabled rules are also indexed by instrument in the
 *       {@link AlertRuleIndex}, so a quote costs O(rules for that instrument).</li>
 *   <li>Evaluation runs inline on every QUOTE {@link MarketChangeEvent}, on the ingestion
 *       thread.</li>
 *   <li>A rule fires on the transition of its predicate from false to true, and only outside
 *       its cooldown. A transition inside the cooldown is dropped, but the predicate state is
 *       still recorded, so a price that stays above the threshold does not fire the moment the
 *       cooldown ends.</li>
 *   <li>A firing is appended to the alert log, queued for the UI (drained once), published as
 *       an {@link com.quoteterm.event.AlertTriggeredEvent} and logged at WARN.</li>
 * </ul>
 *
 * <p><b>Persistence:</b> every rule change is written to {@code alerts.json} before the call
 * returns. If the write fails the in-memory change is undone and the {@link StorageException}
 * propagates. The last-triggered time written after a firing is best effort; {@link #flush()}
 * writes it again at shutdown.
 *
 * <p><b>Concurrency:</b> rule changes and firings serialize on one lock. Evaluation reads the
 * index and the rule map without locking and re-checks the rule inside the lock before firing.
 */
@Service
@EnableConfigurationProperties(AlertEngineConfig.class)
public class AlertEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final AlertEngineConfig alertEngineConfig;
    private final AlertRuleRepository alertRuleRepository;
    private final AlertEventLog alertEventLog;
    private final AlertRuleIndex alertRuleIndex;
    private final MarketStateReader marketStateReader;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();

    /** Predicate result of the previous evaluation per rule id; absent means false. */
    private final Map<String, Boolean> lastPredicate = new ConcurrentHashMap<>();

    private final Queue<AlertEvent> pendingAlerts = new ConcurrentLinkedQueue<>();
    private final Object lock = new Object();

    public AlertEngine(
            AlertEngineConfig alertEngineConfig,
            AlertRuleRepository alertRuleRepository,
            AlertEventLog alertEventLog,
            AlertRuleIndex alertRuleIndex,
            MarketStateReader marketStateReader,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.alertEngineConfig = alertEngineConfig;
        this.alertRuleRepository = alertRuleRepository;
        this.alertEventLog = alertEventLog;
        this.alertRuleIndex = alertRuleIndex;
        this.marketStateReader = marketStateReader;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Loads the stored rules, replacing whatever is in memory. A corrupt file has already been
     * backed up by the repository and yields an empty set.
     */
    @PostConstruct
    public void load() {
        List<AlertRule> stored = alertRuleRepository.findAll();
        synchronized (lock) {
            rules.clear();
            alertRuleIndex.clear();
            lastPredicate.clear();
            for (AlertRule rule : stored) {
                if (rule == null) {
                    log.warn("Ignoring empty entry in the stored alert rules");
                    continue;
                }
                try {
                    validateStored(rule);
                } catch (ValidationException e) {
                    log.warn("Ignoring stored alert rule {}: {}", rule.getId(), e.getMessage());
                    continue;
                }
                swap(rule.getId(), rule);
            }
        }
        log.info("Loaded {} alert rules, {} enabled", rules.size(), alertRuleIndex.size());
    }

    /** Writes the current rule set, including last-triggered times. Called at shutdown. */
    public void flush() {
        synchronized (lock) {
            alertRuleRepository.saveAll(sortedRules());
        }
        log.info("Flushed {} alert rules", rules.size());
    }

    // ---- Evaluation ----

    @EventListener
    @Order(1)
    public void onMarketChange(MarketChangeEvent event) {
        if (!alertEngineConfig.isEnabled() || event.getCategory() != UpdateCategory.QUOTE) {
            return;
        }
        InstrumentId instrument = event.getInstrument();
        if (alertRuleIndex.ruleIdsFor(instrument).isEmpty()) {
            return;
        }
        marketStateReader
                .get(instrument)
                .flatMap(MarketSnapshot::quote)
                .ifPresent(quote -> evaluate(instrument, quote));
    }

    /**
     * Evaluates every enabled rule of {@code instrument} against {@code quote}, in index order.
     * Rules fire independently of each other.
     *
     * @return the alerts fired by this evaluation
     */
    public List<AlertEvent> evaluate(InstrumentId instrument, Quote quote) {
        List<String> ruleIds = alertRuleIndex.ruleIdsFor(instrument);
        if (ruleIds.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        List<AlertEvent> fired = new ArrayList<>();
        for (String ruleId : ruleIds) {
            AlertRule rule = rules.get(ruleId);
            if (rule == null || !rule.isEnabled()) {
                continue;
            }
            Optional<BigDecimal> observed = observedValue(rule.getKind(), quote);
            boolean satisfied = observed.isPresent() && isSatisfied(rule, observed.get());
            Boolean previous = lastPredicate.put(ruleId, satisfied);
            if (!satisfied || Boolean.TRUE.equals(previous)) {
                continue;
            }
            if (rule.isCoolingDown(now)) {
                log.debug("Alert rule {} matched inside its cooldown, suppressed", ruleId);
                continue;
            }
            fire(ruleId, observed.get(), now).ifPresent(fired::add);
        }
        return fired;
    }

    /**
     * Alerts fired since the last call, oldest first. Each alert is returned exactly once.
     */
    public List<AlertEvent> drainPendingAlerts() {
        List<AlertEvent> drained = new ArrayList<>();
        AlertEvent alertEvent;
        while ((alertEvent = pendingAlerts.poll()) != null) {
            drained.add(alertEvent);
        }
        return drained;
    }

    /** The most recent logged alerts, oldest first. */
    public List<AlertEvent> recentAlerts(int limit) {
        return alertEventLog.readRecent(limit);
    }

    // ---- Rule management ----

    public AlertRule createRule(InstrumentId instrument, AlertRuleKind kind, BigDecimal threshold) {
        return createRule(instrument, kind, threshold, alertEngineConfig.getDefaultCooldown());
    }

    /**
     * Creates an enabled rule and persists it.
     *
     * @throws ValidationException if an argument is missing, the threshold is invalid for the
     *     kind, or the rule limit is reached
     * @throws StorageException    if the rule set cannot be written; the rule is not created
     */
    public AlertRule createRule(InstrumentId instrument, AlertRuleKind kind, BigDecimal threshold, Duration cooldown) {
        validate(instrument, kind, threshold, cooldown);
        Instant now = clock.instant();
        synchronized (lock) {
            if (rules.size() >= alertEngineConfig.getMaxRules()) {
                throw new ValidationException("Alert rule limit reached (" + alertEngineConfig.getMaxRules() + ")");
            }
            AlertRule rule = AlertRule.builder()
                    .id(newRuleId())
                    .instrument(instrument)
                    .kind(kind)
                    .threshold(threshold)
                    .status(AlertRuleStatus.ENABLED)
                    .cooldownSeconds(cooldown.getSeconds())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            commit(rule.getId(), rule);
            log.info("Created alert rule {}: {} {} {}", rule.getId(), instrument, kind, threshold);
            return rule;
        }
    }

    public AlertRule enableRule(String ruleId) {
        return changeStatus(ruleId, AlertRuleStatus.ENABLED);
    }

    public AlertRule disableRule(String ruleId) {
        return changeStatus(ruleId, AlertRuleStatus.DISABLED);
    }

    public void deleteRule(String ruleId) {
        synchronized (lock) {
            requireRule(ruleId);
            commit(ruleId, null);
            lastPredicate.remove(ruleId);
        }
        log.info("Deleted alert rule {}", ruleId);
    }

    /** All rules, oldest first. */
    public List<AlertRule> listRules() {
        return sortedRules();
    }

    public AlertRule getRule(String ruleId) {
        return requireRule(ruleId);
    }

    /** Enabled rules of one instrument, in evaluation order. */
    public List<AlertRule> rulesFor(InstrumentId instrument) {
        List<AlertRule> result = new ArrayList<>();
        for (String ruleId : alertRuleIndex.ruleIdsFor(instrument)) {
            AlertRule rule = rules.get(ruleId);
            if (rule != null) {
                result.add(rule);
            }
        }
        return result;
    }

    public int getEnabledRuleCount() {
        return alertRuleIndex.size();
    }

    // ---- Internal ----

    private AlertRule changeStatus(String ruleId, AlertRuleStatus status) {
        synchronized (lock) {
            AlertRule current = requireRule(ruleId);
            if (current.getStatus() == status) {
                return current;
            }
            AlertRule updated = current.toBuilder()
                    .status(status)
                    .updatedAt(clock.instant())
                    .build();
            commit(ruleId, updated);
            lastPredicate.remove(ruleId);
            log.info("Alert rule {} is now {}", ruleId, status);
            return updated;
        }
    }

    private Optional<AlertEvent> fire(String ruleId, BigDecimal observed, Instant now) {
        AlertEvent alertEvent;
        synchronized (lock) {
            AlertRule current = rules.get(ruleId);
            if (current == null || !current.isEnabled() || current.isCoolingDown(now)) {
                return Optional.empty();
            }
            swap(ruleId, current.toBuilder().lastTriggeredAt(now).updatedAt(now).build());
            alertEvent = AlertEvent.builder()
                    .ruleId(ruleId)
                    .instrument(current.getInstrument())
                    .kind(current.getKind())
                    .threshold(current.getThreshold())
                    .triggeringValue(observed)
                    .triggeredAt(now)
                    .build();
            try {
                alertRuleRepository.saveAll(sortedRules());
            } catch (StorageException e) {
                log.warn("Could not save last-triggered time of rule {}: {}", ruleId, e.getMessage());
            }
        }

        try {
            alertEventLog.append(alertEvent);
        } catch (StorageException e) {
            log.error("Could not append alert {} to the alert log", ruleId, e);
        }
        pendingAlerts.add(alertEvent);
        log.warn(
                "Alert triggered: rule={} {} {} {} (value {})",
                ruleId,
                alertEvent.getInstrument(),
                alertEvent.getKind(),
                alertEvent.getThreshold(),
                observed);
        eventPublisherHelper.publishAlertTriggered(this, alertEvent);
        return Optional.of(alertEvent);
    }

    /**
     * Applies a change in memory, persists, and undoes the change if persisting fails.
     * Caller holds {@link #lock}.
     */
    private void commit(String ruleId, AlertRule next) {
        AlertRule previous = swap(ruleId, next);
        try {
            alertRuleRepository.saveAll(sortedRules());
        } catch (StorageException e) {
            swap(ruleId, previous);
            log.error("Alert rule change for {} rolled back, rules file not writable", ruleId);
            throw e;
        }
    }

    /**
     * Replaces (or removes, when {@code next} is null) the in-memory rule and keeps the index
     * in step. Rules that stay enabled keep their index position.
     */
    private AlertRule swap(String ruleId, AlertRule next) {
        AlertRule previous = next == null ? rules.remove(ruleId) : rules.put(ruleId, next);
        boolean wasIndexed = previous != null && previous.isEnabled();
        boolean nowIndexed = next != null && next.isEnabled();
        if (wasIndexed && !nowIndexed) {
            alertRuleIndex.remove(previous.getInstrument(), ruleId);
        } else if (!wasIndexed && nowIndexed) {
            alertRuleIndex.add(next.getInstrument(), ruleId);
        }
        return previous;
    }

    private AlertRule requireRule(String ruleId) {
        AlertRule rule = ruleId == null ? null : rules.get(ruleId);
        if (rule == null) {
            throw new ResourceNotFoundException("AlertRule", ruleId);
        }
        return rule;
    }

    private List<AlertRule> sortedRules() {
        List<AlertRule> sorted = new ArrayList<>(rules.values());
        sorted.sort(Comparator.comparing(AlertRule::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(AlertRule::getId));
        return sorted;
    }

    private String newRuleId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (rules.containsKey(id));
        return id;
    }

    private static void validate(InstrumentId instrument, AlertRuleKind kind, BigDecimal threshold, Duration cooldown) {
        if (instrument == null) {
            throw new ValidationException("Alert rule needs an instrument");
        }
        if (kind == null) {
            throw new ValidationException("Alert rule needs a kind");
        }
        if (threshold == null) {
            throw new ValidationException("Alert rule needs a threshold");
        }
        if (kind == AlertRuleKind.VOLUME_ABOVE && threshold.signum() < 0) {
            throw new ValidationException("Volume threshold must not be negative: " + threshold);
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new ValidationException("Cooldown must not be negative");
        }
    }

    private static void validateStored(AlertRule rule) {
        if (rule.getId() == null || rule.getId().isBlank()) {
            throw new ValidationException("Alert rule has no id");
        }
        if (rule.getCooldownSeconds() < 0) {
            throw new ValidationException("Cooldown must not be negative");
        }
        validate(rule.getInstrument(), rule.getKind(), rule.getThreshold(), Duration.ofSeconds(rule.getCooldownSeconds()));
    }

    private static Optional<BigDecimal> observedValue(AlertRuleKind kind, Quote quote) {
        return switch (kind) {
            case PRICE_ABOVE, PRICE_BELOW -> Optional.ofNullable(quote.getLastPrice());
            case CHANGE_PERCENT_ABOVE, CHANGE_PERCENT_BELOW -> quote.changePercent();
            case VOLUME_ABOVE -> Optional.of(BigDecimal.valueOf(quote.getVolume()));
        };
    }

    private static boolean isSatisfied(AlertRule rule, BigDecimal observed) {
        int cmp = observed.compareTo(rule.getThreshold());
        return switch (rule.getKind()) {
            case PRICE_ABOVE, CHANGE_PERCENT_ABOVE, VOLUME_ABOVE -> cmp >= 0;
            case PRICE_BELOW, CHANGE_PERCENT_BELOW -> cmp <= 0;
        };
    }
}
