package com.quoteterm.alert;

import com.quoteterm.domain.model.InstrumentId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Component;

/**
 * Maps each instrument to the ids of its enabled alert rules, so a quote is matched against
 * only the rules for that instrument.
 *
 * <p>ConcurrentHashMap with CopyOnWriteArrayList values: rule changes are rare next to quote
 * lookups, and evaluation can iterate a list without locking while a rule is being added.
 * Ids are stored instead of rules; the engine resolves them to the current rule version at
 * evaluation time. Ids keep insertion order, which is the order rules are evaluated in.
 */
@Component
public class AlertRuleIndex {

    private final Map<InstrumentId, CopyOnWriteArrayList<String>> rulesByInstrument = new ConcurrentHashMap<>();

    public void add(InstrumentId instrument, String ruleId) {
        rulesByInstrument
                .computeIfAbsent(instrument, k -> new CopyOnWriteArrayList<>())
                .addIfAbsent(ruleId);
    }

    public void remove(InstrumentId instrument, String ruleId) {
        rulesByInstrument.computeIfPresent(instrument, (k, ids) -> {
            ids.remove(ruleId);
            // drop empty lists so unsubscribed instruments do not linger
            return ids.isEmpty() ? null : ids;
        });
    }

    /**
     * Rule ids for an instrument. The hot path: called once per quote update.
     *
     * @return ids in insertion order; empty, never null
     */
    public List<String> ruleIdsFor(InstrumentId instrument) {
        CopyOnWriteArrayList<String> ids = rulesByInstrument.get(instrument);
        return ids != null ? ids : List.of();
    }

    public Set<InstrumentId> instruments() {
        return rulesByInstrument.keySet();
    }

    public int size() {
        return rulesByInstrument.values().stream().mapToInt(List::size).sum();
    }

    public void clear() {
        rulesByInstrument.clear();
    }
}
