package com.quoteterm.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.quoteterm.domain.enums.AlertRuleKind;
import com.quoteterm.domain.enums.AlertRuleStatus;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * User-defined threshold rule on one instrument.
 *
 * <p>Immutable: the alert engine replaces the stored instance on every change (enable, disable,
 * trigger), which keeps the indexed copy and the persisted copy trivially consistent.
 * {@code lastTriggeredAt} is persisted so that the cooldown survives a restart.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertRule {

    String id;
    InstrumentId instrument;
    AlertRuleKind kind;
    BigDecimal threshold;

    @Builder.Default
    AlertRuleStatus status = AlertRuleStatus.ENABLED;

    /** Minimum seconds between two firings of this rule. */
    long cooldownSeconds;

    Instant lastTriggeredAt;
    Instant createdAt;
    Instant updatedAt;

    @JsonIgnore
    public boolean isEnabled() {
        return status == AlertRuleStatus.ENABLED;
    }

    /** True while {@code now} is less than one cooldown after the last firing. */
    public boolean isCoolingDown(Instant now) {
        if (lastTriggeredAt == null) {
            return false;
        }
        return Duration.between(lastTriggeredAt, now).getSeconds() < cooldownSeconds;
    }
}
