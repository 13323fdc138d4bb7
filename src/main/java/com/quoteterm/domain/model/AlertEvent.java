package com.quoteterm.domain.model;

import com.quoteterm.domain.enums.AlertRuleKind;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Record of one rule firing. Written once to the alert log and surfaced once to the UI.
 */
@Value
@Builder
@Jacksonized
public class AlertEvent {

    String ruleId;
    InstrumentId instrument;
    AlertRuleKind kind;
    BigDecimal threshold;

    /** Price, percent change or volume that satisfied the rule. */
    BigDecimal triggeringValue;

    Instant triggeredAt;
}
