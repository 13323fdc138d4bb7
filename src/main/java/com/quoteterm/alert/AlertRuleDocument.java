package com.quoteterm.alert;

import com.quoteterm.domain.model.AlertRule;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * On-disk layout of {@code alerts.json}: {@code {"version":1,"rules":[...]}}.
 */
@Value
@Builder
@Jacksonized
public class AlertRuleDocument {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int version = CURRENT_VERSION;

    @Builder.Default
    List<AlertRule> rules = List.of();
}
