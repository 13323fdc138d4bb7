package com.quoteterm.domain.enums;

/**
 * Predicate of an alert rule. Price and percent thresholds are inclusive: a last price equal
 * to a PRICE_ABOVE threshold satisfies the rule.
 */
public enum AlertRuleKind {
    /** Last price >= threshold. */
    PRICE_ABOVE,
    /** Last price <= threshold. */
    PRICE_BELOW,
    /** Change against previous close, in percent, >= threshold. */
    CHANGE_PERCENT_ABOVE,
    /** Change against previous close, in percent, <= threshold. */
    CHANGE_PERCENT_BELOW,
    /** Cumulative session volume >= threshold. */
    VOLUME_ABOVE
}
