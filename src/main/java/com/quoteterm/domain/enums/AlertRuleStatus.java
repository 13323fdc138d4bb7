package com.quoteterm.domain.enums;

/**
 * ENABLED rules are indexed by the alert engine and evaluated on every quote; DISABLED rules are
 * kept in storage but never evaluated.
 */
public enum AlertRuleStatus {
    ENABLED,
    DISABLED
}
