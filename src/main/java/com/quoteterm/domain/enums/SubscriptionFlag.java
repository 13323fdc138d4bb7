package com.quoteterm.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Push channels requested per instrument when subscribing. */
public enum SubscriptionFlag {
    QUOTE,
    DEPTH,
    TRADES;

    /** Channels for instruments only shown in the watch list. */
    public static Set<SubscriptionFlag> list() {
        return EnumSet.of(QUOTE);
    }

    /** Channels for the instrument open in the detail view. */
    public static Set<SubscriptionFlag> detail() {
        return EnumSet.allOf(SubscriptionFlag.class);
    }
}
