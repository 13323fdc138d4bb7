package com.quoteterm.domain.enums;

/**
 * The independently replaceable parts of a market snapshot. Each push event carries exactly one
 * category and replaces exactly that part.
 */
public enum UpdateCategory {
    QUOTE("quote"),
    DEPTH("depth"),
    TRADES("trades"),
    CANDLES("candles");

    private final String wireName;

    UpdateCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Resolves the category name used in push frames, or null when unknown. */
    public static UpdateCategory fromWireName(String name) {
        for (UpdateCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(name)) {
                return category;
            }
        }
        return null;
    }
}
