package com.quoteterm.domain.enums;

public enum TradeDirection {
    NEUTRAL,
    UP,
    DOWN
}
