package com.quoteterm.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
