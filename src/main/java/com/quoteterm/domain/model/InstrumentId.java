package com.quoteterm.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.quoteterm.exception.ValidationException;
import lombok.EqualsAndHashCode;

/**
 * Exchange-qualified instrument symbol, formatted {@code code.market} (e.g. {@code 700.HK},
 * {@code AAPL.US}).
 *
 * <p>The sole key into the market state store and the alert rule index. Equality is exact
 * string equality: {@code 700.HK} and {@code 00700.HK} are different instruments.
 */
@EqualsAndHashCode
public final class InstrumentId implements Comparable<InstrumentId> {

    private final String symbol;

    private InstrumentId(String symbol) {
        this.symbol = symbol;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static InstrumentId of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Instrument symbol must not be blank");
        }
        return new InstrumentId(symbol.trim());
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /** Symbol without the market suffix. */
    public String code() {
        int dot = symbol.lastIndexOf('.');
        return dot < 0 ? symbol : symbol.substring(0, dot);
    }

    /** Market suffix (HK, US, SH, SZ, SG), or empty when the symbol has none. */
    public String market() {
        int dot = symbol.lastIndexOf('.');
        return dot < 0 ? "" : symbol.substring(dot + 1);
    }

    @Override
    public int compareTo(InstrumentId other) {
        return symbol.compareTo(other.symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
