package com.quoteterm.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A holding reported by the account API, shown in the portfolio view. */
@Value
@Builder
public class Position {

    InstrumentId instrument;
    String name;
    long quantity;
    long availableQuantity;
    BigDecimal costPrice;
    String currency;
}
