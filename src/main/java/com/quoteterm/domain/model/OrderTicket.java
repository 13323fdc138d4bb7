package com.quoteterm.domain.model;

import com.quoteterm.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Order handed through to the vendor unchanged. The terminal does no routing or validation
 * beyond rate governing.
 */
@Value
@Builder
public class OrderTicket {

    InstrumentId instrument;
    OrderSide side;
    long quantity;

    /** Limit price; null for a market order. */
    BigDecimal limitPrice;
}
