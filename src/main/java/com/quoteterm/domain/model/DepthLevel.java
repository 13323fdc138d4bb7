package com.quoteterm.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One price level of the order book. */
@Value
@Builder
public class DepthLevel {

    /** 1-based level, 1 being the best price. */
    int position;

    BigDecimal price;
    long volume;

    /** Number of orders aggregated at this level. */
    long orderCount;
}
