package com.quoteterm.domain.model;

import com.quoteterm.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** A single executed trade from the trade tape. */
@Value
@Builder
public class TradePrint {

    BigDecimal price;
    long volume;
    Instant timestamp;
    String tradeType;
    TradeDirection direction;
}
