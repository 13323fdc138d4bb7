package com.quoteterm.ingestion;

import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.InstrumentId;

/**
 * A push frame after decoding. {@code payload} is a {@code Quote}, {@code DepthBook},
 * {@code TradeTape} or {@code CandleSeries} according to {@code category}.
 */
public record DecodedPushEvent(InstrumentId instrument, UpdateCategory category, Object payload) {

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
