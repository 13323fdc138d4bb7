package com.quoteterm.store;

import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.MarketSnapshot;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the market state handed to the drawing layer and other consumers that must
 * not write.
 */
public interface MarketStateReader {

    Optional<MarketSnapshot> get(InstrumentId instrument);

    /**
     * Snapshots for the requested instruments that the store knows about, in request order.
     * Unknown instruments are left out.
     */
    Map<InstrumentId, MarketSnapshot> getMany(Collection<InstrumentId> instruments);

    Set<InstrumentId> instruments();

    int size();
}
