package com.quoteterm.store;

import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.InstrumentId;
import java.time.Instant;

/**
 * Produced once for every update the store accepts. Carries no payload: consumers read the
 * current value back from the store.
 */
public record ChangeNotification(InstrumentId instrument, UpdateCategory category, Instant appliedAt) {}
