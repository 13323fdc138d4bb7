package com.quoteterm.store;

import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.DepthBook;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.MarketSnapshot;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.domain.model.TradeTape;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiPredicate;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Latest known market state per instrument: the single source of truth for display and alert
 * evaluation.
 *
 * <p><b>Structure:</b> a ConcurrentHashMap keyed by instrument, each entry holding one
 * AtomicReference per update category. A quote writer and a depth writer on the same instrument
 * touch different references and never contend; two writers to the same category are serialized
 * by compare-and-set. No global lock is taken, not even by {@link #getMany}.
 *
 * <p><b>Ordering:</b> per instrument and category, accepted timestamps never decrease. An update
 * older than the value it would replace is rejected and produces no notification. Equal
 * timestamps are accepted (vendors often repeat the second-resolution timestamp).
 *
 * <p>Readers get immutable {@link MarketSnapshot} copies and can hold them as long as they like.
 */
@Component
public class MarketStateStore implements MarketStateReader {

    private static final Logger log = LoggerFactory.getLogger(MarketStateStore.class);

    private final Map<InstrumentId, InstrumentState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public MarketStateStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<ChangeNotification> updateQuote(InstrumentId instrument, Quote quote) {
        return apply(
                instrument,
                UpdateCategory.QUOTE,
                stateFor(instrument),
                state -> state.quote,
                quote,
                byTimestamp(Quote::getTimestamp));
    }

    public Optional<ChangeNotification> updateDepth(InstrumentId instrument, DepthBook depth) {
        return apply(
                instrument,
                UpdateCategory.DEPTH,
                stateFor(instrument),
                state -> state.depth,
                depth,
                byTimestamp(DepthBook::getTimestamp));
    }

    public Optional<ChangeNotification> updateTrades(InstrumentId instrument, TradeTape trades) {
        return apply(
                instrument,
                UpdateCategory.TRADES,
                stateFor(instrument),
                state -> state.trades,
                trades,
                byTimestamp(TradeTape::getTimestamp));
    }

    /**
     * Replaces the candle series. A series for a different chart period always replaces the held
     * one; within the same period the newest candle must not move backwards.
     */
    public Optional<ChangeNotification> updateCandles(InstrumentId instrument, CandleSeries candles) {
        BiPredicate<CandleSeries, CandleSeries> stale = (current, incoming) ->
                current.getPeriod() == incoming.getPeriod() && isOlder(incoming.getTimestamp(), current.getTimestamp());
        return apply(instrument, UpdateCategory.CANDLES, stateFor(instrument), state -> state.candles, candles, stale);
    }

    @Override
    public Optional<MarketSnapshot> get(InstrumentId instrument) {
        InstrumentState state = states.get(instrument);
        return state == null ? Optional.empty() : Optional.of(state.snapshot(instrument));
    }

    @Override
    public Map<InstrumentId, MarketSnapshot> getMany(Collection<InstrumentId> instruments) {
        Map<InstrumentId, MarketSnapshot> result = new LinkedHashMap<>();
        for (InstrumentId instrument : instruments) {
            InstrumentState state = states.get(instrument);
            if (state != null) {
                result.put(instrument, state.snapshot(instrument));
            }
        }
        return result;
    }

    @Override
    public Set<InstrumentId> instruments() {
        return new TreeSet<>(states.keySet());
    }

    @Override
    public int size() {
        return states.size();
    }

    /** Drops all state for an instrument, typically after it is unsubscribed. */
    public boolean remove(InstrumentId instrument) {
        boolean removed = states.remove(instrument) != null;
        if (removed) {
            log.debug("Removed market state for {}", instrument);
        }
        return removed;
    }

    public void clear() {
        states.clear();
    }

    // ---- Internal ----

    private InstrumentState stateFor(InstrumentId instrument) {
        return states.computeIfAbsent(instrument, k -> new InstrumentState());
    }

    private <T> Optional<ChangeNotification> apply(
            InstrumentId instrument,
            UpdateCategory category,
            InstrumentState state,
            Function<InstrumentState, AtomicReference<T>> field,
            T value,
            BiPredicate<T, T> stale) {
        if (value == null) {
            throw new IllegalArgumentException("Null " + category + " update for " + instrument);
        }
        AtomicReference<T> ref = field.apply(state);
        while (true) {
            T current = ref.get();
            if (current != null && stale.test(current, value)) {
                log.debug("Rejected out-of-order {} update for {}", category, instrument);
                return Optional.empty();
            }
            if (ref.compareAndSet(current, value)) {
                break;
            }
        }
        Instant appliedAt = clock.instant();
        state.lastUpdated.accumulateAndGet(
                appliedAt, (prev, next) -> prev == null || next.isAfter(prev) ? next : prev);
        return Optional.of(new ChangeNotification(instrument, category, appliedAt));
    }

    private static <T> BiPredicate<T, T> byTimestamp(Function<T, Instant> timestampOf) {
        return (current, incoming) -> isOlder(timestampOf.apply(incoming), timestampOf.apply(current));
    }

    private static boolean isOlder(Instant incoming, Instant current) {
        return incoming != null && current != null && incoming.isBefore(current);
    }

    private static final class InstrumentState {

        private final AtomicReference<Quote> quote = new AtomicReference<>();
        private final AtomicReference<DepthBook> depth = new AtomicReference<>();
        private final AtomicReference<TradeTape> trades = new AtomicReference<>();
        private final AtomicReference<CandleSeries> candles = new AtomicReference<>();
        private final AtomicReference<Instant> lastUpdated = new AtomicReference<>();

        private MarketSnapshot snapshot(InstrumentId instrument) {
            return MarketSnapshot.builder()
                    .instrument(instrument)
                    .quote(quote.get())
                    .depth(depth.get())
                    .trades(trades.get())
                    .candles(candles.get())
                    .lastUpdated(lastUpdated.get())
                    .build();
        }
    }
}
