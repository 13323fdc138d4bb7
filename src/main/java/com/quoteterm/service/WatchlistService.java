package com.quoteterm.service;

import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.enums.FeedStatus;
import com.quoteterm.domain.enums.SubscriptionFlag;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.Position;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.event.EventPublisherHelper;
import com.quoteterm.event.StreamLostEvent;
import com.quoteterm.exception.BaseException;
import com.quoteterm.gateway.RateLimitedMarketDataClient;
import com.quoteterm.store.MarketStateStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns the user's instrument set and keeps the store primed with request/response data that
 * the push stream does not deliver (previous close, candles, positions).
 *
 * <p><b>Subscriptions:</b> watch list instruments get QUOTE pushes; the instrument open in the
 * detail view additionally gets DEPTH and TRADES, released again when the detail closes or
 * moves to another instrument.
 *
 * <p><b>Freshness:</b> a refresh failure (including an exhausted rate limit) is absorbed here:
 * the last good data stays in the store and the feed is marked STALE with the time of the last
 * success. The next successful refresh makes it LIVE again. Loss of the push stream marks it
 * DISCONNECTED, which only a new session clears.
 */
@Service
@EnableConfigurationProperties(WatchlistConfig.class)
public class WatchlistService implements FeedStatusView {

    private static final Logger log = LoggerFactory.getLogger(WatchlistService.class);

    private static final Set<SubscriptionFlag> DETAIL_ONLY = EnumSet.of(SubscriptionFlag.DEPTH, SubscriptionFlag.TRADES);

    private final RateLimitedMarketDataClient marketDataClient;
    private final MarketStateStore marketStateStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final WatchlistConfig watchlistConfig;
    private final Clock clock;

    private final Set<InstrumentId> watched = new LinkedHashSet<>();
    private final List<Position> positions = new CopyOnWriteArrayList<>();

    private volatile boolean started;
    private volatile InstrumentId detailInstrument;
    private volatile FeedStatus feedStatus = FeedStatus.LIVE;
    private volatile Instant lastSuccessAt;
    private volatile String lastError;

    public WatchlistService(
            RateLimitedMarketDataClient marketDataClient,
            MarketStateStore marketStateStore,
            EventPublisherHelper eventPublisherHelper,
            WatchlistConfig watchlistConfig,
            Clock clock) {
        this.marketDataClient = marketDataClient;
        this.marketStateStore = marketStateStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.watchlistConfig = watchlistConfig;
        this.clock = clock;
    }

    /**
     * Subscribes the configured watch list and takes the first snapshot. Requires a connected
     * gateway.
     */
    public void start() {
        Set<InstrumentId> initial = new LinkedHashSet<>();
        for (String symbol : watchlistConfig.getInstruments()) {
            initial.add(InstrumentId.of(symbol));
        }
        synchronized (watched) {
            watched.addAll(initial);
        }
        marketDataClient.subscribe(initial, SubscriptionFlag.list());
        started = true;
        log.info("Watching {} instruments", initial.size());
        refreshSnapshots();
    }

    public void stop() {
        started = false;
    }

    // ---- Instrument set ----

    public List<InstrumentId> getWatched() {
        synchronized (watched) {
            return new ArrayList<>(watched);
        }
    }

    public void addInstrument(InstrumentId instrument) {
        synchronized (watched) {
            if (!watched.add(instrument)) {
                return;
            }
        }
        marketDataClient.subscribe(Set.of(instrument), SubscriptionFlag.list());
        refresh(List.of(instrument));
        log.info("Added {} to the watch list", instrument);
    }

    public void removeInstrument(InstrumentId instrument) {
        synchronized (watched) {
            if (!watched.remove(instrument)) {
                return;
            }
        }
        marketDataClient.unsubscribe(Set.of(instrument), EnumSet.allOf(SubscriptionFlag.class));
        if (instrument.equals(detailInstrument)) {
            detailInstrument = null;
        }
        marketStateStore.remove(instrument);
        log.info("Removed {} from the watch list", instrument);
    }

    /**
     * Moves the detail subscriptions (depth, trades) to {@code instrument} and loads its chart.
     */
    public void openDetail(InstrumentId instrument, ChartPeriod period) {
        InstrumentId previous = detailInstrument;
        if (previous != null && !previous.equals(instrument)) {
            marketDataClient.unsubscribe(Set.of(previous), DETAIL_ONLY);
        }
        detailInstrument = instrument;
        marketDataClient.subscribe(Set.of(instrument), SubscriptionFlag.detail());
        refreshCandles(instrument, period);
    }

    public void closeDetail() {
        InstrumentId previous = detailInstrument;
        detailInstrument = null;
        if (previous != null) {
            marketDataClient.unsubscribe(Set.of(previous), DETAIL_ONLY);
        }
    }

    public Optional<InstrumentId> getDetailInstrument() {
        return Optional.ofNullable(detailInstrument);
    }

    // ---- Refresh ----

    @Scheduled(fixedDelayString = "${quoteterm.watchlist.refresh-interval-ms:5000}")
    public void refreshSnapshots() {
        if (!started) {
            return;
        }
        refresh(getWatched());
    }

    @Scheduled(fixedDelayString = "${quoteterm.watchlist.portfolio-refresh-interval-ms:30000}")
    public void refreshPortfolio() {
        if (!started) {
            return;
        }
        try {
            List<Position> latest = marketDataClient.positions();
            positions.clear();
            positions.addAll(latest);
            eventPublisherHelper.publishPortfolioUpdated(this, latest);
            markSuccess();
        } catch (BaseException e) {
            markStale("Portfolio refresh failed", e);
        }
    }

    /** Fetches candles for the chart; on failure the previous candles stay displayed. */
    public void refreshCandles(InstrumentId instrument, ChartPeriod period) {
        try {
            CandleSeries candles = marketDataClient.candles(instrument, period, watchlistConfig.getChartCandles());
            marketStateStore
                    .updateCandles(instrument, candles)
                    .ifPresent(notification -> eventPublisherHelper.publishMarketChange(this, notification));
            markSuccess();
        } catch (BaseException e) {
            markStale("Candle refresh for " + instrument + " failed", e);
        }
    }

    public List<Position> getPositions() {
        return List.copyOf(positions);
    }

    @EventListener
    public void onStreamLost(StreamLostEvent event) {
        String message = event.getError() != null ? event.getError().getMessage() : "push stream lost";
        transition(FeedStatus.DISCONNECTED, message);
    }

    // ---- FeedStatusView ----

    @Override
    public FeedStatus getFeedStatus() {
        return feedStatus;
    }

    @Override
    public Optional<Instant> getLastSuccessAt() {
        return Optional.ofNullable(lastSuccessAt);
    }

    @Override
    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    // ---- Internal ----

    private void refresh(List<InstrumentId> instruments) {
        if (instruments.isEmpty()) {
            return;
        }
        try {
            Map<InstrumentId, Quote> quotes = marketDataClient.quoteSnapshot(instruments);
            for (Map.Entry<InstrumentId, Quote> entry : quotes.entrySet()) {
                marketStateStore
                        .updateQuote(entry.getKey(), entry.getValue())
                        .ifPresent(notification -> eventPublisherHelper.publishMarketChange(this, notification));
            }
            markSuccess();
        } catch (BaseException e) {
            markStale("Snapshot refresh failed", e);
        }
    }

    private void markSuccess() {
        lastSuccessAt = clock.instant();
        if (feedStatus == FeedStatus.STALE) {
            transition(FeedStatus.LIVE, null);
        }
    }

    private void markStale(String what, BaseException e) {
        log.warn("{} ({}), keeping last good data: {}", what, e.getErrorCode(), e.getMessage());
        if (feedStatus == FeedStatus.LIVE) {
            transition(FeedStatus.STALE, e.getMessage());
        } else {
            lastError = e.getMessage();
        }
    }

    private synchronized void transition(FeedStatus next, String error) {
        FeedStatus previous = feedStatus;
        lastError = error;
        if (previous == next) {
            return;
        }
        feedStatus = next;
        log.info("Feed status {} -> {}", previous, next);
        eventPublisherHelper.publishFeedStatusChanged(this, previous, next, lastSuccessAt);
    }
}
