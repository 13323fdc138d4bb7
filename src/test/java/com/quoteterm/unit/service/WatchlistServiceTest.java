package com.quoteterm.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.enums.FeedStatus;
import com.quoteterm.domain.enums.SubscriptionFlag;
import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.Candle;
import com.quoteterm.domain.model.CandleSeries;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.Position;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.event.EventPublisherHelper;
import com.quoteterm.event.StreamLostEvent;
import com.quoteterm.exception.GatewayException;
import com.quoteterm.exception.PushStreamException;
import com.quoteterm.gateway.MarketDataGateway;
import com.quoteterm.gateway.RateLimitedMarketDataClient;
import com.quoteterm.ratelimit.RateGovernor;
import com.quoteterm.ratelimit.RateGovernorConfig;
import com.quoteterm.service.WatchlistConfig;
import com.quoteterm.service.WatchlistService;
import com.quoteterm.store.ChangeNotification;
import com.quoteterm.store.MarketStateStore;
import com.quoteterm.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for WatchlistService: subscriptions, snapshot refresh into the store and the
 * LIVE / STALE / DISCONNECTED feed status.
 */
@ExtendWith(MockitoExtension.class)
class WatchlistServiceTest {

    private static final InstrumentId TENCENT = InstrumentId.of("700.HK");
    private static final InstrumentId APPLE = InstrumentId.of("AAPL.US");
    private static final Instant NOW = Instant.parse("2026-03-02T02:00:00Z");

    @Mock
    private MarketDataGateway marketDataGateway;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MarketStateStore marketStateStore;
    private WatchlistService watchlistService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        RateGovernorConfig rateGovernorConfig = new RateGovernorConfig();
        rateGovernorConfig.setTokensPerSecond(1000);
        rateGovernorConfig.setInitialBackoff(Duration.ofMillis(1));
        RateLimitedMarketDataClient client =
                new RateLimitedMarketDataClient(marketDataGateway, new RateGovernor(rateGovernorConfig));
        WatchlistConfig watchlistConfig = new WatchlistConfig();
        watchlistConfig.setInstruments(List.of("700.HK", "AAPL.US"));
        marketStateStore = new MarketStateStore(clock);
        watchlistService = new WatchlistService(client, marketStateStore, eventPublisherHelper, watchlistConfig, clock);
    }

    private static Quote quote(String price) {
        return Quote.builder()
                .lastPrice(new BigDecimal(price))
                .prevClose(new BigDecimal("315"))
                .timestamp(NOW)
                .build();
    }

    @Nested
    @DisplayName("Start")
    class Start {

        @Test
        @DisplayName("subscribes quotes for the configured list and loads the first snapshot")
        void subscribesAndSnapshots() {
            when(marketDataGateway.quoteSnapshot(anyCollection()))
                    .thenReturn(Map.of(TENCENT, quote("320"), APPLE, quote("227")));

            watchlistService.start();

            verify(marketDataGateway).subscribe(Set.of(TENCENT, APPLE), SubscriptionFlag.list());
            assertThat(watchlistService.getWatched()).containsExactly(TENCENT, APPLE);
            assertThat(marketStateStore.get(TENCENT)).isPresent();
            verify(eventPublisherHelper, times(2)).publishMarketChange(eq(watchlistService), any(ChangeNotification.class));
            assertThat(watchlistService.getLastSuccessAt()).contains(NOW);
        }

        @Test
        @DisplayName("scheduled refreshes do nothing before start")
        void idleBeforeStart() {
            watchlistService.refreshSnapshots();
            watchlistService.refreshPortfolio();

            verify(marketDataGateway, never()).quoteSnapshot(anyCollection());
            verify(marketDataGateway, never()).positions();
        }
    }

    @Nested
    @DisplayName("Feed status")
    class Status {

        @Test
        @DisplayName("a failed refresh keeps the old data and marks the feed stale until the next success")
        void staleThenLive() {
            when(marketDataGateway.quoteSnapshot(anyCollection()))
                    .thenReturn(Map.of(TENCENT, quote("320")))
                    .thenThrow(new GatewayException(503, "Service unavailable"))
                    .thenReturn(Map.of(TENCENT, quote("321")));
            watchlistService.start();

            watchlistService.refreshSnapshots();
            assertThat(watchlistService.getFeedStatus()).isEqualTo(FeedStatus.STALE);
            assertThat(watchlistService.getLastError()).contains("Service unavailable");
            assertThat(marketStateStore.get(TENCENT).orElseThrow().getQuote().getLastPrice())
                    .isEqualByComparingTo("320");

            watchlistService.refreshSnapshots();
            assertThat(watchlistService.getFeedStatus()).isEqualTo(FeedStatus.LIVE);
            verify(eventPublisherHelper).publishFeedStatusChanged(watchlistService, FeedStatus.LIVE, FeedStatus.STALE, NOW);
            verify(eventPublisherHelper).publishFeedStatusChanged(watchlistService, FeedStatus.STALE, FeedStatus.LIVE, NOW);
        }

        @Test
        @DisplayName("stream loss marks the feed disconnected")
        void streamLost() {
            watchlistService.onStreamLost(new StreamLostEvent(this, new PushStreamException("reset by peer"), NOW));

            assertThat(watchlistService.getFeedStatus()).isEqualTo(FeedStatus.DISCONNECTED);
            assertThat(watchlistService.getLastError()).contains("reset by peer");
        }

        @Test
        @DisplayName("portfolio refresh publishes the positions")
        void portfolio() {
            when(marketDataGateway.quoteSnapshot(anyCollection())).thenReturn(Map.of());
            List<Position> positions = List.of(Position.builder().instrument(TENCENT).quantity(100).build());
            when(marketDataGateway.positions()).thenReturn(positions);
            watchlistService.start();

            watchlistService.refreshPortfolio();

            assertThat(watchlistService.getPositions()).isEqualTo(positions);
            verify(eventPublisherHelper).publishPortfolioUpdated(watchlistService, positions);
        }
    }

    @Nested
    @DisplayName("Detail")
    class Detail {

        @Test
        @DisplayName("moving the detail view moves the depth and trade subscriptions")
        void movesDetailSubscriptions() {
            CandleSeries candles = new CandleSeries(
                    ChartPeriod.DAY,
                    List.of(Candle.builder()
                            .timestamp(NOW)
                            .open(BigDecimal.ONE)
                            .high(BigDecimal.ONE)
                            .low(BigDecimal.ONE)
                            .close(BigDecimal.ONE)
                            .build()));
            when(marketDataGateway.candles(any(), eq(ChartPeriod.DAY), anyInt())).thenReturn(candles);

            watchlistService.openDetail(TENCENT, ChartPeriod.DAY);
            watchlistService.openDetail(APPLE, ChartPeriod.DAY);
            watchlistService.closeDetail();

            verify(marketDataGateway).subscribe(Set.of(TENCENT), SubscriptionFlag.detail());
            verify(marketDataGateway).unsubscribe(Set.of(TENCENT), Set.of(SubscriptionFlag.DEPTH, SubscriptionFlag.TRADES));
            verify(marketDataGateway).unsubscribe(Set.of(APPLE), Set.of(SubscriptionFlag.DEPTH, SubscriptionFlag.TRADES));
            assertThat(watchlistService.getDetailInstrument()).isEmpty();
            assertThat(marketStateStore.get(APPLE).orElseThrow().getCandles()).isEqualTo(candles);
        }

        @Test
        @DisplayName("a candle load is announced as a CANDLES change so the chart repaints")
        void candleLoadPublishesChange() {
            CandleSeries candles = new CandleSeries(
                    ChartPeriod.WEEK,
                    List.of(Candle.builder()
                            .timestamp(NOW)
                            .open(BigDecimal.TEN)
                            .high(BigDecimal.TEN)
                            .low(BigDecimal.TEN)
                            .close(BigDecimal.TEN)
                            .build()));
            when(marketDataGateway.candles(TENCENT, ChartPeriod.WEEK, 120)).thenReturn(candles);

            watchlistService.refreshCandles(TENCENT, ChartPeriod.WEEK);

            ArgumentCaptor<ChangeNotification> notification = ArgumentCaptor.forClass(ChangeNotification.class);
            verify(eventPublisherHelper).publishMarketChange(eq(watchlistService), notification.capture());
            assertThat(notification.getValue().instrument()).isEqualTo(TENCENT);
            assertThat(notification.getValue().category()).isEqualTo(UpdateCategory.CANDLES);
        }

        @Test
        @DisplayName("removing an instrument unsubscribes it and drops its state")
        void removeInstrument() {
            when(marketDataGateway.quoteSnapshot(anyCollection())).thenReturn(Map.of(TENCENT, quote("320")));
            watchlistService.start();

            watchlistService.removeInstrument(TENCENT);

            verify(marketDataGateway).unsubscribe(eq(Set.of(TENCENT)), any());
            assertThat(marketStateStore.get(TENCENT)).isEmpty();
            assertThat(watchlistService.getWatched()).containsExactly(APPLE);
        }
    }
}
