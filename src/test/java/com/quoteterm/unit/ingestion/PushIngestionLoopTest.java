package com.quoteterm.unit.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.Quote;
import com.quoteterm.event.EventPublisherHelper;
import com.quoteterm.exception.PushStreamException;
import com.quoteterm.ingestion.IngestionConfig;
import com.quoteterm.ingestion.PushEventDecoder;
import com.quoteterm.ingestion.PushIngestionLoop;
import com.quoteterm.simulator.SimulatedPushStream;
import com.quoteterm.store.ChangeNotification;
import com.quoteterm.store.MarketStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for PushIngestionLoop: frame processing, stale rejection, bad frames and stream loss.
 */
@ExtendWith(MockitoExtension.class)
class PushIngestionLoopTest {

    private static final InstrumentId TENCENT = InstrumentId.of("700.HK");
    private static final Instant NOW = Instant.parse("2026-03-02T02:00:05Z");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MarketStateStore marketStateStore;
    private PushIngestionLoop pushIngestionLoop;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        IngestionConfig ingestionConfig = new IngestionConfig();
        ingestionConfig.setPollTimeout(Duration.ofMillis(10));
        marketStateStore = new MarketStateStore(clock);
        pushIngestionLoop = new PushIngestionLoop(
                new PushEventDecoder(new ObjectMapper()), marketStateStore, eventPublisherHelper, ingestionConfig, clock);
    }

    @AfterEach
    void tearDown() {
        pushIngestionLoop.stop();
    }

    private static String quoteFrame(String price, String timestamp) {
        return "{\"symbol\":\"700.HK\",\"category\":\"quote\",\"data\":{\"lastPrice\":\"" + price
                + "\",\"timestamp\":\"" + timestamp + "\"}}";
    }

    @Nested
    @DisplayName("Frame processing")
    class FrameProcessing {

        @Test
        @DisplayName("applies a quote and publishes one market change")
        void appliesAndPublishes() {
            boolean applied = pushIngestionLoop.processFrame(quoteFrame("320.00", "2026-03-02T02:00:00Z"));

            assertThat(applied).isTrue();
            assertThat(marketStateStore.get(TENCENT)).isPresent();
            verify(eventPublisherHelper).publishMarketChange(eq(pushIngestionLoop), any(ChangeNotification.class));
            assertThat(pushIngestionLoop.getUpdatesApplied()).isEqualTo(1);
        }

        @Test
        @DisplayName("out-of-order quote is counted as stale and not published")
        void staleNotPublished() {
            pushIngestionLoop.processFrame(quoteFrame("320.00", "2026-03-02T02:00:10Z"));
            boolean applied = pushIngestionLoop.processFrame(quoteFrame("318.00", "2026-03-02T02:00:00Z"));

            assertThat(applied).isFalse();
            assertThat(pushIngestionLoop.getStaleRejected()).isEqualTo(1);
            verify(eventPublisherHelper, times(1)).publishMarketChange(any(), any());
        }

        @Test
        @DisplayName("undecodable frame is skipped and counted")
        void badFrameSkipped() {
            assertThat(pushIngestionLoop.processFrame("{garbage")).isFalse();

            assertThat(pushIngestionLoop.getDecodeFailures()).isEqualTo(1);
            assertThat(pushIngestionLoop.getFramesReceived()).isEqualTo(1);
            verify(eventPublisherHelper, never()).publishMarketChange(any(), any());
        }

        @Test
        @DisplayName("carries the previous close over from the stored quote")
        void carriesPrevClose() {
            marketStateStore.updateQuote(
                    TENCENT,
                    Quote.builder()
                            .lastPrice(new java.math.BigDecimal("316"))
                            .prevClose(new java.math.BigDecimal("315.00"))
                            .timestamp(Instant.parse("2026-03-02T01:59:00Z"))
                            .build());

            pushIngestionLoop.processFrame(quoteFrame("321.50", "2026-03-02T02:00:00Z"));

            Quote quote = marketStateStore.get(TENCENT).orElseThrow().getQuote();
            assertThat(quote.getPrevClose()).isEqualByComparingTo("315.00");
            assertThat(quote.changePercent()).isPresent();
        }

        @Test
        @DisplayName("a failing listener does not stop processing")
        void listenerFailureContained() {
            doThrow(new IllegalStateException("listener bug"))
                    .when(eventPublisherHelper)
                    .publishMarketChange(any(), any());

            assertThat(pushIngestionLoop.processFrame(quoteFrame("320.00", "2026-03-02T02:00:00Z")))
                    .isTrue();
            assertThat(pushIngestionLoop.processFrame(quoteFrame("320.10", "2026-03-02T02:00:01Z")))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("Stream lifecycle")
    class StreamLifecycle {

        @Test
        @DisplayName("consumes queued frames in order, skipping bad ones")
        void consumesInOrder() {
            SimulatedPushStream stream = new SimulatedPushStream();
            stream.offer(quoteFrame("320.00", "2026-03-02T02:00:00Z"));
            stream.offer("not a frame");
            stream.offer(quoteFrame("321.00", "2026-03-02T02:00:01Z"));

            pushIngestionLoop.start(stream);

            verify(eventPublisherHelper, timeout(2000).times(2)).publishMarketChange(any(), any());
            assertThat(pushIngestionLoop.getDecodeFailures()).isEqualTo(1);
            assertThat(marketStateStore.get(TENCENT).orElseThrow().getQuote().getLastPrice())
                    .isEqualByComparingTo("321.00");
        }

        @Test
        @DisplayName("stream loss publishes StreamLost and completes the future exceptionally")
        void streamLoss() throws Exception {
            SimulatedPushStream stream = new SimulatedPushStream();
            stream.offer(quoteFrame("320.00", "2026-03-02T02:00:00Z"));
            PushStreamException failure = new PushStreamException("connection reset");
            stream.fail(failure);

            CompletableFuture<Void> termination = pushIngestionLoop.start(stream);

            assertThatThrownBy(() -> termination.get(2, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCause(failure);
            verify(eventPublisherHelper).publishStreamLost(pushIngestionLoop, failure, NOW);
            assertThat(pushIngestionLoop.getTerminalError()).contains(failure);
            assertThat(pushIngestionLoop.isRunning()).isFalse();
        }

        @Test
        @DisplayName("stop ends the loop normally")
        void stopEndsNormally() throws Exception {
            CompletableFuture<Void> termination = pushIngestionLoop.start(new SimulatedPushStream());

            pushIngestionLoop.stop();

            termination.get(2, TimeUnit.SECONDS);
            assertThat(pushIngestionLoop.getTerminalError()).isEmpty();
        }
    }
}
