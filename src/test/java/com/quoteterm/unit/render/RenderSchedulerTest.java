package com.quoteterm.unit.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.quoteterm.alert.AlertEngine;
import com.quoteterm.domain.enums.AlertRuleKind;
import com.quoteterm.domain.enums.DirtyRegion;
import com.quoteterm.domain.enums.RenderPhase;
import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.event.MarketChangeEvent;
import com.quoteterm.event.StreamLostEvent;
import com.quoteterm.exception.PushStreamException;
import com.quoteterm.render.RenderConfig;
import com.quoteterm.render.RenderFrame;
import com.quoteterm.render.RenderScheduler;
import com.quoteterm.render.RenderSink;
import com.quoteterm.service.FeedStatusView;
import com.quoteterm.store.ChangeNotification;
import com.quoteterm.store.MarketStateReader;
import com.quoteterm.workspace.NavigationState;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for RenderScheduler, driven synchronously through processPendingInputs and tick with a
 * fake nano clock.
 */
@ExtendWith(MockitoExtension.class)
class RenderSchedulerTest {

    private static final InstrumentId TENCENT = InstrumentId.of("700.HK");
    private static final Instant NOW = Instant.parse("2026-03-02T02:00:00Z");

    @Mock
    private MarketStateReader marketStateReader;

    @Mock
    private FeedStatusView feedStatusView;

    @Mock
    private AlertEngine alertEngine;

    private RenderConfig renderConfig;
    private AtomicLong nanoClock;
    private List<RenderFrame> frames;
    private RenderScheduler renderScheduler;

    @BeforeEach
    void setUp() {
        renderConfig = new RenderConfig();
        renderConfig.setMinRenderInterval(Duration.ofMillis(16));
        nanoClock = new AtomicLong(1_000_000_000L);
        frames = new ArrayList<>();
        lenient().when(alertEngine.drainPendingAlerts()).thenReturn(List.of());
        renderScheduler = scheduler(frames::add);
    }

    private RenderScheduler scheduler(RenderSink sink) {
        return new RenderScheduler(
                sink,
                marketStateReader,
                feedStatusView,
                new NavigationState(),
                alertEngine,
                renderConfig,
                Clock.fixed(NOW, ZoneOffset.UTC),
                nanoClock::get);
    }

    private MarketChangeEvent quoteChange() {
        return new MarketChangeEvent(this, new ChangeNotification(TENCENT, UpdateCategory.QUOTE, NOW));
    }

    private void advanceMillis(long millis) {
        nanoClock.addAndGet(Duration.ofMillis(millis).toNanos());
    }

    @Nested
    @DisplayName("Coalescing")
    class Coalescing {

        @Test
        @DisplayName("a burst of changes inside one interval costs a single render")
        void burstCoalesces() {
            for (int i = 0; i < 50; i++) {
                renderScheduler.onMarketChange(quoteChange());
            }
            renderScheduler.processPendingInputs();

            assertThat(renderScheduler.tick()).isTrue();
            assertThat(renderScheduler.tick()).isFalse();

            assertThat(frames).hasSize(1);
            assertThat(frames.get(0).getRegions()).isEqualTo(DirtyRegion.forUpdate(UpdateCategory.QUOTE));
        }

        @Test
        @DisplayName("no changes means no renders, only skipped ticks")
        void noChangesNoRender() {
            for (int i = 0; i < 10; i++) {
                advanceMillis(16);
                renderScheduler.tick();
            }

            assertThat(frames).isEmpty();
            assertThat(renderScheduler.getSkipCount()).isEqualTo(10);
            assertThat(renderScheduler.getEfficiencyPercent()).isEqualTo(100.0);
            assertThat(renderScheduler.getPhase()).isEqualTo(RenderPhase.IDLE);
        }

        @Test
        @DisplayName("changes of different categories are unioned into one frame")
        void regionsUnioned() {
            renderScheduler.onMarketChange(quoteChange());
            renderScheduler.onMarketChange(
                    new MarketChangeEvent(this, new ChangeNotification(TENCENT, UpdateCategory.DEPTH, NOW)));
            renderScheduler.processPendingInputs();

            renderScheduler.tick();

            assertThat(frames.get(0).getRegions())
                    .contains(DirtyRegion.WATCHLIST, DirtyRegion.DEPTH, DirtyRegion.STOCK_DETAIL);
        }
    }

    @Nested
    @DisplayName("Throttle")
    class Throttle {

        @Test
        @DisplayName("holds a second render until the minimum interval has passed")
        void minIntervalRespected() {
            renderScheduler.submitUserInput("key");
            renderScheduler.processPendingInputs();
            assertThat(renderScheduler.tick()).isTrue();

            renderScheduler.onMarketChange(quoteChange());
            renderScheduler.processPendingInputs();
            advanceMillis(5);
            assertThat(renderScheduler.tick()).isFalse();
            assertThat(renderScheduler.getPhase()).isEqualTo(RenderPhase.DIRTY);

            advanceMillis(11);
            assertThat(renderScheduler.tick()).isTrue();
            assertThat(frames).hasSize(2);
        }

        @Test
        @DisplayName("user input marks every region")
        void userInputMarksAll() {
            renderScheduler.submitUserInput("key");
            renderScheduler.processPendingInputs();

            assertThat(renderScheduler.getDirtyRegions()).isEqualTo(DirtyRegion.all());
        }

        @Test
        @DisplayName("stream loss marks the status bar")
        void streamLostMarksStatusBar() {
            renderScheduler.onStreamLost(new StreamLostEvent(this, new PushStreamException("reset"), NOW));
            renderScheduler.processPendingInputs();

            assertThat(renderScheduler.getDirtyRegions()).containsExactly(DirtyRegion.STATUS_BAR);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failed render keeps its regions dirty for the next tick")
        void failedRenderReunions() {
            RenderSink failing = org.mockito.Mockito.mock(RenderSink.class);
            doThrow(new IllegalStateException("terminal gone")).when(failing).render(any());
            RenderScheduler scheduler = scheduler(failing);
            scheduler.onMarketChange(quoteChange());
            scheduler.processPendingInputs();

            assertThat(scheduler.tick()).isFalse();

            assertThat(scheduler.getFailedRenders()).isEqualTo(1);
            assertThat(scheduler.getRenderCount()).isZero();
            assertThat(scheduler.getDirtyRegions()).containsAll(DirtyRegion.forUpdate(UpdateCategory.QUOTE));
            assertThat(scheduler.getPhase()).isEqualTo(RenderPhase.DIRTY);
        }

        @Test
        @DisplayName("empty region sets are ignored")
        void emptyRegionsIgnored() {
            renderScheduler.submitDataUpdate("noop", EnumSet.noneOf(DirtyRegion.class));
            renderScheduler.processPendingInputs();

            assertThat(renderScheduler.tick()).isFalse();
            verify(alertEngine, never()).drainPendingAlerts();
        }
    }

    @Nested
    @DisplayName("Alerts")
    class Alerts {

        @Test
        @DisplayName("pending alerts are handed to exactly one frame")
        void alertsInFrame() {
            AlertEvent alert = AlertEvent.builder()
                    .ruleId("r1")
                    .instrument(TENCENT)
                    .kind(AlertRuleKind.PRICE_ABOVE)
                    .threshold(new BigDecimal("320"))
                    .triggeringValue(new BigDecimal("321.50"))
                    .triggeredAt(NOW)
                    .build();
            when(alertEngine.drainPendingAlerts()).thenReturn(List.of(alert), List.of());
            renderScheduler.onAlertTriggered(new com.quoteterm.event.AlertTriggeredEvent(this, alert));
            renderScheduler.processPendingInputs();

            renderScheduler.tick();

            assertThat(frames.get(0).getAlerts()).containsExactly(alert);
            assertThat(frames.get(0).getRegions()).contains(DirtyRegion.ALERTS, DirtyRegion.STATUS_BAR);
        }
    }

    @Nested
    @DisplayName("Dispatcher thread")
    class DispatcherThread {

        @Test
        @DisplayName("the first frame after start repaints every region")
        void firstFrameRepaintsAll() throws InterruptedException {
            List<RenderFrame> rendered = new CopyOnWriteArrayList<>();
            RenderScheduler live = new RenderScheduler(
                    rendered::add,
                    marketStateReader,
                    feedStatusView,
                    new NavigationState(),
                    alertEngine,
                    renderConfig,
                    Clock.systemUTC());

            live.start();
            long deadline = System.currentTimeMillis() + 2000;
            while (rendered.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            live.stop();

            assertThat(live.awaitStop(1000)).isTrue();
            assertThat(rendered).isNotEmpty();
            assertThat(rendered.get(0).getRegions()).isEqualTo(DirtyRegion.all());
            assertThat(rendered.get(0).getFrameNumber()).isEqualTo(1);
        }
    }
}
