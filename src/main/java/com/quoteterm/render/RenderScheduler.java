package com.quoteterm.render;

import com.quoteterm.alert.AlertEngine;
import com.quoteterm.domain.enums.DirtyRegion;
import com.quoteterm.domain.enums.RenderPhase;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.event.AlertTriggeredEvent;
import com.quoteterm.event.FeedStatusChangedEvent;
import com.quoteterm.event.MarketChangeEvent;
import com.quoteterm.event.PortfolioUpdatedEvent;
import com.quoteterm.event.StreamLostEvent;
import com.quoteterm.service.FeedStatusView;
import com.quoteterm.store.MarketStateReader;
import com.quoteterm.workspace.NavigationState;
import java.time.Clock;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Turns a stream of changes into throttled redraws.
 *
 * <p><b>Inputs</b> are queued and handled by one {@code render-dispatch} thread in priority order
 * USER_INPUT, FATAL_SIGNAL, DATA_UPDATE (FIFO within a priority). Each input unions its regions
 * into the {@link DirtyRegionSet}:
 * <ul>
 *   <li>user input: every region</li>
 *   <li>market change: the regions showing that category, see {@link DirtyRegion#forUpdate}</li>
 *   <li>stream lost: STATUS_BAR</li>
 *   <li>alert fired: ALERTS and STATUS_BAR</li>
 *   <li>portfolio refresh: PORTFOLIO</li>
 *   <li>feed status change: STATUS_BAR</li>
 * </ul>
 *
 * <p><b>Tick:</b> evaluated after every handled input and whenever the queue poll times out. If
 * anything is dirty and at least {@code minRenderInterval} has passed since the last redraw, the
 * dirty set is drained and handed to the {@link RenderSink} as one frame. K changes inside one
 * interval therefore cost one redraw; no changes cost none.
 *
 * <p>State machine: IDLE, DIRTY on the first marked region, RENDERING during the sink call,
 * back to IDLE (or DIRTY if the sink failed or new regions arrived meanwhile). A failing sink
 * gets its regions re-unioned so nothing is lost.
 */
@Service
@EnableConfigurationProperties(RenderConfig.class)
public class RenderScheduler {

    private static final Logger log = LoggerFactory.getLogger(RenderScheduler.class);

    private static final Set<DirtyRegion> ALERT_REGIONS = EnumSet.of(DirtyRegion.ALERTS, DirtyRegion.STATUS_BAR);

    private final RenderSink renderSink;
    private final MarketStateReader marketStateReader;
    private final FeedStatusView feedStatusView;
    private final NavigationState navigationState;
    private final AlertEngine alertEngine;
    private final RenderConfig renderConfig;
    private final Clock clock;
    private final LongSupplier nanoClock;

    private final PriorityBlockingQueue<DispatchInput> inputs = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final DirtyRegionSet dirtyRegions = new DirtyRegionSet();

    private final AtomicLong renderCount = new AtomicLong();
    private final AtomicLong skipCount = new AtomicLong();
    private final AtomicLong failedRenders = new AtomicLong();

    private volatile RenderPhase phase = RenderPhase.IDLE;
    private volatile boolean running;
    private volatile Thread dispatcher;

    /** Guarded by {@code this}. */
    private long lastRenderNanos;

    /** Guarded by {@code this}. */
    private boolean rendered;

    @Autowired
    public RenderScheduler(
            RenderSink renderSink,
            MarketStateReader marketStateReader,
            FeedStatusView feedStatusView,
            NavigationState navigationState,
            AlertEngine alertEngine,
            RenderConfig renderConfig,
            Clock clock) {
        this(renderSink, marketStateReader, feedStatusView, navigationState, alertEngine, renderConfig, clock,
                System::nanoTime);
    }

    public RenderScheduler(
            RenderSink renderSink,
            MarketStateReader marketStateReader,
            FeedStatusView feedStatusView,
            NavigationState navigationState,
            AlertEngine alertEngine,
            RenderConfig renderConfig,
            Clock clock,
            LongSupplier nanoClock) {
        this.renderSink = renderSink;
        this.marketStateReader = marketStateReader;
        this.feedStatusView = feedStatusView;
        this.navigationState = navigationState;
        this.alertEngine = alertEngine;
        this.renderConfig = renderConfig;
        this.clock = clock;
        this.nanoClock = nanoClock;
    }

    // ---- Lifecycle ----

    /** Starts the dispatcher. The first frame repaints every region. */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dirtyRegions.union(DirtyRegion.all());
        phase = RenderPhase.DIRTY;

        Thread thread = new Thread(this::dispatchLoop, "render-dispatch");
        thread.setDaemon(true);
        dispatcher = thread;
        thread.start();
        log.info(
                "Render scheduler started (tick {}ms, min interval {}ms)",
                renderConfig.getTickInterval().toMillis(),
                renderConfig.getMinRenderInterval().toMillis());
    }

    /** Asks the dispatcher to exit; it does so within one tick interval. */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info(
                "Render scheduler stopping: {} renders, {} idle ticks, efficiency {}%",
                renderCount.get(),
                skipCount.get(),
                String.format("%.1f", getEfficiencyPercent()));
    }

    public boolean isRunning() {
        return running;
    }

    /** Waits for the dispatcher thread to exit, up to {@code timeoutMs}. */
    public boolean awaitStop(long timeoutMs) throws InterruptedException {
        Thread thread = dispatcher;
        if (thread == null) {
            return true;
        }
        thread.join(timeoutMs);
        return !thread.isAlive();
    }

    // ---- Inputs ----

    public void submitUserInput(String source) {
        enqueue(InputPriority.USER_INPUT, DirtyRegion.all(), source);
    }

    public void submitFatalSignal(String source, Collection<DirtyRegion> regions) {
        enqueue(InputPriority.FATAL_SIGNAL, regions, source);
    }

    public void submitDataUpdate(String source, Collection<DirtyRegion> regions) {
        enqueue(InputPriority.DATA_UPDATE, regions, source);
    }

    @EventListener
    @Order(2)
    public void onMarketChange(MarketChangeEvent event) {
        submitDataUpdate(event.getCategory().wireName(), DirtyRegion.forUpdate(event.getCategory()));
    }

    @EventListener
    public void onStreamLost(StreamLostEvent event) {
        submitFatalSignal("stream-lost", EnumSet.of(DirtyRegion.STATUS_BAR));
    }

    @EventListener
    public void onAlertTriggered(AlertTriggeredEvent event) {
        submitDataUpdate("alert", ALERT_REGIONS);
    }

    @EventListener
    public void onPortfolioUpdated(PortfolioUpdatedEvent event) {
        submitDataUpdate("portfolio", EnumSet.of(DirtyRegion.PORTFOLIO));
    }

    @EventListener
    public void onFeedStatusChanged(FeedStatusChangedEvent event) {
        submitDataUpdate("feed-status", EnumSet.of(DirtyRegion.STATUS_BAR));
    }

    /**
     * Handles every queued input without waiting. The dispatcher does this one input at a time;
     * exposed for callers that drive the scheduler synchronously.
     *
     * @return number of inputs handled
     */
    public int processPendingInputs() {
        int handled = 0;
        DispatchInput input;
        while ((input = inputs.poll()) != null) {
            handle(input);
            handled++;
        }
        return handled;
    }

    // ---- Tick ----

    /**
     * Redraws if anything is dirty and the minimum interval has passed.
     *
     * @return true if a frame was rendered
     */
    public synchronized boolean tick() {
        if (dirtyRegions.isEmpty()) {
            skipCount.incrementAndGet();
            phase = RenderPhase.IDLE;
            return false;
        }
        long now = nanoClock.getAsLong();
        if (rendered && now - lastRenderNanos < renderConfig.getMinRenderInterval().toNanos()) {
            return false;
        }

        phase = RenderPhase.RENDERING;
        Set<DirtyRegion> regions = dirtyRegions.drain();
        List<AlertEvent> alerts = alertEngine.drainPendingAlerts();
        RenderFrame frame = RenderFrame.builder()
                .frameNumber(renderCount.get() + 1)
                .renderedAt(clock.instant())
                .regions(regions)
                .market(marketStateReader)
                .feedStatus(feedStatusView)
                .navigation(navigationState.current())
                .alerts(alerts)
                .build();
        try {
            renderSink.render(frame);
            renderCount.incrementAndGet();
            rendered = true;
            lastRenderNanos = now;
            return true;
        } catch (RuntimeException e) {
            failedRenders.incrementAndGet();
            dirtyRegions.union(regions);
            log.error("Render of {} failed, regions kept dirty", regions, e);
            return false;
        } finally {
            phase = dirtyRegions.isEmpty() ? RenderPhase.IDLE : RenderPhase.DIRTY;
        }
    }

    // ---- Monitoring ----

    public RenderPhase getPhase() {
        return phase;
    }

    public Set<DirtyRegion> getDirtyRegions() {
        return dirtyRegions.snapshot();
    }

    public long getRenderCount() {
        return renderCount.get();
    }

    /** Ticks that found nothing to draw. */
    public long getSkipCount() {
        return skipCount.get();
    }

    public long getFailedRenders() {
        return failedRenders.get();
    }

    /** Share of ticks that did not need a redraw, in percent. */
    public double getEfficiencyPercent() {
        long renders = renderCount.get();
        long skips = skipCount.get();
        long total = renders + skips;
        return total == 0 ? 0.0 : skips * 100.0 / total;
    }

    public int getQueuedInputs() {
        return inputs.size();
    }

    // ---- Internal ----

    private void enqueue(InputPriority priority, Collection<DirtyRegion> regions, String source) {
        Set<DirtyRegion> copy = regions.isEmpty() ? EnumSet.noneOf(DirtyRegion.class) : EnumSet.copyOf(regions);
        inputs.offer(new DispatchInput(priority, sequence.incrementAndGet(), copy, source));
    }

    private void handle(DispatchInput input) {
        if (input.regions().isEmpty()) {
            return;
        }
        dirtyRegions.union(input.regions());
        if (phase == RenderPhase.IDLE) {
            phase = RenderPhase.DIRTY;
        }
        if (input.priority() != InputPriority.DATA_UPDATE) {
            log.debug("Dispatched {} from {}", input.priority(), input.source());
        }
    }

    private void dispatchLoop() {
        long tickNanos = renderConfig.getTickInterval().toNanos();
        long nextTick = nanoClock.getAsLong() + tickNanos;
        try {
            while (running) {
                long wait = Math.max(0, nextTick - nanoClock.getAsLong());
                DispatchInput input = inputs.poll(wait, TimeUnit.NANOSECONDS);
                if (input != null) {
                    handle(input);
                }
                long now = nanoClock.getAsLong();
                if (now >= nextTick) {
                    tick();
                    nextTick = now + tickNanos;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Render dispatcher interrupted");
        } catch (RuntimeException e) {
            log.error("Render dispatcher failed", e);
        } finally {
            running = false;
            log.info("Render dispatcher exited after {} renders", renderCount.get());
        }
    }
}
