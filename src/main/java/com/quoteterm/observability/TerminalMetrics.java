package com.quoteterm.observability;

import com.quoteterm.domain.enums.FeedStatus;
import com.quoteterm.event.AlertTriggeredEvent;
import com.quoteterm.event.MarketChangeEvent;
import com.quoteterm.ingestion.PushIngestionLoop;
import com.quoteterm.ratelimit.RateGovernor;
import com.quoteterm.render.RenderScheduler;
import com.quoteterm.service.FeedStatusView;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the terminal.
 *
 * <ul>
 *   <li><b>market.changes</b> (counter): accepted store updates, tagged by category</li>
 *   <li><b>market.change.latency</b> (timer): publication to the end of the listener chain</li>
 *   <li><b>alerts.fired</b> (counter)</li>
 *   <li><b>ingest.frames</b>, <b>ingest.decode.failures</b>, <b>ingest.stale.rejected</b>
 *       (function counters read from the ingestion loop)</li>
 *   <li><b>render.count</b>, <b>render.skipped</b>, <b>render.failed</b> (function counters)</li>
 *   <li><b>rate.governor.available</b> (gauge): tokens left in the bucket</li>
 *   <li><b>feed.live</b> (gauge 0/1)</li>
 * </ul>
 *
 * <p>Function counters and gauges are read at scrape time.
 */
@Service
public class TerminalMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter alertsFiredCounter;
    private final Timer marketChangeLatencyTimer;

    public TerminalMetrics(
            MeterRegistry meterRegistry,
            PushIngestionLoop pushIngestionLoop,
            RenderScheduler renderScheduler,
            RateGovernor rateGovernor,
            FeedStatusView feedStatusView) {
        this.meterRegistry = meterRegistry;

        this.alertsFiredCounter = Counter.builder("alerts.fired")
                .description("Alert rule firings")
                .register(meterRegistry);

        this.marketChangeLatencyTimer = Timer.builder("market.change.latency")
                .description("Time from market change publication until all listeners have run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        FunctionCounter.builder("ingest.frames", pushIngestionLoop, PushIngestionLoop::getFramesReceived)
                .description("Push frames received")
                .register(meterRegistry);
        FunctionCounter.builder("ingest.decode.failures", pushIngestionLoop, PushIngestionLoop::getDecodeFailures)
                .description("Push frames dropped because they could not be decoded")
                .register(meterRegistry);
        FunctionCounter.builder("ingest.stale.rejected", pushIngestionLoop, PushIngestionLoop::getStaleRejected)
                .description("Updates rejected as older than the stored value")
                .register(meterRegistry);

        FunctionCounter.builder("render.count", renderScheduler, RenderScheduler::getRenderCount)
                .register(meterRegistry);
        FunctionCounter.builder("render.skipped", renderScheduler, RenderScheduler::getSkipCount)
                .description("Ticks with nothing dirty")
                .register(meterRegistry);
        FunctionCounter.builder("render.failed", renderScheduler, RenderScheduler::getFailedRenders)
                .register(meterRegistry);

        Gauge.builder("rate.governor.available", rateGovernor, RateGovernor::availableTokens)
                .description("Request tokens currently available")
                .register(meterRegistry);
        Gauge.builder("feed.live", feedStatusView, view -> view.getFeedStatus() == FeedStatus.LIVE ? 1 : 0)
                .register(meterRegistry);
    }

    @EventListener
    @Order(10)
    public void onMarketChange(MarketChangeEvent event) {
        Counter.builder("market.changes")
                .tag("category", event.getCategory().name().toLowerCase())
                .register(meterRegistry)
                .increment();
        marketChangeLatencyTimer.record(System.nanoTime() - event.getReceivedAt(), TimeUnit.NANOSECONDS);
    }

    @EventListener
    public void onAlertTriggered(AlertTriggeredEvent event) {
        alertsFiredCounter.increment();
    }
}
