package com.quoteterm.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.quoteterm.domain.enums.FeedStatus;
import com.quoteterm.domain.enums.UpdateCategory;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.event.AlertTriggeredEvent;
import com.quoteterm.event.MarketChangeEvent;
import com.quoteterm.ingestion.PushIngestionLoop;
import com.quoteterm.observability.TerminalMetrics;
import com.quoteterm.ratelimit.RateGovernor;
import com.quoteterm.render.RenderScheduler;
import com.quoteterm.service.FeedStatusView;
import com.quoteterm.store.ChangeNotification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TerminalMetricsTest {

    private static final InstrumentId TENCENT = InstrumentId.of("700.HK");

    @Mock
    private PushIngestionLoop pushIngestionLoop;

    @Mock
    private RenderScheduler renderScheduler;

    @Mock
    private RateGovernor rateGovernor;

    @Mock
    private FeedStatusView feedStatusView;

    private SimpleMeterRegistry registry;
    private TerminalMetrics terminalMetrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        terminalMetrics = new TerminalMetrics(registry, pushIngestionLoop, renderScheduler, rateGovernor, feedStatusView);
    }

    private MarketChangeEvent change(UpdateCategory category) {
        return new MarketChangeEvent(this, new ChangeNotification(TENCENT, category, Instant.EPOCH));
    }

    @Test
    @DisplayName("market changes are counted per category and timed")
    void marketChanges() {
        terminalMetrics.onMarketChange(change(UpdateCategory.QUOTE));
        terminalMetrics.onMarketChange(change(UpdateCategory.QUOTE));
        terminalMetrics.onMarketChange(change(UpdateCategory.DEPTH));

        assertThat(registry.get("market.changes").tag("category", "quote").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("market.changes").tag("category", "depth").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("market.change.latency").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("alert firings are counted")
    void alerts() {
        terminalMetrics.onAlertTriggered(new AlertTriggeredEvent(this, null));

        assertThat(registry.get("alerts.fired").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("function counters and gauges read their components at scrape time")
    void scrapeTime() {
        when(pushIngestionLoop.getFramesReceived()).thenReturn(120L);
        when(renderScheduler.getSkipCount()).thenReturn(7L);
        when(rateGovernor.availableTokens()).thenReturn(18);
        when(feedStatusView.getFeedStatus()).thenReturn(FeedStatus.LIVE, FeedStatus.STALE);

        assertThat(registry.get("ingest.frames").functionCounter().count()).isEqualTo(120.0);
        assertThat(registry.get("render.skipped").functionCounter().count()).isEqualTo(7.0);
        assertThat(registry.get("rate.governor.available").gauge().value()).isEqualTo(18.0);
        assertThat(registry.get("feed.live").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("feed.live").gauge().value()).isEqualTo(0.0);
    }
}
