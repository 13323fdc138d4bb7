package com.quoteterm.lifecycle;

import com.quoteterm.alert.AlertEngine;
import com.quoteterm.console.ConsoleCommandReader;
import com.quoteterm.exception.BaseException;
import com.quoteterm.exception.InstanceLockedException;
import com.quoteterm.gateway.RateLimitedMarketDataClient;
import com.quoteterm.ingestion.PushIngestionLoop;
import com.quoteterm.render.RenderScheduler;
import com.quoteterm.service.WatchlistService;
import com.quoteterm.workspace.Navigation;
import com.quoteterm.workspace.NavigationState;
import com.quoteterm.workspace.WorkspacePersistence;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Brings the terminal up after the context is ready and takes it down before other beans stop.
 *
 * <p>Startup order:
 * <ol>
 *   <li>Take the instance lock on the data directory; startup aborts if another terminal holds it</li>
 *   <li>Restore the saved workspace</li>
 *   <li>Connect the gateway and subscribe the watch list</li>
 *   <li>Reopen the detail view the workspace was left on</li>
 *   <li>Start push ingestion, the render scheduler and the console</li>
 * </ol>
 *
 * <p>Shutdown stops input first, then flushes alert rules, saves the workspace (bounded by
 * {@code quoteterm.workspace.save-timeout}, disconnects and releases the instance lock. Each step is isolated: a failing
 * step is logged and the rest still run.
 */
@Service
@EnableConfigurationProperties(LifecycleConfig.class)
public class TerminalLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TerminalLifecycle.class);

    private final RateLimitedMarketDataClient marketDataClient;
    private final WatchlistService watchlistService;
    private final PushIngestionLoop pushIngestionLoop;
    private final RenderScheduler renderScheduler;
    private final AlertEngine alertEngine;
    private final WorkspacePersistence workspacePersistence;
    private final NavigationState navigationState;
    private final ConsoleCommandReader consoleCommandReader;
    private final InstanceLock instanceLock;
    private final LifecycleConfig lifecycleConfig;
    private final ApplicationContext applicationContext;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TerminalLifecycle(
            RateLimitedMarketDataClient marketDataClient,
            WatchlistService watchlistService,
            PushIngestionLoop pushIngestionLoop,
            RenderScheduler renderScheduler,
            AlertEngine alertEngine,
            WorkspacePersistence workspacePersistence,
            NavigationState navigationState,
            ConsoleCommandReader consoleCommandReader,
            InstanceLock instanceLock,
            LifecycleConfig lifecycleConfig,
            ApplicationContext applicationContext) {
        this.marketDataClient = marketDataClient;
        this.watchlistService = watchlistService;
        this.pushIngestionLoop = pushIngestionLoop;
        this.renderScheduler = renderScheduler;
        this.alertEngine = alertEngine;
        this.workspacePersistence = workspacePersistence;
        this.navigationState = navigationState;
        this.consoleCommandReader = consoleCommandReader;
        this.instanceLock = instanceLock;
        this.lifecycleConfig = lifecycleConfig;
        this.applicationContext = applicationContext;
    }

    @Override
    public void start() {
        log.info("Terminal starting...");
        try {
            instanceLock.acquire();
        } catch (InstanceLockedException e) {
            log.error(e.getMessage());
            throw e;
        }
        running.set(true);

        restoreWorkspace();
        boolean connected = connectFeed();
        if (connected) {
            reopenDetail();
            startIngestion();
        }
        renderScheduler.start();
        consoleCommandReader.setQuitHandler(this::requestExit);
        consoleCommandReader.start();

        log.info("Terminal started (feed {})", connected ? "connected" : "unavailable");
    }

    @Override
    public void stop() {
        log.info("Terminal shutdown initiated...");
        try {
            consoleCommandReader.stop();
            stopIngestion();
            stopRendering();
            flushAlerts();
            saveWorkspace();
            disconnectFeed();
            releaseLock();
            log.info("Terminal shutdown completed");
        } catch (Exception e) {
            log.error("Error during terminal shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return lifecycleConfig.isAutoStart();
    }

    // ---- Startup steps ----

    void restoreWorkspace() {
        try {
            workspacePersistence.restoreSaved();
        } catch (Exception e) {
            log.error("Failed to restore workspace, starting from defaults", e);
        }
    }

    boolean connectFeed() {
        try {
            marketDataClient.connect();
            watchlistService.start();
            return true;
        } catch (BaseException e) {
            log.error("Failed to connect market data feed: {}", e.getMessage(), e);
            return false;
        }
    }

    void reopenDetail() {
        Navigation navigation = navigationState.current();
        if (!navigation.isDetailOpen()) {
            return;
        }
        try {
            watchlistService.openDetail(navigation.getDetailInstrument(), navigation.getChartPeriod());
        } catch (BaseException e) {
            log.warn("Failed to reopen detail for {}: {}", navigation.getDetailInstrument(), e.getMessage());
        }
    }

    void startIngestion() {
        pushIngestionLoop.start(marketDataClient.pushStream()).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Push ingestion ended: {}", error.getMessage());
            }
        });
    }

    // ---- Shutdown steps ----

    void stopIngestion() {
        try {
            pushIngestionLoop.stop();
            watchlistService.stop();
        } catch (Exception e) {
            log.error("Failed to stop ingestion", e);
        }
    }

    void stopRendering() {
        try {
            renderScheduler.stop();
            if (!renderScheduler.awaitStop(lifecycleConfig.getRenderStopTimeoutMs())) {
                log.warn("Render thread did not stop within {}ms", lifecycleConfig.getRenderStopTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping render thread");
        }
    }

    void flushAlerts() {
        try {
            alertEngine.flush();
        } catch (Exception e) {
            log.error("Failed to flush alert rules", e);
        }
    }

    void saveWorkspace() {
        try {
            if (!workspacePersistence.saveWithTimeout(workspacePersistence.capture())) {
                log.warn("Workspace was not saved before shutdown");
            }
        } catch (Exception e) {
            log.error("Failed to save workspace", e);
        }
    }

    void disconnectFeed() {
        try {
            marketDataClient.disconnect();
        } catch (Exception e) {
            log.error("Failed to disconnect market data feed", e);
        }
    }

    void releaseLock() {
        try {
            instanceLock.release();
        } catch (Exception e) {
            log.error("Failed to release instance lock", e);
        }
    }

    private void requestExit() {
        if (applicationContext instanceof ConfigurableApplicationContext configurable) {
            Thread exit = new Thread(() -> SpringApplication.exit(configurable), "terminal-exit");
            exit.start();
        }
    }
}
