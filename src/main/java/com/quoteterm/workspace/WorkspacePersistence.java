package com.quoteterm.workspace;

import com.quoteterm.config.StorageConfig;
import com.quoteterm.domain.model.WorkspaceSnapshot;
import com.quoteterm.exception.StorageException;
import com.quoteterm.persistence.JsonFileStore;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Saves navigation state at shutdown and restores it at the next start.
 *
 * <p>Loading never fails startup: a missing file gives the defaults, a corrupt one is backed up
 * and also gives the defaults. Saving replaces {@code workspace.json} atomically. The shutdown
 * save runs on the gateway executor and is abandoned after {@code saveTimeout} so a stuck disk
 * cannot hold the terminal open.
 */
@Service
@EnableConfigurationProperties(WorkspaceConfig.class)
public class WorkspacePersistence {

    private static final Logger log = LoggerFactory.getLogger(WorkspacePersistence.class);

    private final JsonFileStore jsonFileStore;
    private final StorageConfig storageConfig;
    private final WorkspaceConfig workspaceConfig;
    private final NavigationState navigationState;
    private final Executor gatewayExecutor;
    private final Clock clock;

    public WorkspacePersistence(
            JsonFileStore jsonFileStore,
            StorageConfig storageConfig,
            WorkspaceConfig workspaceConfig,
            NavigationState navigationState,
            @Qualifier("gatewayExecutor") Executor gatewayExecutor,
            Clock clock) {
        this.jsonFileStore = jsonFileStore;
        this.storageConfig = storageConfig;
        this.workspaceConfig = workspaceConfig;
        this.navigationState = navigationState;
        this.gatewayExecutor = gatewayExecutor;
        this.clock = clock;
    }

    /** The saved snapshot, or defaults when there is none or it could not be read. */
    public WorkspaceSnapshot load() {
        try {
            return jsonFileStore
                    .read(storageConfig.workspacePath(), WorkspaceSnapshot.class)
                    .orElseGet(() -> WorkspaceSnapshot.defaults(clock.instant()));
        } catch (StorageException e) {
            log.warn("Workspace not readable, using defaults: {}", e.getMessage());
            return WorkspaceSnapshot.defaults(clock.instant());
        }
    }

    /**
     * Writes {@code snapshot} atomically.
     *
     * @throws StorageException if the file cannot be written
     */
    public void save(WorkspaceSnapshot snapshot) {
        jsonFileStore.write(storageConfig.workspacePath(), snapshot);
        log.debug("Workspace saved to {}", storageConfig.workspacePath());
    }

    public boolean saveWithTimeout(WorkspaceSnapshot snapshot) {
        return saveWithTimeout(snapshot, workspaceConfig.getSaveTimeout());
    }

    /**
     * Saves on the gateway executor and waits at most {@code timeout}.
     *
     * @return true if the save completed in time; false if it failed or timed out (logged)
     */
    public boolean saveWithTimeout(WorkspaceSnapshot snapshot, Duration timeout) {
        CompletableFuture<Void> pending = CompletableFuture.runAsync(() -> save(snapshot), gatewayExecutor);
        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Workspace save did not finish within {}ms, giving up", timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.warn("Workspace save failed: {}", e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while saving workspace");
            return false;
        }
    }

    /** Builds a snapshot of the current navigation state. */
    public WorkspaceSnapshot capture() {
        Navigation navigation = navigationState.current();
        return WorkspaceSnapshot.builder()
                .savedAt(clock.instant())
                .lastView(navigation.getView())
                .watchlistGroupId(navigation.getWatchlistGroupId())
                .watchlistSortColumn(navigation.getWatchlistSortColumn())
                .watchlistSortDescending(navigation.isWatchlistSortDescending())
                .watchlistHidden(navigation.isWatchlistHidden())
                .selectedInstrument(navigation.getSelectedInstrument())
                .detailInstrument(navigation.getDetailInstrument())
                .chartPeriod(navigation.getChartPeriod())
                .chartOffset(navigation.getChartOffset())
                .logPanelVisible(navigation.isLogPanelVisible())
                .build();
    }

    /** Replaces the navigation state with what {@code snapshot} describes. */
    public Navigation restore(WorkspaceSnapshot snapshot) {
        Navigation navigation = Navigation.builder()
                .view(snapshot.getLastView() != null ? snapshot.getLastView() : Navigation.INITIAL.getView())
                .watchlistGroupId(snapshot.getWatchlistGroupId())
                .watchlistSortColumn(Math.max(0, snapshot.getWatchlistSortColumn()))
                .watchlistSortDescending(snapshot.isWatchlistSortDescending())
                .watchlistHidden(snapshot.isWatchlistHidden())
                .selectedInstrument(snapshot.getSelectedInstrument())
                .detailInstrument(snapshot.getDetailInstrument())
                .chartPeriod(
                        snapshot.getChartPeriod() != null
                                ? snapshot.getChartPeriod()
                                : Navigation.INITIAL.getChartPeriod())
                .chartOffset(Math.max(0, snapshot.getChartOffset()))
                .logPanelVisible(snapshot.isLogPanelVisible())
                .build();
        navigationState.restore(navigation);
        log.info("Workspace restored: view {}, detail {}", navigation.getView(), navigation.getDetailInstrument());
        return navigation;
    }

    /** Loads the saved workspace and applies it, if restoring is enabled. */
    public void restoreSaved() {
        if (!workspaceConfig.isRestoreOnStart()) {
            log.info("Workspace restore disabled");
            return;
        }
        restore(load());
    }
}
