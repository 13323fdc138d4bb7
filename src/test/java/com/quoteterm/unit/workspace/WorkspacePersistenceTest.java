package com.quoteterm.unit.workspace;

import static org.assertj.core.api.Assertions.assertThat;

import com.quoteterm.config.StorageConfig;
import com.quoteterm.domain.enums.AppView;
import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.model.InstrumentId;
import com.quoteterm.domain.model.WorkspaceSnapshot;
import com.quoteterm.persistence.JsonFileStore;
import com.quoteterm.unit.support.MutableClock;
import com.quoteterm.unit.support.TestObjectMappers;
import com.quoteterm.workspace.Navigation;
import com.quoteterm.workspace.NavigationCommand;
import com.quoteterm.workspace.NavigationState;
import com.quoteterm.workspace.WorkspaceConfig;
import com.quoteterm.workspace.WorkspacePersistence;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for WorkspacePersistence: round trip, defaults for missing or corrupt files and the
 * bounded shutdown save.
 */
class WorkspacePersistenceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T02:00:00Z");
    private static final InstrumentId TENCENT = InstrumentId.of("700.HK");

    @TempDir
    Path tempDir;

    private StorageConfig storageConfig;
    private WorkspaceConfig workspaceConfig;
    private NavigationState navigationState;
    private JsonFileStore jsonFileStore;

    @BeforeEach
    void setUp() {
        storageConfig = new StorageConfig();
        storageConfig.setDataDir(tempDir);
        workspaceConfig = new WorkspaceConfig();
        navigationState = new NavigationState();
        jsonFileStore = new JsonFileStore(TestObjectMappers.create(), new MutableClock(NOW));
    }

    private WorkspacePersistence persistence(Executor executor) {
        return new WorkspacePersistence(
                jsonFileStore, storageConfig, workspaceConfig, navigationState, executor, new MutableClock(NOW));
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("a saved workspace restores the same navigation in a fresh process")
        void saveAndRestore() {
            navigationState.apply(new NavigationCommand.OpenDetail(TENCENT));
            navigationState.apply(new NavigationCommand.CycleChartPeriod(true));
            navigationState.apply(new NavigationCommand.ShiftChartOffset(12));
            navigationState.apply(new NavigationCommand.SortWatchlist(4));
            WorkspacePersistence persistence = persistence(Runnable::run);
            Navigation before = navigationState.current();

            assertThat(persistence.saveWithTimeout(persistence.capture())).isTrue();

            NavigationState freshState = new NavigationState();
            WorkspacePersistence fresh = new WorkspacePersistence(
                    jsonFileStore, storageConfig, workspaceConfig, freshState, Runnable::run, new MutableClock(NOW));
            fresh.restoreSaved();

            assertThat(freshState.current()).isEqualTo(before);
            assertThat(freshState.current().getChartPeriod()).isEqualTo(ChartPeriod.WEEK);
            assertThat(freshState.current().getView()).isEqualTo(AppView.WATCHLIST_STOCK);
        }

        @Test
        @DisplayName("restore is skipped when disabled")
        void restoreDisabled() {
            WorkspacePersistence persistence = persistence(Runnable::run);
            persistence.save(WorkspaceSnapshot.builder().lastView(AppView.STOCK).build());
            workspaceConfig.setRestoreOnStart(false);

            persistence.restoreSaved();

            assertThat(navigationState.current()).isEqualTo(Navigation.INITIAL);
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("no saved file gives the default workspace")
        void missingFile() {
            WorkspaceSnapshot snapshot = persistence(Runnable::run).load();

            assertThat(snapshot.getLastView()).isEqualTo(AppView.WATCHLIST);
            assertThat(snapshot.getChartPeriod()).isEqualTo(ChartPeriod.DAY);
            assertThat(snapshot.getSavedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("a corrupt file gives the defaults and is kept as a backup")
        void corruptFile() throws IOException {
            Files.writeString(storageConfig.workspacePath(), "[1, 2");

            WorkspaceSnapshot snapshot = persistence(Runnable::run).load();

            assertThat(snapshot.getLastView()).isEqualTo(AppView.WATCHLIST);
            assertThat(tempDir.resolve("workspace.json.corrupt." + NOW.getEpochSecond() + ".bak")).exists();
        }

        @Test
        @DisplayName("negative offsets and sort columns from a hand-edited file are clamped")
        void clampsValues() {
            WorkspacePersistence persistence = persistence(Runnable::run);

            Navigation navigation = persistence.restore(WorkspaceSnapshot.builder()
                    .chartOffset(-4)
                    .watchlistSortColumn(-1)
                    .lastView(null)
                    .chartPeriod(null)
                    .build());

            assertThat(navigation.getChartOffset()).isZero();
            assertThat(navigation.getWatchlistSortColumn()).isZero();
            assertThat(navigation.getView()).isEqualTo(AppView.WATCHLIST);
            assertThat(navigation.getChartPeriod()).isEqualTo(ChartPeriod.DAY);
        }
    }

    @Nested
    @DisplayName("Bounded save")
    class BoundedSave {

        @Test
        @DisplayName("gives up when the save does not finish in time")
        void timesOut() throws InterruptedException {
            CountDownLatch release = new CountDownLatch(1);
            Executor stuck = task -> new Thread(() -> {
                        try {
                            release.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    })
                    .start();
            WorkspacePersistence persistence = persistence(stuck);

            boolean saved = persistence.saveWithTimeout(persistence.capture(), Duration.ofMillis(50));

            release.countDown();
            assertThat(saved).isFalse();
            assertThat(storageConfig.workspacePath()).doesNotExist();
        }

        @Test
        @DisplayName("reports a failed write without throwing")
        void failedWrite() throws IOException {
            storageConfig.setDataDir(Files.createFile(tempDir.resolve("blocked")));
            WorkspacePersistence persistence = persistence(Runnable::run);

            assertThat(persistence.saveWithTimeout(persistence.capture())).isFalse();
        }
    }
}
