package com.quoteterm.workspace;

import com.quoteterm.domain.enums.AppView;
import com.quoteterm.domain.model.InstrumentId;

/**
 * A user action that changes navigation. Commands are pure: they map the current
 * {@link Navigation} to the next one and are applied by {@link NavigationState#apply}.
 */
public interface NavigationCommand {

    Navigation applyTo(Navigation current);

    record SelectInstrument(InstrumentId instrument) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder().selectedInstrument(instrument).build();
        }
    }

    /** Opens the detail panel; it shares the screen with the watch list unless that is hidden. */
    record OpenDetail(InstrumentId instrument) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder()
                    .selectedInstrument(instrument)
                    .detailInstrument(instrument)
                    .view(current.isWatchlistHidden() ? AppView.STOCK : AppView.WATCHLIST_STOCK)
                    .chartOffset(0)
                    .build();
        }
    }

    record CloseDetail() implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder()
                    .detailInstrument(null)
                    .view(AppView.WATCHLIST)
                    .watchlistHidden(false)
                    .build();
        }
    }

    /** Switches watch list group; the selection belonged to the old group and is cleared. */
    record SelectGroup(Long groupId) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder()
                    .watchlistGroupId(groupId)
                    .selectedInstrument(null)
                    .build();
        }
    }

    record CycleChartPeriod(boolean forward) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder()
                    .chartPeriod(forward ? current.getChartPeriod().next() : current.getChartPeriod().prev())
                    .chartOffset(0)
                    .build();
        }
    }

    /** Scrolls the chart back (positive) or forward (negative); never past the latest candle. */
    record ShiftChartOffset(int delta) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder()
                    .chartOffset(Math.max(0, current.getChartOffset() + delta))
                    .build();
        }
    }

    record ToggleWatchlistHidden() implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            boolean hidden = !current.isWatchlistHidden();
            Navigation.NavigationBuilder next = current.toBuilder().watchlistHidden(hidden);
            if (current.isDetailOpen()) {
                next.view(hidden ? AppView.STOCK : AppView.WATCHLIST_STOCK);
            }
            return next.build();
        }
    }

    record ToggleLogPanel() implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder().logPanelVisible(!current.isLogPanelVisible()).build();
        }
    }

    /**
     * Sorts the watch list by a column. Choosing the current column again flips the direction;
     * column 0 removes sorting.
     */
    record SortWatchlist(int column) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            if (column <= 0) {
                return current.toBuilder().watchlistSortColumn(0).watchlistSortDescending(false).build();
            }
            boolean descending = column == current.getWatchlistSortColumn() && !current.isWatchlistSortDescending();
            return current.toBuilder()
                    .watchlistSortColumn(column)
                    .watchlistSortDescending(descending)
                    .build();
        }
    }

    record SwitchView(AppView view) implements NavigationCommand {
        @Override
        public Navigation applyTo(Navigation current) {
            return current.toBuilder().view(view).build();
        }
    }
}
