package com.quoteterm.workspace;

import com.quoteterm.domain.enums.AppView;
import com.quoteterm.domain.enums.ChartPeriod;
import com.quoteterm.domain.model.InstrumentId;
import lombok.Builder;
import lombok.Value;

/**
 * One immutable value of the terminal's navigation: which view is up, what is selected, how the
 * watch list is sorted and where the chart is scrolled.
 */
@Value
@Builder(toBuilder = true)
public class Navigation {

    public static final Navigation INITIAL = Navigation.builder().build();

    @Builder.Default
    AppView view = AppView.WATCHLIST;

    Long watchlistGroupId;
    int watchlistSortColumn;
    boolean watchlistSortDescending;
    boolean watchlistHidden;
    InstrumentId selectedInstrument;
    InstrumentId detailInstrument;

    @Builder.Default
    ChartPeriod chartPeriod = ChartPeriod.DAY;

    int chartOffset;
    boolean logPanelVisible;

    public boolean isDetailOpen() {
        return detailInstrument != null;
    }
}
