package com.quoteterm.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.quoteterm.domain.enums.AppView;
import com.quoteterm.domain.enums.ChartPeriod;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Navigation state saved across restarts. Replaced as a whole on every save; fields unknown to
 * this version are ignored when reading a file written by a newer one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceSnapshot {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int version = CURRENT_VERSION;

    Instant savedAt;

    @Builder.Default
    AppView lastView = AppView.WATCHLIST;

    Long watchlistGroupId;

    /** Watch list column the table is sorted by (0 = unsorted). */
    int watchlistSortColumn;

    boolean watchlistSortDescending;
    boolean watchlistHidden;
    InstrumentId selectedInstrument;
    InstrumentId detailInstrument;

    @Builder.Default
    ChartPeriod chartPeriod = ChartPeriod.DAY;

    /** Number of candles the chart is scrolled back from the latest one. */
    int chartOffset;

    boolean logPanelVisible;

    public static WorkspaceSnapshot defaults(Instant now) {
        return WorkspaceSnapshot.builder().savedAt(now).build();
    }
}
