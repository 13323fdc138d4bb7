package com.quoteterm.render;

import com.quoteterm.domain.enums.DirtyRegion;
import com.quoteterm.domain.model.AlertEvent;
import com.quoteterm.service.FeedStatusView;
import com.quoteterm.store.MarketStateReader;
import com.quoteterm.workspace.Navigation;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a {@link RenderSink} may read for one redraw: the regions to repaint, read-only
 * market state, feed freshness, navigation and the alerts not yet shown.
 */
@Value
@Builder
public class RenderFrame {

    long frameNumber;
    Instant renderedAt;
    Set<DirtyRegion> regions;
    MarketStateReader market;
    FeedStatusView feedStatus;
    Navigation navigation;

    /** Alerts fired since the previous frame; each alert appears in exactly one frame. */
    List<AlertEvent> alerts;

    public boolean isDirty(DirtyRegion region) {
        return regions.contains(region);
    }
}
