package com.quoteterm.render;

import com.quoteterm.domain.enums.DirtyRegion;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Regions waiting to be redrawn. Only three things can happen to it: regions are unioned in,
 * the whole set is drained (read and cleared in one step), or it is inspected.
 */
public class DirtyRegionSet {

    private final EnumSet<DirtyRegion> regions = EnumSet.noneOf(DirtyRegion.class);

    public synchronized void union(Collection<DirtyRegion> changed) {
        regions.addAll(changed);
    }

    public synchronized void union(DirtyRegion region) {
        regions.add(region);
    }

    /** Returns everything marked so far and leaves the set empty. */
    public synchronized Set<DirtyRegion> drain() {
        EnumSet<DirtyRegion> drained = regions.isEmpty() ? EnumSet.noneOf(DirtyRegion.class) : EnumSet.copyOf(regions);
        regions.clear();
        return drained;
    }

    public synchronized boolean isEmpty() {
        return regions.isEmpty();
    }

    public synchronized boolean contains(DirtyRegion region) {
        return regions.contains(region);
    }

    public synchronized Set<DirtyRegion> snapshot() {
        return regions.isEmpty() ? EnumSet.noneOf(DirtyRegion.class) : EnumSet.copyOf(regions);
    }
}
