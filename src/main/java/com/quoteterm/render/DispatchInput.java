package com.quoteterm.render;

import com.quoteterm.domain.enums.DirtyRegion;
import java.util.Set;

/**
 * One queued input of the render dispatcher. Ordered by priority, then by arrival.
 */
public record DispatchInput(InputPriority priority, long sequence, Set<DirtyRegion> regions, String source)
        implements Comparable<DispatchInput> {

    @Override
    public int compareTo(DispatchInput other) {
        int byPriority = priority.compareTo(other.priority);
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }
}
