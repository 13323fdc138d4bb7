package com.quoteterm.domain.enums;

public enum RenderPhase {
    /** Nothing to draw. */
    IDLE,
    /** At least one region changed since the last redraw. */
    DIRTY,
    /** A redraw pass is in progress. */
    RENDERING
}
