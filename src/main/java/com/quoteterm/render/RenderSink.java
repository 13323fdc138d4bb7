package com.quoteterm.render;

/**
 * The drawing layer. Called on the {@code render-dispatch} thread, one frame at a time.
 * Implementations only read from the frame; throwing leaves the frame's regions dirty.
 */
@FunctionalInterface
public interface RenderSink {

    void render(RenderFrame frame);
}
