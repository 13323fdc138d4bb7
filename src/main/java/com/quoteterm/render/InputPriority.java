package com.quoteterm.render;

/**
 * Input sources of the render dispatcher, highest priority first. Keystrokes are never delayed
 * behind a backlog of data updates.
 */
public enum InputPriority {
    USER_INPUT,
    FATAL_SIGNAL,
    DATA_UPDATE
}
