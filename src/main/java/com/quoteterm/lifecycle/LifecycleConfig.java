package com.quoteterm.lifecycle;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for {@link TerminalLifecycle} under the {@code quoteterm.lifecycle}
 * prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.lifecycle")
public class LifecycleConfig {

    /** Start the terminal with the application context. */
    private boolean autoStart = true;

    /** How long shutdown waits for the render thread to exit. */
    private long renderStopTimeoutMs = 1000;
}
