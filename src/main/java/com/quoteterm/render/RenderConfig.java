package com.quoteterm.render;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link RenderScheduler} under the {@code quoteterm.render}
 * prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.render")
public class RenderConfig {

    /** How often the dispatcher checks for dirty regions. */
    private Duration tickInterval = Duration.ofMillis(16);

    /** Minimum spacing between two redraws, however many changes arrive. */
    private Duration minRenderInterval = Duration.ofMillis(16);

    /** Whether the built-in text sink prints frames to standard output. */
    private boolean consoleOutput = true;
}
