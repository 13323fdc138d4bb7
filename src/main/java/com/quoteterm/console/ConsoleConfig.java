package com.quoteterm.console;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link ConsoleCommandReader} under the
 * {@code quoteterm.console} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.console")
public class ConsoleConfig {

    /** Read commands from standard input. Off for headless runs. */
    private boolean enabled = true;

    private int historyLimit = 20;
}
