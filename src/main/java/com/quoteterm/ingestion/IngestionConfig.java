package com.quoteterm.ingestion;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link PushIngestionLoop} under the {@code quoteterm.ingestion}
 * prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.ingestion")
public class IngestionConfig {

    /** Longest single wait on the push stream; also bounds how long {@code stop()} takes. */
    private Duration pollTimeout = Duration.ofMillis(100);
}
