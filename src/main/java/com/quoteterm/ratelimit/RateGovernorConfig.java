package com.quoteterm.ratelimit;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link RateGovernor} under the {@code quoteterm.rate-governor}
 * prefix.
 *
 * <p>Defaults follow the vendor's published limit of 10 requests per second, with a burst of 20
 * so that start-up (watch list, snapshots, subscriptions) is not throttled. Backoff for
 * rate-limited calls is 1s, 2s, 4s.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.rate-governor")
public class RateGovernorConfig {

    private double tokensPerSecond = 10;
    private int burstCapacity = 20;

    /** Retries after the first attempt; 3 gives 4 attempts in total. */
    private int maxRetries = 3;

    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;
}
