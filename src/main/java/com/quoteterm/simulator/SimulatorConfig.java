package com.quoteterm.simulator;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link SimulatedMarketDataGateway} under the
 * {@code quoteterm.simulator} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.simulator")
public class SimulatorConfig {

    /** Interval between push rounds; each round moves every subscribed instrument once. */
    private Duration pushInterval = Duration.ofMillis(250);

    /** Largest single move as a percentage of the current price. */
    private double maxMovePercent = 0.3;

    private long seed = 42L;

    /** Starting prices by symbol; unknown symbols start at {@link #defaultPrice}. */
    private Map<String, BigDecimal> initialPrices = new LinkedHashMap<>();

    private BigDecimal defaultPrice = BigDecimal.valueOf(100);
}
