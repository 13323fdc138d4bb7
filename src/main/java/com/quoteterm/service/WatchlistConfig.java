package com.quoteterm.service;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the {@link WatchlistService} under the {@code quoteterm.watchlist}
 * prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "quoteterm.watchlist")
public class WatchlistConfig {

    /** Symbols watched at start-up, e.g. {@code 700.HK}. */
    private List<String> instruments = new ArrayList<>(List.of("700.HK", "9988.HK", "AAPL.US", "TSLA.US"));

    private long refreshIntervalMs = 5000;
    private long portfolioRefreshIntervalMs = 30000;

    /** Candles fetched when the chart opens or changes period. */
    private int chartCandles = 120;
}
