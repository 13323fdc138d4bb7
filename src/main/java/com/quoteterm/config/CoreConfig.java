package com.quoteterm.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared infrastructure beans: the wall clock every time-based decision reads, and the bounded
 * executor for blocking work that must not run on the ingestion or render threads.
 */
@Configuration
@EnableConfigurationProperties(StorageConfig.class)
public class CoreConfig {

    @Value("${quoteterm.gateway-executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${quoteterm.gateway-executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${quoteterm.gateway-executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("gateway-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
