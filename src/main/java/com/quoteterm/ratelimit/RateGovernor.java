package com.quoteterm.ratelimit;

import com.quoteterm.exception.GatewayException;
import com.quoteterm.exception.RateLimitExhaustedException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide throttle for every outbound call to the market-data vendor.
 *
 * <p>Two layers:
 * <ul>
 *   <li><b>Token bucket</b> ({@code tokensPerSecond}, {@code burstCapacity}): every attempt,
 *       including retries, takes one permit first. Callers block in arrival order while the bucket
 *       is empty.</li>
 *   <li><b>Retry</b> ({@code gateway}): a call rejected by the vendor for rate limiting (status 429
 *       or a "rate limit" / "too many requests" message) is retried with exponential backoff,
 *       1s then 2s then 4s by default. Any other failure propagates on the first attempt.</li>
 * </ul>
 *
 * <p>When every retry has been rate limited the caller gets a {@link RateLimitExhaustedException}
 * carrying the last upstream error. The governor never absorbs a failure itself; the calling
 * service decides whether to keep stale data.
 */
@Component
@EnableConfigurationProperties(RateGovernorConfig.class)
public class RateGovernor {

    private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

    private final TokenBucket tokenBucket;
    private final Retry retry;
    private final int maxAttempts;

    @Autowired
    public RateGovernor(RateGovernorConfig rateGovernorConfig) {
        this(new TokenBucket(rateGovernorConfig.getTokensPerSecond(), rateGovernorConfig.getBurstCapacity()),
                rateGovernorConfig);
    }

    public RateGovernor(TokenBucket tokenBucket, RateGovernorConfig rateGovernorConfig) {
        this.tokenBucket = tokenBucket;
        this.maxAttempts = rateGovernorConfig.getMaxRetries() + 1;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        rateGovernorConfig.getInitialBackoff(), rateGovernorConfig.getBackoffMultiplier()))
                .retryOnException(RateLimitClassifier::isRateLimited)
                .build();
        this.retry = Retry.of("gateway", retryConfig);
        this.retry
                .getEventPublisher()
                .onRetry(event -> log.warn(
                        "Rate limited on '{}', retry {} of {} in {}ms",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        maxAttempts - 1,
                        event.getWaitInterval().toMillis()));

        log.info(
                "Rate governor: {} req/s, burst {}, {} retries from {}ms",
                rateGovernorConfig.getTokensPerSecond(),
                rateGovernorConfig.getBurstCapacity(),
                rateGovernorConfig.getMaxRetries(),
                rateGovernorConfig.getInitialBackoff().toMillis());
    }

    /**
     * Blocks until one permit is available. Used directly by callers that manage their own
     * failure handling.
     */
    public Duration acquire() throws InterruptedException {
        return tokenBucket.acquire();
    }

    /**
     * Runs {@code call} under the rate limit, retrying rate-limited failures with backoff.
     *
     * @param requestName short name of the vendor operation, used in logs and errors
     * @param call        the vendor call; invoked once per attempt, after a permit is taken
     * @return the call's result
     * @throws RateLimitExhaustedException if every attempt was rate limited
     * @throws GatewayException            for other upstream failures, or if interrupted
     */
    public <T> T execute(String requestName, Callable<T> call) {
        Callable<T> throttled = () -> {
            tokenBucket.acquire();
            return call.call();
        };
        try {
            return retry.executeCallable(throttled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(0, "Interrupted while waiting for rate permit: " + requestName, e);
        } catch (Exception e) {
            if (RateLimitClassifier.isRateLimited(e)) {
                log.error("Giving up on '{}' after {} rate-limited attempts", requestName, maxAttempts);
                throw new RateLimitExhaustedException(requestName, maxAttempts, e);
            }
            if (e instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new GatewayException(0, requestName + " failed: " + e.getMessage(), e);
        }
    }

    public int availableTokens() {
        return tokenBucket.availableTokens();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
