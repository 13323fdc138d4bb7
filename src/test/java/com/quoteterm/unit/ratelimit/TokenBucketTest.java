package com.quoteterm.unit.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quoteterm.ratelimit.TokenBucket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for TokenBucket against a fake nano clock. The fake sleeper advances the clock instead of
 * blocking, so waits are measured exactly.
 */
class TokenBucketTest {

    private AtomicLong clock;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(1_000_000_000L);
        sleeps = new ArrayList<>();
    }

    private TokenBucket bucket(double tokensPerSecond, int burst) {
        return new TokenBucket(tokensPerSecond, burst, clock::get, duration -> {
            sleeps.add(duration);
            clock.addAndGet(duration.toNanos());
        });
    }

    private long sleptMillis() {
        return sleeps.stream().mapToLong(Duration::toNanos).sum() / 1_000_000;
    }

    @Nested
    @DisplayName("Burst")
    class Burst {

        @Test
        @DisplayName("starts full: the first burst of calls does not wait")
        void startsFull() throws InterruptedException {
            TokenBucket tokenBucket = bucket(10, 20);

            for (int i = 0; i < 20; i++) {
                assertThat(tokenBucket.acquire()).isEqualTo(Duration.ZERO);
            }

            assertThat(sleeps).isEmpty();
            assertThat(tokenBucket.availableTokens()).isZero();
        }

        @Test
        @DisplayName("30 calls at 10/s with burst 20: 20 immediate, the rest spaced 100ms apart")
        void thirtyCallsTakeAboutOneSecond() throws InterruptedException {
            TokenBucket tokenBucket = bucket(10, 20);
            long start = clock.get();

            for (int i = 0; i < 30; i++) {
                tokenBucket.acquire();
            }

            long elapsedMillis = (clock.get() - start) / 1_000_000;
            assertThat(elapsedMillis).isBetween(990L, 1010L);
            assertThat(sleptMillis()).isBetween(990L, 1010L);
        }

        @Test
        @DisplayName("burst of one allows exactly one call per refill interval")
        void burstOfOne() throws InterruptedException {
            TokenBucket tokenBucket = bucket(4, 1);

            tokenBucket.acquire();
            tokenBucket.acquire();
            tokenBucket.acquire();

            assertThat(sleptMillis()).isBetween(499L, 501L);
        }
    }

    @Nested
    @DisplayName("Refill")
    class Refill {

        @Test
        @DisplayName("idle time refills tokens up to the burst cap, never beyond")
        void refillIsCapped() throws InterruptedException {
            TokenBucket tokenBucket = bucket(10, 5);
            for (int i = 0; i < 5; i++) {
                tokenBucket.acquire();
            }
            assertThat(tokenBucket.availableTokens()).isZero();

            clock.addAndGet(Duration.ofMillis(300).toNanos());
            assertThat(tokenBucket.availableTokens()).isEqualTo(3);

            clock.addAndGet(Duration.ofMinutes(10).toNanos());
            assertThat(tokenBucket.availableTokens()).isEqualTo(5);
        }

        @Test
        @DisplayName("tryAcquire takes a token when available and refuses without waiting when empty")
        void tryAcquire() {
            TokenBucket tokenBucket = bucket(1, 2);

            assertThat(tokenBucket.tryAcquire()).isTrue();
            assertThat(tokenBucket.tryAcquire()).isTrue();
            assertThat(tokenBucket.tryAcquire()).isFalse();
            assertThat(sleeps).isEmpty();

            clock.addAndGet(Duration.ofSeconds(1).toNanos());
            assertThat(tokenBucket.tryAcquire()).isTrue();
        }

        @Test
        @DisplayName("acquire reports how long the caller waited")
        void acquireReportsWait() throws InterruptedException {
            TokenBucket tokenBucket = bucket(2, 1);
            tokenBucket.acquire();

            Duration waited = tokenBucket.acquire();

            assertThat(waited.toMillis()).isBetween(499L, 501L);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("rejects non-positive rate and empty burst")
        void rejectsBadParameters() {
            assertThatThrownBy(() -> new TokenBucket(0, 5)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new TokenBucket(10, 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent callers never receive more permits than the bucket holds")
        void concurrentCallersShareTheBudget() throws InterruptedException {
            TokenBucket tokenBucket = new TokenBucket(1, 10);
            AtomicLong granted = new AtomicLong();
            List<Thread> threads = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                Thread thread = new Thread(() -> {
                    for (int j = 0; j < 5; j++) {
                        if (tokenBucket.tryAcquire()) {
                            granted.incrementAndGet();
                        }
                    }
                });
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            // 10 from the initial burst, plus at most a token or two of refill during the run
            assertThat(granted.get()).isBetween(1L, 12L);
        }

        @Test
        @DisplayName("reading the available tokens does not wait behind a caller sleeping for a refill")
        void availableTokensDoesNotBlock() throws Exception {
            CountDownLatch sleeping = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            TokenBucket tokenBucket = new TokenBucket(10, 1, clock::get, duration -> {
                sleeping.countDown();
                release.await();
                clock.addAndGet(duration.toNanos());
            });
            tokenBucket.acquire();
            Thread waiter = new Thread(() -> {
                try {
                    tokenBucket.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();
            assertThat(sleeping.await(5, TimeUnit.SECONDS)).isTrue();

            int available = CompletableFuture.supplyAsync(tokenBucket::availableTokens).get(1, TimeUnit.SECONDS);

            assertThat(available).isZero();
            release.countDown();
            waiter.join(5_000);
            assertThat(waiter.isAlive()).isFalse();
        }
    }
}
