package com.pricefeed.retry;

import com.pricefeed.error.FetchFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential-backoff retry for classified failures.
 *
 * Only failures whose kind is retryable are attempted again; anything else is
 * rethrown at once, with no sleep. With {@code maxRetries = N} a persistently
 * failing call runs exactly N+1 times and the last failure is rethrown.
 * Knows nothing about HTTP.
 */
public class RetryController {
    private static final Logger logger = LoggerFactory.getLogger(RetryController.class);

    // 2^30 is already far beyond any sane backoff
    private static final int MAX_BACKOFF_EXPONENT = 30;

    private final Sleeper sleeper;

    public RetryController() {
        this(Sleeper.THREAD_SLEEP);
    }

    public RetryController(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Execute an operation, retrying retryable failures.
     *
     * @param operation   name for logging
     * @param call        the attempt to run
     * @param maxRetries  extra attempts allowed after the first
     * @param backoffBase delay before the first retry; doubles for each further retry
     * @return result of the first successful attempt
     * @throws FetchFailure         the non-retryable failure, or the last one once retries are exhausted
     * @throws InterruptedException if interrupted while backing off or inside an attempt
     */
    public <T> T execute(String operation, RetryableCall<T> call, int maxRetries, Duration backoffBase)
            throws FetchFailure, InterruptedException {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        Objects.requireNonNull(backoffBase, "backoffBase");

        int maxAttempts = maxRetries + 1;
        for (int attempt = 0; ; attempt++) {
            try {
                T result = call.call();
                if (attempt > 0) {
                    logger.info("✅ {} succeeded on attempt {}/{}", operation, attempt + 1, maxAttempts);
                }
                return result;
            } catch (FetchFailure failure) {
                if (!failure.isRetryable()) {
                    logger.debug("{} failed with non-retryable {}: {}",
                        operation, failure.getKind(), failure.getMessage());
                    throw failure;
                }
                if (attempt >= maxRetries) {
                    logger.error("❌ {} failed after {} attempts: {}", operation, maxAttempts, failure.getMessage());
                    throw failure;
                }
                Duration delay = backoffFor(backoffBase, attempt);
                logger.warn("⚠️ {} failed (attempt {}/{}): {} - Retrying in {}ms",
                    operation, attempt + 1, maxAttempts, failure.getMessage(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Backoff before the retry that follows attempt {@code attemptIndex} (0-based).
     */
    public static Duration backoffFor(Duration backoffBase, int attemptIndex) {
        int exponent = Math.min(attemptIndex, MAX_BACKOFF_EXPONENT);
        return backoffBase.multipliedBy(1L << exponent);
    }
}
