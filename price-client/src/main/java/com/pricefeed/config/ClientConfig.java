package com.pricefeed.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call tuning knobs of the price client. Immutable, passed into every fetch.
 *
 * @param maxRetries           extra attempts after the first one for transient failures
 * @param backoffBase          sleep before retry {@code i} is {@code backoffBase * 2^i}
 * @param failFastOnRateLimit  fail immediately on 429 instead of waiting once
 * @param defaultRateLimitWait wait used when a 429 carries no usable Retry-After
 */
public record ClientConfig(
    int maxRetries,
    Duration backoffBase,
    boolean failFastOnRateLimit,
    Duration defaultRateLimitWait
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofMillis(300);
    public static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(60);

    public ClientConfig {
        Objects.requireNonNull(backoffBase, "backoffBase");
        Objects.requireNonNull(defaultRateLimitWait, "defaultRateLimitWait");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (backoffBase.isNegative() || backoffBase.isZero()) {
            throw new IllegalArgumentException("backoffBase must be positive: " + backoffBase);
        }
        if (defaultRateLimitWait.isNegative()) {
            throw new IllegalArgumentException("defaultRateLimitWait must not be negative: " + defaultRateLimitWait);
        }
    }

    public static ClientConfig defaults() {
        return new ClientConfig(DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE, false, DEFAULT_RATE_LIMIT_WAIT);
    }

    public ClientConfig withMaxRetries(int maxRetries) {
        return new ClientConfig(maxRetries, backoffBase, failFastOnRateLimit, defaultRateLimitWait);
    }

    public ClientConfig withBackoffBase(Duration backoffBase) {
        return new ClientConfig(maxRetries, backoffBase, failFastOnRateLimit, defaultRateLimitWait);
    }

    public ClientConfig withFailFastOnRateLimit(boolean failFastOnRateLimit) {
        return new ClientConfig(maxRetries, backoffBase, failFastOnRateLimit, defaultRateLimitWait);
    }

    public ClientConfig withDefaultRateLimitWait(Duration defaultRateLimitWait) {
        return new ClientConfig(maxRetries, backoffBase, failFastOnRateLimit, defaultRateLimitWait);
    }
}
