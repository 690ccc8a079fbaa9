package com.pricefeed.metrics;

import com.pricefeed.error.ErrorKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for the price client.
 *
 * Degraded results are counted separately from fresh ones so a dashboard can
 * alert when fetches are being served from cache.
 */
public final class PriceClientMetrics {

    private final MeterRegistry registry;

    public PriceClientMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAttempt(String symbol) {
        registry.counter("price.fetch.attempts", "symbol", symbol).increment();
    }

    public void recordSuccess(String symbol) {
        registry.counter("price.fetch.success", "symbol", symbol).increment();
    }

    public void recordDegraded(String symbol, ErrorKind cause) {
        registry.counter("price.fetch.degraded",
            "symbol", symbol,
            "cause", cause.name()).increment();
    }

    public void recordFailure(String symbol, ErrorKind kind) {
        registry.counter("price.fetch.failure",
            "symbol", symbol,
            "kind", kind.name()).increment();
    }

    public void recordLatency(Duration duration) {
        Timer.builder("price.fetch.latency")
            .register(registry)
            .record(duration);
    }
}
