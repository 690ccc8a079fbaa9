package com.pricefeed.client;

import com.pricefeed.error.ErrorKind;
import com.pricefeed.model.PriceRecord;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Price handed back by a fetch.
 *
 * A degraded result was served from cache because the live source failed
 * transiently; {@code degradedCause} says why, and {@code observedAt} says how
 * old the price is. Callers should alert on degraded results and decide for
 * themselves how stale is too stale.
 */
public record PriceResult(
    String symbol,
    BigDecimal price,
    Instant observedAt,
    boolean degraded,
    ErrorKind degradedCause
) {
    public static PriceResult fresh(PriceRecord record) {
        return new PriceResult(record.symbol(), record.price(), record.observedAt(), false, null);
    }

    public static PriceResult fromCache(PriceRecord record, ErrorKind cause) {
        return new PriceResult(record.symbol(), record.price(), record.observedAt(), true, cause);
    }

    public Optional<ErrorKind> degradationCause() {
        return Optional.ofNullable(degradedCause);
    }

    public Duration age(Clock clock) {
        return Duration.between(observedAt, clock.instant());
    }
}
