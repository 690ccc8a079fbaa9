package com.pricefeed.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable last-known-good price for one symbol.
 * Only created from a validated quote, so the price is always strictly positive.
 */
public record PriceRecord(
    String symbol,
    BigDecimal price,
    Instant observedAt
) {
    public PriceRecord {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(observedAt, "observedAt");
        if (symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must not be blank");
        }
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive for " + symbol + ": " + price);
        }
    }

    /**
     * True if this record was observed after the other one.
     */
    public boolean isNewerThan(PriceRecord other) {
        return observedAt.isAfter(other.observedAt);
    }
}
