package com.pricefeed.model;

import java.util.OptionalInt;

/**
 * Backpressure signal from the quote source (HTTP 429).
 * The retry-after hint is absent when the source sent none or an unparseable one.
 */
public record RateLimitSignal(OptionalInt retryAfterSeconds) {

    public RateLimitSignal {
        if (retryAfterSeconds == null) {
            retryAfterSeconds = OptionalInt.empty();
        }
        if (retryAfterSeconds.isPresent() && retryAfterSeconds.getAsInt() <= 0) {
            throw new IllegalArgumentException("Retry-after must be positive: " + retryAfterSeconds.getAsInt());
        }
    }

    public static RateLimitSignal retryAfter(int seconds) {
        return new RateLimitSignal(OptionalInt.of(seconds));
    }

    public static RateLimitSignal unspecified() {
        return new RateLimitSignal(OptionalInt.empty());
    }

    /**
     * Parse a Retry-After header value given in seconds.
     * Missing, non-numeric or non-positive values produce an unspecified signal.
     */
    public static RateLimitSignal fromHeader(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return unspecified();
        }
        try {
            int seconds = Integer.parseInt(headerValue.trim());
            return seconds > 0 ? retryAfter(seconds) : unspecified();
        } catch (NumberFormatException e) {
            return unspecified();
        }
    }
}
