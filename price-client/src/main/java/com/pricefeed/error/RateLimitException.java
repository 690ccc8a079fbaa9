package com.pricefeed.error;

import java.util.OptionalInt;

/**
 * The quote source is rate limiting us: either fail-fast mode is on, or the
 * single deferred attempt after waiting was rate limited again.
 */
public final class RateLimitException extends PriceClientException {

    private final OptionalInt retryAfterSeconds;

    public RateLimitException(String symbol, String operation, int attempts, boolean cachedValueAvailable,
                              OptionalInt retryAfterSeconds, String message, Throwable cause) {
        super(ErrorKind.RATE_LIMITED, symbol, operation, attempts, cachedValueAvailable, message, cause);
        this.retryAfterSeconds = retryAfterSeconds == null ? OptionalInt.empty() : retryAfterSeconds;
    }

    public OptionalInt getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
