package com.pricefeed.error;

/**
 * Closed set of failure kinds. The kind alone decides whether a failure may be
 * retried and whether a cached price may stand in for it.
 */
public enum ErrorKind {
    /** Network trouble, timeouts, 5xx: uncorrelated with data correctness. */
    TRANSIENT(true, true),
    /** Structurally incomplete quote (missing or null price). */
    INCOMPLETE(true, true),
    /** The payload itself is wrong. Never retried, never masked. */
    DATA_INTEGRITY(false, false),
    /** Backpressure from the quote source, handled by the rate-limit policy. */
    RATE_LIMITED(false, false),
    /** Caller passed an unusable symbol. Rejected before any network call. */
    INVALID_INPUT(false, false);

    private final boolean retryable;
    private final boolean cacheFallbackPermitted;

    ErrorKind(boolean retryable, boolean cacheFallbackPermitted) {
        this.retryable = retryable;
        this.cacheFallbackPermitted = cacheFallbackPermitted;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean permitsCacheFallback() {
        return cacheFallbackPermitted;
    }
}
