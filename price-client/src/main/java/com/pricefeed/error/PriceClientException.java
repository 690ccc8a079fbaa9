package com.pricefeed.error;

import java.util.Objects;

/**
 * Base of every error the price client propagates to callers.
 *
 * Carries enough context for the caller to decide whether to halt trading,
 * alert, or continue in degraded mode: the symbol, the operation, how many
 * quote attempts were made and whether a cached price existed at the time.
 */
public abstract sealed class PriceClientException extends RuntimeException
        permits InvalidSymbolException, DataIntegrityException, NoDataAvailableException, RateLimitException {

    private final ErrorKind kind;
    private final String symbol;
    private final String operation;
    private final int attempts;
    private final boolean cachedValueAvailable;

    protected PriceClientException(ErrorKind kind, String symbol, String operation, int attempts,
                                   boolean cachedValueAvailable, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.symbol = symbol;
        this.operation = operation;
        this.attempts = attempts;
        this.cachedValueAvailable = cachedValueAvailable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Requested symbol; may be null for {@link InvalidSymbolException}.
     */
    public String getSymbol() {
        return symbol;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isCachedValueAvailable() {
        return cachedValueAvailable;
    }
}
