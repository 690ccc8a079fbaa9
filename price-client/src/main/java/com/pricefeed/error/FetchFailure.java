package com.pricefeed.error;

import com.pricefeed.model.RateLimitSignal;
import com.pricefeed.validation.Violation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single failed quote attempt, already classified.
 * Internal to the fetch pipeline; callers only ever see {@link PriceClientException}.
 */
public final class FetchFailure extends Exception {

    private final ErrorKind kind;
    private final Violation violation;
    private final int status;
    private final RateLimitSignal rateLimitSignal;

    FetchFailure(ErrorKind kind, String detail, Violation violation, int status,
                 RateLimitSignal rateLimitSignal, Throwable cause) {
        super(detail, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.violation = violation;
        this.status = status;
        this.rateLimitSignal = rateLimitSignal;
    }

    public static FetchFailure of(ErrorKind kind, String detail) {
        return new FetchFailure(kind, detail, null, -1, null, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<Violation> getViolation() {
        return Optional.ofNullable(violation);
    }

    /**
     * HTTP status of the failed attempt, or -1 if no response was received.
     */
    public int getStatus() {
        return status;
    }

    public Optional<RateLimitSignal> getRateLimitSignal() {
        return Optional.ofNullable(rateLimitSignal);
    }

    /**
     * Client errors (4xx other than 429) may still fall back to cache but are
     * not worth repeating.
     */
    public boolean isRetryable() {
        return kind.isRetryable() && !isClientError();
    }

    private boolean isClientError() {
        return kind == ErrorKind.TRANSIENT && status >= 400 && status < 500;
    }
}
