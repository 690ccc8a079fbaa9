package com.pricefeed.model;

import java.util.Optional;

/**
 * Raw result of one quote request, as handed over by the transport.
 */
public record QuoteResponse(
    int status,
    String body,
    RateLimitSignal rateLimitSignal
) {
    public static final int TOO_MANY_REQUESTS = 429;

    public static QuoteResponse ok(String body) {
        return new QuoteResponse(200, body, null);
    }

    public static QuoteResponse status(int status) {
        return new QuoteResponse(status, "", null);
    }

    public static QuoteResponse rateLimited(RateLimitSignal signal) {
        return new QuoteResponse(TOO_MANY_REQUESTS, "", signal);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == TOO_MANY_REQUESTS;
    }

    public boolean isServerError() {
        return status >= 500 && status < 600;
    }

    public Optional<RateLimitSignal> signal() {
        return Optional.ofNullable(rateLimitSignal);
    }
}
