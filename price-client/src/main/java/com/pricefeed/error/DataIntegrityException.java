package com.pricefeed.error;

import com.pricefeed.validation.Violation;

import java.util.Optional;

/**
 * The quote source returned data that must not be trusted: a malformed body,
 * a non-numeric, zero or negative price, or a quote for another symbol.
 * Trading decisions depending on this symbol should be blocked.
 */
public final class DataIntegrityException extends PriceClientException {

    private final Violation violation;

    public DataIntegrityException(String symbol, String operation, int attempts, boolean cachedValueAvailable,
                                  Violation violation, String message, Throwable cause) {
        super(ErrorKind.DATA_INTEGRITY, symbol, operation, attempts, cachedValueAvailable, message, cause);
        this.violation = violation;
    }

    public Optional<Violation> getViolation() {
        return Optional.ofNullable(violation);
    }
}
