package com.pricefeed.error;

/**
 * Retries for a transient or incomplete failure were exhausted and no cached
 * price exists for the symbol.
 */
public final class NoDataAvailableException extends PriceClientException {

    private final ErrorKind lastFailureKind;

    public NoDataAvailableException(String symbol, String operation, int attempts,
                                    ErrorKind lastFailureKind, String message, Throwable cause) {
        super(lastFailureKind, symbol, operation, attempts, false, message, cause);
        this.lastFailureKind = lastFailureKind;
    }

    /**
     * Kind of the last attempt's failure: {@link ErrorKind#TRANSIENT} or {@link ErrorKind#INCOMPLETE}.
     */
    public ErrorKind getLastFailureKind() {
        return lastFailureKind;
    }
}
