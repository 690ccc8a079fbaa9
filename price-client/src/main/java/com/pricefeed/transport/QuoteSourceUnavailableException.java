package com.pricefeed.transport;

import java.io.IOException;

/**
 * Request was not sent because the local circuit breaker is open or no request
 * permit became available in time.
 */
public class QuoteSourceUnavailableException extends IOException {

    public QuoteSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
