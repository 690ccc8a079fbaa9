package com.pricefeed.transport;

import com.pricefeed.model.QuoteResponse;

import java.io.IOException;

/**
 * Outbound seam to the remote quote source. Implementations own connection
 * handling; the price client only consumes what they return.
 */
@FunctionalInterface
public interface QuoteTransport {

    /**
     * Request the raw quote for a symbol.
     *
     * @return the response, whatever its status; non-2xx statuses are not exceptions
     * @throws IOException          on network failure or timeout
     * @throws InterruptedException if interrupted while waiting for the response
     */
    QuoteResponse requestQuote(String symbol) throws IOException, InterruptedException;
}
