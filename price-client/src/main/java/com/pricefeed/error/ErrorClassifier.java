package com.pricefeed.error;

import com.pricefeed.model.QuoteResponse;
import com.pricefeed.validation.ValidationResult;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Single policy table mapping every failure the pipeline can meet onto an
 * {@link ErrorKind}. Transport failures, HTTP statuses and validation verdicts
 * all go through here, so a missing price and a 503 are treated by the same
 * rules wherever they are detected.
 *
 * <pre>
 *   I/O error, timeout, source unavailable  TRANSIENT
 *   HTTP 429                                RATE_LIMITED
 *   any other non-2xx status                TRANSIENT (4xx not retried)
 *   missing / null price                    INCOMPLETE
 *   malformed, non-numeric, &lt;= 0,
 *   out of range, mismatch                  DATA_INTEGRITY
 *   null / blank symbol                     INVALID_INPUT
 * </pre>
 */
public class ErrorClassifier {

    public ErrorKind classify(IOException transportError) {
        return ErrorKind.TRANSIENT;
    }

    public ErrorKind classify(QuoteResponse response) {
        if (response.isSuccessful()) {
            throw new IllegalArgumentException("Status " + response.status() + " is not a failure");
        }
        if (response.isRateLimited()) {
            return ErrorKind.RATE_LIMITED;
        }
        return ErrorKind.TRANSIENT;
    }

    public ErrorKind classify(ValidationResult result) {
        return switch (result.status()) {
            case VALID -> throw new IllegalArgumentException("A valid quote is not a failure");
            case INCOMPLETE -> ErrorKind.INCOMPLETE;
            case DATA_INTEGRITY -> ErrorKind.DATA_INTEGRITY;
        };
    }

    /**
     * INVALID_INPUT for a null or blank symbol, null when the symbol may be fetched.
     */
    public ErrorKind classifySymbol(String symbol) {
        return symbol == null || symbol.isBlank() ? ErrorKind.INVALID_INPUT : null;
    }

    public FetchFailure failureFor(String symbol, IOException transportError) {
        String reason = transportError instanceof HttpTimeoutException ? "timed out" : "transport error";
        return new FetchFailure(classify(transportError),
            "Quote request for " + symbol + " " + reason + ": " + transportError.getMessage(),
            null, -1, null, transportError);
    }

    public FetchFailure failureFor(String symbol, QuoteResponse response) {
        ErrorKind kind = classify(response);
        String detail = kind == ErrorKind.RATE_LIMITED
            ? "Quote source rate limited request for " + symbol
            : "Quote source returned HTTP " + response.status() + " for " + symbol;
        return new FetchFailure(kind, detail, null, response.status(), response.rateLimitSignal(), null);
    }

    public FetchFailure failureFor(ValidationResult result) {
        return new FetchFailure(classify(result), result.detail(), result.violation(), 200, null, null);
    }
}
