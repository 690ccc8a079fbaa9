package com.pricefeed.error;

/**
 * Null or blank symbol. Thrown before any network interaction.
 */
public final class InvalidSymbolException extends PriceClientException {

    public InvalidSymbolException(String symbol, String operation) {
        super(ErrorKind.INVALID_INPUT, symbol, operation, 0, false,
            "Invalid symbol: " + (symbol == null ? "null" : "'" + symbol + "'"), null);
    }
}
