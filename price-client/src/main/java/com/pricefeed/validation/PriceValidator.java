package com.pricefeed.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;

/**
 * Checks a raw quote body for the requested symbol.
 *
 * Two payload shapes are accepted:
 * <pre>
 *   [{"name": "BTC", "price": 45000.50}, {"name": "ETH", "price": 3000.0}]
 *   {"symbol": "BTC", "price": 45000.50}
 * </pre>
 * Checks run in a fixed order and the first violation wins. Stateless and
 * thread-safe.
 */
public final class PriceValidator {

    private static final String PRICE_FIELD = "price";
    private static final String[] SYMBOL_FIELDS = {"symbol", "name"};
    private static final int MAX_INTEGER_DIGITS = 15;
    private static final int MAX_FRACTION_DIGITS = 18;

    private final ObjectMapper objectMapper;

    public PriceValidator() {
        // Floats as BigDecimal so "45000.50" is not rounded through a double
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ValidationResult validate(String rawBody, String requestedSymbol) {
        JsonNode root;
        try {
            root = rawBody == null ? null : objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid(Violation.MALFORMED_PAYLOAD,
                "Malformed quote payload for " + requestedSymbol + ": " + e.getOriginalMessage());
        }
        if (root == null || !(root.isObject() || root.isArray())) {
            return ValidationResult.invalid(Violation.MALFORMED_PAYLOAD,
                "Quote payload for " + requestedSymbol + " is not a JSON object or array");
        }

        JsonNode quote = root.isArray() ? findQuote(root, requestedSymbol) : root;
        if (quote == null) {
            return ValidationResult.invalid(Violation.MISSING_PRICE,
                "Symbol " + requestedSymbol + " not found in quote list");
        }

        if (!quote.has(PRICE_FIELD)) {
            return ValidationResult.invalid(Violation.MISSING_PRICE,
                "Price field missing for symbol " + requestedSymbol);
        }
        JsonNode priceNode = quote.get(PRICE_FIELD);
        if (priceNode.isNull()) {
            return ValidationResult.invalid(Violation.NULL_PRICE,
                "Price is null for symbol " + requestedSymbol);
        }
        if (!priceNode.isNumber()) {
            return ValidationResult.invalid(Violation.NON_NUMERIC_PRICE,
                "Invalid price format for " + requestedSymbol + ": " + priceNode);
        }
        BigDecimal price = priceNode.decimalValue();
        if (price.signum() <= 0) {
            return ValidationResult.invalid(Violation.NON_POSITIVE_PRICE,
                "Invalid price value for " + requestedSymbol + ": " + price + " (must be positive)");
        }
        if (!withinRange(price)) {
            return ValidationResult.invalid(Violation.PRICE_OUT_OF_RANGE,
                "Price for " + requestedSymbol + " out of range: " + price);
        }

        String returnedSymbol = symbolOf(quote);
        if (returnedSymbol != null && !returnedSymbol.equals(requestedSymbol)) {
            return ValidationResult.invalid(Violation.SYMBOL_MISMATCH,
                "Quote symbol mismatch: requested " + requestedSymbol + " but received " + returnedSymbol);
        }

        return ValidationResult.valid(price);
    }

    /**
     * At most 15 integer and 18 fraction digits. Exponent literals such as
     * {@code 1e999999999} parse fine but must never be formatted or cached.
     */
    private boolean withinRange(BigDecimal price) {
        BigDecimal stripped = price.stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        return integerDigits <= MAX_INTEGER_DIGITS && stripped.scale() <= MAX_FRACTION_DIGITS;
    }

    private JsonNode findQuote(JsonNode quotes, String symbol) {
        for (JsonNode entry : quotes) {
            if (entry.isObject() && symbol.equals(symbolOf(entry))) {
                return entry;
            }
        }
        return null;
    }

    private String symbolOf(JsonNode quote) {
        for (String field : SYMBOL_FIELDS) {
            JsonNode value = quote.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
