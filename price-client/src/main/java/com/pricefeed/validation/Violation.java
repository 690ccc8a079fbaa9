package com.pricefeed.validation;

/**
 * The distinct ways a quote body can fail validation, in the order they are checked.
 */
public enum Violation {
    MALFORMED_PAYLOAD(ValidationResult.Status.DATA_INTEGRITY),
    MISSING_PRICE(ValidationResult.Status.INCOMPLETE),
    NULL_PRICE(ValidationResult.Status.INCOMPLETE),
    NON_NUMERIC_PRICE(ValidationResult.Status.DATA_INTEGRITY),
    NON_POSITIVE_PRICE(ValidationResult.Status.DATA_INTEGRITY),
    PRICE_OUT_OF_RANGE(ValidationResult.Status.DATA_INTEGRITY),
    SYMBOL_MISMATCH(ValidationResult.Status.DATA_INTEGRITY);

    private final ValidationResult.Status status;

    Violation(ValidationResult.Status status) {
        this.status = status;
    }

    public ValidationResult.Status status() {
        return status;
    }
}
