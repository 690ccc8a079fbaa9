package com.pricefeed.validation;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Verdict on one quote body: either a valid price, or the violation found with
 * a detail message suitable for an error report.
 */
public record ValidationResult(
    Status status,
    BigDecimal price,
    Violation violation,
    String detail
) {
    public enum Status {
        VALID,
        INCOMPLETE,
        DATA_INTEGRITY
    }

    public ValidationResult {
        Objects.requireNonNull(status, "status");
        if (status == Status.VALID && (price == null || price.signum() <= 0)) {
            throw new IllegalArgumentException("A valid result needs a positive price");
        }
        if (status != Status.VALID && violation == null) {
            throw new IllegalArgumentException("An invalid result needs a violation");
        }
    }

    public static ValidationResult valid(BigDecimal price) {
        return new ValidationResult(Status.VALID, price, null, "ok");
    }

    public static ValidationResult invalid(Violation violation, String detail) {
        return new ValidationResult(violation.status(), null, violation, detail);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public Optional<Violation> violationIfAny() {
        return Optional.ofNullable(violation);
    }
}
