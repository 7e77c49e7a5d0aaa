package com.chronoline.timeline.core.validate;

import java.util.Objects;

/**
 * Outcome of validating one candidate event or source. A failure carries the
 * first violation found and a reason naming the offending field.
 */
public record ValidationResult(boolean ok, Violation violation, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public ValidationResult {
        if (!ok) {
            Objects.requireNonNull(violation, "violation");
            Objects.requireNonNull(reason, "reason");
        }
    }

    public static ValidationResult valid() {
        return OK;
    }

    public static ValidationResult fail(Violation violation, String reason) {
        return new ValidationResult(false, violation, reason);
    }

    @Override
    public String toString() {
        return ok ? "OK" : violation + ": " + reason;
    }
}
