package com.voucherpay.eventmodel;

import java.util.List;

/**
 * Outcome of {@link EventValidator#validate(AnalyticsEvent)}: every problem found, in the order
 * the checks ran. An event is valid when the list is empty.
 */
public record ValidationResult(List<String> errors) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /** All errors on one line, for log messages. Empty when valid. */
    public String summary() {
        return String.join("; ", errors);
    }
}
