package in.signalbridge.domain.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation pass: either passed, or failed with one or more
 * human-readable reasons.
 */
public record ValidationResult(boolean passed, List<String> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(String error) {
        return new ValidationResult(false, List.of(error));
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    /**
     * All reasons joined for logging and rejection records.
     */
    public String message() {
        return String.join("; ", errors);
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final List<String> errors = new ArrayList<>();

        public Builder addError(String error) {
            errors.add(error);
            return this;
        }

        public Builder check(boolean condition, String error) {
            if (!condition) {
                errors.add(error);
            }
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return errors.isEmpty() ? pass() : fail(errors);
        }
    }
}
