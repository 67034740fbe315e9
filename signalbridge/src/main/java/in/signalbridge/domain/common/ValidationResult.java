package in.signalbridge.domain.common;

import in.signalbridge.domain.trade.Trade;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of trade validation.
 *
 * trade is the trade to carry forward: it includes any stop-loss / take-profit
 * swap the validator applied, so callers never execute the uncorrected input.
 */
public record ValidationResult(
    boolean valid,
    List<ValidationError> errors,
    Trade trade,
    boolean bracketsSwapped
) {
    public static ValidationResult pass(Trade trade, boolean swapped) {
        return new ValidationResult(true, List.of(), trade, swapped);
    }

    public static ValidationResult fail(Trade trade, List<ValidationError> errors) {
        return new ValidationResult(false, List.copyOf(errors), trade, false);
    }

    /**
     * Errors joined into one reason string.
     */
    public String reason() {
        return errors.stream().map(ValidationError::message).collect(Collectors.joining("; "));
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final List<ValidationError> errors = new ArrayList<>();
        private Trade trade;
        private boolean swapped;

        public Builder trade(Trade trade) { this.trade = trade; return this; }
        public Builder swapped(boolean swapped) { this.swapped = swapped; return this; }

        public Builder addError(ValidationErrorCode code) {
            errors.add(ValidationError.of(code));
            return this;
        }

        public Builder addError(ValidationErrorCode code, String field, String detail) {
            errors.add(ValidationError.of(code, field, detail));
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return errors.isEmpty() ? pass(trade, swapped) : fail(trade, errors);
        }
    }
}
