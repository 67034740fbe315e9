package in.signalbridge.domain.common;

/**
 * Validation error codes for trade validation.
 */
public enum ValidationErrorCode {
    // Required fields
    SYMBOL_REQUIRED("Symbol is required"),
    SIDE_REQUIRED("Side is required"),
    QUANTITY_REQUIRED("Valid quantity is required"),
    ENTRY_PRICE_REQUIRED("Valid entry price is required"),
    STOP_LOSS_REQUIRED("Valid stop loss is required"),
    TAKE_PROFIT_REQUIRED("Valid take profit is required"),

    // Price ordering
    STOP_LOSS_WRONG_SIDE("Stop loss is on the wrong side of the entry price"),
    TAKE_PROFIT_WRONG_SIDE("Take profit is on the wrong side of the entry price"),

    // Risk
    RISK_REWARD_TOO_LOW("Risk/reward ratio too low (minimum 0.5:1)");

    private final String message;

    ValidationErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
