package in.signalbridge.domain.trade;

/**
 * Why an ACTIVE trade was closed.
 */
public enum CloseReason {
    STOP_LOSS("stop_loss"),
    TAKE_PROFIT("take_profit"),
    MANUAL("manual");

    private final String code;

    CloseReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CloseReason fromCode(String code) {
        for (CloseReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code) || reason.name().equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown close reason: " + code);
    }
}
