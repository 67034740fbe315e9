package in.signalbridge.domain.trade;

/**
 * Trade direction.
 */
public enum TradeSide {
    BUY,
    SELL;

    /**
     * +1 for BUY, -1 for SELL. Multiplier for pnl.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    /**
     * Exchange wire value ("buy" / "sell").
     */
    public String wireValue() {
        return name().toLowerCase();
    }

    public static TradeSide parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side is required");
        }
        return switch (value.trim().toLowerCase()) {
            case "buy", "long" -> BUY;
            case "sell", "short" -> SELL;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }
}
