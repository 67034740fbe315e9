package in.signalbridge.domain.exception;

public class TradeNotFoundException extends RuntimeException {

    private final long tradeId;

    public TradeNotFoundException(long tradeId) {
        super("Trade not found: " + tradeId);
        this.tradeId = tradeId;
    }

    public long getTradeId() {
        return tradeId;
    }
}
