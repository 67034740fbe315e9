package in.signalbridge.domain.exception;

import in.signalbridge.domain.trade.TradeStatus;

/**
 * A close was requested for a trade that is no longer ACTIVE (another close won).
 */
public class ConcurrentCloseException extends RuntimeException {

    private final long tradeId;
    private final TradeStatus currentStatus;

    public ConcurrentCloseException(long tradeId, TradeStatus currentStatus) {
        super(String.format("Trade %d is already %s, close ignored", tradeId, currentStatus));
        this.tradeId = tradeId;
        this.currentStatus = currentStatus;
    }

    public long getTradeId() {
        return tradeId;
    }

    public TradeStatus getCurrentStatus() {
        return currentStatus;
    }
}
