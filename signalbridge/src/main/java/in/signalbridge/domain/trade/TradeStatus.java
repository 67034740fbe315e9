package in.signalbridge.domain.trade;

/**
 * Trade lifecycle states.
 *
 * PENDING -> ACTIVE -> CLOSED, PENDING -> FAILED. CLOSED and FAILED are terminal.
 */
public enum TradeStatus {
    PENDING,
    ACTIVE,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
