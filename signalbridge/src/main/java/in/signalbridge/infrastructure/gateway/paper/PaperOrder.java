package in.signalbridge.infrastructure.gateway.paper;

import in.signalbridge.domain.trade.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Simulated bracket order held by the paper ledger.
 */
public record PaperOrder(
    String orderId,
    long productId,
    String symbol,
    TradeSide side,
    BigDecimal size,
    BigDecimal limitPrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    String clientOrderId,
    PaperOrderState state,
    Instant createdAt,
    Instant updatedAt
) {
    public PaperOrder withState(PaperOrderState newState) {
        return new PaperOrder(orderId, productId, symbol, side, size, limitPrice, stopLoss, takeProfit,
            clientOrderId, newState, createdAt, Instant.now());
    }

    /**
     * Size signed by side: positive long, negative short.
     */
    public BigDecimal signedSize() {
        return side == TradeSide.BUY ? size : size.negate();
    }
}
