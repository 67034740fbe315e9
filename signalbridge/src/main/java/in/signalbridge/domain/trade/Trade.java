package in.signalbridge.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trade - the unit of work from signal to close.
 *
 * Immutable: every state transition returns a new instance. The transition
 * methods enforce the lifecycle and throw IllegalStateException otherwise:
 * <pre>
 *   PENDING -> ACTIVE  (activate, requires an exchange order id)
 *   PENDING -> FAILED  (fail)
 *   ACTIVE  -> CLOSED  (close)
 * </pre>
 * CLOSED and FAILED are terminal.
 */
public record Trade(
    Long id,

    // Fixed at creation
    String symbol,
    TradeSide side,
    BigDecimal quantity,
    BigDecimal signalEntryPrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    String signalPayload,
    boolean simulated,

    // Lifecycle
    TradeStatus status,
    BigDecimal actualEntryPrice,
    String exchangeOrderId,
    BigDecimal pnl,
    BigDecimal fees,
    String failReason,
    BigDecimal exitPrice,
    CloseReason closeReason,

    // Timestamps
    Instant createdAt,
    Instant openTime,
    Instant closeTime
) {
    /**
     * New PENDING trade built from a signal. No id until persisted.
     */
    public static Trade pending(TradeSignal signal, String signalPayload, boolean simulated, Instant createdAt) {
        return new Trade(
            null,
            signal.symbol(), signal.side(), signal.quantity(), signal.entryPrice(),
            signal.stopLoss(), signal.takeProfit(), signalPayload, simulated,
            TradeStatus.PENDING, null, null, null, BigDecimal.ZERO, null, null, null,
            createdAt, null, null);
    }

    public boolean isPending() {
        return status == TradeStatus.PENDING;
    }

    public boolean isActive() {
        return status == TradeStatus.ACTIVE;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Entry price used for pnl: the fill price once known, otherwise the signal price.
     */
    public BigDecimal effectiveEntryPrice() {
        return actualEntryPrice != null ? actualEntryPrice : signalEntryPrice;
    }

    /**
     * pnl = (exit - entry) * qty * (+1 BUY, -1 SELL).
     */
    public BigDecimal computePnl(BigDecimal exit) {
        return exit.subtract(effectiveEntryPrice())
            .multiply(quantity)
            .multiply(BigDecimal.valueOf(side.sign()));
    }

    public Trade withId(long newId) {
        return new Trade(
            newId, symbol, side, quantity, signalEntryPrice, stopLoss, takeProfit, signalPayload, simulated,
            status, actualEntryPrice, exchangeOrderId, pnl, fees, failReason, exitPrice, closeReason,
            createdAt, openTime, closeTime);
    }

    public Trade withSymbol(String newSymbol) {
        requireStatus(TradeStatus.PENDING, "change symbol");
        return new Trade(
            id, newSymbol, side, quantity, signalEntryPrice, stopLoss, takeProfit, signalPayload, simulated,
            status, actualEntryPrice, exchangeOrderId, pnl, fees, failReason, exitPrice, closeReason,
            createdAt, openTime, closeTime);
    }

    /**
     * Replace stop-loss / take-profit (validator auto-swap). PENDING only.
     */
    public Trade withBrackets(BigDecimal newStopLoss, BigDecimal newTakeProfit) {
        requireStatus(TradeStatus.PENDING, "change brackets");
        return new Trade(
            id, symbol, side, quantity, signalEntryPrice, newStopLoss, newTakeProfit, signalPayload, simulated,
            status, actualEntryPrice, exchangeOrderId, pnl, fees, failReason, exitPrice, closeReason,
            createdAt, openTime, closeTime);
    }

    /**
     * PENDING -> ACTIVE once the exchange has confirmed the order.
     */
    public Trade activate(String orderId, BigDecimal fillPrice, Instant openedAt) {
        requireStatus(TradeStatus.PENDING, "activate");
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalStateException("Cannot activate trade " + id + " without an exchange order id");
        }
        if (exchangeOrderId != null) {
            throw new IllegalStateException("Trade " + id + " already has exchange order " + exchangeOrderId);
        }
        return new Trade(
            id, symbol, side, quantity, signalEntryPrice, stopLoss, takeProfit, signalPayload, simulated,
            TradeStatus.ACTIVE, fillPrice, orderId, pnl, fees, failReason, exitPrice, closeReason,
            createdAt, openedAt, closeTime);
    }

    /**
     * PENDING -> FAILED with a human-readable reason.
     */
    public Trade fail(String reason) {
        requireStatus(TradeStatus.PENDING, "fail");
        return new Trade(
            id, symbol, side, quantity, signalEntryPrice, stopLoss, takeProfit, signalPayload, simulated,
            TradeStatus.FAILED, actualEntryPrice, exchangeOrderId, pnl, fees, reason, exitPrice, closeReason,
            createdAt, openTime, closeTime);
    }

    /**
     * ACTIVE -> CLOSED. pnl is computed from the effective entry price.
     */
    public Trade close(BigDecimal exit, CloseReason reason, Instant closedAt) {
        requireStatus(TradeStatus.ACTIVE, "close");
        return new Trade(
            id, symbol, side, quantity, signalEntryPrice, stopLoss, takeProfit, signalPayload, simulated,
            TradeStatus.CLOSED, actualEntryPrice, exchangeOrderId, computePnl(exit), fees, failReason,
            exit, reason, createdAt, openTime, closedAt);
    }

    private void requireStatus(TradeStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s trade %s in status %s (expected %s)", action, id, status, expected));
        }
    }
}
