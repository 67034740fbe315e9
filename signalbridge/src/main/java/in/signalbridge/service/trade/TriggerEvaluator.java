package in.signalbridge.service.trade;

import in.signalbridge.domain.trade.CloseReason;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeSide;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Stop-loss / take-profit trigger check. Pure, no I/O.
 *
 * <pre>
 *   BUY:  price <= SL -> STOP_LOSS,  price >= TP -> TAKE_PROFIT
 *   SELL: price >= SL -> STOP_LOSS,  price <= TP -> TAKE_PROFIT
 * </pre>
 * Stop-loss is checked first.
 */
public final class TriggerEvaluator {

    private TriggerEvaluator() {}

    public static Optional<CloseReason> evaluate(Trade trade, BigDecimal price) {
        if (trade.side() == TradeSide.BUY) {
            if (trade.stopLoss() != null && price.compareTo(trade.stopLoss()) <= 0) {
                return Optional.of(CloseReason.STOP_LOSS);
            }
            if (trade.takeProfit() != null && price.compareTo(trade.takeProfit()) >= 0) {
                return Optional.of(CloseReason.TAKE_PROFIT);
            }
        } else {
            if (trade.stopLoss() != null && price.compareTo(trade.stopLoss()) >= 0) {
                return Optional.of(CloseReason.STOP_LOSS);
            }
            if (trade.takeProfit() != null && price.compareTo(trade.takeProfit()) <= 0) {
                return Optional.of(CloseReason.TAKE_PROFIT);
            }
        }
        return Optional.empty();
    }
}
