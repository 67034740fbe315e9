package in.signalbridge.service.validation;

import in.signalbridge.domain.common.TradingRules;
import in.signalbridge.domain.common.ValidationErrorCode;
import in.signalbridge.domain.common.ValidationResult;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Structural and risk validation of a proposed trade. Pure, no I/O.
 *
 * CHECKS (in order):
 * 1. Required fields: symbol, side, quantity > 0, entry > 0, stop-loss > 0, take-profit > 0
 * 2. Price ordering:
 *    BUY:  stopLoss < entry < takeProfit
 *    SELL: takeProfit < entry < stopLoss
 *    When the two brackets are exactly reversed they are swapped; any other
 *    violation is rejected.
 * 3. reward / risk >= {@link TradingRules#MIN_REWARD_RISK}, hard rejection.
 *
 * The result carries the (possibly swapped) trade.
 */
public final class TradeValidator {
    private static final Logger log = LoggerFactory.getLogger(TradeValidator.class);

    public ValidationResult validate(Trade trade) {
        ValidationResult.Builder result = new ValidationResult.Builder().trade(trade);

        if (trade.symbol() == null || trade.symbol().isBlank()) {
            result.addError(ValidationErrorCode.SYMBOL_REQUIRED);
        }
        if (trade.side() == null) {
            result.addError(ValidationErrorCode.SIDE_REQUIRED);
        }
        if (!isPositive(trade.quantity())) {
            result.addError(ValidationErrorCode.QUANTITY_REQUIRED, "quantity", String.valueOf(trade.quantity()));
        }
        if (!isPositive(trade.signalEntryPrice())) {
            result.addError(ValidationErrorCode.ENTRY_PRICE_REQUIRED, "entryPrice", String.valueOf(trade.signalEntryPrice()));
        }
        if (!isPositive(trade.stopLoss())) {
            result.addError(ValidationErrorCode.STOP_LOSS_REQUIRED, "stopLoss", String.valueOf(trade.stopLoss()));
        }
        if (!isPositive(trade.takeProfit())) {
            result.addError(ValidationErrorCode.TAKE_PROFIT_REQUIRED, "takeProfit", String.valueOf(trade.takeProfit()));
        }
        if (result.hasErrors()) {
            return result.build();
        }

        Trade candidate = trade;
        BigDecimal entry = trade.signalEntryPrice();

        if (!isOrdered(trade.side(), entry, trade.stopLoss(), trade.takeProfit())) {
            if (isOrdered(trade.side(), entry, trade.takeProfit(), trade.stopLoss())) {
                candidate = trade.withBrackets(trade.takeProfit(), trade.stopLoss());
                result.trade(candidate).swapped(true);
                log.warn("[VALIDATOR] {} {} brackets reversed, swapped SL {} <-> TP {}",
                    trade.side(), trade.symbol(), trade.stopLoss(), trade.takeProfit());
            } else {
                addOrderingErrors(result, trade);
                return result.build();
            }
        }

        BigDecimal risk = entry.subtract(candidate.stopLoss()).abs();
        BigDecimal reward = candidate.takeProfit().subtract(entry).abs();
        if (reward.compareTo(risk.multiply(TradingRules.MIN_REWARD_RISK)) < 0) {
            // truncated so a rejected ratio never prints as the minimum
            BigDecimal ratio = reward.divide(risk, 4, RoundingMode.DOWN);
            result.addError(ValidationErrorCode.RISK_REWARD_TOO_LOW, "riskReward", ratio.toPlainString() + ":1");
        }

        return result.build();
    }

    private static boolean isOrdered(TradeSide side, BigDecimal entry, BigDecimal stopLoss, BigDecimal takeProfit) {
        if (side == TradeSide.BUY) {
            return stopLoss.compareTo(entry) < 0 && entry.compareTo(takeProfit) < 0;
        }
        return takeProfit.compareTo(entry) < 0 && entry.compareTo(stopLoss) < 0;
    }

    private static void addOrderingErrors(ValidationResult.Builder result, Trade trade) {
        BigDecimal entry = trade.signalEntryPrice();
        boolean buy = trade.side() == TradeSide.BUY;

        boolean stopWrong = buy ? trade.stopLoss().compareTo(entry) >= 0 : trade.stopLoss().compareTo(entry) <= 0;
        boolean targetWrong = buy ? trade.takeProfit().compareTo(entry) <= 0 : trade.takeProfit().compareTo(entry) >= 0;

        if (stopWrong) {
            result.addError(ValidationErrorCode.STOP_LOSS_WRONG_SIDE, "stopLoss",
                (buy ? "must be below " : "must be above ") + entry.toPlainString());
        }
        if (targetWrong) {
            result.addError(ValidationErrorCode.TAKE_PROFIT_WRONG_SIDE, "takeProfit",
                (buy ? "must be above " : "must be below ") + entry.toPlainString());
        }
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
