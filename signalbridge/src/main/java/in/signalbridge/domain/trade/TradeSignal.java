package in.signalbridge.domain.trade;

import java.math.BigDecimal;

/**
 * Structured trading signal as delivered by a signal source.
 *
 * confidence is in [0, 1] and is only used as an admission filter before the engine.
 */
public record TradeSignal(
    String symbol,
    TradeSide side,
    BigDecimal quantity,
    BigDecimal entryPrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    double confidence,
    String source
) {
    public static TradeSignal of(String symbol, TradeSide side, String quantity,
                                 String entryPrice, String stopLoss, String takeProfit) {
        return new TradeSignal(symbol, side, new BigDecimal(quantity), new BigDecimal(entryPrice),
            new BigDecimal(stopLoss), new BigDecimal(takeProfit), 1.0, "manual");
    }
}
