package in.signalbridge.domain.trade;

import java.math.BigDecimal;

/**
 * Aggregate statistics over all persisted trades.
 */
public record TradingStats(
    long totalTrades,
    long closedTrades,
    long activeTrades,
    long failedTrades,
    long winningTrades,
    long losingTrades,
    BigDecimal totalPnl,
    BigDecimal avgPnl,
    BigDecimal maxWin,
    BigDecimal maxLoss
) {
    public static TradingStats empty() {
        return new TradingStats(0, 0, 0, 0, 0, 0,
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /**
     * Winning share of closed trades, in percent. 0 when nothing has closed.
     */
    public double winRate() {
        if (closedTrades == 0) return 0.0;
        return (double) winningTrades / closedTrades * 100.0;
    }
}
