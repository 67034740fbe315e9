package in.signalbridge.domain.trade;

import in.signalbridge.domain.order.PaperLedgerStats;

import java.util.Optional;

/**
 * Performance snapshot returned to callers: repository stats, the live active count,
 * and the paper ledger when trading in simulated mode.
 */
public record TradePerformance(
    TradingStats stats,
    int activeInMemory,
    Optional<PaperLedgerStats> paper
) {
    public double winRate() {
        return stats.winRate();
    }
}
