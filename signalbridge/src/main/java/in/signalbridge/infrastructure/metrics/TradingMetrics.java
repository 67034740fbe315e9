package in.signalbridge.infrastructure.metrics;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Trading metrics for monitoring and alerting.
 *
 * All methods default to no-ops so components can be built without a registry.
 *
 * Key metrics:
 * - Signals admitted / discarded
 * - Trades opened / failed (by category) / closed (by reason)
 * - Gateway call latency and outcome
 * - Product catalog refreshes
 * - Monitor pass duration and skipped passes
 */
public interface TradingMetrics {

    TradingMetrics NOOP = new TradingMetrics() {};

    /**
     * @param outcome "accepted", "discarded", "no_signal", "failure"
     */
    default void recordSignal(String outcome) {}

    default void recordTradeOpened(String mode) {}

    /**
     * @param category validation, symbol, slippage, gateway, persistence, recovery
     */
    default void recordTradeFailed(String category) {}

    default void recordTradeClosed(String reason, BigDecimal pnl) {}

    /**
     * Record one gateway call.
     *
     * @param operation price, bid_ask, place_order, cancel_order, positions, products
     */
    default void recordGatewayCall(String operation, boolean success, Duration latency) {}

    default void recordCatalogRefresh(boolean success, Duration latency) {}

    default void recordMonitorPass(int checked, int closed, int errors, Duration duration) {}

    default void recordMonitorPassSkipped() {}

    default void setActiveTrades(int count) {}

    default void setPaperBalance(BigDecimal balance) {}
}
