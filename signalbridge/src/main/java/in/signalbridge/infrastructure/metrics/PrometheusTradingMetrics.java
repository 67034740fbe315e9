package in.signalbridge.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Prometheus implementation of TradingMetrics.
 *
 * Key Metrics:
 * - signalbridge_signals_total{outcome}
 * - signalbridge_trades_opened_total{mode}
 * - signalbridge_trades_failed_total{category}
 * - signalbridge_trades_closed_total{reason}
 * - signalbridge_realized_pnl_total
 * - signalbridge_gateway_calls_total{operation, status}
 * - signalbridge_gateway_latency_seconds{operation}
 * - signalbridge_catalog_refresh_total{status}
 * - signalbridge_monitor_pass_seconds
 * - signalbridge_monitor_passes_skipped_total
 * - signalbridge_active_trades
 * - signalbridge_paper_balance
 */
public class PrometheusTradingMetrics implements TradingMetrics {

    private final CollectorRegistry registry;

    private final Counter signalCounter;
    private final Counter openedCounter;
    private final Counter failedCounter;
    private final Counter closedCounter;
    private final Counter realizedPnl;

    private final Counter gatewayCallCounter;
    private final Histogram gatewayLatency;

    private final Counter catalogRefreshCounter;
    private final Histogram catalogRefreshLatency;

    private final Histogram monitorPassDuration;
    private final Counter monitorTradesChecked;
    private final Counter monitorErrors;
    private final Counter monitorSkipped;

    private final Gauge activeTrades;
    private final Gauge paperBalance;

    public PrometheusTradingMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusTradingMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalCounter = Counter.build()
            .name("signalbridge_signals_total")
            .help("Signals received, by admission outcome")
            .labelNames("outcome")
            .register(registry);

        this.openedCounter = Counter.build()
            .name("signalbridge_trades_opened_total")
            .help("Trades that reached ACTIVE")
            .labelNames("mode")
            .register(registry);

        this.failedCounter = Counter.build()
            .name("signalbridge_trades_failed_total")
            .help("Trades that ended FAILED, by failure category")
            .labelNames("category")
            .register(registry);

        this.closedCounter = Counter.build()
            .name("signalbridge_trades_closed_total")
            .help("Trades closed, by close reason")
            .labelNames("reason")
            .register(registry);

        this.realizedPnl = Counter.build()
            .name("signalbridge_realized_pnl_total")
            .help("Sum of positive realized pnl")
            .register(registry);

        this.gatewayCallCounter = Counter.build()
            .name("signalbridge_gateway_calls_total")
            .help("Order gateway calls")
            .labelNames("operation", "status")
            .register(registry);

        this.gatewayLatency = Histogram.build()
            .name("signalbridge_gateway_latency_seconds")
            .help("Order gateway call latency in seconds")
            .labelNames("operation")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 15.0)
            .register(registry);

        this.catalogRefreshCounter = Counter.build()
            .name("signalbridge_catalog_refresh_total")
            .help("Product catalog refreshes")
            .labelNames("status")
            .register(registry);

        this.catalogRefreshLatency = Histogram.build()
            .name("signalbridge_catalog_refresh_seconds")
            .help("Product catalog refresh duration in seconds")
            .buckets(0.1, 0.5, 1.0, 2.5, 5.0, 15.0)
            .register(registry);

        this.monitorPassDuration = Histogram.build()
            .name("signalbridge_monitor_pass_seconds")
            .help("Trade monitor pass duration in seconds")
            .buckets(0.05, 0.1, 0.5, 1.0, 5.0, 15.0, 30.0)
            .register(registry);

        this.monitorTradesChecked = Counter.build()
            .name("signalbridge_monitor_trades_checked_total")
            .help("Active trades evaluated by the monitor")
            .register(registry);

        this.monitorErrors = Counter.build()
            .name("signalbridge_monitor_errors_total")
            .help("Per-trade errors recorded by monitor passes")
            .register(registry);

        this.monitorSkipped = Counter.build()
            .name("signalbridge_monitor_passes_skipped_total")
            .help("Monitor passes skipped because another pass was running")
            .register(registry);

        this.activeTrades = Gauge.build()
            .name("signalbridge_active_trades")
            .help("Trades currently ACTIVE")
            .register(registry);

        this.paperBalance = Gauge.build()
            .name("signalbridge_paper_balance")
            .help("Paper ledger balance")
            .register(registry);
    }

    @Override
    public void recordSignal(String outcome) {
        signalCounter.labels(outcome).inc();
    }

    @Override
    public void recordTradeOpened(String mode) {
        openedCounter.labels(mode).inc();
    }

    @Override
    public void recordTradeFailed(String category) {
        failedCounter.labels(category).inc();
    }

    @Override
    public void recordTradeClosed(String reason, BigDecimal pnl) {
        closedCounter.labels(reason).inc();
        if (pnl != null && pnl.signum() > 0) {
            realizedPnl.inc(pnl.doubleValue());
        }
    }

    @Override
    public void recordGatewayCall(String operation, boolean success, Duration latency) {
        gatewayCallCounter.labels(operation, success ? "success" : "failure").inc();
        gatewayLatency.labels(operation).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordCatalogRefresh(boolean success, Duration latency) {
        catalogRefreshCounter.labels(success ? "success" : "failure").inc();
        catalogRefreshLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordMonitorPass(int checked, int closed, int errors, Duration duration) {
        monitorPassDuration.observe(duration.toMillis() / 1000.0);
        monitorTradesChecked.inc(checked);
        monitorErrors.inc(errors);
    }

    @Override
    public void recordMonitorPassSkipped() {
        monitorSkipped.inc();
    }

    @Override
    public void setActiveTrades(int count) {
        activeTrades.set(count);
    }

    @Override
    public void setPaperBalance(BigDecimal balance) {
        if (balance != null) {
            paperBalance.set(balance.doubleValue());
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
