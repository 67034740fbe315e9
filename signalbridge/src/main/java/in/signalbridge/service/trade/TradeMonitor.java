package in.signalbridge.service.trade;

import in.signalbridge.domain.trade.CloseReason;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.infrastructure.gateway.OrderGateway;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches ACTIVE trades and closes them when stop-loss or take-profit is hit.
 *
 * Runs on a dedicated single thread with a fixed delay between passes. The
 * running flag also guards manual {@link #runPass()} calls, so two passes never
 * overlap; the later one is skipped.
 */
public final class TradeMonitor {
    private static final Logger log = LoggerFactory.getLogger(TradeMonitor.class);

    private final TradeLifecycleEngine engine;
    private final OrderGateway gateway;
    private final TradingMetrics metrics;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile MonitorPassResult lastResult;
    private volatile Instant lastPassTime;

    public TradeMonitor(TradeLifecycleEngine engine, OrderGateway gateway, TradingMetrics metrics, Duration interval) {
        this.engine = engine;
        this.gateway = gateway;
        this.metrics = metrics;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trade-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long period = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::scheduledPass, period, period, TimeUnit.MILLISECONDS);
        log.info("[MONITOR] Started: interval={}s", interval.toSeconds());
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[MONITOR] Stopped");
    }

    private void scheduledPass() {
        try {
            runPass();
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("[MONITOR] Pass failed", e);
        }
    }

    /**
     * One pass over all ACTIVE trades. Skipped when another pass is in progress.
     */
    public MonitorPassResult runPass() {
        if (!running.compareAndSet(false, true)) {
            log.debug("[MONITOR] Previous pass still running, skipping");
            metrics.recordMonitorPassSkipped();
            return MonitorPassResult.skippedPass();
        }
        try {
            MonitorPassResult result = doPass();
            lastResult = result;
            lastPassTime = Instant.now();
            metrics.recordMonitorPass(result.checked(), result.closed(), result.errors().size(), result.duration());
            return result;
        } finally {
            running.set(false);
        }
    }

    private MonitorPassResult doPass() {
        Instant start = Instant.now();
        List<Trade> trades = engine.getActiveTrades();
        if (trades.isEmpty()) {
            return new MonitorPassResult(false, 0, 0, List.of(), Duration.between(start, Instant.now()));
        }

        Map<String, BigDecimal> prices = new HashMap<>();
        Map<String, String> priceErrors = new HashMap<>();
        List<String> errors = new ArrayList<>();
        int checked = 0;
        int closed = 0;

        for (Trade trade : trades) {
            checked++;
            try {
                BigDecimal price = priceFor(trade.symbol(), prices, priceErrors);
                if (price == null) {
                    errors.add("Trade " + trade.id() + ": price unavailable for " + trade.symbol()
                        + ": " + priceErrors.get(trade.symbol()));
                    continue;
                }

                Optional<CloseReason> trigger = TriggerEvaluator.evaluate(trade, price);
                if (trigger.isEmpty()) {
                    continue;
                }

                log.info("[MONITOR] Trade {} {} {} hit {} at {} (SL {}, TP {})",
                    trade.id(), trade.side(), trade.symbol(), trigger.get().code(), price,
                    trade.stopLoss(), trade.takeProfit());
                Trade result = engine.closeTrade(trade.id(), trigger.get(), price);
                if (result.closeTime() != null && trigger.get() == result.closeReason()) {
                    closed++;
                }
            } catch (RuntimeException e) {
                log.error("[MONITOR] Error checking trade {}: {}", trade.id(), e.getMessage());
                errors.add("Trade " + trade.id() + ": " + e.getMessage());
            }
        }

        Duration elapsed = Duration.between(start, Instant.now());
        log.info("[MONITOR] Pass complete: checked={}, closed={}, errors={}, elapsed={}ms",
            checked, closed, errors.size(), elapsed.toMillis());
        return new MonitorPassResult(false, checked, closed, errors, elapsed);
    }

    private BigDecimal priceFor(String symbol, Map<String, BigDecimal> prices, Map<String, String> priceErrors) {
        if (prices.containsKey(symbol)) {
            return prices.get(symbol);
        }
        if (priceErrors.containsKey(symbol)) {
            return null;
        }
        try {
            BigDecimal price = gateway.getPrice(symbol);
            prices.put(symbol, price);
            return price;
        } catch (RuntimeException e) {
            log.warn("[MONITOR] Price fetch failed for {}: {}", symbol, e.getMessage());
            priceErrors.put(symbol, e.getMessage());
            return null;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public MonitorPassResult lastResult() {
        return lastResult;
    }

    public Instant lastPassTime() {
        return lastPassTime;
    }
}
