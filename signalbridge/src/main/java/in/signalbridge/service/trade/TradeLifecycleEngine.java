package in.signalbridge.service.trade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.signalbridge.application.port.output.TradeNotifier;
import in.signalbridge.application.port.output.TradeRepository;
import in.signalbridge.domain.common.TradingRules;
import in.signalbridge.domain.common.ValidationResult;
import in.signalbridge.domain.exception.ConcurrentCloseException;
import in.signalbridge.domain.exception.SlippageExceededException;
import in.signalbridge.domain.exception.SymbolNotFoundException;
import in.signalbridge.domain.exception.TradeNotFoundException;
import in.signalbridge.domain.order.BidAsk;
import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.order.GatewayMode;
import in.signalbridge.domain.order.Position;
import in.signalbridge.domain.order.SettlementRequest;
import in.signalbridge.domain.product.Product;
import in.signalbridge.domain.trade.CloseReason;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeEvent;
import in.signalbridge.domain.trade.TradePerformance;
import in.signalbridge.domain.trade.TradeSignal;
import in.signalbridge.domain.trade.TradeStatus;
import in.signalbridge.domain.trade.TradingStats;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.infrastructure.gateway.GatewayTimeoutException;
import in.signalbridge.infrastructure.gateway.OrderGateway;
import in.signalbridge.infrastructure.gateway.OrderRejectedException;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import in.signalbridge.service.product.ProductResolver;
import in.signalbridge.service.validation.TradeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * TradeLifecycleEngine - signal to exchange order to close.
 *
 * STATE MACHINE:
 * <pre>
 *   PENDING ──resolve, price, slippage gate, bracket order──▶ ACTIVE ──close──▶ CLOSED
 *      └──────────── validation / symbol / slippage / gateway error ──▶ FAILED
 * </pre>
 *
 * EXECUTION (processSignal):
 * 0. Build trade, validate, persist (PENDING, or FAILED when invalid)
 * 1. Resolve symbol. NotFound ⇒ FAILED, zero order calls
 * 2. Market price from the gateway
 * 3. Slippage gate: |market - entry| / entry > 1% ⇒ FAILED, zero order calls
 * 4. Best bid/ask: entry limit = ask for BUY, bid for SELL
 * 5. placeBracketOrder ⇒ ACTIVE with actualEntryPrice = market price
 * 6. Persist ACTIVE; if that fails the order is cancelled and the trade is FAILED
 *
 * Every failure becomes a FAILED trade with a reason; processSignal never throws.
 *
 * CLOSE (closeTrade):
 * Runs on the trade's coordinator partition. A close on a trade that is no longer
 * ACTIVE returns the current trade unchanged. A cancel whose outcome is not confirmed
 * (timeout, I/O error, server error) leaves the trade ACTIVE so the next monitor pass retries.
 */
public final class TradeLifecycleEngine {
    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleEngine.class);

    static final String RECONCILE_REASON = "Interrupted during execution - reconcile with exchange";

    private final TradeValidator validator;
    private final ProductResolver productResolver;
    private final OrderGateway gateway;
    private final TradeRepository repository;
    private final TradeNotifier notifier;
    private final TradeCoordinator coordinator;
    private final ActiveTradeIndex activeTrades;
    private final TradingMetrics metrics;
    private final ObjectMapper mapper;
    private final Clock clock;

    public TradeLifecycleEngine(
            TradeValidator validator,
            ProductResolver productResolver,
            OrderGateway gateway,
            TradeRepository repository,
            TradeNotifier notifier,
            TradeCoordinator coordinator,
            TradingMetrics metrics,
            ObjectMapper mapper,
            Clock clock) {
        this.validator = validator;
        this.productResolver = productResolver;
        this.gateway = gateway;
        this.repository = repository;
        this.notifier = notifier;
        this.coordinator = coordinator;
        this.activeTrades = new ActiveTradeIndex();
        this.metrics = metrics;
        this.mapper = mapper;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PENDING -> ACTIVE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Turn a signal into an ACTIVE trade, or a FAILED one with a reason.
     */
    public Trade processSignal(TradeSignal signal) {
        Trade draft = Trade.pending(signal, signalPayload(signal), gateway.mode() == GatewayMode.PAPER,
            clock.instant());
        ValidationResult validation = validator.validate(draft);
        Trade candidate = validation.trade();

        if (!validation.valid()) {
            Trade failed = candidate.fail(validation.reason());
            Trade saved = persistNew(failed);
            if (saved.id() != null) {
                ObjectNode details = mapper.createObjectNode();
                details.put("reason", validation.reason());
                recordEvent(saved.id(), TradeEvent.VALIDATION_FAILED, details);
            }
            metrics.recordTradeFailed("validation");
            notifySafely(saved, () -> notifier.onFailed(saved));
            log.warn("[ENGINE] ✗ Signal {} {} rejected: {}", signal.side(), signal.symbol(), validation.reason());
            return saved;
        }

        Trade pending = persistNew(candidate);
        if (pending.id() == null) {
            Trade failed = candidate.fail("Failed to persist trade");
            metrics.recordTradeFailed("persistence");
            notifySafely(failed, () -> notifier.onFailed(failed));
            return failed;
        }

        ObjectNode created = mapper.createObjectNode();
        created.put("symbol", pending.symbol());
        created.put("side", pending.side().name());
        created.put("quantity", pending.quantity());
        created.put("entryPrice", pending.signalEntryPrice());
        created.put("stopLoss", pending.stopLoss());
        created.put("takeProfit", pending.takeProfit());
        created.put("bracketsSwapped", validation.bracketsSwapped());
        created.put("mode", gateway.mode().name());
        recordEvent(pending.id(), TradeEvent.CREATED, created);

        log.info("[ENGINE] Trade {} created: {} {} {} @ {} (SL {}, TP {}) [{}]",
            pending.id(), pending.side(), pending.quantity(), pending.symbol(), pending.signalEntryPrice(),
            pending.stopLoss(), pending.takeProfit(), gateway.mode());

        try {
            return coordinator.executeAndWait(pending.id(), () -> execute(pending));
        } catch (RuntimeException e) {
            // execute() converts its own failures; this is the coordinator refusing work
            log.error("[ENGINE] Trade {} could not be scheduled: {}", pending.id(), e.getMessage(), e);
            return failTrade(pending, "Execution error: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        }
    }

    private Trade execute(Trade pending) {
        try {
            return doExecute(pending);
        } catch (RuntimeException e) {
            log.error("[ENGINE] Unexpected error executing trade {}: {}", pending.id(), e.getMessage(), e);
            return failTrade(pending, "Unexpected error: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        }
    }

    private Trade doExecute(Trade pending) {
        // 1. Resolve symbol
        Product product;
        try {
            product = productResolver.require(pending.symbol());
        } catch (SymbolNotFoundException e) {
            return failTrade(pending, e.getMessage(), TradeEvent.REJECTED_SYMBOL, "symbol", null);
        } catch (GatewayException e) {
            return failTrade(pending, "Symbol lookup failed: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        }
        Trade trade = pending.symbol().equals(product.symbol()) ? pending : pending.withSymbol(product.symbol());

        // 2. Market price
        BigDecimal marketPrice;
        try {
            marketPrice = gateway.getPrice(product.symbol());
        } catch (GatewayException e) {
            return failTrade(trade, "Failed to get market price: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        }

        // 3. Slippage gate
        BigDecimal slippage;
        try {
            slippage = requireWithinSlippage(trade.signalEntryPrice(), marketPrice);
        } catch (SlippageExceededException e) {
            ObjectNode details = mapper.createObjectNode();
            details.put("entryPrice", e.getEntryPrice());
            details.put("marketPrice", e.getMarketPrice());
            details.put("slippagePercent", e.getSlippagePercent());
            return failTrade(trade, e.getMessage(), TradeEvent.REJECTED_SLIPPAGE, "slippage", details);
        }
        log.info("[ENGINE] Trade {} slippage check passed: market {} vs entry {} ({}%)",
            trade.id(), marketPrice, trade.signalEntryPrice(), slippage);

        // 4. Entry limit at the best opposing price
        BigDecimal limitPrice;
        try {
            BidAsk book = gateway.getBestBidAsk(product.symbol());
            limitPrice = book.opposingPrice(trade.side());
        } catch (GatewayException e) {
            return failTrade(trade, "Failed to get order book: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        }

        // 5. Bracket order, always awaited
        String orderId;
        try {
            orderId = gateway.placeBracketOrder(new BracketOrderRequest(
                product, trade.side(), trade.quantity(), limitPrice,
                trade.stopLoss(), trade.takeProfit(), "sb-" + trade.id()));
        } catch (GatewayTimeoutException e) {
            return failTrade(trade, "Order placement timed out, verify on exchange: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        } catch (OrderRejectedException e) {
            return failTrade(trade, e.getMessage(), TradeEvent.EXECUTION_FAILED, "rejected", null);
        } catch (GatewayException e) {
            return failTrade(trade, "Order placement failed: " + e.getMessage(),
                TradeEvent.EXECUTION_FAILED, "gateway", null);
        }

        // 6. Persist ACTIVE, or roll the order back
        Trade active = trade.activate(orderId, marketPrice, clock.instant());
        try {
            repository.updateTrade(active);
        } catch (RuntimeException e) {
            log.error("[ENGINE] Trade {} order {} placed but not recorded: {}", trade.id(), orderId, e.getMessage(), e);
            String reason = "Failed to record order " + orderId + ": " + e.getMessage();
            try {
                gateway.cancelOrder(orderId);
                reason += " (order cancelled)";
            } catch (RuntimeException cancelError) {
                log.error("[ENGINE] ⚠️ Order {} could not be cancelled, reconcile manually: {}",
                    orderId, cancelError.getMessage());
                reason += " (cancel failed, reconcile with exchange)";
            }
            return failTrade(trade, reason, TradeEvent.EXECUTION_FAILED, "persistence", null);
        }

        activeTrades.put(active);
        metrics.recordTradeOpened(gateway.mode().name());
        metrics.setActiveTrades(activeTrades.size());

        ObjectNode details = mapper.createObjectNode();
        details.put("orderId", orderId);
        details.put("productId", product.productId());
        details.put("marketPrice", marketPrice);
        details.put("limitPrice", limitPrice);
        details.put("slippagePercent", slippage);
        recordEvent(active.id(), TradeEvent.BRACKET_ORDER_PLACED, details);

        log.info("[ENGINE] ✅ Trade {} ACTIVE: {} {} {} @ {} order {}",
            active.id(), active.side(), active.quantity(), active.symbol(), marketPrice, orderId);
        notifySafely(active, () -> notifier.onOpened(active));
        return active;
    }

    /**
     * @return the slippage percent when within the limit
     * @throws SlippageExceededException when the market is beyond the limit
     */
    static BigDecimal requireWithinSlippage(BigDecimal entryPrice, BigDecimal marketPrice) {
        BigDecimal slippage = slippagePercent(entryPrice, marketPrice);
        if (exceedsMaxSlippage(entryPrice, marketPrice)) {
            throw new SlippageExceededException(entryPrice, marketPrice, slippage, TradingRules.MAX_SLIPPAGE_PERCENT);
        }
        return slippage;
    }

    /**
     * |market - entry| / entry &gt; 1%, compared unrounded.
     */
    static boolean exceedsMaxSlippage(BigDecimal entryPrice, BigDecimal marketPrice) {
        BigDecimal allowed = entryPrice.multiply(TradingRules.MAX_SLIPPAGE_PERCENT).movePointLeft(2);
        return marketPrice.subtract(entryPrice).abs().compareTo(allowed) > 0;
    }

    /**
     * |market - entry| / entry, in percent, 4 decimals. For logs and event details only.
     */
    static BigDecimal slippagePercent(BigDecimal entryPrice, BigDecimal marketPrice) {
        return marketPrice.subtract(entryPrice).abs()
            .multiply(BigDecimal.valueOf(100))
            .divide(entryPrice, 4, RoundingMode.HALF_UP);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACTIVE -> CLOSED
    // ═══════════════════════════════════════════════════════════════════════

    public Trade closeTrade(long tradeId, CloseReason reason) {
        return closeTrade(tradeId, reason, null);
    }

    /**
     * Close an ACTIVE trade. Idempotent: a trade that is no longer ACTIVE is returned as is.
     *
     * @param observedPrice exit price seen by the caller, or null to fetch the current price
     * @throws TradeNotFoundException for an unknown id
     * @throws GatewayException when the close could not complete; the trade stays ACTIVE
     */
    public Trade closeTrade(long tradeId, CloseReason reason, BigDecimal observedPrice) {
        return coordinator.executeAndWait(tradeId, () -> doClose(tradeId, reason, observedPrice));
    }

    private Trade doClose(long tradeId, CloseReason reason, BigDecimal observedPrice) {
        Trade current = activeTrades.get(tradeId)
            .or(() -> repository.getTrade(tradeId))
            .orElseThrow(() -> new TradeNotFoundException(tradeId));

        try {
            requireActive(current);
        } catch (ConcurrentCloseException e) {
            log.debug("[ENGINE] {}", e.getMessage());
            return current;
        }

        BigDecimal exitPrice = observedPrice != null ? observedPrice : gateway.getPrice(current.symbol());

        // Gateways return normally only when the bracket is cancelled or already gone.
        try {
            gateway.cancelOrder(current.exchangeOrderId());
        } catch (GatewayException e) {
            ObjectNode details = mapper.createObjectNode();
            details.put("reason", reason.code());
            details.put("error", e.getMessage());
            recordEvent(tradeId, TradeEvent.CLOSE_FAILED, details);
            log.warn("[ENGINE] Trade {} close aborted, cancel of order {} unconfirmed ({}); stays ACTIVE",
                tradeId, current.exchangeOrderId(), e.getMessage());
            throw e;
        }

        Trade closed = current.close(exitPrice, reason, clock.instant());
        repository.updateTrade(closed);
        activeTrades.remove(tradeId);
        metrics.setActiveTrades(activeTrades.size());

        try {
            gateway.settleClose(new SettlementRequest(closed.exchangeOrderId(), closed.symbol(), closed.side(),
                closed.quantity(), exitPrice, closed.pnl()));
        } catch (RuntimeException e) {
            log.error("[ENGINE] Settlement of trade {} failed: {}", tradeId, e.getMessage(), e);
        }

        ObjectNode details = mapper.createObjectNode();
        details.put("reason", reason.code());
        details.put("exitPrice", exitPrice);
        details.put("pnl", closed.pnl());
        recordEvent(tradeId, TradeEvent.CLOSED, details);
        metrics.recordTradeClosed(reason.code(), closed.pnl());

        log.info("[ENGINE] 🏁 Trade {} CLOSED ({}): {} {} entry {} exit {} pnl {}",
            tradeId, reason.code(), closed.side(), closed.symbol(), closed.effectiveEntryPrice(),
            exitPrice, closed.pnl());
        notifySafely(closed, () -> notifier.onClosed(closed));
        return closed;
    }

    private static void requireActive(Trade trade) {
        if (trade.status() != TradeStatus.ACTIVE) {
            throw new ConcurrentCloseException(trade.id(), trade.status());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Queries and recovery
    // ═══════════════════════════════════════════════════════════════════════

    public List<Trade> getActiveTrades() {
        return activeTrades.snapshot();
    }

    /**
     * @throws TradeNotFoundException for an unknown id
     */
    public Trade getTrade(long tradeId) {
        return repository.getTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(tradeId));
    }

    /**
     * Audit trail of a trade, oldest first.
     */
    public List<TradeEvent> getTradeEvents(long tradeId) {
        return repository.getTradeEvents(tradeId);
    }

    /**
     * Trades in a lifecycle state, read from the repository rather than the in-memory index.
     */
    public List<Trade> getTrades(TradeStatus status) {
        return repository.findByStatus(status);
    }

    public List<Position> getOpenPositions() {
        List<String> symbols = new ArrayList<>(activeTrades.symbols());
        if (symbols.isEmpty()) {
            return List.of();
        }
        symbols.sort(String::compareTo);
        return gateway.getPositions(symbols);
    }

    public TradePerformance getTradePerformance() {
        TradingStats stats = repository.getTradingStats();
        return new TradePerformance(stats, activeTrades.size(), gateway.paperStats());
    }

    /**
     * Startup recovery: index ACTIVE trades, fail PENDING ones left by an interrupted run.
     *
     * @return number of ACTIVE trades indexed
     */
    public int loadActiveTrades() {
        List<Trade> active = repository.getActiveTrades();
        activeTrades.rebuild(active);
        metrics.setActiveTrades(active.size());

        List<Trade> stale = repository.findByStatus(TradeStatus.PENDING);
        for (Trade pending : stale) {
            log.warn("[ENGINE] Trade {} ({} {}) was PENDING at startup, marking FAILED",
                pending.id(), pending.side(), pending.symbol());
            failTrade(pending, RECONCILE_REASON, TradeEvent.RECOVERED_FAILED, "recovery", null);
        }

        log.info("[ENGINE] Recovery complete: {} active, {} stale pending failed", active.size(), stale.size());
        return active.size();
    }

    public GatewayMode mode() {
        return gateway.mode();
    }

    public void shutdown() {
        coordinator.shutdown();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════════

    private Trade failTrade(Trade trade, String reason, String action, String category, ObjectNode extra) {
        Trade failed = trade.fail(reason);
        try {
            repository.updateTrade(failed);
        } catch (RuntimeException e) {
            log.error("[ENGINE] Failed to persist FAILED state for trade {}: {}", trade.id(), e.getMessage());
        }

        ObjectNode details = extra != null ? extra : mapper.createObjectNode();
        details.put("reason", reason);
        recordEvent(failed.id(), action, details);
        metrics.recordTradeFailed(category);

        log.warn("[ENGINE] ✗ Trade {} FAILED ({}): {}", failed.id(), category, reason);
        notifySafely(failed, () -> notifier.onFailed(failed));
        return failed;
    }

    private Trade persistNew(Trade trade) {
        try {
            return repository.saveTrade(trade);
        } catch (RuntimeException e) {
            log.error("[ENGINE] Failed to persist new trade for {}: {}", trade.symbol(), e.getMessage(), e);
            return trade;
        }
    }

    private void recordEvent(Long tradeId, String action, ObjectNode details) {
        if (tradeId == null) {
            return;
        }
        try {
            repository.addTradeEvent(TradeEvent.of(tradeId, action, details, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[ENGINE] Failed to record {} event for trade {}: {}", action, tradeId, e.getMessage());
        }
    }

    private void notifySafely(Trade trade, Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("[ENGINE] Notification for trade {} failed: {}", trade.id(), e.getMessage());
        }
    }

    private String signalPayload(TradeSignal signal) {
        try {
            return mapper.writeValueAsString(signal);
        } catch (JsonProcessingException e) {
            log.warn("[ENGINE] Could not serialize signal payload: {}", e.getMessage());
            return null;
        }
    }
}
