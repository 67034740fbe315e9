package in.signalbridge.service.trade;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.signalbridge.domain.exception.SlippageExceededException;
import in.signalbridge.domain.exception.TradeNotFoundException;
import in.signalbridge.domain.order.GatewayMode;
import in.signalbridge.domain.order.PaperLedgerStats;
import in.signalbridge.domain.trade.CloseReason;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeEvent;
import in.signalbridge.domain.trade.TradePerformance;
import in.signalbridge.domain.trade.TradeSide;
import in.signalbridge.domain.trade.TradeSignal;
import in.signalbridge.domain.trade.TradeStatus;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.infrastructure.gateway.GatewayTimeoutException;
import in.signalbridge.infrastructure.gateway.OrderGateway;
import in.signalbridge.infrastructure.gateway.PaperOrderGateway;
import in.signalbridge.infrastructure.gateway.paper.PaperLedger;
import in.signalbridge.infrastructure.gateway.paper.PaperOrderState;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import in.signalbridge.service.product.ProductResolver;
import in.signalbridge.service.validation.TradeValidator;
import in.signalbridge.support.InMemoryProductRepository;
import in.signalbridge.support.InMemoryTradeRepository;
import in.signalbridge.support.Products;
import in.signalbridge.support.RecordingNotifier;
import in.signalbridge.support.StubMarketData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Lifecycle tests against the paper gateway with stubbed market data.
 *
 * Tests:
 * - Signal to ACTIVE trade (slippage within 1%)
 * - Slippage, unknown symbol, validation and size rejections
 * - Rollback when the ACTIVE state cannot be persisted
 * - Idempotent and concurrent close, timeout during close
 * - Startup recovery
 */
class TradeLifecycleEngineTest {

    private InMemoryTradeRepository repository;
    private StubMarketData market;
    private PaperLedger ledger;
    private RecordingNotifier notifier;
    private ProductResolver resolver;
    private TradeCoordinator coordinator;
    private ObjectMapper mapper;
    private TradeLifecycleEngine engine;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTradeRepository();
        market = new StubMarketData();
        ledger = new PaperLedger(new BigDecimal("10000"));
        notifier = new RecordingNotifier();
        resolver = new ProductResolver(Products::catalog, new InMemoryProductRepository(), Duration.ofHours(24));
        coordinator = new TradeCoordinator(4);
        mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        engine = newEngine(new PaperOrderGateway(market, ledger));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private TradeLifecycleEngine newEngine(OrderGateway gateway) {
        return new TradeLifecycleEngine(new TradeValidator(), resolver, gateway, repository, notifier,
            coordinator, TradingMetrics.NOOP, mapper, Clock.systemUTC());
    }

    private static TradeSignal btcBuy() {
        return TradeSignal.of("BTC", TradeSide.BUY, "0.01", "45000", "43000", "48000");
    }

    private static TradeSignal ethSell() {
        return TradeSignal.of("ETH", TradeSide.SELL, "1", "3297", "3309", "3200");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Opening
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testBuySignalWithinSlippageBecomesActive() {
        market.price("BTCUSD", "45050");

        Trade trade = engine.processSignal(btcBuy());

        assertEquals(TradeStatus.ACTIVE, trade.status());
        assertEquals("BTCUSD", trade.symbol(), "Symbol should be normalized to the exchange contract");
        assertEquals(0, new BigDecimal("45050").compareTo(trade.actualEntryPrice()));
        assertNotNull(trade.exchangeOrderId());
        assertTrue(trade.exchangeOrderId().startsWith("paper_"));
        assertNotNull(trade.openTime());
        assertTrue(trade.simulated());

        assertEquals(trade, repository.getTrade(trade.id()).orElseThrow());
        assertEquals(List.of(trade), engine.getActiveTrades());
        assertEquals(List.of(TradeEvent.CREATED, TradeEvent.BRACKET_ORDER_PLACED), repository.actions(trade.id()));
        assertEquals(1, notifier.opened.size());

        // Entry limit at the ask (stub book is price +/- 1), rounded to the 0.5 tick
        BigDecimal limit = ledger.order(trade.exchangeOrderId()).orElseThrow().limitPrice();
        assertEquals(0, new BigDecimal("45051").compareTo(limit));
        assertEquals("sb-" + trade.id(), ledger.order(trade.exchangeOrderId()).orElseThrow().clientOrderId());
    }

    @Test
    void testSellSignalUsesBidAsEntryLimit() {
        market.price("ETHUSD", "3297").book("ETHUSD", "3296.95", "3297.05");

        Trade trade = engine.processSignal(ethSell());

        assertEquals(TradeStatus.ACTIVE, trade.status());
        BigDecimal limit = ledger.order(trade.exchangeOrderId()).orElseThrow().limitPrice();
        assertEquals(0, new BigDecimal("3296.95").compareTo(limit));
    }

    @Test
    void testSlippageAboveOnePercentFailsWithoutOrder() {
        OrderGateway gateway = mock(OrderGateway.class);
        when(gateway.mode()).thenReturn(GatewayMode.PAPER);
        when(gateway.getPrice("BTCUSD")).thenReturn(new BigDecimal("46500"));
        TradeLifecycleEngine mocked = newEngine(gateway);

        Trade trade = mocked.processSignal(btcBuy());

        assertEquals(TradeStatus.FAILED, trade.status());
        assertTrue(trade.failReason().contains("slippage"), trade.failReason());
        assertTrue(trade.failReason().contains("3.3333%"), trade.failReason());
        assertNull(trade.exchangeOrderId());
        assertEquals(TradeStatus.FAILED, repository.getTrade(trade.id()).orElseThrow().status());
        assertTrue(repository.actions(trade.id()).contains(TradeEvent.REJECTED_SLIPPAGE));

        verify(gateway, atLeastOnce()).mode();
        verify(gateway).getPrice("BTCUSD");
        verifyNoMoreInteractions(gateway);
    }

    @Test
    void testSlippageOfExactlyOnePercentIsAccepted() {
        market.price("BTCUSD", "45450");

        Trade trade = engine.processSignal(btcBuy());

        assertEquals(TradeStatus.ACTIVE, trade.status());
    }

    @Test
    void testSlippageJustAboveOnePercentFailsWithoutOrder() {
        // 450.02 / 45000 = 1.0000444%, which prints as 1.0000% after rounding
        market.price("BTCUSD", "45450.02");

        Trade trade = engine.processSignal(btcBuy());

        assertEquals(TradeStatus.FAILED, trade.status(), "slippage above 1% must not be rounded into range");
        assertNull(trade.exchangeOrderId());
        assertEquals(0, ledger.stats().totalOrders(), "No paper order should be placed");
        assertTrue(repository.actions(trade.id()).contains(TradeEvent.REJECTED_SLIPPAGE));
    }

    @Test
    void testSlippageJustBelowOnePercentOnShortIsAccepted() {
        // 32.9699 / 3297 < 1%
        market.price("ETHUSD", "3264.0301");

        Trade trade = engine.processSignal(ethSell());

        assertEquals(TradeStatus.ACTIVE, trade.status());
    }

    @Test
    void testTimestampsComeFromEngineClock() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        TradeLifecycleEngine fixed = new TradeLifecycleEngine(new TradeValidator(), resolver,
            new PaperOrderGateway(market, ledger), repository, notifier, coordinator, TradingMetrics.NOOP,
            mapper, Clock.fixed(now, ZoneOffset.UTC));
        market.price("BTCUSD", "45000");

        Trade trade = fixed.processSignal(btcBuy());

        assertEquals(TradeStatus.ACTIVE, trade.status());
        assertEquals(now, trade.createdAt());
        assertEquals(now, trade.openTime());
        assertEquals(now, repository.getTrade(trade.id()).orElseThrow().createdAt());
        assertTrue(repository.getTradeEvents(trade.id()).stream().allMatch(e -> now.equals(e.timestamp())),
            "Events stamped by the engine clock");
    }

    @Test
    void testUnknownSymbolFailsBeforeAnyPriceOrOrderCall() {
        OrderGateway gateway = mock(OrderGateway.class);
        when(gateway.mode()).thenReturn(GatewayMode.PAPER);
        TradeLifecycleEngine mocked = newEngine(gateway);

        Trade trade = mocked.processSignal(TradeSignal.of("ZZZUSD", TradeSide.BUY, "1", "10", "9", "12"));

        assertEquals(TradeStatus.FAILED, trade.status());
        assertEquals("Invalid symbol: ZZZUSD", trade.failReason());
        assertTrue(repository.actions(trade.id()).contains(TradeEvent.REJECTED_SYMBOL));
        assertEquals(1, notifier.failed.size());

        verify(gateway, atLeastOnce()).mode();
        verifyNoMoreInteractions(gateway);
    }

    @Test
    void testInvalidSignalIsPersistedAsFailed() {
        Trade trade = engine.processSignal(TradeSignal.of("BTC", TradeSide.BUY, "0.01", "45000", "46000", "48000"));

        assertEquals(TradeStatus.FAILED, trade.status());
        assertNotNull(trade.id());
        assertTrue(trade.failReason().contains("Stop loss is on the wrong side"), trade.failReason());
        assertEquals(List.of(TradeEvent.VALIDATION_FAILED), repository.actions(trade.id()));
        assertEquals(0, market.priceCalls());
        assertEquals(0, ledger.stats().totalOrders());
    }

    @Test
    void testReversedBracketsAreSwappedBeforeExecution() {
        market.price("BTCUSD", "45000");

        Trade trade = engine.processSignal(TradeSignal.of("BTC", TradeSide.BUY, "0.01", "45000", "48000", "43000"));

        assertEquals(TradeStatus.ACTIVE, trade.status());
        assertEquals(0, new BigDecimal("43000").compareTo(trade.stopLoss()));
        assertEquals(0, new BigDecimal("48000").compareTo(trade.takeProfit()));
        assertEquals(0, new BigDecimal("43000").compareTo(
            ledger.order(trade.exchangeOrderId()).orElseThrow().stopLoss()));
    }

    @Test
    void testSizeAboveProductMaximumIsRejected() {
        market.price("BTCUSD", "45000");

        Trade trade = engine.processSignal(TradeSignal.of("BTC", TradeSide.BUY, "500", "45000", "43000", "48000"));

        assertEquals(TradeStatus.FAILED, trade.status());
        assertTrue(trade.failReason().contains("outside allowed range"), trade.failReason());
        assertEquals(0, ledger.stats().totalOrders());
    }

    @Test
    void testPriceLookupFailureFailsTrade() {
        Trade trade = engine.processSignal(btcBuy());

        assertEquals(TradeStatus.FAILED, trade.status());
        assertTrue(trade.failReason().startsWith("Failed to get market price"), trade.failReason());
    }

    @Test
    void testOrderIsCancelledWhenActiveStateCannotBePersisted() {
        market.price("BTCUSD", "45000");
        repository.failUpdatesWhen(t -> t.status() == TradeStatus.ACTIVE);

        Trade trade = engine.processSignal(btcBuy());

        assertEquals(TradeStatus.FAILED, trade.status());
        assertTrue(trade.failReason().contains("order cancelled"), trade.failReason());
        assertTrue(engine.getActiveTrades().isEmpty());
        assertEquals(TradeStatus.FAILED, repository.getTrade(trade.id()).orElseThrow().status());

        PaperLedgerStats stats = ledger.stats();
        assertEquals(1, stats.cancelledOrders());
        assertEquals(0, stats.openPositions());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Closing
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testTakeProfitCloseSettlesPaperBalance() {
        market.price("ETHUSD", "3297");
        Trade open = engine.processSignal(ethSell());
        assertEquals(TradeStatus.ACTIVE, open.status());

        Trade closed = engine.closeTrade(open.id(), CloseReason.TAKE_PROFIT, new BigDecimal("3195"));

        assertEquals(TradeStatus.CLOSED, closed.status());
        assertEquals(CloseReason.TAKE_PROFIT, closed.closeReason());
        assertEquals(0, new BigDecimal("102").compareTo(closed.pnl()));
        assertEquals(0, new BigDecimal("10102").compareTo(ledger.balance()));
        assertTrue(ledger.isSettled(open.exchangeOrderId()));
        assertEquals(PaperOrderState.CLOSED, ledger.order(open.exchangeOrderId()).orElseThrow().state());
        assertTrue(engine.getActiveTrades().isEmpty());
        assertEquals(closed, repository.getTrade(open.id()).orElseThrow());
        assertTrue(repository.actions(open.id()).contains(TradeEvent.CLOSED));
        assertEquals(1, notifier.closed.size());
    }

    @Test
    void testCloseWithoutObservedPriceFetchesMarketPrice() {
        market.price("BTCUSD", "45000");
        Trade open = engine.processSignal(btcBuy());
        market.price("BTCUSD", "44000");

        Trade closed = engine.closeTrade(open.id(), CloseReason.MANUAL);

        assertEquals(0, new BigDecimal("44000").compareTo(closed.exitPrice()));
        assertEquals(0, new BigDecimal("-10").compareTo(closed.pnl()));
        assertEquals(0, new BigDecimal("9990").compareTo(ledger.balance()));
    }

    @Test
    void testSecondCloseIsNoOp() {
        market.price("BTCUSD", "45000");
        Trade open = engine.processSignal(btcBuy());

        Trade first = engine.closeTrade(open.id(), CloseReason.MANUAL, new BigDecimal("46000"));
        Trade second = engine.closeTrade(open.id(), CloseReason.STOP_LOSS, new BigDecimal("43000"));

        assertEquals(first, second);
        assertEquals(CloseReason.MANUAL, second.closeReason());
        assertEquals(0, new BigDecimal("10010").compareTo(ledger.balance()));
        assertEquals(1, notifier.closed.size());
    }

    @Test
    void testConcurrentClosesApplyPnlOnce() throws Exception {
        market.price("BTCUSD", "45000");
        Trade open = engine.processSignal(btcBuy());

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Trade>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return engine.closeTrade(open.id(), CloseReason.MANUAL, new BigDecimal("46000"));
            }));
        }
        start.countDown();

        for (Future<Trade> result : results) {
            Trade trade = result.get(10, TimeUnit.SECONDS);
            assertEquals(TradeStatus.CLOSED, trade.status());
        }
        pool.shutdown();

        assertEquals(0, new BigDecimal("10010").compareTo(ledger.balance()), "pnl must be applied exactly once");
        assertEquals(1, notifier.closed.size());
        assertEquals(1, repository.actions(open.id()).stream().filter(TradeEvent.CLOSED::equals).count());
    }

    @Test
    void testCancelTimeoutKeepsTradeActive() {
        PaperOrderGateway timingOut = new PaperOrderGateway(market, ledger) {
            @Override
            public void cancelOrder(String exchangeOrderId) {
                throw new GatewayTimeoutException("cancel_order", Duration.ofSeconds(15), null);
            }
        };
        TradeLifecycleEngine flaky = newEngine(timingOut);
        market.price("BTCUSD", "45000");
        Trade open = flaky.processSignal(btcBuy());

        assertThrows(GatewayTimeoutException.class,
            () -> flaky.closeTrade(open.id(), CloseReason.STOP_LOSS, new BigDecimal("42900")));

        assertEquals(TradeStatus.ACTIVE, repository.getTrade(open.id()).orElseThrow().status());
        assertEquals(1, flaky.getActiveTrades().size());
        assertTrue(repository.actions(open.id()).contains(TradeEvent.CLOSE_FAILED));
        assertEquals(0, new BigDecimal("10000").compareTo(ledger.balance()));
    }

    @Test
    void testCancelIoErrorKeepsTradeActive() {
        PaperOrderGateway unreachable = new PaperOrderGateway(market, ledger) {
            @Override
            public void cancelOrder(String exchangeOrderId) {
                throw new GatewayException("cancel_order", "I/O error: Connection reset");
            }
        };
        TradeLifecycleEngine flaky = newEngine(unreachable);
        market.price("BTCUSD", "45000");
        Trade open = flaky.processSignal(btcBuy());

        GatewayException e = assertThrows(GatewayException.class,
            () -> flaky.closeTrade(open.id(), CloseReason.TAKE_PROFIT, new BigDecimal("48100")));

        assertTrue(e.getMessage().contains("Connection reset"), e.getMessage());
        assertEquals(TradeStatus.ACTIVE, repository.getTrade(open.id()).orElseThrow().status(),
            "Unconfirmed cancel must not close the trade");
        assertEquals(1, flaky.getActiveTrades().size());
        assertTrue(repository.actions(open.id()).contains(TradeEvent.CLOSE_FAILED));
        assertTrue(notifier.closed.isEmpty());
        assertEquals(0, new BigDecimal("10000").compareTo(ledger.balance()));
    }

    @Test
    void testCloseProceedsWhenOrderAlreadyInactive() {
        market.price("BTCUSD", "45000");
        Trade open = engine.processSignal(btcBuy());
        ledger.cancel(open.exchangeOrderId());

        Trade closed = engine.closeTrade(open.id(), CloseReason.STOP_LOSS, new BigDecimal("42900"));

        assertEquals(TradeStatus.CLOSED, closed.status());
        assertTrue(engine.getActiveTrades().isEmpty());
    }

    @Test
    void testCloseOfUnknownTradeThrows() {
        assertThrows(TradeNotFoundException.class, () -> engine.closeTrade(999L, CloseReason.MANUAL));
    }

    @Test
    void testCloseOfFailedTradeReturnsItUnchanged() {
        Trade failed = engine.processSignal(TradeSignal.of("ZZZUSD", TradeSide.BUY, "1", "10", "9", "12"));

        Trade result = engine.closeTrade(failed.id(), CloseReason.MANUAL, BigDecimal.TEN);

        assertEquals(TradeStatus.FAILED, result.status());
        assertTrue(notifier.closed.isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Queries and recovery
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testPerformanceIncludesPaperLedger() {
        market.price("ETHUSD", "3297");
        Trade open = engine.processSignal(ethSell());
        engine.closeTrade(open.id(), CloseReason.TAKE_PROFIT, new BigDecimal("3195"));

        TradePerformance performance = engine.getTradePerformance();

        assertEquals(1, performance.stats().closedTrades());
        assertEquals(1, performance.stats().winningTrades());
        assertEquals(100.0, performance.winRate(), 0.0001);
        assertEquals(0, performance.activeInMemory());
        assertTrue(performance.paper().isPresent());
        assertEquals(0, new BigDecimal("102").compareTo(performance.paper().get().totalPnl()));
    }

    @Test
    void testOpenPositionsComeFromGateway() {
        market.price("BTCUSD", "45000");
        engine.processSignal(btcBuy());

        assertEquals(1, engine.getOpenPositions().size());
        assertEquals("BTCUSD", engine.getOpenPositions().get(0).symbol());
    }

    @Test
    void testRecoveryIndexesActiveAndFailsPending() {
        Trade active = repository.insert(Trade.pending(btcBuy(), null, true, Instant.now())
            .withSymbol("BTCUSD")
            .activate("paper_1_abc", new BigDecimal("45000"), Instant.now()));
        Trade pending = repository.insert(Trade.pending(ethSell(), null, true, Instant.now()));

        int recovered = engine.loadActiveTrades();

        assertEquals(1, recovered);
        assertEquals(List.of(active.id()), engine.getActiveTrades().stream().map(Trade::id).toList());
        Trade failed = repository.getTrade(pending.id()).orElseThrow();
        assertEquals(TradeStatus.FAILED, failed.status());
        assertEquals(TradeLifecycleEngine.RECONCILE_REASON, failed.failReason());
        assertTrue(repository.actions(pending.id()).contains(TradeEvent.RECOVERED_FAILED));
    }

    @Test
    void testSlippagePercentIsAbsolute() {
        assertEquals(0, new BigDecimal("1.0000").compareTo(
            TradeLifecycleEngine.slippagePercent(new BigDecimal("100"), new BigDecimal("99"))));
        assertEquals(0, new BigDecimal("3.3333").compareTo(
            TradeLifecycleEngine.slippagePercent(new BigDecimal("45000"), new BigDecimal("46500"))));
    }

    @Test
    void testMaxSlippageComparedUnrounded() {
        BigDecimal entry = new BigDecimal("45000");

        assertFalse(TradeLifecycleEngine.exceedsMaxSlippage(entry, new BigDecimal("45450")));
        assertFalse(TradeLifecycleEngine.exceedsMaxSlippage(entry, new BigDecimal("44550")));
        assertTrue(TradeLifecycleEngine.exceedsMaxSlippage(entry, new BigDecimal("45450.02")));
        assertTrue(TradeLifecycleEngine.exceedsMaxSlippage(entry, new BigDecimal("44549.98")));
    }

    @Test
    void testSlippageGuardCarriesPrices() {
        BigDecimal entry = new BigDecimal("45000");

        assertEquals(0, BigDecimal.ONE.compareTo(
            TradeLifecycleEngine.requireWithinSlippage(entry, new BigDecimal("45450"))));
        SlippageExceededException e = assertThrows(SlippageExceededException.class,
            () -> TradeLifecycleEngine.requireWithinSlippage(entry, new BigDecimal("46000")));
        assertEquals(entry, e.getEntryPrice());
        assertEquals(new BigDecimal("46000"), e.getMarketPrice());
        assertEquals(new BigDecimal("2.2222"), e.getSlippagePercent());
        assertTrue(e.getMessage().startsWith("Price slippage exceeded 1%"), e.getMessage());
    }
}
