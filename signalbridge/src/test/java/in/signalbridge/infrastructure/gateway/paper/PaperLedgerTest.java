package in.signalbridge.infrastructure.gateway.paper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.order.PaperLedgerStats;
import in.signalbridge.domain.order.Position;
import in.signalbridge.domain.trade.TradeSide;
import in.signalbridge.support.Products;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PaperLedger and its file store.
 *
 * Tests:
 * - Orders open positions, cancel withdraws them
 * - Settlement applies pnl once per order id
 * - Snapshot survives a save / load through the store
 */
class PaperLedgerTest {

    @TempDir
    Path tempDir;

    private static BracketOrderRequest order(TradeSide side, String size, String price) {
        return new BracketOrderRequest(Products.BTCUSD, side, new BigDecimal(size), new BigDecimal(price),
            new BigDecimal("40000"), new BigDecimal("50000"), "sb-1");
    }

    @Test
    void testStartingState() {
        PaperLedger ledger = new PaperLedger(PaperLedger.DEFAULT_STARTING_BALANCE);

        PaperLedgerStats stats = ledger.stats();
        assertEquals(0, new BigDecimal("10000").compareTo(stats.balance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.totalPnl()));
        assertEquals(0, stats.totalOrders());
        assertTrue(ledger.positions().isEmpty());
    }

    @Test
    void testRecordOrderOpensPosition() {
        PaperLedger ledger = new PaperLedger(new BigDecimal("10000"));

        PaperOrder placed = ledger.recordOrder(order(TradeSide.SELL, "0.5", "45000"));

        assertTrue(placed.orderId().startsWith("paper_"));
        assertEquals(PaperOrderState.OPEN, placed.state());
        List<Position> positions = ledger.positions();
        assertEquals(1, positions.size());
        assertEquals(0, new BigDecimal("-0.5").compareTo(positions.get(0).size()), "Short is negative");
        assertEquals(0, new BigDecimal("10000").compareTo(ledger.balance()), "Placing does not move balance");
    }

    @Test
    void testOrderIdsAreUnique() {
        PaperLedger ledger = new PaperLedger(new BigDecimal("10000"));

        String first = ledger.recordOrder(order(TradeSide.BUY, "1", "45000")).orderId();
        String second = ledger.recordOrder(order(TradeSide.BUY, "1", "45000")).orderId();

        assertNotEquals(first, second);
    }

    @Test
    void testPositionsAverageEntry() {
        PaperLedger ledger = new PaperLedger(new BigDecimal("10000"));
        ledger.recordOrder(order(TradeSide.BUY, "1", "45000"));
        ledger.recordOrder(order(TradeSide.BUY, "1", "46000"));

        Position position = ledger.positions().get(0);
        assertEquals(0, new BigDecimal("2").compareTo(position.size()));
        assertEquals(0, new BigDecimal("45500").compareTo(position.entryPrice()));
    }

    @Test
    void testCancelWithdrawsPosition() {
        PaperLedger ledger = new PaperLedger(new BigDecimal("10000"));
        PaperOrder placed = ledger.recordOrder(order(TradeSide.BUY, "1", "45000"));

        assertEquals(PaperLedger.CancelOutcome.CANCELLED, ledger.cancel(placed.orderId()));
        assertEquals(PaperLedger.CancelOutcome.ALREADY_INACTIVE, ledger.cancel(placed.orderId()));
        assertEquals(PaperLedger.CancelOutcome.NOT_FOUND, ledger.cancel("paper_missing"));

        assertTrue(ledger.positions().isEmpty());
        assertEquals(1, ledger.stats().cancelledOrders());
    }

    @Test
    void testSettleAppliesPnlOnce() {
        PaperLedger ledger = new PaperLedger(new BigDecimal("10000"));
        PaperOrder placed = ledger.recordOrder(order(TradeSide.BUY, "1", "45000"));

        assertTrue(ledger.settle(placed.orderId(), new BigDecimal("250.5")));
        assertFalse(ledger.settle(placed.orderId(), new BigDecimal("250.5")), "Second settle is a no-op");

        assertEquals(0, new BigDecimal("10250.5").compareTo(ledger.balance()));
        assertEquals(PaperOrderState.CLOSED, ledger.order(placed.orderId()).orElseThrow().state());
        assertTrue(ledger.positions().isEmpty(), "Settling an open order flattens it");

        PaperLedgerStats stats = ledger.stats();
        assertEquals(0, new BigDecimal("250.5").compareTo(stats.totalPnl()));
        assertEquals(1, stats.closedOrders());
    }

    @Test
    void testBalanceEqualsStartPlusSettledPnl() {
        PaperLedger ledger = new PaperLedger(new BigDecimal("5000"));
        String a = ledger.recordOrder(order(TradeSide.BUY, "1", "45000")).orderId();
        String b = ledger.recordOrder(order(TradeSide.SELL, "1", "45000")).orderId();

        ledger.settle(a, new BigDecimal("-120"));
        ledger.settle(b, new BigDecimal("75.25"));

        assertEquals(0, new BigDecimal("4955.25").compareTo(ledger.balance()));
        assertEquals(0, new BigDecimal("-44.75").compareTo(ledger.stats().totalPnl()));
    }

    @Test
    void testStoreRoundTripRestoresLedger() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        PaperLedgerStore store = new PaperLedgerStore(tempDir.resolve("nested/paper-ledger.json"), mapper);

        PaperLedger ledger = new PaperLedger(new BigDecimal("10000"));
        String closed = ledger.recordOrder(order(TradeSide.BUY, "1", "45000")).orderId();
        String open = ledger.recordOrder(order(TradeSide.SELL, "0.25", "45100")).orderId();
        ledger.settle(closed, new BigDecimal("310"));
        store.save(ledger.snapshot());

        assertTrue(Files.exists(store.file()));
        PaperLedger restored = PaperLedger.restore(store.load().orElseThrow());

        assertEquals(0, new BigDecimal("10310").compareTo(restored.balance()));
        assertTrue(restored.isSettled(closed));
        assertFalse(restored.settle(closed, new BigDecimal("310")), "Settled ids survive restart");
        assertEquals(PaperOrderState.OPEN, restored.order(open).orElseThrow().state());
        assertEquals(1, restored.positions().size());
    }

    @Test
    void testMissingFileLoadsEmpty() {
        PaperLedgerStore store = new PaperLedgerStore(tempDir.resolve("absent.json"), new ObjectMapper());

        assertTrue(store.load().isEmpty());
    }

    @Test
    void testCorruptFileFailsLoudly() throws Exception {
        Path file = tempDir.resolve("corrupt.json");
        Files.writeString(file, "{not json");
        PaperLedgerStore store = new PaperLedgerStore(file, new ObjectMapper());

        assertThrows(IllegalStateException.class, store::load);
    }
}
