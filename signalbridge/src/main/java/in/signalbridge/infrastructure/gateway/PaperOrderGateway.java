package in.signalbridge.infrastructure.gateway;

import in.signalbridge.domain.order.BidAsk;
import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.order.GatewayMode;
import in.signalbridge.domain.order.PaperLedgerStats;
import in.signalbridge.domain.order.Position;
import in.signalbridge.domain.order.SettlementRequest;
import in.signalbridge.infrastructure.exchange.MarketDataFeed;
import in.signalbridge.infrastructure.gateway.paper.PaperLedger;
import in.signalbridge.infrastructure.gateway.paper.PaperLedgerStore;
import in.signalbridge.infrastructure.gateway.paper.PaperOrder;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Simulated order gateway.
 *
 * Orders, cancellations and settlements are recorded in the PaperLedger with no
 * exchange calls. Prices still come from the real public feed: paper trading
 * simulates orders, not the market.
 */
public class PaperOrderGateway implements OrderGateway {
    private static final Logger log = LoggerFactory.getLogger(PaperOrderGateway.class);

    private final MarketDataFeed marketData;
    private final PaperLedger ledger;
    private final Optional<PaperLedgerStore> store;
    private final TradingMetrics metrics;

    public PaperOrderGateway(MarketDataFeed marketData, PaperLedger ledger) {
        this(marketData, ledger, null, TradingMetrics.NOOP);
    }

    public PaperOrderGateway(MarketDataFeed marketData, PaperLedger ledger,
                             PaperLedgerStore store, TradingMetrics metrics) {
        this.marketData = marketData;
        this.ledger = ledger;
        this.store = Optional.ofNullable(store);
        this.metrics = metrics;
        metrics.setPaperBalance(ledger.balance());
    }

    @Override
    public BigDecimal getPrice(String symbol) {
        return marketData.getTickerPrice(symbol);
    }

    @Override
    public BidAsk getBestBidAsk(String symbol) {
        return marketData.getBestBidAsk(symbol);
    }

    @Override
    public String placeBracketOrder(BracketOrderRequest request) {
        BracketOrderRequest order = BracketOrders.prepare(request, "place_order");
        PaperOrder placed = ledger.recordOrder(order);
        persist();
        return placed.orderId();
    }

    @Override
    public void cancelOrder(String exchangeOrderId) {
        switch (ledger.cancel(exchangeOrderId)) {
            case CANCELLED -> persist();
            case ALREADY_INACTIVE -> log.debug("[PAPER] Order {} no longer open", exchangeOrderId);
            case NOT_FOUND -> log.warn("[PAPER] Order {} not in ledger, nothing to cancel", exchangeOrderId);
        }
    }

    @Override
    public List<Position> getPositions(List<String> symbols) {
        Set<String> wanted = new HashSet<>(symbols);
        return ledger.positions().stream()
            .filter(p -> wanted.contains(p.symbol()))
            .collect(Collectors.toList());
    }

    @Override
    public void settleClose(SettlementRequest request) {
        if (ledger.settle(request.exchangeOrderId(), request.pnl())) {
            metrics.setPaperBalance(ledger.balance());
            persist();
        }
    }

    @Override
    public Optional<PaperLedgerStats> paperStats() {
        return Optional.of(ledger.stats());
    }

    @Override
    public GatewayMode mode() {
        return GatewayMode.PAPER;
    }

    public PaperLedger ledger() {
        return ledger;
    }

    // Snapshot and write under the ledger lock so a later snapshot never lands before an earlier one.
    private void persist() {
        store.ifPresent(s -> {
            synchronized (ledger) {
                s.save(ledger.snapshot());
            }
        });
    }
}
