package in.signalbridge.infrastructure.gateway;

import in.signalbridge.domain.order.BidAsk;
import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.order.GatewayMode;
import in.signalbridge.domain.order.PaperLedgerStats;
import in.signalbridge.domain.order.Position;
import in.signalbridge.domain.order.SettlementRequest;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Order Gateway - single contract for live and simulated order execution.
 *
 * The lifecycle engine only sees this interface; which implementation is active
 * is decided once at startup.
 *
 * Implementations:
 * - DeltaOrderGateway: signed REST calls against Delta Exchange
 * - PaperOrderGateway: synthetic orders recorded in a PaperLedger, real public prices
 *
 * Every method may throw {@link GatewayException}; {@link GatewayTimeoutException}
 * means the outcome is unknown.
 */
public interface OrderGateway {

    /**
     * Current market price from a public, unauthenticated endpoint.
     */
    BigDecimal getPrice(String symbol);

    BidAsk getBestBidAsk(String symbol);

    /**
     * Place one limit entry order with attached stop-loss / take-profit legs.
     *
     * Size outside the product's [minSize, maxSize] is rejected with
     * {@link OrderRejectedException} before any I/O. Prices are rounded to the
     * product tick size here, never by the caller.
     *
     * @return exchange order id
     */
    String placeBracketOrder(BracketOrderRequest request);

    /**
     * Cancel the entry order and its bracket legs.
     *
     * Returns normally when the order was cancelled or is definitely no longer open
     * (filled, cancelled, unknown to the venue). Any other outcome throws.
     */
    void cancelOrder(String exchangeOrderId);

    /**
     * Open (non-flat) positions for the given exchange symbols.
     */
    List<Position> getPositions(List<String> symbols);

    /**
     * Book a closed trade. Live: the exchange settles, nothing to do.
     * Paper: closes the simulated position and applies pnl exactly once per order id.
     */
    void settleClose(SettlementRequest request);

    /**
     * Paper account summary, empty for live trading.
     */
    Optional<PaperLedgerStats> paperStats();

    GatewayMode mode();
}
