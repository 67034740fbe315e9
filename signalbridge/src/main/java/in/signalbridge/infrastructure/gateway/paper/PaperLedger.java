package in.signalbridge.infrastructure.gateway.paper;

import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.order.PaperLedgerStats;
import in.signalbridge.domain.order.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * PaperLedger - simulated account state.
 *
 * STATE:
 * - balance (starts at the configured starting balance, 10,000 by default)
 * - synthetic order id -> PaperOrder
 * - symbol -> net PaperPosition
 * - ids of orders whose pnl has already been applied
 *
 * INVARIANT:
 * balance == startingBalance + sum(pnl of settled orders). Each order id is
 * settled at most once.
 *
 * All mutators are synchronized; callers arrive from different coordinator partitions.
 */
public final class PaperLedger {
    private static final Logger log = LoggerFactory.getLogger(PaperLedger.class);

    public static final BigDecimal DEFAULT_STARTING_BALANCE = new BigDecimal("10000");

    public enum CancelOutcome { CANCELLED, ALREADY_INACTIVE, NOT_FOUND }

    private final BigDecimal startingBalance;
    private BigDecimal balance;
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private final Set<String> settledOrderIds = new HashSet<>();

    public PaperLedger(BigDecimal startingBalance) {
        this.startingBalance = startingBalance;
        this.balance = startingBalance;
    }

    public static PaperLedger restore(PaperLedgerSnapshot snapshot) {
        PaperLedger ledger = new PaperLedger(snapshot.startingBalance());
        ledger.balance = snapshot.balance();
        for (PaperOrder order : snapshot.orders()) {
            ledger.orders.put(order.orderId(), order);
        }
        for (PaperPosition position : snapshot.positions()) {
            ledger.positions.put(position.symbol(), position);
        }
        ledger.settledOrderIds.addAll(snapshot.settledOrderIds());
        return ledger;
    }

    /**
     * Record a new simulated order and open its position. No external I/O.
     */
    public synchronized PaperOrder recordOrder(BracketOrderRequest request) {
        String orderId = newOrderId();
        Instant now = Instant.now();
        PaperOrder order = new PaperOrder(
            orderId,
            request.product().productId(),
            request.product().symbol(),
            request.side(),
            request.size(),
            request.entryLimitPrice(),
            request.stopLoss(),
            request.takeProfit(),
            request.clientOrderId(),
            PaperOrderState.OPEN,
            now,
            now);
        orders.put(orderId, order);
        addToPosition(order, order.signedSize());
        log.info("[PAPER] Order {} placed: {} {} {} @ {}", orderId, order.side(),
            order.size().toPlainString(), order.symbol(), order.limitPrice().toPlainString());
        return order;
    }

    /**
     * Cancel an OPEN order and withdraw its position contribution.
     */
    public synchronized CancelOutcome cancel(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            return CancelOutcome.NOT_FOUND;
        }
        if (order.state() != PaperOrderState.OPEN) {
            return CancelOutcome.ALREADY_INACTIVE;
        }
        orders.put(orderId, order.withState(PaperOrderState.CANCELLED));
        addToPosition(order, order.signedSize().negate());
        log.info("[PAPER] Order {} cancelled", orderId);
        return CancelOutcome.CANCELLED;
    }

    /**
     * Apply a closed trade's pnl to the balance, once per order id.
     *
     * @return true when applied, false when the order had already been settled
     */
    public synchronized boolean settle(String orderId, BigDecimal pnl) {
        if (!settledOrderIds.add(orderId)) {
            log.debug("[PAPER] Order {} already settled, ignoring", orderId);
            return false;
        }
        PaperOrder order = orders.get(orderId);
        if (order != null) {
            if (order.state() == PaperOrderState.OPEN) {
                addToPosition(order, order.signedSize().negate());
            }
            orders.put(orderId, order.withState(PaperOrderState.CLOSED));
        } else {
            log.warn("[PAPER] Settling unknown order {}", orderId);
        }
        balance = balance.add(pnl);
        log.info("[PAPER] Order {} settled, pnl {} -> balance {}", orderId,
            pnl.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            balance.setScale(2, RoundingMode.HALF_UP).toPlainString());
        return true;
    }

    public synchronized BigDecimal balance() {
        return balance;
    }

    public BigDecimal startingBalance() {
        return startingBalance;
    }

    public synchronized Optional<PaperOrder> order(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public synchronized boolean isSettled(String orderId) {
        return settledOrderIds.contains(orderId);
    }

    public synchronized List<Position> positions() {
        List<Position> result = new ArrayList<>();
        for (PaperPosition p : positions.values()) {
            result.add(new Position(p.symbol(), p.productId(), p.size(), p.entryPrice()));
        }
        return result;
    }

    public synchronized PaperLedgerStats stats() {
        int open = 0;
        int cancelled = 0;
        int closed = 0;
        for (PaperOrder order : orders.values()) {
            switch (order.state()) {
                case OPEN -> open++;
                case CANCELLED -> cancelled++;
                case CLOSED -> closed++;
            }
        }
        return new PaperLedgerStats(balance, startingBalance, balance.subtract(startingBalance),
            orders.size(), open, closed, cancelled, positions.size());
    }

    public synchronized PaperLedgerSnapshot snapshot() {
        return new PaperLedgerSnapshot(balance, startingBalance,
            List.copyOf(orders.values()), List.copyOf(positions.values()), Set.copyOf(settledOrderIds));
    }

    private void addToPosition(PaperOrder order, BigDecimal delta) {
        PaperPosition current = positions.get(order.symbol());
        BigDecimal currentSize = current == null ? BigDecimal.ZERO : current.size();
        BigDecimal newSize = currentSize.add(delta);

        if (newSize.signum() == 0) {
            positions.remove(order.symbol());
            return;
        }

        BigDecimal entry;
        if (current == null || currentSize.signum() != newSize.signum()) {
            entry = order.limitPrice();
        } else if (delta.signum() == currentSize.signum()) {
            BigDecimal notional = current.entryPrice().multiply(currentSize.abs())
                .add(order.limitPrice().multiply(delta.abs()));
            entry = notional.divide(newSize.abs(), 8, RoundingMode.HALF_UP).stripTrailingZeros();
        } else {
            // Reducing keeps the average entry
            entry = current.entryPrice();
        }
        positions.put(order.symbol(), new PaperPosition(order.symbol(), order.productId(), newSize, entry));
    }

    private static String newOrderId() {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "paper_" + System.currentTimeMillis() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }
}
