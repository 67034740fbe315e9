package in.signalbridge.domain.order;

import java.math.BigDecimal;

/**
 * Paper trading account summary.
 */
public record PaperLedgerStats(
    BigDecimal balance,
    BigDecimal startingBalance,
    BigDecimal totalPnl,
    int totalOrders,
    int openOrders,
    int closedOrders,
    int cancelledOrders,
    int openPositions
) {}
