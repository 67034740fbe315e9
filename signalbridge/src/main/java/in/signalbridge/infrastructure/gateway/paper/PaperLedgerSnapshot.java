package in.signalbridge.infrastructure.gateway.paper;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Serializable copy of the ledger state.
 */
public record PaperLedgerSnapshot(
    BigDecimal balance,
    BigDecimal startingBalance,
    List<PaperOrder> orders,
    List<PaperPosition> positions,
    Set<String> settledOrderIds
) {}
