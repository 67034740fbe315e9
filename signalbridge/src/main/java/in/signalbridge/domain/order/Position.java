package in.signalbridge.domain.order;

import java.math.BigDecimal;

/**
 * Open position on the exchange (or in the paper ledger).
 *
 * size is signed: positive long, negative short.
 */
public record Position(
    String symbol,
    long productId,
    BigDecimal size,
    BigDecimal entryPrice
) {
    public boolean isFlat() {
        return size == null || size.signum() == 0;
    }
}
