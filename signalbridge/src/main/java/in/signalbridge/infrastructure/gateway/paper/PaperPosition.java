package in.signalbridge.infrastructure.gateway.paper;

import java.math.BigDecimal;

/**
 * Net simulated position per symbol. size is signed.
 */
public record PaperPosition(
    String symbol,
    long productId,
    BigDecimal size,
    BigDecimal entryPrice
) {}
