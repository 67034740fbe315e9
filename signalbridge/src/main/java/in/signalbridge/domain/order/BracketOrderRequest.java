package in.signalbridge.domain.order;

import in.signalbridge.domain.product.Product;
import in.signalbridge.domain.trade.TradeSide;

import java.math.BigDecimal;

/**
 * One limit entry order with attached stop-loss and take-profit legs.
 *
 * clientOrderId ties the order back to the local trade id.
 */
public record BracketOrderRequest(
    Product product,
    TradeSide side,
    BigDecimal size,
    BigDecimal entryLimitPrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    String clientOrderId
) {}
