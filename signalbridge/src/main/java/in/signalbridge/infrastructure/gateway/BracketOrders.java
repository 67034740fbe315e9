package in.signalbridge.infrastructure.gateway;

import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.product.Product;

import java.math.BigDecimal;

/**
 * Pre-flight checks shared by both gateways.
 */
final class BracketOrders {

    /**
     * Reject out-of-range sizes and return a copy with tick-rounded prices.
     *
     * @throws OrderRejectedException when the size is outside [minSize, maxSize]
     */
    static BracketOrderRequest prepare(BracketOrderRequest request, String operation) {
        Product product = request.product();
        if (product == null) {
            throw new OrderRejectedException(operation, "?", "No product metadata");
        }
        if (!product.acceptsSize(request.size())) {
            throw new OrderRejectedException(operation, product.symbol(),
                String.format("size %s outside allowed range [%s, %s]",
                    plain(request.size()), plain(product.minSize()), plain(product.maxSize())));
        }
        if (request.entryLimitPrice() == null || request.entryLimitPrice().signum() <= 0) {
            throw new OrderRejectedException(operation, product.symbol(), "missing entry limit price");
        }

        BigDecimal tick = product.tickSize();
        return new BracketOrderRequest(
            product,
            request.side(),
            request.size(),
            TickSizes.round(request.entryLimitPrice(), tick),
            TickSizes.round(request.stopLoss(), tick),
            TickSizes.round(request.takeProfit(), tick),
            request.clientOrderId());
    }

    private static String plain(BigDecimal value) {
        return value == null ? "-" : value.stripTrailingZeros().toPlainString();
    }

    private BracketOrders() {}
}
