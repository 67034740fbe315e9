package in.signalbridge.domain.order;

import in.signalbridge.domain.trade.TradeSide;

import java.math.BigDecimal;

/**
 * Settlement of a closed trade against the gateway's books.
 */
public record SettlementRequest(
    String exchangeOrderId,
    String symbol,
    TradeSide side,
    BigDecimal quantity,
    BigDecimal exitPrice,
    BigDecimal pnl
) {}
