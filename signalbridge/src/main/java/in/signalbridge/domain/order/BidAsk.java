package in.signalbridge.domain.order;

import in.signalbridge.domain.trade.TradeSide;

import java.math.BigDecimal;

/**
 * Top of book.
 */
public record BidAsk(BigDecimal bid, BigDecimal ask) {

    /**
     * Best opposing price for an entry: the ask when buying, the bid when selling.
     */
    public BigDecimal opposingPrice(TradeSide side) {
        return side == TradeSide.BUY ? ask : bid;
    }
}
