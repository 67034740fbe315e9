package in.signalbridge.infrastructure.exchange;

import in.signalbridge.domain.order.BidAsk;

import java.math.BigDecimal;

/**
 * Public price source shared by the live and paper gateways.
 */
public interface MarketDataFeed {

    BigDecimal getTickerPrice(String symbol);

    BidAsk getBestBidAsk(String symbol);
}
