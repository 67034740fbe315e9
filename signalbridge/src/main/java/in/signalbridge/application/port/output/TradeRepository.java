package in.signalbridge.application.port.output;

import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeEvent;
import in.signalbridge.domain.trade.TradeStatus;
import in.signalbridge.domain.trade.TradingStats;

import java.util.List;
import java.util.Optional;

/**
 * Repository port for trades and their audit events.
 *
 * Implementations throw {@link in.signalbridge.domain.exception.RepositoryException}.
 */
public interface TradeRepository {

    /**
     * Insert a new trade.
     *
     * @return the trade with its assigned id
     */
    Trade saveTrade(Trade trade);

    /**
     * Overwrite the mutable lifecycle fields of an existing trade.
     *
     * @throws in.signalbridge.domain.exception.RepositoryException if no row has that id
     */
    void updateTrade(Trade trade);

    Optional<Trade> getTrade(long id);

    List<Trade> getActiveTrades();

    List<Trade> findByStatus(TradeStatus status);

    TradeEvent addTradeEvent(TradeEvent event);

    /**
     * Events for a trade, oldest first.
     */
    List<TradeEvent> getTradeEvents(long tradeId);

    TradingStats getTradingStats();
}
