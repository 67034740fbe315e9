package in.signalbridge.application.port.output;

import in.signalbridge.domain.trade.Trade;

/**
 * Notification port, informed after terminal and activation transitions.
 *
 * Delivery failures must never affect trade state; callers catch and log.
 */
public interface TradeNotifier {

    void onOpened(Trade trade);

    void onClosed(Trade trade);

    void onFailed(Trade trade);
}
