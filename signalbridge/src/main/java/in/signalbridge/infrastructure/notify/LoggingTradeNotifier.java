package in.signalbridge.infrastructure.notify;

import in.signalbridge.application.port.output.TradeNotifier;
import in.signalbridge.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that only writes to the log. Default when no webhook is configured.
 */
public final class LoggingTradeNotifier implements TradeNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingTradeNotifier.class);

    @Override
    public void onOpened(Trade trade) {
        log.info("[NOTIFY] 📈 Trade {} OPENED: {} {} {} @ {} (SL {}, TP {}) order {}",
            trade.id(), trade.side(), trade.quantity(), trade.symbol(), trade.actualEntryPrice(),
            trade.stopLoss(), trade.takeProfit(), trade.exchangeOrderId());
    }

    @Override
    public void onClosed(Trade trade) {
        log.info("[NOTIFY] 🏁 Trade {} CLOSED ({}): {} {} exit {} pnl {}",
            trade.id(), trade.closeReason() == null ? "-" : trade.closeReason().code(),
            trade.side(), trade.symbol(), trade.exitPrice(), trade.pnl());
    }

    @Override
    public void onFailed(Trade trade) {
        log.warn("[NOTIFY] ✗ Trade {} FAILED: {} {} - {}",
            trade.id(), trade.side(), trade.symbol(), trade.failReason());
    }
}
