package in.signalbridge.domain.trade;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Append-only audit record of something that happened to a trade.
 */
public record TradeEvent(
    Long id,
    long tradeId,
    String action,
    JsonNode details,
    Instant timestamp
) {
    public static final String CREATED = "created";
    public static final String VALIDATION_FAILED = "validation_failed";
    public static final String REJECTED_SYMBOL = "rejected_symbol";
    public static final String REJECTED_SLIPPAGE = "rejected_slippage";
    public static final String BRACKET_ORDER_PLACED = "bracket_order_placed";
    public static final String EXECUTION_FAILED = "execution_failed";
    public static final String CLOSED = "closed";
    public static final String CLOSE_FAILED = "close_failed";
    public static final String RECOVERED_FAILED = "recovered_failed";

    public static TradeEvent of(long tradeId, String action, JsonNode details, Instant timestamp) {
        return new TradeEvent(null, tradeId, action, details, timestamp);
    }
}
