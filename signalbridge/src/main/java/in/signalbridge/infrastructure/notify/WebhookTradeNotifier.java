package in.signalbridge.infrastructure.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.signalbridge.application.port.output.TradeNotifier;
import in.signalbridge.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Posts a JSON message per trade transition to a webhook URL.
 *
 * Delivery is asynchronous and best effort: failures are logged and never reach the caller.
 *
 * Body:
 * <pre>
 * {"event":"closed","tradeId":42,"symbol":"ETHUSD","side":"SELL","status":"CLOSED",
 *  "quantity":"1","entryPrice":"3297","exitPrice":"3195","pnl":"102","closeReason":"take_profit",
 *  "text":"..."}
 * </pre>
 */
public final class WebhookTradeNotifier implements TradeNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookTradeNotifier.class);

    private final URI endpoint;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public WebhookTradeNotifier(URI endpoint, ObjectMapper mapper, Duration connectTimeout, Duration requestTimeout) {
        this.endpoint = endpoint;
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public void onOpened(Trade trade) {
        post("opened", trade, String.format("📈 %s %s %s @ %s | SL %s | TP %s",
            trade.side(), plain(trade.quantity()), trade.symbol(), plain(trade.actualEntryPrice()),
            plain(trade.stopLoss()), plain(trade.takeProfit())));
    }

    @Override
    public void onClosed(Trade trade) {
        post("closed", trade, String.format("🏁 %s %s closed (%s) @ %s | PnL %s",
            trade.side(), trade.symbol(),
            trade.closeReason() == null ? "-" : trade.closeReason().code(),
            plain(trade.exitPrice()), plain(trade.pnl())));
    }

    @Override
    public void onFailed(Trade trade) {
        post("failed", trade, String.format("✗ %s %s failed: %s",
            trade.side(), trade.symbol(), trade.failReason()));
    }

    CompletableFuture<Integer> post(String event, Trade trade, String text) {
        String body;
        try {
            body = mapper.writeValueAsString(payload(event, trade, text));
        } catch (JsonProcessingException e) {
            log.error("[NOTIFY] Failed to serialize {} notification for trade {}: {}", event, trade.id(), e.getMessage());
            return CompletableFuture.completedFuture(-1);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
            .thenApply(response -> {
                if (response.statusCode() >= 300) {
                    log.warn("[NOTIFY] Webhook returned HTTP {} for {} of trade {}",
                        response.statusCode(), event, trade.id());
                } else {
                    log.debug("[NOTIFY] Webhook delivered {} for trade {}", event, trade.id());
                }
                return response.statusCode();
            })
            .exceptionally(e -> {
                log.warn("[NOTIFY] Webhook delivery failed for {} of trade {}: {}", event, trade.id(), e.getMessage());
                return -1;
            });
    }

    private ObjectNode payload(String event, Trade trade, String text) {
        ObjectNode node = mapper.createObjectNode();
        node.put("event", event);
        if (trade.id() != null) {
            node.put("tradeId", trade.id());
        }
        node.put("symbol", trade.symbol());
        node.put("side", trade.side() == null ? null : trade.side().name());
        node.put("status", trade.status().name());
        node.put("simulated", trade.simulated());
        node.put("quantity", plain(trade.quantity()));
        node.put("entryPrice", plain(trade.effectiveEntryPrice()));
        if (trade.exchangeOrderId() != null) node.put("orderId", trade.exchangeOrderId());
        if (trade.exitPrice() != null) node.put("exitPrice", plain(trade.exitPrice()));
        if (trade.pnl() != null) node.put("pnl", plain(trade.pnl()));
        if (trade.closeReason() != null) node.put("closeReason", trade.closeReason().code());
        if (trade.failReason() != null) node.put("failReason", trade.failReason());
        node.put("text", text);
        return node;
    }

    private static String plain(BigDecimal value) {
        return value == null ? "-" : value.stripTrailingZeros().toPlainString();
    }
}
