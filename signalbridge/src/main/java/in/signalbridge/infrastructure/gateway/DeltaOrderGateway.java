package in.signalbridge.infrastructure.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.signalbridge.domain.order.BidAsk;
import in.signalbridge.domain.order.BracketOrderRequest;
import in.signalbridge.domain.order.GatewayMode;
import in.signalbridge.domain.order.PaperLedgerStats;
import in.signalbridge.domain.order.Position;
import in.signalbridge.domain.order.SettlementRequest;
import in.signalbridge.domain.product.Product;
import in.signalbridge.infrastructure.exchange.DeltaApiException;
import in.signalbridge.infrastructure.exchange.DeltaHttp;
import in.signalbridge.infrastructure.exchange.MarketDataFeed;
import in.signalbridge.infrastructure.exchange.DeltaRequestSigner;
import in.signalbridge.service.product.ProductResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Delta Exchange live order gateway.
 *
 * Order API:
 * - POST   /v2/orders                  limit entry + bracket_stop_loss_price / bracket_take_profit_price
 * - DELETE /v2/orders/{id}
 * - GET    /v2/positions?product_id=N
 *
 * Authenticated calls are HMAC signed (see DeltaRequestSigner). Prices come
 * from the public ticker / order book endpoints only.
 */
public class DeltaOrderGateway implements OrderGateway {
    private static final Logger log = LoggerFactory.getLogger(DeltaOrderGateway.class);

    private static final Set<String> ORDER_GONE_CODES = Set.of(
        "open_order_not_found", "order_not_found", "order_already_filled", "order_already_cancelled");

    private final DeltaHttp http;
    private final MarketDataFeed marketData;
    private final DeltaRequestSigner signer;
    private final ProductResolver productResolver;

    public DeltaOrderGateway(DeltaHttp http, MarketDataFeed marketData,
                             DeltaRequestSigner signer, ProductResolver productResolver) {
        this.http = http;
        this.marketData = marketData;
        this.signer = signer;
        this.productResolver = productResolver;
    }

    @Override
    public BigDecimal getPrice(String symbol) {
        return marketData.getTickerPrice(symbol);
    }

    @Override
    public BidAsk getBestBidAsk(String symbol) {
        return marketData.getBestBidAsk(symbol);
    }

    @Override
    public String placeBracketOrder(BracketOrderRequest request) {
        BracketOrderRequest order = BracketOrders.prepare(request, "place_order");
        Product product = order.product();

        ObjectNode payload = http.mapper().createObjectNode();
        payload.put("product_id", product.productId());
        payload.put("size", order.size());
        payload.put("side", order.side().wireValue());
        payload.put("order_type", "limit_order");
        payload.put("limit_price", order.entryLimitPrice().toPlainString());
        payload.put("bracket_stop_loss_price", order.stopLoss().toPlainString());
        payload.put("bracket_take_profit_price", order.takeProfit().toPlainString());
        if (order.clientOrderId() != null) {
            payload.put("client_order_id", order.clientOrderId());
        }

        log.info("[DELTA] Placing {} {} {} @ {} (SL {}, TP {})",
            order.side(), order.size().toPlainString(), product.symbol(),
            order.entryLimitPrice().toPlainString(), order.stopLoss().toPlainString(),
            order.takeProfit().toPlainString());

        JsonNode response;
        try {
            response = signed("place_order", "POST", "/v2/orders", write(payload));
        } catch (DeltaApiException e) {
            if (e.isClientError()) {
                throw new OrderRejectedException("place_order", product.symbol(),
                    e.getErrorCode() + " (HTTP " + e.getStatusCode() + ")");
            }
            throw e;
        }

        String orderId = response.path("result").path("id").asText("");
        if (orderId.isEmpty()) {
            throw new GatewayException("place_order", "Order response carried no id: " + response);
        }
        log.info("[DELTA] ✅ Order {} accepted for {}", orderId, product.symbol());
        return orderId;
    }

    @Override
    public void cancelOrder(String exchangeOrderId) {
        try {
            signed("cancel_order", "DELETE", "/v2/orders/" + encode(exchangeOrderId), null);
        } catch (DeltaApiException e) {
            if (!isOrderGone(e)) {
                throw e;
            }
            log.info("[DELTA] Order {} already inactive: {}", exchangeOrderId, e.getErrorCode());
            return;
        }
        log.info("[DELTA] Order {} cancelled", exchangeOrderId);
    }

    /**
     * Definite "nothing left to cancel" answers. Auth, rate-limit and 5xx errors are not.
     */
    static boolean isOrderGone(DeltaApiException e) {
        return e.getStatusCode() == 404 || ORDER_GONE_CODES.contains(e.getErrorCode());
    }

    @Override
    public List<Position> getPositions(List<String> symbols) {
        List<Position> positions = new ArrayList<>();
        for (String symbol : symbols) {
            Optional<Product> product = productResolver.cached(symbol).or(() -> productResolver.resolve(symbol));
            if (product.isEmpty()) {
                log.warn("[DELTA] No product for {}, skipping position lookup", symbol);
                continue;
            }
            long productId = product.get().productId();
            JsonNode result = signed("positions", "GET", "/v2/positions?product_id=" + productId, null)
                .path("result");

            BigDecimal size = decimal(result.path("size"));
            BigDecimal entry = decimal(result.path("entry_price"));
            if (size == null || size.signum() == 0 || entry == null) {
                log.debug("[DELTA] No open position for {}", symbol);
                continue;
            }
            positions.add(new Position(symbol, productId, size, entry));
        }
        log.info("[DELTA] {} open positions across {} symbols", positions.size(), symbols.size());
        return positions;
    }

    @Override
    public void settleClose(SettlementRequest request) {
        log.debug("[DELTA] Settlement for order {} handled by exchange", request.exchangeOrderId());
    }

    @Override
    public Optional<PaperLedgerStats> paperStats() {
        return Optional.empty();
    }

    @Override
    public GatewayMode mode() {
        return GatewayMode.LIVE;
    }

    private JsonNode signed(String operation, String method, String path, String body) {
        return http.send(operation, method, path, body, signer.headers(method, path, body));
    }

    private String write(ObjectNode payload) {
        try {
            return http.mapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GatewayException("place_order", "Failed to serialize order: " + e.getMessage(), e);
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) return null;
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
