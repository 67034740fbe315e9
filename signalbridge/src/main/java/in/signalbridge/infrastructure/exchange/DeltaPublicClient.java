package in.signalbridge.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import in.signalbridge.domain.order.BidAsk;
import in.signalbridge.domain.product.Product;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.service.product.ProductCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Public (unauthenticated) Delta Exchange market data.
 *
 * Endpoints:
 * - GET /v2/products                 live product catalog
 * - GET /v2/tickers/{symbol}         last price (result.close), quotes
 * - GET /v2/l2orderbook/{symbol}     best bid (buy[0]) / best ask (sell[0])
 *
 * Price lookups never carry credentials so they do not reveal trade intent.
 */
public final class DeltaPublicClient implements ProductCatalog, MarketDataFeed {
    private static final Logger log = LoggerFactory.getLogger(DeltaPublicClient.class);

    private static final String LIVE_STATE = "live";

    private final DeltaHttp http;

    public DeltaPublicClient(DeltaHttp http) {
        this.http = http;
    }

    @Override
    public List<Product> fetchLiveProducts() {
        JsonNode json = http.get("products", "/v2/products");
        JsonNode result = json.path("result");
        if (!result.isArray()) {
            throw new GatewayException("products", "Invalid response format from products API");
        }

        Instant now = Instant.now();
        List<Product> products = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : result) {
            if (!LIVE_STATE.equals(node.path("state").asText())) {
                skipped++;
                continue;
            }
            products.add(new Product(
                node.path("id").asLong(),
                node.path("symbol").asText(),
                textOrNull(node.path("underlying_asset").path("symbol")),
                textOrNull(node.path("quoting_asset").path("symbol")),
                decimalOrNull(node.path("tick_size")),
                decimalOrNull(node.path("min_size_base")),
                decimalOrNull(node.path("max_size_base")),
                now));
        }
        log.debug("[DELTA] Products: {} live, {} skipped", products.size(), skipped);
        return products;
    }

    /**
     * Last traded price.
     */
    @Override
    public BigDecimal getTickerPrice(String symbol) {
        JsonNode result = http.get("price", "/v2/tickers/" + encode(symbol)).path("result");
        BigDecimal close = decimalOrNull(result.path("close"));
        if (close == null) {
            close = decimalOrNull(result.path("mark_price"));
        }
        if (close == null || close.signum() <= 0) {
            throw new GatewayException("price", "No price in ticker response for " + symbol);
        }
        return close;
    }

    /**
     * Best bid / ask from the L2 order book, falling back to ticker quotes when a side is empty.
     */
    @Override
    public BidAsk getBestBidAsk(String symbol) {
        JsonNode book = http.get("bid_ask", "/v2/l2orderbook/" + encode(symbol)).path("result");
        BigDecimal bid = decimalOrNull(book.path("buy").path(0).path("price"));
        BigDecimal ask = decimalOrNull(book.path("sell").path(0).path("price"));

        if (bid == null || ask == null) {
            JsonNode quotes = http.get("bid_ask", "/v2/tickers/" + encode(symbol)).path("result").path("quotes");
            if (bid == null) bid = decimalOrNull(quotes.path("best_bid"));
            if (ask == null) ask = decimalOrNull(quotes.path("best_ask"));
        }
        if (bid == null || ask == null) {
            throw new GatewayException("bid_ask", "Order book for " + symbol + " has no bid/ask");
        }
        return new BidAsk(bid, ask);
    }

    static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        String text = node.asText();
        if (text.isBlank()) return null;
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String encode(String symbol) {
        return URLEncoder.encode(symbol, StandardCharsets.UTF_8);
    }
}
