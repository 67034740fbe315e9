package in.signalbridge.service.signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.domain.trade.TradeSide;
import in.signalbridge.domain.trade.TradeSignal;

import java.math.BigDecimal;

/**
 * Parses structured JSON signals:
 * <pre>
 * {"isSignal": true, "symbol": "BTCUSDT", "side": "buy", "entryPrice": 45000,
 *  "stopLoss": 43500, "takeProfit": 48000, "quantity": 0.1, "confidence": 0.85}
 * </pre>
 * {@code "isSignal": false} is NO_SIGNAL. Missing prices are passed through as
 * null and left for the trade validator to reject. Quantity falls back to the
 * configured default when absent.
 */
public final class JsonSignalExtractor implements SignalExtractor {

    private final ObjectMapper mapper;
    private final BigDecimal defaultQuantity;
    private final String source;

    public JsonSignalExtractor(ObjectMapper mapper, BigDecimal defaultQuantity, String source) {
        this.mapper = mapper;
        this.defaultQuantity = defaultQuantity;
        this.source = source;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public ExtractionResult extract(String payload) {
        if (payload == null || payload.isBlank()) {
            return ExtractionResult.failure(name(), "empty payload");
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return ExtractionResult.failure(name(), "not JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ExtractionResult.failure(name(), "expected a JSON object");
        }

        if (root.has("isSignal") && !root.get("isSignal").asBoolean()) {
            return ExtractionResult.noSignal(name());
        }

        String symbol = root.path("symbol").asText("").trim();
        if (symbol.isEmpty()) {
            return ExtractionResult.failure(name(), "symbol missing");
        }

        TradeSide side;
        try {
            side = TradeSide.parse(root.path("side").isMissingNode() ? null : root.path("side").asText());
        } catch (IllegalArgumentException e) {
            return ExtractionResult.failure(name(), e.getMessage());
        }

        double confidence = root.path("confidence").asDouble(1.0);
        if (confidence < 0 || confidence > 1) {
            return ExtractionResult.failure(name(), "confidence must be between 0 and 1, got " + confidence);
        }

        BigDecimal quantity;
        try {
            quantity = decimal(root, "quantity");
        } catch (NumberFormatException e) {
            return ExtractionResult.failure(name(), "quantity is not a number");
        }

        try {
            TradeSignal signal = new TradeSignal(
                symbol,
                side,
                quantity != null ? quantity : defaultQuantity,
                decimal(root, "entryPrice"),
                decimal(root, "stopLoss"),
                decimal(root, "takeProfit"),
                confidence,
                root.path("source").asText(source));
            return ExtractionResult.signal(signal, name());
        } catch (NumberFormatException e) {
            return ExtractionResult.failure(name(), "price is not a number");
        }
    }

    private static BigDecimal decimal(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : new BigDecimal(text);
    }
}
