package in.signalbridge.service.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.domain.trade.TradeSide;
import in.signalbridge.domain.trade.TradeSignal;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JsonSignalExtractor.
 */
class JsonSignalExtractorTest {

    private final JsonSignalExtractor extractor =
        new JsonSignalExtractor(new ObjectMapper(), new BigDecimal("0.01"), "api");

    @Test
    void testFullSignal() {
        ExtractionResult result = extractor.extract("{\"isSignal\":true,\"confidence\":0.85,\"symbol\":\"BTCUSDT\","
            + "\"side\":\"buy\",\"entryPrice\":45000,\"stopLoss\":43500,\"takeProfit\":48000,\"quantity\":0.1}");

        assertEquals(ExtractionResult.Kind.SIGNAL, result.kind());
        TradeSignal signal = result.signal();
        assertEquals("BTCUSDT", signal.symbol(), "Normalization happens in the resolver, not here");
        assertEquals(TradeSide.BUY, signal.side());
        assertEquals(0, new BigDecimal("0.1").compareTo(signal.quantity()));
        assertEquals(0, new BigDecimal("45000").compareTo(signal.entryPrice()));
        assertEquals(0, new BigDecimal("43500").compareTo(signal.stopLoss()));
        assertEquals(0, new BigDecimal("48000").compareTo(signal.takeProfit()));
        assertEquals(0.85, signal.confidence(), 1e-9);
        assertEquals("api", signal.source());
        assertEquals("json", result.extractor());
    }

    @Test
    void testExplicitNoSignal() {
        ExtractionResult result = extractor.extract("{\"isSignal\": false}");

        assertEquals(ExtractionResult.Kind.NO_SIGNAL, result.kind());
        assertFalse(result.hasSignal());
    }

    @Test
    void testDefaultsForQuantityAndConfidence() {
        ExtractionResult result = extractor.extract("{\"symbol\":\"ETH\",\"side\":\"short\","
            + "\"entryPrice\":\"3297\",\"stopLoss\":\"3309\",\"takeProfit\":\"3200\",\"source\":\"desk\"}");

        TradeSignal signal = result.signalIfPresent().orElseThrow();
        assertEquals(TradeSide.SELL, signal.side());
        assertEquals(0, new BigDecimal("0.01").compareTo(signal.quantity()));
        assertEquals(1.0, signal.confidence(), 1e-9);
        assertEquals("desk", signal.source());
        assertEquals(0, new BigDecimal("3297").compareTo(signal.entryPrice()), "String prices are accepted");
    }

    @Test
    void testMissingPricesPassThroughAsNull() {
        ExtractionResult result = extractor.extract("{\"symbol\":\"SOL\",\"side\":\"buy\",\"entryPrice\":142}");

        TradeSignal signal = result.signal();
        assertNull(signal.stopLoss());
        assertNull(signal.takeProfit());
    }

    @Test
    void testFailures() {
        assertFailure("", "empty payload");
        assertFailure("buy BTC now", "not JSON");
        assertFailure("[1,2]", "expected a JSON object");
        assertFailure("{\"side\":\"buy\"}", "symbol missing");
        assertFailure("{\"symbol\":\"BTC\",\"side\":\"hold\"}", "Unknown side");
        assertFailure("{\"symbol\":\"BTC\"}", "Side is required");
        assertFailure("{\"symbol\":\"BTC\",\"side\":\"buy\",\"confidence\":1.5}", "confidence must be between 0 and 1");
        assertFailure("{\"symbol\":\"BTC\",\"side\":\"buy\",\"quantity\":\"lots\"}", "quantity is not a number");
        assertFailure("{\"symbol\":\"BTC\",\"side\":\"buy\",\"entryPrice\":\"market\"}", "price is not a number");
    }

    private void assertFailure(String payload, String expected) {
        ExtractionResult result = extractor.extract(payload);
        assertEquals(ExtractionResult.Kind.FAILURE, result.kind(), payload);
        assertEquals(1, result.failures().size());
        assertTrue(result.failures().get(0).startsWith("json: "), result.failures().get(0));
        assertTrue(result.failures().get(0).contains(expected), result.failures().get(0));
    }
}
