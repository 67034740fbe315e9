package in.signalbridge.service.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeSide;
import in.signalbridge.domain.trade.TradeSignal;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import in.signalbridge.service.trade.TradeLifecycleEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignalIntakeTest {

    @Mock
    private TradeLifecycleEngine engine;
    @Mock
    private TradingMetrics metrics;

    private SignalIntake intake;

    @BeforeEach
    void setUp() {
        SignalExtractionChain chain = new SignalExtractionChain(List.of(
            new JsonSignalExtractor(new ObjectMapper(), new BigDecimal("0.01"), "api")));
        intake = new SignalIntake(chain, engine, 0.5, metrics);
    }

    private static TradeSignal withConfidence(double confidence) {
        return new TradeSignal("BTC", TradeSide.BUY, new BigDecimal("0.01"), new BigDecimal("45000"),
            new BigDecimal("43000"), new BigDecimal("48000"), confidence, "api");
    }

    @Test
    void testSubmitMessageAcceptedSignalReachesEngine() {
        Trade trade = Trade.pending(withConfidence(0.85), null, true, Instant.now()).withId(11L);
        when(engine.processSignal(any())).thenReturn(trade);

        IntakeResult result = intake.submitMessage("{\"isSignal\":true,\"confidence\":0.85,\"symbol\":\"BTCUSDT\","
            + "\"side\":\"buy\",\"entryPrice\":45000,\"stopLoss\":43500,\"takeProfit\":48000,\"quantity\":0.1}");

        assertEquals(IntakeResult.Outcome.ACCEPTED, result.outcome());
        assertEquals(trade, result.tradeIfPresent().orElseThrow());
        verify(engine).processSignal(argThat(s -> s.symbol().equals("BTCUSDT") && s.confidence() == 0.85));
        verify(metrics).recordSignal("accepted");
    }

    @Test
    void testSubmitConfidenceAtMinimumIsDiscarded() {
        IntakeResult result = intake.submit(withConfidence(0.5));

        assertEquals(IntakeResult.Outcome.DISCARDED, result.outcome());
        assertEquals("Confidence 0.50 not above minimum 0.50", result.reason());
        assertTrue(result.tradeIfPresent().isEmpty());
        verifyNoInteractions(engine);
        verify(metrics).recordSignal("discarded");
    }

    @Test
    void testSubmitConfidenceJustAboveMinimumIsAccepted() {
        when(engine.processSignal(any())).thenReturn(Trade.pending(withConfidence(0.51), null, true, Instant.now()));

        assertEquals(IntakeResult.Outcome.ACCEPTED, intake.submit(withConfidence(0.51)).outcome());
    }

    @Test
    void testSubmitMessageNoSignal() {
        IntakeResult result = intake.submitMessage("{\"isSignal\": false}");

        assertEquals(IntakeResult.Outcome.NO_SIGNAL, result.outcome());
        verifyNoInteractions(engine);
        verify(metrics).recordSignal("no_signal");
    }

    @Test
    void testSubmitMessageUnparseable() {
        IntakeResult result = intake.submitMessage("going long on BTC");

        assertEquals(IntakeResult.Outcome.FAILED_EXTRACTION, result.outcome());
        assertTrue(result.reason().startsWith("json: not JSON"), result.reason());
        verifyNoInteractions(engine);
        verify(metrics).recordSignal("failure");
    }
}
