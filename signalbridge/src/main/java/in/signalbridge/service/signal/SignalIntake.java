package in.signalbridge.service.signal;

import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeSignal;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import in.signalbridge.service.trade.TradeLifecycleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Front door for signals: extraction, confidence filter, then the engine.
 *
 * A signal is admitted only when its confidence is strictly greater than the
 * configured minimum.
 */
public final class SignalIntake {
    private static final Logger log = LoggerFactory.getLogger(SignalIntake.class);

    private final SignalExtractionChain extractionChain;
    private final TradeLifecycleEngine engine;
    private final double minConfidence;
    private final TradingMetrics metrics;

    public SignalIntake(SignalExtractionChain extractionChain, TradeLifecycleEngine engine,
                        double minConfidence, TradingMetrics metrics) {
        this.extractionChain = extractionChain;
        this.engine = engine;
        this.minConfidence = minConfidence;
        this.metrics = metrics;
    }

    /**
     * Extract a signal from a raw message and submit it.
     */
    public IntakeResult submitMessage(String payload) {
        ExtractionResult extraction = extractionChain.extract(payload);
        return switch (extraction.kind()) {
            case SIGNAL -> submit(extraction.signal());
            case NO_SIGNAL -> {
                metrics.recordSignal("no_signal");
                yield IntakeResult.noSignal();
            }
            case FAILURE -> {
                metrics.recordSignal("failure");
                String reason = String.join("; ", extraction.failures());
                log.warn("[INTAKE] Extraction failed: {}", reason);
                yield IntakeResult.extractionFailed(reason);
            }
        };
    }

    public IntakeResult submit(TradeSignal signal) {
        if (signal.confidence() <= minConfidence) {
            metrics.recordSignal("discarded");
            log.info("[INTAKE] Discarding {} {} from {}: confidence {} not above {}",
                signal.side(), signal.symbol(), signal.source(), signal.confidence(), minConfidence);
            return IntakeResult.discarded(
                String.format(Locale.ROOT, "Confidence %.2f not above minimum %.2f", signal.confidence(), minConfidence));
        }

        metrics.recordSignal("accepted");
        log.info("[INTAKE] Accepted {} {} from {} (confidence {})",
            signal.side(), signal.symbol(), signal.source(), signal.confidence());
        Trade trade = engine.processSignal(signal);
        return IntakeResult.accepted(trade);
    }
}
