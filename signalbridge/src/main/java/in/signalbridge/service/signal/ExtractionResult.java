package in.signalbridge.service.signal;

import in.signalbridge.domain.trade.TradeSignal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a signal extraction attempt.
 *
 * NO_SIGNAL means the input was understood and contains no trade idea.
 * FAILURE means the extractor could not process the input at all.
 */
public record ExtractionResult(Kind kind, TradeSignal signal, List<String> failures, String extractor) {

    public enum Kind { SIGNAL, NO_SIGNAL, FAILURE }

    public ExtractionResult {
        Objects.requireNonNull(kind, "kind");
        failures = failures == null ? List.of() : List.copyOf(failures);
        if (kind == Kind.SIGNAL && signal == null) {
            throw new IllegalArgumentException("SIGNAL result requires a signal");
        }
    }

    public static ExtractionResult signal(TradeSignal signal, String extractor) {
        return new ExtractionResult(Kind.SIGNAL, signal, List.of(), extractor);
    }

    public static ExtractionResult noSignal(String extractor) {
        return new ExtractionResult(Kind.NO_SIGNAL, null, List.of(), extractor);
    }

    public static ExtractionResult failure(String extractor, String reason) {
        return new ExtractionResult(Kind.FAILURE, null, List.of(extractor + ": " + reason), extractor);
    }

    public boolean hasSignal() {
        return kind == Kind.SIGNAL;
    }

    public Optional<TradeSignal> signalIfPresent() {
        return Optional.ofNullable(signal);
    }
}
