package in.signalbridge.service.signal;

import in.signalbridge.domain.trade.Trade;

import java.util.Optional;

/**
 * What happened to a submitted signal.
 */
public record IntakeResult(Outcome outcome, Trade trade, String reason) {

    public enum Outcome { ACCEPTED, DISCARDED, NO_SIGNAL, FAILED_EXTRACTION }

    public static IntakeResult accepted(Trade trade) {
        return new IntakeResult(Outcome.ACCEPTED, trade, null);
    }

    public static IntakeResult discarded(String reason) {
        return new IntakeResult(Outcome.DISCARDED, null, reason);
    }

    public static IntakeResult noSignal() {
        return new IntakeResult(Outcome.NO_SIGNAL, null, "No trading signal found");
    }

    public static IntakeResult extractionFailed(String reason) {
        return new IntakeResult(Outcome.FAILED_EXTRACTION, null, reason);
    }

    public Optional<Trade> tradeIfPresent() {
        return Optional.ofNullable(trade);
    }
}
