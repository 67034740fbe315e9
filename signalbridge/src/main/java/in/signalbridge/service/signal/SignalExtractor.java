package in.signalbridge.service.signal;

/**
 * Turns a raw message payload into a trading signal.
 *
 * Implementations report failure through {@link ExtractionResult}, they do not throw.
 */
public interface SignalExtractor {

    String name();

    ExtractionResult extract(String payload);
}
