package in.signalbridge.service.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered fallback over several extractors.
 *
 * Stops at the first SIGNAL. If no extractor produced one, the result is
 * NO_SIGNAL when at least one extractor understood the input, FAILURE when
 * every extractor failed. A signal is never invented.
 */
public final class SignalExtractionChain {
    private static final Logger log = LoggerFactory.getLogger(SignalExtractionChain.class);

    private final List<SignalExtractor> extractors;

    public SignalExtractionChain(List<SignalExtractor> extractors) {
        if (extractors == null || extractors.isEmpty()) {
            throw new IllegalArgumentException("At least one extractor is required");
        }
        this.extractors = List.copyOf(extractors);
    }

    public ExtractionResult extract(String payload) {
        List<String> failures = new ArrayList<>();
        boolean understood = false;

        for (SignalExtractor extractor : extractors) {
            ExtractionResult result;
            try {
                result = extractor.extract(payload);
            } catch (RuntimeException e) {
                log.warn("[SIGNAL] Extractor {} threw: {}", extractor.name(), e.getMessage());
                failures.add(extractor.name() + ": " + e.getMessage());
                continue;
            }

            switch (result.kind()) {
                case SIGNAL -> {
                    log.debug("[SIGNAL] {} produced {} {}", extractor.name(),
                        result.signal().side(), result.signal().symbol());
                    return result;
                }
                case NO_SIGNAL -> understood = true;
                case FAILURE -> failures.addAll(result.failures());
            }
        }

        if (understood) {
            return new ExtractionResult(ExtractionResult.Kind.NO_SIGNAL, null, failures, null);
        }
        log.warn("[SIGNAL] All {} extractors failed: {}", extractors.size(), failures);
        return new ExtractionResult(ExtractionResult.Kind.FAILURE, null, failures, null);
    }

    public int size() {
        return extractors.size();
    }
}
