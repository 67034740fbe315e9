package in.signalbridge.service.trade;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one monitor pass. Per-trade errors are collected here, never thrown.
 */
public record MonitorPassResult(
    boolean skipped,
    int checked,
    int closed,
    List<String> errors,
    Duration duration
) {
    public MonitorPassResult {
        errors = List.copyOf(errors);
    }

    public static MonitorPassResult skippedPass() {
        return new MonitorPassResult(true, 0, 0, List.of(), Duration.ZERO);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
