package in.signalbridge.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Startup configuration validator.
 *
 * Called from App.main() before anything is wired. Throws IllegalStateException
 * if the configuration is invalid and the system refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(TradingConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (config.paperTrade()) {
            warnPaperMode(config);
        } else {
            validateLiveMode(config);
        }

        requirePositive("HTTP_CONNECT_TIMEOUT_SECONDS", config.connectTimeout().toSeconds());
        requirePositive("HTTP_REQUEST_TIMEOUT_SECONDS", config.requestTimeout().toSeconds());
        requirePositive("MONITOR_INTERVAL_SECONDS", config.monitorInterval().toSeconds());
        requirePositive("PRODUCT_CACHE_TTL_HOURS", config.productCacheTtl().toHours());

        if (config.minSignalConfidence() < 0 || config.minSignalConfidence() >= 1) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: MIN_SIGNAL_CONFIDENCE must be in [0, 1), got " + config.minSignalConfidence());
        }
        if (config.defaultQuantity().signum() <= 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: DEFAULT_QUANTITY must be positive, got " + config.defaultQuantity());
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateLiveMode(TradingConfig config) {
        log.info("LIVE MODE detected - enforcing strict validation");

        if (!config.hasApiCredentials()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: LIVE trading requires DELTA_API_KEY and DELTA_API_SECRET\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Set DELTA_API_KEY and DELTA_API_SECRET\n" +
                "  2. Set PAPER_TRADE=true for simulated trading"
            );
        }
        log.info("✓ Delta API credentials present");

        if (!config.deltaBaseUrl().startsWith("https://")) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: LIVE trading requires an https DELTA_BASE_URL, got " + config.deltaBaseUrl());
        }
        log.info("✓ Delta API: {}", config.deltaBaseUrl());
    }

    private static void warnPaperMode(TradingConfig config) {
        log.warn("⚠️  ════════════════════════════════════════════════════════");
        log.warn("⚠️  PAPER TRADING mode - orders are simulated, prices are live");
        log.warn("⚠️  ════════════════════════════════════════════════════════");

        if (config.paperInitialBalance().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PAPER_INITIAL_BALANCE must be positive, got " + config.paperInitialBalance());
        }
        if (config.hasApiCredentials()) {
            log.warn("⚠️  API credentials are set but unused while PAPER_TRADE=true");
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
