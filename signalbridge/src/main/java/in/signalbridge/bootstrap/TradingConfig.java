package in.signalbridge.bootstrap;

import in.signalbridge.util.Env;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Runtime configuration, read once at startup.
 */
public record TradingConfig(
    boolean paperTrade,
    String deltaBaseUrl,
    String deltaApiKey,
    String deltaApiSecret,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration monitorInterval,
    Duration productCacheTtl,
    BigDecimal paperInitialBalance,
    String paperLedgerFile,
    double minSignalConfidence,
    BigDecimal defaultQuantity,
    String notifyWebhookUrl,
    String metricsHost,
    int metricsPort,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize
) {
    public static TradingConfig fromEnv() {
        return new TradingConfig(
            // paper unless explicitly disabled
            !"false".equalsIgnoreCase(Env.get("PAPER_TRADE", "true").trim()),
            Env.get("DELTA_BASE_URL", "https://api.delta.exchange"),
            Env.get("DELTA_API_KEY", ""),
            Env.get("DELTA_API_SECRET", ""),
            Duration.ofSeconds(Env.getLong("HTTP_CONNECT_TIMEOUT_SECONDS", 10)),
            Duration.ofSeconds(Env.getLong("HTTP_REQUEST_TIMEOUT_SECONDS", 15)),
            Duration.ofSeconds(Env.getLong("MONITOR_INTERVAL_SECONDS", 30)),
            Duration.ofHours(Env.getLong("PRODUCT_CACHE_TTL_HOURS", 24)),
            Env.getDecimal("PAPER_INITIAL_BALANCE", new BigDecimal("10000")),
            Env.get("PAPER_LEDGER_FILE", "data/paper-ledger.json"),
            Env.getDecimal("MIN_SIGNAL_CONFIDENCE", new BigDecimal("0.5")).doubleValue(),
            Env.getDecimal("DEFAULT_QUANTITY", new BigDecimal("0.01")),
            Env.get("NOTIFY_WEBHOOK_URL", ""),
            Env.get("METRICS_HOST", "0.0.0.0"),
            Env.getInt("METRICS_PORT", 9091),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/signalbridge"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10));
    }

    public boolean hasApiCredentials() {
        return !deltaApiKey.isBlank() && !deltaApiSecret.isBlank();
    }

    public boolean hasWebhook() {
        return notifyWebhookUrl != null && !notifyWebhookUrl.isBlank();
    }

    /**
     * Safe for logging: no secrets.
     */
    public String summary() {
        return String.format(
            "mode=%s, delta=%s, credentials=%s, monitor=%ss, productTtl=%sh, timeouts=%ss/%ss, minConfidence=%s",
            paperTrade ? "PAPER" : "LIVE", deltaBaseUrl, hasApiCredentials() ? "set" : "missing",
            monitorInterval.toSeconds(), productCacheTtl.toHours(),
            connectTimeout.toSeconds(), requestTimeout.toSeconds(), minSignalConfidence);
    }
}
