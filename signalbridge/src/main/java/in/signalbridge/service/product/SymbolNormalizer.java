package in.signalbridge.service.product;

import java.util.Locale;
import java.util.Map;

/**
 * Maps human tickers to the exchange's canonical USD-quoted contract symbol.
 *
 * <pre>
 *   BTCUSD    -> BTCUSD   (already USD quoted)
 *   BTC       -> BTCUSD   (alias)
 *   BTCUSDT   -> BTCUSD   (alias)
 *   LINKUSDT  -> LINKUSD  (fallback: strip USDT, append USD)
 *   PEPE      -> PEPEUSD  (fallback)
 * </pre>
 */
public final class SymbolNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("BTC", "BTCUSD"),
        Map.entry("BTCUSDT", "BTCUSD"),
        Map.entry("ETH", "ETHUSD"),
        Map.entry("ETHUSDT", "ETHUSD"),
        Map.entry("ADA", "ADAUSD"),
        Map.entry("ADAUSDT", "ADAUSD"),
        Map.entry("SOL", "SOLUSD"),
        Map.entry("SOLUSDT", "SOLUSD"),
        Map.entry("DOT", "DOTUSD"),
        Map.entry("DOTUSDT", "DOTUSD"),
        Map.entry("AVAX", "AVAXUSD"),
        Map.entry("AVAXUSDT", "AVAXUSD"),
        Map.entry("MATIC", "MATICUSD"),
        Map.entry("MATICUSDT", "MATICUSD"),
        Map.entry("UNI", "UNIUSD"),
        Map.entry("UNIUSDT", "UNIUSD")
    );

    public static String normalize(String symbol) {
        if (symbol == null) {
            return null;
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);

        if (upper.contains("USD") && !upper.contains("USDT")) {
            return upper;
        }

        String alias = ALIASES.get(upper);
        if (alias != null) {
            return alias;
        }

        return upper.replace("USDT", "") + "USD";
    }

    private SymbolNormalizer() {}
}
