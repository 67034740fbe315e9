package in.signalbridge.domain.common;

import java.math.BigDecimal;

/**
 * Hard business rules. Not configurable per trade.
 */
public final class TradingRules {

    /** Maximum |market - entry| / entry, in percent, before a trade is rejected. */
    public static final BigDecimal MAX_SLIPPAGE_PERCENT = BigDecimal.ONE;

    /** Minimum reward/risk ratio (0.5:1). */
    public static final BigDecimal MIN_REWARD_RISK = new BigDecimal("0.5");

    private TradingRules() {}
}
