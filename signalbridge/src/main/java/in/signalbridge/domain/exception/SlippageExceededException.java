package in.signalbridge.domain.exception;

import java.math.BigDecimal;

/**
 * Market moved too far from the signal's entry price. Resubmission is allowed.
 */
public class SlippageExceededException extends RuntimeException {

    private final BigDecimal entryPrice;
    private final BigDecimal marketPrice;
    private final BigDecimal slippagePercent;

    public SlippageExceededException(BigDecimal entryPrice, BigDecimal marketPrice,
                                     BigDecimal slippagePercent, BigDecimal maxPercent) {
        super(String.format("Price slippage exceeded %s%%: %s%% difference (entry %s, market %s)",
            maxPercent.stripTrailingZeros().toPlainString(),
            slippagePercent.toPlainString(),
            entryPrice.toPlainString(),
            marketPrice.toPlainString()));
        this.entryPrice = entryPrice;
        this.marketPrice = marketPrice;
        this.slippagePercent = slippagePercent;
    }

    public BigDecimal getEntryPrice() {
        return entryPrice;
    }

    public BigDecimal getMarketPrice() {
        return marketPrice;
    }

    public BigDecimal getSlippagePercent() {
        return slippagePercent;
    }
}
