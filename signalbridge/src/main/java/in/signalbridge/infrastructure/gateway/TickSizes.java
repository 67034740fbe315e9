package in.signalbridge.infrastructure.gateway;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Price rounding to a product's tick size.
 */
public final class TickSizes {

    /**
     * Round price to the nearest multiple of tickSize (half up).
     * Returns the price unchanged when no tick size is known.
     */
    public static BigDecimal round(BigDecimal price, BigDecimal tickSize) {
        if (price == null || tickSize == null || tickSize.signum() <= 0) {
            return price;
        }
        BigDecimal ticks = price.divide(tickSize, 0, RoundingMode.HALF_UP);
        return ticks.multiply(tickSize).setScale(Math.max(tickSize.stripTrailingZeros().scale(), 0), RoundingMode.HALF_UP);
    }

    private TickSizes() {}
}
