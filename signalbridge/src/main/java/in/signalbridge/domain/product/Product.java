package in.signalbridge.domain.product;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchange metadata for a tradable contract.
 */
public record Product(
    long productId,
    String symbol,
    String underlyingAsset,
    String quotingAsset,
    BigDecimal tickSize,
    BigDecimal minSize,
    BigDecimal maxSize,
    Instant lastUpdated
) {
    /**
     * True when size lies inside [minSize, maxSize]. Missing bounds are not enforced.
     */
    public boolean acceptsSize(BigDecimal size) {
        if (size == null || size.signum() <= 0) return false;
        if (minSize != null && size.compareTo(minSize) < 0) return false;
        if (maxSize != null && maxSize.signum() > 0 && size.compareTo(maxSize) > 0) return false;
        return true;
    }

    public Product withLastUpdated(Instant updated) {
        return new Product(productId, symbol, underlyingAsset, quotingAsset, tickSize, minSize, maxSize, updated);
    }
}
