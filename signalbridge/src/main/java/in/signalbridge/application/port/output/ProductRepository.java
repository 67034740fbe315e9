package in.signalbridge.application.port.output;

import in.signalbridge.domain.product.Product;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted product catalog snapshot.
 */
public interface ProductRepository {

    /**
     * Replace the stored catalog with the given products.
     */
    void saveProducts(List<Product> products);

    Optional<Product> getProductBySymbol(String symbol);

    List<Product> getAllProducts();

    /**
     * Time of the last saveProducts, empty if nothing was ever stored.
     */
    Optional<Instant> getProductsLastUpdated();
}
