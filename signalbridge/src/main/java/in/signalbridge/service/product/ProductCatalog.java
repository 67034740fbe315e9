package in.signalbridge.service.product;

import in.signalbridge.domain.product.Product;

import java.util.List;

/**
 * Source of the exchange's live product list.
 */
public interface ProductCatalog {

    /**
     * Fetch every product currently in the live trading state.
     *
     * @throws in.signalbridge.infrastructure.gateway.GatewayException on network or exchange failure
     */
    List<Product> fetchLiveProducts();
}
