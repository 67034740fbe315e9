package in.signalbridge.service.product;

import in.signalbridge.application.port.output.ProductRepository;
import in.signalbridge.domain.exception.SymbolNotFoundException;
import in.signalbridge.domain.product.Product;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ProductResolver - ticker to exchange product metadata with a time-bounded cache.
 *
 * CACHE:
 * - Whole catalog held in memory, replaced wholesale on refresh (never per symbol)
 * - Expires after the TTL (default 24h); the next lookup refreshes before answering
 * - Persisted through ProductRepository; {@link #initialize()} reuses a snapshot younger than the TTL
 *
 * SINGLE-FLIGHT:
 * Refresh runs under a lock with a double-checked age, so concurrent lookups that
 * find the cache expired wait for the one refresh instead of each triggering their own.
 *
 * A symbol missing after a fresh catalog is NotFound (empty Optional), which is permanent.
 * A refresh failure is a GatewayException, which is retryable.
 */
public final class ProductResolver {
    private static final Logger log = LoggerFactory.getLogger(ProductResolver.class);

    private final ProductCatalog catalog;
    private final ProductRepository repository;
    private final Duration ttl;
    private final Clock clock;
    private final TradingMetrics metrics;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicInteger refreshCount = new AtomicInteger();

    private volatile Map<String, Product> products = Collections.emptyMap();
    private volatile Instant loadedAt;

    public ProductResolver(ProductCatalog catalog, ProductRepository repository, Duration ttl) {
        this(catalog, repository, ttl, Clock.systemUTC(), TradingMetrics.NOOP);
    }

    public ProductResolver(ProductCatalog catalog, ProductRepository repository, Duration ttl,
                           Clock clock, TradingMetrics metrics) {
        this.catalog = catalog;
        this.repository = repository;
        this.ttl = ttl;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Load the persisted snapshot if it is still within the TTL.
     *
     * A missing, stale or unreadable snapshot leaves the cache empty; the first
     * lookup then refreshes from the exchange.
     */
    public void initialize() {
        try {
            Optional<Instant> lastUpdated = repository.getProductsLastUpdated();
            if (lastUpdated.isEmpty()) {
                log.info("[PRODUCTS] No persisted catalog, will fetch on first lookup");
                return;
            }
            if (isExpired(lastUpdated.get())) {
                log.info("[PRODUCTS] Persisted catalog from {} is older than {}h, will refresh",
                    lastUpdated.get(), ttl.toHours());
                return;
            }
            List<Product> stored = repository.getAllProducts();
            install(stored, lastUpdated.get());
            log.info("[PRODUCTS] ✅ Loaded {} products from snapshot ({})", stored.size(), lastUpdated.get());
        } catch (RuntimeException e) {
            log.warn("[PRODUCTS] Could not load persisted catalog: {}", e.getMessage());
        }
    }

    /**
     * Resolve a human ticker to its product.
     *
     * @return the product, or empty when the exchange does not list the symbol
     * @throws GatewayException when the catalog had to be refreshed and the refresh failed
     */
    public Optional<Product> resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String normalized = SymbolNormalizer.normalize(symbol);
        ensureFresh();

        Product product = products.get(normalized);
        if (product == null) {
            log.warn("[PRODUCTS] Symbol {} (normalized {}) not listed", symbol, normalized);
            return Optional.empty();
        }
        log.debug("[PRODUCTS] {} -> {} (id {})", symbol, normalized, product.productId());
        return Optional.of(product);
    }

    /**
     * Like {@link #resolve(String)} but an unlisted symbol is an error.
     *
     * @throws SymbolNotFoundException when the exchange does not list the symbol
     */
    public Product require(String symbol) {
        return resolve(symbol).orElseThrow(() -> new SymbolNotFoundException(symbol));
    }

    /**
     * Cached lookup by exact exchange symbol, no refresh.
     */
    public Optional<Product> cached(String exchangeSymbol) {
        return Optional.ofNullable(products.get(exchangeSymbol));
    }

    public List<String> availableSymbols() {
        List<String> symbols = new ArrayList<>(products.keySet());
        Collections.sort(symbols);
        return symbols;
    }

    public int refreshCount() {
        return refreshCount.get();
    }

    public int size() {
        return products.size();
    }

    private void ensureFresh() {
        if (!isExpired(loadedAt)) {
            return;
        }
        refreshLock.lock();
        try {
            // Another thread may have refreshed while we waited
            if (isExpired(loadedAt)) {
                refresh();
            }
        } finally {
            refreshLock.unlock();
        }
    }

    private void refresh() {
        long start = System.nanoTime();
        List<Product> live;
        try {
            live = catalog.fetchLiveProducts();
        } catch (GatewayException e) {
            metrics.recordCatalogRefresh(false, Duration.ofNanos(System.nanoTime() - start));
            log.error("[PRODUCTS] Catalog refresh failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordCatalogRefresh(false, Duration.ofNanos(System.nanoTime() - start));
            log.error("[PRODUCTS] Catalog refresh failed: {}", e.getMessage(), e);
            throw new GatewayException("products", "Catalog refresh failed: " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        List<Product> stamped = new ArrayList<>(live.size());
        for (Product p : live) {
            stamped.add(p.withLastUpdated(now));
        }
        install(stamped, now);
        refreshCount.incrementAndGet();
        metrics.recordCatalogRefresh(true, Duration.ofNanos(System.nanoTime() - start));
        log.info("[PRODUCTS] ✅ Refreshed catalog: {} live products", stamped.size());

        try {
            repository.saveProducts(stamped);
        } catch (RuntimeException e) {
            // In-memory catalog is still valid, only restart reuse is lost
            log.warn("[PRODUCTS] Failed to persist catalog snapshot: {}", e.getMessage());
        }
    }

    private void install(List<Product> list, Instant at) {
        Map<String, Product> next = new HashMap<>(list.size() * 2);
        for (Product p : list) {
            next.put(p.symbol(), p);
        }
        products = Collections.unmodifiableMap(next);
        loadedAt = at;
    }

    private boolean isExpired(Instant since) {
        return since == null || Duration.between(since, clock.instant()).compareTo(ttl) >= 0;
    }
}
