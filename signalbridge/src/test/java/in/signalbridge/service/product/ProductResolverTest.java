package in.signalbridge.service.product;

import in.signalbridge.application.port.output.ProductRepository;
import in.signalbridge.domain.exception.RepositoryException;
import in.signalbridge.domain.exception.SymbolNotFoundException;
import in.signalbridge.domain.product.Product;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import in.signalbridge.support.Products;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProductResolver.
 *
 * Tests:
 * - First lookup fetches and persists the catalog
 * - 24h TTL, stale snapshot ignored at startup
 * - Refresh failure surfaces as GatewayException and is retried on the next lookup
 * - Concurrent lookups on an expired cache share one refresh
 */
@ExtendWith(MockitoExtension.class)
class ProductResolverTest {

    private static final Duration TTL = Duration.ofHours(24);

    @Mock
    private ProductCatalog catalog;
    @Mock
    private ProductRepository repository;

    private MutableClock clock;
    private ProductResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        resolver = new ProductResolver(catalog, repository, TTL, clock, TradingMetrics.NOOP);
    }

    @Test
    void testResolveFetchesAndPersistsCatalogOnFirstLookup() {
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        Optional<Product> product = resolver.resolve("BTC");

        assertTrue(product.isPresent());
        assertEquals(27, product.get().productId());
        assertEquals(clock.instant(), product.get().lastUpdated(), "Refresh stamps products with the fetch time");
        assertEquals(1, resolver.refreshCount());
        verify(repository).saveProducts(anyList());
    }

    @Test
    void testResolveReusesCacheWithinTtl() {
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        resolver.resolve("BTC");
        clock.advance(Duration.ofHours(23));
        resolver.resolve("ETHUSDT");
        resolver.resolve("SOL");

        verify(catalog, times(1)).fetchLiveProducts();
    }

    @Test
    void testResolveRefreshesAfterTtl() {
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        resolver.resolve("BTC");
        clock.advance(TTL);
        resolver.resolve("BTC");

        assertEquals(2, resolver.refreshCount());
        verify(catalog, times(2)).fetchLiveProducts();
    }

    @Test
    void testResolveUnknownSymbolIsEmptyWithoutExtraRefresh() {
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        assertTrue(resolver.resolve("ZZZUSD").isEmpty());
        assertTrue(resolver.resolve("ZZZUSD").isEmpty());

        verify(catalog, times(1)).fetchLiveProducts();
    }

    @Test
    void testRequireUnknownSymbolThrowsSymbolNotFound() {
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        assertEquals("ETHUSD", resolver.require("ETH").symbol());
        SymbolNotFoundException e = assertThrows(SymbolNotFoundException.class, () -> resolver.require("ZZZ"));
        assertEquals("ZZZ", e.getSymbol());
        assertEquals("Invalid symbol: ZZZ", e.getMessage());
    }

    @Test
    void testResolveBlankSymbolIsEmpty() {
        assertTrue(resolver.resolve(" ").isEmpty());
        verifyNoInteractions(catalog);
    }

    @Test
    void testResolveRefreshFailureIsRetryable() {
        when(catalog.fetchLiveProducts())
            .thenThrow(new GatewayException("products", "connection refused"))
            .thenReturn(Products.catalog());

        assertThrows(GatewayException.class, () -> resolver.resolve("BTC"));
        assertEquals(0, resolver.size());

        assertTrue(resolver.resolve("BTC").isPresent(), "Next lookup should retry the refresh");
    }

    @Test
    void testResolveUnexpectedFailureIsWrapped() {
        when(catalog.fetchLiveProducts()).thenThrow(new IllegalStateException("bad payload"));

        GatewayException e = assertThrows(GatewayException.class, () -> resolver.resolve("BTC"));
        assertTrue(e.getMessage().contains("bad payload"));
    }

    @Test
    void testResolvePersistFailureKeepsCatalogInMemory() {
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());
        doThrow(new RepositoryException("db down")).when(repository).saveProducts(anyList());

        assertTrue(resolver.resolve("ETH").isPresent());
        assertEquals(3, resolver.size());
    }

    @Test
    void testInitializeLoadsFreshSnapshot() {
        Instant storedAt = clock.instant().minus(Duration.ofHours(2));
        when(repository.getProductsLastUpdated()).thenReturn(Optional.of(storedAt));
        when(repository.getAllProducts()).thenReturn(Products.catalog());

        resolver.initialize();

        assertEquals(List.of("BTCUSD", "ETHUSD", "SOLUSD"), resolver.availableSymbols());
        assertTrue(resolver.resolve("SOL").isPresent());
        verifyNoInteractions(catalog);
    }

    @Test
    void testInitializeIgnoresStaleSnapshot() {
        when(repository.getProductsLastUpdated()).thenReturn(Optional.of(clock.instant().minus(Duration.ofHours(25))));
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        resolver.initialize();
        assertEquals(0, resolver.size());

        resolver.resolve("BTC");
        verify(repository, never()).getAllProducts();
        verify(catalog).fetchLiveProducts();
    }

    @Test
    void testInitializeSnapshotExpiresRelativeToStoredTime() {
        Instant storedAt = clock.instant().minus(Duration.ofHours(23));
        when(repository.getProductsLastUpdated()).thenReturn(Optional.of(storedAt));
        when(repository.getAllProducts()).thenReturn(Products.catalog());
        when(catalog.fetchLiveProducts()).thenReturn(Products.catalog());

        resolver.initialize();
        clock.advance(Duration.ofHours(1));
        resolver.resolve("BTC");

        verify(catalog).fetchLiveProducts();
    }

    @Test
    void testResolveConcurrentLookupsShareOneRefresh() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        CountDownLatch fetching = new CountDownLatch(1);
        ProductCatalog slowCatalog = () -> {
            fetches.incrementAndGet();
            fetching.countDown();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Products.catalog();
        };
        ProductResolver shared = new ProductResolver(slowCatalog, repository, TTL, clock,
            TradingMetrics.NOOP);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Product>>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return shared.resolve("BTC");
            }));
        }
        start.countDown();
        assertTrue(fetching.await(5, TimeUnit.SECONDS));

        for (Future<Optional<Product>> result : results) {
            assertTrue(result.get(5, TimeUnit.SECONDS).isPresent());
        }
        pool.shutdown();

        assertEquals(1, fetches.get(), "Only one refresh should reach the exchange");
        assertEquals(1, shared.refreshCount());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
