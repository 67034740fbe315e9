package in.signalbridge.bootstrap;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.signalbridge.application.port.output.ProductRepository;
import in.signalbridge.application.port.output.TradeNotifier;
import in.signalbridge.application.port.output.TradeRepository;
import in.signalbridge.infrastructure.exchange.DeltaHttp;
import in.signalbridge.infrastructure.exchange.DeltaPublicClient;
import in.signalbridge.infrastructure.exchange.DeltaRequestSigner;
import in.signalbridge.infrastructure.gateway.DeltaOrderGateway;
import in.signalbridge.infrastructure.gateway.OrderGateway;
import in.signalbridge.infrastructure.gateway.PaperOrderGateway;
import in.signalbridge.infrastructure.gateway.paper.PaperLedger;
import in.signalbridge.infrastructure.gateway.paper.PaperLedgerStore;
import in.signalbridge.infrastructure.metrics.HealthHandler;
import in.signalbridge.infrastructure.metrics.PrometheusMetricsHandler;
import in.signalbridge.infrastructure.metrics.PrometheusTradingMetrics;
import in.signalbridge.infrastructure.notify.LoggingTradeNotifier;
import in.signalbridge.infrastructure.notify.WebhookTradeNotifier;
import in.signalbridge.infrastructure.persistence.PostgresProductRepository;
import in.signalbridge.infrastructure.persistence.PostgresTradeRepository;
import in.signalbridge.service.product.ProductResolver;
import in.signalbridge.service.signal.JsonSignalExtractor;
import in.signalbridge.service.signal.SignalExtractionChain;
import in.signalbridge.service.signal.SignalIntake;
import in.signalbridge.service.trade.MonitorPassResult;
import in.signalbridge.service.trade.TradeCoordinator;
import in.signalbridge.service.trade.TradeLifecycleEngine;
import in.signalbridge.service.trade.TradeMonitor;
import in.signalbridge.service.validation.TradeValidator;
import in.signalbridge.transport.http.HttpApiServer;
import in.signalbridge.transport.http.TradeApiHandlers;
import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the trade lifecycle engine:
 * - PostgreSQL repositories over HikariCP
 * - Delta Exchange public market data + product catalog
 * - Live (signed REST) or paper order gateway, chosen once from PAPER_TRADE
 * - Trade monitor on a fixed delay
 * - Undertow API with /metrics and /health
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SignalBridge Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        TradingConfig config = TradingConfig.fromEnv();
        log.info("Config: {}", config.summary());
        StartupConfigValidator.validate(config);

        ObjectMapper mapper = createObjectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        TradeRepository tradeRepository = new PostgresTradeRepository(dataSource, mapper);
        ProductRepository productRepository = new PostgresProductRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusTradingMetrics metrics = new PrometheusTradingMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Exchange: public data, product catalog, order gateway
        // ═══════════════════════════════════════════════════════════════
        DeltaHttp http = new DeltaHttp(config.deltaBaseUrl(), config.connectTimeout(), config.requestTimeout(),
            mapper, metrics);
        DeltaPublicClient publicClient = new DeltaPublicClient(http);

        ProductResolver productResolver = new ProductResolver(publicClient, productRepository,
            config.productCacheTtl(), Clock.systemUTC(), metrics);
        productResolver.initialize();

        OrderGateway gateway = createGateway(config, http, publicClient, productResolver, mapper, metrics);
        log.info("✓ Order gateway: {}", gateway.mode());

        TradeNotifier notifier = config.hasWebhook()
            ? new WebhookTradeNotifier(URI.create(config.notifyWebhookUrl()), mapper,
                config.connectTimeout(), config.requestTimeout())
            : new LoggingTradeNotifier();

        // ═══════════════════════════════════════════════════════════════
        // Engine, recovery, monitor
        // ═══════════════════════════════════════════════════════════════
        TradeLifecycleEngine engine = new TradeLifecycleEngine(
            new TradeValidator(), productResolver, gateway, tradeRepository, notifier,
            new TradeCoordinator(), metrics, mapper, Clock.systemUTC());
        int recovered = engine.loadActiveTrades();
        log.info("✓ Recovered {} active trades", recovered);

        TradeMonitor monitor = new TradeMonitor(engine, gateway, metrics, config.monitorInterval());
        monitor.start();

        SignalExtractionChain extractionChain = new SignalExtractionChain(List.of(
            new JsonSignalExtractor(mapper, config.defaultQuantity(), "api")));
        SignalIntake intake = new SignalIntake(extractionChain, engine, config.minSignalConfidence(), metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        TradeApiHandlers api = new TradeApiHandlers(intake, engine, mapper);
        HealthHandler health = new HealthHandler(mapper, () -> healthDetails(engine, monitor, productResolver));

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/health", health)
            .post("/api/signals", api::submitSignal)
            .post("/api/trades/{id}/close", api::closeTrade)
            .get("/api/trades/active", api::activeTrades)
            .get("/api/trades/{id}", api::trade)
            .get("/api/trades", api::tradesByStatus)
            .get("/api/positions", api::positions)
            .get("/api/performance", api::performance);

        HttpApiServer server = new HttpApiServer(config.metricsHost(), config.metricsPort(), routes);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            monitor.stop();
            engine.shutdown();
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("✅ SignalBridge ready [{}] - {} products cached, {} active trades",
            gateway.mode(), productResolver.size(), recovered);
        log.info("═══════════════════════════════════════════════════════════════");
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static OrderGateway createGateway(TradingConfig config, DeltaHttp http, DeltaPublicClient publicClient,
                                              ProductResolver productResolver, ObjectMapper mapper,
                                              PrometheusTradingMetrics metrics) {
        if (!config.paperTrade()) {
            DeltaRequestSigner signer = new DeltaRequestSigner(config.deltaApiKey(), config.deltaApiSecret());
            return new DeltaOrderGateway(http, publicClient, signer, productResolver);
        }

        PaperLedgerStore store = new PaperLedgerStore(Path.of(config.paperLedgerFile()), mapper);
        PaperLedger ledger = store.load()
            .map(PaperLedger::restore)
            .orElseGet(() -> new PaperLedger(config.paperInitialBalance()));
        log.info("[PAPER] Ledger balance {} (starting {})", ledger.balance(), ledger.startingBalance());
        return new PaperOrderGateway(publicClient, ledger, store, metrics);
    }

    private static Map<String, Object> healthDetails(TradeLifecycleEngine engine, TradeMonitor monitor,
                                                     ProductResolver productResolver) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", engine.mode().name());
        details.put("activeTrades", engine.getActiveTrades().size());
        details.put("productsCached", productResolver.size());
        MonitorPassResult last = monitor.lastResult();
        if (last != null) {
            details.put("lastMonitorPass", String.valueOf(monitor.lastPassTime()));
            details.put("lastMonitorErrors", last.errors().size());
        }
        return details;
    }

    private static HikariDataSource createDataSource(TradingConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("signalbridge-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
