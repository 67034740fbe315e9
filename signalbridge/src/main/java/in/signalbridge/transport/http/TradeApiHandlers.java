package in.signalbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.signalbridge.domain.exception.TradeNotFoundException;
import in.signalbridge.domain.trade.CloseReason;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradePerformance;
import in.signalbridge.domain.trade.TradeStatus;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.service.signal.IntakeResult;
import in.signalbridge.service.signal.SignalIntake;
import in.signalbridge.service.trade.TradeLifecycleEngine;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Locale;

/**
 * Trade API.
 *
 * <pre>
 *   POST /api/signals                 raw signal message (JSON) -> intake
 *   POST /api/trades/{id}/close       manual close
 *   GET  /api/trades/{id}             trade with its events
 *   GET  /api/trades?status=CLOSED    trades by lifecycle state
 *   GET  /api/trades/active
 *   GET  /api/positions
 *   GET  /api/performance
 * </pre>
 *
 * All handlers block on the engine, so they run on the worker pool, never on the IO thread.
 */
public final class TradeApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(TradeApiHandlers.class);

    private static final String JSON_SUCCESS = "success";
    private static final String JSON_DATA = "data";
    private static final String JSON_ERROR = "error";
    private static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";

    private final SignalIntake intake;
    private final TradeLifecycleEngine engine;
    private final ObjectMapper mapper;

    public TradeApiHandlers(SignalIntake intake, TradeLifecycleEngine engine, ObjectMapper mapper) {
        this.intake = intake;
        this.engine = engine;
        this.mapper = mapper;
    }

    /**
     * POST /api/signals
     */
    public void submitSignal(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> ex.dispatch(() -> {
            try {
                IntakeResult result = intake.submitMessage(body);
                ObjectNode data = mapper.createObjectNode();
                data.put("outcome", result.outcome().name());
                if (result.reason() != null) {
                    data.put("reason", result.reason());
                }
                if (result.trade() != null) {
                    data.set("trade", mapper.valueToTree(result.trade()));
                }
                int status = result.outcome() == IntakeResult.Outcome.FAILED_EXTRACTION ? 400 : 200;
                send(ex, status, ok(data));
            } catch (RuntimeException e) {
                log.error("[API] Signal submission failed: {}", e.getMessage(), e);
                error(ex, 500, "Signal submission failed");
            }
        }), StandardCharsets.UTF_8);
    }

    /**
     * POST /api/trades/{id}/close
     */
    public void closeTrade(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::closeTrade);
            return;
        }
        String idStr = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get("id");
        long tradeId;
        try {
            tradeId = Long.parseLong(idStr);
        } catch (NumberFormatException e) {
            error(exchange, 400, "Invalid trade id: " + idStr);
            return;
        }

        try {
            Trade trade = engine.closeTrade(tradeId, CloseReason.MANUAL);
            send(exchange, 200, ok(mapper.valueToTree(trade)));
        } catch (TradeNotFoundException e) {
            error(exchange, 404, e.getMessage());
        } catch (GatewayException e) {
            log.warn("[API] Manual close of trade {} failed: {}", tradeId, e.getMessage());
            error(exchange, 502, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[API] Manual close of trade {} failed: {}", tradeId, e.getMessage(), e);
            error(exchange, 500, "Close failed");
        }
    }

    /**
     * GET /api/trades/{id}
     */
    public void trade(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::trade);
            return;
        }
        String idStr = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get("id");
        long tradeId;
        try {
            tradeId = Long.parseLong(idStr);
        } catch (NumberFormatException e) {
            error(exchange, 400, "Invalid trade id: " + idStr);
            return;
        }

        try {
            Trade trade = engine.getTrade(tradeId);
            ObjectNode data = mapper.createObjectNode();
            data.set("trade", mapper.valueToTree(trade));
            data.set("events", mapper.valueToTree(engine.getTradeEvents(tradeId)));
            send(exchange, 200, ok(data));
        } catch (TradeNotFoundException e) {
            error(exchange, 404, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[API] Trade {} query failed: {}", tradeId, e.getMessage(), e);
            error(exchange, 500, "Trade query failed");
        }
    }

    /**
     * GET /api/trades?status=...
     */
    public void tradesByStatus(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::tradesByStatus);
            return;
        }
        Deque<String> param = exchange.getQueryParameters().get("status");
        if (param == null || param.isEmpty() || param.getFirst().isBlank()) {
            error(exchange, 400, "Missing status parameter");
            return;
        }
        TradeStatus status;
        try {
            status = TradeStatus.valueOf(param.getFirst().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            error(exchange, 400, "Invalid status: " + param.getFirst());
            return;
        }

        try {
            send(exchange, 200, ok(mapper.valueToTree(engine.getTrades(status))));
        } catch (RuntimeException e) {
            log.error("[API] {} trades query failed: {}", status, e.getMessage(), e);
            error(exchange, 500, "Trade query failed");
        }
    }

    /**
     * GET /api/trades/active
     */
    public void activeTrades(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::activeTrades);
            return;
        }
        send(exchange, 200, ok(mapper.valueToTree(engine.getActiveTrades())));
    }

    /**
     * GET /api/positions
     */
    public void positions(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::positions);
            return;
        }
        try {
            send(exchange, 200, ok(mapper.valueToTree(engine.getOpenPositions())));
        } catch (GatewayException e) {
            error(exchange, 502, e.getMessage());
        }
    }

    /**
     * GET /api/performance
     */
    public void performance(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::performance);
            return;
        }
        try {
            TradePerformance performance = engine.getTradePerformance();
            ObjectNode data = mapper.createObjectNode();
            data.set("stats", mapper.valueToTree(performance.stats()));
            data.put("winRate", performance.winRate());
            data.put("activeInMemory", performance.activeInMemory());
            data.put("mode", engine.mode().name());
            performance.paper().ifPresent(paper -> data.set("paper", mapper.valueToTree(paper)));
            send(exchange, 200, ok(data));
        } catch (RuntimeException e) {
            log.error("[API] Performance query failed: {}", e.getMessage(), e);
            error(exchange, 500, "Performance query failed");
        }
    }

    private ObjectNode ok(JsonNode data) {
        ObjectNode response = mapper.createObjectNode();
        response.put(JSON_SUCCESS, true);
        response.set(JSON_DATA, data);
        return response;
    }

    private void error(HttpServerExchange exchange, int status, String message) {
        ObjectNode response = mapper.createObjectNode();
        response.put(JSON_SUCCESS, false);
        response.put(JSON_ERROR, message);
        send(exchange, status, response);
    }

    private static void send(HttpServerExchange exchange, int status, ObjectNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
