package in.signalbridge.infrastructure.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * GET /health - JSON status snapshot.
 */
public class HealthHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);

    private final ObjectMapper mapper;
    private final Supplier<Map<String, Object>> details;

    public HealthHandler(ObjectMapper mapper, Supplier<Map<String, Object>> details) {
        this.mapper = mapper;
        this.details = details;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        int status;
        try {
            body.put("status", "UP");
            body.putAll(details.get());
            status = 200;
        } catch (RuntimeException e) {
            log.warn("[HEALTH] Status snapshot failed: {}", e.getMessage());
            body.put("status", "DEGRADED");
            body.put("error", e.getMessage());
            status = 503;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.setStatusCode(status);
        try {
            exchange.getResponseSender().send(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.error("[HEALTH] Failed to serialize status: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"status\":\"ERROR\"}");
        }
    }
}
