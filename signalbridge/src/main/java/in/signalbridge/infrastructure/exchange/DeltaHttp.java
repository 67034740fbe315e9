package in.signalbridge.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.infrastructure.gateway.GatewayException;
import in.signalbridge.infrastructure.gateway.GatewayTimeoutException;
import in.signalbridge.infrastructure.metrics.TradingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Thin JSON transport for the Delta Exchange REST API.
 *
 * Every call carries the configured connect and request timeouts. Failures map to:
 * - timeout             -> GatewayTimeoutException
 * - non-2xx / success=false -> DeltaApiException (with the exchange's error code)
 * - other I/O           -> GatewayException
 */
public final class DeltaHttp {
    private static final Logger log = LoggerFactory.getLogger(DeltaHttp.class);

    private final String baseUrl;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;
    private final TradingMetrics metrics;
    private final HttpClient httpClient;

    public DeltaHttp(String baseUrl, Duration connectTimeout, Duration requestTimeout,
                     ObjectMapper mapper, TradingMetrics metrics) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.mapper = mapper;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    public JsonNode get(String operation, String pathWithQuery) {
        return send(operation, "GET", pathWithQuery, null, Map.of());
    }

    public JsonNode send(String operation, String method, String pathWithQuery, String body,
                         Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + pathWithQuery))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .header("User-Agent", "signalbridge");
        headers.forEach(builder::header);

        if (body != null) {
            builder.header("Content-Type", "application/json");
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        long start = System.nanoTime();
        boolean success = false;
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            JsonNode json = parse(operation, response);
            success = true;
            return json;
        } catch (HttpTimeoutException e) {
            log.warn("[DELTA] {} {} timed out after {}ms", method, pathWithQuery, requestTimeout.toMillis());
            throw new GatewayTimeoutException(operation, requestTimeout, e);
        } catch (IOException e) {
            log.warn("[DELTA] {} {} failed: {}", method, pathWithQuery, e.getMessage());
            throw new GatewayException(operation, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(operation, "Interrupted", e);
        } finally {
            metrics.recordGatewayCall(operation, success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private JsonNode parse(String operation, HttpResponse<String> response) {
        String body = response.body();
        JsonNode json;
        try {
            json = body == null || body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (IOException e) {
            if (response.statusCode() >= 300) {
                throw new DeltaApiException(operation, response.statusCode(), "unparseable", truncate(body));
            }
            throw new GatewayException(operation, "Malformed JSON response: " + e.getMessage(), e);
        }

        boolean explicitFailure = json.has("success") && !json.path("success").asBoolean(true);
        if (response.statusCode() >= 300 || explicitFailure) {
            JsonNode error = json.path("error");
            String code = error.isTextual() ? error.asText() : error.path("code").asText("unknown");
            String message = error.path("message").asText(error.isTextual() ? error.asText() : error.toString());
            throw new DeltaApiException(operation, response.statusCode(), code, message);
        }
        return json;
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
