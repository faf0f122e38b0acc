package io.tradehybrid.brokerlink.infrastructure.broker.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.tradehybrid.brokerlink.config.GatewayConfig;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerAuthenticationException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.BrokerExceptions;
import io.tradehybrid.brokerlink.infrastructure.broker.data.MappingException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueRejectedException;
import io.tradehybrid.brokerlink.infrastructure.broker.data.VenueUnavailableException;
import io.tradehybrid.brokerlink.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP transport owned by one adapter.
 *
 * Every request carries the configured timeout. Responses are mapped onto the broker exception
 * hierarchy: 401/403 authentication, 429 and 5xx unavailable, other 4xx rejected, I/O failures and
 * timeouts unavailable, unparseable bodies mapping errors. Raw bodies are only logged at DEBUG.
 */
public class VenueHttpClient {
    private static final Logger log = LoggerFactory.getLogger(VenueHttpClient.class);

    private final String brokerCode;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final BrokerMetrics metrics;

    public VenueHttpClient(String brokerCode, GatewayConfig config, ObjectMapper objectMapper, BrokerMetrics metrics) {
        this.brokerCode = brokerCode;
        this.objectMapper = objectMapper;
        this.requestTimeout = config.requestTimeout();
        this.connectTimeout = config.connectTimeout();
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    public CompletableFuture<JsonNode> get(String operation, URI uri, String... headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("Accept", "application/json")
            .GET();
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return send(operation, builder);
    }

    public CompletableFuture<JsonNode> postJson(String operation, URI uri, JsonNode body, String... headers) {
        return sendJson(operation, uri, "POST", body, headers);
    }

    public CompletableFuture<JsonNode> putJson(String operation, URI uri, JsonNode body, String... headers) {
        return sendJson(operation, uri, "PUT", body, headers);
    }

    public CompletableFuture<JsonNode> delete(String operation, URI uri, String... headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("Accept", "application/json")
            .DELETE();
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return send(operation, builder);
    }

    private CompletableFuture<JsonNode> sendJson(String operation, URI uri, String method, JsonNode body,
                                                 String... headers) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                new MappingException(brokerCode, "Cannot serialize " + operation + " request", e));
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(payload));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return send(operation, builder);
    }

    /**
     * Send a prepared request and parse the JSON body.
     *
     * @param operation logical operation name for logs and metrics
     */
    public CompletableFuture<JsonNode> send(String operation, HttpRequest.Builder builder) {
        HttpRequest request = builder.timeout(requestTimeout).build();
        Instant start = Instant.now();
        log.debug("[{}] {} {} {}", brokerCode, operation, request.method(), request.uri().getPath());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                Duration latency = Duration.between(start, Instant.now());
                if (error != null) {
                    Throwable cause = BrokerExceptions.unwrap(error);
                    metrics.recordRequest(brokerCode, operation, "unavailable", latency);
                    log.warn("[{}] {} failed after {}ms: {}", brokerCode, operation, latency.toMillis(), cause.toString());
                    throw new VenueUnavailableException(brokerCode, operation + " request failed", cause);
                }
                try {
                    JsonNode body = interpret(operation, response);
                    metrics.recordRequest(brokerCode, operation, "success", latency);
                    return body;
                } catch (BrokerException e) {
                    metrics.recordRequest(brokerCode, operation, outcomeOf(e), latency);
                    throw e;
                }
            });
    }

    /**
     * Open a WebSocket with the configured connect timeout.
     */
    public CompletableFuture<WebSocket> openWebSocket(URI uri, WebSocket.Listener listener) {
        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(uri, listener);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    private JsonNode interpret(String operation, HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();
        log.debug("[{}] {} HTTP {} body={}", brokerCode, operation, status, body);

        if (status == 401 || status == 403) {
            throw new BrokerAuthenticationException(brokerCode,
                operation + " unauthorized (HTTP " + status + "): " + errorMessage(body));
        }
        if (status == 429 || status >= 500) {
            throw new VenueUnavailableException(brokerCode, status, operation + " unavailable");
        }
        if (status >= 400) {
            throw new VenueRejectedException(brokerCode, status, errorMessage(body));
        }
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MappingException(brokerCode, operation + " returned invalid JSON", e);
        }
    }

    /**
     * Pull the venue's error text out of an error body: Binance {@code msg}, Tradovate {@code errorText},
     * E*TRADE {@code Error.message}, generic {@code message}.
     */
    String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            for (String field : new String[] {"msg", "errorText", "message"}) {
                if (node.hasNonNull(field)) {
                    return node.get(field).asText();
                }
            }
            if (node.path("Error").hasNonNull("message")) {
                return node.path("Error").get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("[{}] Error body is not JSON", brokerCode);
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static String outcomeOf(BrokerException e) {
        if (e instanceof BrokerAuthenticationException) return "auth_error";
        if (e instanceof VenueUnavailableException) return "unavailable";
        if (e instanceof VenueRejectedException) return "rejected";
        return "mapping_error";
    }
}
