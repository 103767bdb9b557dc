package io.swarmhive.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmhive.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over HTTP: every operation is a {@code tools/call} POST to {@code <base>/mcp/}.
 */
public final class HttpRelayTransport implements RelayTransport, HealthProbe {
    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public HttpRelayTransport(String baseUrl, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public JsonNode call(String operation, ObjectNode args) {
        ObjectNode body = Jsons.compact().createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", "swarmhive-" + requestIds.incrementAndGet());
        body.put("method", "tools/call");
        ObjectNode params = body.putObject("params");
        params.put("name", operation);
        params.set("arguments", args == null ? Jsons.compact().createObjectNode() : args);

        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/mcp/"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(operation, request);
        if (response.statusCode() / 100 != 2) {
            throw new RelayException(operation, RelayException.Kind.HTTP, response.statusCode(),
                    "HTTP " + response.statusCode() + " from relay for " + operation);
        }
        JsonNode json;
        try {
            json = Jsons.compact().readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RelayException(operation, RelayException.Kind.RPC, 0,
                    "Malformed relay response for " + operation, e);
        }
        JsonNode error = json.get("error");
        if (error != null && !error.isNull()) {
            throw new RelayException(operation, RelayException.Kind.RPC, error.path("code").asInt(0),
                    error.path("message").asText("relay error"));
        }
        return unwrap(operation, json.path("result"));
    }

    @Override
    public boolean isHealthy() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/health/liveness"))
                .timeout(timeout)
                .GET()
                .build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.discarding()).statusCode() / 100 == 2;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpResponse<String> send(String operation, HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new RelayException(operation, RelayException.Kind.TIMEOUT, 0,
                    "Relay call " + operation + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new RelayException(operation, RelayException.Kind.IO, 0,
                    "Relay call " + operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException(operation, RelayException.Kind.INTERRUPTED, 0,
                    "Relay call " + operation + " interrupted", e);
        }
    }

    /**
     * Tool results arrive either bare or wrapped as {@code {content:[...], structuredContent:{...}}}.
     */
    private JsonNode unwrap(String operation, JsonNode result) {
        if (!result.isObject()) {
            return result;
        }
        JsonNode first = result.path("content").path(0).path("text");
        if (result.path("isError").asBoolean(false)) {
            throw new RelayException(operation, RelayException.Kind.TOOL, 0,
                    first.isTextual() ? first.asText() : "Unknown relay tool error");
        }
        if (result.has("structuredContent")) {
            return result.get("structuredContent");
        }
        if (first.isTextual()) {
            try {
                return Jsons.compact().readTree(first.asText());
            } catch (JsonProcessingException e) {
                return first;
            }
        }
        return result;
    }
}
