package com.agentbench.backend.runtime;

import com.agentbench.core.error.BackendNotFoundException;
import com.agentbench.core.error.InfraException;
import com.agentbench.core.error.QuotaExceededException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the hosted agent runtime data plane.
 *
 * <p>{@code POST /runtimes/{runtimeId}/invocations} invokes synchronously; with
 * {@code ?mode=async} it returns an {@code invocationId} that is polled through
 * {@code GET /runtimes/{runtimeId}/invocations/{invocationId}}. The session id travels in the
 * {@code X-Runtime-Session-Id} header.
 */
public class HttpRuntimeClient implements RuntimeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRuntimeClient.class);

    static final String SESSION_HEADER = "X-Runtime-Session-Id";

    private final String endpoint;
    private final String token;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpRuntimeClient(String endpoint, String token, ObjectMapper objectMapper) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.token = token;
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Invocation invoke(String runtimeId, String sessionId, Payload payload) {
        HttpRequest request = post(invocationsPath(runtimeId), sessionId, body(payload),
                Duration.ofMillis(payload.timeoutMs()).plusSeconds(5));
        JsonNode json = expectOk(send(request, "invoke " + runtimeId), "invoke " + runtimeId);
        return toInvocation(json);
    }

    @Override
    public String startInvocation(String runtimeId, String sessionId, Payload payload) {
        HttpRequest request = post(invocationsPath(runtimeId) + "?mode=async", sessionId, body(payload),
                Duration.ofSeconds(30));
        JsonNode json = expectOk(send(request, "start invocation on " + runtimeId), "start invocation");
        String invocationId = json.path("invocationId").asText();
        log.info("Started async invocation {} on runtime {}", invocationId, runtimeId);
        return invocationId;
    }

    @Override
    public Invocation getInvocation(String runtimeId, String invocationId) {
        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(endpoint + invocationsPath(runtimeId) + "/" + encode(invocationId))))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = send(request, "get invocation " + invocationId);
        if (response.statusCode() == 404) {
            throw new BackendNotFoundException("Invocation not found: " + invocationId);
        }
        return toInvocation(expectOk(response, "get invocation"));
    }

    @Override
    public void stopInvocation(String runtimeId, String invocationId) {
        HttpRequest request = post(invocationsPath(runtimeId) + "/" + encode(invocationId) + "/stop",
                null, "{}", Duration.ofSeconds(30));
        HttpResponse<String> response = send(request, "stop invocation " + invocationId);
        if (response.statusCode() >= 400 && response.statusCode() != 404) {
            throw new InfraException("Stopping invocation %s failed (HTTP %d)"
                    .formatted(invocationId, response.statusCode()));
        }
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────

    private String body(Payload payload) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt", payload.prompt());
        if (payload.modelId() != null) {
            body.put("modelId", payload.modelId());
        }
        if (payload.region() != null) {
            body.put("region", payload.region());
        }
        body.put("timeoutMs", payload.timeoutMs());
        return body.toString();
    }

    private Invocation toInvocation(JsonNode json) {
        List<String> logs = new ArrayList<>();
        json.path("logs").forEach(line -> logs.add(line.asText()));
        return new Invocation(
                json.path("status").asText("succeeded"),
                json.hasNonNull("response") ? json.get("response").asText() : null,
                json.hasNonNull("error") ? json.get("error").asText() : null,
                logs);
    }

    private static String invocationsPath(String runtimeId) {
        return "/runtimes/" + encode(runtimeId) + "/invocations";
    }

    private HttpRequest post(String path, String sessionId, String body, Duration timeout) {
        HttpRequest.Builder builder = authorized(HttpRequest.newBuilder().uri(URI.create(endpoint + path)))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (sessionId != null) {
            builder.header(SESSION_HEADER, sessionId);
        }
        return builder.build();
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String action) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new InfraException("Runtime service unreachable (" + action + "): " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfraException("Interrupted during " + action, e);
        }
    }

    private JsonNode expectOk(HttpResponse<String> response, String what) {
        if (response.statusCode() == 429) {
            throw new QuotaExceededException("Runtime service throttled " + what);
        }
        if (response.statusCode() >= 400) {
            throw new InfraException("Runtime service %s failed (HTTP %d): %s"
                    .formatted(what, response.statusCode(), response.body()));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new InfraException("Runtime service returned malformed JSON for " + what, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
