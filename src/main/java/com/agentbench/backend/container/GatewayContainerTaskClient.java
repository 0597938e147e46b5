package com.agentbench.backend.container;

import com.agentbench.backend.LogPage;
import com.agentbench.core.error.BackendNotFoundException;
import com.agentbench.core.error.InfraException;
import com.agentbench.core.error.QuotaExceededException;
import com.agentbench.core.routing.AssumedCredentials;
import com.agentbench.core.routing.CredentialContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
 * HTTP client for the task gateway that fronts the elastic container executor and its log store.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /tasks} launch, 429 when the cluster is out of capacity</li>
 *   <li>{@code GET /tasks/{id}} describe</li>
 *   <li>{@code POST /tasks/{id}/stop} stop</li>
 *   <li>{@code GET /logs?group=&stream=&cursor=} forward log pagination</li>
 * </ul>
 * Assumed-role credentials travel in the launch body so the gateway acts in the right account.
 */
public class GatewayContainerTaskClient implements ContainerTaskClient {

    private static final Logger log = LoggerFactory.getLogger(GatewayContainerTaskClient.class);

    private final String baseUrl;
    private final String token;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GatewayContainerTaskClient(String baseUrl, String token, ObjectMapper objectMapper) {
        this(baseUrl, token, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper);
    }

    GatewayContainerTaskClient(String baseUrl, String token, HttpClient httpClient, ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Task gateway URL is not configured (agentbench.backend.container.gateway-url)");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public LaunchedTask launch(TaskLaunchRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("cluster", request.cluster());
        body.put("taskName", request.taskName());
        body.put("image", request.image());
        body.put("cpu", request.cpuUnits());
        body.put("memory", request.memoryMb());
        body.put("logGroup", request.logGroup());
        body.put("logStream", request.taskName());

        ArrayNode env = body.putArray("environment");
        request.environment().forEach((k, v) -> env.addObject().put("name", k).put("value", v));

        ObjectNode network = body.putObject("network");
        request.subnets().forEach(network.putArray("subnets")::add);
        request.securityGroups().forEach(network.putArray("securityGroups")::add);

        CredentialContext credentials = request.credentials();
        if (credentials != null) {
            body.put("region", credentials.region());
            AssumedCredentials assumed = credentials.credentials();
            if (assumed != null) {
                body.putObject("credentials")
                        .put("accessKeyId", assumed.accessKeyId())
                        .put("secretAccessKey", assumed.secretAccessKey())
                        .put("sessionToken", assumed.sessionToken());
            }
        }

        HttpResponse<String> response = send(post("/tasks", body.toString()), "launch task");
        if (response.statusCode() == 429) {
            throw new QuotaExceededException("Task executor is out of capacity: " + response.body());
        }
        JsonNode json = expectOk(response, "POST /tasks");
        String taskId = json.path("taskId").asText();
        log.info("Gateway launched task '{}' (id={})", request.taskName(), taskId);
        return new LaunchedTask(taskId, json.path("taskArn").asText(taskId));
    }

    @Override
    public TaskState describe(String taskId) {
        HttpResponse<String> response = send(get("/tasks/" + encode(taskId)), "describe task");
        if (response.statusCode() == 404) {
            throw new BackendNotFoundException("Task not found: " + taskId);
        }
        JsonNode json = expectOk(response, "GET /tasks/" + taskId);
        return new TaskState(
                json.path("lastStatus").asText("PENDING"),
                json.hasNonNull("exitCode") ? json.get("exitCode").asInt() : null,
                json.hasNonNull("stoppedReason") ? json.get("stoppedReason").asText() : null,
                json.hasNonNull("memoryUsedMb") ? json.get("memoryUsedMb").asLong() : null,
                json.hasNonNull("cpuUsed") ? json.get("cpuUsed").asDouble() : null);
    }

    @Override
    public void stop(String taskId, String reason) {
        ObjectNode body = objectMapper.createObjectNode().put("reason", reason);
        HttpResponse<String> response = send(post("/tasks/" + encode(taskId) + "/stop", body.toString()), "stop task");
        if (response.statusCode() >= 400 && response.statusCode() != 404) {
            throw new InfraException("Stopping task %s failed (HTTP %d): %s"
                    .formatted(taskId, response.statusCode(), response.body()));
        }
    }

    @Override
    public LogPage readLogs(String taskId, String logGroup, String logStream, String cursor) {
        String path = "/logs?group=" + encode(logGroup) + "&stream=" + encode(logStream)
                + (cursor != null ? "&cursor=" + encode(cursor) : "");
        HttpResponse<String> response = send(get(path), "read logs");
        if (response.statusCode() == 404) {
            // stream not created yet
            return LogPage.empty(cursor);
        }
        JsonNode json = expectOk(response, "GET /logs");
        List<String> lines = new ArrayList<>();
        json.path("lines").forEach(line -> lines.add(line.asText()));
        String next = json.hasNonNull("nextCursor") ? json.get("nextCursor").asText() : cursor;
        return new LogPage(lines, next);
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────

    private HttpRequest get(String path) {
        return authorized(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)))
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private HttpRequest post(String path, String body) {
        return authorized(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.timeout(Duration.ofSeconds(30));
    }

    private HttpResponse<String> send(HttpRequest request, String action) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new InfraException("Task gateway unreachable (" + action + "): " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfraException("Interrupted during " + action, e);
        }
    }

    private JsonNode expectOk(HttpResponse<String> response, String what) {
        if (response.statusCode() >= 400) {
            throw new InfraException("Task gateway %s failed (HTTP %d): %s"
                    .formatted(what, response.statusCode(), response.body()));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new InfraException("Task gateway returned malformed JSON for " + what, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
