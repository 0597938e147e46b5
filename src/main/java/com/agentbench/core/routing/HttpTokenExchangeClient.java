package com.agentbench.core.routing;

import com.agentbench.core.error.CrossAccountTrustException;
import com.agentbench.core.error.InfraException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Calls the platform's token-exchange endpoint ({@code POST /aws/assumeRole}).
 * <p>
 * A 401 or 403 (whatever the body says), or an error code of {@code AccessDenied}, means the role's trust policy refused
 * the platform, which is how an external id mismatch surfaces.
 */
@Component
public class HttpTokenExchangeClient implements TokenExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpTokenExchangeClient.class);

    private final TrustProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpTokenExchangeClient(TrustProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public AssumedCredentials assumeRole(String roleArn, String externalId, String sessionName, int durationSeconds) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("roleArn", roleArn);
        body.put("externalId", externalId);
        body.put("sessionName", sessionName);
        body.put("durationSeconds", durationSeconds);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.getTokenExchangeUrl() + "/aws/assumeRole"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (properties.getTokenExchangeSecret() != null) {
            builder.header("Authorization", "Bearer " + properties.getTokenExchangeSecret());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new InfraException("Token exchange unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfraException("Interrupted during token exchange", e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            log.warn("Role {} refused the token exchange (HTTP {})", roleArn, status);
            throw trustRefused(roleArn);
        }
        if (status >= 400) {
            if ("AccessDenied".equals(errorCode(tryParse(response.body())))) {
                log.warn("Role {} refused the token exchange", roleArn);
                throw trustRefused(roleArn);
            }
            throw new InfraException("Token exchange failed (HTTP %d): %s".formatted(status, response.body()));
        }

        JsonNode json = parse(response.body());
        if ("AccessDenied".equals(errorCode(json))) {
            log.warn("Role {} refused the token exchange", roleArn);
            throw trustRefused(roleArn);
        }
        JsonNode credentials = json.has("Credentials") ? json.get("Credentials") : json;
        if (!credentials.hasNonNull("AccessKeyId")) {
            throw new InfraException("Token exchange response carried no credentials");
        }
        return new AssumedCredentials(
                credentials.get("AccessKeyId").asText(),
                credentials.path("SecretAccessKey").asText(),
                credentials.path("SessionToken").asText(),
                credentials.hasNonNull("Expiration")
                        ? Instant.parse(credentials.get("Expiration").asText())
                        : clock.instant().plusSeconds(durationSeconds));
    }

    private static CrossAccountTrustException trustRefused(String roleArn) {
        return new CrossAccountTrustException("Role " + roleArn
                + " refused to be assumed; check that the trust policy names the platform and the external id");
    }

    private static String errorCode(JsonNode json) {
        return json.path("error").path("code").asText(json.path("code").asText(""));
    }

    /** Error bodies are not always JSON; an unreadable one has no error code. */
    private JsonNode tryParse(String body) {
        try {
            return parse(body);
        } catch (InfraException e) {
            return objectMapper.createObjectNode();
        }
    }

    private JsonNode parse(String body) {
        try {
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new InfraException("Token exchange returned malformed JSON", e);
        }
    }
}
