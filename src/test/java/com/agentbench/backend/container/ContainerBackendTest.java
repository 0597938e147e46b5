package com.agentbench.backend.container;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.BackendProperties;
import com.agentbench.backend.BackendStatus;
import com.agentbench.backend.JobDescriptor;
import com.agentbench.backend.LogPage;
import com.agentbench.backend.PollResult;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.routing.AssumedCredentials;
import com.agentbench.core.routing.CredentialContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ContainerBackendTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private ImageBuilder imageBuilder;
    private ContainerTaskClient taskClient;
    private BackendProperties properties;
    private ContainerBackend backend;

    @BeforeEach
    void setUp() {
        imageBuilder = mock(ImageBuilder.class);
        taskClient = mock(ContainerTaskClient.class);
        properties = new BackendProperties();
        properties.getContainer().setLogGroup("/agent-tests");
        properties.getContainer().setSubnets(List.of("subnet-1"));
        backend = new ContainerBackend(imageBuilder, taskClient, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static JobDescriptor descriptor(ProviderConfig config, CredentialContext credentials) {
        return new JobDescriptor("job-0123456789", "a1", "What is 2+2?",
                new ExecutionArtifact("print(4)", "requests\n", "FROM python:3.11-slim\n"),
                config, null, 60_000, credentials);
    }

    private static String decode(String value) {
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        @DisplayName("Builds, launches and returns a handle carrying the image and build time")
        void launches() {
            when(imageBuilder.build(eq("job-0123456789"), any()))
                    .thenReturn(new ImageBuilder.BuiltImage("registry/agent-test:job", 1200));
            when(taskClient.launch(any())).thenReturn(new ContainerTaskClient.LaunchedTask("t-1", "arn:task/t-1"));

            BackendHandle handle = backend.submit(descriptor(
                    new ProviderConfig("http://ollama:11434", "llama3.1:8b", null), CredentialContext.platform("us-east-1")));

            assertEquals(ProviderKind.CONTAINER, handle.provider());
            assertEquals("t-1", handle.taskId());
            assertEquals("registry/agent-test:job", handle.imageRef());
            assertEquals(1200, handle.buildTimeMs());
            assertEquals("/agent-tests", handle.logGroup());
            assertEquals("test-23456789-" + NOW.toEpochMilli(), handle.logStream());

            ArgumentCaptor<ContainerTaskClient.TaskLaunchRequest> request =
                    ArgumentCaptor.forClass(ContainerTaskClient.TaskLaunchRequest.class);
            verify(taskClient).launch(request.capture());
            assertEquals("registry/agent-test:job", request.getValue().image());
            assertEquals(List.of("subnet-1"), request.getValue().subnets());
        }

        @Test
        @DisplayName("Open model: ollama settings and base64 artifact, no cloud credentials")
        void openModelEnvironment() {
            Map<String, String> env = backend.environment(descriptor(
                    new ProviderConfig("http://ollama:11434", "llama3.1:8b", null), CredentialContext.platform("us-east-1")));

            assertEquals("job-0123456789", env.get("TEST_ID"));
            assertEquals("What is 2+2?", env.get("TEST_QUERY"));
            assertEquals("ollama", env.get("MODEL_PROVIDER"));
            assertEquals("http://ollama:11434", env.get("OLLAMA_BASE_URL"));
            assertEquals("llama3.1:8b", env.get("OLLAMA_MODEL"));
            assertEquals("print(4)", decode(env.get("AGENT_CODE_B64")));
            assertEquals("FROM python:3.11-slim\n", decode(env.get("DOCKERFILE_B64")));
            assertFalse(env.containsKey("AWS_ACCESS_KEY_ID"));
        }

        @Test
        @DisplayName("Foundation model in a user account: bedrock settings and assumed credentials")
        void foundationModelEnvironment() {
            var credentials = CredentialContext.userAccount("eu-west-1", "arn:aws:iam::123456789012:role/R",
                    new AssumedCredentials("ASIA1", "secret", "token", NOW.plusSeconds(3600)));

            Map<String, String> env = backend.environment(descriptor(
                    new ProviderConfig(null, "anthropic.claude-3-haiku", null), credentials));

            assertEquals("bedrock", env.get("MODEL_PROVIDER"));
            assertEquals("eu-west-1", env.get("AWS_REGION"));
            assertEquals("anthropic.claude-3-haiku", env.get("BEDROCK_MODEL_ID"));
            assertEquals("ASIA1", env.get("AWS_ACCESS_KEY_ID"));
            assertEquals("token", env.get("AWS_SESSION_TOKEN"));
        }
    }

    @Nested
    @DisplayName("poll")
    class Poll {

        private final BackendHandle handle =
                new BackendHandle(ProviderKind.CONTAINER, "t-1", "arn", "/agent-tests", "stream", null, 0L);

        @Test
        @DisplayName("Running and provisioning tasks map to running and pending")
        void notStopped() {
            when(taskClient.describe("t-1"))
                    .thenReturn(new ContainerTaskClient.TaskState("RUNNING", null, null, null, null))
                    .thenReturn(new ContainerTaskClient.TaskState("PROVISIONING", null, null, null, null));

            assertEquals(BackendStatus.RUNNING, backend.poll(handle).status());
            assertEquals(BackendStatus.PENDING, backend.poll(handle).status());
        }

        @Test
        @DisplayName("Stopped task with the success marker yields the response lines")
        void succeeded() {
            when(taskClient.describe("t-1"))
                    .thenReturn(new ContainerTaskClient.TaskState("STOPPED", 0, null, 256L, 0.5));
            when(taskClient.readLogs(eq("t-1"), anyString(), anyString(), isNull()))
                    .thenReturn(new LogPage(List.of("RESPONSE: 4", "TEST COMPLETED SUCCESSFULLY"), "2"));
            when(taskClient.readLogs("t-1", "/agent-tests", "stream", "2")).thenReturn(LogPage.empty("2"));

            PollResult result = backend.poll(handle);

            assertEquals(BackendStatus.SUCCEEDED, result.status());
            assertEquals("4", result.response());
            assertEquals(256L, result.memoryUsedMb());
        }

        @Test
        @DisplayName("Stopped task with the failure marker reports the last error line")
        void failed() {
            when(taskClient.describe("t-1"))
                    .thenReturn(new ContainerTaskClient.TaskState("STOPPED", 0, null, null, null));
            when(taskClient.readLogs(eq("t-1"), anyString(), anyString(), isNull()))
                    .thenReturn(new LogPage(List.of("ERROR: model unreachable", "TEST FAILED"), "2"));
            when(taskClient.readLogs("t-1", "/agent-tests", "stream", "2")).thenReturn(LogPage.empty("2"));

            PollResult result = backend.poll(handle);

            assertEquals(BackendStatus.FAILED, result.status());
            assertEquals("model unreachable", result.error());
        }

        @Test
        @DisplayName("cancel stops the task and tolerates executor errors")
        void cancel() {
            doThrow(new IllegalStateException("gone")).when(taskClient).stop(anyString(), anyString());

            assertDoesNotThrow(() -> backend.cancel(handle));
            verify(taskClient).stop("t-1", "Stopped by scheduler");
        }
    }

    @Nested
    @DisplayName("ResultMarkers")
    class Markers {

        @Test
        @DisplayName("A zero exit code without markers counts as success")
        void exitCodeFallback() {
            assertTrue(ResultMarkers.succeeded(List.of("hello"), 0));
            assertFalse(ResultMarkers.succeeded(List.of("hello"), 1));
            assertFalse(ResultMarkers.succeeded(List.of("TEST COMPLETED SUCCESSFULLY", "TEST FAILED"), 0));
        }

        @Test
        @DisplayName("Error falls back to the stop reason, then the exit code")
        void errorFallback() {
            assertEquals("OutOfMemory", ResultMarkers.error(List.of(), 137, "OutOfMemory"));
            assertEquals("Container exited with code 137", ResultMarkers.error(List.of(), 137, null));
            assertEquals("a\nb", ResultMarkers.response(List.of("RESPONSE: a", "noise", "RESPONSE: b")));
        }
    }
}
