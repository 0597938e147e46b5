package com.agentbench.core.service;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.model.ProviderConfig;
import com.agentbench.core.store.InMemoryAgentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentServiceTest {

    private static final ProviderConfig OLLAMA = new ProviderConfig("http://ollama:11434", "llama3", null);

    private AgentService service;

    @BeforeEach
    void setUp() {
        service = new AgentService(new InMemoryAgentStore());
    }

    @Test
    @DisplayName("registerAgent assigns an id and an empty artifact when none are given")
    void registerDefaults() {
        Agent saved = service.registerAgent(new Agent(null, "u1", "echo", null, OLLAMA, null, false));

        assertNotNull(saved.id());
        assertFalse(saved.id().isBlank());
        assertEquals(ExecutionArtifact.empty(), saved.artifact());
        assertEquals(saved, service.getAgent(saved.id()));
    }

    @Test
    @DisplayName("registerAgent with a known id replaces the stored agent")
    void upsert() {
        service.registerAgent(new Agent("a1", "u1", "v1", null, OLLAMA, null, false));
        service.registerAgent(new Agent("a1", "u1", "v2", null, OLLAMA, null, true));

        Agent agent = service.getAgent("a1");
        assertEquals("v2", agent.name());
        assertTrue(agent.visibleTo("someone-else"));
    }

    @Test
    @DisplayName("owner and model id are required")
    void validation() {
        assertThrows(ValidationException.class,
                () -> service.registerAgent(new Agent("a1", " ", "x", null, OLLAMA, null, false)));
        assertThrows(ValidationException.class,
                () -> service.registerAgent(new Agent("a1", "u1", "x", null, new ProviderConfig(null, null, null), null, false)));
    }

    @Test
    @DisplayName("getAgent of an unknown id throws")
    void unknown() {
        assertThrows(JobNotFoundException.class, () -> service.getAgent("missing"));
    }
}
