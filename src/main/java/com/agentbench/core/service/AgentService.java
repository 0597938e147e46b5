package com.agentbench.core.service;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.ExecutionArtifact;
import com.agentbench.core.store.AgentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Registration of agents produced by the external agent builder.
 */
@Service
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final AgentStore agents;

    public AgentService(AgentStore agents) {
        this.agents = agents;
    }

    public Agent registerAgent(Agent agent) {
        if (agent.ownerId() == null || agent.ownerId().isBlank()) {
            throw new ValidationException("Agent owner is required");
        }
        if (agent.providerConfig() == null || agent.providerConfig().modelId() == null) {
            throw new ValidationException("Agent model id is required");
        }
        String id = agent.id() != null && !agent.id().isBlank() ? agent.id() : UUID.randomUUID().toString();
        ExecutionArtifact artifact = agent.artifact() != null ? agent.artifact() : ExecutionArtifact.empty();
        Agent saved = agents.save(new Agent(id, agent.ownerId(), agent.name(), artifact, agent.providerConfig(),
                agent.runtimeId(), agent.isPublic()));
        log.info("Registered agent {} ({}) for {}", id, agent.providerConfig().modelId(), agent.ownerId());
        return saved;
    }

    public Agent getAgent(String agentId) {
        return agents.findById(agentId).orElseThrow(() -> new JobNotFoundException("Agent", agentId));
    }
}
