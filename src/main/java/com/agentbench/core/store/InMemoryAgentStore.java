package com.agentbench.core.store;

import com.agentbench.core.model.Agent;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAgentStore implements AgentStore {

    private final ConcurrentHashMap<String, Agent> agents = new ConcurrentHashMap<>();

    @Override
    public Optional<Agent> findById(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Agent save(Agent agent) {
        agents.put(agent.id(), agent);
        return agent;
    }
}
