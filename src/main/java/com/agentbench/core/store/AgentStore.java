package com.agentbench.core.store;

import com.agentbench.core.model.Agent;

import java.util.Optional;

public interface AgentStore {

    Optional<Agent> findById(String agentId);

    Agent save(Agent agent);
}
