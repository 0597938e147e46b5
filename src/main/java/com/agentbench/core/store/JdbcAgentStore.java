package com.agentbench.core.store;

import com.agentbench.core.model.Agent;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.Optional;

public class JdbcAgentStore implements AgentStore {

    private final JdbcDocumentTable<Agent> table;

    public JdbcAgentStore(DataSource dataSource) {
        this.table = new JdbcDocumentTable<>(dataSource, "agent", Agent.class);
    }

    @Override
    public Optional<Agent> findById(String agentId) {
        return table.find(agentId);
    }

    @Override
    public Agent save(Agent agent) {
        return table.save(agent.id(), agent.ownerId(), Instant.now(), agent);
    }
}
