package com.agentbench.core.store;

import com.agentbench.core.model.Deployment;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;

public class JdbcDeploymentStore implements DeploymentStore {

    private final JdbcDocumentTable<Deployment> table;

    public JdbcDeploymentStore(DataSource dataSource) {
        this.table = new JdbcDocumentTable<>(dataSource, "deployment", Deployment.class);
    }

    @Override
    public Deployment save(Deployment deployment) {
        return table.save(deployment.id(), deployment.agentId(), deployment.createdAt(), deployment);
    }

    @Override
    public Optional<Deployment> findById(String deploymentId) {
        return table.find(deploymentId);
    }

    @Override
    public List<Deployment> findByAgent(String agentId, int limit) {
        return table.findByOwner(agentId, limit);
    }
}
