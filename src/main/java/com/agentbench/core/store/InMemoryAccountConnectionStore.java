package com.agentbench.core.store;

import com.agentbench.core.model.AwsAccountConnection;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAccountConnectionStore implements AccountConnectionStore {

    private final ConcurrentHashMap<String, AwsAccountConnection> connections = new ConcurrentHashMap<>();

    @Override
    public Optional<AwsAccountConnection> findByUserId(String userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    @Override
    public AwsAccountConnection save(AwsAccountConnection connection) {
        connections.put(connection.userId(), connection);
        return connection;
    }
}
