package com.agentbench.core.store;

import com.agentbench.core.model.AwsAccountConnection;

import javax.sql.DataSource;
import java.util.Optional;

public class JdbcAccountConnectionStore implements AccountConnectionStore {

    private final JdbcDocumentTable<AwsAccountConnection> table;

    public JdbcAccountConnectionStore(DataSource dataSource) {
        this.table = new JdbcDocumentTable<>(dataSource, "aws_connection", AwsAccountConnection.class);
    }

    @Override
    public Optional<AwsAccountConnection> findByUserId(String userId) {
        return table.find(userId);
    }

    @Override
    public AwsAccountConnection save(AwsAccountConnection connection) {
        return table.save(connection.userId(), connection.userId(), connection.createdAt(), connection);
    }
}
