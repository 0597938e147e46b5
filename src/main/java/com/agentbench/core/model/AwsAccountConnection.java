package com.agentbench.core.model;

import java.time.Instant;

/**
 * Cross-account trust record. Only the role reference and the server-generated external id are
 * kept; credentials are exchanged per dispatch and never persisted.
 */
public record AwsAccountConnection(
        String userId,
        String awsAccountId,
        String roleArn,
        String externalId,
        String region,
        ConnectionStatus status,
        Instant createdAt,
        Instant connectedAt
) {

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    public AwsAccountConnection connect(String accountId, String arn, String newRegion, Instant at) {
        return new AwsAccountConnection(userId, accountId, arn, externalId, newRegion,
                ConnectionStatus.CONNECTED, createdAt, at);
    }

    public AwsAccountConnection disconnect() {
        return new AwsAccountConnection(userId, awsAccountId, roleArn, externalId, region,
                ConnectionStatus.DISCONNECTED, createdAt, connectedAt);
    }
}
