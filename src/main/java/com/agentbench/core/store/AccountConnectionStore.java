package com.agentbench.core.store;

import com.agentbench.core.model.AwsAccountConnection;

import java.util.Optional;

public interface AccountConnectionStore {

    Optional<AwsAccountConnection> findByUserId(String userId);

    AwsAccountConnection save(AwsAccountConnection connection);
}
