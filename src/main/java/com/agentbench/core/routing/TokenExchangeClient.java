package com.agentbench.core.routing;

/**
 * Exchanges a role reference plus external id for short-lived credentials.
 */
public interface TokenExchangeClient {

    /**
     * @throws com.agentbench.core.error.CrossAccountTrustException if the trust policy refuses the
     *         exchange (wrong external id, role not trusting the platform)
     * @throws com.agentbench.core.error.InfraException             if the exchange service is unreachable
     */
    AssumedCredentials assumeRole(String roleArn, String externalId, String sessionName, int durationSeconds);
}
