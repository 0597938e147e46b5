package com.agentbench.core.routing;

import com.agentbench.backend.BackendProperties;
import com.agentbench.core.error.NoAwsAccountConnectedException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.Agent;
import com.agentbench.core.model.AwsAccountConnection;
import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.store.AccountConnectionStore;
import com.agentbench.core.store.UsageCharge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides, from the agent's model provider and the user's tier, which backend and which
 * credentials a job uses.
 *
 * <table>
 *   <caption>Routing table</caption>
 *   <tr><th>Tier</th><th>Foundation-model agent</th><th>Other agent</th><th>Account</th><th>Usage</th></tr>
 *   <tr><td>freemium</td><td>managed runtime</td><td>container</td><td>platform</td><td>capped (foundation models only)</td></tr>
 *   <tr><td>personal</td><td>container</td><td>container</td><td>user, via assumed role</td><td>capped</td></tr>
 *   <tr><td>enterprise</td><td>container</td><td>container</td><td>user, via assumed role</td><td>uncapped</td></tr>
 * </table>
 */
@Service
public class DeploymentRouter {

    private static final Logger log = LoggerFactory.getLogger(DeploymentRouter.class);

    private final TierProperties tiers;
    private final TrustProperties trust;
    private final BackendProperties backend;
    private final AccountConnectionStore connections;
    private final TokenExchangeClient tokenExchange;
    private final CredentialCache credentialCache;

    public DeploymentRouter(TierProperties tiers, TrustProperties trust, BackendProperties backend,
                            AccountConnectionStore connections, TokenExchangeClient tokenExchange,
                            CredentialCache credentialCache) {
        this.tiers = tiers;
        this.trust = trust;
        this.backend = backend;
        this.connections = connections;
        this.tokenExchange = tokenExchange;
        this.credentialCache = credentialCache;
    }

    /**
     * Routing decision made before anything is queued. Fails fast when the tier needs a connected
     * account and none exists.
     *
     * @throws NoAwsAccountConnectedException if the tier runs in the user's account and it is not connected
     * @throws ValidationException            if a managed-runtime route is chosen for an agent without a runtime id
     */
    public RoutingPlan plan(UserAccount user, Agent agent) {
        Tier tier = user.tier();
        TierProperties.Policy policy = tiers.policyFor(tier);

        if (tier.usesOwnAccount()) {
            AwsAccountConnection connection = requireConnection(user.id());
            return new RoutingPlan(ProviderKind.CONTAINER, tier, true, connection.region(),
                    new UsageCharge(user.id(), policy.enforcedCap()));
        }

        boolean foundationModel = agent.providerConfig() != null && agent.providerConfig().isFoundationModel();
        String region = agent.providerConfig() != null && agent.providerConfig().region() != null
                ? agent.providerConfig().region() : backend.getDefaultRegion();
        if (!foundationModel) {
            // open models run on platform containers and do not count against usage
            return new RoutingPlan(ProviderKind.CONTAINER, tier, false, region, null);
        }
        if (agent.runtimeId() == null || agent.runtimeId().isBlank()) {
            throw new ValidationException("Agent " + agent.id() + " has no managed runtime to run on");
        }
        return new RoutingPlan(ProviderKind.MANAGED_RUNTIME, tier, false, region,
                new UsageCharge(user.id(), policy.enforcedCap()));
    }

    /**
     * Credentials for dispatching a job, resolved at dispatch time. Assumed-role credentials are
     * cached per user for at most the session lifetime.
     *
     * @throws NoAwsAccountConnectedException if the account was disconnected after submission
     * @throws com.agentbench.core.error.CrossAccountTrustException if the role refuses the exchange
     */
    public CredentialContext resolveCredentials(String userId, Tier tier, String region) {
        if (!tier.usesOwnAccount()) {
            return CredentialContext.platform(region != null ? region : backend.getDefaultRegion());
        }
        AwsAccountConnection connection = requireConnection(userId);
        AssumedCredentials credentials = credentialCache.get(userId, connection.roleArn(),
                () -> exchange(connection));
        return CredentialContext.userAccount(connection.region(), connection.roleArn(), credentials);
    }

    AssumedCredentials exchange(AwsAccountConnection connection) {
        String sessionName = trust.getSessionNamePrefix() + "-" + connection.userId();
        log.info("Assuming role {} for user {}", connection.roleArn(), connection.userId());
        return tokenExchange.assumeRole(connection.roleArn(), connection.externalId(), sessionName,
                trust.getSessionDurationSeconds());
    }

    private AwsAccountConnection requireConnection(String userId) {
        return connections.findByUserId(userId)
                .filter(AwsAccountConnection::isConnected)
                .orElseThrow(() -> new NoAwsAccountConnectedException(
                        "No AWS account connected. Connect an account before running tests on this tier."));
    }
}
