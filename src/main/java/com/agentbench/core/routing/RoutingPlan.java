package com.agentbench.core.routing;

import com.agentbench.core.model.ProviderKind;
import com.agentbench.core.model.Tier;
import com.agentbench.core.store.UsageCharge;

/**
 * Submission-time routing decision.
 *
 * @param provider   backend the job goes to
 * @param tier       tier the decision was made under
 * @param ownAccount whether the job runs in the user's own account
 * @param region     region to run in
 * @param charge     usage increment to apply with the submission, null when free
 */
public record RoutingPlan(ProviderKind provider, Tier tier, boolean ownAccount, String region, UsageCharge charge) {
}
