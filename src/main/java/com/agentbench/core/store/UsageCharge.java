package com.agentbench.core.store;

/**
 * A usage increment to apply together with a submission.
 *
 * @param userId       user to charge
 * @param monthlyCap   cap the counter must stay below before the increment; negative means unlimited
 */
public record UsageCharge(String userId, int monthlyCap) {

    public boolean isCapped() {
        return monthlyCap >= 0;
    }
}
