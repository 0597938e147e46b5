package com.agentbench.core.model;

import java.time.Instant;

/**
 * A user as far as the scheduler cares: tier and monthly usage.
 */
public record UserAccount(String id, Tier tier, int testsThisMonth, Instant usageResetAt) {

    public UserAccount withTier(Tier newTier) {
        return new UserAccount(id, newTier, testsThisMonth, usageResetAt);
    }
}
