package com.agentbench.core.store;

import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;

import java.time.Instant;
import java.util.Optional;

public interface UserStore {

    Optional<UserAccount> findById(String userId);

    UserAccount save(UserAccount user);

    /**
     * Increments the monthly counter only if it is below {@code monthlyCap} (negative = no cap).
     *
     * @return false if the cap was already reached or the user does not exist
     */
    boolean tryIncrementUsage(String userId, int monthlyCap);

    /** Increments the monthly counter without a cap and returns the new value. */
    int incrementUsage(String userId);

    /** Gives back one charge taken for work the platform never performed. Never goes below zero. */
    void refundUsage(String userId);

    /** Resets the monthly counter of every user of the tier. Returns how many were reset. */
    int resetUsage(Tier tier, Instant resetAt);
}
