package com.agentbench.core.service;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Tier and monthly usage of users. Authentication lives elsewhere; users are upserted here by id.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserStore users;
    private final Clock clock;

    public UserService(UserStore users, Clock clock) {
        this.users = users;
        this.clock = clock;
    }

    /**
     * Creates the user or changes its tier. Usage is kept across tier changes.
     */
    public UserAccount registerUser(String userId, Tier tier) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        Tier effective = tier != null ? tier : Tier.FREEMIUM;
        UserAccount saved = users.save(users.findById(userId)
                .map(u -> u.withTier(effective))
                .orElseGet(() -> new UserAccount(userId, effective, 0, now())));
        log.info("Registered user {} on tier {}", userId, effective.value());
        return saved;
    }

    public UserAccount getUser(String userId) {
        return users.findById(userId).orElseThrow(() -> new JobNotFoundException("User", userId));
    }

    /**
     * Returns the user, provisioning unknown ids on the freemium tier.
     */
    public UserAccount getOrProvision(String userId) {
        return users.findById(userId).orElseGet(() -> {
            log.info("Provisioning unknown user {} on freemium", userId);
            return users.save(new UserAccount(userId, Tier.FREEMIUM, 0, now()));
        });
    }

    /**
     * Unconditional increment, for usage recorded outside a submission.
     *
     * @return the new monthly count
     */
    public int incrementUsage(String userId) {
        getUser(userId);
        return users.incrementUsage(userId);
    }

    /**
     * Resets the monthly counter of every freemium user.
     *
     * @return number of users reset
     */
    public int resetMonthlyUsage() {
        int reset = users.resetUsage(Tier.FREEMIUM, now());
        log.info("Reset monthly usage for {} freemium user(s)", reset);
        return reset;
    }

    @Scheduled(cron = "${agentbench.usage.reset-cron:0 0 0 1 * *}")
    public void monthlyReset() {
        try {
            resetMonthlyUsage();
        } catch (RuntimeException e) {
            log.error("Monthly usage reset failed: {}", e.getMessage(), e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
