package com.agentbench.core.store;

import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryUserStore implements UserStore {

    private final ConcurrentHashMap<String, UserAccount> users = new ConcurrentHashMap<>();

    @Override
    public Optional<UserAccount> findById(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public synchronized UserAccount save(UserAccount user) {
        users.put(user.id(), user);
        return user;
    }

    @Override
    public synchronized boolean tryIncrementUsage(String userId, int monthlyCap) {
        UserAccount user = users.get(userId);
        if (user == null || (monthlyCap >= 0 && user.testsThisMonth() >= monthlyCap)) {
            return false;
        }
        users.put(userId, new UserAccount(userId, user.tier(), user.testsThisMonth() + 1, user.usageResetAt()));
        return true;
    }

    @Override
    public synchronized int incrementUsage(String userId) {
        UserAccount user = users.get(userId);
        if (user == null) {
            return 0;
        }
        UserAccount updated = new UserAccount(userId, user.tier(), user.testsThisMonth() + 1, user.usageResetAt());
        users.put(userId, updated);
        return updated.testsThisMonth();
    }

    @Override
    public synchronized void refundUsage(String userId) {
        UserAccount user = users.get(userId);
        if (user != null && user.testsThisMonth() > 0) {
            users.put(userId, new UserAccount(userId, user.tier(), user.testsThisMonth() - 1, user.usageResetAt()));
        }
    }

    @Override
    public synchronized int resetUsage(Tier tier, Instant resetAt) {
        int count = 0;
        for (UserAccount user : users.values()) {
            if (user.tier() == tier) {
                users.put(user.id(), new UserAccount(user.id(), tier, 0, resetAt));
                count++;
            }
        }
        return count;
    }
}
