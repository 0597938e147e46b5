package com.agentbench.core.routing;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-user assumed-role credentials, reused until shortly before they expire.
 * Entries are keyed by user and role so a re-pointed connection never reuses old credentials.
 */
@Component
public class CredentialCache {

    private record Key(String userId, String roleArn) {}

    private final ConcurrentHashMap<Key, AssumedCredentials> cache = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration refreshSkew;

    public CredentialCache(Clock clock, TrustProperties properties) {
        this.clock = clock;
        this.refreshSkew = Duration.ofSeconds(properties.getRefreshSkewSeconds());
    }

    /**
     * Returns cached credentials for the user and role, loading fresh ones when none are cached or
     * they expire within the refresh skew. Loading holds the key, so concurrent callers for the
     * same key share a single exchange. A failing loader leaves the previous entry in place.
     */
    public AssumedCredentials get(String userId, String roleArn, Supplier<AssumedCredentials> loader) {
        return cache.compute(new Key(userId, roleArn), (key, cached) ->
                cached != null && cached.validAt(clock.instant().plus(refreshSkew)) ? cached : loader.get());
    }

    public void invalidate(String userId) {
        cache.keySet().removeIf(key -> key.userId().equals(userId));
    }

    int size() {
        return cache.size();
    }
}
