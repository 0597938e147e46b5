package com.agentbench.core.routing;

import java.time.Instant;

/**
 * Short-lived credentials returned by the token exchange. Never persisted.
 */
public record AssumedCredentials(String accessKeyId, String secretAccessKey, String sessionToken,
                                 Instant expiration) {

    public boolean validAt(Instant now) {
        return expiration != null && now.isBefore(expiration);
    }

    @Override
    public String toString() {
        // keep secrets out of logs
        return "AssumedCredentials[accessKeyId=" + accessKeyId + ", expiration=" + expiration + "]";
    }
}
