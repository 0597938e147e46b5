package com.agentbench.core.routing;

import com.agentbench.core.error.CrossAccountTrustException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.AwsAccountConnection;
import com.agentbench.core.model.ConnectionStatus;
import com.agentbench.core.store.AccountConnectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lifecycle of a user's cross-account trust record.
 * <p>
 * The external id is generated here and shown to the user, who puts it in the role's trust
 * policy. It never changes afterwards, and confirmation must present it exactly.
 */
@Service
public class AccountConnectionService {

    private static final Logger log = LoggerFactory.getLogger(AccountConnectionService.class);

    private static final Pattern ROLE_ARN = Pattern.compile("^arn:aws[a-z-]*:iam::(\\d{12}):role/[\\w+=,.@/-]+$");

    private final AccountConnectionStore store;
    private final DeploymentRouter router;
    private final CredentialCache credentialCache;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public AccountConnectionService(AccountConnectionStore store, DeploymentRouter router,
                                    CredentialCache credentialCache, Clock clock) {
        this.store = store;
        this.router = router;
        this.credentialCache = credentialCache;
        this.clock = clock;
    }

    /**
     * Starts (or resumes) a connection and returns the record holding the external id.
     */
    public AwsAccountConnection beginConnection(String userId) {
        Optional<AwsAccountConnection> existing = store.findByUserId(userId);
        if (existing.isPresent() && existing.get().status() != ConnectionStatus.DISCONNECTED) {
            return existing.get();
        }
        var connection = new AwsAccountConnection(userId, null, null, newExternalId(), null,
                ConnectionStatus.PENDING, clock.instant(), null);
        log.info("Generated external id for user {}", userId);
        return store.save(connection);
    }

    /**
     * Confirms the connection after the user created the role. The presented external id must
     * match the stored one, and a trial exchange must succeed.
     */
    public AwsAccountConnection confirmConnection(String userId, String roleArn, String region, String externalId) {
        var matcher = roleArn == null ? null : ROLE_ARN.matcher(roleArn);
        if (matcher == null || !matcher.matches()) {
            throw new ValidationException("Invalid role ARN: " + roleArn);
        }
        if (region == null || region.isBlank()) {
            throw new ValidationException("Region is required");
        }
        AwsAccountConnection pending = store.findByUserId(userId)
                .filter(c -> c.status() != ConnectionStatus.DISCONNECTED)
                .orElseThrow(() -> new ValidationException("No connection in progress for user " + userId));
        if (!constantTimeEquals(pending.externalId(), externalId)) {
            log.warn("External id mismatch while confirming connection for user {}", userId);
            throw new CrossAccountTrustException("External id does not match the one issued for this account");
        }

        AwsAccountConnection candidate = pending.connect(matcher.group(1), roleArn, region, clock.instant());
        router.exchange(candidate);
        credentialCache.invalidate(userId);
        log.info("Connected account {} for user {}", candidate.awsAccountId(), userId);
        return store.save(candidate);
    }

    public void disconnect(String userId) {
        store.findByUserId(userId).ifPresent(connection -> {
            store.save(connection.disconnect());
            log.info("Disconnected account {} for user {}", connection.awsAccountId(), userId);
        });
        credentialCache.invalidate(userId);
    }

    public Optional<AwsAccountConnection> find(String userId) {
        return store.findByUserId(userId);
    }

    private String newExternalId() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return "ab-" + HexFormat.of().formatHex(bytes);
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
