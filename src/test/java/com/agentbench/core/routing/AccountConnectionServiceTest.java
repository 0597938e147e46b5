package com.agentbench.core.routing;

import com.agentbench.core.error.CrossAccountTrustException;
import com.agentbench.core.error.ValidationException;
import com.agentbench.core.model.AwsAccountConnection;
import com.agentbench.core.model.ConnectionStatus;
import com.agentbench.core.model.Tier;
import com.agentbench.testing.SchedulerHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountConnectionServiceTest {

    private static final String ROLE = "arn:aws:iam::210987654321:role/AgentTestRunner";

    private SchedulerHarness h;
    private AccountConnectionService service;

    @BeforeEach
    void setUp() {
        h = new SchedulerHarness();
        service = new AccountConnectionService(h.connections, h.router, h.credentialCache, h.clock);
    }

    @Test
    @DisplayName("beginConnection issues one external id and keeps it on repeat calls")
    void stableExternalId() {
        AwsAccountConnection first = service.beginConnection("u1");
        AwsAccountConnection again = service.beginConnection("u1");

        assertEquals(ConnectionStatus.PENDING, first.status());
        assertTrue(first.externalId().startsWith("ab-"));
        assertEquals(first.externalId(), again.externalId());
    }

    @Test
    @DisplayName("confirmConnection with the issued id connects and parses the account")
    void confirm() {
        String externalId = service.beginConnection("u1").externalId();

        AwsAccountConnection connected = service.confirmConnection("u1", ROLE, "eu-central-1", externalId);

        assertTrue(connected.isConnected());
        assertEquals("210987654321", connected.awsAccountId());
        assertEquals("eu-central-1", connected.region());
        assertEquals(List.of(ROLE), h.assumedRoles, "trial exchange happened");
        assertNotNull(h.router.resolveCredentials("u1", Tier.PERSONAL, null).credentials());
    }

    @Test
    @DisplayName("A mismatched external id is a trust failure and nothing is connected")
    void mismatch() {
        service.beginConnection("u1");

        assertThrows(CrossAccountTrustException.class,
                () -> service.confirmConnection("u1", ROLE, "eu-central-1", "ab-forged"));
        assertEquals(ConnectionStatus.PENDING, service.find("u1").orElseThrow().status());
    }

    @Test
    @DisplayName("Malformed role ARN or missing region is rejected")
    void validation() {
        String externalId = service.beginConnection("u1").externalId();

        assertThrows(ValidationException.class,
                () -> service.confirmConnection("u1", "arn:aws:iam::12:role/x", "us-east-1", externalId));
        assertThrows(ValidationException.class,
                () -> service.confirmConnection("u1", ROLE, " ", externalId));
        assertThrows(ValidationException.class,
                () -> service.confirmConnection("u2", ROLE, "us-east-1", externalId));
    }

    @Test
    @DisplayName("disconnect drops cached credentials and a new connection gets a new id")
    void disconnect() {
        String externalId = service.beginConnection("u1").externalId();
        service.confirmConnection("u1", ROLE, "us-east-1", externalId);

        service.disconnect("u1");

        assertEquals(ConnectionStatus.DISCONNECTED, service.find("u1").orElseThrow().status());
        assertEquals(0, h.credentialCache.size());
        assertNotEquals(externalId, service.beginConnection("u1").externalId());
    }
}
