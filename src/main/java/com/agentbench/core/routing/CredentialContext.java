package com.agentbench.core.routing;

/**
 * Which account a job runs in and with which credentials.
 *
 * @param owner       platform-owned or the user's own account
 * @param region      region to run in
 * @param roleArn     assumed role, null for platform credentials
 * @param credentials short-lived credentials, null for platform credentials
 */
public record CredentialContext(Owner owner, String region, String roleArn, AssumedCredentials credentials) {

    public enum Owner {
        PLATFORM,
        USER_ACCOUNT
    }

    public static CredentialContext platform(String region) {
        return new CredentialContext(Owner.PLATFORM, region, null, null);
    }

    public static CredentialContext userAccount(String region, String roleArn, AssumedCredentials credentials) {
        return new CredentialContext(Owner.USER_ACCOUNT, region, roleArn, credentials);
    }

    public boolean isPlatform() {
        return owner == Owner.PLATFORM;
    }
}
