package com.agentbench.core.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentbench.trust")
public class TrustProperties {

    private String tokenExchangeUrl = "http://localhost:8086";
    private String tokenExchangeSecret;
    private int sessionDurationSeconds = 3600;
    private int refreshSkewSeconds = 300;
    private String sessionNamePrefix = "agent-test";

    public String getTokenExchangeUrl() { return tokenExchangeUrl; }
    public void setTokenExchangeUrl(String tokenExchangeUrl) { this.tokenExchangeUrl = tokenExchangeUrl; }
    public String getTokenExchangeSecret() { return tokenExchangeSecret; }
    public void setTokenExchangeSecret(String tokenExchangeSecret) { this.tokenExchangeSecret = tokenExchangeSecret; }
    /** Never longer than one hour. */
    public int getSessionDurationSeconds() { return Math.min(sessionDurationSeconds, 3600); }
    public void setSessionDurationSeconds(int sessionDurationSeconds) { this.sessionDurationSeconds = sessionDurationSeconds; }
    public int getRefreshSkewSeconds() { return refreshSkewSeconds; }
    public void setRefreshSkewSeconds(int refreshSkewSeconds) { this.refreshSkewSeconds = refreshSkewSeconds; }
    public String getSessionNamePrefix() { return sessionNamePrefix; }
    public void setSessionNamePrefix(String sessionNamePrefix) { this.sessionNamePrefix = sessionNamePrefix; }
}
