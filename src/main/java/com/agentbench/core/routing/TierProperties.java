package com.agentbench.core.routing;

import com.agentbench.core.model.Tier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-tier usage policy. A negative monthly cap means unlimited.
 */
@Component
@ConfigurationProperties(prefix = "agentbench.tiers")
public class TierProperties {

    private Policy freemium = new Policy(10, false, 1);
    private Policy personal = new Policy(100, false, 5);
    private Policy enterprise = new Policy(-1, false, 20);

    public Policy policyFor(Tier tier) {
        return switch (tier) {
            case FREEMIUM -> freemium;
            case PERSONAL -> personal;
            case ENTERPRISE -> enterprise;
        };
    }

    public Policy getFreemium() { return freemium; }
    public void setFreemium(Policy freemium) { this.freemium = freemium; }
    public Policy getPersonal() { return personal; }
    public void setPersonal(Policy personal) { this.personal = personal; }
    public Policy getEnterprise() { return enterprise; }
    public void setEnterprise(Policy enterprise) { this.enterprise = enterprise; }

    public static class Policy {
        private int monthlyCap;
        /** When true the cap is informational and submissions past it are still accepted. */
        private boolean allowOverage;
        private int maxConcurrentTests;

        public Policy() {}

        public Policy(int monthlyCap, boolean allowOverage, int maxConcurrentTests) {
            this.monthlyCap = monthlyCap;
            this.allowOverage = allowOverage;
            this.maxConcurrentTests = maxConcurrentTests;
        }

        /** Cap to enforce at submission, or -1 when nothing is enforced. */
        public int enforcedCap() {
            return allowOverage ? -1 : monthlyCap;
        }

        public int getMonthlyCap() { return monthlyCap; }
        public void setMonthlyCap(int monthlyCap) { this.monthlyCap = monthlyCap; }
        public boolean isAllowOverage() { return allowOverage; }
        public void setAllowOverage(boolean allowOverage) { this.allowOverage = allowOverage; }
        public int getMaxConcurrentTests() { return maxConcurrentTests; }
        public void setMaxConcurrentTests(int maxConcurrentTests) { this.maxConcurrentTests = maxConcurrentTests; }
    }
}
