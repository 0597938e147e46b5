package com.agentbench.backend;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agentbench.backend")
public class BackendProperties {

    private String defaultRegion = "us-east-1";
    private Container container = new Container();
    private ManagedRuntime managedRuntime = new ManagedRuntime();

    public String getDefaultRegion() { return defaultRegion; }
    public void setDefaultRegion(String defaultRegion) { this.defaultRegion = defaultRegion; }
    public Container getContainer() { return container; }
    public void setContainer(Container container) { this.container = container; }
    public ManagedRuntime getManagedRuntime() { return managedRuntime; }
    public void setManagedRuntime(ManagedRuntime managedRuntime) { this.managedRuntime = managedRuntime; }

    public static class Container {
        /** "docker" runs tasks on the local daemon, "gateway" on a remote task executor. */
        private String executor = "docker";
        private String imageRegistry;
        private String imagePrefix = "agent-test";
        private String logGroup = "/ecs/agent-tests";
        private int cpuUnits = 1024;
        private int memoryMb = 2048;
        private String logLevel = "INFO";
        private String gatewayUrl;
        private String gatewayToken;
        private String cluster = "agent-tests";
        private List<String> subnets = new ArrayList<>();
        private List<String> securityGroups = new ArrayList<>();

        public String getExecutor() { return executor; }
        public void setExecutor(String executor) { this.executor = executor; }
        public String getImageRegistry() { return imageRegistry; }
        public void setImageRegistry(String imageRegistry) { this.imageRegistry = imageRegistry; }
        public String getImagePrefix() { return imagePrefix; }
        public void setImagePrefix(String imagePrefix) { this.imagePrefix = imagePrefix; }
        public String getLogGroup() { return logGroup; }
        public void setLogGroup(String logGroup) { this.logGroup = logGroup; }
        public int getCpuUnits() { return cpuUnits; }
        public void setCpuUnits(int cpuUnits) { this.cpuUnits = cpuUnits; }
        public int getMemoryMb() { return memoryMb; }
        public void setMemoryMb(int memoryMb) { this.memoryMb = memoryMb; }
        public String getLogLevel() { return logLevel; }
        public void setLogLevel(String logLevel) { this.logLevel = logLevel; }
        public String getGatewayUrl() { return gatewayUrl; }
        public void setGatewayUrl(String gatewayUrl) { this.gatewayUrl = gatewayUrl; }
        public String getGatewayToken() { return gatewayToken; }
        public void setGatewayToken(String gatewayToken) { this.gatewayToken = gatewayToken; }
        public String getCluster() { return cluster; }
        public void setCluster(String cluster) { this.cluster = cluster; }
        public List<String> getSubnets() { return subnets; }
        public void setSubnets(List<String> subnets) { this.subnets = subnets; }
        public List<String> getSecurityGroups() { return securityGroups; }
        public void setSecurityGroups(List<String> securityGroups) { this.securityGroups = securityGroups; }
    }

    public static class ManagedRuntime {
        private boolean enabled = true;
        private String endpoint = "http://localhost:8085";
        private String token;
        /** "sync" blocks on the invocation, "async" starts it and polls. */
        private String mode = "sync";
        private int requestTimeoutSeconds = 30;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }
}
