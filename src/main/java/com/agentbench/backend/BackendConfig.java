package com.agentbench.backend;

import com.agentbench.backend.container.ContainerBackend;
import com.agentbench.backend.container.ContainerTaskClient;
import com.agentbench.backend.container.DockerContainerTaskClient;
import com.agentbench.backend.container.DockerImageBuilder;
import com.agentbench.backend.container.GatewayContainerTaskClient;
import com.agentbench.backend.container.ImageBuilder;
import com.agentbench.backend.runtime.HttpRuntimeClient;
import com.agentbench.backend.runtime.ManagedRuntimeBackend;
import com.agentbench.backend.runtime.RuntimeClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class BackendConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ImageBuilder imageBuilder(DockerClient dockerClient, BackendProperties properties) {
        return new DockerImageBuilder(dockerClient, properties.getContainer().getImageRegistry(),
                properties.getContainer().getImagePrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "agentbench.backend.container.executor", havingValue = "docker", matchIfMissing = true)
    public ContainerTaskClient dockerContainerTaskClient(DockerClient dockerClient) {
        return new DockerContainerTaskClient(dockerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "agentbench.backend.container.executor", havingValue = "gateway")
    public ContainerTaskClient gatewayContainerTaskClient(BackendProperties properties, ObjectMapper objectMapper) {
        var container = properties.getContainer();
        return new GatewayContainerTaskClient(container.getGatewayUrl(), container.getGatewayToken(), objectMapper);
    }

    @Bean
    public ExecutionBackend containerBackend(ImageBuilder imageBuilder, ContainerTaskClient taskClient,
                                             BackendProperties properties, Clock clock) {
        return new ContainerBackend(imageBuilder, taskClient, properties, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "agentbench.backend.managed-runtime.enabled", havingValue = "true", matchIfMissing = true)
    public RuntimeClient runtimeClient(BackendProperties properties, ObjectMapper objectMapper) {
        var runtime = properties.getManagedRuntime();
        return new HttpRuntimeClient(runtime.getEndpoint(), runtime.getToken(), objectMapper);
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnProperty(name = "agentbench.backend.managed-runtime.enabled", havingValue = "true", matchIfMissing = true)
    public ExecutorService runtimeInvocationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "runtime-invoke-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnProperty(name = "agentbench.backend.managed-runtime.enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionBackend managedRuntimeBackend(RuntimeClient runtimeClient, BackendProperties properties,
                                                  ExecutorService runtimeInvocationExecutor, Clock clock) {
        return new ManagedRuntimeBackend(runtimeClient,
                ManagedRuntimeBackend.Mode.fromValue(properties.getManagedRuntime().getMode()),
                runtimeInvocationExecutor, clock);
    }
}
