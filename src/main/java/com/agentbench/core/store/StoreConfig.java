package com.agentbench.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Store beans. {@code agentbench.store.type=jdbc} persists to the configured {@link DataSource};
 * the default keeps everything in memory, which is enough for development and tests but does not
 * survive a restart or coordinate more than one process.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Configuration
    @ConditionalOnProperty(name = "agentbench.store.type", havingValue = "jdbc")
    static class JdbcStores {

        JdbcStores(DataSource dataSource) throws Exception {
            log.info("Configuring JDBC stores");
            JdbcSchema.createTables(dataSource);
        }

        @Bean
        JobStore jobStore(DataSource dataSource) {
            return new JdbcJobStore(dataSource);
        }

        @Bean
        QueueStore queueStore(DataSource dataSource) {
            return new JdbcQueueStore(dataSource);
        }

        @Bean
        UserStore userStore(DataSource dataSource) {
            return new JdbcUserStore(dataSource);
        }

        @Bean
        AgentStore agentStore(DataSource dataSource) {
            return new JdbcAgentStore(dataSource);
        }

        @Bean
        DeploymentStore deploymentStore(DataSource dataSource) {
            return new JdbcDeploymentStore(dataSource);
        }

        @Bean
        AccountConnectionStore accountConnectionStore(DataSource dataSource) {
            return new JdbcAccountConnectionStore(dataSource);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "agentbench.store.type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStores {

        private final InMemoryQueueStore queueStore = new InMemoryQueueStore();
        private final InMemoryUserStore userStore = new InMemoryUserStore();

        InMemoryStores() {
            log.info("Using in-memory stores (state will not persist across restarts)");
        }

        @Bean
        JobStore jobStore() {
            return new InMemoryJobStore(queueStore, userStore);
        }

        @Bean
        QueueStore queueStore() {
            return queueStore;
        }

        @Bean
        UserStore userStore() {
            return userStore;
        }

        @Bean
        AgentStore agentStore() {
            return new InMemoryAgentStore();
        }

        @Bean
        DeploymentStore deploymentStore() {
            return new InMemoryDeploymentStore();
        }

        @Bean
        AccountConnectionStore accountConnectionStore() {
            return new InMemoryAccountConnectionStore();
        }
    }
}
