/*
 * Copyright 2026 The FlowLedger Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.flowledger.workflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.condition.ConditionParser;
import org.flowledger.workflow.core.WorkflowEngine;
import org.flowledger.workflow.definition.WorkflowDefinitionService;
import org.flowledger.workflow.health.WorkflowEngineHealthIndicator;
import org.flowledger.workflow.insight.InsightService;
import org.flowledger.workflow.metrics.WorkflowMetrics;
import org.flowledger.workflow.properties.WorkflowProperties;
import org.flowledger.workflow.store.CachingWorkflowDefinitionStore;
import org.flowledger.workflow.store.InsightStore;
import org.flowledger.workflow.store.JsonColumnMapper;
import org.flowledger.workflow.store.R2dbcInsightStore;
import org.flowledger.workflow.store.R2dbcWorkflowDefinitionStore;
import org.flowledger.workflow.store.R2dbcWorkflowHistoryStore;
import org.flowledger.workflow.store.R2dbcWorkflowInstanceStore;
import org.flowledger.workflow.store.WorkflowDefinitionStore;
import org.flowledger.workflow.store.WorkflowHistoryStore;
import org.flowledger.workflow.store.WorkflowInstanceStore;
import org.flowledger.workflow.validation.DefinitionValidator;
import org.flowledger.workflow.validation.TransitionValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;

/**
 * Auto-configuration for the FlowLedger workflow engine.
 * <p>
 * This configuration provides all necessary beans for running workflow instances:
 * <ul>
 *   <li>R2DBC-backed definition, instance, history and insight stores</li>
 *   <li>Caffeine definition cache (optional)</li>
 *   <li>TransitionValidator and DefinitionValidator</li>
 *   <li>WorkflowEngine - main facade</li>
 *   <li>WorkflowDefinitionService and InsightService</li>
 *   <li>WorkflowMetrics - Micrometer metrics</li>
 *   <li>WorkflowEngineHealthIndicator - health monitoring</li>
 * </ul>
 * <p>
 * Requires a {@link DatabaseClient} and a {@link ReactiveTransactionManager}, normally
 * provided by Spring Boot's R2DBC auto-configuration.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(WorkflowProperties.class)
@ConditionalOnClass(DatabaseClient.class)
@ConditionalOnProperty(prefix = "flowledger.workflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowEngineAutoConfiguration {

    // ==================== Storage ====================

    @Bean
    @ConditionalOnMissingBean
    public JsonColumnMapper workflowJsonColumnMapper(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable(() -> new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        log.info("Creating JsonColumnMapper");
        return new JsonColumnMapper(mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public WorkflowDefinitionStore workflowDefinitionStore(
            DatabaseClient databaseClient,
            JsonColumnMapper jsonColumnMapper,
            WorkflowProperties properties,
            ObjectProvider<MeterRegistry> meterRegistry) {
        WorkflowDefinitionStore store = new R2dbcWorkflowDefinitionStore(databaseClient, jsonColumnMapper);
        WorkflowProperties.DefinitionCacheConfig cache = properties.getDefinitionCache();
        if (!cache.isEnabled()) {
            log.info("Creating R2dbcWorkflowDefinitionStore without cache");
            return store;
        }
        log.info("Creating R2dbcWorkflowDefinitionStore with cache TTL: {}, max size: {}",
                cache.getTtl(), cache.getMaxSize());
        return new CachingWorkflowDefinitionStore(store, cache.getTtl(), cache.getMaxSize(),
                meterRegistry.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public WorkflowInstanceStore workflowInstanceStore(DatabaseClient databaseClient,
                                                       JsonColumnMapper jsonColumnMapper) {
        log.info("Creating R2dbcWorkflowInstanceStore");
        return new R2dbcWorkflowInstanceStore(databaseClient, jsonColumnMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public WorkflowHistoryStore workflowHistoryStore(DatabaseClient databaseClient,
                                                     JsonColumnMapper jsonColumnMapper) {
        log.info("Creating R2dbcWorkflowHistoryStore");
        return new R2dbcWorkflowHistoryStore(databaseClient, jsonColumnMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public InsightStore workflowInsightStore(DatabaseClient databaseClient, JsonColumnMapper jsonColumnMapper) {
        log.info("Creating R2dbcInsightStore");
        return new R2dbcInsightStore(databaseClient, jsonColumnMapper);
    }

    @Bean
    @ConditionalOnMissingBean(name = "workflowTransactionalOperator")
    @ConditionalOnBean(ReactiveTransactionManager.class)
    public TransactionalOperator workflowTransactionalOperator(ReactiveTransactionManager transactionManager) {
        log.info("Creating workflow TransactionalOperator");
        return TransactionalOperator.create(transactionManager);
    }

    // ==================== Validation ====================

    @Bean
    @ConditionalOnMissingBean
    public ConditionParser workflowConditionParser(WorkflowProperties properties) {
        return new ConditionParser(properties.getConditionCache().getMaxSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionValidator transitionValidator(ConditionParser conditionParser) {
        log.info("Creating TransitionValidator");
        return new TransitionValidator(conditionParser);
    }

    @Bean
    @ConditionalOnMissingBean
    public DefinitionValidator definitionValidator(ConditionParser conditionParser) {
        return new DefinitionValidator(conditionParser);
    }

    // ==================== Metrics ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "flowledger.workflow", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        log.info("Creating WorkflowMetrics");
        return new WorkflowMetrics(meterRegistry);
    }

    // ==================== Services ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({WorkflowInstanceStore.class, ReactiveTransactionManager.class})
    public WorkflowEngine workflowEngine(
            WorkflowDefinitionStore definitionStore,
            WorkflowInstanceStore instanceStore,
            WorkflowHistoryStore historyStore,
            InsightStore insightStore,
            TransitionValidator transitionValidator,
            @Qualifier("workflowTransactionalOperator") TransactionalOperator transactionalOperator,
            WorkflowProperties properties,
            @Nullable WorkflowMetrics workflowMetrics) {
        log.info("Creating WorkflowEngine with metrics: {}, recent history: {}, record rejected attempts: {}",
                workflowMetrics != null,
                properties.getHistory().getRecentLimit(),
                properties.getHistory().isRecordRejectedAttempts());
        return new WorkflowEngine(definitionStore, instanceStore, historyStore, insightStore,
                transitionValidator, transactionalOperator, properties, workflowMetrics, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WorkflowDefinitionStore.class)
    public WorkflowDefinitionService workflowDefinitionService(WorkflowDefinitionStore definitionStore,
                                                               DefinitionValidator definitionValidator) {
        log.info("Creating WorkflowDefinitionService");
        return new WorkflowDefinitionService(definitionStore, definitionValidator);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({WorkflowInstanceStore.class, InsightStore.class})
    public InsightService insightService(WorkflowInstanceStore instanceStore, InsightStore insightStore,
                                         @Nullable WorkflowMetrics workflowMetrics) {
        log.info("Creating InsightService");
        return new InsightService(instanceStore, insightStore, workflowMetrics, Clock.systemUTC());
    }

    // ==================== Schema ====================

    /**
     * Runs the bundled schema script on startup when enabled.
     */
    @Bean
    @ConditionalOnMissingBean(name = "workflowSchemaInitializer")
    @ConditionalOnBean(ConnectionFactory.class)
    @ConditionalOnProperty(prefix = "flowledger.workflow.schema", name = "initialize", havingValue = "true")
    public ConnectionFactoryInitializer workflowSchemaInitializer(ConnectionFactory connectionFactory,
                                                                  WorkflowProperties properties) {
        String location = properties.getSchema().getLocation();
        log.info("Creating workflow schema initializer with script: {}", location);
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(
                new DefaultResourceLoader().getResource(location)));
        return initializer;
    }

    // ==================== Health ====================

    /**
     * Health indicator for workflow engine monitoring.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(DatabaseClient.class)
        @ConditionalOnProperty(prefix = "flowledger.workflow", name = "health-enabled", havingValue = "true", matchIfMissing = true)
        public WorkflowEngineHealthIndicator workflowEngineHealthIndicator(
                WorkflowInstanceStore instanceStore,
                WorkflowDefinitionStore definitionStore) {
            log.info("Creating WorkflowEngineHealthIndicator");
            return new WorkflowEngineHealthIndicator(instanceStore, definitionStore);
        }
    }
}
