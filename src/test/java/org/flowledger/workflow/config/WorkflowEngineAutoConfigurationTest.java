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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.flowledger.workflow.core.WorkflowEngine;
import org.flowledger.workflow.definition.WorkflowDefinitionService;
import org.flowledger.workflow.health.WorkflowEngineHealthIndicator;
import org.flowledger.workflow.insight.InsightService;
import org.flowledger.workflow.metrics.WorkflowMetrics;
import org.flowledger.workflow.properties.WorkflowProperties;
import org.flowledger.workflow.store.CachingWorkflowDefinitionStore;
import org.flowledger.workflow.store.R2dbcWorkflowDefinitionStore;
import org.flowledger.workflow.store.WorkflowDefinitionStore;
import org.flowledger.workflow.store.WorkflowInstanceStore;
import org.flowledger.workflow.validation.TransitionValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.ReactiveTransactionManager;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WorkflowEngineAutoConfiguration.class))
            .withUserConfiguration(R2dbcConfiguration.class);

    @Test
    @DisplayName("should create the engine, services and stores")
    void shouldCreateBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(WorkflowEngine.class);
            assertThat(context).hasSingleBean(WorkflowDefinitionService.class);
            assertThat(context).hasSingleBean(InsightService.class);
            assertThat(context).hasSingleBean(TransitionValidator.class);
            assertThat(context).hasSingleBean(WorkflowInstanceStore.class);
            assertThat(context).hasSingleBean(WorkflowEngineHealthIndicator.class);
            assertThat(context).hasSingleBean(WorkflowProperties.class);
        });
    }

    @Test
    @DisplayName("should cache definitions by default")
    void shouldCacheDefinitionsByDefault() {
        contextRunner.run(context ->
                assertThat(context.getBean(WorkflowDefinitionStore.class))
                        .isInstanceOf(CachingWorkflowDefinitionStore.class));
    }

    @Test
    @DisplayName("should use the plain store when the cache is disabled")
    void shouldSkipCacheWhenDisabled() {
        contextRunner
                .withPropertyValues("flowledger.workflow.definition-cache.enabled=false")
                .run(context ->
                        assertThat(context.getBean(WorkflowDefinitionStore.class))
                                .isInstanceOf(R2dbcWorkflowDefinitionStore.class));
    }

    @Test
    @DisplayName("should bind properties")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "flowledger.workflow.history.recent-limit=25",
                        "flowledger.workflow.history.record-rejected-attempts=true",
                        "flowledger.workflow.definition-cache.ttl=30s",
                        "flowledger.workflow.condition-cache.max-size=50")
                .run(context -> {
                    WorkflowProperties properties = context.getBean(WorkflowProperties.class);
                    assertThat(properties.getConditionCache().getMaxSize()).isEqualTo(50);
                    assertThat(properties.getHistory().getRecentLimit()).isEqualTo(25);
                    assertThat(properties.getHistory().isRecordRejectedAttempts()).isTrue();
                    assertThat(properties.getDefinitionCache().getTtl()).isEqualTo(Duration.ofSeconds(30));
                });
    }

    @Test
    @DisplayName("should back off entirely when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("flowledger.workflow.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(WorkflowEngine.class);
                    assertThat(context).doesNotHaveBean(WorkflowDefinitionStore.class);
                });
    }

    @Test
    @DisplayName("should create metrics only when a meter registry is present")
    void shouldCreateMetricsWithRegistry() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(WorkflowMetrics.class));

        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context).hasSingleBean(WorkflowMetrics.class));

        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("flowledger.workflow.metrics-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(WorkflowMetrics.class));
    }

    @Test
    @DisplayName("should apply the bundled schema when asked to")
    void shouldInitializeSchema() {
        contextRunner
                .withPropertyValues("flowledger.workflow.schema.initialize=true")
                .run(context -> {
                    assertThat(context).hasBean("workflowSchemaInitializer");
                    Long count = context.getBean(DatabaseClient.class)
                            .sql("SELECT COUNT(*) AS cnt FROM workflow_instances")
                            .map(row -> row.get("cnt", Long.class))
                            .one()
                            .block(Duration.ofSeconds(10));
                    assertThat(count).isZero();
                });
    }

    @Test
    @DisplayName("should not initialize the schema by default")
    void shouldNotInitializeSchemaByDefault() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean("workflowSchemaInitializer"));
    }

    @Configuration(proxyBeanMethods = false)
    static class R2dbcConfiguration {

        @Bean
        ConnectionFactory connectionFactory() {
            return ConnectionFactories.get("r2dbc:h2:mem:///autoconfig-" + UUID.randomUUID()
                    + "?options=DB_CLOSE_DELAY=-1");
        }

        @Bean
        DatabaseClient databaseClient(ConnectionFactory connectionFactory) {
            return DatabaseClient.create(connectionFactory);
        }

        @Bean
        ReactiveTransactionManager transactionManager(ConnectionFactory connectionFactory) {
            return new R2dbcTransactionManager(connectionFactory);
        }
    }
}
