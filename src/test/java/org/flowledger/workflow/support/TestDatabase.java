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


package org.flowledger.workflow.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.flowledger.workflow.properties.WorkflowProperties;
import org.flowledger.workflow.store.JsonColumnMapper;
import org.flowledger.workflow.store.R2dbcInsightStore;
import org.flowledger.workflow.store.R2dbcWorkflowDefinitionStore;
import org.flowledger.workflow.store.R2dbcWorkflowHistoryStore;
import org.flowledger.workflow.store.R2dbcWorkflowInstanceStore;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Duration;
import java.util.UUID;

/**
 * In-memory H2 database with the workflow schema applied, plus the R2DBC stores on top of it.
 * Every instance uses its own database.
 */
public final class TestDatabase {

    public final ConnectionFactory connectionFactory;
    public final DatabaseClient databaseClient;
    public final TransactionalOperator transactionalOperator;
    public final JsonColumnMapper jsonMapper;
    public final R2dbcWorkflowDefinitionStore definitionStore;
    public final R2dbcWorkflowInstanceStore instanceStore;
    public final R2dbcWorkflowHistoryStore historyStore;
    public final R2dbcInsightStore insightStore;

    private TestDatabase() {
        String url = "r2dbc:h2:mem:///workflow-" + UUID.randomUUID()
                + "?options=DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
        this.connectionFactory = ConnectionFactories.get(url);
        this.databaseClient = DatabaseClient.create(connectionFactory);
        this.transactionalOperator = TransactionalOperator.create(new R2dbcTransactionManager(connectionFactory));
        this.jsonMapper = new JsonColumnMapper(new ObjectMapper().findAndRegisterModules());
        this.definitionStore = new R2dbcWorkflowDefinitionStore(databaseClient, jsonMapper);
        this.instanceStore = new R2dbcWorkflowInstanceStore(databaseClient, jsonMapper);
        this.historyStore = new R2dbcWorkflowHistoryStore(databaseClient, jsonMapper);
        this.insightStore = new R2dbcInsightStore(databaseClient, jsonMapper);
    }

    public static TestDatabase create() {
        TestDatabase database = new TestDatabase();
        new ResourceDatabasePopulator(new ClassPathResource("org/flowledger/workflow/schema.sql"))
                .populate(database.connectionFactory)
                .block(Duration.ofSeconds(30));
        return database;
    }

    public static WorkflowProperties properties() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.setEnabled(true);
        properties.getHistory().setRecentLimit(10);
        properties.getQuery().setDefaultLimit(50);
        properties.getQuery().setMaxLimit(200);
        return properties;
    }
}
