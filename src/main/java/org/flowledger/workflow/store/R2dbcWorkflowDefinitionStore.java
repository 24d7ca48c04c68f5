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


package org.flowledger.workflow.store;

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.model.StateDefinition;
import org.flowledger.workflow.model.TransitionDefinition;
import org.flowledger.workflow.model.WorkflowDefinition;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.flowledger.workflow.store.SqlSupport.bindNullable;
import static org.flowledger.workflow.store.SqlSupport.bindTimestamp;
import static org.flowledger.workflow.store.SqlSupport.boolValue;
import static org.flowledger.workflow.store.SqlSupport.longValue;
import static org.flowledger.workflow.store.SqlSupport.timestamp;

/**
 * {@link WorkflowDefinitionStore} backed by the {@code workflow_definitions} table.
 * States, transitions and business rules are stored as JSON text.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private static final String SELECT_COLUMNS = """
            SELECT id, name, description, category, definition_version, initial_state,
                   states, transitions, business_rules, organization_id, is_active,
                   usage_count, created_by, created_at, updated_at
            FROM workflow_definitions
            """;

    private final DatabaseClient databaseClient;
    private final JsonColumnMapper jsonMapper;

    @Override
    public Mono<WorkflowDefinition> insert(WorkflowDefinition definition) {
        GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO workflow_definitions (
                        id, name, description, category, definition_version, initial_state,
                        states, transitions, business_rules, organization_id, is_active,
                        usage_count, created_by, created_at, updated_at)
                    VALUES (
                        :id, :name, :description, :category, :version, :initialState,
                        :states, :transitions, :businessRules, :organizationId, :active,
                        :usageCount, :createdBy, :createdAt, :updatedAt)
                    """)
                .bind("id", definition.id())
                .bind("active", definition.active())
                .bind("usageCount", definition.usageCount());
        spec = bindContent(spec, definition);
        spec = bindNullable(spec, "createdBy", definition.createdBy(), String.class);
        spec = bindTimestamp(spec, "createdAt", definition.createdAt());
        spec = bindTimestamp(spec, "updatedAt", definition.updatedAt());

        return spec.fetch()
                .rowsUpdated()
                .thenReturn(definition)
                .doOnSuccess(d -> log.debug("DEFINITION_INSERTED: definitionId={}, name={}", d.id(), d.name()))
                .onErrorMap(StorageErrors.translate("definition-insert"));
    }

    @Override
    public Mono<WorkflowDefinition> update(WorkflowDefinition definition) {
        GenericExecuteSpec spec = databaseClient.sql("""
                    UPDATE workflow_definitions
                    SET name = :name, description = :description, category = :category,
                        definition_version = :version, initial_state = :initialState,
                        states = :states, transitions = :transitions,
                        business_rules = :businessRules, organization_id = :organizationId,
                        is_active = :active, updated_at = :updatedAt
                    WHERE id = :id
                    """)
                .bind("id", definition.id())
                .bind("active", definition.active());
        spec = bindContent(spec, definition);
        spec = bindTimestamp(spec, "updatedAt", definition.updatedAt());

        return spec.fetch()
                .rowsUpdated()
                .filter(count -> count > 0)
                .flatMap(count -> findById(definition.id()))
                .onErrorMap(StorageErrors.translate("definition-update"));
    }

    @Override
    public Mono<WorkflowDefinition> findById(String definitionId) {
        return databaseClient.sql(SELECT_COLUMNS + "WHERE id = :id")
                .bind("id", definitionId)
                .map(this::mapRow)
                .one()
                .onErrorMap(StorageErrors.translate("definition-find"));
    }

    @Override
    public Flux<WorkflowDefinition> findActive(String organizationId, String category) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append("WHERE is_active = TRUE AND (organization_id IS NULL");
        if (organizationId != null) {
            sql.append(" OR organization_id = :organizationId");
        }
        sql.append(")");
        if (category != null) {
            sql.append(" AND category = :category");
        }
        sql.append(" ORDER BY name, created_at");

        GenericExecuteSpec spec = databaseClient.sql(sql.toString());
        if (organizationId != null) {
            spec = spec.bind("organizationId", organizationId);
        }
        if (category != null) {
            spec = spec.bind("category", category);
        }
        return spec.map(this::mapRow)
                .all()
                .onErrorMap(StorageErrors.translate("definition-list"));
    }

    @Override
    public Mono<Boolean> setActive(String definitionId, boolean active, Instant updatedAt) {
        return databaseClient.sql("""
                    UPDATE workflow_definitions
                    SET is_active = :active, updated_at = :updatedAt
                    WHERE id = :id
                    """)
                .bind("id", definitionId)
                .bind("active", active)
                .bind("updatedAt", updatedAt.atOffset(ZoneOffset.UTC))
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0)
                .defaultIfEmpty(false)
                .onErrorMap(StorageErrors.translate("definition-set-active"));
    }

    @Override
    public Mono<Boolean> incrementUsageCount(String definitionId) {
        return databaseClient.sql("""
                    UPDATE workflow_definitions
                    SET usage_count = usage_count + 1
                    WHERE id = :id
                    """)
                .bind("id", definitionId)
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0)
                .defaultIfEmpty(false)
                .onErrorMap(StorageErrors.translate("definition-usage-count"));
    }

    private GenericExecuteSpec bindContent(GenericExecuteSpec spec, WorkflowDefinition definition) {
        List<Map<String, Object>> states = definition.states().stream().map(StateDefinition::toMap).toList();
        List<Map<String, Object>> transitions = definition.transitions().stream()
                .map(TransitionDefinition::toMap)
                .toList();
        spec = spec.bind("name", definition.name())
                .bind("version", definition.version())
                .bind("initialState", definition.initialState())
                .bind("states", jsonMapper.write(states))
                .bind("transitions", jsonMapper.write(transitions))
                .bind("businessRules", jsonMapper.write(definition.businessRules()));
        spec = bindNullable(spec, "description", definition.description(), String.class);
        spec = bindNullable(spec, "category", definition.category(), String.class);
        return bindNullable(spec, "organizationId", definition.organizationId(), String.class);
    }

    private WorkflowDefinition mapRow(Readable row) {
        List<StateDefinition> states = jsonMapper.readList(row.get("states", String.class)).stream()
                .map(StateDefinition::fromMap)
                .toList();
        List<TransitionDefinition> transitions = jsonMapper.readList(row.get("transitions", String.class)).stream()
                .map(TransitionDefinition::fromMap)
                .toList();
        Map<String, Object> rules = jsonMapper.readMap(row.get("business_rules", String.class));

        return WorkflowDefinition.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .description(row.get("description", String.class))
                .category(row.get("category", String.class))
                .version(row.get("definition_version", String.class))
                .initialState(row.get("initial_state", String.class))
                .states(states)
                .transitions(transitions)
                .businessRules(rules != null ? rules : Map.of())
                .organizationId(row.get("organization_id", String.class))
                .active(boolValue(row, "is_active"))
                .usageCount(longValue(row, "usage_count"))
                .createdBy(row.get("created_by", String.class))
                .createdAt(timestamp(row, "created_at"))
                .updatedAt(timestamp(row, "updated_at"))
                .build();
    }
}
