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
import org.flowledger.workflow.exception.ConcurrentInstanceModificationException;
import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.InstanceSummary;
import org.flowledger.workflow.model.Priority;
import org.flowledger.workflow.model.WorkflowInstance;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

import static org.flowledger.workflow.store.SqlSupport.bindNullable;
import static org.flowledger.workflow.store.SqlSupport.bindTimestamp;
import static org.flowledger.workflow.store.SqlSupport.intValue;
import static org.flowledger.workflow.store.SqlSupport.longValue;
import static org.flowledger.workflow.store.SqlSupport.timestamp;

/**
 * {@link WorkflowInstanceStore} backed by the {@code workflow_instances} table.
 * <p>
 * Writes are guarded by {@code row_version}: an update only applies when the stored
 * version equals the one the instance was read at, and increments it.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcWorkflowInstanceStore implements WorkflowInstanceStore {

    private static final String SELECT_COLUMNS = """
            SELECT id, definition_id, entity_id, entity_type, organization_id, title, description,
                   current_state, previous_state, status, context_data, progress_percentage,
                   priority, assigned_to, assigned_group, due_date, started_at, completed_at,
                   error_count, last_error, created_by, created_at, updated_at, row_version
            FROM workflow_instances
            """;

    private final DatabaseClient databaseClient;
    private final JsonColumnMapper jsonMapper;

    @Override
    public Mono<WorkflowInstance> insert(WorkflowInstance instance) {
        GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO workflow_instances (
                        id, definition_id, entity_id, entity_type, organization_id, title, description,
                        current_state, previous_state, status, context_data, progress_percentage,
                        priority, assigned_to, assigned_group, due_date, started_at, completed_at,
                        error_count, last_error, created_by, created_at, updated_at, row_version)
                    VALUES (
                        :id, :definitionId, :entityId, :entityType, :organizationId, :title, :description,
                        :currentState, :previousState, :status, :contextData, :progress,
                        :priority, :assignedTo, :assignedGroup, :dueDate, :startedAt, :completedAt,
                        :errorCount, :lastError, :createdBy, :createdAt, :updatedAt, :version)
                    """)
                .bind("id", instance.id())
                .bind("definitionId", instance.definitionId())
                .bind("entityId", instance.entityId())
                .bind("organizationId", instance.organizationId())
                .bind("version", instance.version());
        spec = bindNullable(spec, "entityType", instance.entityType(), String.class);
        spec = bindNullable(spec, "description", instance.description(), String.class);
        spec = bindNullable(spec, "createdBy", instance.createdBy(), String.class);
        spec = bindTimestamp(spec, "startedAt", instance.startedAt());
        spec = bindTimestamp(spec, "createdAt", instance.createdAt());
        spec = bindMutableFields(spec, instance);

        return spec.fetch()
                .rowsUpdated()
                .thenReturn(instance)
                .onErrorMap(StorageErrors.translate("instance-insert", instance.id()));
    }

    @Override
    public Mono<WorkflowInstance> findById(String instanceId, String organizationId) {
        return select(instanceId, organizationId, false)
                .onErrorMap(StorageErrors.translate("instance-find", instanceId));
    }

    @Override
    public Mono<WorkflowInstance> findByIdForUpdate(String instanceId, String organizationId) {
        return select(instanceId, organizationId, true)
                .doOnNext(i -> log.debug("INSTANCE_LOCKED: instanceId={}, version={}", i.id(), i.version()))
                .onErrorMap(StorageErrors.translate("instance-lock", instanceId));
    }

    @Override
    public Mono<WorkflowInstance> update(WorkflowInstance instance) {
        GenericExecuteSpec spec = databaseClient.sql("""
                    UPDATE workflow_instances
                    SET title = :title, current_state = :currentState, previous_state = :previousState,
                        status = :status, context_data = :contextData, progress_percentage = :progress,
                        priority = :priority, assigned_to = :assignedTo, assigned_group = :assignedGroup,
                        due_date = :dueDate, completed_at = :completedAt, error_count = :errorCount,
                        last_error = :lastError, updated_at = :updatedAt,
                        row_version = row_version + 1
                    WHERE id = :id AND row_version = :expectedVersion
                    """)
                .bind("id", instance.id())
                .bind("expectedVersion", instance.version());
        spec = bindMutableFields(spec, instance);

        return spec.fetch()
                .rowsUpdated()
                .defaultIfEmpty(0L)
                .flatMap(count -> {
                    if (count == 0) {
                        log.warn("INSTANCE_VERSION_CONFLICT: instanceId={}, expectedVersion={}",
                                instance.id(), instance.version());
                        return Mono.error(new ConcurrentInstanceModificationException(instance.id()));
                    }
                    return Mono.just(instance.toBuilder().version(instance.version() + 1).build());
                })
                .onErrorMap(StorageErrors.translate("instance-update", instance.id()));
    }

    @Override
    public Flux<InstanceSummary> findByAssignee(String assignedTo, String organizationId, InstanceStatus status,
                                                int limit, int offset, Instant now) {
        String sql = """
                SELECT i.id, i.definition_id, d.name AS definition_name, i.entity_id, i.entity_type,
                       i.title, i.current_state, i.status, i.progress_percentage, i.priority,
                       i.assigned_to, i.due_date, i.created_at, i.updated_at
                FROM workflow_instances i
                JOIN workflow_definitions d ON d.id = i.definition_id
                WHERE i.assigned_to = :assignedTo AND i.organization_id = :organizationId
                """
                + (status != null ? "  AND i.status = :status\n" : "")
                + "ORDER BY i.created_at DESC, i.id\nLIMIT :limit OFFSET :offset";

        GenericExecuteSpec spec = databaseClient.sql(sql)
                .bind("assignedTo", assignedTo)
                .bind("organizationId", organizationId)
                .bind("limit", limit)
                .bind("offset", offset);
        if (status != null) {
            spec = spec.bind("status", status.value());
        }
        return spec.map(row -> mapSummary(row, now))
                .all()
                .onErrorMap(StorageErrors.translate("instance-list"));
    }

    @Override
    public Flux<WorkflowInstance> findOverdue(String organizationId, Instant now) {
        return databaseClient.sql(SELECT_COLUMNS + """
                    WHERE organization_id = :organizationId
                      AND status = :status
                      AND due_date IS NOT NULL
                      AND due_date < :now
                    ORDER BY due_date
                    """)
                .bind("organizationId", organizationId)
                .bind("status", InstanceStatus.ACTIVE.value())
                .bind("now", now.atOffset(ZoneOffset.UTC))
                .map(this::mapRow)
                .all()
                .onErrorMap(StorageErrors.translate("instance-overdue"));
    }

    @Override
    public Mono<Map<InstanceStatus, Long>> countByStatus(String organizationId) {
        return databaseClient.sql("""
                    SELECT status, COUNT(*) AS cnt FROM workflow_instances
                    WHERE organization_id = :organizationId
                    GROUP BY status
                    """)
                .bind("organizationId", organizationId)
                .map(row -> Map.entry(InstanceStatus.fromValue(row.get("status", String.class)), longValue(row, "cnt")))
                .all()
                .collect(() -> new EnumMap<InstanceStatus, Long>(InstanceStatus.class),
                        (counts, entry) -> counts.merge(entry.getKey(), entry.getValue(), Long::sum))
                .<Map<InstanceStatus, Long>>map(counts -> counts)
                .onErrorMap(StorageErrors.translate("instance-count"));
    }

    @Override
    public Mono<Boolean> delete(String instanceId, String organizationId) {
        return databaseClient.sql("""
                    DELETE FROM workflow_instances
                    WHERE id = :id AND organization_id = :organizationId
                    """)
                .bind("id", instanceId)
                .bind("organizationId", organizationId)
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0)
                .defaultIfEmpty(false)
                .onErrorMap(StorageErrors.translate("instance-delete", instanceId));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT COUNT(*) AS cnt FROM workflow_instances WHERE 1 = 0")
                .map(row -> true)
                .one()
                .defaultIfEmpty(true)
                .onErrorResume(e -> {
                    log.warn("Instance store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<WorkflowInstance> select(String instanceId, String organizationId, boolean forUpdate) {
        String sql = SELECT_COLUMNS + "WHERE id = :id"
                + (organizationId != null ? " AND organization_id = :organizationId" : "")
                + (forUpdate ? " FOR UPDATE" : "");
        GenericExecuteSpec spec = databaseClient.sql(sql).bind("id", instanceId);
        if (organizationId != null) {
            spec = spec.bind("organizationId", organizationId);
        }
        return spec.map(this::mapRow).one();
    }

    private GenericExecuteSpec bindMutableFields(GenericExecuteSpec spec, WorkflowInstance instance) {
        spec = spec.bind("currentState", instance.currentState())
                .bind("status", instance.status().value())
                .bind("contextData", jsonMapper.write(instance.contextData()))
                .bind("progress", instance.progressPercentage())
                .bind("priority", instance.priority().value())
                .bind("errorCount", instance.errorCount());
        spec = bindNullable(spec, "title", instance.title(), String.class);
        spec = bindNullable(spec, "previousState", instance.previousState(), String.class);
        spec = bindNullable(spec, "assignedTo", instance.assignedTo(), String.class);
        spec = bindNullable(spec, "assignedGroup", instance.assignedGroup(), String.class);
        spec = bindNullable(spec, "lastError", instance.lastError(), String.class);
        spec = bindTimestamp(spec, "dueDate", instance.dueDate());
        spec = bindTimestamp(spec, "completedAt", instance.completedAt());
        return bindTimestamp(spec, "updatedAt", instance.updatedAt());
    }

    private WorkflowInstance mapRow(Readable row) {
        return WorkflowInstance.builder()
                .id(row.get("id", String.class))
                .definitionId(row.get("definition_id", String.class))
                .entityId(row.get("entity_id", String.class))
                .entityType(row.get("entity_type", String.class))
                .organizationId(row.get("organization_id", String.class))
                .title(row.get("title", String.class))
                .description(row.get("description", String.class))
                .currentState(row.get("current_state", String.class))
                .previousState(row.get("previous_state", String.class))
                .status(InstanceStatus.fromValue(row.get("status", String.class)))
                .contextData(jsonMapper.readMap(row.get("context_data", String.class)))
                .progressPercentage(intValue(row, "progress_percentage"))
                .priority(Priority.fromValue(row.get("priority", String.class)))
                .assignedTo(row.get("assigned_to", String.class))
                .assignedGroup(row.get("assigned_group", String.class))
                .dueDate(timestamp(row, "due_date"))
                .startedAt(timestamp(row, "started_at"))
                .completedAt(timestamp(row, "completed_at"))
                .errorCount(intValue(row, "error_count"))
                .lastError(row.get("last_error", String.class))
                .createdBy(row.get("created_by", String.class))
                .createdAt(timestamp(row, "created_at"))
                .updatedAt(timestamp(row, "updated_at"))
                .version(longValue(row, "row_version"))
                .build();
    }

    private InstanceSummary mapSummary(Readable row, Instant now) {
        InstanceStatus status = InstanceStatus.fromValue(row.get("status", String.class));
        Instant dueDate = timestamp(row, "due_date");
        return new InstanceSummary(
                row.get("id", String.class),
                row.get("definition_id", String.class),
                row.get("definition_name", String.class),
                row.get("entity_id", String.class),
                row.get("entity_type", String.class),
                row.get("title", String.class),
                row.get("current_state", String.class),
                status,
                intValue(row, "progress_percentage"),
                Priority.fromValue(row.get("priority", String.class)),
                row.get("assigned_to", String.class),
                dueDate,
                dueDate != null && dueDate.isBefore(now) && status != InstanceStatus.COMPLETED,
                timestamp(row, "created_at"),
                timestamp(row, "updated_at"));
    }
}
