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
import org.flowledger.workflow.model.TriggerType;
import org.flowledger.workflow.model.WorkflowHistoryEntry;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.flowledger.workflow.store.SqlSupport.bindNullable;
import static org.flowledger.workflow.store.SqlSupport.bindTimestamp;
import static org.flowledger.workflow.store.SqlSupport.boolValue;
import static org.flowledger.workflow.store.SqlSupport.longValue;
import static org.flowledger.workflow.store.SqlSupport.timestamp;

/**
 * {@link WorkflowHistoryStore} backed by the {@code workflow_history} table.
 * <p>
 * The store only ever inserts and reads; rows are never updated. The unique
 * constraint on {@code (instance_id, sequence_number)} rejects a second writer that
 * computed the same sequence number.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcWorkflowHistoryStore implements WorkflowHistoryStore {

    private static final String SELECT_COLUMNS = """
            SELECT id, instance_id, sequence_number, from_state, to_state, action, triggered_by,
                   trigger_type, comment_text, action_metadata, context_snapshot, was_successful,
                   error_message, duration_ms, created_at
            FROM workflow_history
            """;

    private final DatabaseClient databaseClient;
    private final JsonColumnMapper jsonMapper;

    @Override
    public Mono<WorkflowHistoryEntry> append(WorkflowHistoryEntry entry) {
        return databaseClient.sql("""
                    SELECT COALESCE(MAX(sequence_number), 0) + 1 AS next_sequence
                    FROM workflow_history
                    WHERE instance_id = :instanceId
                    """)
                .bind("instanceId", entry.instanceId())
                .map(row -> longValue(row, "next_sequence"))
                .one()
                .defaultIfEmpty(1L)
                .map(entry::withSequenceNumber)
                .flatMap(this::insert)
                .doOnNext(e -> log.debug("HISTORY_APPENDED: instanceId={}, sequence={}, from={}, to={}, action={}, successful={}",
                        e.instanceId(), e.sequenceNumber(), e.fromState(), e.toState(), e.action(), e.wasSuccessful()))
                .onErrorMap(StorageErrors.translate("history-append", entry.instanceId()));
    }

    @Override
    public Flux<WorkflowHistoryEntry> findByInstanceId(String instanceId) {
        return databaseClient.sql(SELECT_COLUMNS + "WHERE instance_id = :instanceId ORDER BY sequence_number ASC")
                .bind("instanceId", instanceId)
                .map(this::mapRow)
                .all()
                .onErrorMap(StorageErrors.translate("history-find"));
    }

    @Override
    public Flux<WorkflowHistoryEntry> findRecent(String instanceId, int limit) {
        return databaseClient.sql(SELECT_COLUMNS
                        + "WHERE instance_id = :instanceId ORDER BY sequence_number DESC LIMIT :limit")
                .bind("instanceId", instanceId)
                .bind("limit", limit)
                .map(this::mapRow)
                .all()
                .onErrorMap(StorageErrors.translate("history-recent"));
    }

    @Override
    public Mono<Long> countByInstanceId(String instanceId) {
        return databaseClient.sql("SELECT COUNT(*) AS cnt FROM workflow_history WHERE instance_id = :instanceId")
                .bind("instanceId", instanceId)
                .map(row -> longValue(row, "cnt"))
                .one()
                .defaultIfEmpty(0L)
                .onErrorMap(StorageErrors.translate("history-count"));
    }

    @Override
    public Mono<Long> deleteByInstanceId(String instanceId) {
        return databaseClient.sql("DELETE FROM workflow_history WHERE instance_id = :instanceId")
                .bind("instanceId", instanceId)
                .fetch()
                .rowsUpdated()
                .onErrorMap(StorageErrors.translate("history-delete", instanceId));
    }

    private Mono<WorkflowHistoryEntry> insert(WorkflowHistoryEntry entry) {
        GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO workflow_history (
                        id, instance_id, sequence_number, from_state, to_state, action, triggered_by,
                        trigger_type, comment_text, action_metadata, context_snapshot, was_successful,
                        error_message, duration_ms, created_at)
                    VALUES (
                        :id, :instanceId, :sequence, :fromState, :toState, :action, :triggeredBy,
                        :triggerType, :comment, :actionMetadata, :contextSnapshot, :successful,
                        :errorMessage, :durationMs, :createdAt)
                    """)
                .bind("id", entry.id())
                .bind("instanceId", entry.instanceId())
                .bind("sequence", entry.sequenceNumber())
                .bind("toState", entry.toState())
                .bind("action", entry.action())
                .bind("triggerType", entry.triggerType().value())
                .bind("successful", entry.wasSuccessful());
        spec = bindNullable(spec, "fromState", entry.fromState(), String.class);
        spec = bindNullable(spec, "triggeredBy", entry.triggeredBy(), String.class);
        spec = bindNullable(spec, "comment", entry.comment(), String.class);
        spec = bindNullable(spec, "actionMetadata", jsonMapper.write(entry.actionMetadata()), String.class);
        spec = bindNullable(spec, "contextSnapshot", jsonMapper.write(entry.contextSnapshot()), String.class);
        spec = bindNullable(spec, "errorMessage", entry.errorMessage(), String.class);
        spec = bindNullable(spec, "durationMs", entry.durationMs(), Long.class);
        spec = bindTimestamp(spec, "createdAt", entry.createdAt());
        return spec.fetch().rowsUpdated().thenReturn(entry);
    }

    private WorkflowHistoryEntry mapRow(Readable row) {
        Number duration = (Number) row.get("duration_ms");
        return new WorkflowHistoryEntry(
                row.get("id", String.class),
                row.get("instance_id", String.class),
                longValue(row, "sequence_number"),
                row.get("from_state", String.class),
                row.get("to_state", String.class),
                row.get("action", String.class),
                row.get("triggered_by", String.class),
                TriggerType.fromValue(row.get("trigger_type", String.class)),
                row.get("comment_text", String.class),
                jsonMapper.readMap(row.get("action_metadata", String.class)),
                jsonMapper.readMap(row.get("context_snapshot", String.class)),
                boolValue(row, "was_successful"),
                row.get("error_message", String.class),
                duration != null ? duration.longValue() : null,
                timestamp(row, "created_at"));
    }
}
