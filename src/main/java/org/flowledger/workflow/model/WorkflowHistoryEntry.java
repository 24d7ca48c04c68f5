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


package org.flowledger.workflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit record of one applied, or rejected, transition.
 * <p>
 * {@code sequenceNumber} is assigned by the history store when the entry is appended
 * and orders the entries of one instance in commit order.
 *
 * @param id unique identifier
 * @param instanceId owning instance
 * @param sequenceNumber position within the instance's trail, starting at 1
 * @param fromState state before the transition, null for the creation entry
 * @param toState state after the transition
 * @param action action name, {@code create} for the creation entry
 * @param triggeredBy caller identifier
 * @param triggerType how the transition was triggered
 * @param comment optional caller comment
 * @param actionMetadata transition configuration and caller data
 * @param contextSnapshot copy of the context at transition time
 * @param wasSuccessful false for rejected attempts
 * @param errorMessage rejection reason when unsuccessful
 * @param durationMs time spent applying the transition
 * @param createdAt insertion time
 */
public record WorkflowHistoryEntry(
        String id,
        String instanceId,
        long sequenceNumber,
        String fromState,
        String toState,
        String action,
        String triggeredBy,
        TriggerType triggerType,
        String comment,
        Map<String, Object> actionMetadata,
        Map<String, Object> contextSnapshot,
        boolean wasSuccessful,
        String errorMessage,
        Long durationMs,
        Instant createdAt
) {

    public static final String CREATE_ACTION = "create";

    public WorkflowHistoryEntry {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        Objects.requireNonNull(toState, "toState cannot be null");
        if (triggerType == null) {
            triggerType = TriggerType.MANUAL;
        }
        actionMetadata = copy(actionMetadata);
        contextSnapshot = copy(contextSnapshot);
    }

    /**
     * Creates the first entry of a new instance.
     */
    public static WorkflowHistoryEntry creation(WorkflowInstance instance, String createdBy, Instant now) {
        return new WorkflowHistoryEntry(
                UUID.randomUUID().toString(), instance.id(), 0,
                null, instance.currentState(), CREATE_ACTION,
                createdBy, TriggerType.MANUAL, "Workflow instance created",
                null, instance.contextData(), true, null, null, now);
    }

    /**
     * Creates the entry for an applied transition.
     */
    public static WorkflowHistoryEntry transition(WorkflowInstance before, WorkflowInstance after,
                                                  String action, String userId, TriggerType triggerType,
                                                  String comment, Map<String, Object> actionMetadata,
                                                  long durationMs, Instant now) {
        return new WorkflowHistoryEntry(
                UUID.randomUUID().toString(), after.id(), 0,
                before.currentState(), after.currentState(), action,
                userId, triggerType, comment,
                actionMetadata, after.contextData(), true, null, durationMs, now);
    }

    /**
     * Creates the entry recording an attempt that was rejected after the instance was
     * locked. The instance did not move, so {@code fromState} and {@code toState} are
     * both its current state.
     */
    public static WorkflowHistoryEntry rejected(WorkflowInstance instance, String action, String userId,
                                                TriggerType triggerType, String comment,
                                                Map<String, Object> data, String errorMessage, Instant now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("data", data != null ? data : Map.of());
        return new WorkflowHistoryEntry(
                UUID.randomUUID().toString(), instance.id(), 0,
                instance.currentState(), instance.currentState(), action,
                userId, triggerType, comment,
                metadata, instance.contextData(), false, errorMessage, null, now);
    }

    /**
     * Creates a copy carrying the sequence number assigned by the store.
     */
    public WorkflowHistoryEntry withSequenceNumber(long sequence) {
        return new WorkflowHistoryEntry(
                id, instanceId, sequence, fromState, toState, action,
                triggeredBy, triggerType, comment, actionMetadata, contextSnapshot,
                wasSuccessful, errorMessage, durationMs, createdAt);
    }

    public boolean isCreation() {
        return fromState == null;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
