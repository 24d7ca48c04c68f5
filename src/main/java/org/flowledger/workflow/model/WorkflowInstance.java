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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One execution of a workflow definition against a business entity.
 * <p>
 * Instances are immutable; every change produces a copy that the engine persists
 * with an optimistic check on {@code version}.
 */
@Builder(toBuilder = true)
public record WorkflowInstance(
        String id,
        String definitionId,
        String entityId,
        String entityType,
        String organizationId,
        String title,
        String description,
        String currentState,
        String previousState,
        InstanceStatus status,
        Map<String, Object> contextData,
        int progressPercentage,
        Priority priority,
        String assignedTo,
        String assignedGroup,
        Instant dueDate,
        Instant startedAt,
        Instant completedAt,
        int errorCount,
        String lastError,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        long version
) {

    public WorkflowInstance {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(definitionId, "definitionId cannot be null");
        Objects.requireNonNull(organizationId, "organizationId cannot be null");
        Objects.requireNonNull(currentState, "currentState cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        contextData = contextData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contextData));
        if (priority == null) {
            priority = Priority.MEDIUM;
        }
    }

    /**
     * Checks whether the instance is past its due date and not yet completed.
     *
     * @param now the reference time
     * @return true if overdue
     */
    public boolean isOverdue(Instant now) {
        return dueDate != null && dueDate.isBefore(now) && status != InstanceStatus.COMPLETED;
    }

    /**
     * Merges the given data into a copy of the context. Existing keys not present in
     * {@code data} are kept.
     *
     * @param data values to merge, may be null
     * @return the merged context
     */
    public Map<String, Object> mergeContext(Map<String, Object> data) {
        Map<String, Object> merged = new LinkedHashMap<>(contextData);
        if (data != null) {
            merged.putAll(data);
        }
        return merged;
    }

    /**
     * Creates the copy that results from moving to {@code toState}.
     * <p>
     * Progress is recomputed from the definition's state list, the status becomes
     * {@link InstanceStatus#COMPLETED} when the destination is final, and an
     * auto-assignment rule for the destination replaces the current assignment.
     *
     * @param definition the definition the instance runs against
     * @param toState the resolved destination
     * @param mergedContext the context after merging the caller's data
     * @param now transition time
     * @return the updated instance
     */
    public WorkflowInstance transitionTo(WorkflowDefinition definition, String toState,
                                         Map<String, Object> mergedContext, Instant now) {
        boolean completes = definition.isFinalState(toState);
        WorkflowInstanceBuilder next = toBuilder()
                .previousState(currentState)
                .currentState(toState)
                .contextData(mergedContext)
                .progressPercentage(computeProgress(definition.stateNames(), toState, progressPercentage))
                .status(completes ? InstanceStatus.COMPLETED : status)
                .completedAt(completes ? now : completedAt)
                .updatedAt(now);
        definition.rules().autoAssignment(toState).ifPresent(assignment -> {
            if (assignment.assignedTo() != null) {
                next.assignedTo(assignment.assignedTo());
            }
            if (assignment.assignedGroup() != null) {
                next.assignedGroup(assignment.assignedGroup());
            }
        });
        return next.build();
    }

    /**
     * Creates a copy with one context key set.
     */
    public WorkflowInstance withContextValue(String key, Object value, Instant now) {
        Map<String, Object> updated = new LinkedHashMap<>(contextData);
        updated.put(key, value);
        return toBuilder().contextData(updated).updatedAt(now).build();
    }

    /**
     * Computes the progress of {@code state} within {@code stateList}.
     * <p>
     * The result is {@code index / (size - 1) * 100}, truncated and clamped to [0, 100].
     * When the state is not in the list, or the list has fewer than two states,
     * {@code current} is returned unchanged.
     *
     * @param stateList the ordered state names
     * @param state the state to locate
     * @param current the progress to keep when it cannot be computed
     * @return the progress percentage
     */
    public static int computeProgress(List<String> stateList, String state, int current) {
        int index = stateList.indexOf(state);
        if (index < 0 || stateList.size() < 2) {
            return current;
        }
        int progress = (int) ((double) index / (stateList.size() - 1) * 100);
        return Math.max(0, Math.min(100, progress));
    }
}
