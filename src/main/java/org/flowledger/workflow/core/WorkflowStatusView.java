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


package org.flowledger.workflow.core;

import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.WorkflowHistoryEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of an instance returned by status queries.
 *
 * @param availableActions actions declared from the current state, conditions not evaluated
 * @param recentHistory most recent audit entries, newest first
 */
public record WorkflowStatusView(
        String instanceId,
        String definitionId,
        String definitionName,
        String entityId,
        String entityType,
        String title,
        String currentState,
        String previousState,
        InstanceStatus status,
        int progressPercentage,
        Instant startedAt,
        Instant completedAt,
        Instant dueDate,
        boolean overdue,
        String assignedTo,
        String assignedGroup,
        List<String> availableActions,
        Map<String, Object> contextData,
        List<WorkflowHistoryEntry> recentHistory
) {
}
