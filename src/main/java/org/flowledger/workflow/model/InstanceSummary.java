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

/**
 * Row of a user's work list: the instance with the name of its definition.
 */
public record InstanceSummary(
        String instanceId,
        String definitionId,
        String definitionName,
        String entityId,
        String entityType,
        String title,
        String currentState,
        InstanceStatus status,
        int progressPercentage,
        Priority priority,
        String assignedTo,
        Instant dueDate,
        boolean overdue,
        Instant createdAt,
        Instant updatedAt
) {
}
