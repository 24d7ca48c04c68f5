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

import lombok.Builder;
import org.flowledger.workflow.model.Priority;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Request to start a new instance of a definition for a business entity.
 *
 * @param definitionId the definition to instantiate
 * @param entityId the tracked business object
 * @param entityType optional type of the business object
 * @param title optional title, defaults to {@code "Workflow for <entityId>"}
 * @param description optional description
 * @param contextData initial context
 * @param assignedTo optional assignee
 * @param assignedGroup optional assignee group
 * @param priority optional priority, defaults to medium
 * @param dueDate optional due date; when absent the definition's SLA applies
 * @param organizationId tenant of the new instance
 * @param createdBy caller identifier
 */
@Builder
public record CreateInstanceCommand(
        String definitionId,
        String entityId,
        String entityType,
        String title,
        String description,
        Map<String, Object> contextData,
        String assignedTo,
        String assignedGroup,
        Priority priority,
        Instant dueDate,
        String organizationId,
        String createdBy
) {

    public CreateInstanceCommand {
        Objects.requireNonNull(definitionId, "definitionId cannot be null");
        Objects.requireNonNull(entityId, "entityId cannot be null");
        Objects.requireNonNull(organizationId, "organizationId cannot be null");
        Objects.requireNonNull(createdBy, "createdBy cannot be null");
        if (contextData == null) {
            contextData = Map.of();
        }
    }
}
