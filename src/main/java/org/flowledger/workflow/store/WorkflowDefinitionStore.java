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

import org.flowledger.workflow.model.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence for workflow definitions.
 * <p>
 * Definitions are read-mostly; implementations may cache reads as long as every
 * write through this interface invalidates the cached entry.
 */
public interface WorkflowDefinitionStore {

    /**
     * Stores a new definition.
     *
     * @param definition the definition to insert
     * @return the stored definition
     */
    Mono<WorkflowDefinition> insert(WorkflowDefinition definition);

    /**
     * Replaces the content of an existing definition. The usage count is not written.
     *
     * @param definition the definition to update
     * @return the stored definition, or empty if it does not exist
     */
    Mono<WorkflowDefinition> update(WorkflowDefinition definition);

    /**
     * Finds a definition by ID, active or not.
     *
     * @param definitionId the definition ID
     * @return the definition, or empty if not found
     */
    Mono<WorkflowDefinition> findById(String definitionId);

    /**
     * Lists active definitions visible to an organization: its own and the shared ones.
     *
     * @param organizationId the organization, or null for shared definitions only
     * @param category optional category filter
     * @return the definitions ordered by name
     */
    Flux<WorkflowDefinition> findActive(String organizationId, String category);

    /**
     * Sets the active flag.
     *
     * @param updatedAt the new modification time
     * @return true if a definition was updated
     */
    Mono<Boolean> setActive(String definitionId, boolean active, Instant updatedAt);

    /**
     * Atomically increments the usage count in storage.
     *
     * @param definitionId the definition ID
     * @return true if a definition was updated
     */
    Mono<Boolean> incrementUsageCount(String definitionId);
}
