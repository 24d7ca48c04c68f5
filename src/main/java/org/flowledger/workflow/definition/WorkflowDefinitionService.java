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


package org.flowledger.workflow.definition;

import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.exception.DefinitionNotFoundException;
import org.flowledger.workflow.model.WorkflowDefinition;
import org.flowledger.workflow.store.WorkflowDefinitionStore;
import org.flowledger.workflow.validation.DefinitionValidator;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Administration of workflow definitions.
 * <p>
 * Definitions are validated before every write. Editing a definition does not touch
 * the instances already running against it.
 */
@Slf4j
public class WorkflowDefinitionService {

    private final WorkflowDefinitionStore definitionStore;
    private final DefinitionValidator definitionValidator;
    private final Clock clock;

    public WorkflowDefinitionService(WorkflowDefinitionStore definitionStore, DefinitionValidator definitionValidator) {
        this(definitionStore, definitionValidator, Clock.systemUTC());
    }

    public WorkflowDefinitionService(WorkflowDefinitionStore definitionStore, DefinitionValidator definitionValidator,
                                     Clock clock) {
        this.definitionStore = definitionStore;
        this.definitionValidator = definitionValidator;
        this.clock = clock;
    }

    /**
     * Registers a new definition. It starts active with a usage count of zero.
     *
     * @param definition the definition to register
     * @return the stored definition; errors with
     *         {@link org.flowledger.workflow.exception.DefinitionValidationException} if invalid
     */
    public Mono<WorkflowDefinition> register(WorkflowDefinition definition) {
        return Mono.defer(() -> {
            definitionValidator.validate(definition);
            Instant now = now();
            WorkflowDefinition toStore = definition.toBuilder()
                    .active(true)
                    .usageCount(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            return definitionStore.insert(toStore)
                    .doOnSuccess(stored -> log.info(
                            "DEFINITION_REGISTERED: definitionId={}, name={}, version={}, states={}, transitions={}, organizationId={}",
                            stored.id(), stored.name(), stored.version(), stored.states().size(),
                            stored.transitions().size(), stored.organizationId()));
        });
    }

    /**
     * Replaces the states, transitions, rules and descriptive fields of a definition.
     * The usage count and creation metadata are kept.
     *
     * @param definition the new content, identified by its ID
     * @return the stored definition
     */
    public Mono<WorkflowDefinition> update(WorkflowDefinition definition) {
        return Mono.defer(() -> {
            definitionValidator.validate(definition);
            return definitionStore.findById(definition.id())
                    .switchIfEmpty(Mono.error(() -> new DefinitionNotFoundException(definition.id())))
                    .flatMap(existing -> definitionStore.update(definition.toBuilder()
                            .usageCount(existing.usageCount())
                            .createdBy(existing.createdBy())
                            .createdAt(existing.createdAt())
                            .updatedAt(now())
                            .build()))
                    .switchIfEmpty(Mono.error(() -> new DefinitionNotFoundException(definition.id())))
                    .doOnSuccess(stored -> log.info("DEFINITION_UPDATED: definitionId={}, version={}",
                            stored.id(), stored.version()));
        });
    }

    /**
     * Deactivates a definition so no new instances can be created from it.
     * Running instances are unaffected.
     */
    public Mono<Void> deactivate(String definitionId) {
        return definitionStore.setActive(definitionId, false, now())
                .flatMap(updated -> updated
                        ? Mono.<Void>empty()
                        : Mono.error(new DefinitionNotFoundException(definitionId)))
                .doOnSuccess(v -> log.info("DEFINITION_DEACTIVATED: definitionId={}", definitionId));
    }

    /**
     * Lists active definitions visible to an organization.
     *
     * @param organizationId the organization
     * @param category optional category filter
     * @return the organization's own and the shared definitions
     */
    public Flux<WorkflowDefinition> listActive(@Nullable String organizationId, @Nullable String category) {
        return definitionStore.findActive(organizationId, category);
    }

    /**
     * Gets a definition, active or not, if visible to the caller's organization.
     *
     * @param definitionId the definition ID
     * @param organizationId the caller's organization, or null to skip the tenant check
     * @return the definition; errors with {@link DefinitionNotFoundException} otherwise
     */
    public Mono<WorkflowDefinition> get(String definitionId, @Nullable String organizationId) {
        return definitionStore.findById(definitionId)
                .filter(definition -> definition.isVisibleTo(organizationId))
                .switchIfEmpty(Mono.error(() -> new DefinitionNotFoundException(definitionId)));
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
