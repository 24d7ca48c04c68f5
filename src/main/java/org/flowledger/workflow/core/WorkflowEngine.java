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

import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.exception.ActionNotAvailableException;
import org.flowledger.workflow.exception.BusinessRuleViolationException;
import org.flowledger.workflow.exception.DefinitionNotFoundException;
import org.flowledger.workflow.exception.InstanceNotActiveException;
import org.flowledger.workflow.exception.InstanceNotFoundException;
import org.flowledger.workflow.metrics.WorkflowMetrics;
import org.flowledger.workflow.model.BusinessRules;
import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.InstanceSummary;
import org.flowledger.workflow.model.WorkflowDefinition;
import org.flowledger.workflow.model.WorkflowHistoryEntry;
import org.flowledger.workflow.model.WorkflowInstance;
import org.flowledger.workflow.properties.WorkflowProperties;
import org.flowledger.workflow.store.InsightStore;
import org.flowledger.workflow.store.WorkflowDefinitionStore;
import org.flowledger.workflow.store.WorkflowHistoryStore;
import org.flowledger.workflow.store.WorkflowInstanceStore;
import org.flowledger.workflow.validation.TransitionResolution;
import org.flowledger.workflow.validation.TransitionValidator;
import org.springframework.lang.Nullable;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main facade for workflow instance operations.
 * <p>
 * The WorkflowEngine provides a high-level API for:
 * <ul>
 *   <li>Creating instances from active definitions</li>
 *   <li>Advancing instances along their definition's transition graph</li>
 *   <li>Querying status, work lists, audit trails and statistics</li>
 *   <li>Updating context values and deleting instances</li>
 * </ul>
 * <p>
 * Every write runs in one transaction. {@link #advance(AdvanceCommand)} locks the
 * instance row, writes the instance with a version check and appends the history
 * entry before committing, so a transition is either fully recorded or not at all.
 * <p>
 * Example usage:
 * <pre>
 * {@code
 * workflowEngine.createInstance(CreateInstanceCommand.builder()
 *         .definitionId(definitionId)
 *         .entityId("contract-42")
 *         .organizationId("org-1")
 *         .createdBy("user-1")
 *         .build())
 *     .flatMap(instance -> workflowEngine.advance(AdvanceCommand.of(instance.id(), "submit", "user-1")))
 *     .subscribe(instance -> log.info("Now in: {}", instance.currentState()));
 * }
 * </pre>
 */
@Slf4j
public class WorkflowEngine {

    private final WorkflowDefinitionStore definitionStore;
    private final WorkflowInstanceStore instanceStore;
    private final WorkflowHistoryStore historyStore;
    private final InsightStore insightStore;
    private final TransitionValidator validator;
    private final TransactionalOperator transactionalOperator;
    private final WorkflowProperties properties;
    private final WorkflowMetrics workflowMetrics;
    private final Clock clock;

    public WorkflowEngine(
            WorkflowDefinitionStore definitionStore,
            WorkflowInstanceStore instanceStore,
            WorkflowHistoryStore historyStore,
            InsightStore insightStore,
            TransitionValidator validator,
            TransactionalOperator transactionalOperator,
            WorkflowProperties properties) {
        this(definitionStore, instanceStore, historyStore, insightStore, validator,
                transactionalOperator, properties, null, Clock.systemUTC());
    }

    public WorkflowEngine(
            WorkflowDefinitionStore definitionStore,
            WorkflowInstanceStore instanceStore,
            WorkflowHistoryStore historyStore,
            InsightStore insightStore,
            TransitionValidator validator,
            TransactionalOperator transactionalOperator,
            WorkflowProperties properties,
            @Nullable WorkflowMetrics workflowMetrics,
            Clock clock) {
        this.definitionStore = definitionStore;
        this.instanceStore = instanceStore;
        this.historyStore = historyStore;
        this.insightStore = insightStore;
        this.validator = validator;
        this.transactionalOperator = transactionalOperator;
        this.properties = properties;
        this.workflowMetrics = workflowMetrics;
        this.clock = clock;
    }

    // ==================== Definitions ====================

    /**
     * Gets an active definition visible to the caller's organization.
     *
     * @param definitionId the definition ID
     * @param organizationId the caller's organization, or null to skip the tenant check
     * @return the definition; errors with {@link DefinitionNotFoundException} when it is
     *         missing, inactive or owned by another organization
     */
    public Mono<WorkflowDefinition> getActiveDefinition(String definitionId, @Nullable String organizationId) {
        return definitionStore.findById(definitionId)
                .filter(WorkflowDefinition::active)
                .filter(definition -> definition.isVisibleTo(organizationId))
                .switchIfEmpty(Mono.error(() -> new DefinitionNotFoundException(definitionId)));
    }

    // ==================== Creation ====================

    /**
     * Creates a new instance in the definition's initial state.
     * <p>
     * The instance row, the creation history entry and the definition's usage count
     * increment are written in one transaction.
     *
     * @param command the creation request
     * @return the created instance
     */
    public Mono<WorkflowInstance> createInstance(CreateInstanceCommand command) {
        return Mono.defer(() -> {
            log.info("INSTANCE_CREATE: definitionId={}, entityId={}, organizationId={}, createdBy={}",
                    command.definitionId(), command.entityId(), command.organizationId(), command.createdBy());

            return getActiveDefinition(command.definitionId(), command.organizationId())
                    .flatMap(definition -> {
                        Instant now = now();
                        WorkflowInstance instance = newInstance(definition, command, now);
                        WorkflowHistoryEntry creation = WorkflowHistoryEntry.creation(instance, command.createdBy(), now);

                        return instanceStore.insert(instance)
                                .flatMap(saved -> historyStore.append(creation).thenReturn(saved))
                                .flatMap(saved -> definitionStore.incrementUsageCount(definition.id())
                                        .flatMap(updated -> updated
                                                ? Mono.just(saved)
                                                : Mono.<WorkflowInstance>error(new DefinitionNotFoundException(definition.id()))));
                    })
                    .as(transactionalOperator::transactional)
                    .doOnSuccess(created -> {
                        log.info("INSTANCE_CREATED: instanceId={}, definitionId={}, state={}, organizationId={}",
                                created.id(), created.definitionId(), created.currentState(), created.organizationId());
                        if (workflowMetrics != null) {
                            workflowMetrics.recordInstanceCreated(created.definitionId());
                        }
                    })
                    .doOnError(error -> log.warn("INSTANCE_CREATE_FAILED: definitionId={}, entityId={}, error={}",
                            command.definitionId(), command.entityId(), error.getMessage()));
        });
    }

    private WorkflowInstance newInstance(WorkflowDefinition definition, CreateInstanceCommand command, Instant now) {
        BusinessRules rules = definition.rules();
        BusinessRules.Assignment assignment = rules.autoAssignment(definition.initialState())
                .orElse(new BusinessRules.Assignment(null, null));

        Instant dueDate = command.dueDate();
        if (dueDate == null) {
            dueDate = rules.sla().map(now::plus).orElse(null);
        }

        return WorkflowInstance.builder()
                .id(UUID.randomUUID().toString())
                .definitionId(definition.id())
                .entityId(command.entityId())
                .entityType(command.entityType())
                .organizationId(command.organizationId())
                .title(command.title() != null ? command.title() : "Workflow for " + command.entityId())
                .description(command.description())
                .currentState(definition.initialState())
                .status(InstanceStatus.ACTIVE)
                .contextData(command.contextData())
                .progressPercentage(0)
                .priority(command.priority())
                .assignedTo(command.assignedTo() != null ? command.assignedTo() : assignment.assignedTo())
                .assignedGroup(command.assignedGroup() != null ? command.assignedGroup() : assignment.assignedGroup())
                .dueDate(dueDate)
                .startedAt(now)
                .createdBy(command.createdBy())
                .createdAt(now)
                .updatedAt(now)
                .version(0)
                .build();
    }

    // ==================== Transitions ====================

    /**
     * Advances an instance along the transition selected by the requested action.
     * <p>
     * The instance row is locked for the duration of the transaction. The caller's
     * data is merged into the context before conditions are evaluated. When the
     * action has no matching transition the instance and its history are left
     * unchanged, unless rejected attempts are recorded: then a failed history entry
     * is appended and the instance's error count and last error are updated in a
     * separate transaction.
     *
     * @param command the transition request
     * @return the updated instance
     */
    public Mono<WorkflowInstance> advance(AdvanceCommand command) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            AtomicReference<WorkflowInstance> lockedInstance = new AtomicReference<>();

            log.info("TRANSITION_START: instanceId={}, action={}, userId={}, triggerType={}",
                    command.instanceId(), command.action(), command.userId(), command.triggerType());

            return instanceStore.findByIdForUpdate(command.instanceId(), command.organizationId())
                    .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(command.instanceId())))
                    .flatMap(instance -> {
                        lockedInstance.set(instance);
                        if (!instance.status().isActive()) {
                            return Mono.error(new InstanceNotActiveException(instance.id(), instance.status()));
                        }
                        return definitionStore.findById(instance.definitionId())
                                .switchIfEmpty(Mono.error(() -> new DefinitionNotFoundException(instance.definitionId())))
                                .flatMap(definition -> applyTransition(definition, instance, command, startNanos));
                    })
                    .as(transactionalOperator::transactional)
                    .onErrorResume(error -> recordRejectedAttempt(lockedInstance.get(), command, error)
                            .then(Mono.error(error)))
                    .doOnSuccess(updated -> {
                        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                        log.info("TRANSITION_COMPLETE: instanceId={}, from={}, to={}, action={}, status={}, progress={}, durationMs={}",
                                updated.id(), updated.previousState(), updated.currentState(), command.action(),
                                updated.status(), updated.progressPercentage(), duration.toMillis());
                        if (workflowMetrics != null) {
                            workflowMetrics.recordTransition(updated.definitionId(), command.action(), duration);
                            if (updated.status() == InstanceStatus.COMPLETED) {
                                workflowMetrics.recordInstanceCompleted(updated.definitionId());
                            }
                        }
                    })
                    .doOnError(error -> {
                        log.warn("TRANSITION_REJECTED: instanceId={}, action={}, userId={}, error={}",
                                command.instanceId(), command.action(), command.userId(), error.getMessage());
                        if (workflowMetrics != null) {
                            workflowMetrics.recordTransitionRejected(command.action(), error);
                        }
                    });
        });
    }

    private Mono<WorkflowInstance> applyTransition(WorkflowDefinition definition, WorkflowInstance instance,
                                                   AdvanceCommand command, long startNanos) {
        Map<String, Object> mergedContext = instance.mergeContext(command.data());
        TransitionResolution resolution = validator.resolve(
                definition, instance.id(), instance.currentState(), command.action(), mergedContext);

        List<String> missing = definition.rules()
                .requiredFields(instance.currentState(), resolution.toState()).stream()
                .filter(field -> mergedContext.get(field) == null)
                .toList();
        if (!missing.isEmpty()) {
            return Mono.error(new BusinessRuleViolationException(instance.id(), missing));
        }

        Instant now = now();
        WorkflowInstance next = instance.transitionTo(definition, resolution.toState(), mergedContext, now);

        Map<String, Object> actionMetadata = new LinkedHashMap<>();
        actionMetadata.put("transition", resolution.transition().toMap());
        actionMetadata.put("data", command.data() != null ? command.data() : Map.of());

        return instanceStore.update(next)
                .flatMap(saved -> {
                    long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
                    WorkflowHistoryEntry entry = WorkflowHistoryEntry.transition(
                            instance, saved, command.action(), command.userId(), command.triggerType(),
                            command.comment(), actionMetadata, durationMs, now);
                    return historyStore.append(entry).thenReturn(saved);
                });
    }

    private Mono<Void> recordRejectedAttempt(@Nullable WorkflowInstance instance, AdvanceCommand command,
                                             Throwable error) {
        if (instance == null
                || !properties.getHistory().isRecordRejectedAttempts()
                || !(error instanceof ActionNotAvailableException || error instanceof BusinessRuleViolationException)) {
            return Mono.empty();
        }
        return instanceStore.findByIdForUpdate(instance.id(), instance.organizationId())
                .flatMap(current -> {
                    Instant now = now();
                    return instanceStore.update(current.toBuilder()
                                    .errorCount(current.errorCount() + 1)
                                    .lastError(error.getMessage())
                                    .updatedAt(now)
                                    .build())
                            .flatMap(counted -> historyStore.append(WorkflowHistoryEntry.rejected(
                                    counted, command.action(), command.userId(), command.triggerType(),
                                    command.comment(), command.data(), error.getMessage(), now)));
                })
                .as(transactionalOperator::transactional)
                .doOnNext(entry -> log.info("TRANSITION_ATTEMPT_RECORDED: instanceId={}, action={}, sequence={}",
                        entry.instanceId(), entry.action(), entry.sequenceNumber()))
                .then()
                .onErrorResume(recordError -> {
                    log.error("TRANSITION_ATTEMPT_RECORD_FAILED: instanceId={}, action={}, error={}",
                            instance.id(), command.action(), recordError.getMessage(), recordError);
                    return Mono.empty();
                });
    }

    // ==================== Context ====================

    /**
     * Sets one context value of an active instance. No history entry is written.
     */
    public Mono<WorkflowInstance> updateContext(String instanceId, String key, Object value, String userId) {
        return updateContext(instanceId, key, value, userId, null);
    }

    /**
     * Sets one context value of an active instance within the caller's organization.
     *
     * @param instanceId the instance ID
     * @param key the context key
     * @param value the new value
     * @param userId caller identifier
     * @param organizationId the caller's organization, or null to skip tenant scoping
     * @return the updated instance
     */
    public Mono<WorkflowInstance> updateContext(String instanceId, String key, Object value, String userId,
                                                @Nullable String organizationId) {
        return Mono.defer(() -> {
            if (key == null || key.isBlank()) {
                return Mono.error(new IllegalArgumentException("context key must not be blank"));
            }
            return instanceStore.findByIdForUpdate(instanceId, organizationId)
                    .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(instanceId)))
                    .flatMap(instance -> instance.status().isActive()
                            ? instanceStore.update(instance.withContextValue(key, value, now()))
                            : Mono.error(new InstanceNotActiveException(instance.id(), instance.status())))
                    .as(transactionalOperator::transactional)
                    .doOnSuccess(updated -> log.info("CONTEXT_UPDATED: instanceId={}, key={}, userId={}",
                            instanceId, key, userId));
        });
    }

    // ==================== Deletion ====================

    /**
     * Deletes an instance with its insights and history.
     *
     * @param instanceId the instance ID
     * @param organizationId the owning organization
     * @return completes when deleted; errors with {@link InstanceNotFoundException} if absent
     */
    public Mono<Void> deleteInstance(String instanceId, String organizationId) {
        return instanceStore.findByIdForUpdate(instanceId, organizationId)
                .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(instanceId)))
                .flatMap(instance -> insightStore.deleteByInstanceId(instanceId)
                        .then(historyStore.deleteByInstanceId(instanceId))
                        .then(instanceStore.delete(instanceId, organizationId)))
                .as(transactionalOperator::transactional)
                .doOnSuccess(deleted -> log.info("INSTANCE_DELETED: instanceId={}, organizationId={}",
                        instanceId, organizationId))
                .then();
    }

    // ==================== Queries ====================

    /**
     * Gets the status of an instance without tenant scoping.
     */
    public Mono<WorkflowStatusView> getStatus(String instanceId) {
        return getStatus(instanceId, null);
    }

    /**
     * Gets the status of an instance, including its available actions and the most
     * recent history entries.
     *
     * @param instanceId the instance ID
     * @param organizationId the caller's organization, or null to skip tenant scoping
     * @return the status view; errors with {@link InstanceNotFoundException} if absent
     */
    public Mono<WorkflowStatusView> getStatus(String instanceId, @Nullable String organizationId) {
        int recentLimit = properties.getHistory().getRecentLimit();
        return instanceStore.findById(instanceId, organizationId)
                .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(instanceId)))
                .flatMap(instance -> Mono.zip(
                                definitionStore.findById(instance.definitionId())
                                        .switchIfEmpty(Mono.error(() -> new DefinitionNotFoundException(instance.definitionId()))),
                                historyStore.findRecent(instance.id(), recentLimit).collectList())
                        .map(tuple -> toStatusView(instance, tuple.getT1(), tuple.getT2())));
    }

    private WorkflowStatusView toStatusView(WorkflowInstance instance, WorkflowDefinition definition,
                                            List<WorkflowHistoryEntry> recentHistory) {
        return new WorkflowStatusView(
                instance.id(),
                definition.id(),
                definition.name(),
                instance.entityId(),
                instance.entityType(),
                instance.title(),
                instance.currentState(),
                instance.previousState(),
                instance.status(),
                instance.progressPercentage(),
                instance.startedAt(),
                instance.completedAt(),
                instance.dueDate(),
                instance.isOverdue(now()),
                instance.assignedTo(),
                instance.assignedGroup(),
                validator.availableActions(definition, instance.currentState()),
                instance.contextData(),
                recentHistory);
    }

    /**
     * Lists the instances assigned to a user within one organization, newest first.
     *
     * @param userId the assignee
     * @param organizationId the organization, mandatory
     * @param status optional status filter
     * @param limit page size; non-positive means the configured default
     * @param offset rows to skip
     * @return the summaries
     */
    public Flux<InstanceSummary> listForUser(String userId, String organizationId, @Nullable InstanceStatus status,
                                             int limit, int offset) {
        if (organizationId == null || organizationId.isBlank()) {
            return Flux.error(new IllegalArgumentException("organizationId is required"));
        }
        WorkflowProperties.QueryConfig query = properties.getQuery();
        int effectiveLimit = limit <= 0 ? query.getDefaultLimit() : Math.min(limit, query.getMaxLimit());
        int effectiveOffset = Math.max(0, offset);
        log.debug("INSTANCE_LIST: userId={}, organizationId={}, status={}, limit={}, offset={}",
                userId, organizationId, status, effectiveLimit, effectiveOffset);
        return instanceStore.findByAssignee(userId, organizationId, status, effectiveLimit, effectiveOffset, now());
    }

    /**
     * Gets the full audit trail of an instance in commit order.
     *
     * @param instanceId the instance ID
     * @param organizationId the caller's organization, or null to skip tenant scoping
     * @return the history entries
     */
    public Flux<WorkflowHistoryEntry> getHistory(String instanceId, @Nullable String organizationId) {
        return instanceStore.findById(instanceId, organizationId)
                .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(instanceId)))
                .flatMapMany(instance -> historyStore.findByInstanceId(instance.id()));
    }

    /**
     * Counts an organization's instances per status.
     */
    public Mono<WorkflowStatistics> getStatistics(String organizationId) {
        return instanceStore.countByStatus(organizationId)
                .map(counts -> new WorkflowStatistics(organizationId, counts));
    }

    /**
     * Finds an organization's active instances that are past their due date.
     */
    public Flux<WorkflowInstance> findOverdue(String organizationId) {
        return instanceStore.findOverdue(organizationId, now());
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
