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

import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.InstanceSummary;
import org.flowledger.workflow.model.WorkflowInstance;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Persistence for workflow instances.
 * <p>
 * Instances are never cached. Every lookup that takes an {@code organizationId}
 * restricts the result to that tenant when the argument is non-null.
 */
public interface WorkflowInstanceStore {

    /**
     * Inserts a new instance.
     *
     * @param instance the instance to insert
     * @return the stored instance
     */
    Mono<WorkflowInstance> insert(WorkflowInstance instance);

    /**
     * Finds an instance without locking it.
     *
     * @param instanceId the instance ID
     * @param organizationId the caller's organization, or null to skip tenant scoping
     * @return the instance, or empty if not found
     */
    Mono<WorkflowInstance> findById(String instanceId, String organizationId);

    /**
     * Finds an instance and locks its row until the surrounding transaction ends.
     * Must be called inside a transaction.
     *
     * @param instanceId the instance ID
     * @param organizationId the caller's organization, or null to skip tenant scoping
     * @return the instance, or empty if not found
     */
    Mono<WorkflowInstance> findByIdForUpdate(String instanceId, String organizationId);

    /**
     * Writes the mutable fields of an instance if its stored version still equals
     * {@code instance.version()}.
     *
     * @param instance the new state, carrying the version it was read at
     * @return the stored instance with its version incremented; errors with
     *         {@link org.flowledger.workflow.exception.ConcurrentInstanceModificationException}
     *         if the stored version differs
     */
    Mono<WorkflowInstance> update(WorkflowInstance instance);

    /**
     * Lists instances assigned to a user within one organization, newest first.
     *
     * @param assignedTo the assignee
     * @param organizationId the organization, mandatory
     * @param status optional status filter
     * @param limit maximum number of rows
     * @param offset rows to skip
     * @param now reference time for the overdue flag
     * @return the summaries
     */
    Flux<InstanceSummary> findByAssignee(String assignedTo, String organizationId, InstanceStatus status,
                                         int limit, int offset, Instant now);

    /**
     * Finds active instances of an organization whose due date is before {@code now}.
     */
    Flux<WorkflowInstance> findOverdue(String organizationId, Instant now);

    /**
     * Counts an organization's instances per status.
     *
     * @return counts keyed by status, statuses without instances omitted
     */
    Mono<Map<InstanceStatus, Long>> countByStatus(String organizationId);

    /**
     * Deletes an instance.
     *
     * @return true if a row was deleted
     */
    Mono<Boolean> delete(String instanceId, String organizationId);

    /**
     * Checks that the store answers queries.
     */
    Mono<Boolean> isHealthy();
}
