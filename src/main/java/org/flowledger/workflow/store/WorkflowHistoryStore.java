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

import org.flowledger.workflow.model.WorkflowHistoryEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only persistence for the audit trail.
 */
public interface WorkflowHistoryStore {

    /**
     * Appends an entry, assigning the next sequence number of its instance.
     * Callers append inside the transaction that holds the instance row lock so that
     * sequence numbers follow commit order.
     *
     * @param entry the entry to append
     * @return the stored entry with its sequence number
     */
    Mono<WorkflowHistoryEntry> append(WorkflowHistoryEntry entry);

    /**
     * Gets the full trail of an instance in commit order.
     */
    Flux<WorkflowHistoryEntry> findByInstanceId(String instanceId);

    /**
     * Gets the most recent entries of an instance, newest first.
     */
    Flux<WorkflowHistoryEntry> findRecent(String instanceId, int limit);

    Mono<Long> countByInstanceId(String instanceId);

    Mono<Long> deleteByInstanceId(String instanceId);
}
