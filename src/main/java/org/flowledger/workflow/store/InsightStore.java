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

import org.flowledger.workflow.model.AIInsight;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for advisory insights. Independent of instance locking.
 */
public interface InsightStore {

    Mono<AIInsight> insert(AIInsight insight);

    /**
     * Lists insights of an instance, oldest first.
     *
     * @param instanceId the instance ID
     * @param organizationId the organization
     * @param insightType optional type filter
     * @return the insights
     */
    Flux<AIInsight> findByInstanceId(String instanceId, String organizationId, String insightType);

    Mono<Long> deleteByInstanceId(String instanceId);
}
