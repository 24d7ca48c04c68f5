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


package org.flowledger.workflow.insight;

import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.exception.InstanceNotFoundException;
import org.flowledger.workflow.metrics.WorkflowMetrics;
import org.flowledger.workflow.model.AIInsight;
import org.flowledger.workflow.store.InsightStore;
import org.flowledger.workflow.store.WorkflowInstanceStore;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Attachment point for advisory insights produced outside the engine.
 * <p>
 * Attaching reads the instance only to check that it exists in the caller's
 * organization and takes no lock, so it never waits on a running transition.
 */
@Slf4j
public class InsightService {

    private final WorkflowInstanceStore instanceStore;
    private final InsightStore insightStore;
    private final WorkflowMetrics workflowMetrics;
    private final Clock clock;

    public InsightService(WorkflowInstanceStore instanceStore, InsightStore insightStore) {
        this(instanceStore, insightStore, null, Clock.systemUTC());
    }

    public InsightService(WorkflowInstanceStore instanceStore, InsightStore insightStore,
                          @Nullable WorkflowMetrics workflowMetrics, Clock clock) {
        this.instanceStore = instanceStore;
        this.insightStore = insightStore;
        this.workflowMetrics = workflowMetrics;
        this.clock = clock;
    }

    /**
     * Stores an insight for an existing instance.
     *
     * @param command the insight to attach
     * @return the stored insight; errors with {@link InstanceNotFoundException} if the
     *         instance does not exist in the given organization
     */
    public Mono<AIInsight> attachInsight(AttachInsightCommand command) {
        return instanceStore.findById(command.instanceId(), command.organizationId())
                .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(command.instanceId())))
                .flatMap(instance -> {
                    AIInsight insight = new AIInsight(
                            UUID.randomUUID().toString(),
                            instance.id(),
                            command.insightType(),
                            command.content(),
                            command.confidence(),
                            command.generatedBy(),
                            command.organizationId(),
                            Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
                    if (!insight.hasValidConfidence()) {
                        log.warn("INSIGHT_CONFIDENCE_OUT_OF_RANGE: instanceId={}, insightType={}, confidence={}",
                                instance.id(), command.insightType(), command.confidence());
                    }
                    return insightStore.insert(insight);
                })
                .doOnSuccess(stored -> {
                    log.info("INSIGHT_ATTACHED: insightId={}, instanceId={}, insightType={}, generatedBy={}",
                            stored.id(), stored.instanceId(), stored.insightType(), stored.generatedBy());
                    if (workflowMetrics != null) {
                        workflowMetrics.recordInsightAttached(stored.insightType());
                    }
                });
    }

    /**
     * Lists the insights of an instance, oldest first.
     *
     * @param instanceId the instance ID
     * @param organizationId the organization
     * @param insightType optional type filter
     * @return the insights
     */
    public Flux<AIInsight> listInsights(String instanceId, String organizationId, @Nullable String insightType) {
        return insightStore.findByInstanceId(instanceId, organizationId, insightType);
    }
}
