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


package org.flowledger.workflow.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.store.CachingWorkflowDefinitionStore;
import org.flowledger.workflow.store.WorkflowDefinitionStore;
import org.flowledger.workflow.store.WorkflowInstanceStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the workflow engine.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Instance store connectivity</li>
 *   <li>Number of cached definitions, when caching is enabled</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowEngineHealthIndicator implements ReactiveHealthIndicator {

    private final WorkflowInstanceStore instanceStore;
    private final WorkflowDefinitionStore definitionStore;

    @Override
    public Mono<Health> health() {
        return instanceStore.isHealthy()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false)
                .map(storeHealthy -> {
                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    builder.withDetail("instanceStore", storeHealthy ? "connected" : "disconnected");
                    if (definitionStore instanceof CachingWorkflowDefinitionStore caching) {
                        builder.withDetail("cachedDefinitions", caching.size());
                    }
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.warn("Workflow engine health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
