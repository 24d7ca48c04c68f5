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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.model.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Decorates a {@link WorkflowDefinitionStore} with a Caffeine cache of definitions by ID.
 * <p>
 * Writes through this store invalidate the affected entry. Usage-count increments do
 * not, so a cached definition may report a stale {@code usageCount}.
 */
@Slf4j
public class CachingWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private final WorkflowDefinitionStore delegate;
    private final Cache<String, WorkflowDefinition> cache;

    public CachingWorkflowDefinitionStore(WorkflowDefinitionStore delegate, Duration ttl, long maxSize,
                                          MeterRegistry meterRegistry) {
        this.delegate = delegate;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl);
        if (meterRegistry != null) {
            builder.recordStats();
        }
        this.cache = builder.build();
        if (meterRegistry != null) {
            new CaffeineCacheMetrics<>(cache, "flowledger.workflow.definitions", Tags.empty()).bindTo(meterRegistry);
        }
        log.debug("Definition cache initialized: ttl={}, maxSize={}", ttl, maxSize);
    }

    @Override
    public Mono<WorkflowDefinition> insert(WorkflowDefinition definition) {
        return delegate.insert(definition)
                .doOnSuccess(d -> invalidate(definition.id()));
    }

    @Override
    public Mono<WorkflowDefinition> update(WorkflowDefinition definition) {
        return delegate.update(definition)
                .doFinally(signal -> invalidate(definition.id()));
    }

    @Override
    public Mono<WorkflowDefinition> findById(String definitionId) {
        return Mono.defer(() -> {
            WorkflowDefinition cached = cache.getIfPresent(definitionId);
            if (cached != null) {
                log.debug("DEFINITION_CACHE_HIT: definitionId={}", definitionId);
                return Mono.just(cached);
            }
            return delegate.findById(definitionId)
                    .doOnNext(d -> cache.put(definitionId, d));
        });
    }

    @Override
    public Flux<WorkflowDefinition> findActive(String organizationId, String category) {
        return delegate.findActive(organizationId, category);
    }

    @Override
    public Mono<Boolean> setActive(String definitionId, boolean active, Instant updatedAt) {
        return delegate.setActive(definitionId, active, updatedAt)
                .doFinally(signal -> invalidate(definitionId));
    }

    @Override
    public Mono<Boolean> incrementUsageCount(String definitionId) {
        return delegate.incrementUsageCount(definitionId);
    }

    /**
     * Drops a cached definition.
     */
    public void invalidate(String definitionId) {
        cache.invalidate(definitionId);
    }

    public long size() {
        return cache.estimatedSize();
    }
}
