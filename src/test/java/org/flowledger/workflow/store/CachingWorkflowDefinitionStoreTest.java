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

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.flowledger.workflow.model.WorkflowDefinition;
import org.flowledger.workflow.support.TestDefinitions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CachingWorkflowDefinitionStore}.
 */
@ExtendWith(MockitoExtension.class)
class CachingWorkflowDefinitionStoreTest {

    @Mock
    private WorkflowDefinitionStore delegate;

    private SimpleMeterRegistry meterRegistry;
    private CachingWorkflowDefinitionStore store;
    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new CachingWorkflowDefinitionStore(delegate, Duration.ofMinutes(5), 100, meterRegistry);
        definition = TestDefinitions.documentApproval().build();
    }

    @Test
    @DisplayName("should serve repeated reads from the cache")
    void shouldCacheReads() {
        when(delegate.findById(definition.id())).thenReturn(Mono.just(definition));

        StepVerifier.create(store.findById(definition.id())).expectNext(definition).verifyComplete();
        StepVerifier.create(store.findById(definition.id())).expectNext(definition).verifyComplete();

        verify(delegate, times(1)).findById(definition.id());
        assertThat(store.size()).isEqualTo(1);
        assertThat(meterRegistry.find("cache.gets").tag("cache", "flowledger.workflow.definitions").meters())
                .isNotEmpty();
    }

    @Test
    @DisplayName("should not cache missing definitions")
    void shouldNotCacheMisses() {
        when(delegate.findById("missing")).thenReturn(Mono.empty());

        StepVerifier.create(store.findById("missing")).verifyComplete();
        StepVerifier.create(store.findById("missing")).verifyComplete();

        verify(delegate, times(2)).findById("missing");
    }

    @Test
    @DisplayName("should invalidate on update and deactivation")
    void shouldInvalidateOnWrites() {
        WorkflowDefinition renamed = definition.toBuilder().name("Renamed").build();
        when(delegate.findById(definition.id())).thenReturn(Mono.just(definition), Mono.just(renamed), Mono.just(renamed));
        when(delegate.update(any())).thenReturn(Mono.just(renamed));
        when(delegate.setActive(eq(definition.id()), eq(false), any())).thenReturn(Mono.just(true));

        store.findById(definition.id()).block();
        StepVerifier.create(store.update(renamed)).expectNext(renamed).verifyComplete();
        StepVerifier.create(store.findById(definition.id()).map(WorkflowDefinition::name))
                .expectNext("Renamed")
                .verifyComplete();

        StepVerifier.create(store.setActive(definition.id(), false, Instant.now())).expectNext(true).verifyComplete();
        store.findById(definition.id()).block();

        verify(delegate, times(3)).findById(definition.id());
    }

    @Test
    @DisplayName("should keep the cached entry when the usage count changes")
    void shouldKeepEntryOnUsageIncrement() {
        when(delegate.findById(definition.id())).thenReturn(Mono.just(definition));
        when(delegate.incrementUsageCount(definition.id())).thenReturn(Mono.just(true));

        store.findById(definition.id()).block();
        StepVerifier.create(store.incrementUsageCount(definition.id())).expectNext(true).verifyComplete();
        StepVerifier.create(store.findById(definition.id()).map(WorkflowDefinition::usageCount))
                .expectNext(0L)
                .verifyComplete();

        verify(delegate, times(1)).findById(definition.id());
    }
}
