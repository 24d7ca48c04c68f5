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

import org.flowledger.workflow.condition.ConditionParser;
import org.flowledger.workflow.exception.DefinitionNotFoundException;
import org.flowledger.workflow.exception.DefinitionValidationException;
import org.flowledger.workflow.model.TransitionDefinition;
import org.flowledger.workflow.model.WorkflowDefinition;
import org.flowledger.workflow.store.WorkflowDefinitionStore;
import org.flowledger.workflow.support.TestDefinitions;
import org.flowledger.workflow.validation.DefinitionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WorkflowDefinitionService}.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowDefinitionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant CREATED = Instant.parse("2026-01-15T08:30:00Z");

    @Mock
    private WorkflowDefinitionStore definitionStore;

    private WorkflowDefinitionService service;

    @BeforeEach
    void setUp() {
        service = new WorkflowDefinitionService(definitionStore, new DefinitionValidator(new ConditionParser()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should store new definitions active with a zero usage count")
        void shouldRegister() {
            when(definitionStore.insert(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
            WorkflowDefinition definition = TestDefinitions.documentApproval()
                    .active(false)
                    .usageCount(12)
                    .build();

            StepVerifier.create(service.register(definition))
                    .assertNext(stored -> {
                        assertThat(stored.id()).isEqualTo(definition.id());
                        assertThat(stored.active()).isTrue();
                        assertThat(stored.usageCount()).isZero();
                        assertThat(stored.createdAt()).isEqualTo(NOW);
                        assertThat(stored.updatedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject invalid definitions without touching the store")
        void shouldRejectInvalidDefinition() {
            WorkflowDefinition invalid = TestDefinitions.documentApproval()
                    .transitions(List.of(TransitionDefinition.of("draft", "nowhere", "submit")))
                    .build();

            StepVerifier.create(service.register(invalid))
                    .expectError(DefinitionValidationException.class)
                    .verify();

            verifyNoInteractions(definitionStore);
        }
    }

    @Nested
    @DisplayName("Updates")
    class UpdateTests {

        @Test
        @DisplayName("should keep usage count and creation metadata")
        void shouldKeepCreationMetadata() {
            WorkflowDefinition existing = TestDefinitions.documentApproval()
                    .usageCount(7)
                    .createdBy("founder")
                    .createdAt(CREATED)
                    .updatedAt(CREATED)
                    .build();
            WorkflowDefinition edited = existing.toBuilder()
                    .description("Now with descriptions")
                    .usageCount(0)
                    .createdBy("editor")
                    .createdAt(null)
                    .build();
            when(definitionStore.findById(existing.id())).thenReturn(Mono.just(existing));
            when(definitionStore.update(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

            StepVerifier.create(service.update(edited))
                    .assertNext(stored -> assertThat(stored.description()).isEqualTo("Now with descriptions"))
                    .verifyComplete();

            ArgumentCaptor<WorkflowDefinition> captor = ArgumentCaptor.forClass(WorkflowDefinition.class);
            verify(definitionStore).update(captor.capture());
            assertThat(captor.getValue().usageCount()).isEqualTo(7);
            assertThat(captor.getValue().createdBy()).isEqualTo("founder");
            assertThat(captor.getValue().createdAt()).isEqualTo(CREATED);
            assertThat(captor.getValue().updatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should fail for unknown definitions")
        void shouldFailForUnknownDefinition() {
            WorkflowDefinition definition = TestDefinitions.documentApproval().build();
            when(definitionStore.findById(definition.id())).thenReturn(Mono.empty());

            StepVerifier.create(service.update(definition))
                    .expectError(DefinitionNotFoundException.class)
                    .verify();

            verify(definitionStore, never()).update(any());
        }
    }

    @Nested
    @DisplayName("Activation and lookup")
    class LookupTests {

        @Test
        @DisplayName("deactivate should fail when nothing was updated")
        void shouldFailToDeactivateUnknownDefinition() {
            when(definitionStore.setActive("missing", false, NOW)).thenReturn(Mono.just(false));
            when(definitionStore.setActive("known", false, NOW)).thenReturn(Mono.just(true));

            StepVerifier.create(service.deactivate("missing"))
                    .expectError(DefinitionNotFoundException.class)
                    .verify();
            StepVerifier.create(service.deactivate("known"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("get should hide definitions owned by another organization")
        void shouldScopeLookup() {
            WorkflowDefinition owned = TestDefinitions.documentApproval().organizationId("org-1").active(false).build();
            when(definitionStore.findById(owned.id())).thenReturn(Mono.just(owned));

            StepVerifier.create(service.get(owned.id(), "org-1"))
                    .expectNext(owned)
                    .verifyComplete();
            StepVerifier.create(service.get(owned.id(), "org-2"))
                    .expectError(DefinitionNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("listActive should delegate the organization and category filters")
        void shouldListActive() {
            WorkflowDefinition shared = TestDefinitions.contractReview().build();
            when(definitionStore.findActive("org-1", "legal")).thenReturn(Flux.just(shared));

            StepVerifier.create(service.listActive("org-1", "legal"))
                    .expectNext(shared)
                    .verifyComplete();
        }
    }
}
