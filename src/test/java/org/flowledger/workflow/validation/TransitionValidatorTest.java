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


package org.flowledger.workflow.validation;

import org.flowledger.workflow.exception.ActionNotAvailableException;
import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.StateDefinition;
import org.flowledger.workflow.model.TransitionDefinition;
import org.flowledger.workflow.model.WorkflowDefinition;
import org.flowledger.workflow.support.TestDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TransitionValidator}.
 */
class TransitionValidatorTest {

    private final TransitionValidator validator = new TransitionValidator();

    @Nested
    @DisplayName("Conditional routing")
    class ConditionalRoutingTests {

        private final WorkflowDefinition contractReview = TestDefinitions.contractReview().build();

        @Test
        @DisplayName("should route small contracts straight to approval")
        void shouldRouteSmallContract() {
            TransitionResolution resolution = validator.resolve(contractReview, "i-1", "legal_review",
                    "legal_approve", Map.of("contract_value", 25000));

            assertThat(resolution.toState()).isEqualTo("approved");
            assertThat(resolution.completes()).isTrue();
            assertThat(resolution.resultingStatus()).isEqualTo(InstanceStatus.COMPLETED);
        }

        @Test
        @DisplayName("should route large contracts to finance review")
        void shouldRouteLargeContract() {
            TransitionResolution resolution = validator.resolve(contractReview, "i-1", "legal_review",
                    "legal_approve", Map.of("contract_value", 75000));

            assertThat(resolution.toState()).isEqualTo("finance_review");
            assertThat(resolution.completes()).isFalse();
        }

        @Test
        @DisplayName("should reject when no condition holds")
        void shouldRejectWhenNoConditionHolds() {
            assertThatThrownBy(() -> validator.resolve(contractReview, "i-1", "legal_review",
                    "legal_approve", Map.of()))
                    .isInstanceOf(ActionNotAvailableException.class)
                    .satisfies(e -> assertThat(((ActionNotAvailableException) e).getAvailableActions())
                            .containsExactly("legal_approve"));
        }
    }

    @Test
    @DisplayName("should evaluate the condition of a single candidate")
    void shouldEvaluateSingleCandidate() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
                .id("d-1")
                .name("Gated")
                .initialState("open")
                .states(List.of(StateDefinition.initial("open"), StateDefinition.terminal("closed")))
                .transitions(List.of(TransitionDefinition.of("open", "closed", "close", "signed == true")))
                .build();

        assertThatThrownBy(() -> validator.resolve(definition, "i-1", "open", "close", Map.of("signed", false)))
                .isInstanceOf(ActionNotAvailableException.class);
        assertThat(validator.resolve(definition, "i-1", "open", "close", Map.of("signed", true)).toState())
                .isEqualTo("closed");
    }

    @Test
    @DisplayName("should reject an action not declared from the current state")
    void shouldRejectUnknownAction() {
        WorkflowDefinition definition = TestDefinitions.documentApproval().build();

        assertThatThrownBy(() -> validator.resolve(definition, "i-9", "draft", "approve", Map.of()))
                .isInstanceOf(ActionNotAvailableException.class)
                .hasMessageContaining("approve")
                .satisfies(e -> {
                    ActionNotAvailableException error = (ActionNotAvailableException) e;
                    assertThat(error.getInstanceId()).isEqualTo("i-9");
                    assertThat(error.getCurrentState()).isEqualTo("draft");
                    assertThat(error.getAvailableActions()).containsExactly("submit");
                });
    }

    @Test
    @DisplayName("should list distinct actions without evaluating conditions")
    void shouldListAvailableActions() {
        assertThat(validator.availableActions(TestDefinitions.contractReview().build(), "legal_review"))
                .containsExactly("legal_approve");
        assertThat(validator.availableActions(TestDefinitions.documentApproval().build(), "review"))
                .containsExactly("approve", "reject", "finish");
        assertThat(validator.availableActions(TestDefinitions.documentApproval().build(), "done"))
                .isEmpty();
    }
}
