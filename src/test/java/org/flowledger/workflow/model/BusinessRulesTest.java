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


package org.flowledger.workflow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessRulesTest {

    @Test
    @DisplayName("should combine global and per-edge required fields")
    void shouldCombineRequiredFields() {
        BusinessRules rules = BusinessRules.of(Map.of(
                "required_fields", List.of("customer_id"),
                "transitions", Map.of("draft_review", Map.of("required_fields", List.of("document_url", "customer_id")))));

        assertThat(rules.requiredFields("draft", "review")).containsExactly("customer_id", "document_url");
        assertThat(rules.requiredFields("review", "approved")).containsExactly("customer_id");
    }

    @Test
    @DisplayName("should read group and explicit assignments")
    void shouldReadAutoAssignments() {
        BusinessRules rules = BusinessRules.of(Map.of("auto_assignments", Map.of(
                "review", "legal-team",
                "approved", Map.of("assigned_to", "cfo", "assigned_group", "finance"),
                "done", Map.of())));

        assertThat(rules.autoAssignment("review"))
                .contains(new BusinessRules.Assignment(null, "legal-team"));
        assertThat(rules.autoAssignment("approved"))
                .contains(new BusinessRules.Assignment("cfo", "finance"));
        assertThat(rules.autoAssignment("done")).isEmpty();
        assertThat(rules.autoAssignment("draft")).isEmpty();
    }

    @Test
    @DisplayName("should convert sla_hours to a duration")
    void shouldReadSla() {
        assertThat(BusinessRules.of(Map.of("sla_hours", 48)).sla()).contains(Duration.ofHours(48));
        assertThat(BusinessRules.of(Map.of("sla_hours", "1.5")).sla()).contains(Duration.ofMinutes(90));
        assertThat(BusinessRules.of(Map.of("sla_hours", 0)).sla()).isEmpty();
        assertThat(BusinessRules.of(Map.of("sla_hours", "soon")).sla()).isEmpty();
        assertThat(BusinessRules.NONE.sla()).isEmpty();
    }

    @Test
    @DisplayName("should treat null and empty maps as no rules")
    void shouldTreatEmptyAsNone() {
        assertThat(BusinessRules.of(null)).isSameAs(BusinessRules.NONE);
        assertThat(BusinessRules.of(Map.of())).isSameAs(BusinessRules.NONE);
        assertThat(BusinessRules.NONE.requiredFields("a", "b")).isEmpty();
    }
}
