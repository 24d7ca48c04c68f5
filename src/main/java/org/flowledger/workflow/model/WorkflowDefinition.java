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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A reusable workflow template: its states, the transition graph between them and
 * the business rules the engine applies while instances move through the graph.
 * <p>
 * A definition with a null {@code organizationId} is shared by every tenant.
 *
 * @param id unique identifier of the definition
 * @param name human-readable name
 * @param description optional description
 * @param category optional grouping used by listings
 * @param version version string of the template
 * @param initialState name of the state new instances start in
 * @param states ordered list of states; the order drives progress
 * @param transitions permitted edges, in declaration order
 * @param businessRules free-form rules consumed by the engine
 * @param organizationId owning tenant, or null for a shared definition
 * @param active whether new instances may be created
 * @param usageCount number of instances created from this definition
 * @param createdBy identifier of the author
 * @param createdAt creation timestamp
 * @param updatedAt last modification timestamp
 */
public record WorkflowDefinition(
        String id,
        String name,
        String description,
        String category,
        String version,
        String initialState,
        List<StateDefinition> states,
        List<TransitionDefinition> transitions,
        Map<String, Object> businessRules,
        String organizationId,
        boolean active,
        long usageCount,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {

    public WorkflowDefinition {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        if (version == null) {
            version = "1.0.0";
        }
        states = states == null ? List.of() : List.copyOf(states);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        businessRules = businessRules == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(businessRules));
    }

    /**
     * Gets the state names in declaration order.
     *
     * @return the ordered state list used for progress computation
     */
    public List<String> stateNames() {
        return states.stream().map(StateDefinition::name).toList();
    }

    /**
     * Finds a state by name.
     *
     * @param name the state name
     * @return optional containing the state if declared
     */
    public Optional<StateDefinition> findState(String name) {
        return states.stream()
                .filter(s -> s.name().equals(name))
                .findFirst();
    }

    /**
     * Checks if the named state is declared with {@code is_final}.
     */
    public boolean isFinalState(String name) {
        return findState(name).map(StateDefinition::isFinal).orElse(false);
    }

    /**
     * Gets the transitions leaving the given state, in declaration order.
     *
     * @param fromState the source state
     * @return the outgoing transitions
     */
    public List<TransitionDefinition> getValidTransitions(String fromState) {
        return transitions.stream()
                .filter(t -> t.from().equals(fromState))
                .toList();
    }

    /**
     * Checks whether an edge from {@code fromState} to {@code toState} is declared.
     * When {@code action} is non-null it must match as well.
     *
     * @param fromState the source state
     * @param toState the destination state
     * @param action the action, or null to match on states only
     * @return true if such a transition exists
     */
    public boolean validateTransition(String fromState, String toState, String action) {
        return transitions.stream()
                .anyMatch(t -> t.from().equals(fromState)
                        && t.to().equals(toState)
                        && (action == null || action.equals(t.action())));
    }

    /**
     * Gets the business rules as a typed view.
     */
    public BusinessRules rules() {
        return BusinessRules.of(businessRules);
    }

    /**
     * Checks whether a caller from the given organization may use this definition.
     * Shared definitions are visible to everyone; a null caller organization skips the check.
     */
    public boolean isVisibleTo(String callerOrganizationId) {
        return organizationId == null
                || callerOrganizationId == null
                || organizationId.equals(callerOrganizationId);
    }

    /**
     * Creates a copy with the given identifier.
     */
    public WorkflowDefinition withId(String newId) {
        return toBuilder().id(newId).build();
    }

    /**
     * Creates a copy with the active flag changed.
     */
    public WorkflowDefinition withActive(boolean newActive) {
        return toBuilder().active(newActive).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .category(category)
                .version(version)
                .initialState(initialState)
                .states(states)
                .transitions(transitions)
                .businessRules(businessRules)
                .organizationId(organizationId)
                .active(active)
                .usageCount(usageCount)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String category;
        private String version = "1.0.0";
        private String initialState;
        private List<StateDefinition> states = new ArrayList<>();
        private List<TransitionDefinition> transitions = new ArrayList<>();
        private Map<String, Object> businessRules = new HashMap<>();
        private String organizationId;
        private boolean active = true;
        private long usageCount;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder states(List<StateDefinition> states) {
            this.states = new ArrayList<>(states);
            return this;
        }

        public Builder addState(StateDefinition state) {
            this.states.add(state);
            return this;
        }

        public Builder transitions(List<TransitionDefinition> transitions) {
            this.transitions = new ArrayList<>(transitions);
            return this;
        }

        public Builder addTransition(TransitionDefinition transition) {
            this.transitions.add(transition);
            return this;
        }

        public Builder businessRules(Map<String, Object> businessRules) {
            this.businessRules = new HashMap<>(businessRules);
            return this;
        }

        public Builder addBusinessRule(String key, Object value) {
            this.businessRules.put(key, value);
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder usageCount(long usageCount) {
            this.usageCount = usageCount;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                    id, name, description, category, version, initialState,
                    states, transitions, businessRules, organizationId,
                    active, usageCount, createdBy, createdAt, updatedAt
            );
        }
    }
}
