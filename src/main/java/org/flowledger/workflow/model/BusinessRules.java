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

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view over a definition's free-form {@code business_rules} map.
 * <p>
 * Recognised keys:
 * <ul>
 *   <li>{@code required_fields}: context keys that must be present before any transition</li>
 *   <li>{@code transitions.<from>_<to>.required_fields}: context keys required for one edge</li>
 *   <li>{@code auto_assignments.<state>}: a group name, or an object with
 *       {@code assigned_to} and/or {@code assigned_group}, applied on entering the state</li>
 *   <li>{@code sla_hours}: hours from creation until the instance is due</li>
 * </ul>
 * Unknown keys are ignored.
 */
public final class BusinessRules {

    public static final BusinessRules NONE = new BusinessRules(Map.of());

    private final Map<String, Object> rules;

    private BusinessRules(Map<String, Object> rules) {
        this.rules = rules;
    }

    public static BusinessRules of(Map<String, Object> rules) {
        return rules == null || rules.isEmpty() ? NONE : new BusinessRules(rules);
    }

    /**
     * Gets the context keys that must be present for the given edge, combining the
     * definition-wide list with the edge-specific one.
     */
    public Set<String> requiredFields(String fromState, String toState) {
        Set<String> fields = new LinkedHashSet<>(stringList(rules.get("required_fields")));
        Object transitions = rules.get("transitions");
        if (transitions instanceof Map<?, ?> byEdge) {
            Object edgeRule = byEdge.get(fromState + "_" + toState);
            if (edgeRule instanceof Map<?, ?> edge) {
                fields.addAll(stringList(edge.get("required_fields")));
            }
        }
        return fields;
    }

    /**
     * Gets the assignment to apply when an instance enters the given state.
     */
    public Optional<Assignment> autoAssignment(String state) {
        Object assignments = rules.get("auto_assignments");
        if (!(assignments instanceof Map<?, ?> byState)) {
            return Optional.empty();
        }
        Object rule = byState.get(state);
        if (rule instanceof String group && !group.isBlank()) {
            return Optional.of(new Assignment(null, group));
        }
        if (rule instanceof Map<?, ?> target) {
            String assignee = asString(target.get("assigned_to"));
            String group = asString(target.get("assigned_group"));
            if (assignee != null || group != null) {
                return Optional.of(new Assignment(assignee, group));
            }
        }
        return Optional.empty();
    }

    /**
     * Gets the SLA window configured for new instances.
     */
    public Optional<Duration> sla() {
        Object hours = rules.get("sla_hours");
        BigDecimal value = null;
        if (hours instanceof Number number) {
            value = new BigDecimal(number.toString());
        } else if (hours instanceof String text && !text.isBlank()) {
            try {
                value = new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (value == null || value.signum() <= 0) {
            return Optional.empty();
        }
        long minutes = value.multiply(BigDecimal.valueOf(60)).longValue();
        return Optional.of(Duration.ofMinutes(minutes));
    }

    public Map<String, Object> asMap() {
        return rules;
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static String asString(Object value) {
        return value == null || value.toString().isBlank() ? null : value.toString();
    }

    /**
     * Assignee and group applied by an auto-assignment rule; either may be null.
     */
    public record Assignment(String assignedTo, String assignedGroup) {
    }
}
