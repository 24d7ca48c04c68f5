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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A permitted edge of a definition's transition graph.
 *
 * @param from source state name
 * @param to destination state name
 * @param action action name that triggers the transition
 * @param condition optional comparison evaluated against the instance context, e.g. {@code amount > 1000}
 */
public record TransitionDefinition(
        String from,
        String to,
        String action,
        String condition
) {

    public TransitionDefinition {
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
        if (condition != null && condition.isBlank()) {
            condition = null;
        }
    }

    public static TransitionDefinition of(String from, String to, String action) {
        return new TransitionDefinition(from, to, action, null);
    }

    public static TransitionDefinition of(String from, String to, String action, String condition) {
        return new TransitionDefinition(from, to, action, condition);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public static TransitionDefinition fromMap(Map<String, Object> map) {
        Object from = map.get("from");
        Object to = map.get("to");
        if (from == null || to == null) {
            throw new IllegalArgumentException("transition entry requires 'from' and 'to'");
        }
        Object action = map.get("action");
        Object condition = map.get("condition");
        return new TransitionDefinition(
                from.toString(),
                to.toString(),
                action != null ? action.toString() : null,
                condition != null ? condition.toString() : null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("from", from);
        map.put("to", to);
        map.put("action", action);
        if (condition != null) {
            map.put("condition", condition);
        }
        return map;
    }
}
