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
 * A named state of a workflow definition.
 * <p>
 * Keys other than {@code name}, {@code title}, {@code is_initial} and {@code is_final}
 * are kept as display metadata and written back unchanged.
 *
 * @param name unique name of the state within its definition
 * @param title optional display title
 * @param initial whether the state is flagged as initial
 * @param isFinal whether landing on this state completes the instance
 * @param metadata extra display metadata
 */
public record StateDefinition(
        String name,
        String title,
        boolean initial,
        boolean isFinal,
        Map<String, Object> metadata
) {

    public StateDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        if (metadata == null) {
            metadata = Map.of();
        } else {
            metadata = Map.copyOf(metadata);
        }
    }

    public static StateDefinition of(String name) {
        return new StateDefinition(name, null, false, false, null);
    }

    public static StateDefinition initial(String name) {
        return new StateDefinition(name, null, true, false, null);
    }

    public static StateDefinition terminal(String name) {
        return new StateDefinition(name, null, false, true, null);
    }

    /**
     * Reads a state from its stored JSON form.
     *
     * @param map the decoded JSON object
     * @return the state
     */
    public static StateDefinition fromMap(Map<String, Object> map) {
        Object name = map.get("name");
        if (name == null) {
            throw new IllegalArgumentException("state entry is missing 'name'");
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (!"name".equals(key) && !"title".equals(key)
                    && !"is_initial".equals(key) && !"is_final".equals(key) && value != null) {
                extra.put(key, value);
            }
        });
        Object title = map.get("title");
        return new StateDefinition(
                name.toString(),
                title != null ? title.toString() : null,
                Boolean.TRUE.equals(map.get("is_initial")),
                Boolean.TRUE.equals(map.get("is_final")),
                extra);
    }

    /**
     * Converts the state to its stored JSON form.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(metadata);
        map.put("name", name);
        if (title != null) {
            map.put("title", title);
        }
        map.put("is_initial", initial);
        map.put("is_final", isFinal);
        return map;
    }
}
