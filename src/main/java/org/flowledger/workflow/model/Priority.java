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

import java.util.Locale;

/**
 * Business priority of a workflow instance.
 */
public enum Priority {

    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Priority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
