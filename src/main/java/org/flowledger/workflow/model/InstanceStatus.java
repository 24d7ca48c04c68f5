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
 * Represents the lifecycle status of a workflow instance.
 * <p>
 * Only {@link #ACTIVE} instances accept transitions. The engine itself moves an
 * instance to {@link #COMPLETED} when a transition lands on a final state;
 * {@link #FAILED} and {@link #PAUSED} are set by operators outside the engine
 * and are honoured when a transition is attempted.
 */
public enum InstanceStatus {

    /**
     * Instance is running and accepts transitions.
     */
    ACTIVE,

    /**
     * Instance reached a final state.
     */
    COMPLETED,

    /**
     * Instance was marked as failed.
     */
    FAILED,

    /**
     * Instance is on hold and does not accept transitions until reactivated.
     */
    PAUSED;

    /**
     * Checks if the instance is in a terminal state.
     *
     * @return true if no further transitions are possible
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Checks if the instance accepts transitions.
     *
     * @return true if active
     */
    public boolean isActive() {
        return this == ACTIVE;
    }

    /**
     * Gets the value persisted in the {@code status} column.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a persisted status value, case-insensitively.
     *
     * @param value the stored value
     * @return the matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static InstanceStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status value cannot be null");
        }
        return InstanceStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
