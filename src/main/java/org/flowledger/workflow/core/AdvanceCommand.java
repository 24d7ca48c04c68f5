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


package org.flowledger.workflow.core;

import lombok.Builder;
import org.flowledger.workflow.model.TriggerType;

import java.util.Map;
import java.util.Objects;

/**
 * Request to move an instance along the transition named by {@code action}.
 *
 * @param instanceId the instance to advance
 * @param action the requested action
 * @param userId caller identifier, recorded as {@code triggered_by}
 * @param comment optional comment for the audit trail
 * @param data optional values merged into the context before conditions are evaluated
 * @param triggerType how the transition was triggered, defaults to manual
 * @param organizationId the caller's organization, or null to skip tenant scoping
 */
@Builder
public record AdvanceCommand(
        String instanceId,
        String action,
        String userId,
        String comment,
        Map<String, Object> data,
        TriggerType triggerType,
        String organizationId
) {

    public AdvanceCommand {
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        Objects.requireNonNull(userId, "userId cannot be null");
        if (triggerType == null) {
            triggerType = TriggerType.MANUAL;
        }
    }

    public static AdvanceCommand of(String instanceId, String action, String userId) {
        return new AdvanceCommand(instanceId, action, userId, null, null, null, null);
    }
}
