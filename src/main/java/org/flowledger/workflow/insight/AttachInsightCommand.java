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


package org.flowledger.workflow.insight;

import lombok.Builder;

import java.util.Map;
import java.util.Objects;

/**
 * Request from an external analyzer to attach an insight to an instance.
 */
@Builder
public record AttachInsightCommand(
        String instanceId,
        String insightType,
        Map<String, Object> content,
        Double confidence,
        String generatedBy,
        String organizationId
) {

    public AttachInsightCommand {
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        Objects.requireNonNull(insightType, "insightType cannot be null");
        Objects.requireNonNull(organizationId, "organizationId cannot be null");
        if (content == null) {
            content = Map.of();
        }
    }
}
