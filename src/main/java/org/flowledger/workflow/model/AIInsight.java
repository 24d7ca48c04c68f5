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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Advisory annotation attached to an instance by an external analyzer.
 * <p>
 * Insights never gate or alter transitions. {@code confidenceScore} is expected in
 * [0, 1] but values outside that range are kept as given.
 */
public record AIInsight(
        String id,
        String instanceId,
        String insightType,
        Map<String, Object> content,
        Double confidenceScore,
        String generatedBy,
        String organizationId,
        Instant createdAt
) {

    public AIInsight {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        Objects.requireNonNull(insightType, "insightType cannot be null");
        Objects.requireNonNull(organizationId, "organizationId cannot be null");
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public boolean hasValidConfidence() {
        return confidenceScore == null || (confidenceScore >= 0.0 && confidenceScore <= 1.0);
    }
}
