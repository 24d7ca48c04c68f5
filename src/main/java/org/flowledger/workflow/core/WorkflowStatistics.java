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

import org.flowledger.workflow.model.InstanceStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Instance counts of one organization, per status.
 */
public record WorkflowStatistics(String organizationId, Map<InstanceStatus, Long> countsByStatus) {

    public WorkflowStatistics {
        EnumMap<InstanceStatus, Long> counts = new EnumMap<>(InstanceStatus.class);
        for (InstanceStatus status : InstanceStatus.values()) {
            counts.put(status, 0L);
        }
        if (countsByStatus != null) {
            counts.putAll(countsByStatus);
        }
        countsByStatus = Map.copyOf(counts);
    }

    public long count(InstanceStatus status) {
        return countsByStatus.getOrDefault(status, 0L);
    }

    public long total() {
        return countsByStatus.values().stream().mapToLong(Long::longValue).sum();
    }
}
