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


package org.flowledger.workflow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.exception.WorkflowException;

import java.time.Duration;
import java.util.Locale;

/**
 * Provides workflow engine metrics through Micrometer.
 * All metrics are prefixed with {@code flowledger.workflow.*}.
 */
@Slf4j
public class WorkflowMetrics {

    private static final String PREFIX = "flowledger.workflow.";

    private final MeterRegistry meterRegistry;

    public WorkflowMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("WorkflowMetrics initialized");
    }

    // ==================== Instance Metrics ====================

    public void recordInstanceCreated(String definitionId) {
        counter("instance.created", "definition.id", definitionId).increment();
        log.debug("METRIC: instance.created definitionId={}", definitionId);
    }

    public void recordInstanceCompleted(String definitionId) {
        counter("instance.completed", "definition.id", definitionId).increment();
        log.debug("METRIC: instance.completed definitionId={}", definitionId);
    }

    // ==================== Transition Metrics ====================

    public void recordTransition(String definitionId, String action, Duration duration) {
        counter("transition.applied",
                "definition.id", definitionId,
                "action", action)
                .increment();

        timer("transition.duration",
                "definition.id", definitionId,
                "action", action)
                .record(duration);

        log.debug("METRIC: transition.applied definitionId={}, action={}, durationMs={}",
                definitionId, action, duration.toMillis());
    }

    public void recordTransitionRejected(String action, Throwable error) {
        counter("transition.rejected",
                "action", normalizeTag(action),
                "reason", reason(error))
                .increment();

        log.debug("METRIC: transition.rejected action={}, reason={}", action, reason(error));
    }

    // ==================== Insight Metrics ====================

    public void recordInsightAttached(String insightType) {
        counter("insight.attached", "insight.type", normalizeTag(insightType)).increment();
        log.debug("METRIC: insight.attached insightType={}", insightType);
    }

    // ==================== Helper Methods ====================

    private Counter counter(String name, String... tags) {
        return meterRegistry.counter(PREFIX + name, tags);
    }

    private Timer timer(String name, String... tags) {
        return meterRegistry.timer(PREFIX + name, tags);
    }

    private static String reason(Throwable error) {
        if (error instanceof WorkflowException) {
            String simpleName = error.getClass().getSimpleName();
            return simpleName.replace("Exception", "")
                    .replaceAll("([a-z])([A-Z])", "$1_$2")
                    .toLowerCase(Locale.ROOT);
        }
        return "error";
    }

    private static String normalizeTag(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
