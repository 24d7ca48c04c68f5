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


package org.flowledger.workflow.exception;

/**
 * Exception thrown when an instance changed between read and write, or its row lock
 * could not be obtained. Safe to retry with fresh state.
 */
public class ConcurrentInstanceModificationException extends WorkflowException {

    private final String instanceId;

    public ConcurrentInstanceModificationException(String instanceId) {
        super("Workflow instance '" + instanceId + "' was modified concurrently");
        this.instanceId = instanceId;
    }

    public ConcurrentInstanceModificationException(String instanceId, Throwable cause) {
        super("Workflow instance '" + instanceId + "' was modified concurrently", cause);
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
