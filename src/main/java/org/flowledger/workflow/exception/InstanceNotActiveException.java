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

import org.flowledger.workflow.model.InstanceStatus;

/**
 * Exception thrown when a transition is attempted on an instance that is not active.
 */
public class InstanceNotActiveException extends WorkflowException {

    private final String instanceId;
    private final InstanceStatus status;

    public InstanceNotActiveException(String instanceId, InstanceStatus status) {
        super("Workflow instance '" + instanceId + "' is not active (status: " + status.value() + ")");
        this.instanceId = instanceId;
        this.status = status;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public InstanceStatus getStatus() {
        return status;
    }
}
