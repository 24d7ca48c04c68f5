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

import java.util.List;

/**
 * Exception thrown when a transition is legal in the graph but the definition's
 * business rules reject it, e.g. a required context field is missing.
 */
public class BusinessRuleViolationException extends WorkflowException {

    private final String instanceId;
    private final List<String> missingFields;

    public BusinessRuleViolationException(String instanceId, List<String> missingFields) {
        super("Workflow instance '" + instanceId + "' is missing required fields: " + missingFields);
        this.instanceId = instanceId;
        this.missingFields = List.copyOf(missingFields);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
