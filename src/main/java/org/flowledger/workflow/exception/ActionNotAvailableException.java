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
 * Exception thrown when the requested action has no matching transition from the
 * current state, including when every candidate's condition evaluated false.
 */
public class ActionNotAvailableException extends WorkflowException {

    private final String instanceId;
    private final String currentState;
    private final String action;
    private final List<String> availableActions;

    public ActionNotAvailableException(String instanceId, String currentState, String action,
                                       List<String> availableActions) {
        super("Action '" + action + "' is not available from state '" + currentState
                + "' for instance '" + instanceId + "'; available actions: " + availableActions);
        this.instanceId = instanceId;
        this.currentState = currentState;
        this.action = action;
        this.availableActions = List.copyOf(availableActions);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getAction() {
        return action;
    }

    public List<String> getAvailableActions() {
        return availableActions;
    }
}
