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


package org.flowledger.workflow.validation;

import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.TransitionDefinition;

/**
 * Outcome of resolving an action: the selected transition and the status the
 * instance takes once it lands on the destination.
 *
 * @param transition the selected transition
 * @param resultingStatus {@link InstanceStatus#COMPLETED} for a final destination, otherwise {@link InstanceStatus#ACTIVE}
 */
public record TransitionResolution(TransitionDefinition transition, InstanceStatus resultingStatus) {

    public String toState() {
        return transition.to();
    }

    public boolean completes() {
        return resultingStatus == InstanceStatus.COMPLETED;
    }
}
