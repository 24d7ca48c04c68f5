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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flowledger.workflow.condition.ConditionParser;
import org.flowledger.workflow.exception.ActionNotAvailableException;
import org.flowledger.workflow.model.InstanceStatus;
import org.flowledger.workflow.model.TransitionDefinition;
import org.flowledger.workflow.model.WorkflowDefinition;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether an action is legal from an instance's current state and, if so,
 * which transition it takes.
 * <p>
 * Candidates are the transitions leaving the current state with a matching action.
 * They are tried in declaration order and the first one without a condition, or whose
 * condition holds against the context, is selected. This class holds no state besides
 * the parsed-condition cache and is safe for concurrent use.
 */
@Slf4j
@RequiredArgsConstructor
public class TransitionValidator {

    private final ConditionParser conditionParser;

    public TransitionValidator() {
        this(new ConditionParser());
    }

    /**
     * Resolves the transition taken by {@code action}.
     *
     * @param definition the definition the instance runs against
     * @param instanceId the instance, used for diagnostics
     * @param currentState the instance's current state
     * @param action the requested action
     * @param context the context to evaluate conditions against
     * @return the selected transition and resulting status
     * @throws ActionNotAvailableException if no candidate matches
     */
    public TransitionResolution resolve(WorkflowDefinition definition, String instanceId,
                                        String currentState, String action, Map<String, Object> context) {
        List<TransitionDefinition> candidates = definition.getValidTransitions(currentState).stream()
                .filter(t -> Objects.equals(t.action(), action))
                .toList();

        for (TransitionDefinition candidate : candidates) {
            if (!candidate.hasCondition()
                    || conditionParser.parse(candidate.condition()).evaluate(context)) {
                InstanceStatus status = definition.isFinalState(candidate.to())
                        ? InstanceStatus.COMPLETED
                        : InstanceStatus.ACTIVE;
                log.debug("TRANSITION_RESOLVED: instanceId={}, from={}, to={}, action={}, condition={}",
                        instanceId, currentState, candidate.to(), action, candidate.condition());
                return new TransitionResolution(candidate, status);
            }
            log.debug("TRANSITION_CONDITION_FALSE: instanceId={}, from={}, to={}, condition={}",
                    instanceId, currentState, candidate.to(), candidate.condition());
        }

        throw new ActionNotAvailableException(instanceId, currentState, action,
                availableActions(definition, currentState));
    }

    /**
     * Gets the distinct actions leaving {@code state}, in declaration order, without
     * evaluating conditions.
     *
     * @param definition the definition
     * @param state the state
     * @return the syntactically available actions
     */
    public List<String> availableActions(WorkflowDefinition definition, String state) {
        return definition.getValidTransitions(state).stream()
                .map(TransitionDefinition::action)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }
}
