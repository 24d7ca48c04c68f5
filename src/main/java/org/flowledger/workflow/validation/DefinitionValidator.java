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
import org.flowledger.workflow.condition.ConditionParser;
import org.flowledger.workflow.condition.InvalidConditionException;
import org.flowledger.workflow.exception.DefinitionValidationException;
import org.flowledger.workflow.model.StateDefinition;
import org.flowledger.workflow.model.TransitionDefinition;
import org.flowledger.workflow.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a definition is structurally sound before it is stored.
 * <p>
 * The following are rejected:
 * <ul>
 *   <li>a blank name</li>
 *   <li>no states, or duplicate state names</li>
 *   <li>an initial state that is not declared</li>
 *   <li>transitions without an action or referencing undeclared states</li>
 *   <li>conditions that do not parse</li>
 * </ul>
 */
@RequiredArgsConstructor
public class DefinitionValidator {

    private final ConditionParser conditionParser;

    /**
     * Validates the definition.
     *
     * @param definition the definition to check
     * @throws DefinitionValidationException listing every problem found
     */
    public void validate(WorkflowDefinition definition) {
        List<String> errors = new ArrayList<>();

        if (definition.name().isBlank()) {
            errors.add("name must not be blank");
        }
        if (definition.states().isEmpty()) {
            errors.add("at least one state is required");
        }

        Set<String> names = new HashSet<>();
        for (StateDefinition state : definition.states()) {
            if (state.name().isBlank()) {
                errors.add("state names must not be blank");
            } else if (!names.add(state.name())) {
                errors.add("duplicate state '" + state.name() + "'");
            }
        }

        if (definition.initialState() == null || definition.initialState().isBlank()) {
            errors.add("initial state is required");
        } else if (!names.contains(definition.initialState())) {
            errors.add("initial state '" + definition.initialState() + "' is not a declared state");
        }

        for (TransitionDefinition transition : definition.transitions()) {
            String edge = transition.from() + " -> " + transition.to();
            if (transition.action() == null || transition.action().isBlank()) {
                errors.add("transition " + edge + " has no action");
            }
            if (!names.contains(transition.from())) {
                errors.add("transition " + edge + " starts from undeclared state '" + transition.from() + "'");
            }
            if (!names.contains(transition.to())) {
                errors.add("transition " + edge + " leads to undeclared state '" + transition.to() + "'");
            }
            if (transition.hasCondition()) {
                try {
                    conditionParser.parse(transition.condition());
                } catch (InvalidConditionException e) {
                    errors.add("transition " + edge + ": " + e.getMessage());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new DefinitionValidationException(errors);
        }
    }
}
