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


package org.flowledger.workflow.condition;

/**
 * Exception thrown when a condition string does not follow the comparison grammar.
 */
public class InvalidConditionException extends IllegalArgumentException {

    private final String condition;

    public InvalidConditionException(String condition, String reason) {
        super("Invalid condition '" + condition + "': " + reason);
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }
}
