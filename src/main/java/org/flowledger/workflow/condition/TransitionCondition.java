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

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed {@code field op literal} comparison evaluated against an instance context.
 * <p>
 * Dots in {@code field} address nested maps. Numbers compare numerically, including
 * numeric strings found in the context. A missing or null field fails every
 * comparison except {@code == null} and {@code != null}.
 *
 * @param field context path
 * @param operator comparison operator
 * @param literal {@link BigDecimal}, {@link String}, {@link Boolean} or null
 * @param source the original expression
 */
public record TransitionCondition(
        String field,
        ComparisonOperator operator,
        Object literal,
        String source
) {

    public TransitionCondition {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
    }

    /**
     * Evaluates the condition.
     *
     * @param context the instance context
     * @return true if the comparison holds
     */
    public boolean evaluate(Map<String, Object> context) {
        Object actual = resolve(context, field);
        if (literal == null) {
            return operator == ComparisonOperator.EQUAL ? actual == null : actual != null;
        }
        if (actual == null) {
            return false;
        }
        if (literal instanceof BigDecimal expected) {
            BigDecimal number = toNumber(actual);
            if (number == null) {
                return operator == ComparisonOperator.NOT_EQUAL;
            }
            return operator.test(number.compareTo(expected));
        }
        if (literal instanceof Boolean expected) {
            Boolean flag = toBoolean(actual);
            boolean equal = expected.equals(flag);
            return operator == ComparisonOperator.EQUAL ? equal : !equal;
        }
        return operator.test(actual.toString().compareTo(literal.toString()));
    }

    private static Object resolve(Map<String, Object> context, String path) {
        if (context == null) {
            return null;
        }
        if (context.containsKey(path)) {
            return context.get(path);
        }
        Object current = context;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    private static BigDecimal toNumber(Object value) {
        try {
            if (value instanceof BigDecimal decimal) {
                return decimal;
            }
            if (value instanceof Number || value instanceof String) {
                return new BigDecimal(value.toString().trim());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return source;
    }
}
