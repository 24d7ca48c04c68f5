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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses transition conditions of the form {@code field op literal}.
 * <p>
 * Literals are numbers, single- or double-quoted strings, {@code true}, {@code false}
 * and {@code null}. Nothing else is accepted; there is no expression language behind
 * this parser. Parsed conditions are cached by their source text, up to a maximum
 * number of entries.
 */
public class ConditionParser {

    public static final long DEFAULT_CACHE_SIZE = 1000;

    private static final Pattern CONDITION = Pattern.compile(
            "^\\s*([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\s*(==|!=|>=|<=|>|<)\\s*(.+?)\\s*$");

    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?$");

    private final Cache<String, TransitionCondition> cache;

    public ConditionParser() {
        this(DEFAULT_CACHE_SIZE);
    }

    public ConditionParser(long maxCacheSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxCacheSize)
                .build();
    }

    /**
     * Parses a condition, returning a cached instance when the same text was parsed before.
     *
     * @param expression the condition text
     * @return the parsed condition
     * @throws InvalidConditionException if the text does not follow the grammar
     */
    public TransitionCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidConditionException(String.valueOf(expression), "condition is empty");
        }
        return cache.get(expression, ConditionParser::doParse);
    }

    long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static TransitionCondition doParse(String expression) {
        Matcher matcher = CONDITION.matcher(expression);
        if (!matcher.matches()) {
            throw new InvalidConditionException(expression, "expected 'field operator literal'");
        }
        String field = matcher.group(1);
        ComparisonOperator operator = ComparisonOperator.fromSymbol(matcher.group(2))
                .orElseThrow(() -> new InvalidConditionException(expression, "unknown operator"));
        Object literal = parseLiteral(expression, matcher.group(3));
        if (operator.isOrdering() && (literal == null || literal instanceof Boolean)) {
            throw new InvalidConditionException(expression,
                    "operator '" + operator.symbol() + "' cannot be applied to " + literal);
        }
        return new TransitionCondition(field, operator, literal, expression.trim());
    }

    private static Object parseLiteral(String expression, String token) {
        if (token.length() >= 2) {
            char first = token.charAt(0);
            char last = token.charAt(token.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return token.substring(1, token.length() - 1);
            }
        }
        switch (token) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
                return null;
            default:
                break;
        }
        if (NUMBER.matcher(token).matches()) {
            return new BigDecimal(token);
        }
        throw new InvalidConditionException(expression, "unsupported literal '" + token + "'");
    }
}
