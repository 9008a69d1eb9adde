/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.automation.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.expression.ast.Expression;
import org.fireflyframework.automation.metrics.WorkflowMetrics;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for evaluating untrusted expressions.
 * <p>
 * Each call screens the raw source for dangerous patterns, tokenizes, parses and walks the
 * resulting tree against the supplied context. Nothing is cached between calls, so a single
 * instance is safe to share across threads.
 *
 * <pre>{@code
 * evaluator.evaluate("Math.max(a, b)", Map.of("a", 5, "b", 10));                 // 10.0
 * evaluator.evaluateCondition("user.age >= 18", Map.of("user", Map.of("age", 21))); // true
 * evaluator.evaluate("eval(\"1+1\")", Map.of());                                 // throws
 * }</pre>
 */
@Slf4j
public class SafeEvaluator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.+?)\\s*}}");

    private final SafeBuiltins builtins;
    private final ObjectMapper objectMapper;
    private final WorkflowMetrics metrics;

    public SafeEvaluator() {
        this(new ObjectMapper(), null);
    }

    public SafeEvaluator(ObjectMapper objectMapper, @Nullable WorkflowMetrics metrics) {
        this.objectMapper = objectMapper;
        this.builtins = new SafeBuiltins(objectMapper);
        this.metrics = metrics;
    }

    /**
     * Evaluates an expression to a value.
     *
     * @param expression the expression source
     * @param context variables visible to the expression, may be {@code null}
     * @return the result: {@code null}, {@link Undefined#INSTANCE}, a {@link Double}, a
     *         {@link String}, a {@link Boolean}, or a value taken from the context
     * @throws SafeEvaluationException if the expression is empty, malformed or uses a blocked feature
     */
    public Object evaluate(String expression, @Nullable Map<String, ?> context) {
        if (expression == null || expression.isBlank()) {
            throw rejected(expression, new SafeEvaluationException("Expression must be a non-empty string"));
        }
        try {
            ExpressionSecurityPolicy.screen(expression);
            Expression tree = ExpressionParser.parse(Tokenizer.tokenize(expression));
            return new ExpressionInterpreter(builtins, context).evaluate(tree);
        } catch (SafeEvaluationException e) {
            throw rejected(expression, e);
        } catch (RuntimeException e) {
            throw rejected(expression, new SafeEvaluationException("Failed to evaluate expression: " + e.getMessage(), e));
        }
    }

    /**
     * Evaluates an expression and coerces the result to a boolean.
     */
    public boolean evaluateCondition(String expression, @Nullable Map<String, ?> context) {
        return ValueCoercion.isTruthy(evaluate(expression, context));
    }

    /**
     * Replaces every {@code {{ expression }}} placeholder in a template with the display form
     * of its value. Objects and arrays are rendered as JSON; placeholders evaluating to
     * {@code undefined} are left untouched.
     */
    public String interpolate(String template, @Nullable Map<String, ?> context) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = evaluate(matcher.group(1), context);
            String replacement = Undefined.is(value) ? matcher.group() : render(value);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String render(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new SafeEvaluationException("Cannot render template value: " + e.getOriginalMessage(), e);
            }
        }
        return ValueCoercion.toDisplayString(value);
    }

    private SafeEvaluationException rejected(String expression, SafeEvaluationException e) {
        log.warn("EXPRESSION_REJECTED: expression={}, reason={}", abbreviate(expression), e.getMessage());
        if (metrics != null) {
            metrics.recordExpressionRejected();
        }
        return e;
    }

    private static String abbreviate(String expression) {
        if (expression == null) {
            return "null";
        }
        return expression.length() > 120 ? expression.substring(0, 117) + "..." : expression;
    }
}
