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

package org.fireflyframework.automation.handler.builtin;

import org.fireflyframework.automation.exception.NodeExecutionException;
import org.fireflyframework.automation.expression.SafeEvaluationException;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.expression.Undefined;
import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.handler.NodeVariables;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.config.ExpressionConfig;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@code expression} and {@code code}: evaluates a single safe expression and emits
 * {@code {result: value}}.
 * <p>
 * Anything that looks like a program rather than an expression (statement separators, blocks,
 * arrow functions, assignments, control-flow or declaration keywords) is rejected before
 * evaluation. Such code belongs in an external code execution service registered as its own
 * node type; it is never run inline.
 */
public class ExpressionNodeHandler implements NodeHandler {

    static final String DELEGATE_HINT =
            "register an external code execution service as a node handler for multi-statement code";

    private static final Pattern STATEMENT_KEYWORD = Pattern.compile(
            "(?<![.$\\w])(function|return|var|let|const|if|else|for|while|do|switch|case|class|new|try|catch|finally"
                    + "|throw|async|await|yield|delete|typeof|instanceof|void|with|import|export)(?![$\\w])");
    private static final Pattern ASSIGNMENT = Pattern.compile("(?<![=!<>])=(?![=>])");
    private static final Set<String> INLINE_LANGUAGES = Set.of("expression", "javascript", "js");

    private final SafeEvaluator evaluator;

    public ExpressionNodeHandler(SafeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        return Mono.fromCallable(() -> {
            if (!(node.typedConfig() instanceof ExpressionConfig config) || config.expression() == null) {
                throw new NodeExecutionException(node.id(), "missing 'expression' or 'code' in node configuration", null);
            }
            if (config.language() != null && !INLINE_LANGUAGES.contains(config.language().toLowerCase())) {
                throw new SafeEvaluationException("Language '" + config.language()
                        + "' cannot run inline; " + DELEGATE_HINT);
            }
            String expression = requireSingleExpression(config.expression());
            Object value = evaluator.evaluate(expression, NodeVariables.of(node, inputs));
            Map<String, Object> output = new HashMap<>();
            output.put("result", Undefined.is(value) ? null : value);
            return output;
        });
    }

    /**
     * Returns the expression with at most one trailing semicolon removed.
     *
     * @throws SafeEvaluationException if the source is not a single expression
     */
    static String requireSingleExpression(String source) {
        String trimmed = source.strip();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        String code = blankStringLiterals(trimmed);
        String reason = null;
        if (code.indexOf(';') >= 0) {
            reason = "statement separators";
        } else if (code.indexOf('{') >= 0 || code.indexOf('}') >= 0) {
            reason = "blocks";
        } else if (code.contains("=>")) {
            reason = "function definitions";
        } else if (ASSIGNMENT.matcher(code).find()) {
            reason = "assignments";
        } else if (STATEMENT_KEYWORD.matcher(code).find()) {
            reason = "statements";
        } else if (code.contains("`")) {
            reason = "template literals";
        }
        if (reason != null) {
            throw new SafeEvaluationException("Only a single expression is allowed, found " + reason + "; " + DELEGATE_HINT);
        }
        return trimmed;
    }

    /**
     * Replaces the contents of quoted string literals with {@code ""} so that keywords and
     * separators inside them are not mistaken for code. An unterminated literal is kept as is.
     */
    private static String blankStringLiterals(String source) {
        StringBuilder code = new StringBuilder(source.length());
        int i = 0;
        while (i < source.length()) {
            char ch = source.charAt(i);
            if (ch != '"' && ch != '\'') {
                code.append(ch);
                i++;
                continue;
            }
            int end = i + 1;
            while (end < source.length() && source.charAt(end) != ch) {
                end += source.charAt(end) == '\\' ? 2 : 1;
            }
            if (end >= source.length()) {
                code.append(source, i, source.length());
                break;
            }
            code.append("\"\"");
            i = end + 1;
        }
        return code.toString();
    }
}
