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
import org.fireflyframework.automation.model.ExecutionNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExpressionNodeHandler}.
 */
class ExpressionNodeHandlerTest {

    private final ExpressionNodeHandler handler = new ExpressionNodeHandler(new SafeEvaluator());

    private static ExecutionNode expressionNode(String key, String source) {
        return ExecutionNode.builder("calc", "expression").config(key, source).build();
    }

    @Nested
    @DisplayName("handle")
    class HandleTests {

        @Test
        @DisplayName("should evaluate against inputs and the node variables")
        void evaluatesWithInputs() {
            ExecutionNode node = expressionNode("expression", "input.price * 2 + ' from ' + node.id");

            StepVerifier.create(handler.handle(node, Map.of("price", 21)))
                    .assertNext(output -> assertThat(output).containsEntry("result", "42 from calc"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should accept the 'code' key with one trailing semicolon")
        void acceptsCodeKey() {
            ExecutionNode node = expressionNode("code", "Math.max(a, b);");

            StepVerifier.create(handler.handle(node, Map.of("a", 3, "b", 7)))
                    .assertNext(output -> assertThat(output).containsEntry("result", 7.0))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map undefined results to null")
        void undefinedBecomesNull() {
            StepVerifier.create(handler.handle(expressionNode("expression", "missing"), Map.of()))
                    .assertNext(output -> {
                        assertThat(output).containsKey("result");
                        assertThat(output.get("result")).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail when no expression is configured")
        void failsWithoutExpression() {
            ExecutionNode node = ExecutionNode.builder("calc", "expression").build();

            StepVerifier.create(handler.handle(node, Map.of()))
                    .expectError(NodeExecutionException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse languages that cannot run inline")
        void refusesForeignLanguages() {
            ExecutionNode node = ExecutionNode.builder("calc", "code")
                    .config("code", "print(1)")
                    .config("language", "python")
                    .build();

            StepVerifier.create(handler.handle(node, Map.of()))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(SafeEvaluationException.class)
                            .hasMessageContaining("Language 'python' cannot run inline"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("requireSingleExpression")
    class SingleExpressionTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "a = 1", "let x = 1", "return 5", "a; b", "if (a) b", "{ a }", "x => x",
                "new Date()", "typeof a", "`t`", "a += 1"
        })
        @DisplayName("should reject statements and multi-statement code")
        void rejectsStatements(String source) {
            assertThatThrownBy(() -> ExpressionNodeHandler.requireSingleExpression(source))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessageStartingWith("Only a single expression is allowed")
                    .hasMessageContaining(ExpressionNodeHandler.DELEGATE_HINT);
        }

        @ParameterizedTest
        @ValueSource(strings = {"a >= 1 && b != 2", "a === b", "'x = 1; return'", "cond ? 'if' : 'else'"})
        @DisplayName("should accept single expressions, ignoring string contents")
        void acceptsExpressions(String source) {
            assertThat(ExpressionNodeHandler.requireSingleExpression(source)).isEqualTo(source);
        }

        @ParameterizedTest
        @ValueSource(strings = {"status.do", "order.new", "item.case", "data.class", "$new + 1", "returned || iffy"})
        @DisplayName("should accept keywords used as property names or inside identifiers")
        void acceptsKeywordLikeNames(String source) {
            assertThat(ExpressionNodeHandler.requireSingleExpression(source)).isEqualTo(source);
        }

        @Test
        @DisplayName("should ignore keywords inside long and escaped string literals")
        void longStringLiterals() {
            String source = "'" + "return; ".repeat(20_000) + "\\' if' + x";

            assertThat(ExpressionNodeHandler.requireSingleExpression(source)).isEqualTo(source);
        }
    }

    @Test
    @DisplayName("should evaluate properties named after keywords")
    void evaluatesKeywordProperties() {
        ExecutionNode node = expressionNode("expression", "status.do + order.new + $new");
        Map<String, Object> inputs = Map.of(
                "status", Map.of("do", 1),
                "order", Map.of("new", 2),
                "$new", 3);

        StepVerifier.create(handler.handle(node, inputs))
                .assertNext(output -> assertThat(output).containsEntry("result", 6.0))
                .verifyComplete();
    }
}
