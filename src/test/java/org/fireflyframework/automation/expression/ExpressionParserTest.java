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

import org.fireflyframework.automation.expression.ast.BinaryExpression;
import org.fireflyframework.automation.expression.ast.CallExpression;
import org.fireflyframework.automation.expression.ast.ConditionalExpression;
import org.fireflyframework.automation.expression.ast.Expression;
import org.fireflyframework.automation.expression.ast.Identifier;
import org.fireflyframework.automation.expression.ast.Literal;
import org.fireflyframework.automation.expression.ast.LogicalExpression;
import org.fireflyframework.automation.expression.ast.MemberExpression;
import org.fireflyframework.automation.expression.ast.UnaryExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExpressionParser}.
 */
class ExpressionParserTest {

    // ========================================================================
    // Precedence and associativity
    // ========================================================================

    @Nested
    @DisplayName("precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("multiplication binds tighter than addition")
        void multiplicationBeforeAddition() {
            Expression tree = ExpressionParser.parse("1 + 2 * 3");

            assertThat(tree).isEqualTo(new BinaryExpression("+", new Literal(1.0),
                    new BinaryExpression("*", new Literal(2.0), new Literal(3.0))));
        }

        @Test
        @DisplayName("binary operators of equal precedence are left-associative")
        void leftAssociative() {
            Expression tree = ExpressionParser.parse("10 - 4 - 3");

            assertThat(tree).isEqualTo(new BinaryExpression("-",
                    new BinaryExpression("-", new Literal(10.0), new Literal(4.0)), new Literal(3.0)));
        }

        @Test
        @DisplayName("&& binds tighter than ||")
        void andBeforeOr() {
            Expression tree = ExpressionParser.parse("a || b && c");

            assertThat(tree).isEqualTo(new LogicalExpression("||", new Identifier("a"),
                    new LogicalExpression("&&", new Identifier("b"), new Identifier("c"))));
        }

        @Test
        @DisplayName("ternary is right-associative")
        void ternaryRightAssociative() {
            Expression tree = ExpressionParser.parse("a ? 1 : b ? 2 : 3");

            assertThat(tree).isEqualTo(new ConditionalExpression(new Identifier("a"), new Literal(1.0),
                    new ConditionalExpression(new Identifier("b"), new Literal(2.0), new Literal(3.0))));
        }

        @Test
        @DisplayName("unary operators nest")
        void unaryNests() {
            Expression tree = ExpressionParser.parse("!!x");

            assertThat(tree).isEqualTo(new UnaryExpression("!", new UnaryExpression("!", new Identifier("x"))));
        }

        @Test
        @DisplayName("parentheses override precedence")
        void parentheses() {
            Expression tree = ExpressionParser.parse("(1 + 2) * 3");

            assertThat(tree).isInstanceOf(BinaryExpression.class);
            assertThat(((BinaryExpression) tree).operator()).isEqualTo("*");
        }
    }

    // ========================================================================
    // Postfix forms
    // ========================================================================

    @Nested
    @DisplayName("member access and calls")
    class PostfixTests {

        @Test
        @DisplayName("should parse dotted and computed member access")
        void memberAccess() {
            Expression tree = ExpressionParser.parse("user.tags[0]");

            assertThat(tree).isEqualTo(new MemberExpression(
                    new MemberExpression(new Identifier("user"), new Identifier("tags"), false),
                    new Literal(0.0), true));
        }

        @Test
        @DisplayName("should parse calls on identifiers and members")
        void calls() {
            Expression tree = ExpressionParser.parse("Math.max(a, 2)");

            assertThat(tree).isEqualTo(new CallExpression(
                    new MemberExpression(new Identifier("Math"), new Identifier("max"), false),
                    List.of(new Identifier("a"), new Literal(2.0))));
            assertThat(ExpressionParser.parse("isNaN()")).isEqualTo(
                    new CallExpression(new Identifier("isNaN"), List.of()));
        }

        @Test
        @DisplayName("should treat grouping parentheses around a callee as transparent")
        void groupedCallee() {
            assertThat(ExpressionParser.parse("(a)(1)")).isEqualTo(
                    new CallExpression(new Identifier("a"), List.of(new Literal(1.0))));
            assertThatThrownBy(() -> new SafeEvaluator().evaluate("(a)(1)", Map.of("a", 1)))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessage("Function call 'a' is not allowed");
        }

        @Test
        @DisplayName("should refuse to call the result of a call")
        void onlyNamedCalls() {
            assertThatThrownBy(() -> ExpressionParser.parse("f(1)(2)"))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessageStartingWith("Only named functions can be called");
        }
    }

    // ========================================================================
    // Errors
    // ========================================================================

    @Nested
    @DisplayName("syntax errors")
    class ErrorTests {

        @Test
        @DisplayName("should reject trailing tokens")
        void trailingTokens() {
            assertThatThrownBy(() -> ExpressionParser.parse("1 2"))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessage("Unexpected token: 2");
        }

        @Test
        @DisplayName("should reject a truncated expression")
        void truncated() {
            assertThatThrownBy(() -> ExpressionParser.parse("1 +"))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessage("Unexpected end of expression");
        }

        @Test
        @DisplayName("should require ':' in a ternary")
        void ternaryWithoutColon() {
            assertThatThrownBy(() -> ExpressionParser.parse("a ? b"))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessageContaining("Expected ':'");
        }

        @Test
        @DisplayName("should report unbalanced brackets")
        void unbalanced() {
            assertThatThrownBy(() -> ExpressionParser.parse("(1 + 2"))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessage("Expected RPAREN but got EOF");
            assertThatThrownBy(() -> ExpressionParser.parse("a."))
                    .isInstanceOf(SafeEvaluationException.class)
                    .hasMessage("Expected IDENTIFIER but got EOF");
        }
    }
}
