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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing an {@link Expression} tree.
 * <p>
 * Binding strength, from loosest to tightest: ternary, {@code || ??}, {@code &&}, equality,
 * relational, additive, multiplicative, unary, call/member, primary.
 */
public final class ExpressionParser {

    private static final Set<String> EQUALITY = Set.of("==", "!=", "===", "!==");
    private static final Set<String> RELATIONAL = Set.of("<", ">", "<=", ">=");
    private static final Set<String> ADDITIVE = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE = Set.of("*", "/", "%");
    private static final Set<String> UNARY = Set.of("!", "-", "+");

    private final List<Token> tokens;
    private int pos;
    private int depth;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a token list produced by {@link Tokenizer#tokenize(String)}.
     *
     * @throws SafeEvaluationException if a token is missing or input remains after the expression
     */
    public static Expression parse(List<Token> tokens) {
        ExpressionParser parser = new ExpressionParser(tokens);
        Expression root = parser.parseTernary();
        if (!parser.peek().is(TokenType.EOF)) {
            throw new SafeEvaluationException("Unexpected token: " + parser.peek().raw());
        }
        return root;
    }

    /**
     * Convenience for {@code parse(Tokenizer.tokenize(source))}.
     */
    public static Expression parse(String source) {
        return parse(Tokenizer.tokenize(source));
    }

    private Expression parseTernary() {
        descend();
        try {
            Expression test = parseLogicalOr();
            if (!peek().isOperator("?")) {
                return test;
            }
            advance();
            Expression consequent = parseTernary();
            expectOperator(":");
            Expression alternate = parseTernary();
            return new ConditionalExpression(test, consequent, alternate);
        } finally {
            depth--;
        }
    }

    private Expression parseLogicalOr() {
        Expression left = parseLogicalAnd();
        while (peek().isOperator("||") || peek().isOperator("??")) {
            String operator = operatorValue(advance());
            left = new LogicalExpression(operator, left, parseLogicalAnd());
        }
        return left;
    }

    private Expression parseLogicalAnd() {
        Expression left = parseEquality();
        while (peek().isOperator("&&")) {
            advance();
            left = new LogicalExpression("&&", left, parseEquality());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (matchesOperator(EQUALITY)) {
            String operator = operatorValue(advance());
            left = new BinaryExpression(operator, left, parseRelational());
        }
        return left;
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (matchesOperator(RELATIONAL)) {
            String operator = operatorValue(advance());
            left = new BinaryExpression(operator, left, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (matchesOperator(ADDITIVE)) {
            String operator = operatorValue(advance());
            left = new BinaryExpression(operator, left, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (matchesOperator(MULTIPLICATIVE)) {
            String operator = operatorValue(advance());
            left = new BinaryExpression(operator, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (matchesOperator(UNARY)) {
            String operator = operatorValue(advance());
            descend();
            try {
                return new UnaryExpression(operator, parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression node = parsePrimary();
        while (true) {
            Token token = peek();
            if (token.is(TokenType.DOT)) {
                advance();
                Token name = expect(TokenType.IDENTIFIER);
                node = new MemberExpression(node, new Identifier((String) name.value()), false);
            } else if (token.is(TokenType.LBRACKET)) {
                advance();
                Expression property = parseTernary();
                expect(TokenType.RBRACKET);
                node = new MemberExpression(node, property, true);
            } else if (token.is(TokenType.LPAREN)) {
                if (!(node instanceof Identifier) && !(node instanceof MemberExpression)) {
                    throw new SafeEvaluationException("Only named functions can be called (position " + token.position() + ")");
                }
                advance();
                node = new CallExpression(node, parseArguments());
            } else {
                return node;
            }
        }
    }

    private List<Expression> parseArguments() {
        List<Expression> arguments = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            arguments.add(parseTernary());
            while (peek().is(TokenType.COMMA)) {
                advance();
                arguments.add(parseTernary());
            }
        }
        expect(TokenType.RPAREN);
        return arguments;
    }

    private Expression parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING, BOOLEAN, NULL, UNDEFINED -> {
                advance();
                return new Literal(token.value());
            }
            case IDENTIFIER -> {
                advance();
                return new Identifier((String) token.value());
            }
            case LPAREN -> {
                advance();
                Expression inner = parseTernary();
                expect(TokenType.RPAREN);
                return inner;
            }
            default -> throw new SafeEvaluationException(token.is(TokenType.EOF)
                    ? "Unexpected end of expression"
                    : "Unexpected token: " + token.raw());
        }
    }

    private void descend() {
        if (++depth > ExpressionSecurityPolicy.MAX_NESTING_DEPTH) {
            throw new SafeEvaluationException(ExpressionSecurityPolicy.NESTING_TOO_DEEP);
        }
    }

    private boolean matchesOperator(Set<String> operators) {
        Token token = peek();
        return token.is(TokenType.OPERATOR) && operators.contains(token.value());
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (!token.is(type)) {
            throw new SafeEvaluationException("Expected " + type + " but got " + token.type());
        }
        return advance();
    }

    private void expectOperator(String operator) {
        Token token = peek();
        if (!token.isOperator(operator)) {
            throw new SafeEvaluationException("Expected '" + operator + "' but got "
                    + (token.is(TokenType.EOF) ? "end of expression" : token.raw()));
        }
        advance();
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : Token.eof(pos);
    }

    private Token advance() {
        Token token = peek();
        pos++;
        return token;
    }

    private static String operatorValue(Token token) {
        return (String) token.value();
    }
}
