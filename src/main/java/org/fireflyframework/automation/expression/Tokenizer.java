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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts expression source text into a flat list of {@link Token}s terminated by
 * {@link TokenType#EOF}.
 * <p>
 * Operators are matched longest-first. The keywords {@code true}, {@code false}, {@code null}
 * and {@code undefined} are emitted as literal tokens rather than identifiers.
 */
public final class Tokenizer {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("==", "!=", "<=", ">=", "&&", "||", "??");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/%<>!?:";

    private final String input;
    private int pos;

    private Tokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the given source.
     *
     * @param input the expression source
     * @return the tokens, always ending with an EOF token
     * @throws SafeEvaluationException on an unterminated string or an unknown character
     */
    public static List<Token> tokenize(String input) {
        return new Tokenizer(input).readAll();
    }

    private List<Token> readAll() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            char ch = peek(0);
            if (isDigit(ch) || (ch == '.' && isDigit(peek(1)))) {
                tokens.add(readNumber());
            } else if (ch == '"' || ch == '\'') {
                tokens.add(readString(ch));
            } else if (isIdentifierStart(ch)) {
                tokens.add(readIdentifier());
            } else if (ch == '(') {
                tokens.add(punctuation(TokenType.LPAREN));
            } else if (ch == ')') {
                tokens.add(punctuation(TokenType.RPAREN));
            } else if (ch == '[') {
                tokens.add(punctuation(TokenType.LBRACKET));
            } else if (ch == ']') {
                tokens.add(punctuation(TokenType.RBRACKET));
            } else if (ch == '.') {
                tokens.add(punctuation(TokenType.DOT));
            } else if (ch == ',') {
                tokens.add(punctuation(TokenType.COMMA));
            } else {
                tokens.add(readOperator());
            }
        }
        tokens.add(Token.eof(pos));
        return tokens;
    }

    private Token punctuation(TokenType type) {
        String raw = String.valueOf(input.charAt(pos));
        Token token = new Token(type, raw, raw, pos);
        pos++;
        return token;
    }

    private Token readNumber() {
        int start = pos;
        boolean seenDot = false;
        while (pos < input.length()) {
            char ch = peek(0);
            if (isDigit(ch)) {
                pos++;
            } else if (ch == '.' && !seenDot) {
                seenDot = true;
                pos++;
            } else {
                break;
            }
        }
        // exponent only when digits follow, otherwise the 'e' starts an identifier
        if (pos < input.length() && (peek(0) == 'e' || peek(0) == 'E')) {
            int look = pos + 1;
            if (look < input.length() && (input.charAt(look) == '+' || input.charAt(look) == '-')) {
                look++;
            }
            if (look < input.length() && isDigit(input.charAt(look))) {
                pos = look;
                while (pos < input.length() && isDigit(peek(0))) {
                    pos++;
                }
            }
        }
        String raw = input.substring(start, pos);
        return new Token(TokenType.NUMBER, Double.parseDouble(raw), raw, start);
    }

    private Token readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder value = new StringBuilder();
        while (pos < input.length() && peek(0) != quote) {
            char ch = input.charAt(pos++);
            if (ch != '\\') {
                value.append(ch);
                continue;
            }
            if (pos >= input.length()) {
                break;
            }
            char escaped = input.charAt(pos++);
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                default -> value.append(escaped);
            }
        }
        if (pos >= input.length() || peek(0) != quote) {
            throw new SafeEvaluationException("Unterminated string literal");
        }
        pos++;
        return new Token(TokenType.STRING, value.toString(), input.substring(start, pos), start);
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < input.length() && isIdentifierPart(peek(0))) {
            pos++;
        }
        String name = input.substring(start, pos);
        return switch (name) {
            case "true" -> new Token(TokenType.BOOLEAN, Boolean.TRUE, name, start);
            case "false" -> new Token(TokenType.BOOLEAN, Boolean.FALSE, name, start);
            case "null" -> new Token(TokenType.NULL, null, name, start);
            case "undefined" -> new Token(TokenType.UNDEFINED, Undefined.INSTANCE, name, start);
            default -> new Token(TokenType.IDENTIFIER, name, name, start);
        };
    }

    private Token readOperator() {
        int start = pos;
        if (input.startsWith("===", pos) || input.startsWith("!==", pos)) {
            return operator(start, 3);
        }
        if (pos + 2 <= input.length() && TWO_CHAR_OPERATORS.contains(input.substring(pos, pos + 2))) {
            return operator(start, 2);
        }
        char ch = peek(0);
        if (SINGLE_CHAR_OPERATORS.indexOf(ch) >= 0) {
            return operator(start, 1);
        }
        throw new SafeEvaluationException("Unknown operator at position " + start + ": " + ch);
    }

    private Token operator(int start, int length) {
        String op = input.substring(start, start + length);
        pos += length;
        return new Token(TokenType.OPERATOR, op, op, start);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentifierStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_' || ch == '$';
    }

    private static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || isDigit(ch);
    }
}
