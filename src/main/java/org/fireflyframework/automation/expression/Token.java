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

import org.springframework.lang.Nullable;

/**
 * A single lexical token.
 *
 * @param type the token category
 * @param value the decoded value: a {@link Double} for numbers, the unescaped text for strings,
 *              a {@link Boolean}, {@code null}, {@link Undefined#INSTANCE} or the raw text otherwise
 * @param raw the source text the token was read from
 * @param position offset of the first character in the source
 */
public record Token(TokenType type, @Nullable Object value, String raw, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && operator.equals(value);
    }

    static Token eof(int position) {
        return new Token(TokenType.EOF, null, "", position);
    }
}
