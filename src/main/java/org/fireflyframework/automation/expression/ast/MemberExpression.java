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

package org.fireflyframework.automation.expression.ast;

import java.util.Objects;

/**
 * Property access, either {@code object.name} or {@code object[expression]}.
 *
 * @param object the expression yielding the target
 * @param property an {@link Identifier} for static access, any expression when computed
 * @param computed whether the bracket form was used
 */
public record MemberExpression(Expression object, Expression property, boolean computed) implements Expression {

    public MemberExpression {
        Objects.requireNonNull(object, "object must not be null");
        Objects.requireNonNull(property, "property must not be null");
    }
}
