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

/**
 * Node of a parsed expression tree.
 * <p>
 * The set of node kinds is closed: assignment, function literals, object construction and
 * template strings have no representation, so a parsed tree can only read values, combine
 * them with operators and call allow-listed functions.
 */
public sealed interface Expression
        permits Literal, Identifier, MemberExpression, UnaryExpression, BinaryExpression,
        LogicalExpression, ConditionalExpression, CallExpression {
}
