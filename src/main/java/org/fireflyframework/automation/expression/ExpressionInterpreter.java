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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.fireflyframework.automation.expression.ValueCoercion.isNullish;
import static org.fireflyframework.automation.expression.ValueCoercion.isTruthy;
import static org.fireflyframework.automation.expression.ValueCoercion.toDisplayString;
import static org.fireflyframework.automation.expression.ValueCoercion.toNumber;

/**
 * Tree-walking evaluator for parsed expressions.
 * <p>
 * Security checks happen here at evaluation time: every identifier and every property name is
 * checked against {@link ExpressionSecurityPolicy#BLOCKED_NAMES}, and every call target against
 * {@link ExpressionSecurityPolicy#ALLOWED_CALLS}. Property access never uses reflection, so host
 * objects other than maps, lists and strings expose nothing.
 */
public final class ExpressionInterpreter {

    private final SafeBuiltins builtins;
    private final Map<String, ?> context;
    private int depth;

    public ExpressionInterpreter(SafeBuiltins builtins, Map<String, ?> context) {
        this.builtins = builtins;
        this.context = context != null ? context : Map.of();
    }

    public Object evaluate(Expression expression) {
        if (++depth > ExpressionSecurityPolicy.MAX_TREE_DEPTH) {
            throw new SafeEvaluationException(ExpressionSecurityPolicy.NESTING_TOO_DEEP);
        }
        try {
            return evaluateNode(expression);
        } finally {
            depth--;
        }
    }

    private Object evaluateNode(Expression expression) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        if (expression instanceof Identifier identifier) {
            return resolve(identifier.name());
        }
        if (expression instanceof MemberExpression member) {
            return evaluateMember(member);
        }
        if (expression instanceof UnaryExpression unary) {
            return evaluateUnary(unary);
        }
        if (expression instanceof BinaryExpression binary) {
            return evaluateBinary(binary);
        }
        if (expression instanceof LogicalExpression logical) {
            return evaluateLogical(logical);
        }
        if (expression instanceof ConditionalExpression conditional) {
            return isTruthy(evaluate(conditional.test()))
                    ? evaluate(conditional.consequent())
                    : evaluate(conditional.alternate());
        }
        if (expression instanceof CallExpression call) {
            return evaluateCall(call);
        }
        throw new SafeEvaluationException("Unknown expression type: " + expression.getClass().getSimpleName());
    }

    private Object resolve(String name) {
        checkName(name);
        if (builtins.isGlobal(name)) {
            return builtins.global(name);
        }
        if (context.containsKey(name)) {
            return context.get(name);
        }
        return Undefined.INSTANCE;
    }

    private Object evaluateMember(MemberExpression member) {
        Object target = evaluate(member.object());
        String key = propertyName(member);
        checkName(key);
        if (isNullish(target)) {
            return Undefined.INSTANCE;
        }
        if (target instanceof Map<?, ?> map) {
            return map.containsKey(key) ? map.get(key) : Undefined.INSTANCE;
        }
        if (target instanceof List<?> list) {
            if ("length".equals(key)) {
                return (double) list.size();
            }
            int index = ValueCoercion.toIndex(key);
            return index >= 0 && index < list.size() ? list.get(index) : Undefined.INSTANCE;
        }
        if (target instanceof String s) {
            if ("length".equals(key)) {
                return (double) s.length();
            }
            int index = ValueCoercion.toIndex(key);
            return index >= 0 && index < s.length() ? String.valueOf(s.charAt(index)) : Undefined.INSTANCE;
        }
        if (target instanceof SafeNamespace namespace) {
            return namespace.member(key);
        }
        return Undefined.INSTANCE;
    }

    private String propertyName(MemberExpression member) {
        if (!member.computed() && member.property() instanceof Identifier identifier) {
            return identifier.name();
        }
        return toDisplayString(evaluate(member.property()));
    }

    private Object evaluateUnary(UnaryExpression unary) {
        Object value = evaluate(unary.argument());
        return switch (unary.operator()) {
            case "!" -> !isTruthy(value);
            case "-" -> -toNumber(value);
            case "+" -> toNumber(value);
            default -> throw new SafeEvaluationException("Unknown unary operator: " + unary.operator());
        };
    }

    private Object evaluateBinary(BinaryExpression binary) {
        Object left = evaluate(binary.left());
        Object right = evaluate(binary.right());
        return switch (binary.operator()) {
            case "+" -> ValueCoercion.add(left, right);
            case "-" -> toNumber(left) - toNumber(right);
            case "*" -> toNumber(left) * toNumber(right);
            case "/" -> toNumber(left) / toNumber(right);
            case "%" -> toNumber(left) % toNumber(right);
            case "==" -> ValueCoercion.looseEquals(left, right);
            case "!=" -> !ValueCoercion.looseEquals(left, right);
            case "===" -> ValueCoercion.strictEquals(left, right);
            case "!==" -> !ValueCoercion.strictEquals(left, right);
            case "<", ">", "<=", ">=" -> ValueCoercion.compare(binary.operator(), left, right);
            default -> throw new SafeEvaluationException("Unknown binary operator: " + binary.operator());
        };
    }

    private Object evaluateLogical(LogicalExpression logical) {
        Object left = evaluate(logical.left());
        return switch (logical.operator()) {
            case "&&" -> isTruthy(left) ? evaluate(logical.right()) : left;
            case "||" -> isTruthy(left) ? left : evaluate(logical.right());
            case "??" -> isNullish(left) ? evaluate(logical.right()) : left;
            default -> throw new SafeEvaluationException("Unknown logical operator: " + logical.operator());
        };
    }

    private Object evaluateCall(CallExpression call) {
        String path = calleePath(call.callee());
        if (!ExpressionSecurityPolicy.isCallAllowed(path)) {
            throw new SafeEvaluationException("Function call '" + path + "' is not allowed");
        }
        Object callee = evaluate(call.callee());
        if (!(callee instanceof SafeFunction function)) {
            throw new SafeEvaluationException("'" + path + "' is not a function");
        }
        List<Object> arguments = new ArrayList<>(call.arguments().size());
        for (Expression argument : call.arguments()) {
            arguments.add(evaluate(argument));
        }
        return function.invoke(arguments);
    }

    private String calleePath(Expression callee) {
        Deque<String> segments = new ArrayDeque<>();
        Expression current = callee;
        while (current instanceof MemberExpression member) {
            if (segments.size() >= ExpressionSecurityPolicy.MAX_TREE_DEPTH) {
                throw new SafeEvaluationException(ExpressionSecurityPolicy.NESTING_TOO_DEEP);
            }
            segments.addFirst(propertyName(member));
            current = member.object();
        }
        segments.addFirst(current instanceof Identifier identifier ? identifier.name() : "<expression>");
        return String.join(".", segments);
    }

    private static void checkName(String name) {
        if (ExpressionSecurityPolicy.isBlocked(name)) {
            throw new SafeEvaluationException("Access to '" + name + "' is not allowed");
        }
    }
}
