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

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Conversion and comparison rules of the expression language.
 * <p>
 * Values are {@code null}, {@link Undefined}, {@link Number}, {@link String}, {@link Boolean},
 * {@link Map} (object), {@link List} (array) and the built-in {@link SafeFunction}s and
 * {@link SafeNamespace}s. Arithmetic is always carried out in {@code double}.
 */
public final class ValueCoercion {

    private static final Pattern NUMERIC_STRING =
            Pattern.compile("[+-]?(\\d+\\.?\\d*([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?)");
    private static final Pattern HEX_STRING = Pattern.compile("0[xX][0-9a-fA-F]+");

    private ValueCoercion() {
    }

    public static boolean isNullish(Object value) {
        return value == null || Undefined.is(value);
    }

    /**
     * {@code false}, {@code 0}, {@code -0}, {@code NaN}, {@code ""}, {@code null} and
     * {@code undefined} are falsy; every other value is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (isNullish(value)) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    public static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (Undefined.is(value)) {
            return Double.NaN;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            return parseNumericString(s);
        }
        if (value instanceof List<?>) {
            return parseNumericString(toDisplayString(value));
        }
        return Double.NaN;
    }

    private static double parseNumericString(String raw) {
        String s = raw.strip();
        if (s.isEmpty()) {
            return 0;
        }
        switch (s) {
            case "Infinity", "+Infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-Infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            default -> {
                if (HEX_STRING.matcher(s).matches()) {
                    return Long.parseLong(s.substring(2), 16);
                }
                return NUMERIC_STRING.matcher(s).matches() ? Double.parseDouble(s) : Double.NaN;
            }
        }
    }

    /**
     * Reduces arrays and objects to their primitive string form; primitives pass through.
     */
    public static Object toPrimitive(Object value) {
        if (value instanceof List<?> || value instanceof Map<?, ?>
                || value instanceof SafeFunction || value instanceof SafeNamespace) {
            return toDisplayString(value);
        }
        return value;
    }

    public static String toDisplayString(Object value) {
        if (value == null) {
            return "null";
        }
        if (Undefined.is(value)) {
            return "undefined";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number n) {
            return formatNumber(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(item -> isNullish(item) ? "" : toDisplayString(item))
                    .collect(Collectors.joining(","));
        }
        if (value instanceof Map<?, ?>) {
            return "[object Object]";
        }
        if (value instanceof SafeFunction function) {
            return "function " + function.name() + "() { [native code] }";
        }
        if (value instanceof SafeNamespace namespace) {
            return "[object " + namespace.name() + "]";
        }
        return String.valueOf(value);
    }

    /**
     * Formats a number the way the expression language prints it: integral values without a
     * fraction, very small or very large magnitudes in exponent notation.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0) {
            return "0";
        }
        double abs = Math.abs(d);
        if (d == Math.rint(d) && abs < 1e21) {
            return new BigDecimal(d).toPlainString();
        }
        BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        if (abs >= 1e-6 && abs < 1e21) {
            return decimal.toPlainString();
        }
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        return (d < 0 ? "-" : "") + mantissa + "e" + (exponent >= 0 ? "+" : "-") + Math.abs(exponent);
    }

    public static boolean strictEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        if (left instanceof String || left instanceof Boolean) {
            return left.equals(right);
        }
        return left == right;
    }

    public static boolean looseEquals(Object left, Object right) {
        if (isNullish(left) || isNullish(right)) {
            return isNullish(left) && isNullish(right);
        }
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        if (left instanceof String && right instanceof String) {
            return left.equals(right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return left.equals(right);
        }
        if (left instanceof Boolean) {
            return looseEquals(toNumber(left), right);
        }
        if (right instanceof Boolean) {
            return looseEquals(left, toNumber(right));
        }
        if (left instanceof Number && right instanceof String) {
            return toNumber(left) == toNumber(right);
        }
        if (left instanceof String && right instanceof Number) {
            return toNumber(left) == toNumber(right);
        }
        boolean leftPrimitive = left instanceof String || left instanceof Number;
        boolean rightPrimitive = right instanceof String || right instanceof Number;
        if (leftPrimitive && !rightPrimitive) {
            return looseEquals(left, toPrimitive(right));
        }
        if (rightPrimitive && !leftPrimitive) {
            return looseEquals(toPrimitive(left), right);
        }
        return left == right;
    }

    /**
     * {@code +}: string concatenation when either primitive operand is a string, numeric
     * addition otherwise.
     */
    public static Object add(Object left, Object right) {
        Object l = toPrimitive(left);
        Object r = toPrimitive(right);
        if (l instanceof String || r instanceof String) {
            return toDisplayString(l) + toDisplayString(r);
        }
        return toNumber(l) + toNumber(r);
    }

    /**
     * Relational comparison. Two strings compare lexicographically, everything else
     * numerically, and any comparison involving {@code NaN} is {@code false}.
     */
    public static boolean compare(String operator, Object left, Object right) {
        Object l = toPrimitive(left);
        Object r = toPrimitive(right);
        if (l instanceof String ls && r instanceof String rs) {
            int cmp = ls.compareTo(rs);
            return switch (operator) {
                case "<" -> cmp < 0;
                case ">" -> cmp > 0;
                case "<=" -> cmp <= 0;
                case ">=" -> cmp >= 0;
                default -> throw new SafeEvaluationException("Unknown relational operator: " + operator);
            };
        }
        double a = toNumber(l);
        double b = toNumber(r);
        return switch (operator) {
            case "<" -> a < b;
            case ">" -> a > b;
            case "<=" -> a <= b;
            case ">=" -> a >= b;
            default -> throw new SafeEvaluationException("Unknown relational operator: " + operator);
        };
    }

    /**
     * Interprets a property key as a non-negative integer index, or returns -1.
     */
    static int toIndex(Object key) {
        if (key instanceof Number n) {
            double d = n.doubleValue();
            return d >= 0 && d == Math.rint(d) && d <= Integer.MAX_VALUE ? (int) d : -1;
        }
        if (key instanceof String s && !s.isEmpty() && s.length() < 10 && s.chars().allMatch(Character::isDigit)) {
            return Integer.parseInt(s);
        }
        return -1;
    }
}
