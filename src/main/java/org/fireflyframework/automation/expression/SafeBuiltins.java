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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.fireflyframework.automation.expression.SafeFunction.arg;
import static org.fireflyframework.automation.expression.ValueCoercion.toDisplayString;
import static org.fireflyframework.automation.expression.ValueCoercion.toNumber;

/**
 * The global names available to every expression: {@code Math}, {@code Number},
 * {@code String}, {@code Boolean}, {@code Array}, {@code Object}, {@code JSON},
 * {@code parseInt}, {@code parseFloat}, {@code isNaN}, {@code isFinite}, {@code NaN} and
 * {@code Infinity}.
 * <p>
 * Globals are resolved before the caller's context so they cannot be shadowed.
 */
public final class SafeBuiltins {

    private static final Pattern FLOAT_PREFIX =
            Pattern.compile("^[+-]?(Infinity|\\d+\\.?\\d*([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?)");

    private final ObjectMapper objectMapper;
    private final Map<String, Object> globals;

    public SafeBuiltins(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.globals = Collections.unmodifiableMap(createGlobals());
    }

    public boolean isGlobal(String name) {
        return globals.containsKey(name);
    }

    public Object global(String name) {
        return globals.getOrDefault(name, Undefined.INSTANCE);
    }

    private Map<String, Object> createGlobals() {
        Map<String, Object> map = new HashMap<>();

        Map<String, Object> math = new HashMap<>();
        math.put("PI", Math.PI);
        math.put("E", Math.E);
        math.put("abs", unary("Math.abs", Math::abs));
        math.put("ceil", unary("Math.ceil", Math::ceil));
        math.put("floor", unary("Math.floor", Math::floor));
        math.put("round", unary("Math.round", SafeBuiltins::round));
        math.put("sqrt", unary("Math.sqrt", Math::sqrt));
        math.put("pow", new SafeFunction("Math.pow", args -> pow(toNumber(arg(args, 0)), toNumber(arg(args, 1)))));
        math.put("max", new SafeFunction("Math.max", args -> extreme(args, true)));
        math.put("min", new SafeFunction("Math.min", args -> extreme(args, false)));
        math.put("random", new SafeFunction("Math.random", args -> ThreadLocalRandom.current().nextDouble()));
        map.put("Math", new SafeNamespace("Math", math));

        map.put("Number", new SafeFunction("Number", args -> args.isEmpty() ? 0.0 : toNumber(args.get(0))));
        map.put("String", new SafeFunction("String", args -> args.isEmpty() ? "" : toDisplayString(args.get(0))));
        map.put("Boolean", new SafeFunction("Boolean", args -> ValueCoercion.isTruthy(arg(args, 0))));

        map.put("Array", new SafeNamespace("Array", Map.of(
                "isArray", new SafeFunction("Array.isArray", args -> arg(args, 0) instanceof List<?>))));
        map.put("Object", new SafeNamespace("Object", Map.of(
                "keys", new SafeFunction("Object.keys", args -> keys(arg(args, 0))),
                "values", new SafeFunction("Object.values", args -> values(arg(args, 0))))));
        map.put("JSON", new SafeNamespace("JSON", Map.of(
                "stringify", new SafeFunction("JSON.stringify", args -> stringify(arg(args, 0))),
                "parse", new SafeFunction("JSON.parse", args -> parse(arg(args, 0))))));

        map.put("parseInt", new SafeFunction("parseInt", args -> parseInt(arg(args, 0), arg(args, 1))));
        map.put("parseFloat", new SafeFunction("parseFloat", args -> parseFloat(arg(args, 0))));
        map.put("isNaN", new SafeFunction("isNaN", args -> Double.isNaN(toNumber(arg(args, 0)))));
        map.put("isFinite", new SafeFunction("isFinite", args -> Double.isFinite(toNumber(arg(args, 0)))));
        map.put("NaN", Double.NaN);
        map.put("Infinity", Double.POSITIVE_INFINITY);
        return map;
    }

    private static SafeFunction unary(String name, DoubleUnaryOperator operator) {
        return new SafeFunction(name, args -> operator.applyAsDouble(toNumber(arg(args, 0))));
    }

    private static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return Math.floor(value + 0.5);
    }

    private static double pow(double base, double exponent) {
        if (Double.isNaN(exponent)) {
            return Double.NaN;
        }
        return Math.pow(base, exponent);
    }

    private static double extreme(List<Object> args, boolean max) {
        double result = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        for (Object arg : args) {
            double value = toNumber(arg);
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            result = max ? Math.max(result, value) : Math.min(result, value);
        }
        return result;
    }

    private static List<Object> keys(Object target) {
        requireObject(target);
        List<Object> keys = new ArrayList<>();
        if (target instanceof Map<?, ?> map) {
            map.keySet().forEach(key -> keys.add(String.valueOf(key)));
        } else if (target instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                keys.add(String.valueOf(i));
            }
        } else if (target instanceof String s) {
            for (int i = 0; i < s.length(); i++) {
                keys.add(String.valueOf(i));
            }
        }
        return keys;
    }

    private static List<Object> values(Object target) {
        requireObject(target);
        List<Object> values = new ArrayList<>();
        if (target instanceof Map<?, ?> map) {
            values.addAll(map.values());
        } else if (target instanceof List<?> list) {
            values.addAll(list);
        } else if (target instanceof String s) {
            s.chars().forEach(ch -> values.add(String.valueOf((char) ch)));
        }
        return values;
    }

    private static void requireObject(Object target) {
        if (ValueCoercion.isNullish(target)) {
            throw new SafeEvaluationException("Cannot convert undefined or null to object");
        }
    }

    private Object stringify(Object value) {
        if (Undefined.is(value) || value instanceof SafeFunction) {
            return Undefined.INSTANCE;
        }
        try {
            return objectMapper.writeValueAsString(toJsonTree(value));
        } catch (JsonProcessingException e) {
            throw new SafeEvaluationException("JSON.stringify failed: " + e.getOriginalMessage(), e);
        }
    }

    private Object toJsonTree(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return d == Math.rint(d) && Math.abs(d) < 1e15 ? (Object) (long) d : (Object) d;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> json = new LinkedHashMap<>();
            map.forEach((key, item) -> {
                if (!Undefined.is(item) && !(item instanceof SafeFunction)) {
                    json.put(String.valueOf(key), toJsonTree(item));
                }
            });
            return json;
        }
        if (value instanceof List<?> list) {
            List<Object> json = new ArrayList<>(list.size());
            for (Object item : list) {
                json.add(Undefined.is(item) || item instanceof SafeFunction ? null : toJsonTree(item));
            }
            return json;
        }
        if (value instanceof SafeNamespace) {
            return Map.of();
        }
        return value;
    }

    private Object parse(Object text) {
        try {
            return objectMapper.readValue(toDisplayString(text), Object.class);
        } catch (JsonProcessingException e) {
            throw new SafeEvaluationException("JSON.parse failed: " + e.getOriginalMessage(), e);
        }
    }

    private static double parseInt(Object value, Object radixArg) {
        String s = toDisplayString(value).strip();
        int sign = 1;
        if (!s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-')) {
            sign = s.charAt(0) == '-' ? -1 : 1;
            s = s.substring(1);
        }
        int radix = Undefined.is(radixArg) ? 0 : (int) toNumber(radixArg);
        if (radix == 0 || radix == 16) {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                s = s.substring(2);
                radix = 16;
            }
        }
        if (radix == 0) {
            radix = 10;
        }
        if (radix < 2 || radix > 36) {
            return Double.NaN;
        }
        int end = 0;
        while (end < s.length() && Character.digit(s.charAt(end), radix) >= 0) {
            end++;
        }
        if (end == 0) {
            return Double.NaN;
        }
        double result = 0;
        for (int i = 0; i < end; i++) {
            result = result * radix + Character.digit(s.charAt(i), radix);
        }
        return sign * result;
    }

    private static double parseFloat(Object value) {
        Matcher matcher = FLOAT_PREFIX.matcher(toDisplayString(value).strip());
        if (!matcher.find()) {
            return Double.NaN;
        }
        String match = matcher.group();
        if (match.endsWith("Infinity")) {
            return match.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(match);
    }
}
