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

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fixed security rules of the expression language.
 * <p>
 * The blocklist applies to identifiers and to property names alike. The call allow-list is
 * separate from the set of values that merely happen to be callable: a function reachable
 * through the evaluation context can never be invoked.
 */
public final class ExpressionSecurityPolicy {

    public static final Set<String> BLOCKED_NAMES = Set.of(
            "eval", "Function", "constructor", "__proto__", "prototype",
            "__defineGetter__", "__defineSetter__", "__lookupGetter__", "__lookupSetter__",
            "require", "import", "module", "exports",
            "global", "globalThis", "window", "document", "process", "Buffer",
            "setTimeout", "setInterval", "setImmediate",
            "clearTimeout", "clearInterval", "clearImmediate",
            "fetch", "XMLHttpRequest", "WebSocket");

    public static final Set<String> ALLOWED_CALLS = Set.of(
            "Math.abs", "Math.ceil", "Math.floor", "Math.round", "Math.max", "Math.min",
            "Math.pow", "Math.sqrt", "Math.random",
            "Number", "String", "Boolean",
            "Array.isArray", "Object.keys", "Object.values",
            "JSON.stringify", "JSON.parse",
            "parseInt", "parseFloat", "isNaN", "isFinite");

    /**
     * Deepest nesting of parentheses, brackets, call arguments, ternaries and unary operators
     * the parser accepts.
     */
    public static final int MAX_NESTING_DEPTH = 256;

    /**
     * Deepest expression tree the interpreter walks. Left-associative operator and member
     * chains are parsed iteratively, so they are bounded here rather than by the parser.
     */
    public static final int MAX_TREE_DEPTH = 1024;

    static final String NESTING_TOO_DEEP = "Expression nesting too deep";

    static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("\\beval\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bFunction\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bconstructor\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b__proto__\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bprototype\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bimport\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\brequire\\s*\\(", Pattern.CASE_INSENSITIVE));

    private ExpressionSecurityPolicy() {
    }

    public static boolean isBlocked(String name) {
        return BLOCKED_NAMES.contains(name);
    }

    public static boolean isCallAllowed(String path) {
        return path != null && ALLOWED_CALLS.contains(path);
    }

    /**
     * Rejects source text matching one of the blocked patterns before it is tokenized.
     *
     * @throws SafeEvaluationException naming the first matching pattern
     */
    public static void screen(String source) {
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(source).find()) {
                throw new SafeEvaluationException("Expression contains blocked pattern: " + pattern.pattern());
            }
        }
    }
}
