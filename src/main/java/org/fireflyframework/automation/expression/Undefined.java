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

/**
 * The "undefined" value of the expression language.
 * <p>
 * Distinct from {@code null}: missing variables and missing properties evaluate to
 * {@link #INSTANCE}, while {@code null} is only produced by the {@code null} literal or by
 * caller data.
 */
public final class Undefined {

    public static final Undefined INSTANCE = new Undefined();

    private Undefined() {
    }

    public static boolean is(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
