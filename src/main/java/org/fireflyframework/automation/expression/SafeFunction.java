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
import java.util.Objects;
import java.util.function.Function;

/**
 * A side-effect-free built-in that expressions may call.
 * <p>
 * Only values of this type are invocable; anything else found at an allow-listed call path
 * is rejected.
 *
 * @param name the dotted path the function is published under, e.g. {@code Math.max}
 * @param body the implementation, receiving already-evaluated arguments
 */
public record SafeFunction(String name, Function<List<Object>, Object> body) {

    public SafeFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    public Object invoke(List<Object> arguments) {
        return body.apply(arguments);
    }

    /**
     * Returns the argument at {@code index}, or {@link Undefined#INSTANCE} when absent.
     */
    static Object arg(List<Object> arguments, int index) {
        return index < arguments.size() ? arguments.get(index) : Undefined.INSTANCE;
    }
}
