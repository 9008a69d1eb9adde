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

import java.util.Map;

/**
 * A read-only group of built-in members such as {@code Math} or {@code JSON}.
 */
public record SafeNamespace(String name, Map<String, Object> members) {

    public SafeNamespace {
        members = Map.copyOf(members);
    }

    public Object member(String key) {
        return members.getOrDefault(key, Undefined.INSTANCE);
    }
}
