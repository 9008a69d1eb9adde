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

package org.fireflyframework.automation.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Directed connection between two nodes.
 * <p>
 * When both handles are set, only the {@code sourceHandle} field of the source output is
 * delivered to the target, under the {@code targetHandle} key. Otherwise the whole output is
 * merged into the target's inputs.
 */
public record Edge(
        String source,
        String target,
        @Nullable String sourceHandle,
        @Nullable String targetHandle
) {

    public Edge {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
    }

    public static Edge of(String source, String target) {
        return new Edge(source, target, null, null);
    }

    public static Edge of(String source, String sourceHandle, String target, String targetHandle) {
        return new Edge(source, target, sourceHandle, targetHandle);
    }

    public boolean routesSingleField() {
        return sourceHandle != null && targetHandle != null;
    }
}
