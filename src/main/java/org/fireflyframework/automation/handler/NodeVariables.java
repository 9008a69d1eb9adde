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

package org.fireflyframework.automation.handler;

import org.fireflyframework.automation.model.ExecutionNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the variable context that expression-based handlers evaluate against: every merged
 * input key, plus {@code input} (the whole input map) and {@code node} ({@code id} and
 * {@code type}).
 */
public final class NodeVariables {

    private NodeVariables() {
    }

    public static Map<String, Object> of(ExecutionNode node, Map<String, Object> inputs) {
        Map<String, Object> variables = new HashMap<>(inputs);
        variables.putIfAbsent("input", inputs);
        variables.putIfAbsent("node", Map.of("id", node.id(), "type", node.type()));
        return variables;
    }
}
