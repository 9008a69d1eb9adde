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

package org.fireflyframework.automation.handler.builtin;

import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.config.InputConfig;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * {@code input}: emits {@code {data: config.defaultValue}}.
 */
public class InputNodeHandler implements NodeHandler {

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        Object defaultValue = node.typedConfig() instanceof InputConfig config ? config.defaultValue() : null;
        Map<String, Object> output = new HashMap<>();
        output.put("data", defaultValue);
        return Mono.just(output);
    }
}
