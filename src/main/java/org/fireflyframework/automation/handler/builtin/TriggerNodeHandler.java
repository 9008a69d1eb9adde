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

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * {@code trigger} and {@code webhook}: entry points of a workflow. Emits
 * {@code {triggered: true, timestamp, payload}} where the payload is {@code config.mockData},
 * or the incoming {@code payload} input when no mock data is configured.
 */
public class TriggerNodeHandler implements NodeHandler {

    private final Clock clock;

    public TriggerNodeHandler() {
        this(Clock.systemUTC());
    }

    public TriggerNodeHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        Object payload = node.typedConfig() instanceof InputConfig config ? config.mockData() : null;
        if (payload == null) {
            payload = inputs.get("payload");
        }
        Map<String, Object> output = new HashMap<>();
        output.put("triggered", true);
        output.put("timestamp", clock.millis());
        output.put("payload", payload);
        return Mono.just(output);
    }
}
