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

import org.fireflyframework.automation.exception.NodeExecutionException;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.handler.NodeVariables;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.config.ConditionConfig;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@code condition}: evaluates {@code config.condition} with the safe evaluator and emits
 * {@code {result: boolean}}.
 */
public class ConditionNodeHandler implements NodeHandler {

    private final SafeEvaluator evaluator;

    public ConditionNodeHandler(SafeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        return Mono.fromCallable(() -> {
            if (!(node.typedConfig() instanceof ConditionConfig config) || config.condition() == null) {
                throw new NodeExecutionException(node.id(), "missing 'condition' in node configuration", null);
            }
            boolean result = evaluator.evaluateCondition(config.condition(), NodeVariables.of(node, inputs));
            return Map.<String, Object>of("result", result);
        });
    }
}
