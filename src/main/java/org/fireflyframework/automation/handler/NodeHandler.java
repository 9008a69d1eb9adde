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
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Executes one node type.
 * <p>
 * Handlers receive the node and its merged inputs (initial data, static node inputs and the
 * outputs of upstream nodes) and emit the node's output map. An empty Mono is treated as an
 * empty output. Errors are recorded against the node and retried according to the run's
 * retry settings, except {@link org.fireflyframework.automation.expression.SafeEvaluationException}
 * which is never retried.
 * <p>
 * Example implementation:
 * <pre>
 * {@code
 * public class UppercaseHandler implements NodeHandler {
 *
 *     @Override
 *     public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
 *         return Mono.just(Map.of("data", String.valueOf(inputs.get("data")).toUpperCase()));
 *     }
 * }
 * }
 * </pre>
 */
@FunctionalInterface
public interface NodeHandler {

    /**
     * Executes the node.
     *
     * @param node the node being executed
     * @param inputs merged inputs of the node
     * @return a Mono emitting the node output
     */
    Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs);
}
