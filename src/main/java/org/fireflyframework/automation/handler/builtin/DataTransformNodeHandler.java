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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.exception.NodeExecutionException;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.expression.Undefined;
import org.fireflyframework.automation.expression.ValueCoercion;
import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.handler.NodeVariables;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.config.TransformConfig;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code data-transform} and {@code transform}: reshapes the upstream {@code data} input.
 * <p>
 * With a {@code transformType} of {@code map}, {@code filter} or {@code reduce} the handler
 * iterates over the data (object values or list items) evaluating the configured expression with
 * {@code item}, {@code index} and, for reduce, {@code acc} in scope. Otherwise a {@code template}
 * is rendered or an {@code expression} evaluated against the node variables. Without any of
 * these the data passes through unchanged. The result is always emitted as {@code {data: ...}}.
 */
@Slf4j
public class DataTransformNodeHandler implements NodeHandler {

    private final SafeEvaluator evaluator;

    public DataTransformNodeHandler(SafeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        return Mono.fromCallable(() -> {
            TransformConfig config = node.typedConfig() instanceof TransformConfig transform
                    ? transform
                    : new TransformConfig(null, null, null, null, null, null);
            Map<String, Object> variables = NodeVariables.of(node, inputs);
            Object data = inputs.get("data");
            Object result;
            if (config.transformType() != null) {
                result = switch (config.transformType()) {
                    case "map" -> map(items(data), config.expression(), variables);
                    case "filter" -> filter(items(data), config.predicate(), variables);
                    case "reduce" -> reduce(items(data), config.reducer(), config.initialValue(), variables);
                    default -> throw new NodeExecutionException(node.id(),
                            "unknown transformType '" + config.transformType() + "'", null);
                };
            } else if (config.template() != null) {
                result = evaluator.interpolate(config.template(), variables);
            } else if (config.expression() != null) {
                result = evaluator.evaluate(config.expression(), variables);
            } else {
                result = data;
            }
            log.debug("TRANSFORM: nodeId={}, transformType={}", node.id(), config.transformType());
            Map<String, Object> output = new HashMap<>();
            output.put("data", Undefined.is(result) ? null : result);
            return output;
        });
    }

    private List<Object> map(List<Object> items, String expression, Map<String, Object> variables) {
        if (expression == null) {
            return items;
        }
        List<Object> mapped = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            mapped.add(evaluator.evaluate(expression, itemScope(variables, items.get(i), i)));
        }
        return mapped;
    }

    private List<Object> filter(List<Object> items, String predicate, Map<String, Object> variables) {
        if (predicate == null) {
            return items;
        }
        List<Object> kept = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (evaluator.evaluateCondition(predicate, itemScope(variables, items.get(i), i))) {
                kept.add(items.get(i));
            }
        }
        return kept;
    }

    private Object reduce(List<Object> items, String reducer, Object initialValue, Map<String, Object> variables) {
        if (reducer == null) {
            return items;
        }
        Object acc = initialValue;
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> scope = itemScope(variables, items.get(i), i);
            scope.put("acc", acc);
            acc = evaluator.evaluate(reducer, scope);
        }
        return acc;
    }

    private static Map<String, Object> itemScope(Map<String, Object> variables, Object item, int index) {
        Map<String, Object> scope = new HashMap<>(variables);
        scope.put("item", item);
        scope.put("index", index);
        return scope;
    }

    private static List<Object> items(Object data) {
        if (data instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (data instanceof Map<?, ?> map) {
            return new ArrayList<>(map.values());
        }
        if (ValueCoercion.isNullish(data)) {
            return new ArrayList<>();
        }
        List<Object> single = new ArrayList<>();
        single.add(data);
        return single;
    }
}
