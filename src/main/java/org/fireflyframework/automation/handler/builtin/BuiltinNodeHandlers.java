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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.handler.NodeHandlerRegistry;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Registers the node types every engine understands.
 * <p>
 * {@code trigger} and {@code webhook} share one handler, as do {@code expression} and
 * {@code code}, and {@code data-transform} and {@code transform}.
 */
public final class BuiltinNodeHandlers {

    private BuiltinNodeHandlers() {
    }

    /**
     * Adds the built-in handlers to a registry builder.
     *
     * @param registry the builder to populate
     * @param evaluator the evaluator used by expression-based nodes
     * @param webClient client used by {@code http-request}
     * @param objectMapper mapper used to parse JSON response bodies
     * @param httpTimeout default timeout of {@code http-request}
     * @param maxDelay upper bound of {@code delay}
     * @return the same builder
     */
    public static NodeHandlerRegistry.Builder register(NodeHandlerRegistry.Builder registry,
                                                       SafeEvaluator evaluator,
                                                       WebClient webClient,
                                                       ObjectMapper objectMapper,
                                                       Duration httpTimeout,
                                                       Duration maxDelay) {
        TriggerNodeHandler trigger = new TriggerNodeHandler();
        ExpressionNodeHandler expression = new ExpressionNodeHandler(evaluator);
        DataTransformNodeHandler transform = new DataTransformNodeHandler(evaluator);

        return registry
                .register("input", new InputNodeHandler())
                .register("trigger", trigger)
                .register("webhook", trigger)
                .register("output", new OutputNodeHandler())
                .register("condition", new ConditionNodeHandler(evaluator))
                .register("expression", expression)
                .register("code", expression)
                .register("data-transform", transform)
                .register("transform", transform)
                .register("http-request", new HttpRequestNodeHandler(webClient, objectMapper, httpTimeout))
                .register("delay", new DelayNodeHandler(maxDelay));
    }
}
