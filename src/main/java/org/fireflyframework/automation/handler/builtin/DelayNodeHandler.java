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
import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.config.DelayConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code delay}: waits {@code config.delay} milliseconds, capped at the configured maximum, then
 * emits {@code {delayed: true, delayMs, original}}.
 */
@Slf4j
public class DelayNodeHandler implements NodeHandler {

    static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

    private final Duration maxDelay;

    public DelayNodeHandler(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        Duration requested = node.typedConfig() instanceof DelayConfig config && config.delay() != null
                ? config.delay()
                : DEFAULT_DELAY;
        Duration delay = requested.isNegative() ? Duration.ZERO : requested;
        if (delay.compareTo(maxDelay) > 0) {
            log.debug("DELAY_CAPPED: nodeId={}, requestedMs={}, maxMs={}", node.id(), delay.toMillis(), maxDelay.toMillis());
            delay = maxDelay;
        }
        long delayMs = delay.toMillis();
        return Mono.delay(delay).map(tick -> {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("delayed", true);
            output.put("delayMs", delayMs);
            output.put("original", inputs);
            return output;
        });
    }
}
