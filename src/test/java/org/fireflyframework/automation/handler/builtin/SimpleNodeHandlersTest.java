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
import org.fireflyframework.automation.expression.SafeEvaluationException;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.model.ExecutionNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the input, trigger, output, condition and delay handlers.
 */
class SimpleNodeHandlersTest {

    @Test
    @DisplayName("input should emit its default value")
    void inputEmitsDefault() {
        ExecutionNode node = ExecutionNode.builder("in", "input").config("defaultValue", 5).build();

        StepVerifier.create(new InputNodeHandler().handle(node, Map.of()))
                .assertNext(output -> assertThat(output).containsEntry("data", 5))
                .verifyComplete();
    }

    @Test
    @DisplayName("trigger should prefer mock data over the incoming payload")
    void triggerUsesMockData() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        TriggerNodeHandler handler = new TriggerNodeHandler(clock);
        ExecutionNode mocked = ExecutionNode.builder("t", "trigger").config("mockData", Map.of("id", 1)).build();
        ExecutionNode plain = ExecutionNode.builder("t", "webhook").build();

        StepVerifier.create(handler.handle(mocked, Map.of("payload", "ignored")))
                .assertNext(output -> {
                    assertThat(output).containsEntry("triggered", true);
                    assertThat(output).containsEntry("timestamp", 1_700_000_000_000L);
                    assertThat(output).containsEntry("payload", Map.of("id", 1));
                })
                .verifyComplete();
        StepVerifier.create(handler.handle(plain, Map.of("payload", "body")))
                .assertNext(output -> assertThat(output).containsEntry("payload", "body"))
                .verifyComplete();
    }

    @Test
    @DisplayName("output should echo its inputs")
    void outputEchoesInputs() {
        ExecutionNode node = ExecutionNode.builder("out", "output").build();

        StepVerifier.create(new OutputNodeHandler().handle(node, Map.of("result", 42)))
                .assertNext(output -> assertThat(output).containsExactlyEntriesOf(Map.of("result", 42)))
                .verifyComplete();
    }

    @Test
    @DisplayName("condition should evaluate to a boolean result")
    void conditionEvaluates() {
        ConditionNodeHandler handler = new ConditionNodeHandler(new SafeEvaluator());
        ExecutionNode node = ExecutionNode.builder("check", "condition").config("condition", "amount > 100").build();

        StepVerifier.create(handler.handle(node, Map.of("amount", 250)))
                .assertNext(output -> assertThat(output).containsEntry("result", true))
                .verifyComplete();
        StepVerifier.create(handler.handle(node, Map.of("amount", 50)))
                .assertNext(output -> assertThat(output).containsEntry("result", false))
                .verifyComplete();
    }

    @Test
    @DisplayName("condition should fail without a condition or with a blocked one")
    void conditionFailures() {
        ConditionNodeHandler handler = new ConditionNodeHandler(new SafeEvaluator());

        StepVerifier.create(handler.handle(ExecutionNode.builder("c", "condition").build(), Map.of()))
                .expectError(NodeExecutionException.class)
                .verify();
        StepVerifier.create(handler.handle(
                        ExecutionNode.builder("c", "condition").config("condition", "process.exit()").build(), Map.of()))
                .expectError(SafeEvaluationException.class)
                .verify();
    }

    @Test
    @DisplayName("delay should wait the configured time, capped at the maximum")
    void delayIsCapped() {
        DelayNodeHandler handler = new DelayNodeHandler(Duration.ofMillis(50));
        ExecutionNode node = ExecutionNode.builder("wait", "delay").config("delay", 10_000).build();

        StepVerifier.create(handler.handle(node, Map.of("x", 1)))
                .assertNext(output -> {
                    assertThat(output).containsEntry("delayed", true);
                    assertThat(output).containsEntry("delayMs", 50L);
                    assertThat(output).containsEntry("original", Map.of("x", 1));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("delay should default to one second")
    void delayDefaults() {
        DelayNodeHandler handler = new DelayNodeHandler(Duration.ofSeconds(5));
        ExecutionNode node = ExecutionNode.builder("wait", "delay").build();

        StepVerifier.withVirtualTime(() -> handler.handle(node, Map.of()))
                .expectSubscription()
                .thenAwait(DelayNodeHandler.DEFAULT_DELAY)
                .assertNext(output -> assertThat(output).containsEntry("delayMs", 1000L))
                .verifyComplete();
    }
}
