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

package org.fireflyframework.automation.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.handler.NodeHandlerRegistry;
import org.fireflyframework.automation.handler.builtin.BuiltinNodeHandlers;
import org.fireflyframework.automation.model.Edge;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.ExecutionOptions;
import org.fireflyframework.automation.model.ExecutionReport;
import org.fireflyframework.automation.model.NodeExecutionEvent;
import org.fireflyframework.automation.model.NodeStatus;
import org.fireflyframework.automation.model.SchedulerStats;
import org.fireflyframework.automation.properties.AutomationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WorkflowScheduler} and {@link WorkflowExecution}.
 * <p>
 * Runs real graphs against the built-in handlers plus a few test handlers: {@code fail} always
 * errors, {@code flaky} errors on its first two attempts, {@code slow} completes after its
 * configured {@code delayMs} and {@code hang} never completes.
 */
class WorkflowSchedulerTest {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(10);

    private final AtomicInteger failAttempts = new AtomicInteger();
    private final AtomicInteger flakyAttempts = new AtomicInteger();
    private final List<NodeExecutionEvent> events = new CopyOnWriteArrayList<>();

    private AutomationProperties properties;
    private WorkflowScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        properties.getRetry().setInitialDelay(Duration.ofMillis(5));

        NodeHandlerRegistry.Builder registry = BuiltinNodeHandlers.register(NodeHandlerRegistry.builder(),
                new SafeEvaluator(), WebClient.create(), new ObjectMapper(),
                Duration.ofSeconds(1), Duration.ofSeconds(1));
        registry.register("fail", (node, inputs) -> {
            failAttempts.incrementAndGet();
            return Mono.error(new IllegalStateException("boom"));
        });
        registry.register("flaky", (node, inputs) -> flakyAttempts.incrementAndGet() <= 2
                ? Mono.error(new IllegalStateException("transient"))
                : Mono.just(Map.<String, Object>of("attempts", flakyAttempts.get())));
        registry.register("slow", (node, inputs) -> {
            long delayMs = ((Number) node.config().getOrDefault("delayMs", 20)).longValue();
            return Mono.delay(Duration.ofMillis(delayMs)).thenReturn(Map.<String, Object>of("id", node.id()));
        });
        registry.register("hang", (node, inputs) -> Mono.never());

        scheduler = new WorkflowScheduler(registry.build(), properties);
    }

    private ExecutionOptions.Builder options() {
        return ExecutionOptions.builder()
                .workflowId("wf-test")
                .onNodeExecution(events::add);
    }

    private static ExecutionNode node(String id, String type) {
        return ExecutionNode.builder(id, type).build();
    }

    private List<String> eventsFor(String nodeId, NodeStatus status) {
        return events.stream()
                .filter(event -> event.nodeId().equals(nodeId) && event.status() == status)
                .map(NodeExecutionEvent::nodeId)
                .toList();
    }

    // ========================================================================
    // Basic execution
    // ========================================================================

    @Nested
    @DisplayName("basic execution")
    class BasicExecutionTests {

        @Test
        @DisplayName("an empty workflow succeeds with an empty report")
        void emptyWorkflow() {
            StepVerifier.create(scheduler.execute(options().build()))
                    .assertNext(report -> {
                        assertThat(report.success()).isTrue();
                        assertThat(report.executionPath()).isEmpty();
                        assertThat(report.nodeResults()).isEmpty();
                        assertThat(report.errors()).isEmpty();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("independent nodes all start before any completes")
        void independentNodesStartTogether() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("a", "input").config("defaultValue", 1).build())
                    .node(ExecutionNode.builder("b", "input").config("defaultValue", 2).build())
                    .maxConcurrency(2)
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.success()).isTrue())
                    .verifyComplete();

            assertThat(events).extracting(NodeExecutionEvent::status)
                    .containsExactly(NodeStatus.RUNNING, NodeStatus.RUNNING, NodeStatus.COMPLETED, NodeStatus.COMPLETED);
        }

        @Test
        @DisplayName("a condition node evaluates against the initial data")
        void conditionAgainstInitialData() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("check", "condition")
                            .config("condition", "age >= 18 && hasLicense === true")
                            .build())
                    .initialData(Map.of("age", 21, "hasLicense", true))
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.nodeResults().get("check")).containsEntry("result", true))
                    .verifyComplete();
        }

        @Test
        @DisplayName("a chain runs in dependency order and reports output nodes as data")
        void chainRunsInOrder() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("A", "input").config("defaultValue", 20).build())
                    .node(ExecutionNode.builder("B", "expression").config("expression", "data + 1").build())
                    .node(node("C", "output"))
                    .edge("A", "B")
                    .edge("B", "C")
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isTrue();
                        assertThat(report.executionPath()).containsExactly("A", "B", "C");
                        assertThat(report.nodeResults().get("B")).containsEntry("result", 21.0);
                        assertThat(report.data()).containsOnlyKeys("C");
                        assertThat(report.data().get("C")).containsEntry("result", 21.0);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("explicit dependencies gate execution like edges")
        void explicitDependencies() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("last", "output").dependsOn("first").build())
                    .node(ExecutionNode.builder("first", "input").config("defaultValue", "x").build())
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.executionPath()).containsExactly("first", "last");
                        assertThat(report.nodeResults().get("last")).containsEntry("data", "x");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("named handles route a single field between nodes")
        void singleFieldRouting() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("calc", "expression").config("expression", "21 * 2").build())
                    .node(ExecutionNode.builder("next", "expression").config("expression", "value + 1").build())
                    .edge(Edge.of("calc", "result", "next", "value"))
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.nodeResults().get("next")).containsEntry("result", 43.0))
                    .verifyComplete();
        }

        @Test
        @DisplayName("a routed field missing upstream clears the target key")
        void missingRoutedField() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("calc", "expression").config("expression", "1").build())
                    .node(node("out", "output"))
                    .edge(Edge.of("calc", "absent", "out", "value"))
                    .initialData(Map.of("value", "stale"))
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.data().get("out"))
                            .containsEntry("value", null)
                            .doesNotContainKey("result"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("upstream outputs override initial data and node inputs")
        void inputPrecedence() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("src", "input").config("defaultValue", "upstream").build())
                    .node(ExecutionNode.builder("out", "output").input("data", "static").input("extra", 1).build())
                    .edge("src", "out")
                    .initialData(Map.of("data", "initial", "seed", true))
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.data().get("out"))
                            .containsEntry("data", "upstream")
                            .containsEntry("extra", 1)
                            .containsEntry("seed", true))
                    .verifyComplete();
        }

        @Test
        @DisplayName("a run can only be executed once")
        void singleUse() {
            WorkflowExecution execution = scheduler.prepare(options().node(node("a", "input")).build());

            StepVerifier.create(execution.execute()).expectNextCount(1).verifyComplete();
            StepVerifier.create(execution.execute()).expectError(IllegalStateException.class).verify();
        }
    }

    // ========================================================================
    // Ordering and concurrency
    // ========================================================================

    @Nested
    @DisplayName("ordering and concurrency")
    class OrderingTests {

        @Test
        @DisplayName("with one permit, independent nodes start in descending priority")
        void priorityOrder() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("low", "slow").priority(1).build())
                    .node(ExecutionNode.builder("high", "slow").priority(10).build())
                    .node(ExecutionNode.builder("mid", "slow").priority(5).build())
                    .maxConcurrency(1)
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.executionPath()).containsExactly("high", "mid", "low"))
                    .expectComplete().verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("running nodes never exceed maxConcurrency")
        void boundedConcurrency() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            ExecutionOptions.Builder builder = ExecutionOptions.builder()
                    .maxConcurrency(2)
                    .onNodeExecution(event -> {
                        if (event.status() == NodeStatus.RUNNING) {
                            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                        } else if (event.status().isTerminal()) {
                            running.decrementAndGet();
                        }
                    });
            for (int i = 0; i < 6; i++) {
                builder.node(ExecutionNode.builder("n" + i, "slow").config("delayMs", 15).build());
            }

            StepVerifier.create(scheduler.execute(builder.build()))
                    .assertNext(report -> assertThat(report.nodeResults()).hasSize(6))
                    .expectComplete().verify(VERIFY_TIMEOUT);

            assertThat(peak.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("a node starts only after all of its upstream nodes finished")
        void dependencyOrdering() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("fast", "slow").config("delayMs", 5).build())
                    .node(ExecutionNode.builder("slower", "slow").config("delayMs", 40).build())
                    .node(node("join", "output"))
                    .edge("fast", "join")
                    .edge("slower", "join")
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.executionPath().get(2)).isEqualTo("join"))
                    .expectComplete().verify(VERIFY_TIMEOUT);

            int joinStart = indexOf("join", NodeStatus.RUNNING);
            assertThat(joinStart).isGreaterThan(indexOf("fast", NodeStatus.COMPLETED));
            assertThat(joinStart).isGreaterThan(indexOf("slower", NodeStatus.COMPLETED));
        }

        private int indexOf(String nodeId, NodeStatus status) {
            for (int i = 0; i < events.size(); i++) {
                if (events.get(i).nodeId().equals(nodeId) && events.get(i).status() == status) {
                    return i;
                }
            }
            return -1;
        }
    }

    // ========================================================================
    // Failures and retries
    // ========================================================================

    @Nested
    @DisplayName("failures and retries")
    class FailureTests {

        @Test
        @DisplayName("retryCount 2 gives exactly three attempts before failing")
        void retriesThenFails() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("bad", "fail").retryCount(2).build())
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isFalse();
                        assertThat(report.errors()).containsEntry("bad", "boom");
                        assertThat(report.hasGlobalError()).isFalse();
                    })
                    .expectComplete().verify(VERIFY_TIMEOUT);

            assertThat(failAttempts).hasValue(3);
            assertThat(eventsFor("bad", NodeStatus.RETRYING)).hasSize(2);
            assertThat(events.get(events.size() - 1).attempt()).isEqualTo(3);
        }

        @Test
        @DisplayName("a transient failure recovers within the retry budget")
        void recoversAfterRetries() {
            ExecutionOptions run = options()
                    .node(node("sometimes", "flaky"))
                    .maxRetries(3)
                    .retryDelay(Duration.ofMillis(1))
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isTrue();
                        assertThat(report.nodeResults().get("sometimes")).containsEntry("attempts", 3);
                    })
                    .expectComplete().verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("no retries happen by default")
        void noRetryByDefault() {
            StepVerifier.create(scheduler.execute(options().node(node("bad", "fail")).build()))
                    .assertNext(report -> assertThat(report.errors()).containsOnlyKeys("bad"))
                    .verifyComplete();

            assertThat(failAttempts).hasValue(1);
        }

        @Test
        @DisplayName("sandbox violations are never retried")
        void securityErrorsNotRetried() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("evil", "expression")
                            .config("expression", "process.exit()")
                            .retryCount(3)
                            .build())
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.errors().get("evil"))
                            .isEqualTo("Function call 'process.exit' is not allowed"))
                    .verifyComplete();

            assertThat(eventsFor("evil", NodeStatus.RETRYING)).isEmpty();
        }

        @Test
        @DisplayName("a pathologically nested condition fails only its own node")
        void deeplyNestedCondition() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("deep", "condition")
                            .config("condition", "!".repeat(200_000) + "1")
                            .retryCount(2)
                            .build())
                    .node(ExecutionNode.builder("sibling", "input").config("defaultValue", 1).build())
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.errors()).containsEntry("deep", "Expression nesting too deep");
                        assertThat(report.hasGlobalError()).isFalse();
                        assertThat(report.nodeResults()).containsKey("sibling");
                    })
                    .expectComplete()
                    .verify(VERIFY_TIMEOUT);

            assertThat(eventsFor("deep", NodeStatus.RETRYING)).isEmpty();
        }

        @Test
        @DisplayName("a failing node does not stop its siblings or its dependents")
        void failureIsIsolated() {
            ExecutionOptions run = options()
                    .node(node("bad", "fail"))
                    .node(ExecutionNode.builder("good", "input").config("defaultValue", 1).build())
                    .node(node("after", "output"))
                    .edge("bad", "after")
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isFalse();
                        assertThat(report.errors()).containsOnlyKeys("bad");
                        assertThat(report.nodeResults()).containsKeys("good", "after");
                        assertThat(report.nodeResults()).doesNotContainKey("bad");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("a node timeout fails only that node")
        void nodeTimeout() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("stuck", "hang").timeout(Duration.ofMillis(50)).build())
                    .node(ExecutionNode.builder("fine", "input").build())
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.errors()).containsEntry("stuck", "Node stuck timed out after 50ms");
                        assertThat(report.nodeResults()).containsKey("fine");
                        assertThat(report.hasGlobalError()).isFalse();
                    })
                    .expectComplete().verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("an unknown node type aborts the run with a global error")
        void unknownType() {
            ExecutionOptions run = options()
                    .node(node("odd", "mystery"))
                    .node(ExecutionNode.builder("later", "output").dependsOn("odd").build())
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isFalse();
                        assertThat(report.errors()).containsEntry(ExecutionReport.GLOBAL_ERROR_KEY,
                                "No handler registered for node type: mystery");
                        assertThat(report.errors()).containsKey("odd");
                        assertThat(report.executionPath()).containsExactly("odd");
                    })
                    .expectComplete().verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("dangling references fail fast before any node runs")
        void danglingEdge() {
            ExecutionOptions run = options()
                    .node(node("a", "input"))
                    .edge("ghost", "a")
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isFalse();
                        assertThat(report.errors().get(ExecutionReport.GLOBAL_ERROR_KEY))
                                .contains("non-existent node 'ghost'");
                        assertThat(report.executionPath()).isEmpty();
                    })
                    .verifyComplete();

            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("cycles fail fast before any node runs")
        void cycle() {
            ExecutionOptions run = options()
                    .node(node("a", "output"))
                    .node(node("b", "output"))
                    .edge("a", "b")
                    .edge("b", "a")
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.errors().get(ExecutionReport.GLOBAL_ERROR_KEY))
                            .contains("Circular dependency"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("a throwing listener does not break the run")
        void listenerFailureIgnored() {
            ExecutionOptions run = ExecutionOptions.builder()
                    .node(node("a", "input"))
                    .onNodeExecution(event -> {
                        throw new IllegalStateException("listener bug");
                    })
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> assertThat(report.success()).isTrue())
                    .verifyComplete();
        }
    }

    // ========================================================================
    // Control: timeout, abort, step-by-step, stats
    // ========================================================================

    @Nested
    @DisplayName("run control")
    class ControlTests {

        @Test
        @DisplayName("the global deadline aborts the run and keeps partial results")
        void globalTimeout() {
            ExecutionOptions run = options()
                    .node(ExecutionNode.builder("done", "input").config("defaultValue", 1).build())
                    .node(node("stuck", "hang"))
                    .maxExecutionTime(Duration.ofMillis(100))
                    .build();

            StepVerifier.create(scheduler.execute(run))
                    .assertNext(report -> {
                        assertThat(report.success()).isFalse();
                        assertThat(report.errors()).containsEntry(ExecutionReport.GLOBAL_ERROR_KEY,
                                "Workflow execution timed out after 100ms");
                        assertThat(report.errors()).containsEntry("stuck", "Workflow execution aborted");
                        assertThat(report.nodeResults()).containsKey("done");
                    })
                    .expectComplete().verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("abort interrupts running nodes and skips pending ones")
        void abort() {
            WorkflowExecution execution = scheduler.prepare(options()
                    .node(node("stuck", "hang"))
                    .node(ExecutionNode.builder("next", "output").dependsOn("stuck").build())
                    .build());

            StepVerifier.create(execution.execute())
                    .then(execution::abort)
                    .assertNext(report -> {
                        assertThat(report.errors()).containsEntry(ExecutionReport.GLOBAL_ERROR_KEY,
                                "Workflow execution aborted");
                        assertThat(report.errors()).containsEntry("stuck", "Workflow execution aborted");
                        assertThat(report.executionPath()).containsExactly("stuck");
                    })
                    .expectComplete().verify(VERIFY_TIMEOUT);

            assertThat(execution.isAborted()).isTrue();
        }

        @Test
        @DisplayName("abort stops the retry loop")
        void abortDuringRetry() {
            WorkflowExecution execution = scheduler.prepare(options()
                    .node(ExecutionNode.builder("bad", "fail").retryCount(50).build())
                    .retryDelay(Duration.ofSeconds(30))
                    .build());

            StepVerifier.create(execution.execute())
                    .then(execution::abort)
                    .assertNext(report -> assertThat(report.errors()).containsEntry("bad", "Workflow execution aborted"))
                    .expectComplete().verify(VERIFY_TIMEOUT);

            assertThat(failAttempts).hasValue(1);
        }

        @Test
        @DisplayName("step-by-step mode runs one node per confirmation")
        void stepByStep() {
            WorkflowExecution execution = scheduler.prepare(options()
                    .node(ExecutionNode.builder("a", "input").config("defaultValue", 1).build())
                    .node(node("b", "output"))
                    .edge("a", "b")
                    .stepByStep(true)
                    .build());

            StepVerifier.create(execution.execute())
                    .expectSubscription()
                    .expectNoEvent(Duration.ofMillis(50))
                    .then(() -> {
                        assertThat(execution.getStats().completedNodes()).isZero();
                        assertThat(execution.confirmNextStep()).isTrue();
                        assertThat(execution.getStats().completedNodes()).isEqualTo(1);
                        assertThat(execution.getStats().runningNodes()).containsExactly("b");
                    })
                    .expectNoEvent(Duration.ofMillis(50))
                    .then(() -> assertThat(execution.confirmNextStep()).isTrue())
                    .assertNext(report -> assertThat(report.executionPath()).containsExactly("a", "b"))
                    .expectComplete().verify(VERIFY_TIMEOUT);

            assertThat(execution.confirmNextStep()).isFalse();
        }

        @Test
        @DisplayName("stats reflect the finished run")
        void stats() {
            WorkflowExecution execution = scheduler.prepare(options()
                    .node(node("ok", "input"))
                    .node(node("bad", "fail"))
                    .maxConcurrency(3)
                    .build());

            StepVerifier.create(execution.execute()).expectNextCount(1).verifyComplete();

            SchedulerStats stats = execution.getStats();
            assertThat(stats.runningNodes()).isEmpty();
            assertThat(stats.completedNodes()).isEqualTo(1);
            assertThat(stats.failedNodes()).isEqualTo(1);
            assertThat(stats.availableConcurrency()).isEqualTo(3);
            assertThat(stats.elapsedTime()).isEqualTo(execution.getStats().elapsedTime());
        }

        @Test
        @DisplayName("engine defaults apply when the run leaves values unset")
        void engineDefaults() {
            properties.getRetry().setMaxRetries(1);
            properties.setMaxConcurrency(4);
            WorkflowExecution execution = scheduler.prepare(options().node(node("bad", "fail")).build());

            StepVerifier.create(execution.execute()).expectNextCount(1).expectComplete().verify(VERIFY_TIMEOUT);

            assertThat(failAttempts).hasValue(2);
            assertThat(execution.getStats().availableConcurrency()).isEqualTo(4);
        }
    }
}
