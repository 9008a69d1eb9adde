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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.concurrent.PermitGate;
import org.fireflyframework.automation.exception.NodeTimeoutException;
import org.fireflyframework.automation.exception.SchedulingException;
import org.fireflyframework.automation.exception.WorkflowAbortedException;
import org.fireflyframework.automation.exception.WorkflowValidationException;
import org.fireflyframework.automation.expression.SafeEvaluationException;
import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.handler.NodeHandlerRegistry;
import org.fireflyframework.automation.metrics.WorkflowMetrics;
import org.fireflyframework.automation.model.Edge;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.ExecutionOptions;
import org.fireflyframework.automation.model.ExecutionReport;
import org.fireflyframework.automation.model.NodeExecutionEvent;
import org.fireflyframework.automation.model.NodeStatus;
import org.fireflyframework.automation.model.RetryPolicy;
import org.fireflyframework.automation.model.SchedulerStats;
import org.fireflyframework.automation.resilience.WorkflowResilience;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One run of a workflow graph.
 * <p>
 * Scheduling follows Kahn's algorithm: every node tracks how many of its dependencies have not
 * reached a terminal state yet, and a node whose count drops to zero joins the ready queue.
 * Ready nodes are taken in descending priority order, admitted through a {@link PermitGate},
 * and executed with a per-attempt timeout and exponential backoff between retries. A failed
 * node is terminal too, so its dependents still run, just without its output.
 * <p>
 * All bookkeeping is guarded by this object's monitor. Launching is done by a single drain loop
 * that re-entrant callers only signal, so completions arriving on any thread never recurse into
 * the scheduler and the stack depth stays constant regardless of graph size.
 * <p>
 * Instances are single-use: {@link #execute()} may be subscribed to once. {@link #abort()},
 * {@link #confirmNextStep()} and {@link #getStats()} may be called from any thread.
 */
@Slf4j
public class WorkflowExecution {

    private static final String ABORTED_MESSAGE = "Workflow execution aborted";
    private static final Comparator<ReadyNode> READY_ORDER = Comparator
            .comparingInt((ReadyNode ready) -> ready.node().priority()).reversed()
            .thenComparingLong(ReadyNode::sequence);

    private final ExecutionOptions options;
    private final DependencyGraph graph;
    private final NodeHandlerRegistry registry;
    private final WorkflowMetrics metrics;
    private final WorkflowResilience resilience;
    private final PermitGate permits;
    private final StepGate stepGate = new StepGate();
    private final Duration maxExecutionTime;
    private final Duration defaultNodeTimeout;
    private final int defaultRetries;
    private final Duration retryDelay;
    private final Duration maxRetryDelay;
    private final double retryMultiplier;

    private final Map<String, NodeStatus> statuses = new LinkedHashMap<>();
    private final Map<String, Integer> remainingDependencies = new HashMap<>();
    private final PriorityQueue<ReadyNode> ready = new PriorityQueue<>(READY_ORDER);
    private final Deque<ExecutionNode> admitted = new ArrayDeque<>();
    private final Set<String> running = new LinkedHashSet<>();
    private final Map<String, Long> nodeStartNanos = new HashMap<>();
    private final Map<String, Map<String, Object>> nodeResults = new LinkedHashMap<>();
    private final Map<String, String> nodeErrors = new LinkedHashMap<>();
    private final List<String> executionPath = new ArrayList<>();
    private long readySequence;
    private int inFlight;
    private int completedCount;
    private int failedCount;
    private String globalError;
    private boolean aborted;
    private long startNanos;
    private long endNanos;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicInteger drainWip = new AtomicInteger();
    private final Sinks.One<Void> abortSignal = Sinks.one();
    private final Sinks.One<Void> done = Sinks.one();

    WorkflowExecution(ExecutionOptions options,
                      NodeHandlerRegistry registry,
                      SchedulerDefaults defaults,
                      @Nullable WorkflowMetrics metrics,
                      @Nullable WorkflowResilience resilience) {
        this.options = options;
        this.registry = registry;
        this.metrics = metrics;
        this.resilience = resilience;
        this.graph = new DependencyGraph(options.workflowId(), options.nodes(), options.edges());
        this.permits = new PermitGate(options.maxConcurrency() != null
                ? options.maxConcurrency() : defaults.maxConcurrency());
        this.maxExecutionTime = options.maxExecutionTime() != null
                ? options.maxExecutionTime() : defaults.maxExecutionTime();
        this.defaultNodeTimeout = options.defaultNodeTimeout() != null
                ? options.defaultNodeTimeout() : defaults.defaultNodeTimeout();
        this.defaultRetries = options.maxRetries() != null ? options.maxRetries() : defaults.maxRetries();
        this.retryDelay = options.retryDelay() != null ? options.retryDelay() : defaults.retryDelay();
        this.maxRetryDelay = defaults.maxRetryDelay();
        this.retryMultiplier = defaults.retryMultiplier();
        options.nodes().forEach(node -> statuses.putIfAbsent(node.id(), NodeStatus.PENDING));
    }

    public String getWorkflowId() {
        return options.workflowId();
    }

    /**
     * Runs the workflow.
     *
     * @return a Mono emitting the report once every reachable node is terminal, the run was
     *         aborted or the global deadline passed; errors only if subscribed more than once
     */
    public Mono<ExecutionReport> execute() {
        return Mono.defer(() -> {
            if (!started.compareAndSet(false, true)) {
                return Mono.error(new IllegalStateException(
                        "Workflow execution " + options.workflowId() + " has already been started"));
            }
            synchronized (this) {
                startNanos = System.nanoTime();
            }
            log.info("WORKFLOW_START: workflowId={}, nodes={}, edges={}, stepByStep={}, maxConcurrency={}",
                    options.workflowId(), options.nodes().size(), options.edges().size(),
                    options.stepByStep(), permits.limit());
            if (metrics != null) {
                metrics.recordWorkflowStarted(options.workflowId(), options.nodes().size());
            }

            try {
                graph.validate();
            } catch (WorkflowValidationException e) {
                log.warn("WORKFLOW_INVALID: workflowId={}, error={}", options.workflowId(), e.getMessage());
                synchronized (this) {
                    globalError = e.getMessage();
                }
                markFinished();
                return Mono.fromCallable(this::completeReport);
            }
            if (log.isDebugEnabled()) {
                log.debug("WORKFLOW_PLAN: workflowId={}, layers={}", options.workflowId(),
                        graph.buildExecutionLayers().stream()
                                .map(layer -> layer.stream().map(ExecutionNode::id).toList())
                                .toList());
            }

            synchronized (this) {
                for (ExecutionNode node : graph.getNodes()) {
                    remainingDependencies.put(node.id(), graph.getDependencies(node.id()).size());
                }
                for (ExecutionNode root : graph.getRootNodes()) {
                    ready.add(new ReadyNode(root, readySequence++));
                }
            }
            drain();

            return done.asMono()
                    .timeout(maxExecutionTime, Mono.defer(() -> {
                        onGlobalTimeout();
                        return done.asMono();
                    }))
                    .then(Mono.fromCallable(this::completeReport));
        });
    }

    /**
     * Requests cooperative cancellation. No further node is started; running attempts, backoff
     * delays and step confirmations are interrupted and reported as failures.
     */
    public void abort() {
        synchronized (this) {
            if (aborted) {
                return;
            }
            aborted = true;
            if (globalError == null) {
                globalError = ABORTED_MESSAGE;
            }
            ready.clear();
        }
        log.warn("WORKFLOW_ABORT: workflowId={}", options.workflowId());
        abortSignal.tryEmitEmpty();
        drain();
    }

    /**
     * Releases the oldest node waiting for confirmation in step-by-step mode.
     *
     * @return {@code false} when no node is currently waiting
     */
    public boolean confirmNextStep() {
        boolean confirmed = stepGate.confirmNext();
        log.debug("STEP_CONFIRM: workflowId={}, released={}", options.workflowId(), confirmed);
        return confirmed;
    }

    public synchronized SchedulerStats getStats() {
        return new SchedulerStats(List.copyOf(running), completedCount, failedCount, elapsed(),
                permits.availablePermits());
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    // ==================== Scheduling ====================

    private void drain() {
        if (drainWip.getAndIncrement() != 0) {
            return;
        }
        do {
            List<ExecutionNode> wave = new ArrayList<>();
            List<ExecutionNode> abandoned = new ArrayList<>();
            synchronized (this) {
                while (!ready.isEmpty()) {
                    wave.add(ready.poll().node());
                    inFlight++;
                }
            }

            List<ExecutionNode> startable = new ArrayList<>();
            for (ExecutionNode node : wave) {
                if (permits.tryAcquire()) {
                    startable.add(node);
                } else {
                    awaitPermit(node);
                }
            }
            synchronized (this) {
                startable.addAll(admitted);
                admitted.clear();
                if (aborted) {
                    abandoned.addAll(startable);
                    startable.clear();
                }
            }
            abandoned.forEach(node -> {
                permits.release();
                abandon(node);
            });

            startable.forEach(this::markStarted);
            startable.forEach(this::runNode);

            checkCompletion();
        } while (drainWip.decrementAndGet() != 0);
    }

    private void awaitPermit(ExecutionNode node) {
        Mono.firstWithSignal(permits.acquire().thenReturn(true), abortSignal.asMono().thenReturn(false))
                .subscribe(granted -> {
                    if (granted) {
                        synchronized (this) {
                            admitted.add(node);
                        }
                        drain();
                    } else {
                        abandon(node);
                    }
                });
    }

    private void abandon(ExecutionNode node) {
        log.debug("NODE_ABANDONED: workflowId={}, nodeId={}", options.workflowId(), node.id());
        synchronized (this) {
            inFlight--;
        }
        drain();
    }

    private void markStarted(ExecutionNode node) {
        synchronized (this) {
            statuses.put(node.id(), NodeStatus.RUNNING);
            running.add(node.id());
            executionPath.add(node.id());
            nodeStartNanos.put(node.id(), System.nanoTime());
        }
        log.info("NODE_START: workflowId={}, nodeId={}, type={}, priority={}",
                options.workflowId(), node.id(), node.type(), node.priority());
        if (metrics != null) {
            metrics.recordNodeStarted(node.type());
        }
        notifyListener(node, NodeStatus.RUNNING, 1, null, null);
    }

    private void runNode(ExecutionNode node) {
        AtomicInteger attempts = new AtomicInteger();
        Mono.defer(() -> {
                    NodeHandler handler = registry.handlerFor(node.type());
                    Map<String, Object> inputs = gatherInputs(node);
                    Mono<Void> confirmation = options.stepByStep() ? abortable(stepGate.await()) : Mono.empty();
                    return confirmation.then(Mono.defer(() ->
                            attempt(node, handler, inputs, retryPolicyFor(node), timeoutFor(node), 1, attempts)));
                })
                .subscribe(
                        output -> finishNode(node, output, null, attempts.get()),
                        error -> finishNode(node, null, error, Math.max(1, attempts.get())));
    }

    private Mono<Map<String, Object>> attempt(ExecutionNode node, NodeHandler handler, Map<String, Object> inputs,
                                              RetryPolicy retryPolicy, Duration timeout, int attempt,
                                              AtomicInteger attempts) {
        attempts.set(attempt);
        Mono<Map<String, Object>> call = Mono.defer(() -> handler.handle(node, new LinkedHashMap<>(inputs)))
                .defaultIfEmpty(Map.of())
                .timeout(timeout, Mono.error(() -> new NodeTimeoutException(node.id(), timeout)));
        if (resilience != null) {
            call = resilience.decorateNode(node.type(), call);
        }

        return abortable(call).onErrorResume(error -> {
            if (!isRetryable(error) || !retryPolicy.shouldRetry(attempt) || isAborted()) {
                return Mono.error(error);
            }
            int nextAttempt = attempt + 1;
            Duration delay = retryPolicy.getDelayForAttempt(nextAttempt);
            log.warn("NODE_RETRY: workflowId={}, nodeId={}, failedAttempt={}, maxAttempts={}, delayMs={}, error={}",
                    options.workflowId(), node.id(), attempt, retryPolicy.maxAttempts(), delay.toMillis(),
                    error.getMessage());
            synchronized (this) {
                statuses.put(node.id(), NodeStatus.RETRYING);
            }
            if (metrics != null) {
                metrics.recordNodeRetry(node.type(), nextAttempt);
            }
            notifyListener(node, NodeStatus.RETRYING, attempt, null, messageOf(error));
            return abortable(Mono.delay(delay))
                    .then(Mono.defer(() -> {
                        synchronized (this) {
                            statuses.put(node.id(), NodeStatus.RUNNING);
                        }
                        return attempt(node, handler, inputs, retryPolicy, timeout, nextAttempt, attempts);
                    }));
        });
    }

    private void finishNode(ExecutionNode node, @Nullable Map<String, Object> output,
                            @Nullable Throwable error, int attempts) {
        boolean fatal = error instanceof SchedulingException;
        NodeStatus status = error == null ? NodeStatus.COMPLETED : NodeStatus.FAILED;
        Map<String, Object> result = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : null;
        String message = error != null ? messageOf(error) : null;
        Duration duration;

        synchronized (this) {
            statuses.put(node.id(), status);
            running.remove(node.id());
            Long nodeStart = nodeStartNanos.get(node.id());
            duration = Duration.ofNanos(System.nanoTime() - (nodeStart != null ? nodeStart : startNanos));
            if (error == null) {
                completedCount++;
                nodeResults.put(node.id(), result);
            } else {
                failedCount++;
                nodeErrors.put(node.id(), message);
                if (fatal && globalError == null) {
                    globalError = message;
                }
            }
            for (String dependentId : graph.getDependents(node.id())) {
                int remaining = remainingDependencies.merge(dependentId, -1, Integer::sum);
                if (remaining == 0 && !aborted && statuses.get(dependentId) == NodeStatus.PENDING) {
                    graph.getNode(dependentId).ifPresent(dependent ->
                            ready.add(new ReadyNode(dependent, readySequence++)));
                }
            }
            inFlight--;
        }

        if (error == null) {
            log.info("NODE_COMPLETE: workflowId={}, nodeId={}, attempts={}, durationMs={}",
                    options.workflowId(), node.id(), attempts, duration.toMillis());
        } else {
            log.error("NODE_FAILED: workflowId={}, nodeId={}, attempts={}, durationMs={}, error={}",
                    options.workflowId(), node.id(), attempts, duration.toMillis(), message);
        }
        if (metrics != null) {
            metrics.recordNodeCompleted(node.type(), status, duration);
        }
        notifyListener(node, status, attempts, result, message);
        permits.release();

        if (fatal) {
            abort();
        }
        drain();
    }

    private void checkCompletion() {
        boolean complete;
        synchronized (this) {
            complete = started.get() && inFlight == 0 && ready.isEmpty() && admitted.isEmpty();
        }
        if (complete) {
            markFinished();
        }
    }

    private void markFinished() {
        if (finished.compareAndSet(false, true)) {
            synchronized (this) {
                endNanos = System.nanoTime();
            }
            done.tryEmitEmpty();
        }
    }

    private void onGlobalTimeout() {
        synchronized (this) {
            if (globalError == null) {
                globalError = "Workflow execution timed out after " + maxExecutionTime.toMillis() + "ms";
            }
        }
        log.error("WORKFLOW_TIMEOUT: workflowId={}, maxExecutionTimeMs={}",
                options.workflowId(), maxExecutionTime.toMillis());
        abort();
    }

    // ==================== Inputs, policies and results ====================

    private synchronized Map<String, Object> gatherInputs(ExecutionNode node) {
        Map<String, Object> inputs = new LinkedHashMap<>(options.initialData());
        inputs.putAll(node.inputs());
        Set<String> merged = new LinkedHashSet<>();
        for (Edge edge : graph.getIncomingEdges(node.id())) {
            Map<String, Object> upstream = nodeResults.get(edge.source());
            if (upstream == null) {
                continue;
            }
            if (edge.routesSingleField()) {
                inputs.put(edge.targetHandle(), upstream.get(edge.sourceHandle()));
            } else {
                inputs.putAll(upstream);
                merged.add(edge.source());
            }
        }
        for (String dependencyId : node.dependencies()) {
            Map<String, Object> upstream = nodeResults.get(dependencyId);
            if (upstream != null && merged.add(dependencyId)) {
                inputs.putAll(upstream);
            }
        }
        return inputs;
    }

    private RetryPolicy retryPolicyFor(ExecutionNode node) {
        int retries = node.retryCount() != null ? node.retryCount() : defaultRetries;
        if (retries == 0) {
            return RetryPolicy.NO_RETRY;
        }
        return new RetryPolicy(retries + 1, retryDelay, maxRetryDelay, retryMultiplier);
    }

    private Duration timeoutFor(ExecutionNode node) {
        return node.timeout() != null ? node.timeout() : defaultNodeTimeout;
    }

    private ExecutionReport completeReport() {
        ExecutionReport report = buildReport();
        log.info("WORKFLOW_COMPLETE: workflowId={}, success={}, completed={}, failed={}, durationMs={}",
                report.workflowId(), report.success(), completedCount, failedCount,
                report.executionTime().toMillis());
        if (metrics != null) {
            metrics.recordWorkflowCompleted(report.workflowId(), report.success(), report.executionTime());
        }
        return report;
    }

    private synchronized ExecutionReport buildReport() {
        Map<String, String> errors = new LinkedHashMap<>();
        if (globalError != null) {
            errors.put(ExecutionReport.GLOBAL_ERROR_KEY, globalError);
        }
        errors.putAll(nodeErrors);

        Map<String, Map<String, Object>> data = new LinkedHashMap<>();
        for (ExecutionNode node : options.nodes()) {
            if ("output".equals(node.type()) && nodeResults.containsKey(node.id())) {
                data.put(node.id(), nodeResults.get(node.id()));
            }
        }
        return new ExecutionReport(options.workflowId(), errors.isEmpty(), data, errors,
                executionPath, elapsed(), nodeResults);
    }

    private Duration elapsed() {
        if (startNanos == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((endNanos != 0 ? endNanos : System.nanoTime()) - startNanos);
    }

    // ==================== Helpers ====================

    private <T> Mono<T> abortable(Mono<T> source) {
        return Mono.firstWithSignal(source,
                abortSignal.asMono().then(Mono.error(() -> new WorkflowAbortedException(ABORTED_MESSAGE))));
    }

    private static boolean isRetryable(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SafeEvaluationException
                    || current instanceof SchedulingException
                    || current instanceof WorkflowAbortedException) {
                return false;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return true;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void notifyListener(ExecutionNode node, NodeStatus status, int attempt,
                                @Nullable Map<String, Object> output, @Nullable String error) {
        if (options.onNodeExecution() == null) {
            return;
        }
        NodeExecutionEvent event = new NodeExecutionEvent(options.workflowId(), node.id(), node.type(),
                status, attempt, output, error, Instant.now());
        try {
            options.onNodeExecution().onNodeExecution(event);
        } catch (RuntimeException e) {
            log.warn("Node execution listener failed: workflowId={}, nodeId={}, status={}",
                    options.workflowId(), node.id(), status, e);
        }
    }

    private record ReadyNode(ExecutionNode node, long sequence) {
    }
}
