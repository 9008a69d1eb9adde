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

package org.fireflyframework.automation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.model.NodeStatus;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides Micrometer metrics for workflow execution monitoring.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>workflow.started</b> - Counter of runs started</li>
 *   <li><b>workflow.completed</b> - Counter of runs finished (tags: outcome)</li>
 *   <li><b>workflow.duration</b> - Timer for run duration (tags: outcome)</li>
 *   <li><b>workflow.active</b> - Gauge of runs in progress</li>
 *   <li><b>node.started</b> - Counter of nodes started (tags: nodeType)</li>
 *   <li><b>node.completed</b> - Counter of nodes finished (tags: nodeType, status)</li>
 *   <li><b>node.duration</b> - Timer for node duration including retries (tags: nodeType, status)</li>
 *   <li><b>node.retries</b> - Counter of node retry attempts (tags: nodeType)</li>
 *   <li><b>expression.rejected</b> - Counter of expressions refused by the safe evaluator</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.automation.". Run identifiers are logged, not tagged,
 * to keep tag cardinality bounded.
 */
@Slf4j
public class WorkflowMetrics {

    private static final String METRIC_PREFIX = "firefly.automation.";

    // Tag names
    private static final String TAG_NODE_TYPE = "nodeType";
    private static final String TAG_STATUS = "status";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeWorkflows = new AtomicInteger();

    public WorkflowMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(METRIC_PREFIX + "workflow.active", activeWorkflows, AtomicInteger::get)
                .description("Number of workflow runs in progress")
                .register(meterRegistry);
        log.info("WorkflowMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    // ==================== Workflow Metrics ====================

    public void recordWorkflowStarted(String workflowId, int nodeCount) {
        Counter.builder(METRIC_PREFIX + "workflow.started")
                .description("Number of workflow runs started")
                .register(meterRegistry)
                .increment();
        activeWorkflows.incrementAndGet();

        log.debug("METRIC: workflow.started workflowId={}, nodes={}", workflowId, nodeCount);
    }

    /**
     * Records the end of a run.
     *
     * @param workflowId the run identifier
     * @param success whether the run finished without errors
     * @param duration the run duration
     */
    public void recordWorkflowCompleted(String workflowId, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";

        Counter.builder(METRIC_PREFIX + "workflow.completed")
                .description("Number of workflow runs completed")
                .tag(TAG_OUTCOME, outcome)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "workflow.duration")
                .description("Workflow run duration")
                .tag(TAG_OUTCOME, outcome)
                .register(meterRegistry)
                .record(duration);

        if (activeWorkflows.get() > 0) {
            activeWorkflows.decrementAndGet();
        }

        log.debug("METRIC: workflow.completed workflowId={}, outcome={}, durationMs={}",
                workflowId, outcome, duration.toMillis());
    }

    // ==================== Node Metrics ====================

    public void recordNodeStarted(String nodeType) {
        Counter.builder(METRIC_PREFIX + "node.started")
                .description("Number of nodes started")
                .tag(TAG_NODE_TYPE, normalizeTag(nodeType))
                .register(meterRegistry)
                .increment();
    }

    /**
     * Records that a node reached a terminal status.
     *
     * @param nodeType the node type
     * @param status {@link NodeStatus#COMPLETED} or {@link NodeStatus#FAILED}
     * @param duration time from start to the terminal status, retries included
     */
    public void recordNodeCompleted(String nodeType, NodeStatus status, Duration duration) {
        String statusTag = status.name().toLowerCase();

        Counter.builder(METRIC_PREFIX + "node.completed")
                .description("Number of nodes completed")
                .tag(TAG_NODE_TYPE, normalizeTag(nodeType))
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "node.duration")
                .description("Node execution duration")
                .tag(TAG_NODE_TYPE, normalizeTag(nodeType))
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .record(duration);
    }

    public void recordNodeRetry(String nodeType, int attemptNumber) {
        Counter.builder(METRIC_PREFIX + "node.retries")
                .description("Number of node retry attempts")
                .tag(TAG_NODE_TYPE, normalizeTag(nodeType))
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: node.retry nodeType={}, attempt={}", nodeType, attemptNumber);
    }

    // ==================== Expression Metrics ====================

    public void recordExpressionRejected() {
        Counter.builder(METRIC_PREFIX + "expression.rejected")
                .description("Number of expressions rejected by the safe evaluator")
                .register(meterRegistry)
                .increment();
    }

    private String normalizeTag(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        // Replace special characters that might cause issues in metric systems
        return value.replaceAll("[^a-zA-Z0-9._-]", "_").toLowerCase();
    }
}
