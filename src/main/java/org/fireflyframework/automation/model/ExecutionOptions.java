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

package org.fireflyframework.automation.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything needed to run one workflow.
 * <p>
 * Unset tuning values ({@code null}) fall back to the engine's configured defaults.
 *
 * @param workflowId identifier used in logs, metrics and events
 * @param nodes the nodes to run
 * @param edges connections between nodes
 * @param initialData data merged into every node's inputs first
 * @param stepByStep whether each node waits for an explicit confirmation before running
 * @param maxExecutionTime global deadline for the run
 * @param maxRetries default retries per node
 * @param maxConcurrency maximum nodes running at once
 * @param defaultNodeTimeout default per-attempt timeout
 * @param retryDelay base backoff delay, doubled for every further retry
 * @param onNodeExecution optional progress listener
 */
public record ExecutionOptions(
        String workflowId,
        List<ExecutionNode> nodes,
        List<Edge> edges,
        Map<String, Object> initialData,
        boolean stepByStep,
        @Nullable Duration maxExecutionTime,
        @Nullable Integer maxRetries,
        @Nullable Integer maxConcurrency,
        @Nullable Duration defaultNodeTimeout,
        @Nullable Duration retryDelay,
        @Nullable NodeExecutionListener onNodeExecution
) {

    public ExecutionOptions {
        if (workflowId == null || workflowId.isBlank()) {
            workflowId = UUID.randomUUID().toString();
        }
        nodes = ModelMaps.copy(nodes);
        edges = ModelMaps.copy(edges);
        initialData = ModelMaps.copy(initialData);
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (maxConcurrency != null && maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String workflowId;
        private List<ExecutionNode> nodes = new ArrayList<>();
        private List<Edge> edges = new ArrayList<>();
        private Map<String, Object> initialData = new HashMap<>();
        private boolean stepByStep;
        private Duration maxExecutionTime;
        private Integer maxRetries;
        private Integer maxConcurrency;
        private Duration defaultNodeTimeout;
        private Duration retryDelay;
        private NodeExecutionListener onNodeExecution;

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder nodes(List<ExecutionNode> nodes) {
            this.nodes = new ArrayList<>(nodes);
            return this;
        }

        public Builder node(ExecutionNode node) {
            this.nodes.add(node);
            return this;
        }

        public Builder edges(List<Edge> edges) {
            this.edges = new ArrayList<>(edges);
            return this;
        }

        public Builder edge(String source, String target) {
            this.edges.add(Edge.of(source, target));
            return this;
        }

        public Builder edge(Edge edge) {
            this.edges.add(edge);
            return this;
        }

        public Builder initialData(Map<String, Object> initialData) {
            this.initialData = new HashMap<>(initialData);
            return this;
        }

        public Builder stepByStep(boolean stepByStep) {
            this.stepByStep = stepByStep;
            return this;
        }

        public Builder maxExecutionTime(Duration maxExecutionTime) {
            this.maxExecutionTime = maxExecutionTime;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxConcurrency(Integer maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder defaultNodeTimeout(Duration defaultNodeTimeout) {
            this.defaultNodeTimeout = defaultNodeTimeout;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder onNodeExecution(NodeExecutionListener onNodeExecution) {
            this.onNodeExecution = onNodeExecution;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(workflowId, nodes, edges, initialData, stepByStep, maxExecutionTime,
                    maxRetries, maxConcurrency, defaultNodeTimeout, retryDelay, onNodeExecution);
        }
    }
}
