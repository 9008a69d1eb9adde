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
import org.fireflyframework.automation.handler.NodeHandlerRegistry;
import org.fireflyframework.automation.metrics.WorkflowMetrics;
import org.fireflyframework.automation.model.ExecutionOptions;
import org.fireflyframework.automation.model.ExecutionReport;
import org.fireflyframework.automation.properties.AutomationProperties;
import org.fireflyframework.automation.resilience.WorkflowResilience;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Entry point for running workflow graphs.
 * <p>
 * The scheduler itself is stateless and thread-safe; every call creates an independent
 * {@link WorkflowExecution}. Use {@link #prepare(ExecutionOptions)} when the caller needs a
 * handle on the run (to abort it, confirm steps or poll statistics) and {@link #execute(ExecutionOptions)}
 * otherwise.
 */
@Slf4j
public class WorkflowScheduler {

    private final NodeHandlerRegistry registry;
    private final AutomationProperties properties;
    private final WorkflowMetrics metrics;
    private final WorkflowResilience resilience;

    public WorkflowScheduler(NodeHandlerRegistry registry, AutomationProperties properties) {
        this(registry, properties, null, null);
    }

    public WorkflowScheduler(NodeHandlerRegistry registry,
                             AutomationProperties properties,
                             @Nullable WorkflowMetrics metrics,
                             @Nullable WorkflowResilience resilience) {
        this.registry = registry;
        this.properties = properties;
        this.metrics = metrics;
        this.resilience = resilience != null && resilience.isEnabled() ? resilience : null;
        log.info("Workflow scheduler initialized: handlerTypes={}, maxConcurrency={}, resilience={}",
                registry.getTypes(), properties.getMaxConcurrency(), this.resilience != null);
    }

    /**
     * Creates a run without starting it.
     */
    public WorkflowExecution prepare(ExecutionOptions options) {
        return new WorkflowExecution(options, registry, SchedulerDefaults.from(properties), metrics, resilience);
    }

    /**
     * Runs a workflow to completion.
     *
     * @param options the graph and tuning of the run
     * @return the report; never errors for node, validation or timeout failures, those are
     *         reported in {@link ExecutionReport#errors()}
     */
    public Mono<ExecutionReport> execute(ExecutionOptions options) {
        return Mono.defer(() -> prepare(options).execute());
    }

    public NodeHandlerRegistry getRegistry() {
        return registry;
    }
}
