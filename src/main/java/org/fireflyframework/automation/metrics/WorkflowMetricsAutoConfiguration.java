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

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for automation metrics using Micrometer.
 * <p>
 * Active when a {@link MeterRegistry} bean exists and {@code firefly.automation.metrics-enabled}
 * is {@code true} (the default). Exposed meters:
 * <ul>
 *   <li><b>firefly.automation.workflow.started / completed</b> - run counters, completed tagged by outcome</li>
 *   <li><b>firefly.automation.workflow.duration</b> - run timer</li>
 *   <li><b>firefly.automation.workflow.active</b> - gauge of running workflows</li>
 *   <li><b>firefly.automation.node.started / completed / retries</b> - node counters by type</li>
 *   <li><b>firefly.automation.node.duration</b> - node timer by type and status</li>
 *   <li><b>firefly.automation.expression.rejected</b> - expressions refused by the sandbox</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "firefly.automation", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        log.info("Configuring WorkflowMetrics with Micrometer MeterRegistry");
        return new WorkflowMetrics(meterRegistry);
    }
}
