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

package org.fireflyframework.automation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.WorkflowScheduler;
import org.fireflyframework.automation.expression.SafeEvaluator;
import org.fireflyframework.automation.handler.NodeHandlerCustomizer;
import org.fireflyframework.automation.handler.NodeHandlerRegistry;
import org.fireflyframework.automation.handler.builtin.BuiltinNodeHandlers;
import org.fireflyframework.automation.metrics.WorkflowMetrics;
import org.fireflyframework.automation.metrics.WorkflowMetricsAutoConfiguration;
import org.fireflyframework.automation.properties.AutomationProperties;
import org.fireflyframework.automation.resilience.WorkflowResilience;
import org.fireflyframework.automation.resilience.WorkflowResilienceAutoConfiguration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Auto-configuration for the Firefly automation engine.
 * <p>
 * Provides:
 * <ul>
 *   <li>SafeEvaluator - sandboxed expression evaluation</li>
 *   <li>NodeHandlerRegistry - built-in node types plus any {@link NodeHandlerCustomizer} beans</li>
 *   <li>WorkflowScheduler - dependency-driven execution of workflow graphs</li>
 * </ul>
 * Metrics and resilience beans are picked up when their own auto-configurations contribute them.
 */
@Slf4j
@AutoConfiguration(
        after = {WorkflowMetricsAutoConfiguration.class, WorkflowResilienceAutoConfiguration.class},
        afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration")
@EnableConfigurationProperties(AutomationProperties.class)
@ConditionalOnProperty(prefix = "firefly.automation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AutomationEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper automationObjectMapper() {
        log.info("Creating ObjectMapper for the automation engine");
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Bean
    @ConditionalOnMissingBean
    public SafeEvaluator safeEvaluator(ObjectMapper objectMapper, ObjectProvider<WorkflowMetrics> workflowMetrics) {
        WorkflowMetrics metrics = workflowMetrics.getIfAvailable();
        log.info("Creating SafeEvaluator with metrics: {}", metrics != null);
        return new SafeEvaluator(objectMapper, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeHandlerRegistry nodeHandlerRegistry(SafeEvaluator safeEvaluator,
                                                   ObjectMapper objectMapper,
                                                   AutomationProperties properties,
                                                   ObjectProvider<WebClient.Builder> webClientBuilder,
                                                   ObjectProvider<NodeHandlerCustomizer> customizers) {
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
        NodeHandlerRegistry.Builder builder = BuiltinNodeHandlers.register(NodeHandlerRegistry.builder(),
                safeEvaluator, webClient, objectMapper,
                properties.getHttp().getDefaultTimeout(), properties.getDelay().getMaxDelay());
        customizers.orderedStream().forEach(customizer -> customizer.customize(builder));
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowScheduler workflowScheduler(NodeHandlerRegistry nodeHandlerRegistry,
                                               AutomationProperties properties,
                                               ObjectProvider<WorkflowMetrics> workflowMetrics,
                                               ObjectProvider<WorkflowResilience> workflowResilience) {
        log.info("Creating WorkflowScheduler with maxConcurrency: {}, maxExecutionTime: {}",
                properties.getMaxConcurrency(), properties.getMaxExecutionTime());
        return new WorkflowScheduler(nodeHandlerRegistry, properties,
                workflowMetrics.getIfAvailable(), workflowResilience.getIfAvailable());
    }
}
