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

package org.fireflyframework.automation.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.properties.AutomationProperties;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Resilience4j protection of node handlers.
 * <p>
 * Off unless {@code firefly.automation.resilience.enabled=true}.
 */
@AutoConfiguration
@ConditionalOnClass(CircuitBreakerRegistry.class)
@EnableConfigurationProperties(AutomationProperties.class)
@ConditionalOnProperty(prefix = "firefly.automation.resilience", name = "enabled", havingValue = "true")
@Slf4j
public class WorkflowResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowResilience workflowResilience(AutomationProperties properties) {
        log.info("Configuring WorkflowResilience with Resilience4j");
        return new WorkflowResilience(properties);
    }
}
