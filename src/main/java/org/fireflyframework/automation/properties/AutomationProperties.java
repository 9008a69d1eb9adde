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

package org.fireflyframework.automation.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the automation engine.
 * <p>
 * Values set on {@link org.fireflyframework.automation.model.ExecutionOptions} take precedence
 * over these defaults for a single run.
 */
@ConfigurationProperties(prefix = "firefly.automation")
@Validated
@Data
public class AutomationProperties {

    /**
     * Whether the automation engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Maximum number of nodes running at the same time within one workflow run.
     */
    @Min(1)
    private int maxConcurrency = 5;

    /**
     * Default timeout for a single attempt of a node.
     */
    @NotNull
    private Duration defaultNodeTimeout = Duration.ofSeconds(30);

    /**
     * Default deadline for a whole workflow run.
     */
    @NotNull
    private Duration maxExecutionTime = Duration.ofHours(1);

    /**
     * Whether Micrometer metrics are recorded when a MeterRegistry is available.
     */
    private boolean metricsEnabled = true;

    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    @Valid
    @NotNull
    private HttpConfig http = new HttpConfig();

    @Valid
    @NotNull
    private DelayConfig delay = new DelayConfig();

    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * Node retry defaults.
     */
    @Data
    public static class RetryConfig {

        /**
         * Retries after the first attempt. Zero disables retries.
         */
        @Min(0)
        private int maxRetries = 0;

        /**
         * Delay before the first retry.
         */
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(1);

        /**
         * Upper bound for the backoff delay.
         */
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        /**
         * Backoff multiplier applied for every further retry.
         */
        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    /**
     * Settings of the {@code http-request} node type.
     */
    @Data
    public static class HttpConfig {

        /**
         * Timeout applied when a node does not configure its own.
         */
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(10);
    }

    /**
     * Settings of the {@code delay} node type.
     */
    @Data
    public static class DelayConfig {

        /**
         * Longest delay a node may request.
         */
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(5);
    }

    /**
     * Resilience4j protection around handler invocations, keyed by node type.
     */
    @Data
    public static class ResilienceConfig {

        private boolean enabled = false;

        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        @Valid
        @NotNull
        private RateLimiterConfig rateLimiter = new RateLimiterConfig();
    }

    @Data
    public static class CircuitBreakerConfig {

        private boolean enabled = true;

        @Min(1)
        private int failureRateThreshold = 50;

        @Min(1)
        private int slidingWindowSize = 20;

        @Min(1)
        private int minimumNumberOfCalls = 10;

        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 5;

        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimiterConfig {

        private boolean enabled = false;

        @Min(1)
        private int limitForPeriod = 50;

        @NotNull
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);

        @NotNull
        private Duration timeoutDuration = Duration.ofSeconds(5);
    }
}
