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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.expression.SafeEvaluationException;
import org.fireflyframework.automation.properties.AutomationProperties;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides Resilience4j decorators for node handler invocations.
 * <p>
 * Circuit breakers and rate limiters are shared by all nodes of the same type, so a failing
 * downstream service trips the breaker for every workflow using it. Expression rejections are
 * ignored by the circuit breaker since they say nothing about the health of a dependency.
 */
@Slf4j
public class WorkflowResilience {

    private final AutomationProperties.ResilienceConfig config;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;

    private final Map<String, CircuitBreaker> nodeCircuitBreakers = new ConcurrentHashMap<>();
    private final Map<String, RateLimiter> nodeRateLimiters = new ConcurrentHashMap<>();

    public WorkflowResilience(AutomationProperties properties) {
        this.config = properties.getResilience();
        this.circuitBreakerRegistry = createCircuitBreakerRegistry();
        this.rateLimiterRegistry = createRateLimiterRegistry();

        log.info("RESILIENCE_INIT: enabled={}, circuitBreaker={}, rateLimiter={}",
                config.isEnabled(),
                config.getCircuitBreaker().isEnabled(),
                config.getRateLimiter().isEnabled());
    }

    /**
     * Decorates a handler invocation with all enabled resilience patterns.
     *
     * @param nodeType the node type, used as the breaker and limiter name
     * @param mono the invocation to decorate
     * @param <T> the result type
     * @return the decorated Mono
     */
    public <T> Mono<T> decorateNode(String nodeType, Mono<T> mono) {
        if (!config.isEnabled()) {
            return mono;
        }

        Mono<T> decorated = mono;

        // Apply rate limiter
        if (config.getRateLimiter().isEnabled()) {
            RateLimiter rateLimiter = getOrCreateRateLimiter(nodeType);
            decorated = decorated.transformDeferred(RateLimiterOperator.of(rateLimiter));
        }

        // Apply circuit breaker (outermost)
        if (config.getCircuitBreaker().isEnabled()) {
            CircuitBreaker circuitBreaker = getOrCreateCircuitBreaker(nodeType);
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
        }

        return decorated;
    }

    /**
     * Gets or creates the circuit breaker for a node type.
     */
    public CircuitBreaker getOrCreateCircuitBreaker(String nodeType) {
        return nodeCircuitBreakers.computeIfAbsent(nodeType, n -> {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(n);
            cb.getEventPublisher()
                    .onStateTransition(event ->
                            log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                    event.getCircuitBreakerName(),
                                    event.getStateTransition().getFromState(),
                                    event.getStateTransition().getToState()))
                    .onError(event ->
                            log.warn("CIRCUIT_BREAKER_ERROR: name={}, error={}",
                                    event.getCircuitBreakerName(),
                                    event.getThrowable().getMessage()));
            return cb;
        });
    }

    /**
     * Gets or creates the rate limiter for a node type.
     */
    public RateLimiter getOrCreateRateLimiter(String nodeType) {
        return nodeRateLimiters.computeIfAbsent(nodeType, n -> {
            RateLimiter rl = rateLimiterRegistry.rateLimiter(n);
            rl.getEventPublisher()
                    .onFailure(event ->
                            log.warn("RATE_LIMITER_REJECTED: name={}", event.getRateLimiterName()));
            return rl;
        });
    }

    /**
     * Gets the circuit breaker state for a node type, or {@code null} if none was created yet.
     */
    public CircuitBreaker.State getCircuitBreakerState(String nodeType) {
        CircuitBreaker cb = nodeCircuitBreakers.get(nodeType);
        return cb != null ? cb.getState() : null;
    }

    /**
     * Resets the circuit breaker for a node type.
     */
    public void resetCircuitBreaker(String nodeType) {
        CircuitBreaker cb = nodeCircuitBreakers.get(nodeType);
        if (cb != null) {
            cb.reset();
            log.info("CIRCUIT_BREAKER_RESET: name={}", nodeType);
        }
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    // ==================== Registry Creation ====================

    private CircuitBreakerRegistry createCircuitBreakerRegistry() {
        var cbConfig = config.getCircuitBreaker();

        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getSlidingWindowSize())
                .minimumNumberOfCalls(cbConfig.getMinimumNumberOfCalls())
                .permittedNumberOfCallsInHalfOpenState(cbConfig.getPermittedNumberOfCallsInHalfOpenState())
                .waitDurationInOpenState(cbConfig.getWaitDurationInOpenState())
                .ignoreExceptions(SafeEvaluationException.class)
                .build();

        return CircuitBreakerRegistry.of(defaultConfig);
    }

    private RateLimiterRegistry createRateLimiterRegistry() {
        var rlConfig = config.getRateLimiter();

        RateLimiterConfig defaultConfig = RateLimiterConfig.custom()
                .limitForPeriod(rlConfig.getLimitForPeriod())
                .limitRefreshPeriod(rlConfig.getLimitRefreshPeriod())
                .timeoutDuration(rlConfig.getTimeoutDuration())
                .build();

        return RateLimiterRegistry.of(defaultConfig);
    }
}
