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

import java.time.Duration;

/**
 * Retry behavior of a single node.
 *
 * @param maxAttempts maximum number of attempts, including the first one
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound for any delay
 * @param multiplier factor applied to the delay for every further retry
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier
) {

    /**
     * No retry policy - fail immediately on error.
     */
    public static final RetryPolicy NO_RETRY = new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            initialDelay = Duration.ZERO;
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
    }

    /**
     * Creates a policy allowing {@code retries} retries after the first attempt with the delay
     * doubling from {@code baseDelay}.
     */
    public static RetryPolicy ofRetries(int retries, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(retries + 1, baseDelay, maxDelay, 2.0);
    }

    /**
     * Calculates the delay to wait before the given attempt.
     *
     * @param attempt the attempt about to start (1-based)
     * @return zero for the first attempt, otherwise {@code initialDelay * multiplier^(attempt - 2)}
     *         capped at {@code maxDelay}
     */
    public Duration getDelayForAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }

        long delayMs = (long) (initialDelay.toMillis() * Math.pow(multiplier, attempt - 2));
        return Duration.ofMillis(Math.min(delayMs, maxDelay.toMillis()));
    }

    /**
     * Checks if another attempt may follow the given one.
     *
     * @param currentAttempt the attempt that just failed (1-based)
     */
    public boolean shouldRetry(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }
}
