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

import org.fireflyframework.automation.properties.AutomationProperties;

import java.time.Duration;

/**
 * Engine-wide fallbacks for the tuning values a run leaves unset.
 */
record SchedulerDefaults(
        int maxConcurrency,
        Duration maxExecutionTime,
        Duration defaultNodeTimeout,
        int maxRetries,
        Duration retryDelay,
        Duration maxRetryDelay,
        double retryMultiplier
) {

    static SchedulerDefaults from(AutomationProperties properties) {
        AutomationProperties.RetryConfig retry = properties.getRetry();
        return new SchedulerDefaults(
                properties.getMaxConcurrency(),
                properties.getMaxExecutionTime(),
                properties.getDefaultNodeTimeout(),
                retry.getMaxRetries(),
                retry.getInitialDelay(),
                retry.getMaxDelay(),
                retry.getMultiplier());
    }
}
