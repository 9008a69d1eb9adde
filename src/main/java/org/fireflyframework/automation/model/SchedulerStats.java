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
import java.util.List;

/**
 * Point-in-time view of a run.
 *
 * @param runningNodes ids of the nodes started but not yet finished
 * @param completedNodes number of nodes that completed
 * @param failedNodes number of nodes that failed
 * @param elapsedTime time since the run started, frozen once it finished
 * @param availableConcurrency permits currently free
 */
public record SchedulerStats(
        List<String> runningNodes,
        int completedNodes,
        int failedNodes,
        Duration elapsedTime,
        int availableConcurrency
) {

    public SchedulerStats {
        runningNodes = List.copyOf(runningNodes);
    }
}
