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
import java.util.Map;

/**
 * Outcome of one workflow run. Immutable once returned.
 *
 * @param workflowId the run identifier
 * @param success {@code true} when no node or global error was recorded
 * @param data outputs of the nodes of type {@code output}, keyed by node id
 * @param errors failure messages keyed by node id, with {@link #GLOBAL_ERROR_KEY} first when present
 * @param executionPath node ids in the order they started
 * @param executionTime wall-clock duration of the run
 * @param nodeResults outputs of every completed node, keyed by node id
 */
public record ExecutionReport(
        String workflowId,
        boolean success,
        Map<String, Map<String, Object>> data,
        Map<String, String> errors,
        List<String> executionPath,
        Duration executionTime,
        Map<String, Map<String, Object>> nodeResults
) {

    /**
     * Key under which run-level failures (validation, scheduling, global timeout, abort) are reported.
     */
    public static final String GLOBAL_ERROR_KEY = "global";

    public ExecutionReport {
        data = ModelMaps.copy(data);
        errors = ModelMaps.copy(errors);
        executionPath = ModelMaps.copy(executionPath);
        nodeResults = ModelMaps.copy(nodeResults);
    }

    public boolean hasGlobalError() {
        return errors.containsKey(GLOBAL_ERROR_KEY);
    }

    public static ExecutionReport empty(String workflowId) {
        return new ExecutionReport(workflowId, true, Map.of(), Map.of(), List.of(), Duration.ZERO, Map.of());
    }
}
