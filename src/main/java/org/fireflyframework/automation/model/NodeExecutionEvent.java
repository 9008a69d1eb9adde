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

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Progress notification delivered to a {@link NodeExecutionListener}.
 *
 * @param workflowId the run the node belongs to
 * @param nodeId the node
 * @param nodeType the node's handler type
 * @param status {@code RUNNING} when the node starts, {@code RETRYING} after a failed attempt
 *               that will be retried, {@code COMPLETED} or {@code FAILED} at the end
 * @param attempt the 1-based attempt the event refers to
 * @param output the node output, set for {@code COMPLETED}
 * @param error the failure message, set for {@code RETRYING} and {@code FAILED}
 * @param timestamp when the transition happened
 */
public record NodeExecutionEvent(
        String workflowId,
        String nodeId,
        String nodeType,
        NodeStatus status,
        int attempt,
        @Nullable Map<String, Object> output,
        @Nullable String error,
        Instant timestamp
) {
}
