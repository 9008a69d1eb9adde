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

package org.fireflyframework.automation.exception;

import java.time.Duration;

/**
 * Raised when a single attempt of a node exceeds its timeout.
 */
public class NodeTimeoutException extends WorkflowException {

    private final String nodeId;
    private final Duration timeout;

    public NodeTimeoutException(String nodeId, Duration timeout) {
        super("Node " + nodeId + " timed out after " + timeout.toMillis() + "ms");
        this.nodeId = nodeId;
        this.timeout = timeout;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
