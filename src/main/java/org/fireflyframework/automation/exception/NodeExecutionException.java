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

/**
 * Exception thrown when a node handler fails.
 * <p>
 * Node execution failures are recorded against the node and are eligible for retry.
 */
public class NodeExecutionException extends WorkflowException {

    private final String nodeId;

    public NodeExecutionException(String message) {
        super(message);
        this.nodeId = null;
    }

    public NodeExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.nodeId = null;
    }

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super("Node '" + nodeId + "' execution failed: " + message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
