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
 * Exception thrown when a workflow graph is rejected before execution.
 * <p>
 * This exception is thrown when:
 * <ul>
 *   <li>Two nodes share the same id</li>
 *   <li>An edge or explicit dependency names a node that does not exist</li>
 *   <li>Circular dependencies are detected</li>
 * </ul>
 */
public class WorkflowValidationException extends WorkflowException {

    /**
     * Creates a new validation exception with the given message.
     *
     * @param message the error message
     */
    public WorkflowValidationException(String message) {
        super(message);
    }
}
