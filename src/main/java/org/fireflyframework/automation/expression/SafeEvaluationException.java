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

package org.fireflyframework.automation.expression;

/**
 * Raised for every expression that is malformed or breaches the evaluator's security policy.
 * <p>
 * These failures are never retried by the scheduler and are surfaced to the caller verbatim.
 */
public class SafeEvaluationException extends RuntimeException {

    public SafeEvaluationException(String message) {
        super(message);
    }

    public SafeEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
