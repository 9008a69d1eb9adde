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

package org.fireflyframework.automation.handler;

/**
 * Callback for contributing handlers to the {@link NodeHandlerRegistry} before it is sealed.
 * <p>
 * Declare beans of this type to plug in agent invocations, external code execution services or
 * other node types. Customizers run after the built-in handlers are registered, so they may also
 * replace a built-in type.
 */
@FunctionalInterface
public interface NodeHandlerCustomizer {

    void customize(NodeHandlerRegistry.Builder registry);
}
