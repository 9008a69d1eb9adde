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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.exception.NodeHandlerNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps node types to their {@link NodeHandler}.
 * <p>
 * The registry is populated once through its {@link Builder} and is read-only afterwards, so it
 * can be shared by any number of concurrent runs.
 */
@Slf4j
public final class NodeHandlerRegistry {

    private final Map<String, NodeHandler> handlers;

    private NodeHandlerRegistry(Map<String, NodeHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * Looks up the handler for a node type.
     *
     * @param type the node type
     * @return the handler
     * @throws NodeHandlerNotFoundException if the type is not registered
     */
    public NodeHandler handlerFor(String type) {
        NodeHandler handler = handlers.get(type);
        if (handler == null) {
            throw new NodeHandlerNotFoundException(type);
        }
        return handler;
    }

    public boolean contains(String type) {
        return handlers.containsKey(type);
    }

    public Set<String> getTypes() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, NodeHandler> handlers = new LinkedHashMap<>();

        /**
         * Registers a handler, replacing any handler previously registered for the type.
         */
        public Builder register(String type, NodeHandler handler) {
            Objects.requireNonNull(type, "type cannot be null");
            Objects.requireNonNull(handler, "handler cannot be null");
            if (handlers.put(type, handler) != null) {
                log.info("Replacing node handler for type: {}", type);
            }
            return this;
        }

        public Builder registerAll(Map<String, ? extends NodeHandler> handlers) {
            handlers.forEach(this::register);
            return this;
        }

        public NodeHandlerRegistry build() {
            log.info("Node handler registry sealed with {} types: {}", handlers.size(), handlers.keySet());
            return new NodeHandlerRegistry(handlers);
        }
    }
}
