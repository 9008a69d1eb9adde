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

import org.fireflyframework.automation.model.config.NodeConfig;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single step of a workflow graph.
 *
 * @param id unique identifier within the workflow
 * @param type handler type, e.g. {@code condition} or {@code http-request}
 * @param inputs static inputs merged over the initial data before upstream outputs
 * @param outputs declared outputs, informational only
 * @param config handler configuration, see {@link #typedConfig()}
 * @param dependencies explicit upstream node ids in addition to those derived from edges
 * @param priority higher values are launched first among ready nodes
 * @param retryCount retries after the first attempt, overriding the run default
 * @param timeout per-attempt timeout, overriding the run default
 */
public record ExecutionNode(
        String id,
        String type,
        Map<String, Object> inputs,
        Map<String, Object> outputs,
        Map<String, Object> config,
        List<String> dependencies,
        int priority,
        @Nullable Integer retryCount,
        @Nullable Duration timeout
) {

    public ExecutionNode {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        inputs = ModelMaps.copy(inputs);
        outputs = ModelMaps.copy(outputs);
        config = ModelMaps.copy(config);
        dependencies = ModelMaps.copy(dependencies);
        if (retryCount != null && retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative for node " + id);
        }
    }

    /**
     * The configuration interpreted according to {@link #type()}.
     */
    public NodeConfig typedConfig() {
        return NodeConfig.from(type, config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String id, String type) {
        return new Builder().id(id).type(type);
    }

    public static class Builder {
        private String id;
        private String type;
        private Map<String, Object> inputs = new HashMap<>();
        private Map<String, Object> outputs = new HashMap<>();
        private Map<String, Object> config = new HashMap<>();
        private List<String> dependencies = new ArrayList<>();
        private int priority;
        private Integer retryCount;
        private Duration timeout;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            this.inputs = new HashMap<>(inputs);
            return this;
        }

        public Builder input(String key, Object value) {
            this.inputs.put(key, value);
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = new HashMap<>(outputs);
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = new HashMap<>(config);
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = new ArrayList<>(dependencies);
            return this;
        }

        public Builder dependsOn(String nodeId) {
            this.dependencies.add(nodeId);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder retryCount(Integer retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public ExecutionNode build() {
            return new ExecutionNode(id, type, inputs, outputs, config, dependencies, priority, retryCount, timeout);
        }
    }
}
