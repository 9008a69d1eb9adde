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

package org.fireflyframework.automation.core;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.exception.WorkflowValidationException;
import org.fireflyframework.automation.model.Edge;
import org.fireflyframework.automation.model.ExecutionNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dependency graph of a workflow's nodes.
 * <p>
 * Dependencies come from edges ({@code source -> target}) and from each node's explicit
 * {@link ExecutionNode#dependencies()}. The graph keeps both directions: the reverse map
 * (node to the nodes it waits for) and the forward map (node to the nodes waiting for it).
 * <p>
 * <b>Execution Layers:</b>
 * Nodes are organized into layers where:
 * <ul>
 *   <li>Layer 0 contains root nodes (no dependencies)</li>
 *   <li>Each subsequent layer contains nodes whose dependencies are all in previous layers</li>
 *   <li>Nodes within the same layer can execute in parallel</li>
 * </ul>
 */
@Slf4j
public class DependencyGraph {

    private static final Comparator<ExecutionNode> BY_PRIORITY =
            Comparator.comparingInt(ExecutionNode::priority).reversed();

    private final String workflowId;
    private final Map<String, ExecutionNode> nodeMap = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencyGraph = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependentGraph = new LinkedHashMap<>();
    private final Map<String, List<Edge>> incomingEdges = new LinkedHashMap<>();
    private final List<ExecutionNode> nodes;
    private final List<Edge> edges;
    private boolean validated;

    public DependencyGraph(String workflowId, List<ExecutionNode> nodes, List<Edge> edges) {
        this.workflowId = workflowId;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        buildGraph();
    }

    private void buildGraph() {
        for (ExecutionNode node : nodes) {
            if (nodeMap.putIfAbsent(node.id(), node) == null) {
                dependencyGraph.put(node.id(), new LinkedHashSet<>());
                dependentGraph.put(node.id(), new LinkedHashSet<>());
                incomingEdges.put(node.id(), new ArrayList<>());
            }
        }
        for (Edge edge : edges) {
            link(edge.source(), edge.target());
            if (incomingEdges.containsKey(edge.target())) {
                incomingEdges.get(edge.target()).add(edge);
            }
        }
        for (ExecutionNode node : nodes) {
            node.dependencies().forEach(depId -> link(depId, node.id()));
        }
    }

    private void link(String sourceId, String targetId) {
        if (dependencyGraph.containsKey(targetId)) {
            dependencyGraph.get(targetId).add(sourceId);
        }
        if (dependentGraph.containsKey(sourceId)) {
            dependentGraph.get(sourceId).add(targetId);
        }
    }

    /**
     * Validates the graph: unique node ids, no edge or dependency naming an unknown node, and
     * no cycles.
     *
     * @throws WorkflowValidationException if validation fails
     */
    public void validate() {
        if (validated) {
            return;
        }
        validateUniqueIds();
        validateReferencesExist();
        validateNoCycles();
        validated = true;
    }

    private void validateUniqueIds() {
        if (nodeMap.size() == nodes.size()) {
            return;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (ExecutionNode node : nodes) {
            if (!seen.add(node.id())) {
                throw new WorkflowValidationException(
                        String.format("Duplicate node id '%s' in workflow '%s'", node.id(), workflowId));
            }
        }
    }

    private void validateReferencesExist() {
        for (Edge edge : edges) {
            if (!nodeMap.containsKey(edge.source()) || !nodeMap.containsKey(edge.target())) {
                String missing = nodeMap.containsKey(edge.source()) ? edge.target() : edge.source();
                throw new WorkflowValidationException(
                        String.format("Edge '%s' -> '%s' references non-existent node '%s' in workflow '%s'",
                                edge.source(), edge.target(), missing, workflowId));
            }
        }
        for (ExecutionNode node : nodes) {
            for (String depId : node.dependencies()) {
                if (!nodeMap.containsKey(depId)) {
                    throw new WorkflowValidationException(
                            String.format("Node '%s' depends on non-existent node '%s' in workflow '%s'",
                                    node.id(), depId, workflowId));
                }
            }
        }
    }

    private void validateNoCycles() {
        Set<String> sorted = new LinkedHashSet<>();
        layers(sorted);
        if (sorted.size() < nodeMap.size()) {
            Set<String> cyclic = new LinkedHashSet<>(nodeMap.keySet());
            cyclic.removeAll(sorted);
            log.error("Circular dependency detected among nodes: {}", cyclic);
            throw new WorkflowValidationException(
                    String.format("Circular dependency detected in workflow '%s' involving nodes %s",
                            workflowId, cyclic));
        }
    }

    /**
     * Builds execution layers using Kahn's algorithm (topological sort). Nodes inside a layer
     * are sorted by descending priority.
     *
     * @return list of execution layers, each containing nodes that can run in parallel
     */
    public List<List<ExecutionNode>> buildExecutionLayers() {
        validate();
        return layers(new LinkedHashSet<>());
    }

    private List<List<ExecutionNode>> layers(Set<String> processed) {
        List<List<ExecutionNode>> layers = new ArrayList<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        dependencyGraph.forEach((id, deps) -> {
            inDegree.put(id, deps.size());
            if (deps.isEmpty()) {
                ready.add(id);
            }
        });

        while (!ready.isEmpty()) {
            List<ExecutionNode> currentLayer = new ArrayList<>();
            int size = ready.size();
            for (int i = 0; i < size; i++) {
                currentLayer.add(nodeMap.get(ready.poll()));
            }
            currentLayer.sort(BY_PRIORITY);
            layers.add(currentLayer);

            for (ExecutionNode node : currentLayer) {
                processed.add(node.id());
                for (String dependentId : dependentGraph.get(node.id())) {
                    int remaining = inDegree.merge(dependentId, -1, Integer::sum);
                    if (remaining == 0) {
                        ready.add(dependentId);
                    }
                }
            }
        }
        return layers;
    }

    /**
     * Gets root nodes (nodes with no dependencies), highest priority first.
     */
    public List<ExecutionNode> getRootNodes() {
        return nodeMap.values().stream()
                .filter(node -> dependencyGraph.get(node.id()).isEmpty())
                .sorted(BY_PRIORITY)
                .collect(Collectors.toList());
    }

    /**
     * Gets the nodes the given node waits for.
     */
    public Set<String> getDependencies(String nodeId) {
        return Collections.unmodifiableSet(dependencyGraph.getOrDefault(nodeId, Collections.emptySet()));
    }

    /**
     * Gets the nodes waiting for the given node.
     */
    public Set<String> getDependents(String nodeId) {
        return Collections.unmodifiableSet(dependentGraph.getOrDefault(nodeId, Collections.emptySet()));
    }

    /**
     * Gets the edges arriving at the given node, in declaration order.
     */
    public List<Edge> getIncomingEdges(String nodeId) {
        return Collections.unmodifiableList(incomingEdges.getOrDefault(nodeId, Collections.emptyList()));
    }

    /**
     * Checks if all dependencies of a node are in the given set.
     */
    public boolean areDependenciesSatisfied(String nodeId, Set<String> terminalNodes) {
        return terminalNodes.containsAll(getDependencies(nodeId));
    }

    public Optional<ExecutionNode> getNode(String nodeId) {
        return Optional.ofNullable(nodeMap.get(nodeId));
    }

    public List<ExecutionNode> getNodes() {
        return nodes;
    }

    public int size() {
        return nodeMap.size();
    }
}
