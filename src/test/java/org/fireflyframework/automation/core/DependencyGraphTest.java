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

import org.fireflyframework.automation.exception.WorkflowValidationException;
import org.fireflyframework.automation.model.Edge;
import org.fireflyframework.automation.model.ExecutionNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DependencyGraph}.
 */
class DependencyGraphTest {

    private static ExecutionNode node(String id) {
        return ExecutionNode.builder(id, "expression").build();
    }

    private static ExecutionNode node(String id, int priority) {
        return ExecutionNode.builder(id, "expression").priority(priority).build();
    }

    // ========================================================================
    // Structure
    // ========================================================================

    @Nested
    @DisplayName("structure")
    class StructureTests {

        @Test
        @DisplayName("should merge edge and explicit dependencies")
        void mergesDependencySources() {
            ExecutionNode c = ExecutionNode.builder("c", "output").dependsOn("a").build();
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("a"), node("b"), c),
                    List.of(Edge.of("b", "c"), Edge.of("a", "c")));

            assertThat(graph.getDependencies("c")).containsExactlyInAnyOrder("a", "b");
            assertThat(graph.getDependents("a")).containsExactly("c");
            assertThat(graph.getIncomingEdges("c")).extracting(Edge::source).containsExactly("b", "a");
            assertThat(graph.getRootNodes()).extracting(ExecutionNode::id).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should build layers ordered by priority")
        void buildsLayers() {
            DependencyGraph graph = new DependencyGraph("wf",
                    List.of(node("root"), node("low", 1), node("high", 9), node("end")),
                    List.of(Edge.of("root", "low"), Edge.of("root", "high"),
                            Edge.of("low", "end"), Edge.of("high", "end")));

            List<List<ExecutionNode>> layers = graph.buildExecutionLayers();

            assertThat(layers).hasSize(3);
            assertThat(layers.get(1)).extracting(ExecutionNode::id).containsExactly("high", "low");
            assertThat(layers.get(2)).extracting(ExecutionNode::id).containsExactly("end");
        }

        @Test
        @DisplayName("should check satisfied dependencies")
        void checksSatisfaction() {
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("a"), node("b"), node("c")),
                    List.of(Edge.of("a", "c"), Edge.of("b", "c")));

            assertThat(graph.areDependenciesSatisfied("c", Set.of("a"))).isFalse();
            assertThat(graph.areDependenciesSatisfied("c", Set.of("a", "b"))).isTrue();
            assertThat(graph.getNode("missing")).isEmpty();
            assertThat(graph.size()).isEqualTo(3);
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("validate")
    class ValidationTests {

        @Test
        @DisplayName("should accept an acyclic graph")
        void acceptsDag() {
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("a"), node("b")),
                    List.of(Edge.of("a", "b")));

            graph.validate();

            assertThat(graph.buildExecutionLayers()).hasSize(2);
        }

        @Test
        @DisplayName("should reject duplicate ids")
        void rejectsDuplicates() {
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("a"), node("a")), List.of());

            assertThatThrownBy(graph::validate)
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Duplicate node id 'a'");
        }

        @Test
        @DisplayName("should reject edges to unknown nodes")
        void rejectsDanglingEdges() {
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("a")), List.of(Edge.of("a", "ghost")));

            assertThatThrownBy(graph::validate)
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("non-existent node 'ghost'");
        }

        @Test
        @DisplayName("should reject explicit dependencies on unknown nodes")
        void rejectsDanglingDependencies() {
            ExecutionNode a = ExecutionNode.builder("a", "output").dependsOn("ghost").build();
            DependencyGraph graph = new DependencyGraph("wf", List.of(a), List.of());

            assertThatThrownBy(graph::validate)
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("depends on non-existent node 'ghost'");
        }

        @Test
        @DisplayName("should reject cycles and name the nodes involved")
        void rejectsCycles() {
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("start"), node("a"), node("b")),
                    List.of(Edge.of("start", "a"), Edge.of("a", "b"), Edge.of("b", "a")));

            assertThatThrownBy(graph::validate)
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Circular dependency")
                    .hasMessageContaining("[a, b]");
        }

        @Test
        @DisplayName("should reject self loops")
        void rejectsSelfLoop() {
            DependencyGraph graph = new DependencyGraph("wf", List.of(node("a")), List.of(Edge.of("a", "a")));

            assertThatThrownBy(graph::validate)
                    .isInstanceOf(WorkflowValidationException.class);
        }
    }
}
