/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.stepflow.workflow.graph;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The compiled form of a job: the main subgraph plus its hook subgraphs.
 * Immutable and shared by all runs of the definition.
 */
public final class Graph {

    private final String name;
    private final Map<Phase, Subgraph> subgraphs;

    Graph(String name, Map<Phase, Subgraph> subgraphs) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.subgraphs = new EnumMap<>(subgraphs);
        for (Phase phase : Phase.values()) {
            if (!this.subgraphs.containsKey(phase)) {
                throw new IllegalArgumentException("Missing " + phase.getKey() + " subgraph for " + name);
            }
        }
    }

    public String getName() {
        return name;
    }

    public Subgraph getSubgraph(Phase phase) {
        return subgraphs.get(phase);
    }

    public Subgraph getMain() {
        return subgraphs.get(Phase.MAIN);
    }

    /**
     * Total number of nodes across all subgraphs.
     */
    public int getNodeCount() {
        return subgraphs.values().stream().mapToInt(subgraph -> subgraph.getNodes().size()).sum();
    }

    /**
     * Renders the execution order of every subgraph.
     */
    public String describe() {
        StringBuilder out = new StringBuilder();
        describe(out, "");
        return out.toString();
    }

    void describe(StringBuilder out, String indent) {
        out.append(indent).append("job ").append(name).append('\n');
        for (Phase phase : Phase.values()) {
            Subgraph subgraph = subgraphs.get(phase);
            if (phase == Phase.MAIN || !subgraph.isEmpty()) {
                subgraph.describe(out, indent + "  ");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Graph graph = (Graph) o;
        return name.equals(graph.name) && subgraphs.equals(graph.subgraphs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, subgraphs);
    }

    @Override
    public String toString() {
        return "Graph{name='" + name + "', nodes=" + getNodeCount() + "}";
    }
}
