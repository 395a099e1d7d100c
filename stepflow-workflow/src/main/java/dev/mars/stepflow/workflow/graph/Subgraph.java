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

import dev.mars.stepflow.workflow.Step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The compiled form of one step list.
 */
public final class Subgraph {

    private final Phase phase;
    private final List<Step> steps;
    private final String entry;
    private final Map<String, GraphNode> nodes;
    private final Map<String, String> stepEntries;

    Subgraph(Phase phase, List<Step> steps, String entry, Map<String, GraphNode> nodes,
             Map<String, String> stepEntries) {
        this.phase = Objects.requireNonNull(phase, "Phase cannot be null");
        this.steps = List.copyOf(steps);
        this.entry = Objects.requireNonNull(entry, "Entry cannot be null");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.stepEntries = Collections.unmodifiableMap(new LinkedHashMap<>(stepEntries));
    }

    public Phase getPhase() {
        return phase;
    }

    public List<Step> getSteps() {
        return steps;
    }

    /**
     * First node to execute, or {@link GraphNode#END} for an empty list.
     */
    public String getEntry() {
        return entry;
    }

    /**
     * Nodes in compilation order.
     */
    public Map<String, GraphNode> getNodes() {
        return nodes;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Looks up a node.
     *
     * @throws IllegalArgumentException if the subgraph has no such node
     */
    public GraphNode getNode(String nodeId) {
        GraphNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("No node '" + nodeId + "' in " + phase.getKey() + " subgraph");
        }
        return node;
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * Entry node of a step (its loop head, branch or action node).
     *
     * @throws IllegalArgumentException if the step is not part of this subgraph
     */
    public String entryOf(String stepId) {
        String nodeId = stepEntries.get(stepId);
        if (nodeId == null) {
            throw new IllegalArgumentException("No step '" + stepId + "' in " + phase.getKey() + " subgraph");
        }
        return nodeId;
    }

    void describe(StringBuilder out, String indent) {
        out.append(indent).append(phase.getKey()).append(":");
        if (steps.isEmpty()) {
            out.append(" (none)\n");
            return;
        }
        out.append('\n');
        for (GraphNode node : nodes.values()) {
            out.append(indent).append("  ").append(String.format("%-28s", node.getId())).append(' ');
            out.append(describeNode(node)).append('\n');
        }
    }

    private static String describeNode(GraphNode node) {
        if (node instanceof ActionNode action) {
            Step step = action.step();
            String target = step.getUses() != null ? "uses " + step.getUses() : "run";
            return "action  " + target + " -> " + action.next()
                    + failureSuffix(action.failure(), action.failureRoute());
        }
        if (node instanceof BranchNode branch) {
            return "branch  if " + branch.condition() + " -> " + branch.whenTrue() + " | else -> " + branch.whenFalse();
        }
        if (node instanceof LoopHeadNode head) {
            return "loop    over " + head.items() + " -> " + head.body() + " | empty -> " + head.tail();
        }
        if (node instanceof LoopTailNode tail) {
            String breakIf = tail.breakIf() != null ? " break_if " + tail.breakIf() : "";
            return "tail   " + breakIf + " again -> " + tail.again() + " | exit -> " + tail.exit();
        }
        JumpNode jump = (JumpNode) node;
        return "jump    " + jump.kind().name().toLowerCase(Locale.ROOT) + " -> " + jump.target();
    }

    private static String failureSuffix(String failure, FailureRoute route) {
        if (route == FailureRoute.ABORT) {
            return "";
        }
        return " | fail(" + route.name().toLowerCase(Locale.ROOT) + ") -> " + failure;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Subgraph that = (Subgraph) o;
        return phase == that.phase && entry.equals(that.entry) && nodes.equals(that.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, entry, nodes);
    }
}
