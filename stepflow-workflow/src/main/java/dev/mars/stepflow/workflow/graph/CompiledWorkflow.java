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

import dev.mars.stepflow.workflow.WorkflowDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A workflow definition together with one {@link Graph} per job and the
 * document-level hook subgraphs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class CompiledWorkflow {

    /**
     * Pseudo job name under which the document-level hooks are addressed.
     */
    public static final String WORKFLOW_SCOPE = "__workflow__";

    private final WorkflowDefinition definition;
    private final Map<String, Graph> jobs;
    private final Graph workflowHooks;

    CompiledWorkflow(WorkflowDefinition definition, Map<String, Graph> jobs, Graph workflowHooks) {
        this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
        this.jobs = Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
        this.workflowHooks = Objects.requireNonNull(workflowHooks, "Workflow hooks cannot be null");
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    /**
     * Job graphs in declaration order.
     */
    public Map<String, Graph> getJobs() {
        return jobs;
    }

    public Graph getJob(String name) {
        Graph graph = jobs.get(name);
        if (graph == null) {
            throw new IllegalArgumentException("Unknown job '" + name + "'");
        }
        return graph;
    }

    /**
     * Hook subgraphs declared at document level. Its main subgraph is always empty.
     */
    public Graph getWorkflowHooks() {
        return workflowHooks;
    }

    /**
     * Resolves a subgraph by job name (or {@link #WORKFLOW_SCOPE}) and phase.
     */
    public Subgraph getSubgraph(String job, Phase phase) {
        return WORKFLOW_SCOPE.equals(job) ? workflowHooks.getSubgraph(phase) : getJob(job).getSubgraph(phase);
    }

    public String describe() {
        StringBuilder out = new StringBuilder();
        out.append("workflow ").append(definition.getName());
        if (definition.getVersion() != null) {
            out.append(" (").append(definition.getVersion()).append(')');
        }
        out.append('\n');
        for (Graph graph : jobs.values()) {
            graph.describe(out, "  ");
        }
        boolean hasHooks = false;
        for (Phase phase : Phase.values()) {
            hasHooks |= phase.isHook() && !workflowHooks.getSubgraph(phase).isEmpty();
        }
        if (hasHooks) {
            out.append("  workflow hooks\n");
            for (Phase phase : Phase.values()) {
                Subgraph subgraph = workflowHooks.getSubgraph(phase);
                if (phase.isHook() && !subgraph.isEmpty()) {
                    subgraph.describe(out, "    ");
                }
            }
        }
        return out.toString();
    }
}
