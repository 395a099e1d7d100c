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

import dev.mars.stepflow.workflow.Job;
import dev.mars.stepflow.workflow.Step;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers step lists into graphs of executable nodes.
 *
 * <p>Per step, in declaration order:</p>
 * <ul>
 *   <li>{@code loop} becomes {@code <id>#loop} (materialise the sequence), the body,
 *       {@code <id>#tail} ({@code break_if}, iteration bookkeeping) and the
 *       {@code <id>#next} back edge;</li>
 *   <li>{@code if} becomes a {@code <id>#if} branch whose false edge skips the step
 *       (or, inside a loop, the iteration);</li>
 *   <li>{@code on_failure} adds a {@code <id>#fail} jump to the handler's entry node.</li>
 * </ul>
 * <p>Within a loop an explicit {@code on_failure} takes precedence over
 * {@code continue_on_error}. Failures in hook lists continue with the next hook step.
 * Compilation is pure: the same input always yields equal graphs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GraphCompiler {
    private static final Logger logger = LoggerFactory.getLogger(GraphCompiler.class);

    public static final String IF_SUFFIX = "#if";
    public static final String LOOP_SUFFIX = "#loop";
    public static final String TAIL_SUFFIX = "#tail";
    public static final String NEXT_SUFFIX = "#next";
    public static final String FAIL_SUFFIX = "#fail";

    public CompiledWorkflow compile(WorkflowDefinition definition) {
        Map<String, Graph> jobs = new LinkedHashMap<>();
        for (Job job : definition.getJobs().values()) {
            jobs.put(job.getName(), compile(job));
        }
        Map<Phase, Subgraph> hooks = new EnumMap<>(Phase.class);
        hooks.put(Phase.MAIN, compileSteps(Phase.MAIN, List.of()));
        hooks.put(Phase.ON_COMPLETE, compileSteps(Phase.ON_COMPLETE, definition.getOnComplete()));
        hooks.put(Phase.ON_FAILURE, compileSteps(Phase.ON_FAILURE, definition.getOnFailure()));
        hooks.put(Phase.FINALLY, compileSteps(Phase.FINALLY, definition.getFinally()));
        CompiledWorkflow compiled = new CompiledWorkflow(definition, jobs,
                new Graph(CompiledWorkflow.WORKFLOW_SCOPE, hooks));
        logger.debug("Compiled workflow '{}' into {} job graph(s)", definition.getName(), jobs.size());
        return compiled;
    }

    public Graph compile(Job job) {
        Map<Phase, Subgraph> subgraphs = new EnumMap<>(Phase.class);
        subgraphs.put(Phase.MAIN, compileSteps(Phase.MAIN, job.getSteps()));
        subgraphs.put(Phase.ON_COMPLETE, compileSteps(Phase.ON_COMPLETE, job.getOnComplete()));
        subgraphs.put(Phase.ON_FAILURE, compileSteps(Phase.ON_FAILURE, job.getOnFailure()));
        subgraphs.put(Phase.FINALLY, compileSteps(Phase.FINALLY, job.getFinally()));
        Graph graph = new Graph(job.getName(), subgraphs);
        logger.debug("Compiled job '{}': {} nodes", job.getName(), graph.getNodeCount());
        return graph;
    }

    Subgraph compileSteps(Phase phase, List<Step> steps) {
        Map<String, String> stepEntries = new LinkedHashMap<>();
        List<String> entries = new ArrayList<>();
        for (Step step : steps) {
            String entry = entryId(step);
            entries.add(entry);
            stepEntries.put(step.getId(), entry);
        }

        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            String next = i + 1 < steps.size() ? entries.get(i + 1) : GraphNode.END;
            lowerStep(phase, step, next, stepEntries, nodes);
        }
        String entry = entries.isEmpty() ? GraphNode.END : entries.get(0);
        return new Subgraph(phase, steps, entry, nodes, stepEntries);
    }

    static String entryId(Step step) {
        if (step.isLoop()) {
            return step.getId() + LOOP_SUFFIX;
        }
        if (step.hasCondition()) {
            return step.getId() + IF_SUFFIX;
        }
        return step.getId();
    }

    private void lowerStep(Phase phase, Step step, String next, Map<String, String> stepEntries,
                           Map<String, GraphNode> nodes) {
        String id = step.getId();
        String failJump = id + FAIL_SUFFIX;

        // failure of the step as a whole: branch, loop head, loop tail, or a non-loop action
        FailureRoute outerRoute;
        String outerFailure;
        if (step.getOnFailure() != null) {
            outerRoute = FailureRoute.JUMP;
            outerFailure = failJump;
        } else if (phase.isHook()) {
            outerRoute = FailureRoute.HOOK_CONTINUE;
            outerFailure = next;
        } else {
            outerRoute = FailureRoute.ABORT;
            outerFailure = null;
        }

        if (step.isLoop()) {
            String tail = id + TAIL_SUFFIX;
            String body = step.hasCondition() ? id + IF_SUFFIX : id;
            FailureRoute iterationRoute = outerRoute;
            String iterationFailure = outerFailure;
            if (outerRoute != FailureRoute.JUMP && step.isContinueOnError()) {
                iterationRoute = FailureRoute.LOOP_CONTINUE;
                iterationFailure = tail;
            }
            nodes.put(id + LOOP_SUFFIX, new LoopHeadNode(id + LOOP_SUFFIX, id, step.getLoop(),
                    step.getMaxIterations(), body, tail, outerFailure, outerRoute));
            if (step.hasCondition()) {
                nodes.put(id + IF_SUFFIX, new BranchNode(id + IF_SUFFIX, id, step.getCondition(), id, tail,
                        iterationFailure, iterationRoute));
            }
            nodes.put(id, new ActionNode(id, step, tail, iterationFailure, iterationRoute));
            nodes.put(tail, new LoopTailNode(tail, id, step.getBreakIf(), step.isContinueOnError(),
                    id + NEXT_SUFFIX, next, outerFailure, outerRoute));
            nodes.put(id + NEXT_SUFFIX, new JumpNode(id + NEXT_SUFFIX, id, body, JumpNode.Kind.LOOP_BACK));
        } else {
            if (step.hasCondition()) {
                nodes.put(id + IF_SUFFIX, new BranchNode(id + IF_SUFFIX, id, step.getCondition(), id, next,
                        outerFailure, outerRoute));
            }
            nodes.put(id, new ActionNode(id, step, next, outerFailure, outerRoute));
        }

        if (step.getOnFailure() != null) {
            String target = stepEntries.get(step.getOnFailure());
            if (target == null) {
                throw new IllegalArgumentException("on_failure target '" + step.getOnFailure()
                        + "' of step '" + id + "' is not in the same step list");
            }
            nodes.put(failJump, new JumpNode(failJump, id, target, JumpNode.Kind.FAILURE));
        }
    }
}
