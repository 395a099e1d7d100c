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

package dev.mars.stepflow.workflow.engine;

import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.graph.CompiledWorkflow;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for executing workflows: fresh runs, resumption of suspended runs and
 * dry runs that only compile.
 */
public interface WorkflowEngine {

    /**
     * Executes a workflow definition.
     *
     * @param definition the workflow definition to execute
     * @param context run id, inputs and answers known up front
     * @return future completing with the run once it finishes or suspends. Input
     *         problems complete it exceptionally with an {@link InputValidationException}.
     */
    CompletableFuture<WorkflowRun> execute(WorkflowDefinition definition, ExecutionContext context);

    /**
     * Resumes a run from its latest checkpoint.
     *
     * @param definition the same workflow the run was started with
     * @param runId the run to resume
     * @param answers values for suspended steps, keyed by step id
     * @return future completing with the run once it finishes or suspends again
     */
    CompletableFuture<WorkflowRun> resume(WorkflowDefinition definition, String runId, Map<String, Object> answers);

    /**
     * Compiles the workflow without invoking any action.
     *
     * @param definition the workflow definition to compile
     * @return the compiled graphs, whose {@code describe()} gives the execution order
     */
    CompiledWorkflow dryRun(WorkflowDefinition definition);

    /**
     * Gets the status of a run known to this engine or its checkpoint store.
     *
     * @param runId the run ID
     * @return the current status, or {@code null} if the run is unknown
     */
    WorkflowStatus getStatus(String runId);

    /**
     * Requests cancellation of a run. An in-flight run stops before its next
     * dispatch, walks its {@code finally} steps and ends cancelled. A suspended run
     * is finished as cancelled from its checkpoint without running further steps.
     *
     * @param runId the run ID
     * @return true if the run was active or suspended and is now being cancelled
     */
    boolean cancel(String runId);

    /**
     * Cancels a suspended run by resuming it with cancellation already requested,
     * so its {@code finally} steps and failure hooks run before it ends cancelled.
     *
     * @param definition the workflow the run was started from
     * @param runId the run ID
     * @return a future completing with the cancelled run
     */
    CompletableFuture<WorkflowRun> cancel(WorkflowDefinition definition, String runId);

    /**
     * Shuts down the workflow engine and cleans up resources.
     */
    void shutdown();
}
