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

import dev.mars.stepflow.core.Values;
import dev.mars.stepflow.workflow.graph.CompiledWorkflow;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one run. Exactly one executor drives a run context at a time,
 * so it is not synchronised. {@link #toState()} and {@link #fromState(Map, List)}
 * convert it to and from the plain map persisted in checkpoints.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RunContext {

    /**
     * Why the run is winding down, if it is.
     */
    public enum Termination {
        NONE, FAILED, EXITED, CANCELLED
    }

    private final String runId;
    private final String workflowName;
    private final String fingerprint;
    private final List<String> jobOrder;
    private final Map<String, Object> inputs;
    private final Instant startedAt;
    private final Map<String, Map<String, StepExecution>> steps = new LinkedHashMap<>();
    private final Deque<LoopFrame> loops = new ArrayDeque<>();
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final Map<String, Object> answers = new LinkedHashMap<>();
    private WorkflowStatus status = WorkflowStatus.PENDING;
    private Termination termination = Termination.NONE;
    private String terminationMessage;
    private Map<String, Object> errorContext;
    private String errorScopeStep;
    private Cursor cursor;
    private String inFlight;
    private SuspensionState suspension;
    private Map<String, Object> exitOutputs;
    private String exitStatus;
    private Instant finishedAt;

    public RunContext(String runId, String workflowName, String fingerprint, List<String> jobOrder,
                      Map<String, Object> inputs, Instant startedAt) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.fingerprint = fingerprint;
        this.jobOrder = List.copyOf(Objects.requireNonNull(jobOrder, "Job order cannot be null"));
        this.inputs = Collections.unmodifiableMap(Values.normalizeMap(inputs != null ? inputs : Map.of()));
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    void setStatus(WorkflowStatus status) {
        this.status = status;
    }

    // Steps

    public Optional<StepExecution> getStep(String job, String stepId) {
        Map<String, StepExecution> jobSteps = steps.get(job);
        return jobSteps != null ? Optional.ofNullable(jobSteps.get(stepId)) : Optional.empty();
    }

    void putStep(String job, StepExecution execution) {
        steps.computeIfAbsent(job, key -> new LinkedHashMap<>()).put(execution.getStepId(), execution);
    }

    /**
     * Step executions grouped by job, in execution order.
     */
    public Map<String, Map<String, StepExecution>> getSteps() {
        Map<String, Map<String, StepExecution>> copy = new LinkedHashMap<>();
        steps.forEach((job, jobSteps) -> copy.put(job, Collections.unmodifiableMap(new LinkedHashMap<>(jobSteps))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * The {@code steps} namespace seen from a scope. A job sees the steps of
     * earlier jobs and its own, its own winning on duplicate ids; the document
     * hooks see every job.
     */
    public Map<String, Object> stepsView(String scope) {
        Map<String, Object> view = new LinkedHashMap<>();
        for (String job : jobOrder) {
            addViews(view, job);
            if (job.equals(scope)) {
                return view;
            }
        }
        addViews(view, CompiledWorkflow.WORKFLOW_SCOPE);
        return view;
    }

    private void addViews(Map<String, Object> view, String job) {
        Map<String, StepExecution> jobSteps = steps.get(job);
        if (jobSteps != null) {
            jobSteps.forEach((id, execution) -> view.put(id, execution.toView()));
        }
    }

    // Loops

    public Optional<LoopFrame> currentLoop() {
        return Optional.ofNullable(loops.peek());
    }

    void pushLoop(LoopFrame frame) {
        loops.push(frame);
    }

    LoopFrame popLoop() {
        return loops.pop();
    }

    // Variables

    public Map<String, Object> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    void setVariable(String name, Object value) {
        variables.put(name, Values.normalize(value));
    }

    // Error context

    public Optional<Map<String, Object>> getErrorContext() {
        return Optional.ofNullable(errorContext);
    }

    /**
     * Binds {@code error}. With a scope step the binding is dropped once that
     * step finishes; without one it lasts for the rest of the run.
     */
    void setErrorContext(String message, String kind, String stepId, String job, String scopeStep) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("kind", kind);
        error.put("step", stepId);
        error.put("job", job);
        this.errorContext = error;
        this.errorScopeStep = scopeStep;
    }

    void stepFinished(String stepId) {
        if (errorScopeStep != null && errorScopeStep.equals(stepId)) {
            errorContext = null;
            errorScopeStep = null;
        }
    }

    // Termination

    public Termination getTermination() {
        return termination;
    }

    public Optional<String> getTerminationMessage() {
        return Optional.ofNullable(terminationMessage);
    }

    /**
     * Records the first reason the run is ending. Later requests are ignored.
     */
    boolean terminate(Termination reason, String message) {
        if (termination != Termination.NONE) {
            return false;
        }
        termination = reason;
        terminationMessage = message;
        return true;
    }

    public WorkflowStatus finalStatus() {
        switch (termination) {
            case FAILED:
                return WorkflowStatus.FAILED;
            case EXITED:
                return WorkflowStatus.EXITED;
            case CANCELLED:
                return WorkflowStatus.CANCELLED;
            default:
                return WorkflowStatus.SUCCEEDED;
        }
    }

    // Cursor and suspension

    public Cursor getCursor() {
        return cursor;
    }

    void setCursor(Cursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Node whose action was dispatched but whose result is not yet recorded.
     * Found set on resume, it means the process died mid-dispatch.
     */
    public Optional<String> getInFlight() {
        return Optional.ofNullable(inFlight);
    }

    void setInFlight(String nodeId) {
        this.inFlight = nodeId;
    }

    public Optional<SuspensionState> getSuspension() {
        return Optional.ofNullable(suspension);
    }

    void setSuspension(SuspensionState suspension) {
        this.suspension = suspension;
    }

    void queueAnswers(Map<String, Object> newAnswers) {
        if (newAnswers != null) {
            newAnswers.forEach((stepId, value) -> answers.put(stepId, Values.normalize(value)));
        }
    }

    boolean hasAnswer(String stepId) {
        return answers.containsKey(stepId);
    }

    Object takeAnswer(String stepId) {
        return answers.remove(stepId);
    }

    // Exit

    public Optional<Map<String, Object>> getExitOutputs() {
        return Optional.ofNullable(exitOutputs);
    }

    public Optional<String> getExitStatus() {
        return Optional.ofNullable(exitStatus);
    }

    void setExit(String status, Map<String, Object> outputs) {
        this.exitStatus = status;
        this.exitOutputs = Values.normalizeMap(outputs != null ? outputs : Map.of());
    }

    // Persistence

    Map<String, Object> toState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("run_id", runId);
        state.put("workflow", workflowName);
        state.put("fingerprint", fingerprint);
        state.put("inputs", new LinkedHashMap<>(inputs));
        state.put("started_at", startedAt.toString());
        state.put("finished_at", finishedAt != null ? finishedAt.toString() : null);
        state.put("status", status.name());

        Map<String, Object> stepState = new LinkedHashMap<>();
        steps.forEach((job, jobSteps) -> {
            List<Object> executions = new ArrayList<>();
            jobSteps.values().forEach(execution -> executions.add(execution.toMap()));
            stepState.put(job, executions);
        });
        state.put("steps", stepState);

        List<Object> frames = new ArrayList<>();
        Iterator<LoopFrame> bottomUp = loops.descendingIterator();
        while (bottomUp.hasNext()) {
            frames.add(bottomUp.next().toMap());
        }
        state.put("loops", frames);
        state.put("variables", new LinkedHashMap<>(variables));
        state.put("answers", new LinkedHashMap<>(answers));
        state.put("error", errorContext != null ? new LinkedHashMap<>(errorContext) : null);
        state.put("error_scope", errorScopeStep);
        state.put("termination", termination.name());
        state.put("termination_message", terminationMessage);
        state.put("cursor", cursor != null ? cursor.toMap() : null);
        state.put("in_flight", inFlight);
        state.put("suspension", suspension != null ? suspension.toMap() : null);
        state.put("exit_status", exitStatus);
        state.put("exit_outputs", exitOutputs != null ? new LinkedHashMap<>(exitOutputs) : null);
        return state;
    }

    @SuppressWarnings("unchecked")
    static RunContext fromState(Map<String, Object> state, List<String> jobOrder) {
        RunContext run = new RunContext((String) state.get("run_id"), (String) state.get("workflow"),
                (String) state.get("fingerprint"), jobOrder, (Map<String, Object>) state.get("inputs"),
                Instant.parse((String) state.get("started_at")));
        Object finished = state.get("finished_at");
        run.finishedAt = finished != null ? Instant.parse((String) finished) : null;
        run.status = WorkflowStatus.valueOf((String) state.get("status"));

        Map<String, Object> stepState = (Map<String, Object>) state.get("steps");
        stepState.forEach((job, executions) -> {
            for (Object execution : (List<Object>) executions) {
                run.putStep(job, StepExecution.fromMap((Map<String, Object>) execution));
            }
        });
        for (Object frame : (List<Object>) state.get("loops")) {
            run.loops.push(LoopFrame.fromMap((Map<String, Object>) frame));
        }
        run.variables.putAll((Map<String, Object>) state.get("variables"));
        Object answers = state.get("answers");
        if (answers != null) {
            run.answers.putAll((Map<String, Object>) answers);
        }
        Object error = state.get("error");
        run.errorContext = error != null ? new LinkedHashMap<>((Map<String, Object>) error) : null;
        run.errorScopeStep = (String) state.get("error_scope");
        run.termination = Termination.valueOf((String) state.get("termination"));
        run.terminationMessage = (String) state.get("termination_message");
        Object cursor = state.get("cursor");
        run.cursor = cursor != null ? Cursor.fromMap((Map<String, Object>) cursor) : null;
        run.inFlight = (String) state.get("in_flight");
        Object suspension = state.get("suspension");
        run.suspension = suspension != null ? SuspensionState.fromMap((Map<String, Object>) suspension) : null;
        run.exitStatus = (String) state.get("exit_status");
        Object exitOutputs = state.get("exit_outputs");
        run.exitOutputs = exitOutputs != null ? (Map<String, Object>) exitOutputs : null;
        return run;
    }

    @Override
    public String toString() {
        return "RunContext{runId='" + runId + "', workflow='" + workflowName + "', status=" + status
                + ", cursor=" + cursor + "}";
    }
}
