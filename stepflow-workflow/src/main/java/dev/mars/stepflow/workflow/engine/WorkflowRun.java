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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a run returned to callers: when the run finishes, and also when it
 * suspends waiting for input.
 */
public class WorkflowRun {

    private final String runId;
    private final String workflowName;
    private final WorkflowStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Map<String, Map<String, StepExecution>> stepExecutions;
    private final Map<String, Object> variables;
    private final String errorMessage;
    private final Throwable cause;
    private final SuspensionState suspension;
    private final String exitStatus;
    private final Map<String, Object> exitOutputs;

    public WorkflowRun(String runId, String workflowName, WorkflowStatus status, Instant startTime, Instant endTime,
                       Map<String, Map<String, StepExecution>> stepExecutions, Map<String, Object> variables,
                       String errorMessage, Throwable cause, SuspensionState suspension, String exitStatus,
                       Map<String, Object> exitOutputs) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.stepExecutions = stepExecutions != null ? stepExecutions : Map.of();
        this.variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
        this.errorMessage = errorMessage;
        this.cause = cause;
        this.suspension = suspension;
        this.exitStatus = exitStatus;
        this.exitOutputs = exitOutputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(exitOutputs))
                : Map.of();
    }

    static WorkflowRun of(RunContext run, Throwable cause) {
        String error = run.getTerminationMessage().orElse(cause != null ? cause.getMessage() : null);
        return new WorkflowRun(run.getRunId(), run.getWorkflowName(), run.getStatus(), run.getStartedAt(),
                run.getFinishedAt().orElse(null), run.getSteps(), run.getVariables(),
                run.getStatus() == WorkflowStatus.SUCCEEDED ? null : error, cause,
                run.getSuspension().orElse(null), run.getExitStatus().orElse(null),
                run.getExitOutputs().orElse(null));
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return endTime != null ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
    }

    /**
     * Step executions grouped by job (document hooks under
     * {@link dev.mars.stepflow.workflow.graph.CompiledWorkflow#WORKFLOW_SCOPE}).
     */
    public Map<String, Map<String, StepExecution>> getStepExecutions() {
        return stepExecutions;
    }

    public Optional<StepExecution> getStep(String job, String stepId) {
        Map<String, StepExecution> jobSteps = stepExecutions.get(job);
        return jobSteps != null ? Optional.ofNullable(jobSteps.get(stepId)) : Optional.empty();
    }

    /**
     * The most recent execution of a step id in any job.
     */
    public Optional<StepExecution> getStep(String stepId) {
        List<Map<String, StepExecution>> jobs = new ArrayList<>(stepExecutions.values());
        Collections.reverse(jobs);
        for (Map<String, StepExecution> jobSteps : jobs) {
            StepExecution execution = jobSteps.get(stepId);
            if (execution != null) {
                return Optional.of(execution);
            }
        }
        return Optional.empty();
    }

    public Map<String, Object> getStepOutputs(String stepId) {
        return getStep(stepId).map(StepExecution::getOutputs).orElse(Map.of());
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Present while the run is {@link WorkflowStatus#SUSPENDED}.
     */
    public Optional<SuspensionState> getSuspension() {
        return Optional.ofNullable(suspension);
    }

    public Optional<String> getExitStatus() {
        return Optional.ofNullable(exitStatus);
    }

    public Map<String, Object> getExitOutputs() {
        return exitOutputs;
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.SUCCEEDED;
    }

    public boolean isSuspended() {
        return status == WorkflowStatus.SUSPENDED;
    }

    public boolean isCompleted() {
        return status.isTerminal();
    }

    public int getStepCount() {
        return stepExecutions.values().stream().mapToInt(Map::size).sum();
    }

    public long getFailedStepCount() {
        return stepExecutions.values().stream()
                .flatMap(jobSteps -> jobSteps.values().stream())
                .filter(execution -> execution.getOutcome() == StepOutcome.FAILED)
                .count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowRun that = (WorkflowRun) o;
        return Objects.equals(runId, that.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId);
    }

    @Override
    public String toString() {
        return "WorkflowRun{" +
               "runId='" + runId + '\'' +
               ", workflow='" + workflowName + '\'' +
               ", status=" + status +
               ", startTime=" + startTime +
               ", endTime=" + endTime +
               ", steps=" + getStepCount() +
               '}';
    }
}
