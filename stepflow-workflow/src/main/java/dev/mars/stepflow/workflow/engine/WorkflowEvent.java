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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Structured notification emitted by the engine. Listeners decide how events
 * are displayed or shipped.
 */
public final class WorkflowEvent {

    public enum Type {
        RUN_STARTED,
        RUN_SUSPENDED,
        RUN_RESUMED,
        RUN_FINISHED,
        STEP_STARTED,
        STEP_COMPLETED,
        STEP_SKIPPED,
        STEP_FAILED,
        STEP_RETRYING,
        LOOP_ITERATION,
        GUARDRAIL_VIOLATION,
        CHECKPOINT_WRITTEN
    }

    private final Type type;
    private final String runId;
    private final String workflowName;
    private final String job;
    private final String stepId;
    private final Instant timestamp;
    private final Map<String, Object> details;

    public WorkflowEvent(Type type, String runId, String workflowName, String job, String stepId,
                         Instant timestamp, Map<String, Object> details) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.workflowName = workflowName;
        this.job = job;
        this.stepId = stepId;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public Type getType() {
        return type;
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getJob() {
        return job;
    }

    public String getStepId() {
        return stepId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "WorkflowEvent{" + type + ", run=" + runId
                + (stepId != null ? ", step=" + job + "/" + stepId : "")
                + (details.isEmpty() ? "" : ", details=" + details) + "}";
    }
}
