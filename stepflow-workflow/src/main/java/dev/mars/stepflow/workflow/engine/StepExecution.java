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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime record of one step in one run. Immutable; every transition returns a
 * new instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepExecution {

    private final String stepId;
    private final StepOutcome outcome;
    private final Map<String, Object> outputs;
    private final String errorMessage;
    private final String errorKind;
    private final int attempts;
    private final Instant startedAt;
    private final Instant finishedAt;

    private StepExecution(String stepId, StepOutcome outcome, Map<String, Object> outputs, String errorMessage,
                          String errorKind, int attempts, Instant startedAt, Instant finishedAt) {
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.outcome = Objects.requireNonNull(outcome, "Outcome cannot be null");
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.errorMessage = errorMessage;
        this.errorKind = errorKind;
        this.attempts = attempts;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public static StepExecution running(String stepId, int attempt, Instant now) {
        return new StepExecution(stepId, StepOutcome.RUNNING, null, null, null, attempt, now, null);
    }

    public static StepExecution skipped(String stepId, Instant now) {
        return new StepExecution(stepId, StepOutcome.SKIPPED, null, null, null, 0, now, now);
    }

    public StepExecution suspended() {
        return new StepExecution(stepId, StepOutcome.SUSPENDED, outputs, null, null, attempts, startedAt, null);
    }

    public StepExecution succeeded(Map<String, Object> newOutputs, Instant now) {
        return new StepExecution(stepId, StepOutcome.SUCCEEDED, newOutputs, null, null, attempts,
                startedAt != null ? startedAt : now, now);
    }

    public StepExecution failed(String kind, String message, Map<String, Object> newOutputs, Instant now) {
        return new StepExecution(stepId, StepOutcome.FAILED, newOutputs, message, kind, attempts,
                startedAt != null ? startedAt : now, now);
    }

    public String getStepId() {
        return stepId;
    }

    public StepOutcome getOutcome() {
        return outcome;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<String> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    /**
     * The value bound to {@code steps.<id>} in expressions. Skipped steps have no
     * {@code outputs} key so lookups fall through to {@code default}.
     */
    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("outcome", outcome.toYamlValue());
        if (outcome != StepOutcome.SKIPPED) {
            view.put("outputs", outputs);
        }
        if (outcome == StepOutcome.FAILED) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("message", errorMessage);
            error.put("kind", errorKind);
            view.put("error", error);
        }
        return view;
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("step", stepId);
        map.put("outcome", outcome.toYamlValue());
        map.put("outputs", outputs);
        map.put("error_message", errorMessage);
        map.put("error_kind", errorKind);
        map.put("attempts", (long) attempts);
        map.put("started_at", startedAt != null ? startedAt.toString() : null);
        map.put("finished_at", finishedAt != null ? finishedAt.toString() : null);
        return map;
    }

    @SuppressWarnings("unchecked")
    static StepExecution fromMap(Map<String, Object> map) {
        Object started = map.get("started_at");
        Object finished = map.get("finished_at");
        Object attempts = map.get("attempts");
        return new StepExecution((String) map.get("step"),
                StepOutcome.fromString((String) map.get("outcome")),
                (Map<String, Object>) map.get("outputs"),
                (String) map.get("error_message"),
                (String) map.get("error_kind"),
                attempts instanceof Number ? ((Number) attempts).intValue() : 0,
                started != null ? Instant.parse((String) started) : null,
                finished != null ? Instant.parse((String) finished) : null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepExecution that = (StepExecution) o;
        return attempts == that.attempts && stepId.equals(that.stepId) && outcome == that.outcome
                && outputs.equals(that.outputs) && Objects.equals(errorMessage, that.errorMessage)
                && Objects.equals(errorKind, that.errorKind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, outcome, outputs, errorMessage, errorKind, attempts);
    }

    @Override
    public String toString() {
        return "StepExecution{step='" + stepId + "', outcome=" + outcome
                + (errorMessage != null ? ", error='" + errorMessage + "'" : "") + "}";
    }
}
