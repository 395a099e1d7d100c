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
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied parameters of one run: its id, the raw input values and any
 * answers already available for steps that would otherwise suspend.
 */
public class ExecutionContext {

    private final String runId;
    private final Instant submittedAt;
    private final Map<String, Object> inputs;
    private final Map<String, Object> answers;
    private final String userId;
    private final Map<String, String> metadata;

    public ExecutionContext(String runId, Map<String, Object> inputs, Map<String, Object> answers,
                            String userId, Map<String, String> metadata) {
        this.runId = Objects.requireNonNull(runId, "Run ID cannot be null");
        this.submittedAt = Instant.now();
        this.inputs = inputs != null ? Map.copyOf(inputs) : Map.of();
        this.answers = answers != null ? Map.copyOf(answers) : Map.of();
        this.userId = userId;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public String getRunId() {
        return runId;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    /**
     * Answers keyed by step id, consumed by steps that request external input.
     */
    public Map<String, Object> getAnswers() {
        return answers;
    }

    public String getUserId() {
        return userId;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public ExecutionContext withInputs(Map<String, Object> additionalInputs) {
        if (additionalInputs == null || additionalInputs.isEmpty()) {
            return this;
        }

        Map<String, Object> mergedInputs = new HashMap<>(this.inputs);
        mergedInputs.putAll(additionalInputs);

        return new ExecutionContext(runId, mergedInputs, answers, userId, metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionContext that = (ExecutionContext) o;
        return Objects.equals(runId, that.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "runId='" + runId + '\'' +
               ", inputs=" + inputs.keySet() +
               ", submittedAt=" + submittedAt +
               ", userId='" + userId + '\'' +
               '}';
    }

    /**
     * Builder for ExecutionContext.
     */
    public static class Builder {
        private String runId;
        private final Map<String, Object> inputs = new HashMap<>();
        private final Map<String, Object> answers = new HashMap<>();
        private String userId;
        private Map<String, String> metadata = Map.of();

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            if (inputs != null) {
                this.inputs.putAll(inputs);
            }
            return this;
        }

        public Builder input(String name, Object value) {
            this.inputs.put(name, value);
            return this;
        }

        public Builder answer(String stepId, Object value) {
            this.answers.put(stepId, value);
            return this;
        }

        public Builder answers(Map<String, Object> answers) {
            if (answers != null) {
                this.answers.putAll(answers);
            }
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public ExecutionContext build() {
            if (runId == null) {
                runId = java.util.UUID.randomUUID().toString();
            }
            return new ExecutionContext(runId, inputs, answers, userId, metadata);
        }
    }
}
