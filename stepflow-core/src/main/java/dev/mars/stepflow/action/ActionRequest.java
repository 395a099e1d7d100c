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

package dev.mars.stepflow.action;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything an action needs to run one step: the resolved {@code with}
 * parameters, the step settings and a read-only view of the run.
 */
public final class ActionRequest {

    private final String actionId;
    private final String runId;
    private final String stepId;
    private final Map<String, Object> with;
    private final Object command;
    private final Duration timeout;
    private final CaptureMode captureMode;
    private final boolean interactive;
    private final Path workingDirectory;
    private final ActionContext context;
    private final boolean answerAvailable;
    private final Object answer;
    private final boolean suspensionExpired;

    private ActionRequest(Builder builder) {
        this.actionId = Objects.requireNonNull(builder.actionId, "Action id cannot be null");
        this.runId = builder.runId;
        this.stepId = Objects.requireNonNull(builder.stepId, "Step id cannot be null");
        this.with = Collections.unmodifiableMap(new LinkedHashMap<>(builder.with));
        this.command = builder.command;
        this.timeout = builder.timeout != null ? builder.timeout : Duration.ofSeconds(300);
        this.captureMode = builder.captureMode != null ? builder.captureMode : CaptureMode.MEMORY;
        this.interactive = builder.interactive;
        this.workingDirectory = builder.workingDirectory != null ? builder.workingDirectory : Paths.get(".");
        this.context = builder.context;
        this.answerAvailable = builder.answerAvailable;
        this.answer = builder.answer;
        this.suspensionExpired = builder.suspensionExpired;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getActionId() {
        return actionId;
    }

    public String getRunId() {
        return runId;
    }

    public String getStepId() {
        return stepId;
    }

    public Map<String, Object> getWith() {
        return with;
    }

    public ActionParameters getParameters() {
        return new ActionParameters(actionId, with);
    }

    /**
     * The resolved {@code run} value: a {@link String} for shell form or a
     * {@link List} of tokens for exec form. {@code null} for {@code uses} steps.
     */
    public Object getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public CaptureMode getCaptureMode() {
        return captureMode;
    }

    public boolean isInteractive() {
        return interactive;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public ActionContext getContext() {
        return context;
    }

    /**
     * Whether an externally supplied answer is queued for this step.
     */
    public boolean hasAnswer() {
        return answerAvailable;
    }

    public Object getAnswer() {
        return answer;
    }

    /**
     * Whether this step was previously suspended and its answer window has elapsed.
     */
    public boolean isSuspensionExpired() {
        return suspensionExpired;
    }

    public static class Builder {
        private String actionId;
        private String runId;
        private String stepId;
        private final Map<String, Object> with = new LinkedHashMap<>();
        private Object command;
        private Duration timeout;
        private CaptureMode captureMode;
        private boolean interactive;
        private Path workingDirectory;
        private ActionContext context;
        private boolean answerAvailable;
        private Object answer;
        private boolean suspensionExpired;

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder with(Map<String, Object> parameters) {
            if (parameters != null) {
                this.with.putAll(parameters);
            }
            return this;
        }

        public Builder param(String key, Object value) {
            this.with.put(key, value);
            return this;
        }

        public Builder command(Object command) {
            this.command = command;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder captureMode(CaptureMode captureMode) {
            this.captureMode = captureMode;
            return this;
        }

        public Builder interactive(boolean interactive) {
            this.interactive = interactive;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder context(ActionContext context) {
            this.context = context;
            return this;
        }

        public Builder answer(Object answer) {
            this.answerAvailable = true;
            this.answer = answer;
            return this;
        }

        public Builder suspensionExpired(boolean suspensionExpired) {
            this.suspensionExpired = suspensionExpired;
            return this;
        }

        public ActionRequest build() {
            return new ActionRequest(this);
        }
    }
}
