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

package dev.mars.stepflow.workflow;

import dev.mars.stepflow.action.CaptureMode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a job. Steps are immutable templates; runtime state lives in the
 * engine's step executions.
 */
public class Step {

    public static final String RUN_ACTION = "run";

    private final String id;
    private final boolean generatedId;
    private final String name;
    private final Object run;
    private final String uses;
    private final Map<String, Object> with;
    private final String condition;
    private final Object loop;
    private final String breakIf;
    private final boolean continueOnError;
    private final String onFailure;
    private final Duration timeout;
    private final CaptureMode captureMode;
    private final boolean interactive;
    private final Map<String, Object> guardrails;
    private final boolean guardrailsDisabled;
    private final int maxIterations;
    private final RetryPolicy retry;
    private final boolean idempotent;

    private Step(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step id cannot be null");
        this.generatedId = builder.generatedId;
        this.name = builder.name != null ? builder.name : builder.id;
        this.run = copyIfList(builder.run);
        this.uses = builder.uses;
        this.with = builder.with != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.with))
                : Map.of();
        this.condition = builder.condition;
        this.loop = copyIfList(builder.loop);
        this.breakIf = builder.breakIf;
        this.continueOnError = builder.continueOnError;
        this.onFailure = builder.onFailure;
        this.timeout = builder.timeout;
        this.captureMode = builder.captureMode != null ? builder.captureMode : CaptureMode.MEMORY;
        this.interactive = builder.interactive;
        this.guardrails = builder.guardrails != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.guardrails))
                : null;
        this.guardrailsDisabled = builder.guardrailsDisabled;
        this.maxIterations = builder.maxIterations;
        this.retry = builder.retry != null ? builder.retry : RetryPolicy.NONE;
        this.idempotent = builder.idempotent;
    }

    private static Object copyIfList(Object value) {
        return value instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>) value)) : value;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    /**
     * Whether the id was derived from the name or position rather than written
     * in the document. Generated ids cannot be jump targets.
     */
    public boolean isGeneratedId() {
        return generatedId;
    }

    public String getName() {
        return name;
    }

    /**
     * A {@link String} for shell form, a {@link List} of tokens for exec form,
     * or {@code null} for {@code uses} steps.
     */
    public Object getRun() {
        return run;
    }

    public boolean isShellForm() {
        return run instanceof String;
    }

    public String getUses() {
        return uses;
    }

    /**
     * The action this step dispatches to: {@code uses}, or {@code run} for
     * command steps.
     */
    public String getActionId() {
        return uses != null ? uses : RUN_ACTION;
    }

    public Map<String, Object> getWith() {
        return with;
    }

    public String getCondition() {
        return condition;
    }

    public boolean hasCondition() {
        return condition != null;
    }

    /**
     * The loop source: an expression string or a literal list.
     */
    public Object getLoop() {
        return loop;
    }

    public boolean isLoop() {
        return loop != null;
    }

    public String getBreakIf() {
        return breakIf;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public String getOnFailure() {
        return onFailure;
    }

    /**
     * The declared timeout, or {@code null} to use the workflow default.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public CaptureMode getCaptureMode() {
        return captureMode;
    }

    public boolean isInteractive() {
        return interactive;
    }

    /**
     * Step guardrail overrides, or {@code null} to inherit the workflow settings.
     */
    public Map<String, Object> getGuardrails() {
        return guardrails;
    }

    public boolean isGuardrailsDisabled() {
        return guardrailsDisabled;
    }

    /**
     * Loop safety limit; 0 when the document leaves it to {@code stepflow.loop.max.iterations}.
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    public RetryPolicy getRetry() {
        return retry;
    }

    /**
     * Whether the step may be dispatched again after a crash interrupted it.
     */
    public boolean isIdempotent() {
        return idempotent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step step = (Step) o;
        return generatedId == step.generatedId &&
               continueOnError == step.continueOnError &&
               interactive == step.interactive &&
               guardrailsDisabled == step.guardrailsDisabled &&
               maxIterations == step.maxIterations &&
               idempotent == step.idempotent &&
               id.equals(step.id) &&
               Objects.equals(name, step.name) &&
               Objects.equals(run, step.run) &&
               Objects.equals(uses, step.uses) &&
               with.equals(step.with) &&
               Objects.equals(condition, step.condition) &&
               Objects.equals(loop, step.loop) &&
               Objects.equals(breakIf, step.breakIf) &&
               Objects.equals(onFailure, step.onFailure) &&
               Objects.equals(timeout, step.timeout) &&
               captureMode == step.captureMode &&
               Objects.equals(guardrails, step.guardrails) &&
               retry.equals(step.retry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, uses, run, with, condition, loop);
    }

    @Override
    public String toString() {
        return "Step{id='" + id + "', action='" + getActionId() + "'" +
               (loop != null ? ", loop='" + loop + "'" : "") +
               (condition != null ? ", if='" + condition + "'" : "") +
               "}";
    }

    public static class Builder {
        private final String id;
        private boolean generatedId;
        private String name;
        private Object run;
        private String uses;
        private Map<String, Object> with;
        private String condition;
        private Object loop;
        private String breakIf;
        private boolean continueOnError;
        private String onFailure;
        private Duration timeout;
        private CaptureMode captureMode;
        private boolean interactive;
        private Map<String, Object> guardrails;
        private boolean guardrailsDisabled;
        private int maxIterations;
        private RetryPolicy retry;
        private boolean idempotent = true;

        private Builder(String id) {
            this.id = id;
        }

        public Builder generatedId(boolean generatedId) {
            this.generatedId = generatedId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder run(Object run) {
            this.run = run;
            return this;
        }

        public Builder uses(String uses) {
            this.uses = uses;
            return this;
        }

        public Builder with(Map<String, Object> with) {
            this.with = with;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder loop(Object loop) {
            this.loop = loop;
            return this;
        }

        public Builder breakIf(String breakIf) {
            this.breakIf = breakIf;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder onFailure(String onFailure) {
            this.onFailure = onFailure;
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

        public Builder guardrails(Map<String, Object> guardrails) {
            this.guardrails = guardrails;
            return this;
        }

        public Builder guardrailsDisabled(boolean guardrailsDisabled) {
            this.guardrailsDisabled = guardrailsDisabled;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = retry;
            return this;
        }

        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Step build() {
            return new Step(this);
        }
    }
}
