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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a successful action invocation: its outputs plus optional
 * directives the engine applies (variable updates, run termination, suspension).
 */
public final class ActionResult {

    private final Map<String, Object> outputs;
    private final Map<String, Object> variableUpdates;
    private final ControlSignal controlSignal;
    private final SuspensionRequest suspension;

    private ActionResult(Builder builder) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.variableUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variableUpdates));
        this.controlSignal = builder.controlSignal;
        this.suspension = builder.suspension;
    }

    public static ActionResult of(Map<String, Object> outputs) {
        return builder().outputs(outputs).build();
    }

    public static ActionResult empty() {
        return builder().build();
    }

    public static ActionResult suspend(SuspensionRequest request) {
        return builder().suspend(request).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Map<String, Object> getVariableUpdates() {
        return variableUpdates;
    }

    public ControlSignal getControlSignal() {
        return controlSignal;
    }

    public SuspensionRequest getSuspension() {
        return suspension;
    }

    public boolean isSuspended() {
        return suspension != null;
    }

    public boolean hasControlSignal() {
        return controlSignal != null;
    }

    /**
     * Copy of this result with different outputs, used when guardrails redact them.
     */
    public ActionResult withOutputs(Map<String, Object> newOutputs) {
        Builder builder = builder().outputs(newOutputs);
        builder.variableUpdates.putAll(variableUpdates);
        builder.controlSignal = controlSignal;
        builder.suspension = suspension;
        return builder.build();
    }

    @Override
    public String toString() {
        return "ActionResult{outputs=" + outputs.keySet() +
                ", variableUpdates=" + variableUpdates.keySet() +
                ", controlSignal=" + controlSignal +
                ", suspended=" + isSuspended() + "}";
    }

    public static class Builder {
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private final Map<String, Object> variableUpdates = new LinkedHashMap<>();
        private ControlSignal controlSignal;
        private SuspensionRequest suspension;

        public Builder output(String key, Object value) {
            outputs.put(key, value);
            return this;
        }

        public Builder outputs(Map<String, Object> values) {
            if (values != null) {
                outputs.putAll(values);
            }
            return this;
        }

        public Builder setVariable(String name, Object value) {
            variableUpdates.put(name, value);
            return this;
        }

        public Builder control(ControlSignal signal) {
            this.controlSignal = signal;
            return this;
        }

        public Builder suspend(SuspensionRequest request) {
            this.suspension = request;
            return this;
        }

        public ActionResult build() {
            return new ActionResult(this);
        }
    }
}
