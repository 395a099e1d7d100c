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

import dev.mars.stepflow.action.ActionContext;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.secrets.SecretProvider;
import dev.mars.stepflow.workflow.expression.EvaluationContext;
import dev.mars.stepflow.workflow.expression.ExpressionEvaluator;
import dev.mars.stepflow.workflow.expression.ExpressionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Read-only view of a run handed to actions.
 */
final class StepActionContext implements ActionContext {

    private final RunContext run;
    private final String scope;
    private final String actionId;
    private final EvaluationContext evaluationContext;
    private final ExpressionEvaluator evaluator;
    private final SecretProvider secrets;
    private final BooleanSupplier cancelled;

    StepActionContext(RunContext run, String scope, String actionId, EvaluationContext evaluationContext,
                      ExpressionEvaluator evaluator, SecretProvider secrets, BooleanSupplier cancelled) {
        this.run = run;
        this.scope = scope;
        this.actionId = actionId;
        this.evaluationContext = evaluationContext;
        this.evaluator = evaluator;
        this.secrets = secrets;
        this.cancelled = cancelled;
    }

    @Override
    public String getRunId() {
        return run.getRunId();
    }

    @Override
    public Map<String, Object> getInputs() {
        return run.getInputs();
    }

    @Override
    public Map<String, Object> getVariables() {
        return new LinkedHashMap<>(run.getVariables());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getStepOutputs(String stepId) {
        Object view = run.stepsView(scope).get(stepId);
        if (view instanceof Map) {
            Object outputs = ((Map<String, Object>) view).get("outputs");
            if (outputs instanceof Map) {
                return Optional.of((Map<String, Object>) outputs);
            }
        }
        return Optional.empty();
    }

    @Override
    public Object evaluate(String expression) throws ActionException {
        try {
            return evaluator.evaluateBare(expression, evaluationContext);
        } catch (ExpressionException e) {
            throw new ActionException(actionId, ActionException.KIND_EXPRESSION, e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> getSecret(String name) {
        return secrets.getSecret(name);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}
