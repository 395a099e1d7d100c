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

import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the run an action is executing in.
 */
public interface ActionContext {

    String getRunId();

    Map<String, Object> getInputs();

    Map<String, Object> getVariables();

    /**
     * Outputs recorded for a step of the current job, if it has run.
     */
    Optional<Map<String, Object>> getStepOutputs(String stepId);

    /**
     * Evaluates a bare expression against the current run state.
     *
     * @throws ActionException with kind {@code expression} if evaluation fails
     */
    Object evaluate(String expression) throws ActionException;

    Optional<String> getSecret(String name);

    boolean isCancelled();
}
