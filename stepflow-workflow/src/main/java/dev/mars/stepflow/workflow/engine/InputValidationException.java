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

import dev.mars.stepflow.core.exceptions.StepflowException;

import java.util.List;

/**
 * Exception thrown when the inputs supplied for a run do not satisfy the
 * workflow's input declarations. The run never starts.
 */
public class InputValidationException extends StepflowException {

    private final List<String> problems;

    public InputValidationException(List<String> problems) {
        super("Invalid workflow inputs: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
