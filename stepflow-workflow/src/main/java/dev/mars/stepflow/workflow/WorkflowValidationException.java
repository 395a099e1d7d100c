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

import dev.mars.stepflow.core.exceptions.StepflowException;

/**
 * Thrown when a document parses but fails validation. The run never starts.
 */
public class WorkflowValidationException extends StepflowException {

    private final ValidationResult result;

    public WorkflowValidationException(String workflowName, ValidationResult result) {
        super(describe(workflowName, result));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    private static String describe(String workflowName, ValidationResult result) {
        StringBuilder sb = new StringBuilder("Workflow '").append(workflowName).append("' is invalid:");
        for (ValidationResult.ValidationIssue error : result.getErrors()) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}
