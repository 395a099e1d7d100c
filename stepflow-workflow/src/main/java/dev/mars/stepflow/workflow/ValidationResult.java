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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Errors and warnings collected while validating a workflow document. Validation
 * never stops at the first problem.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public void addError(String code, String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, fieldPath, message));
    }

    public void addWarning(String code, String fieldPath, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, fieldPath, message));
    }

    public void merge(ValidationResult other) {
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
    }

    /**
     * Copy of this result with every warning turned into an error, as
     * {@code --strict} requires.
     */
    public ValidationResult promoteWarnings() {
        List<ValidationIssue> promoted = new ArrayList<>(errors);
        for (ValidationIssue warning : warnings) {
            promoted.add(new ValidationIssue(ValidationIssue.Severity.ERROR,
                    warning.getCode(), warning.getFieldPath(), warning.getMessage()));
        }
        return new ValidationResult(promoted, List.of());
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(issue -> issue.getCode().equals(code));
    }

    public boolean hasWarningCode(String code) {
        return warnings.stream().anyMatch(issue -> issue.getCode().equals(code));
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * Represents a single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String code;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, String code, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        /**
         * Stable machine-readable identifier such as {@code E_FORWARD_REFERENCE}.
         */
        public String getCode() {
            return code;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   code.equals(that.code) &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, code, fieldPath, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name()).append(' ').append(code);
            if (fieldPath != null) {
                sb.append(" [").append(fieldPath).append("]");
            }
            sb.append(": ").append(message);
            return sb.toString();
        }
    }
}
