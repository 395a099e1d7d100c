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

package dev.mars.stepflow.workflow.guardrail;

import dev.mars.stepflow.core.exceptions.ActionException;

/**
 * Raised when a scanner reports a violation and the configured policy does not
 * let the step continue. Routed like any other action failure.
 */
public class GuardrailViolationException extends ActionException {

    private final String scanner;
    private final Severity severity;
    private final GuardrailPhase phase;

    public GuardrailViolationException(String scanner, Severity severity, GuardrailPhase phase, String message) {
        super("guardrail/" + scanner, KIND_GUARDRAIL,
                phase.toYamlValue() + " guardrail '" + scanner + "' (" + severity + "): " + message);
        this.scanner = scanner;
        this.severity = severity;
        this.phase = phase;
    }

    public String getScanner() {
        return scanner;
    }

    public Severity getSeverity() {
        return severity;
    }

    public GuardrailPhase getPhase() {
        return phase;
    }
}
