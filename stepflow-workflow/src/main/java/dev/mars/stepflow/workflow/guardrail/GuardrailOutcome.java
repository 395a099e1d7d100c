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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running a phase's scanners over a set of payload values: the values
 * after any rewriting scanners, plus every violation found.
 */
public final class GuardrailOutcome {

    /**
     * One scanner violation on one payload value.
     */
    public record Violation(String scanner, String key, Severity severity, String message) {
    }

    private final GuardrailPhase phase;
    private final Map<String, Object> values;
    private final List<Violation> violations;

    GuardrailOutcome(GuardrailPhase phase, Map<String, Object> values, List<Violation> violations) {
        this.phase = phase;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.violations = List.copyOf(violations);
    }

    public GuardrailPhase getPhase() {
        return phase;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public boolean isPassed() {
        return violations.isEmpty();
    }

    /**
     * Exception describing the most severe violation.
     *
     * @throws IllegalStateException if the outcome passed
     */
    public GuardrailViolationException toException() {
        Violation worst = violations.stream()
                .max((a, b) -> a.severity().compareTo(b.severity()))
                .orElseThrow(() -> new IllegalStateException("No guardrail violation"));
        String where = worst.key() != null ? " in '" + worst.key() + "'" : "";
        return new GuardrailViolationException(worst.scanner(), worst.severity(), phase, worst.message() + where);
    }
}
