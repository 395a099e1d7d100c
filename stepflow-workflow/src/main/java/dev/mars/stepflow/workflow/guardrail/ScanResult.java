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

import java.util.Objects;

/**
 * Result of running one scanner over a text payload. A passing result may carry
 * a transformed payload (for example with secrets redacted).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScanResult {

    private final boolean passed;
    private final String text;
    private final Severity severity;
    private final String message;

    private ScanResult(boolean passed, String text, Severity severity, String message) {
        this.passed = passed;
        this.text = Objects.requireNonNull(text, "Text cannot be null");
        this.severity = severity;
        this.message = message;
    }

    public static ScanResult pass(String text) {
        return new ScanResult(true, text, null, null);
    }

    /**
     * Passing result whose payload was rewritten by the scanner.
     */
    public static ScanResult sanitized(String text, String message) {
        return new ScanResult(true, text, null, message);
    }

    public static ScanResult violation(String text, Severity severity, String message) {
        return new ScanResult(false, text, Objects.requireNonNull(severity, "Severity cannot be null"), message);
    }

    public boolean isPassed() {
        return passed;
    }

    public String getText() {
        return text;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (passed) {
            return "ScanResult{passed}";
        }
        return "ScanResult{violation, severity=" + severity + ", message='" + message + "'}";
    }
}
