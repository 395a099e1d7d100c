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

package dev.mars.stepflow.workflow.guardrail.scanner;

import dev.mars.stepflow.workflow.guardrail.GuardrailScanner;
import dev.mars.stepflow.workflow.guardrail.ScanResult;
import dev.mars.stepflow.workflow.guardrail.Severity;

import java.util.Map;

/**
 * Rejects payloads with more whitespace separated tokens than {@code limit}.
 */
public class TokenLimitScanner implements GuardrailScanner {

    static final long DEFAULT_LIMIT = 4096;

    @Override
    public String getName() {
        return "token_limit";
    }

    @Override
    public ScanResult scan(String text, Map<String, Object> params) {
        long limit = ScannerParameters.getLong(params, "limit", DEFAULT_LIMIT);
        if (limit < 1) {
            throw new IllegalArgumentException("'limit' must be positive");
        }
        String trimmed = text.trim();
        long tokens = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        if (tokens > limit) {
            return ScanResult.violation(text, ScannerParameters.getSeverity(params, Severity.LOW),
                    "Payload has " + tokens + " tokens, limit is " + limit);
        }
        return ScanResult.pass(text);
    }
}
