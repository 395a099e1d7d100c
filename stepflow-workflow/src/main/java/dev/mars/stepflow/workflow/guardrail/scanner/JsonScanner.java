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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.workflow.guardrail.GuardrailScanner;
import dev.mars.stepflow.workflow.guardrail.ScanResult;
import dev.mars.stepflow.workflow.guardrail.Severity;

import java.util.Map;

/**
 * Requires the payload to be a well-formed JSON document.
 */
public class JsonScanner implements GuardrailScanner {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public ScanResult scan(String text, Map<String, Object> params) {
        if (text.isBlank()) {
            return ScanResult.violation(text, ScannerParameters.getSeverity(params, Severity.MEDIUM),
                    "Payload is empty, expected JSON");
        }
        try {
            MAPPER.readTree(text);
            return ScanResult.pass(text);
        } catch (JsonProcessingException e) {
            return ScanResult.violation(text, ScannerParameters.getSeverity(params, Severity.MEDIUM),
                    "Payload is not valid JSON: " + e.getOriginalMessage());
        }
    }
}
