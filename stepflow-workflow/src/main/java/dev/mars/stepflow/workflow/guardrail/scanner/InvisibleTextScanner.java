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

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Strips zero-width and bidirectional control characters. Never fails.
 */
public class InvisibleTextScanner implements GuardrailScanner {

    private static final Pattern INVISIBLE =
            Pattern.compile("[\\u200B-\\u200F\\u202A-\\u202E\\u2060-\\u2064\\u2066-\\u2069\\uFEFF\\u00AD]");

    @Override
    public String getName() {
        return "invisible_text";
    }

    @Override
    public ScanResult scan(String text, Map<String, Object> params) {
        String cleaned = INVISIBLE.matcher(text).replaceAll("");
        if (cleaned.length() == text.length()) {
            return ScanResult.pass(text);
        }
        return ScanResult.sanitized(cleaned, (text.length() - cleaned.length()) + " invisible character(s) removed");
    }
}
