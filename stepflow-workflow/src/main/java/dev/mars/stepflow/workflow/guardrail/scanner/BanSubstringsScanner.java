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

import java.util.List;
import java.util.Locale;
import java.util.Map;

public class BanSubstringsScanner implements GuardrailScanner {

    @Override
    public String getName() {
        return "ban_substrings";
    }

    @Override
    public ScanResult scan(String text, Map<String, Object> params) {
        List<String> banned = ScannerParameters.getStrings(params, "substrings");
        if (banned.isEmpty()) {
            throw new IllegalArgumentException("ban_substrings scanner requires 'substrings'");
        }
        boolean caseSensitive = ScannerParameters.getBoolean(params, "case_sensitive", false);
        String haystack = caseSensitive ? text : text.toLowerCase(Locale.ROOT);
        for (String substring : banned) {
            String needle = caseSensitive ? substring : substring.toLowerCase(Locale.ROOT);
            if (!needle.isEmpty() && haystack.contains(needle)) {
                return ScanResult.violation(text, ScannerParameters.getSeverity(params, Severity.MEDIUM),
                        "Banned substring '" + substring + "' found");
            }
        }
        return ScanResult.pass(text);
    }
}
