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
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for scanners that look for regular expression matches. With
 * {@code redact: true} matches are replaced and the payload passes, otherwise
 * any match is a violation.
 */
public abstract class PatternScanner implements GuardrailScanner {

    protected abstract List<Pattern> patterns(Map<String, Object> params);

    protected abstract Severity defaultSeverity();

    protected abstract String describe(int matches);

    @Override
    public ScanResult scan(String text, Map<String, Object> params) {
        boolean redact = ScannerParameters.getBoolean(params, "redact", false);
        int matches = 0;
        String current = text;
        for (Pattern pattern : patterns(params)) {
            Matcher matcher = pattern.matcher(current);
            if (!matcher.find()) {
                continue;
            }
            matcher.reset();
            while (matcher.find()) {
                matches++;
            }
            if (redact) {
                current = pattern.matcher(current).replaceAll(Matcher.quoteReplacement(ScannerParameters.REDACTED));
            }
        }
        if (matches == 0) {
            return ScanResult.pass(text);
        }
        if (redact) {
            return ScanResult.sanitized(current, describe(matches) + " redacted");
        }
        return ScanResult.violation(text, ScannerParameters.getSeverity(params, defaultSeverity()), describe(matches));
    }
}
