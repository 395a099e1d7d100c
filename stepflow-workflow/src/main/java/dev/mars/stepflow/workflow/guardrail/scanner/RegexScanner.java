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

import dev.mars.stepflow.workflow.guardrail.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Flags payloads matching any of the configured {@code patterns}.
 */
public class RegexScanner extends PatternScanner {

    @Override
    public String getName() {
        return "regex";
    }

    @Override
    protected List<Pattern> patterns(Map<String, Object> params) {
        List<String> sources = ScannerParameters.getStrings(params, "patterns");
        sources.addAll(ScannerParameters.getStrings(params, "pattern"));
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("regex scanner requires 'patterns'");
        }
        List<Pattern> patterns = new ArrayList<>();
        for (String source : sources) {
            try {
                patterns.add(Pattern.compile(source));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid pattern '" + source + "': " + e.getDescription(), e);
            }
        }
        return patterns;
    }

    @Override
    protected Severity defaultSeverity() {
        return Severity.MEDIUM;
    }

    @Override
    protected String describe(int matches) {
        return "Pattern matched " + matches + " time(s)";
    }
}
