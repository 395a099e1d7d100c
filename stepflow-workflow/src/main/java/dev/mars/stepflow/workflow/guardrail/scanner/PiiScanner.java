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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects personally identifiable information. {@code types} restricts the check
 * to a subset of {@code ssn}, {@code card}, {@code email} and {@code phone}.
 */
public class PiiScanner extends PatternScanner {

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("ssn", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"));
        PATTERNS.put("card", Pattern.compile("\\b(?:\\d[ -]?){15}\\d\\b"));
        PATTERNS.put("email", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"));
        PATTERNS.put("phone", Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b"));
    }

    @Override
    public String getName() {
        return "pii";
    }

    @Override
    protected List<Pattern> patterns(Map<String, Object> params) {
        List<String> types = ScannerParameters.getStrings(params, "types");
        if (types.isEmpty()) {
            return new ArrayList<>(PATTERNS.values());
        }
        List<Pattern> selected = new ArrayList<>();
        for (String type : types) {
            Pattern pattern = PATTERNS.get(type.toLowerCase(Locale.ROOT));
            if (pattern == null) {
                throw new IllegalArgumentException("Unknown PII type '" + type + "', expected one of "
                        + PATTERNS.keySet());
            }
            selected.add(pattern);
        }
        return selected;
    }

    @Override
    protected Severity defaultSeverity() {
        return Severity.HIGH;
    }

    @Override
    protected String describe(int matches) {
        return "PII detected: " + matches + " match(es)";
    }
}
