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

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects credentials: API keys, passwords, bearer tokens, cloud access keys,
 * private key blocks and well known vendor token formats.
 */
public class SecretsScanner extends PatternScanner {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?i)(api[_-]?key|apikey)\\s*[:=]\\s*[\"']?[\\w-]{20,}"),
            Pattern.compile("(?i)(secret|password|passwd|pwd)\\s*[:=]\\s*[\"']?[^\\s\"']{8,}"),
            Pattern.compile("(?i)(token|bearer)\\s*[:=]\\s*[\"']?[\\w-]{20,}"),
            Pattern.compile("(?i)aws[_-]?(access|secret)[_-]?key\\s*[:=]\\s*[\"']?[\\w/+=]{20,}"),
            Pattern.compile("AKIA[0-9A-Z]{16}"),
            Pattern.compile("-----BEGIN (RSA |DSA |EC |OPENSSH )?PRIVATE KEY-----"),
            Pattern.compile("(ghp_|gho_|ghu_|ghs_|ghr_)[a-zA-Z0-9]{36}"),
            Pattern.compile("sk-[a-zA-Z0-9]{48}"),
            Pattern.compile("xox[baprs]-[\\w-]+"));

    @Override
    public String getName() {
        return "secrets";
    }

    @Override
    protected List<Pattern> patterns(Map<String, Object> params) {
        return PATTERNS;
    }

    @Override
    protected Severity defaultSeverity() {
        return Severity.CRITICAL;
    }

    @Override
    protected String describe(int matches) {
        return "Potential secrets detected: " + matches + " match(es)";
    }
}
