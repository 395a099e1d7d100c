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

import dev.mars.stepflow.core.exceptions.ActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the configured scanners of one phase over the string values of a payload.
 * Rewriting scanners feed their output into the next scanner; violations are
 * collected so the caller can apply the {@code on_fail} policy.
 *
 * <p>Thread-safe: holds no per-run state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GuardrailPipeline {
    private static final Logger logger = LoggerFactory.getLogger(GuardrailPipeline.class);

    private final ScannerRegistry registry;

    public GuardrailPipeline(ScannerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Scanner registry cannot be null");
    }

    public ScannerRegistry getRegistry() {
        return registry;
    }

    /**
     * Scans every string value of {@code values} with the phase's scanners.
     * Non-string values pass through untouched.
     *
     * @throws ActionException with kind {@code configuration} if a scanner is unknown
     *                         or its parameters are invalid
     */
    public GuardrailOutcome scan(GuardrailConfig config, GuardrailPhase phase, Map<String, Object> values)
            throws ActionException {
        Map<String, Map<String, Object>> scanners = config.getScanners(phase);
        Map<String, Object> result = new LinkedHashMap<>(values);
        List<GuardrailOutcome.Violation> violations = new ArrayList<>();
        if (scanners.isEmpty()) {
            return new GuardrailOutcome(phase, result, violations);
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                continue;
            }
            String text = (String) entry.getValue();
            for (Map.Entry<String, Map<String, Object>> scannerEntry : scanners.entrySet()) {
                ScanResult scanResult = runScanner(scannerEntry.getKey(), scannerEntry.getValue(), text);
                if (scanResult.isPassed()) {
                    if (!scanResult.getText().equals(text)) {
                        logger.debug("Guardrail '{}' rewrote {} value '{}': {}", scannerEntry.getKey(),
                                phase.toYamlValue(), entry.getKey(), scanResult.getMessage());
                    }
                    text = scanResult.getText();
                } else {
                    violations.add(new GuardrailOutcome.Violation(scannerEntry.getKey(), entry.getKey(),
                            scanResult.getSeverity(), scanResult.getMessage()));
                }
            }
            result.put(entry.getKey(), text);
        }
        return new GuardrailOutcome(phase, result, violations);
    }

    private ScanResult runScanner(String name, Map<String, Object> params, String text) throws ActionException {
        GuardrailScanner scanner = registry.getScanner(name)
                .orElseThrow(() -> new ActionException("guardrail/" + name, ActionException.KIND_CONFIGURATION,
                        "Unknown guardrail scanner '" + name + "'"));
        try {
            return scanner.scan(text, params != null ? params : Map.of());
        } catch (IllegalArgumentException e) {
            throw new ActionException("guardrail/" + name, ActionException.KIND_CONFIGURATION, e.getMessage(), e);
        }
    }
}
