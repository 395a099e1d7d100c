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

import dev.mars.stepflow.workflow.Step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Effective guardrail configuration for one step: the input and output scanners
 * with their parameters, the violation policy and the retry limit.
 *
 * <p>Step configuration is deep merged over the workflow defaults, so a step that
 * adds one scanner keeps the inherited ones. A step whose {@code guardrails} is
 * {@code false} runs with no scanners at all.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class GuardrailConfig {

    public static final String ON_FAIL_ABORT = "abort";
    public static final String ON_FAIL_RETRY = "retry";
    public static final String ON_FAIL_CONTINUE = "continue";

    private static final Set<String> KEYS = Set.of("input", "output", "on_fail", "max_retries");
    private static final GuardrailConfig DISABLED = new GuardrailConfig(Map.of(), Map.of(), ON_FAIL_ABORT, null);

    private final Map<String, Map<String, Object>> inputScanners;
    private final Map<String, Map<String, Object>> outputScanners;
    private final String onFail;
    private final Integer maxRetries;

    private GuardrailConfig(Map<String, Map<String, Object>> inputScanners,
                            Map<String, Map<String, Object>> outputScanners,
                            String onFail, Integer maxRetries) {
        this.inputScanners = Collections.unmodifiableMap(new LinkedHashMap<>(inputScanners));
        this.outputScanners = Collections.unmodifiableMap(new LinkedHashMap<>(outputScanners));
        this.onFail = onFail;
        this.maxRetries = maxRetries;
    }

    public static GuardrailConfig disabled() {
        return DISABLED;
    }

    /**
     * Builds a configuration from a {@code guardrails:} mapping.
     *
     * @throws IllegalArgumentException if the mapping is malformed
     */
    public static GuardrailConfig fromMap(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return DISABLED;
        }
        for (String key : config.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown guardrails key '" + key + "'");
            }
        }
        Map<String, Map<String, Object>> input = scannerMap(config.get("input"), "input");
        Map<String, Map<String, Object>> output = scannerMap(config.get("output"), "output");
        Object onFailValue = config.get("on_fail");
        String onFail = onFailValue != null ? onFailValue.toString().trim() : ON_FAIL_ABORT;
        if (onFail.isEmpty()) {
            throw new IllegalArgumentException("'on_fail' cannot be empty");
        }
        Integer maxRetries = null;
        Object retriesValue = config.get("max_retries");
        if (retriesValue != null) {
            if (!(retriesValue instanceof Number)) {
                throw new IllegalArgumentException("'max_retries' must be an integer");
            }
            maxRetries = ((Number) retriesValue).intValue();
            if (maxRetries < 0) {
                throw new IllegalArgumentException("'max_retries' cannot be negative");
            }
        }
        return new GuardrailConfig(input, output, onFail, maxRetries);
    }

    /**
     * Effective configuration of a step given the workflow defaults.
     */
    public static GuardrailConfig effective(Map<String, Object> workflowDefaults, Step step) {
        if (step.isGuardrailsDisabled()) {
            return DISABLED;
        }
        return fromMap(merge(workflowDefaults, step.getGuardrails()));
    }

    /**
     * Deep merge of {@code override} over {@code base}. Nested mappings merge key by
     * key; any other value in {@code override} replaces the base value.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (override == null) {
            return merged;
        }
        for (Map.Entry<String, Object> entry : override.entrySet()) {
            Object existing = merged.get(entry.getKey());
            Object value = entry.getValue();
            if (existing instanceof Map && value instanceof Map) {
                merged.put(entry.getKey(), merge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else {
                merged.put(entry.getKey(), value);
            }
        }
        return merged;
    }

    /**
     * Whether a {@code guardrails:} value switches guardrails off.
     */
    public static boolean isDisabledValue(Object value) {
        if (Boolean.FALSE.equals(value)) {
            return true;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim().toLowerCase(Locale.ROOT);
            return text.equals("false") || text.equals("off") || text.equals("0") || text.equals("no");
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> scannerMap(Object value, String key) {
        Map<String, Map<String, Object>> scanners = new LinkedHashMap<>();
        if (value == null) {
            return scanners;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping of scanner names");
        }
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            Object params = entry.getValue();
            if (params == null || Boolean.TRUE.equals(params)) {
                scanners.put(entry.getKey(), Map.of());
            } else if (Boolean.FALSE.equals(params)) {
                // explicitly switched off by an override
                continue;
            } else if (params instanceof Map) {
                scanners.put(entry.getKey(), (Map<String, Object>) params);
            } else {
                throw new IllegalArgumentException("Parameters of scanner '" + entry.getKey()
                        + "' must be a mapping");
            }
        }
        return scanners;
    }

    public Map<String, Map<String, Object>> getInputScanners() {
        return inputScanners;
    }

    public Map<String, Map<String, Object>> getOutputScanners() {
        return outputScanners;
    }

    public Map<String, Map<String, Object>> getScanners(GuardrailPhase phase) {
        return phase == GuardrailPhase.INPUT ? inputScanners : outputScanners;
    }

    public Set<String> getScannerNames() {
        Set<String> names = new LinkedHashSet<>(inputScanners.keySet());
        names.addAll(outputScanners.keySet());
        return names;
    }

    public int getScannerCount() {
        return inputScanners.size() + outputScanners.size();
    }

    public boolean isEmpty() {
        return inputScanners.isEmpty() && outputScanners.isEmpty();
    }

    public String getOnFail() {
        return onFail;
    }

    /**
     * Whether {@code on_fail} names a step to jump to.
     */
    public boolean isJumpOnFail() {
        return !onFail.equals(ON_FAIL_ABORT) && !onFail.equals(ON_FAIL_RETRY) && !onFail.equals(ON_FAIL_CONTINUE);
    }

    /**
     * The configured retry limit, or {@code defaultValue} when none is set.
     */
    public int getMaxRetries(int defaultValue) {
        return maxRetries != null ? maxRetries : defaultValue;
    }

    @Override
    public String toString() {
        return "GuardrailConfig{input=" + inputScanners.keySet() + ", output=" + outputScanners.keySet()
                + ", onFail='" + onFail + "'}";
    }
}
