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

/**
 * Typed access to scanner parameters.
 */
final class ScannerParameters {

    static final String REDACTED = "[REDACTED]";

    private ScannerParameters() {
    }

    static boolean getBoolean(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    static long getLong(Map<String, Object> params, String key, long defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer", e);
        }
    }

    static Severity getSeverity(Map<String, Object> params, Severity defaultValue) {
        Object value = params.get("severity");
        return Severity.fromString(value != null ? value.toString() : null, defaultValue);
    }

    /**
     * A list parameter that may also be given as a single string.
     */
    static List<String> getStrings(Map<String, Object> params, String key) {
        Object value = params.get(key);
        List<String> values = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    values.add(item.toString());
                }
            }
        } else if (value != null) {
            values.add(value.toString());
        }
        return values;
    }
}
