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

package dev.mars.stepflow.action;

import dev.mars.stepflow.core.exceptions.ActionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over a resolved {@code with} mapping. Type mismatches are
 * reported as {@link ActionException}s of kind {@code validation}.
 */
public final class ActionParameters {

    private final String actionId;
    private final Map<String, Object> values;

    public ActionParameters(String actionId, Map<String, Object> values) {
        this.actionId = actionId;
        this.values = values != null ? values : Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.toString();
    }

    public String requireString(String key) throws ActionException {
        String value = getString(key);
        if (value == null || value.isBlank()) {
            throw invalid("'" + key + "' is required");
        }
        return value;
    }

    public long getLong(String key, long defaultValue) throws ActionException {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid("'" + key + "' must be an integer, got: " + value);
        }
    }

    public double getDouble(String key, double defaultValue) throws ActionException {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid("'" + key + "' must be a number, got: " + value);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase();
        return text.equals("true") || text.equals("yes") || text.equals("1") || text.equals("on");
    }

    /**
     * Reads a duration given in (possibly fractional) seconds.
     */
    public Duration getSeconds(String key, Duration defaultValue) throws ActionException {
        if (!has(key)) {
            return defaultValue;
        }
        double seconds = getDouble(key, 0);
        if (seconds < 0) {
            throw invalid("'" + key + "' must not be negative");
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) throws ActionException {
        Object value = values.get(key);
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw invalid("'" + key + "' must be a mapping");
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }

    public List<Object> getList(String key) throws ActionException {
        Object value = values.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof List)) {
            throw invalid("'" + key + "' must be a list");
        }
        return new ArrayList<>((List<?>) value);
    }

    public List<String> getStringList(String key) throws ActionException {
        List<String> result = new ArrayList<>();
        for (Object item : getList(key)) {
            result.add(item != null ? item.toString() : "");
        }
        return result;
    }

    public ActionException invalid(String message) {
        return new ActionException(actionId, ActionException.KIND_VALIDATION, message);
    }
}
