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

package dev.mars.stepflow.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the plain value model shared by actions, expressions and checkpoints:
 * {@code null}, {@link String}, {@link Boolean}, {@link Long}, {@link Double},
 * {@link List} and string-keyed {@link Map}.
 */
public final class Values {

    private Values() {
    }

    /**
     * Converts an arbitrary value (for example one produced by a YAML parser) into the
     * plain value model. Integral numbers become {@code Long}, other numbers
     * {@code Double}, maps get string keys and keep their insertion order.
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).longValue();
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            return decimal.scale() <= 0 ? (Object) decimal.longValue() : (Object) decimal.doubleValue();
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(normalize(item));
            }
            return copy;
        }
        if (value instanceof Object[]) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Object[]) value) {
                copy.add(normalize(item));
            }
            return copy;
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof Instant) {
            return value.toString();
        }
        return value.toString();
    }

    /**
     * Normalizes every value of a mapping.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeMap(Map<String, ?> values) {
        if (values == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) normalize(values);
    }

    /**
     * Renders a value as text. {@code null} renders as the empty string and whole
     * doubles keep their decimal point.
     */
    public static String asText(Object value) {
        if (value == null) {
            return "";
        }
        return value.toString();
    }
}
