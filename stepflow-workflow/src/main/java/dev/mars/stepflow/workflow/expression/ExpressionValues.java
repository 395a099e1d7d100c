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

package dev.mars.stepflow.workflow.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Truthiness, equality, ordering and text rendering for expression values.
 */
public final class ExpressionValues {

    static final ObjectMapper JSON = new ObjectMapper();

    private ExpressionValues() {
    }

    public static boolean isTruthy(Object value) {
        if (Undefined.isMissing(value)) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    public static boolean valuesEqual(Object left, Object right) {
        Object a = left == Undefined.INSTANCE ? null : left;
        Object b = right == Undefined.INSTANCE ? null : right;
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) {
                return x.longValue() == y.longValue();
            }
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Orders two numbers or two strings.
     *
     * @throws ExpressionException for any other combination
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Number x && right instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) {
                return Long.compare(x.longValue(), y.longValue());
            }
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (left instanceof String x && right instanceof String y) {
            return x.compareTo(y);
        }
        throw new ExpressionException("cannot compare " + typeName(left) + " with " + typeName(right));
    }

    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value == Undefined.INSTANCE) {
            return "undefined";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (isIntegral(value)) {
            return "integer";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof List) {
            return "list";
        }
        if (value instanceof Map || value instanceof LazyScope) {
            return "mapping";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Renders a value for splicing into text. Missing values render empty,
     * lists and mappings render as JSON.
     */
    public static String toText(Object value) {
        if (Undefined.isMissing(value)) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Map || value instanceof List || value instanceof LazyScope) {
            return toJson(value);
        }
        return value.toString();
    }

    public static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(toPlain(value));
        } catch (JsonProcessingException e) {
            throw new ExpressionException("value cannot be converted to JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Converts a value to plain maps and lists, materialising lazy scopes and
     * dropping undefined markers.
     */
    public static Object toPlain(Object value) {
        if (value == Undefined.INSTANCE) {
            return null;
        }
        if (value instanceof LazyScope scope) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String key : scope.keys()) {
                copy.put(key, toPlain(scope.get(key)));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), toPlain(item)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>();
            collection.forEach(item -> copy.add(toPlain(item)));
            return copy;
        }
        return value;
    }
}
