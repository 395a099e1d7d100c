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

package dev.mars.stepflow.workflow.engine;

import dev.mars.stepflow.workflow.InputDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coerces the values supplied for a run to the declared input types, applies
 * defaults and checks {@code required}, {@code pattern}, {@code min}/{@code max}
 * and {@code enum}. All problems are reported together.
 */
public class InputResolver {
    private static final Logger logger = LoggerFactory.getLogger(InputResolver.class);

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "on", "y");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "0", "off", "n");

    private final Path workspace;

    public InputResolver(Path workspace) {
        this.workspace = workspace;
    }

    public Map<String, Object> resolve(Map<String, InputDefinition> definitions, Map<String, Object> supplied)
            throws InputValidationException {
        Map<String, Object> values = supplied != null ? supplied : Map.of();
        List<String> problems = new ArrayList<>();
        for (String name : values.keySet()) {
            if (!definitions.containsKey(name)) {
                problems.add("unknown input '" + name + "'");
            }
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (InputDefinition definition : definitions.values()) {
            String name = definition.getName();
            Object raw = values.get(name);
            if (raw == null) {
                if (definition.hasDefault()) {
                    resolved.put(name, definition.getDefaultValue());
                } else if (definition.isRequired()) {
                    problems.add("input '" + name + "' is required");
                } else {
                    resolved.put(name, null);
                }
                continue;
            }
            try {
                Object value = coerce(definition, raw);
                check(definition, value);
                resolved.put(name, value);
            } catch (IllegalArgumentException e) {
                problems.add("input '" + name + "': " + e.getMessage());
            }
        }
        if (!problems.isEmpty()) {
            throw new InputValidationException(problems);
        }
        logger.debug("Resolved {} input(s)", resolved.size());
        return resolved;
    }

    Object coerce(InputDefinition definition, Object raw) {
        switch (definition.getType()) {
            case BOOLEAN:
                if (raw instanceof Boolean) {
                    return raw;
                }
                String flag = raw.toString().trim().toLowerCase(Locale.ROOT);
                if (TRUE_VALUES.contains(flag)) {
                    return true;
                }
                if (FALSE_VALUES.contains(flag)) {
                    return false;
                }
                throw new IllegalArgumentException("expected a boolean, got '" + raw + "'");
            case INTEGER:
                if (raw instanceof Long) {
                    return raw;
                }
                if (raw instanceof Number) {
                    double number = ((Number) raw).doubleValue();
                    if (number == Math.rint(number) && !Double.isInfinite(number)) {
                        return (long) number;
                    }
                    throw new IllegalArgumentException("expected an integer, got " + raw);
                }
                try {
                    return Long.parseLong(raw.toString().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("expected an integer, got '" + raw + "'");
                }
            case FILE:
                Path path = workspace.resolve(raw.toString());
                if (!Files.exists(path)) {
                    throw new IllegalArgumentException("file '" + raw + "' does not exist");
                }
                return raw.toString();
            default:
                if (raw instanceof Map || raw instanceof List) {
                    throw new IllegalArgumentException("expected a string");
                }
                return raw.toString();
        }
    }

    private static void check(InputDefinition definition, Object value) {
        if (definition.getPattern() != null && value instanceof String
                && !Pattern.compile(definition.getPattern()).matcher((String) value).matches()) {
            throw new IllegalArgumentException("value does not match pattern " + definition.getPattern());
        }
        if (value instanceof Long) {
            long number = (Long) value;
            if (definition.getMin() != null && number < definition.getMin()) {
                throw new IllegalArgumentException(number + " is below the minimum " + definition.getMin());
            }
            if (definition.getMax() != null && number > definition.getMax()) {
                throw new IllegalArgumentException(number + " is above the maximum " + definition.getMax());
            }
        }
        if (!definition.getAllowedValues().isEmpty() && !definition.getAllowedValues().contains(value)) {
            throw new IllegalArgumentException("value must be one of " + definition.getAllowedValues());
        }
    }
}
