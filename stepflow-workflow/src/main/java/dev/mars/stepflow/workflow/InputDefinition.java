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

package dev.mars.stepflow.workflow;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declaration of one workflow input.
 */
public class InputDefinition {

    public enum InputType {
        STRING, INTEGER, BOOLEAN, FILE;

        public static InputType fromString(String value) {
            if (value == null) {
                return STRING;
            }
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "string":
                    return STRING;
                case "integer":
                case "int":
                    return INTEGER;
                case "boolean":
                case "bool":
                    return BOOLEAN;
                case "file":
                    return FILE;
                default:
                    throw new IllegalArgumentException("Unknown input type: " + value);
            }
        }

        public String toYamlValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String name;
    private final InputType type;
    private final boolean required;
    private final Object defaultValue;
    private final boolean hasDefault;
    private final String description;
    private final String pattern;
    private final Long min;
    private final Long max;
    private final List<Object> allowedValues;
    private final boolean secret;

    private InputDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Input name cannot be null");
        this.type = builder.type != null ? builder.type : InputType.STRING;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
        this.required = builder.required != null ? builder.required : !builder.hasDefault;
        this.description = builder.description;
        this.pattern = builder.pattern;
        this.min = builder.min;
        this.max = builder.max;
        this.allowedValues = builder.allowedValues != null ? List.copyOf(builder.allowedValues) : List.of();
        this.secret = builder.secret;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public InputType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    public String getPattern() {
        return pattern;
    }

    public Long getMin() {
        return min;
    }

    public Long getMax() {
        return max;
    }

    public List<Object> getAllowedValues() {
        return allowedValues;
    }

    /**
     * Whether the value is masked in logs and events.
     */
    public boolean isSecret() {
        return secret;
    }

    @Override
    public String toString() {
        return "InputDefinition{name='" + name + "', type=" + type + ", required=" + required + "}";
    }

    public static class Builder {
        private final String name;
        private InputType type;
        private Boolean required;
        private Object defaultValue;
        private boolean hasDefault;
        private String description;
        private String pattern;
        private Long min;
        private Long max;
        private List<Object> allowedValues;
        private boolean secret;

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(InputType type) {
            this.type = type;
            return this;
        }

        public Builder required(Boolean required) {
            this.required = required;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            this.hasDefault = true;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder min(Long min) {
            this.min = min;
            return this;
        }

        public Builder max(Long max) {
            this.max = max;
            return this;
        }

        public Builder allowedValues(List<Object> allowedValues) {
            this.allowedValues = allowedValues;
            return this;
        }

        public Builder secret(boolean secret) {
            this.secret = secret;
            return this;
        }

        public InputDefinition build() {
            return new InputDefinition(this);
        }
    }
}
