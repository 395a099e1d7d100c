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

import java.util.Locale;

/**
 * How the standard output of a process is captured.
 */
public enum CaptureMode {
    MEMORY,
    FILE,
    NONE;

    public static CaptureMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEMORY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown capture mode: " + value, e);
        }
    }

    public String toYamlValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
