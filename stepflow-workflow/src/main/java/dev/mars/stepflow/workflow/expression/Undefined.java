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

/**
 * Marker for a missing key or unbound root. Attribute access on it yields itself,
 * it renders as the empty string and is falsy; the {@code default} filter
 * replaces it.
 */
public enum Undefined {
    INSTANCE;

    public static boolean isMissing(Object value) {
        return value == null || value == INSTANCE;
    }

    @Override
    public String toString() {
        return "";
    }
}
