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

package dev.mars.stepflow.workflow.graph;

/**
 * The step lists of a job or document, in the order the engine may walk them.
 */
public enum Phase {
    MAIN("steps"),
    ON_COMPLETE("on_complete"),
    ON_FAILURE("on_failure"),
    FINALLY("finally");

    private final String key;

    Phase(String key) {
        this.key = key;
    }

    /**
     * The document key of the step list.
     */
    public String getKey() {
        return key;
    }

    public boolean isHook() {
        return this != MAIN;
    }
}
