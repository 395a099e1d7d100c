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

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Returned by an action that needs externally supplied input before it can
 * complete. The engine persists the run and yields; the step is re-dispatched
 * with the answer when the run is resumed.
 */
public final class SuspensionRequest {

    private final String prompt;
    private final String inputType;
    private final List<String> choices;
    private final Duration timeout;

    public SuspensionRequest(String prompt, String inputType, List<String> choices, Duration timeout) {
        this.prompt = Objects.requireNonNull(prompt, "Prompt cannot be null");
        this.inputType = inputType != null ? inputType : "text";
        this.choices = choices != null ? List.copyOf(choices) : List.of();
        this.timeout = timeout;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getInputType() {
        return inputType;
    }

    public List<String> getChoices() {
        return choices;
    }

    /**
     * How long the request stays answerable, or {@code null} for no limit.
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "SuspensionRequest{prompt='" + prompt + "', inputType='" + inputType + "', choices=" + choices + "}";
    }
}
