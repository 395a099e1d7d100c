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

package dev.mars.stepflow.action.llm;

import java.util.Objects;

/**
 * A single completion request.
 */
public final class LlmRequest {

    private final String systemPrompt;
    private final String prompt;
    private final String model;
    private final boolean jsonResponse;

    public LlmRequest(String systemPrompt, String prompt, String model, boolean jsonResponse) {
        this.systemPrompt = systemPrompt;
        this.prompt = Objects.requireNonNull(prompt, "Prompt cannot be null");
        this.model = model;
        this.jsonResponse = jsonResponse;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public String getPrompt() {
        return prompt;
    }

    /**
     * Requested model, or {@code null} for the client default.
     */
    public String getModel() {
        return model;
    }

    public boolean isJsonResponse() {
        return jsonResponse;
    }

    @Override
    public String toString() {
        return "LlmRequest{model='" + model + "', jsonResponse=" + jsonResponse +
                ", promptLength=" + prompt.length() + "}";
    }
}
