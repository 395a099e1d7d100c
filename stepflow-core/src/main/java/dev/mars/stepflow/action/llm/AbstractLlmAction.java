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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shared plumbing for the llm/* actions: client lookup, prompt assembly and
 * lenient JSON extraction from model responses.
 */
public abstract class AbstractLlmAction implements WorkflowAction {
    private static final Logger logger = LoggerFactory.getLogger(AbstractLlmAction.class);

    protected final LlmClient llmClient;
    protected final ObjectMapper objectMapper = new ObjectMapper();

    protected AbstractLlmAction(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    protected LlmResponse complete(ActionParameters params, String prompt, boolean json) throws ActionException {
        if (llmClient == null) {
            throw new ActionException(getActionId(), ActionException.KIND_CONFIGURATION,
                    "no LLM client is configured");
        }
        LlmRequest request = new LlmRequest(params.getString("system"), prompt, params.getString("model"), json);
        logger.debug("Calling LLM for {}: {}", getActionId(), request);
        return llmClient.complete(request);
    }

    protected String withContent(String instruction, String content) {
        if (content == null || content.isBlank()) {
            return instruction;
        }
        return instruction + "\n\nContent:\n" + content;
    }

    /**
     * Parses the first JSON document found in a model response. Markdown code
     * fences and leading prose are tolerated.
     */
    protected Optional<Object> parseJson(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String candidate = stripFences(text.trim());
        int objectStart = candidate.indexOf('{');
        int arrayStart = candidate.indexOf('[');
        int start = objectStart < 0 ? arrayStart : (arrayStart < 0 ? objectStart : Math.min(objectStart, arrayStart));
        if (start < 0) {
            return Optional.empty();
        }
        char close = candidate.charAt(start) == '{' ? '}' : ']';
        int end = candidate.lastIndexOf(close);
        if (end <= start) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(candidate.substring(start, end + 1), Object.class));
        } catch (JsonProcessingException e) {
            logger.debug("Response is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).trim();
    }
}
