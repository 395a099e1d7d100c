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
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts structured fields from {@code with.content}. The outputs are the
 * fields of the caller-supplied JSON schema, checked against that schema.
 */
public class LlmExtractAction extends AbstractLlmAction {

    public static final String ACTION_ID = "llm/extract";

    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    public LlmExtractAction(LlmClient llmClient) {
        super(llmClient);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    @SuppressWarnings("unchecked")
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String content = params.requireString("content");
        Map<String, Object> schema = params.getMap("schema");
        if (schema.isEmpty()) {
            throw params.invalid("'schema' is required");
        }

        String schemaText;
        try {
            schemaText = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw params.invalid("schema cannot be serialised: " + e.getOriginalMessage());
        }
        String instruction = params.getString("prompt",
                "Extract the requested information and answer with a single JSON object only.")
                + "\n\nJSON schema:\n" + schemaText;

        LlmResponse response = complete(params, withContent(instruction, content), true);
        Object parsed = parseJson(response.getText()).orElseThrow(() ->
                new ActionException(ACTION_ID, ActionException.KIND_LLM, "model response did not contain JSON"));
        if (!(parsed instanceof Map)) {
            throw new ActionException(ACTION_ID, ActionException.KIND_LLM, "model response was not a JSON object");
        }

        JsonSchema jsonSchema = schemaFactory.getSchema(objectMapper.valueToTree(schema));
        JsonNode document = objectMapper.valueToTree(parsed);
        Set<ValidationMessage> errors = jsonSchema.validate(document);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).sorted()
                    .collect(Collectors.joining("; "));
            throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION,
                    "extracted data does not match schema: " + detail,
                    new LinkedHashMap<>((Map<String, Object>) parsed));
        }
        return ActionResult.of(new LinkedHashMap<>((Map<String, Object>) parsed));
    }
}
