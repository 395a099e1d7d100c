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

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks the model to pick exactly one of {@code with.choices}.
 */
public class LlmDecideAction extends AbstractLlmAction {

    public static final String ACTION_ID = "llm/decide";

    public LlmDecideAction(LlmClient llmClient) {
        super(llmClient);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        List<String> choices = params.getStringList("choices");
        if (choices.isEmpty()) {
            throw params.invalid("'choices' must contain at least one option");
        }
        String question = params.getString("prompt", "Choose the most appropriate option.");
        String instruction = question + "\n\nAnswer with exactly one of: " + String.join(", ", choices);

        LlmResponse response = complete(params, withContent(instruction, params.getString("content")), false);
        String decision = match(response.getText(), choices);
        if (decision == null) {
            throw new ActionException(ACTION_ID, ActionException.KIND_LLM,
                    "model answer did not match any choice: " + response.getText().trim());
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("decision", decision);
        outputs.put("choices", choices);
        return ActionResult.of(outputs);
    }

    static String match(String answer, List<String> choices) {
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        for (String choice : choices) {
            if (normalized.equals(choice.toLowerCase(Locale.ROOT))) {
                return choice;
            }
        }
        String best = null;
        int bestIndex = Integer.MAX_VALUE;
        for (String choice : choices) {
            int index = normalized.indexOf(choice.toLowerCase(Locale.ROOT));
            if (index >= 0 && index < bestIndex) {
                best = choice;
                bestIndex = index;
            }
        }
        return best;
    }
}
