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
import dev.mars.stepflow.action.SuspensionRequest;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends instructions to the model, or in airgapped mode hands them to a human
 * operator and suspends the run until their feedback is supplied.
 */
public class LlmInstructAction extends AbstractLlmAction {

    public static final String ACTION_ID = "llm/instruct";

    private final boolean airgappedByDefault;

    public LlmInstructAction(LlmClient llmClient, boolean airgappedByDefault) {
        super(llmClient);
        this.airgappedByDefault = airgappedByDefault;
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String instructions = params.requireString("instructions");
        String prompt = withContent(instructions, params.getString("content"));

        if (!params.getBoolean("airgapped", airgappedByDefault)) {
            LlmResponse response = complete(params, prompt, false);
            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("response", response.getText());
            outputs.put("model", response.getModel());
            return ActionResult.of(outputs);
        }

        if (!request.hasAnswer()) {
            return ActionResult.suspend(new SuspensionRequest(prompt, "text", null,
                    params.getSeconds("timeout", null)));
        }

        String feedback = request.getAnswer() != null ? request.getAnswer().toString() : "";
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("instructions", instructions);
        outputs.put("feedback", feedback);
        parseJson(feedback).ifPresent(parsed -> outputs.put("parsed_json", parsed));
        if (llmClient != null && params.getBoolean("analyze_feedback", false)) {
            LlmResponse analysis = complete(params,
                    "Summarise the operator feedback below against these instructions.\n\nInstructions:\n"
                            + instructions + "\n\nFeedback:\n" + feedback, false);
            outputs.put("feedback_analysis", analysis.getText());
        }
        return ActionResult.of(outputs);
    }
}
