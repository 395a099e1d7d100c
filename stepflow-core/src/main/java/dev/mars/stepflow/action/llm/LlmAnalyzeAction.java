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

/**
 * Free-form analysis of {@code with.content}. With {@code format: json} the
 * parsed response is exposed as {@code parsed}.
 */
public class LlmAnalyzeAction extends AbstractLlmAction {

    public static final String ACTION_ID = "llm/analyze";

    public LlmAnalyzeAction(LlmClient llmClient) {
        super(llmClient);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String content = params.requireString("content");
        boolean json = "json".equalsIgnoreCase(params.getString("format", "text"));
        String instruction = params.getString("prompt", "Analyze the following content.");

        LlmResponse response = complete(params, withContent(instruction, content), json);
        ActionResult.Builder result = ActionResult.builder().output("analysis", response.getText());
        if (json) {
            parseJson(response.getText()).ifPresent(parsed -> result.output("parsed", parsed));
        }
        return result.build();
    }
}
