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

public class LlmGenerateAction extends AbstractLlmAction {

    public static final String ACTION_ID = "llm/generate";

    public LlmGenerateAction(LlmClient llmClient) {
        super(llmClient);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        boolean json = "json".equalsIgnoreCase(params.getString("format", "text"));
        LlmResponse response = complete(params, params.requireString("prompt"), json);

        ActionResult.Builder result = ActionResult.builder().output("text", response.getText());
        if (json) {
            parseJson(response.getText()).ifPresent(parsed -> result.output("parsed", parsed));
        }
        return result.build();
    }
}
