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

package dev.mars.stepflow.action.human;

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.SuspensionRequest;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.core.exceptions.ActionTimeoutException;

import java.time.Duration;
import java.util.List;

/**
 * Asks a human operator to pick one of {@code with.choices}. When
 * {@code with.confirm} is set the outputs carry {@code confirmed: true}.
 */
public class HumanDecideAction implements WorkflowAction {

    public static final String ACTION_ID = "human/decide";

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public boolean isInline() {
        return true;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String prompt = params.requireString("prompt");
        List<String> choices = params.getStringList("choices");
        if (choices.isEmpty()) {
            throw params.invalid("'choices' must contain at least one option");
        }

        Object answer = null;
        if (request.hasAnswer() && request.getAnswer() != null && !request.getAnswer().toString().isBlank()) {
            answer = request.getAnswer();
        } else if (params.has("default")) {
            answer = params.get("default");
        }

        if (answer == null) {
            Duration timeout = params.getSeconds("timeout", null);
            if (request.isSuspensionExpired()) {
                throw new ActionTimeoutException(ACTION_ID, timeout != null ? timeout : Duration.ZERO);
            }
            return ActionResult.suspend(new SuspensionRequest(prompt, "choice", choices, timeout));
        }

        ActionResult.Builder result = ActionResult.builder()
                .output("value", HumanInputAction.matchChoice(params, choices, answer));
        if (params.getBoolean("confirm", false)) {
            result.output("confirmed", true);
        }
        return result.build();
    }
}
