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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Requests a value from a human operator.
 *
 * <p>A queued answer is used first, then {@code with.default}. With neither the
 * action suspends the run. If the suspension window ({@code with.timeout}) has
 * elapsed when the run is resumed without an answer the step fails with a
 * timeout.</p>
 */
public class HumanInputAction implements WorkflowAction {

    public static final String ACTION_ID = "human/input";

    private static final Set<String> TRUE_VALUES = Set.of("yes", "y", "true", "1", "on");
    private static final Set<String> FALSE_VALUES = Set.of("no", "n", "false", "0", "off");

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
        String inputType = params.getString("input_type", "text").toLowerCase(Locale.ROOT);
        List<String> choices = params.getStringList("choices");
        if (!inputType.equals("text") && !inputType.equals("confirm") && !inputType.equals("choice")) {
            throw params.invalid("input_type must be text, confirm or choice");
        }
        if (inputType.equals("choice") && choices.isEmpty()) {
            throw params.invalid("input_type 'choice' requires 'choices'");
        }

        boolean answered = request.hasAnswer() && !isBlank(request.getAnswer());
        if (answered) {
            return result(coerce(params, inputType, choices, request.getAnswer()), false);
        }
        if (params.has("default")) {
            return result(coerce(params, inputType, choices, params.get("default")), true);
        }
        Duration timeout = params.getSeconds("timeout", null);
        if (request.isSuspensionExpired()) {
            throw new ActionTimeoutException(ACTION_ID, timeout != null ? timeout : Duration.ZERO);
        }
        return ActionResult.suspend(new SuspensionRequest(prompt, inputType, choices, timeout));
    }

    private ActionResult result(Object response, boolean isDefault) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("response", response);
        outputs.put("is_default", isDefault);
        return ActionResult.of(outputs);
    }

    static Object coerce(ActionParameters params, String inputType, List<String> choices, Object value)
            throws ActionException {
        switch (inputType) {
            case "confirm":
                return toBoolean(params, value);
            case "choice":
                return matchChoice(params, choices, value);
            default:
                return value != null ? value.toString() : "";
        }
    }

    static boolean toBoolean(ActionParameters params, Object value) throws ActionException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(text)) {
            return true;
        }
        if (FALSE_VALUES.contains(text)) {
            return false;
        }
        throw params.invalid("expected a yes/no answer, got: " + value);
    }

    static String matchChoice(ActionParameters params, List<String> choices, Object value) throws ActionException {
        String text = String.valueOf(value).trim();
        for (String choice : choices) {
            if (choice.equalsIgnoreCase(text)) {
                return choice;
            }
        }
        throw params.invalid("'" + text + "' is not one of " + choices);
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
