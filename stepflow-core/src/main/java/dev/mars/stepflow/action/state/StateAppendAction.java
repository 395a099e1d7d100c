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

package dev.mars.stepflow.action.state;

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends {@code with.value} to the list variable named by {@code with.target},
 * creating the list when it does not exist yet.
 */
public class StateAppendAction implements WorkflowAction {

    public static final String ACTION_ID = "state/append";

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
        String target = params.requireString("target");
        if (!params.asMap().containsKey("value")) {
            throw params.invalid("'value' is required");
        }

        Object current = request.getContext() != null ? request.getContext().getVariables().get(target) : null;
        List<Object> updated = new ArrayList<>();
        if (current instanceof List) {
            updated.addAll((List<?>) current);
        } else if (current != null) {
            throw params.invalid("variable '" + target + "' is not a list");
        }
        updated.add(params.get("value"));

        return ActionResult.builder()
                .setVariable(target, updated)
                .output(target, updated)
                .build();
    }
}
