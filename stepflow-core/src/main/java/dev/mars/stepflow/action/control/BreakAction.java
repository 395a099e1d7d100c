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


package dev.mars.stepflow.action.control;

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.ControlSignal;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leaves the enclosing loop after the current iteration. The iteration counts
 * as successful and {@code with.result} becomes its output.
 */
public class BreakAction implements WorkflowAction {

    public static final String ACTION_ID = "control/break";

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
        String reason = params.getString("reason", "");
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("reason", reason);
        outputs.put("result", params.get("result"));
        return ActionResult.builder()
                .outputs(outputs)
                .control(ControlSignal.breakLoop(reason, outputs))
                .build();
    }
}
