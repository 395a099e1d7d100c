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

/**
 * Ends the run early with state {@code EXITED}. The finally subgraphs still run.
 */
public class ExitAction implements WorkflowAction {

    public static final String ACTION_ID = "control/exit";

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
        String status = params.getString("status", "success");
        String message = params.getString("message", "Workflow exited");
        return ActionResult.builder()
                .output("status", status)
                .output("message", message)
                .control(ControlSignal.exit(status, message, params.getMap("outputs")))
                .build();
    }
}
