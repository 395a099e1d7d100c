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

package dev.mars.stepflow.action.shell;

import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes the {@code run} command of a step. The string form goes through the
 * configured shell; the list form is executed directly and never sees a shell.
 */
public class ShellAction implements WorkflowAction {

    public static final String ACTION_ID = "run";

    private final StepflowConfiguration configuration;
    private final ProcessRunner processRunner;

    public ShellAction(StepflowConfiguration configuration, ProcessRunner processRunner) {
        this.configuration = configuration;
        this.processRunner = processRunner;
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        List<String> commandLine = toCommandLine(request.getCommand());
        ProcessRunner.ProcessOutcome outcome = processRunner.run(ACTION_ID, commandLine,
                request.getWorkingDirectory(), null, request.getTimeout(),
                request.getCaptureMode(), request.isInteractive());

        Map<String, Object> outputs = outcome.toOutputs();
        if (outcome.getExitCode() != 0) {
            throw new ActionException(ACTION_ID, ActionException.KIND_EXIT_CODE,
                    "command exited with status " + outcome.getExitCode(), outputs);
        }
        return ActionResult.of(outputs);
    }

    List<String> toCommandLine(Object command) throws ActionException {
        if (command instanceof String) {
            String script = ((String) command).trim();
            if (script.isEmpty()) {
                throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION, "command is empty");
            }
            return List.of(configuration.getShellExecutable(), "-c", script);
        }
        if (command instanceof List) {
            List<String> tokens = new ArrayList<>();
            for (Object token : (List<?>) command) {
                tokens.add(token != null ? token.toString() : "");
            }
            if (tokens.isEmpty() || tokens.get(0).isBlank()) {
                throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION, "command is empty");
            }
            return tokens;
        }
        throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION,
                "run must be a string or a list of tokens");
    }
}
