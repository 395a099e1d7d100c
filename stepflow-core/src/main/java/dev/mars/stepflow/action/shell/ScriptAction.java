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

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.CaptureMode;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an inline script ({@code with.script}) through an interpreter, passing
 * {@code with.args} as positional arguments and {@code with.env} as extra
 * environment variables.
 */
public class ScriptAction implements WorkflowAction {

    private final String actionId;
    private final String interpreter;
    private final boolean needsArgZero;
    private final ProcessRunner processRunner;

    private ScriptAction(String actionId, String interpreter, boolean needsArgZero, ProcessRunner processRunner) {
        this.actionId = actionId;
        this.interpreter = interpreter;
        this.needsArgZero = needsArgZero;
        this.processRunner = processRunner;
    }

    public static ScriptAction bash(StepflowConfiguration configuration, ProcessRunner processRunner) {
        return new ScriptAction("script/bash", configuration.getBashExecutable(), true, processRunner);
    }

    public static ScriptAction python(StepflowConfiguration configuration, ProcessRunner processRunner) {
        return new ScriptAction("script/python", configuration.getPythonExecutable(), false, processRunner);
    }

    @Override
    public String getActionId() {
        return actionId;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String script = params.requireString("script");

        List<String> commandLine = new ArrayList<>();
        commandLine.add(interpreter);
        commandLine.add("-c");
        commandLine.add(script);
        if (needsArgZero) {
            // bash -c binds the first operand to $0
            commandLine.add("stepflow-script");
        }
        commandLine.addAll(params.getStringList("args"));

        Map<String, String> environment = new LinkedHashMap<>();
        params.getMap("env").forEach((key, value) -> environment.put(key, value != null ? value.toString() : ""));

        ProcessRunner.ProcessOutcome outcome = processRunner.run(actionId, commandLine,
                request.getWorkingDirectory(), environment, request.getTimeout(),
                CaptureMode.MEMORY, false);

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("stdout", outcome.getStdout());
        outputs.put("stderr", outcome.getStderr());
        outputs.put("exit_code", (long) outcome.getExitCode());
        if (outcome.getExitCode() != 0) {
            throw new ActionException(actionId, ActionException.KIND_EXIT_CODE,
                    "script exited with status " + outcome.getExitCode(), outputs);
        }
        return ActionResult.of(outputs);
    }
}
