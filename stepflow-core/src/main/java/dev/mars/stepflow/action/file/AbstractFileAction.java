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


package dev.mars.stepflow.action.file;

import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.config.StepflowConfiguration;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Base class for actions that touch files. Relative paths resolve against the
 * step's working directory, which defaults to the configured workspace.
 */
public abstract class AbstractFileAction implements WorkflowAction {

    private final Path workspace;

    protected AbstractFileAction(StepflowConfiguration configuration) {
        this.workspace = Objects.requireNonNull(configuration, "Configuration cannot be null").getWorkspace();
    }

    protected Path resolve(ActionRequest request, String path) {
        Path candidate = Path.of(expandHome(path));
        if (candidate.isAbsolute()) {
            return candidate.normalize();
        }
        Path base = request.getWorkingDirectory() != null ? request.getWorkingDirectory() : workspace;
        return base.resolve(candidate).toAbsolutePath().normalize();
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
