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

package dev.mars.stepflow.core.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when an action invoked by a workflow step fails.
 * The {@code kind} is a short machine-readable classification that workflows
 * can inspect through the {@code error} context object.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ActionException extends StepflowException {

    public static final String KIND_EXIT_CODE = "exit_code";
    public static final String KIND_HTTP = "http";
    public static final String KIND_VALIDATION = "validation";
    public static final String KIND_CONFIGURATION = "configuration";
    public static final String KIND_IO = "io";
    public static final String KIND_INTERRUPTED = "interrupted";
    public static final String KIND_TIMEOUT = "timeout";
    public static final String KIND_GUARDRAIL = "guardrail";
    public static final String KIND_EXPRESSION = "expression";
    public static final String KIND_LLM = "llm";
    public static final String KIND_INTERNAL = "internal";

    private final String actionId;
    private final String kind;
    private final Map<String, Object> outputs;

    public ActionException(String actionId, String kind, String message) {
        this(actionId, kind, message, null, null);
    }

    public ActionException(String actionId, String kind, String message, Throwable cause) {
        this(actionId, kind, message, null, cause);
    }

    public ActionException(String actionId, String kind, String message, Map<String, Object> outputs) {
        this(actionId, kind, message, outputs, null);
    }

    public ActionException(String actionId, String kind, String message, Map<String, Object> outputs,
                           Throwable cause) {
        super(message, cause);
        this.actionId = actionId;
        this.kind = kind != null ? kind : KIND_INTERNAL;
        this.outputs = outputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs))
                : Map.of();
    }

    public String getActionId() {
        return actionId;
    }

    public String getKind() {
        return kind;
    }

    /**
     * Outputs the action produced before failing, for example the captured
     * stdout of a command that exited with a non-zero status.
     */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    /**
     * The failure description without the action prefix.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("Action %s failed (%s): %s", actionId, kind, super.getMessage());
    }
}
