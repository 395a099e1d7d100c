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

package dev.mars.stepflow.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request from an action to change control flow: terminate the whole run, or
 * leave or skip ahead in the enclosing loop.
 */
public final class ControlSignal {

    public enum Type {
        EXIT, FAIL, BREAK, CONTINUE
    }

    private final Type type;
    private final String status;
    private final String message;
    private final String errorCode;
    private final Map<String, Object> outputs;

    private ControlSignal(Type type, String status, String message, String errorCode, Map<String, Object> outputs) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.status = status;
        this.message = message;
        this.errorCode = errorCode;
        this.outputs = outputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs))
                : Map.of();
    }

    public static ControlSignal exit(String status, String message, Map<String, Object> outputs) {
        return new ControlSignal(Type.EXIT, status != null ? status : "success", message, null, outputs);
    }

    public static ControlSignal fail(String message, String errorCode, Map<String, Object> details) {
        return new ControlSignal(Type.FAIL, "failure", message, errorCode, details);
    }

    public static ControlSignal breakLoop(String reason, Map<String, Object> outputs) {
        return new ControlSignal(Type.BREAK, null, reason, null, outputs);
    }

    public static ControlSignal continueLoop(String reason) {
        return new ControlSignal(Type.CONTINUE, null, reason, null, null);
    }

    /**
     * Whether this signal only affects the enclosing loop rather than the run.
     */
    public boolean isLoopControl() {
        return type == Type.BREAK || type == Type.CONTINUE;
    }

    public Type getType() {
        return type;
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return "ControlSignal{type=" + type + ", status='" + status + "', message='" + message + "'}";
    }
}
