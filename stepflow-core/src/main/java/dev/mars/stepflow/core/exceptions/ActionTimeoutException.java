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

import java.time.Duration;
import java.util.Map;

/**
 * Thrown when an action does not complete within its step timeout.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ActionTimeoutException extends ActionException {

    private final Duration timeout;

    public ActionTimeoutException(String actionId, Duration timeout) {
        this(actionId, timeout, null);
    }

    public ActionTimeoutException(String actionId, Duration timeout, Map<String, Object> outputs) {
        super(actionId, KIND_TIMEOUT, "timed out after " + describe(timeout), outputs);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String describe(Duration timeout) {
        return timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
    }
}
