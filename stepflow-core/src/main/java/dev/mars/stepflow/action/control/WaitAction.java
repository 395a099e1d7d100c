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

import dev.mars.stepflow.action.ActionContext;
import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pauses the run. With {@code with.until} the bare expression is polled every
 * {@code with.interval} seconds until it is true or {@code with.timeout} elapses;
 * otherwise the action sleeps for {@code with.seconds}.
 */
public class WaitAction implements WorkflowAction {

    public static final String ACTION_ID = "control/wait";

    private final Duration defaultInterval;

    public WaitAction(StepflowConfiguration configuration) {
        this.defaultInterval = configuration.getWaitPollInterval();
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        long start = System.nanoTime();

        if (!params.has("until")) {
            Duration delay = params.getSeconds("seconds", Duration.ZERO);
            sleep(delay);
            return result(start, false);
        }

        Duration timeout = params.getSeconds("timeout", request.getTimeout());
        Duration interval = params.getSeconds("interval", defaultInterval);
        long deadline = start + timeout.toNanos();
        while (true) {
            if (conditionMet(request, params.get("until"))) {
                return result(start, false);
            }
            if (System.nanoTime() >= deadline) {
                return result(start, true);
            }
            if (request.getContext() != null && request.getContext().isCancelled()) {
                throw new ActionException(ACTION_ID, ActionException.KIND_INTERRUPTED, "run cancelled while waiting");
            }
            long remaining = deadline - System.nanoTime();
            sleep(Duration.ofNanos(Math.max(0, Math.min(interval.toNanos(), remaining))));
        }
    }

    private boolean conditionMet(ActionRequest request, Object until) throws ActionException {
        if (until instanceof Boolean) {
            return (Boolean) until;
        }
        ActionContext context = request.getContext();
        if (context == null) {
            throw new ActionException(ACTION_ID, ActionException.KIND_CONFIGURATION,
                    "no run context available to evaluate 'until'");
        }
        Object value = context.evaluate(until.toString());
        return value instanceof Boolean ? (Boolean) value : value != null && !"".equals(value);
    }

    private void sleep(Duration duration) throws ActionException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException(ACTION_ID, ActionException.KIND_INTERRUPTED, "wait interrupted", e);
        }
    }

    private ActionResult result(long start, boolean timedOut) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("waited_seconds", (System.nanoTime() - start) / 1_000_000_000.0);
        outputs.put("timed_out", timedOut);
        return ActionResult.of(outputs);
    }
}
