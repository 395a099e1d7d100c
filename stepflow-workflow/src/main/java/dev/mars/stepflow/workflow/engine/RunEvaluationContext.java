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

package dev.mars.stepflow.workflow.engine;

import dev.mars.stepflow.workflow.expression.EvaluationContext;
import dev.mars.stepflow.workflow.expression.LazyScope;
import dev.mars.stepflow.workflow.expression.Undefined;

import java.time.Clock;
import java.time.Instant;

/**
 * Binds the expression roots to the live state of a run, as seen from one job
 * (or the document hooks).
 */
final class RunEvaluationContext implements EvaluationContext {

    private final RunContext run;
    private final String scope;
    private final LazyScope env;
    private final LazyScope secrets;
    private final Clock clock;

    RunEvaluationContext(RunContext run, String scope, LazyScope env, LazyScope secrets, Clock clock) {
        this.run = run;
        this.scope = scope;
        this.env = env;
        this.secrets = secrets;
        this.clock = clock;
    }

    @Override
    public Object resolveRoot(String name) {
        switch (name) {
            case "inputs":
                return run.getInputs();
            case "env":
                return env;
            case "steps":
                return run.stepsView(scope);
            case "loop":
                return run.currentLoop().<Object>map(LoopFrame::toView).orElse(Undefined.INSTANCE);
            case "variables":
                return run.getVariables();
            case "secrets":
                return secrets;
            case "error":
                return run.getErrorContext().<Object>map(error -> error).orElse(Undefined.INSTANCE);
            default:
                return Undefined.INSTANCE;
        }
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
