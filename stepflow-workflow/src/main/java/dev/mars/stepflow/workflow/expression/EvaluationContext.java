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

package dev.mars.stepflow.workflow.expression;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only bindings an expression is evaluated against.
 */
public interface EvaluationContext {

    /**
     * Names that may appear as the first identifier of a path.
     */
    Set<String> ROOTS = Set.of("inputs", "env", "steps", "loop", "variables", "secrets", "error");

    /**
     * Value bound to a root name. Roots that exist but are not bound in the
     * current scope (for example {@code loop} outside a loop) return
     * {@link Undefined#INSTANCE}.
     */
    Object resolveRoot(String name);

    /**
     * Clock reading exposed to expressions as {@code now()}.
     */
    Instant now();
}
