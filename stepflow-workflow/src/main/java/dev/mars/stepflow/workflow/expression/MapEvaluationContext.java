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

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Evaluation context backed by plain maps.
 */
public class MapEvaluationContext implements EvaluationContext {

    private final Map<String, Object> roots;
    private final Clock clock;

    public MapEvaluationContext(Map<String, Object> roots) {
        this(roots, Clock.systemUTC());
    }

    public MapEvaluationContext(Map<String, Object> roots, Clock clock) {
        this.roots = new HashMap<>(roots);
        this.clock = clock;
    }

    @Override
    public Object resolveRoot(String name) {
        return roots.containsKey(name) ? roots.get(name) : Undefined.INSTANCE;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
