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
import dev.mars.stepflow.workflow.expression.ExpressionEvaluator;
import dev.mars.stepflow.workflow.expression.ExpressionException;
import dev.mars.stepflow.workflow.expression.LazyScope;
import dev.mars.stepflow.workflow.expression.Undefined;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The {@code env} namespace. Entries are resolved on first reference and cached
 * for the lifetime of the scope; an entry may reference {@code inputs},
 * {@code secrets} and other {@code env} entries.
 */
final class EnvScope implements LazyScope {

    private final Map<String, Object> definitions;
    private final Map<String, Object> inputs;
    private final LazyScope secrets;
    private final ExpressionEvaluator evaluator;
    private final Map<String, Object> resolved = new HashMap<>();
    private final Set<String> resolving = new LinkedHashSet<>();
    private final EvaluationContext context;

    EnvScope(Map<String, Object> definitions, Map<String, Object> inputs, LazyScope secrets,
             ExpressionEvaluator evaluator, Clock clock) {
        this.definitions = new LinkedHashMap<>(definitions);
        this.inputs = inputs;
        this.secrets = secrets;
        this.evaluator = evaluator;
        this.context = new EvaluationContext() {
            @Override
            public Object resolveRoot(String name) {
                switch (name) {
                    case "inputs":
                        return EnvScope.this.inputs;
                    case "env":
                        return EnvScope.this;
                    case "secrets":
                        return EnvScope.this.secrets;
                    default:
                        return Undefined.INSTANCE;
                }
            }

            @Override
            public Instant now() {
                return clock.instant();
            }
        };
    }

    @Override
    public Object get(String key) {
        if (resolved.containsKey(key)) {
            return resolved.get(key);
        }
        if (!definitions.containsKey(key)) {
            return Undefined.INSTANCE;
        }
        if (!resolving.add(key)) {
            throw new ExpressionException("env cycle: " + String.join(" -> ", resolving) + " -> " + key);
        }
        try {
            Object value = evaluator.resolve(definitions.get(key), context);
            resolved.put(key, value);
            return value;
        } finally {
            resolving.remove(key);
        }
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(definitions.keySet());
    }
}
