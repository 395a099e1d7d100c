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

import java.util.Set;

/**
 * A namespace whose entries are computed on first access, such as {@code env}
 * (resolved lazily) and {@code secrets} (fetched from the secret provider).
 */
public interface LazyScope {

    /**
     * @return the value for {@code key}, or {@link Undefined#INSTANCE} if absent
     */
    Object get(String key);

    /**
     * Names enumerable through {@code keys}/{@code values}. Scopes holding
     * sensitive values may return an empty set.
     */
    Set<String> keys();
}
