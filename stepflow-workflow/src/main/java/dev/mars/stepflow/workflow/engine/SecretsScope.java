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

import dev.mars.stepflow.secrets.SecretProvider;
import dev.mars.stepflow.workflow.expression.LazyScope;
import dev.mars.stepflow.workflow.expression.Undefined;

import java.util.Set;

/**
 * The {@code secrets} namespace, fetched from the secret provider on access.
 * Secrets are never enumerable.
 */
final class SecretsScope implements LazyScope {

    private final SecretProvider provider;

    SecretsScope(SecretProvider provider) {
        this.provider = provider;
    }

    @Override
    public Object get(String key) {
        return provider.getSecret(key).<Object>map(value -> value).orElse(Undefined.INSTANCE);
    }

    @Override
    public Set<String> keys() {
        return Set.of();
    }
}
