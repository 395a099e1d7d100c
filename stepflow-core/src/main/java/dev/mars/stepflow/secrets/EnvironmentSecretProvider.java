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

package dev.mars.stepflow.secrets;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads secrets from environment variables, {@code secrets.API_KEY} mapping to
 * {@code <prefix>API_KEY}.
 */
public class EnvironmentSecretProvider implements SecretProvider {

    private final String prefix;
    private final Map<String, String> environment;

    public EnvironmentSecretProvider(String prefix) {
        this(prefix, System.getenv());
    }

    EnvironmentSecretProvider(String prefix, Map<String, String> environment) {
        this.prefix = prefix != null ? prefix : "";
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
    }

    @Override
    public Optional<String> getSecret(String name) {
        return Optional.ofNullable(environment.get(prefix + name));
    }
}
