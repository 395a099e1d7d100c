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

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SecretProviderTest {

    @Test
    void testEnvironmentProviderAppliesPrefix() {
        EnvironmentSecretProvider provider = new EnvironmentSecretProvider("STEPFLOW_SECRET_",
                Map.of("STEPFLOW_SECRET_API_KEY", "abc123", "API_KEY", "unprefixed"));

        assertEquals(Optional.of("abc123"), provider.getSecret("API_KEY"));
        assertEquals(Optional.empty(), provider.getSecret("OTHER"));
    }

    @Test
    void testEnvironmentProviderWithoutPrefix() {
        EnvironmentSecretProvider provider = new EnvironmentSecretProvider(null, Map.of("TOKEN", "t"));

        assertEquals(Optional.of("t"), provider.getSecret("TOKEN"));
    }

    @Test
    void testMapProvider() {
        MapSecretProvider provider = new MapSecretProvider(Map.of("db_password", "s3cret"));

        assertEquals("s3cret", provider.getSecret("db_password").orElseThrow());
        assertTrue(provider.getSecret("missing").isEmpty());
    }

    @Test
    void testNoneProvider() {
        assertTrue(SecretProvider.none().getSecret("anything").isEmpty());
    }
}
