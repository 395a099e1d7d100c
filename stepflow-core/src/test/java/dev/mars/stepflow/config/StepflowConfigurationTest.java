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

package dev.mars.stepflow.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StepflowConfiguration defaults, overrides and type conversion.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class StepflowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("stepflow.loop.max.iterations");
        System.clearProperty("stepflow.checkpoint.fsync");
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        StepflowConfiguration config = new StepflowConfiguration(new Properties());

        assertEquals(Duration.ofSeconds(300), config.getDefaultStepTimeout());
        assertEquals(10000, config.getMaxLoopIterations());
        assertEquals("/bin/sh", config.getShellExecutable());
        assertEquals(Paths.get(".stepflow/checkpoints"), config.getCheckpointDirectory());
        assertTrue(config.isCheckpointFsync());
        assertEquals(3, config.getGuardrailMaxRetries());
        assertEquals(0, config.getEngineThreads());
        assertFalse(config.isLlmAirgapped());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Override Tests ==========

    @Test
    void testExplicitPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty("stepflow.step.timeout.seconds", "12");
        properties.setProperty("stepflow.checkpoint.dir", "/tmp/cp");
        properties.setProperty("stepflow.checkpoint.fsync", "false");

        StepflowConfiguration config = new StepflowConfiguration(properties);

        assertEquals(Duration.ofSeconds(12), config.getDefaultStepTimeout());
        assertEquals(Paths.get("/tmp/cp"), config.getCheckpointDirectory());
        assertFalse(config.isCheckpointFsync());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty("stepflow.loop.max.iterations", "42");
        System.setProperty("stepflow.checkpoint.fsync", "false");

        StepflowConfiguration config = new StepflowConfiguration();

        assertEquals(42, config.getMaxLoopIterations());
        assertFalse(config.isCheckpointFsync());
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        StepflowConfiguration config = new StepflowConfiguration(new Properties());
        config.setProperty("stepflow.guardrails.max.retries", "many");

        assertEquals(3, config.getGuardrailMaxRetries());
    }

    @Test
    void testSetAndGetProperty() {
        StepflowConfiguration config = new StepflowConfiguration(new Properties());
        config.setProperty("custom.key", "value");

        assertEquals("value", config.getProperty("custom.key"));
        assertEquals("fallback", config.getProperty("missing.key", "fallback"));
        assertNull(config.getProperty("missing.key"));
    }
}
