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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration management for the Stepflow engine.
 * Values are layered: built-in defaults, then a {@code stepflow.properties} file,
 * then system properties prefixed with {@code stepflow.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(StepflowConfiguration.class);

    public static final String PREFIX = "stepflow.";

    // Default configuration values
    private static final int DEFAULT_STEP_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_MAX_STEP_TIMEOUT_SECONDS = 86400;
    private static final int DEFAULT_MAX_LOOP_ITERATIONS = 10000;
    private static final long DEFAULT_CAPTURE_MAX_BYTES = 1024L * 1024;
    private static final String DEFAULT_SHELL = "/bin/sh";
    private static final String DEFAULT_BASH = "bash";
    private static final String DEFAULT_PYTHON = "python3";
    private static final String DEFAULT_WORKSPACE = ".";
    private static final String DEFAULT_CHECKPOINT_DIR = ".stepflow/checkpoints";
    private static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 30;
    private static final long DEFAULT_WAIT_POLL_MILLIS = 1000;
    private static final int DEFAULT_GUARDRAIL_MAX_RETRIES = 3;

    private final Properties properties;

    public StepflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public StepflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Step execution
    public Duration getDefaultStepTimeout() {
        return Duration.ofSeconds(getIntProperty("stepflow.step.timeout.seconds", DEFAULT_STEP_TIMEOUT_SECONDS));
    }

    public int getMaxStepTimeoutSeconds() {
        return getIntProperty("stepflow.step.timeout.max.seconds", DEFAULT_MAX_STEP_TIMEOUT_SECONDS);
    }

    public int getMaxLoopIterations() {
        return getIntProperty("stepflow.loop.max.iterations", DEFAULT_MAX_LOOP_ITERATIONS);
    }

    // Process execution
    public long getCaptureMaxBytes() {
        return getLongProperty("stepflow.capture.max.bytes", DEFAULT_CAPTURE_MAX_BYTES);
    }

    public String getShellExecutable() {
        return getStringProperty("stepflow.shell.executable", DEFAULT_SHELL);
    }

    public String getBashExecutable() {
        return getStringProperty("stepflow.bash.executable", DEFAULT_BASH);
    }

    public String getPythonExecutable() {
        return getStringProperty("stepflow.python.executable", DEFAULT_PYTHON);
    }

    public Path getWorkspace() {
        return Paths.get(getStringProperty("stepflow.workspace", DEFAULT_WORKSPACE));
    }

    // Persistence
    public Path getCheckpointDirectory() {
        return Paths.get(getStringProperty("stepflow.checkpoint.dir", DEFAULT_CHECKPOINT_DIR));
    }

    public boolean isCheckpointFsync() {
        return getBooleanProperty("stepflow.checkpoint.fsync", true);
    }

    // Actions
    public Duration getHttpTimeout() {
        return Duration.ofSeconds(getIntProperty("stepflow.http.timeout.seconds", DEFAULT_HTTP_TIMEOUT_SECONDS));
    }

    public Duration getWaitPollInterval() {
        return Duration.ofMillis(getLongProperty("stepflow.wait.poll.millis", DEFAULT_WAIT_POLL_MILLIS));
    }

    public boolean isLlmAirgapped() {
        return getBooleanProperty("stepflow.llm.airgapped", false);
    }

    public int getGuardrailMaxRetries() {
        return getIntProperty("stepflow.guardrails.max.retries", DEFAULT_GUARDRAIL_MAX_RETRIES);
    }

    // Engine
    public int getEngineThreads() {
        return getIntProperty("stepflow.engine.threads", 0);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty("stepflow.monitoring.metrics.enabled", true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty("stepflow.step.timeout.seconds", String.valueOf(DEFAULT_STEP_TIMEOUT_SECONDS));
        properties.setProperty("stepflow.step.timeout.max.seconds", String.valueOf(DEFAULT_MAX_STEP_TIMEOUT_SECONDS));
        properties.setProperty("stepflow.loop.max.iterations", String.valueOf(DEFAULT_MAX_LOOP_ITERATIONS));
        properties.setProperty("stepflow.capture.max.bytes", String.valueOf(DEFAULT_CAPTURE_MAX_BYTES));
        properties.setProperty("stepflow.shell.executable", DEFAULT_SHELL);
        properties.setProperty("stepflow.bash.executable", DEFAULT_BASH);
        properties.setProperty("stepflow.python.executable", DEFAULT_PYTHON);
        properties.setProperty("stepflow.workspace", DEFAULT_WORKSPACE);
        properties.setProperty("stepflow.checkpoint.dir", DEFAULT_CHECKPOINT_DIR);
        properties.setProperty("stepflow.checkpoint.fsync", "true");
        properties.setProperty("stepflow.http.timeout.seconds", String.valueOf(DEFAULT_HTTP_TIMEOUT_SECONDS));
        properties.setProperty("stepflow.wait.poll.millis", String.valueOf(DEFAULT_WAIT_POLL_MILLIS));
        properties.setProperty("stepflow.guardrails.max.retries", String.valueOf(DEFAULT_GUARDRAIL_MAX_RETRIES));
        properties.setProperty("stepflow.llm.airgapped", "false");
        properties.setProperty("stepflow.engine.threads", "0");
        properties.setProperty("stepflow.monitoring.metrics.enabled", "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "stepflow.properties",
                "config/stepflow.properties",
                System.getProperty("user.home") + "/.stepflow/stepflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stepflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "StepflowConfiguration{" +
                "defaultStepTimeout=" + getDefaultStepTimeout() +
                ", maxLoopIterations=" + getMaxLoopIterations() +
                ", shell='" + getShellExecutable() + '\'' +
                ", checkpointDirectory=" + getCheckpointDirectory() +
                '}';
    }
}
