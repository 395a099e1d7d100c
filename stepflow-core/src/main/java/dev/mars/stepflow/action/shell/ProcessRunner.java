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

package dev.mars.stepflow.action.shell;

import dev.mars.stepflow.action.CaptureMode;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.core.exceptions.ActionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs external processes with a timeout and captures their output according to
 * a {@link CaptureMode}. Output is redirected to temporary files so that a chatty
 * process can never block on a full pipe.
 */
public class ProcessRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);

    private final long maxCaptureBytes;

    public ProcessRunner(StepflowConfiguration configuration) {
        this.maxCaptureBytes = configuration.getCaptureMaxBytes();
    }

    /**
     * Result of one process execution.
     */
    public static final class ProcessOutcome {
        private final String stdout;
        private final String stderr;
        private final int exitCode;
        private final Path outputFile;

        ProcessOutcome(String stdout, String stderr, int exitCode, Path outputFile) {
            this.stdout = stdout;
            this.stderr = stderr;
            this.exitCode = exitCode;
            this.outputFile = outputFile;
        }

        public String getStdout() {
            return stdout;
        }

        public String getStderr() {
            return stderr;
        }

        public int getExitCode() {
            return exitCode;
        }

        public Path getOutputFile() {
            return outputFile;
        }

        public Map<String, Object> toOutputs() {
            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("stdout", stdout);
            outputs.put("stderr", stderr);
            outputs.put("exit_code", (long) exitCode);
            if (outputFile != null) {
                outputs.put("file", outputFile.toString());
            }
            return outputs;
        }
    }

    public ProcessOutcome run(String actionId,
                              List<String> commandLine,
                              Path workingDirectory,
                              Map<String, String> environment,
                              Duration timeout,
                              CaptureMode captureMode,
                              boolean interactive) throws ActionException {
        ProcessBuilder builder = new ProcessBuilder(commandLine);
        builder.directory(workingDirectory.toFile());
        if (environment != null && !environment.isEmpty()) {
            builder.environment().putAll(environment);
        }

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            if (interactive) {
                builder.inheritIO();
            } else {
                stderrFile = Files.createTempFile("stepflow-", ".err");
                builder.redirectError(stderrFile.toFile());
                if (captureMode == CaptureMode.NONE) {
                    builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
                } else {
                    stdoutFile = Files.createTempFile("stepflow-", ".out");
                    builder.redirectOutput(stdoutFile.toFile());
                }
            }

            logger.debug("Starting process: {} in {}", commandLine.get(0), workingDirectory);
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new ActionException(actionId, ActionException.KIND_INTERRUPTED,
                        "process interrupted before completion", e);
            }

            if (!finished) {
                process.destroyForcibly();
                logger.warn("Process {} exceeded timeout of {} and was killed", commandLine.get(0), timeout);
                Map<String, Object> partial = new LinkedHashMap<>();
                partial.put("stdout", captureMode == CaptureMode.MEMORY ? read(stdoutFile) : "");
                partial.put("stderr", read(stderrFile));
                throw new ActionTimeoutException(actionId, timeout, partial);
            }

            int exitCode = process.exitValue();
            String stderr = read(stderrFile);
            if (captureMode == CaptureMode.FILE && stdoutFile != null) {
                Path kept = stdoutFile;
                stdoutFile = null;
                return new ProcessOutcome("", stderr, exitCode, kept);
            }
            return new ProcessOutcome(read(stdoutFile), stderr, exitCode, null);
        } catch (IOException e) {
            throw new ActionException(actionId, ActionException.KIND_IO,
                    "failed to run " + commandLine.get(0) + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private String read(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return "";
        }
        long size = Files.size(file);
        if (size <= maxCaptureBytes) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        byte[] buffer = new byte[(int) maxCaptureBytes];
        try (InputStream input = Files.newInputStream(file)) {
            int read = input.readNBytes(buffer, 0, buffer.length);
            logger.debug("Captured output truncated from {} to {} bytes", size, read);
            return new String(buffer, 0, read, StandardCharsets.UTF_8);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete temporary capture file {}: {}", file, e.getMessage());
        }
    }
}
