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

import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.CaptureMode;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.core.exceptions.ActionTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ShellAction against the local /bin/sh.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@DisabledOnOs(OS.WINDOWS)
class ShellActionTest {

    @TempDir
    Path workDir;

    private ShellAction action;

    @BeforeEach
    void setUp() {
        StepflowConfiguration config = new StepflowConfiguration(new Properties());
        action = new ShellAction(config, new ProcessRunner(config));
    }

    private ActionRequest.Builder request(Object command) {
        return ActionRequest.builder()
                .actionId(ShellAction.ACTION_ID)
                .stepId("shell")
                .command(command)
                .workingDirectory(workDir)
                .timeout(Duration.ofSeconds(10));
    }

    @Test
    void testShellFormCapturesOutput() throws ActionException {
        ActionResult result = action.execute(request("echo hello && echo oops 1>&2").build());

        assertEquals("hello\n", result.getOutputs().get("stdout"));
        assertEquals("oops\n", result.getOutputs().get("stderr"));
        assertEquals(0L, result.getOutputs().get("exit_code"));
    }

    @Test
    void testListFormBypassesShell() throws ActionException {
        ActionResult result = action.execute(request(List.of("echo", "$HOME; rm -rf /")).build());

        assertEquals("$HOME; rm -rf /\n", result.getOutputs().get("stdout"));
    }

    @Test
    void testRunsInWorkingDirectory() throws Exception {
        Files.writeString(workDir.resolve("marker.txt"), "present");

        ActionResult result = action.execute(request("cat marker.txt").build());

        assertEquals("present", result.getOutputs().get("stdout"));
    }

    @Test
    void testNonZeroExitFailsWithOutputs() {
        ActionException e = assertThrows(ActionException.class,
                () -> action.execute(request("echo partial; exit 3").build()));

        assertEquals(ActionException.KIND_EXIT_CODE, e.getKind());
        assertEquals(3L, e.getOutputs().get("exit_code"));
        assertEquals("partial\n", e.getOutputs().get("stdout"));
    }

    @Test
    void testTimeoutKillsProcess() {
        ActionException e = assertThrows(ActionException.class,
                () -> action.execute(request("sleep 5").timeout(Duration.ofMillis(200)).build()));

        assertInstanceOf(ActionTimeoutException.class, e);
        assertEquals(ActionException.KIND_TIMEOUT, e.getKind());
    }

    @Test
    void testCaptureToFile() throws Exception {
        ActionResult result = action.execute(request("printf data").captureMode(CaptureMode.FILE).build());

        Path file = Path.of((String) result.getOutputs().get("file"));
        try {
            assertEquals("", result.getOutputs().get("stdout"));
            assertEquals("data", Files.readString(file));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void testEmptyCommandRejected() {
        ActionException blank = assertThrows(ActionException.class, () -> action.execute(request("  ").build()));
        ActionException empty = assertThrows(ActionException.class, () -> action.execute(request(List.of()).build()));

        assertEquals(ActionException.KIND_VALIDATION, blank.getKind());
        assertEquals(ActionException.KIND_VALIDATION, empty.getKind());
    }
}
