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

package dev.mars.stepflow.cli;

import dev.mars.stepflow.config.StepflowConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StepflowCli commands and exit codes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class StepflowCliTest {

    private static final String VALID = """
            name: hello
            jobs:
              main:
                steps:
                  - id: greet
                    uses: state/set
                    with:
                      variables:
                        greeting: "hello ${{ inputs.who }}"
            inputs:
              who:
                type: string
                default: world
            """;

    private static final String WITH_WARNING = """
            name: warned
            jobs:
              main:
                steps:
                  - id: once
                    uses: state/set
                    break_if: "true"
                    with:
                      variables: {x: 1}
            """;

    private static final String INVALID = """
            name: broken
            jobs:
              main:
                steps:
                  - id: a
                    uses: no/such-action
            """;

    private static final String APPROVAL = """
            name: approval
            jobs:
              main:
                steps:
                  - id: approve
                    uses: human/input
                    with:
                      prompt: "Ship it?"
                      input_type: confirm
                  - id: decide
                    if: "not steps.approve.outputs.response"
                    uses: control/exit
                    with:
                      status: rejected
                      message: not approved
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private StepflowCli cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        Properties properties = new Properties();
        properties.setProperty("stepflow.workspace", tempDir.toString());
        properties.setProperty("stepflow.checkpoint.dir", tempDir.resolve("checkpoints").toString());
        properties.setProperty("stepflow.checkpoint.fsync", "false");
        properties.setProperty("stepflow.monitoring.metrics.enabled", "false");
        cli = new StepflowCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), new StepflowConfiguration(properties));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // ========== General ==========

    @Test
    void testNoArgumentsPrintsUsage() {
        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[0]));
        assertThat(err()).contains("No command specified").contains("USAGE:");
    }

    @Test
    void testUnknownCommand() {
        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[]{"explode"}));
        assertThat(err()).contains("Unknown command: explode");
    }

    @Test
    void testHelpAndVersion() {
        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"--help"}));
        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"--version"}));
        assertThat(out()).contains("EXIT CODES:").contains("Stepflow CLI v1.0.0");
    }

    @Test
    void testSchemaIsPrinted() {
        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"schema"}));
        assertThat(out()).contains("\"$schema\"").contains("\"jobs\"");
    }

    // ========== validate ==========

    @Test
    void testValidateValidFile() throws IOException {
        Path file = write("hello.yaml", VALID);

        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"validate", file.toString()}));
        assertThat(out()).contains("✓ VALID");
    }

    @Test
    void testValidateInvalidFileListsErrors() throws IOException {
        Path file = write("broken.yaml", INVALID);

        assertEquals(StepflowCli.EXIT_FAILED, cli.run(new String[]{"validate", file.toString()}));
        assertThat(out()).contains("✗ INVALID").contains("[E_UNKNOWN_ACTION]").contains("Summary: 1 errors");
    }

    @Test
    void testWarningsFailOnlyInStrictMode() throws IOException {
        Path file = write("warned.yaml", WITH_WARNING);

        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"validate", file.toString()}));
        assertThat(out()).contains("⚠ VALID (with warnings)").contains("W_LOOP_MODIFIER");

        assertEquals(StepflowCli.EXIT_FAILED, cli.run(new String[]{"validate", "--strict", file.toString()}));
        assertThat(out()).contains("✗ FAILED (warnings in strict mode)");
    }

    @Test
    void testQuietPrintsNothingForValidFile() throws IOException {
        Path file = write("hello.yaml", VALID);

        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"validate", "--quiet", file.toString()}));
        assertEquals("", out());
    }

    @Test
    void testValidateMissingAndMalformedFiles() throws IOException {
        Path malformed = write("malformed.yaml", "name: [unclosed\n");

        assertEquals(StepflowCli.EXIT_IO,
                cli.run(new String[]{"validate", tempDir.resolve("absent.yaml").toString()}));
        assertThat(err()).contains("File does not exist");
        assertEquals(StepflowCli.EXIT_IO, cli.run(new String[]{"validate", malformed.toString()}));
        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[]{"validate"}));
    }

    // ========== dry-run ==========

    @Test
    void testDryRunDescribesGraph() throws IOException {
        Path file = write("hello.yaml", VALID);

        assertEquals(StepflowCli.EXIT_OK, cli.run(new String[]{"dry-run", file.toString()}));
        assertThat(out()).startsWith("workflow hello").contains("  job main\n").contains("uses state/set");
    }

    @Test
    void testDryRunOfInvalidWorkflow() throws IOException {
        Path file = write("broken.yaml", INVALID);

        assertEquals(StepflowCli.EXIT_FAILED, cli.run(new String[]{"dry-run", file.toString()}));
        assertThat(err()).contains("Workflow 'broken' is invalid:");
    }

    // ========== run and resume ==========

    @Test
    void testRunWithInputs() throws IOException {
        Path file = write("hello.yaml", VALID);

        int code = cli.run(new String[]{"run", file.toString(), "--input", "who=stepflow",
                "--checkpoint-dir", tempDir.resolve("runs").toString()});

        assertEquals(StepflowCli.EXIT_OK, code);
        assertThat(out()).contains("of workflow 'hello'").contains("succeeded  greet").contains("Status: SUCCEEDED");
    }

    @Test
    void testRunRejectsUnknownInput() throws IOException {
        Path file = write("hello.yaml", VALID);

        assertEquals(StepflowCli.EXIT_FAILED, cli.run(new String[]{"run", file.toString(), "--input", "colour=red"}));
        assertThat(err()).contains("unknown input 'colour'");
    }

    @Test
    void testSuspendedRunCanBeResumed() throws IOException {
        Path file = write("approval.yaml", APPROVAL);
        String checkpoints = tempDir.resolve("runs").toString();

        assertEquals(StepflowCli.EXIT_OK,
                cli.run(new String[]{"run", file.toString(), "--checkpoint-dir", checkpoints}));
        assertThat(out()).contains("Status: SUSPENDED").contains("Waiting for input at step 'approve': Ship it?");
        Matcher matcher = Pattern.compile("Resume with: stepflow resume <file> (\\S+) --answer approve=<value>")
                .matcher(out());
        assertTrue(matcher.find(), out());
        String runId = matcher.group(1);

        int code = cli.run(new String[]{"resume", file.toString(), runId, "--answer", "approve=no",
                "--checkpoint-dir", checkpoints});

        assertEquals(StepflowCli.EXIT_FAILED, code);
        assertThat(out()).contains("Status: EXITED").contains("Exit status: rejected");
    }

    @Test
    void testSuspendedRunCanBeCancelled() throws IOException {
        Path file = write("approval.yaml", APPROVAL);
        String checkpoints = tempDir.resolve("runs").toString();
        cli.run(new String[]{"run", file.toString(), "--checkpoint-dir", checkpoints});
        Matcher matcher = Pattern.compile("Resume with: stepflow resume <file> (\\S+) ").matcher(out());
        assertTrue(matcher.find(), out());

        int code = cli.run(new String[]{"cancel", file.toString(), matcher.group(1), "--checkpoint-dir", checkpoints});

        assertEquals(StepflowCli.EXIT_OK, code);
        assertThat(out()).contains("Status: CANCELLED").contains("failed  approve");
        assertEquals(StepflowCli.EXIT_IO, cli.run(new String[]{"resume", file.toString(), matcher.group(1),
                "--answer", "approve=yes", "--checkpoint-dir", checkpoints}));
        assertThat(err()).contains("already finished with status CANCELLED");
    }

    @Test
    void testResumeOfUnknownRunIsIoError() throws IOException {
        Path file = write("approval.yaml", APPROVAL);

        int code = cli.run(new String[]{"resume", file.toString(), "missing-run",
                "--checkpoint-dir", tempDir.resolve("runs").toString()});

        assertEquals(StepflowCli.EXIT_IO, code);
        assertThat(err()).contains("No checkpoint found for run missing-run");
    }

    @Test
    void testRunArgumentErrors() throws IOException {
        Path file = write("hello.yaml", VALID);

        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[]{"run"}));
        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[]{"run", file.toString(), "--input", "novalue"}));
        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[]{"resume", file.toString()}));
        assertEquals(StepflowCli.EXIT_USAGE, cli.run(new String[]{"run", file.toString(), "--checkpoint-dir"}));
    }

    // ========== Argument helpers ==========

    @Test
    void testPositionalSkipsOptionValues() {
        assertEquals(List.of("flow.yaml", "run-1"), StepflowCli.positional(
                List.of("flow.yaml", "--input", "a=b", "run-1", "--strict", "--checkpoint-dir", "dir")));
    }

    @Test
    void testPairsSplitOnFirstEquals() throws StepflowCli.UsageException {
        assertEquals(Map.of("query", "a=b", "n", ""), StepflowCli.pairs(
                List.of("--input", "query=a=b", "--answer", "x=y", "--input", "n="), "--input"));

        StepflowCli.UsageException e = assertThrows(StepflowCli.UsageException.class,
                () -> StepflowCli.pairs(List.of("--input", "=value"), "--input"));
        assertThat(e.getMessage()).contains("expects name=value");
    }
}
