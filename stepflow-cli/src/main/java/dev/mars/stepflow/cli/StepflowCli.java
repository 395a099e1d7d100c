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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.stepflow.action.ActionRegistry;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.workflow.ValidationResult;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.WorkflowParseException;
import dev.mars.stepflow.workflow.WorkflowSchemaValidator;
import dev.mars.stepflow.workflow.WorkflowValidationException;
import dev.mars.stepflow.workflow.YamlWorkflowDefinitionParser;
import dev.mars.stepflow.workflow.checkpoint.FileCheckpointStore;
import dev.mars.stepflow.workflow.engine.ExecutionContext;
import dev.mars.stepflow.workflow.engine.GraphWorkflowEngine;
import dev.mars.stepflow.workflow.engine.InputValidationException;
import dev.mars.stepflow.workflow.engine.StepExecution;
import dev.mars.stepflow.workflow.engine.WorkflowRun;
import dev.mars.stepflow.workflow.engine.WorkflowStatus;
import dev.mars.stepflow.workflow.guardrail.ScannerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Command-line front end: validates workflow files, prints compiled graphs and
 * the document schema, and runs or resumes workflows with file checkpoints.
 *
 * <pre>
 *   stepflow validate [--strict] [--quiet] &lt;file&gt;
 *   stepflow dry-run &lt;file&gt;
 *   stepflow schema
 *   stepflow run &lt;file&gt; [--input k=v]... [--checkpoint-dir dir]
 *   stepflow resume &lt;file&gt; &lt;runId&gt; [--answer step=value]... [--checkpoint-dir dir]
 *   stepflow cancel &lt;file&gt; &lt;runId&gt; [--checkpoint-dir dir]
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepflowCli {
    private static final Logger logger = LoggerFactory.getLogger(StepflowCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String VERSION = "1.0.0";
    private static final String USAGE = """
            Stepflow CLI v%s

            USAGE:
              stepflow validate [--strict] [--quiet] <file>
              stepflow dry-run <file>
              stepflow schema
              stepflow run <file> [--input name=value]... [--checkpoint-dir dir]
              stepflow resume <file> <runId> [--answer step=value]... [--checkpoint-dir dir]
              stepflow cancel <file> <runId> [--checkpoint-dir dir]
              stepflow --help | --version

            EXIT CODES:
              0  Success (or run suspended waiting for input)
              1  Validation errors found, or the run failed
              2  Invalid command line arguments
              3  File not found, I/O error or unparseable YAML
            """.formatted(VERSION);

    private final PrintStream out;
    private final PrintStream err;
    private final StepflowConfiguration configuration;
    private final ActionRegistry actionRegistry;
    private final YamlWorkflowDefinitionParser parser;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public StepflowCli() {
        this(System.out, System.err, new StepflowConfiguration());
    }

    StepflowCli(PrintStream out, PrintStream err, StepflowConfiguration configuration) {
        this.out = out;
        this.err = err;
        this.configuration = configuration;
        this.actionRegistry = ActionRegistry.withBuiltins(configuration, null, null);
        WorkflowSchemaValidator validator = new WorkflowSchemaValidator(actionRegistry,
                ScannerRegistry.withBuiltins(), configuration);
        this.parser = new YamlWorkflowDefinitionParser(validator, configuration);
    }

    public static void main(String[] args) {
        System.exit(new StepflowCli().run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println("Error: No command specified");
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (args[0]) {
                case "--help":
                case "-h":
                    out.println(USAGE);
                    return EXIT_OK;
                case "--version":
                    out.println("Stepflow CLI v" + VERSION);
                    return EXIT_OK;
                case "validate":
                    return validate(rest);
                case "dry-run":
                    return dryRun(rest);
                case "schema":
                    return schema();
                case "run":
                    return execute(rest);
                case "resume":
                    return resume(rest);
                case "cancel":
                    return cancel(rest);
                default:
                    err.println("Error: Unknown command: " + args[0]);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("I/O failure details", e);
            return EXIT_IO;
        }
    }

    // validate

    private int validate(List<String> args) throws IOException, UsageException {
        boolean strict = args.contains("--strict");
        boolean quiet = args.contains("--quiet");
        Path file = singleFile(args, "validate");
        ValidationResult result = parser.validate(read(file));
        if (result.hasErrorCode(YamlWorkflowDefinitionParser.E_YAML)) {
            err.println("✗ " + file + " - " + result.getErrors().get(0).getMessage());
            return EXIT_IO;
        }

        boolean passed = result.isValid() && (!strict || !result.hasWarnings());
        if (!quiet || !passed) {
            String status;
            if (result.isValid()) {
                if (result.hasWarnings()) {
                    status = strict ? "✗ FAILED (warnings in strict mode)" : "⚠ VALID (with warnings)";
                } else {
                    status = "✓ VALID";
                }
            } else {
                status = "✗ INVALID";
            }
            out.println(file + ": " + status);
            printIssues("Errors", result.getErrors());
            if (!quiet || strict) {
                printIssues("Warnings", result.getWarnings());
            }
            if (!result.isValid() || result.hasWarnings()) {
                out.println("  Summary: " + result.getErrorCount() + " errors, "
                        + result.getWarningCount() + " warnings");
            }
        }
        return passed ? EXIT_OK : EXIT_FAILED;
    }

    private void printIssues(String title, List<ValidationResult.ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        out.println("  " + title + ":");
        for (ValidationResult.ValidationIssue issue : issues) {
            String fieldPath = issue.getFieldPath() == null || issue.getFieldPath().isEmpty()
                    ? "root" : issue.getFieldPath();
            out.println("    - [" + issue.getCode() + "] " + fieldPath + ": " + issue.getMessage());
        }
    }

    // dry-run and schema

    private int dryRun(List<String> args) throws IOException, UsageException {
        WorkflowDefinition definition = load(singleFile(args, "dry-run"));
        if (definition == null) {
            return EXIT_FAILED;
        }
        GraphWorkflowEngine engine = GraphWorkflowEngine.builder()
                .configuration(configuration)
                .actionRegistry(actionRegistry)
                .build();
        try {
            out.print(engine.dryRun(definition).describe());
            return EXIT_OK;
        } finally {
            engine.shutdown();
        }
    }

    private int schema() throws IOException {
        String resource = WorkflowSchemaValidator.SCHEMA_RESOURCE;
        try (InputStream in = WorkflowSchemaValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + resource);
            }
            out.println(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        return EXIT_OK;
    }

    // run and resume

    private int execute(List<String> args) throws IOException, UsageException {
        List<String> positional = positional(args);
        if (positional.size() != 1) {
            throw new UsageException("run expects exactly one workflow file");
        }
        WorkflowDefinition definition = load(Paths.get(positional.get(0)));
        if (definition == null) {
            return EXIT_FAILED;
        }
        Map<String, Object> inputs = new LinkedHashMap<>(pairs(args, "--input"));
        GraphWorkflowEngine engine = newEngine(checkpointDirectory(args));
        try {
            ExecutionContext context = ExecutionContext.builder().inputs(inputs).build();
            out.println("Run " + context.getRunId() + " of workflow '" + definition.getName() + "'");
            return report(await(engine.execute(definition, context)));
        } finally {
            engine.shutdown();
        }
    }

    private int resume(List<String> args) throws IOException, UsageException {
        List<String> positional = positional(args);
        if (positional.size() != 2) {
            throw new UsageException("resume expects a workflow file and a run id");
        }
        WorkflowDefinition definition = load(Paths.get(positional.get(0)));
        if (definition == null) {
            return EXIT_FAILED;
        }
        Map<String, Object> answers = new LinkedHashMap<>(pairs(args, "--answer"));
        GraphWorkflowEngine engine = newEngine(checkpointDirectory(args));
        try {
            return report(await(engine.resume(definition, positional.get(1), answers)));
        } finally {
            engine.shutdown();
        }
    }

    private int cancel(List<String> args) throws IOException, UsageException {
        List<String> positional = positional(args);
        if (positional.size() != 2) {
            throw new UsageException("cancel expects a workflow file and a run id");
        }
        WorkflowDefinition definition = load(Paths.get(positional.get(0)));
        if (definition == null) {
            return EXIT_FAILED;
        }
        GraphWorkflowEngine engine = newEngine(checkpointDirectory(args));
        try {
            WorkflowRun run = await(engine.cancel(definition, positional.get(1)));
            int code = report(run);
            return run != null && run.getStatus() == WorkflowStatus.CANCELLED ? EXIT_OK : code;
        } finally {
            engine.shutdown();
        }
    }

    private WorkflowRun await(CompletableFuture<WorkflowRun> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the run", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof InputValidationException) {
                err.println("Error: " + cause.getMessage());
                return null;
            }
            throw new IOException(cause.getMessage(), cause);
        }
    }

    private int report(WorkflowRun run) throws JsonProcessingException {
        if (run == null) {
            return EXIT_FAILED;
        }
        for (Map.Entry<String, Map<String, StepExecution>> job : run.getStepExecutions().entrySet()) {
            out.println("  " + job.getKey());
            for (StepExecution step : job.getValue().values()) {
                out.println("    " + step.getOutcome().toYamlValue() + "  " + step.getStepId()
                        + step.getErrorMessage().map(message -> "  (" + message + ")").orElse(""));
            }
        }
        out.println("Status: " + run.getStatus());
        run.getErrorMessage().ifPresent(message -> out.println("Error: " + message));

        if (run.getStatus() == WorkflowStatus.SUSPENDED) {
            run.getSuspension().ifPresent(suspension -> {
                out.println("Waiting for input at step '" + suspension.stepId() + "': " + suspension.prompt());
                if (!suspension.choices().isEmpty()) {
                    out.println("Choices: " + String.join(", ", suspension.choices()));
                }
                out.println("Resume with: stepflow resume <file> " + run.getRunId() + " --answer "
                        + suspension.stepId() + "=<value>");
            });
            return EXIT_OK;
        }
        if (run.getStatus() == WorkflowStatus.EXITED) {
            out.println("Exit status: " + run.getExitStatus().orElse("success"));
            if (!run.getExitOutputs().isEmpty()) {
                out.println(mapper.writeValueAsString(run.getExitOutputs()));
            }
            return "success".equals(run.getExitStatus().orElse("success")) ? EXIT_OK : EXIT_FAILED;
        }
        return run.isSuccessful() ? EXIT_OK : EXIT_FAILED;
    }

    // helpers

    private WorkflowDefinition load(Path file) throws IOException {
        String content = read(file);
        try {
            return parser.parseFromString(content);
        } catch (WorkflowParseException e) {
            throw new IOException(file + ": " + e.getMessage(), e);
        } catch (WorkflowValidationException e) {
            err.println(e.getMessage());
            return null;
        }
    }

    private GraphWorkflowEngine newEngine(Path checkpointDirectory) {
        return GraphWorkflowEngine.builder()
                .configuration(configuration)
                .actionRegistry(actionRegistry)
                .checkpointStore(new FileCheckpointStore(checkpointDirectory, configuration.isCheckpointFsync()))
                .build();
    }

    private Path checkpointDirectory(List<String> args) throws UsageException {
        int index = args.indexOf("--checkpoint-dir");
        if (index < 0) {
            return configuration.getCheckpointDirectory();
        }
        if (index + 1 >= args.size()) {
            throw new UsageException("--checkpoint-dir requires a directory");
        }
        return Paths.get(args.get(index + 1));
    }

    private static String read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("File does not exist: " + file);
        }
        return Files.readString(file);
    }

    private static Path singleFile(List<String> args, String command) throws UsageException {
        List<String> positional = positional(args);
        if (positional.size() != 1) {
            throw new UsageException(command + " expects exactly one workflow file");
        }
        return Paths.get(positional.get(0));
    }

    /**
     * Arguments that are neither options nor option values.
     */
    static List<String> positional(List<String> args) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.equals("--input") || arg.equals("--answer") || arg.equals("--checkpoint-dir")) {
                i++;
            } else if (!arg.startsWith("--")) {
                result.add(arg);
            }
        }
        return result;
    }

    static Map<String, String> pairs(List<String> args, String option) throws UsageException {
        Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i < args.size(); i++) {
            if (!args.get(i).equals(option)) {
                continue;
            }
            if (i + 1 >= args.size()) {
                throw new UsageException(option + " requires name=value");
            }
            String pair = args.get(++i);
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new UsageException(option + " expects name=value, got '" + pair + "'");
            }
            result.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return result;
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
