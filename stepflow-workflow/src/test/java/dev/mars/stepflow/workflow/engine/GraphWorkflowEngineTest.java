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

import dev.mars.stepflow.action.ActionRegistry;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.WorkflowSchemaValidator;
import dev.mars.stepflow.workflow.YamlWorkflowDefinitionParser;
import dev.mars.stepflow.workflow.checkpoint.CheckpointStore;
import dev.mars.stepflow.workflow.checkpoint.FileCheckpointStore;
import dev.mars.stepflow.workflow.checkpoint.InMemoryCheckpointStore;
import dev.mars.stepflow.workflow.graph.CompiledWorkflow;
import dev.mars.stepflow.workflow.guardrail.ScannerRegistry;
import dev.mars.stepflow.workflow.observability.WorkflowMetrics;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * End-to-end tests for GraphWorkflowEngine: sequencing, loops, failure handling,
 * suspension and resumption, cancellation and events.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class GraphWorkflowEngineTest {

    @TempDir
    Path tempDir;

    private StepflowConfiguration configuration;
    private ActionRegistry registry;
    private YamlWorkflowDefinitionParser parser;
    private GraphWorkflowEngine engine;
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
    private final FlakyAction flaky = new FlakyAction(2);
    private final BlockingAction blocking = new BlockingAction();

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty("stepflow.workspace", tempDir.toString());
        properties.setProperty("stepflow.monitoring.metrics.enabled", "false");
        properties.setProperty("stepflow.loop.max.iterations", "3");
        configuration = new StepflowConfiguration(properties);

        registry = ActionRegistry.withBuiltins(configuration, null, null);
        registry.register(new EchoAction());
        registry.register(new BoomAction());
        registry.register(new SlowAction());
        registry.register(flaky);
        registry.register(blocking);

        parser = new YamlWorkflowDefinitionParser(
                new WorkflowSchemaValidator(registry, ScannerRegistry.withBuiltins(), configuration), configuration);
        engine = newEngine(new InMemoryCheckpointStore());
    }

    @AfterEach
    void tearDown() {
        blocking.release.countDown();
        engine.shutdown();
    }

    private GraphWorkflowEngine newEngine(CheckpointStore store) {
        return GraphWorkflowEngine.builder()
                .configuration(configuration)
                .actionRegistry(registry)
                .checkpointStore(store)
                .listener(events::add)
                .build();
    }

    private WorkflowRun run(String yaml) throws Exception {
        return run(parser.parseFromString(yaml), ExecutionContext.builder().build());
    }

    private WorkflowRun run(WorkflowDefinition definition, ExecutionContext context) throws Exception {
        return engine.execute(definition, context).get(10, TimeUnit.SECONDS);
    }

    private List<WorkflowEvent.Type> eventTypes() {
        return events.stream().map(WorkflowEvent::getType).collect(Collectors.toList());
    }

    // ========== Sequencing ==========

    @Test
    void testSequentialStepsShareVariablesAndOutputs() throws Exception {
        WorkflowRun result = run("""
                name: greet
                inputs:
                  who:
                    type: string
                    default: world
                jobs:
                  main:
                    steps:
                      - id: greeting
                        uses: test/echo
                        with:
                          text: "hello ${{ inputs.who }}"
                      - id: remember
                        uses: state/set
                        with:
                          variables:
                            message: "${{ steps.greeting.outputs.text | upper }}"
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertTrue(result.isSuccessful());
        assertEquals("greet", result.getWorkflowName());
        assertEquals("hello world", result.getStepOutputs("greeting").get("text"));
        assertEquals("HELLO WORLD", result.getVariables().get("message"));
        assertEquals(2, result.getStepCount());
        assertEquals(0, result.getFailedStepCount());
        assertTrue(result.getEndTime().isPresent());
        assertTrue(result.getErrorMessage().isEmpty());
    }

    @Test
    void testFalseConditionSkipsStep() throws Exception {
        WorkflowRun result = run("""
                name: conditional
                inputs:
                  enabled:
                    type: boolean
                    default: false
                jobs:
                  main:
                    steps:
                      - id: optional
                        if: inputs.enabled
                        uses: test/echo
                        with: {text: never}
                      - id: report
                        uses: state/set
                        with:
                          variables:
                            seen: "${{ steps.optional.outputs.text | default('skipped') }}"
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(StepOutcome.SKIPPED, result.getStep("main", "optional").orElseThrow().getOutcome());
        assertEquals("skipped", result.getVariables().get("seen"));
        assertThat(eventTypes()).contains(WorkflowEvent.Type.STEP_SKIPPED);
    }

    @Test
    void testLaterJobsSeeEarlierJobSteps() throws Exception {
        WorkflowRun result = run("""
                name: two-jobs
                jobs:
                  build:
                    steps:
                      - id: compile
                        uses: test/echo
                        with: {artifact: app.jar}
                  ship:
                    steps:
                      - id: upload
                        uses: test/echo
                        with:
                          target: "${{ steps.compile.outputs.artifact }}"
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals("app.jar", result.getStep("ship", "upload").orElseThrow().getOutputs().get("target"));
    }

    // ========== Loops ==========

    @Test
    void testEmptyLoopSucceedsWithoutIterations() throws Exception {
        WorkflowRun result = run("""
                name: empty-loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: []
                        uses: state/set
                        with:
                          variables:
                            last: "${{ loop.item }}"
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        StepExecution each = result.getStep("main", "each").orElseThrow();
        assertEquals(StepOutcome.SUCCEEDED, each.getOutcome());
        assertEquals(0L, each.getOutputs().get("iterations"));
        assertEquals(List.of(), each.getOutputs().get("results"));
        assertFalse(result.getVariables().containsKey("last"));
    }

    @Test
    void testBreakIfStopsLoop() throws Exception {
        WorkflowRun result = run("""
                name: break-loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: [10, 20, 30]
                        break_if: "loop.index >= 2"
                        uses: test/echo
                        with:
                          value: "${{ loop.item }}"
                """);

        Map<String, Object> outputs = result.getStepOutputs("each");
        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(2L, outputs.get("iterations"));
        assertEquals(true, outputs.get("break_early"));
        assertEquals(2L, outputs.get("break_index"));
        assertEquals(20L, outputs.get("break_item"));
        assertEquals(List.of(Map.of("value", 10L), Map.of("value", 20L)), outputs.get("results"));
    }

    @Test
    void testBreakActionLeavesLoop() throws Exception {
        WorkflowRun result = run("""
                name: search
                jobs:
                  main:
                    steps:
                      - id: find
                        loop: [10, 20, 30]
                        if: "loop.item == 20"
                        uses: control/break
                        with:
                          reason: found
                          result: "${{ loop.item }}"
                """);

        Map<String, Object> outputs = result.getStepOutputs("find");
        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(2L, outputs.get("iterations"));
        assertEquals(true, outputs.get("break_early"));
        assertEquals(2L, outputs.get("break_index"));
        assertEquals(20L, outputs.get("break_item"));
        assertEquals(Arrays.asList(null, Map.of("reason", "found", "result", 20L)), outputs.get("results"));
    }

    @Test
    void testContinueActionSkipsIteration() throws Exception {
        WorkflowRun result = run("""
                name: skipper
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: [1, 2, 3]
                        uses: continue
                        with:
                          reason: "not interesting"
                """);

        Map<String, Object> outputs = result.getStepOutputs("each");
        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(3L, outputs.get("iterations"));
        assertEquals(0L, outputs.get("success_count"));
        assertEquals(false, outputs.get("break_early"));
        assertEquals(Arrays.asList(null, null, null), outputs.get("results"));
    }

    @Test
    void testBreakOutsideLoopCompletesStep() throws Exception {
        WorkflowRun result = run("""
                name: stray-break
                jobs:
                  main:
                    steps:
                      - id: stop
                        uses: control/break
                        with: {reason: nothing to leave}
                      - id: after
                        uses: test/echo
                        with: {text: reached}
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals("nothing to leave", result.getStepOutputs("stop").get("reason"));
        assertEquals("reached", result.getStepOutputs("after").get("text"));
    }

    @Test
    void testSkippedIterationsRecordNull() throws Exception {
        WorkflowRun result = run("""
                name: skip-loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: [1, 2, 3]
                        if: "loop.item != 2"
                        uses: test/echo
                        with:
                          value: "${{ loop.item }}"
                      - id: summary
                        uses: state/set
                        with:
                          variables:
                            second: "${{ steps.each.outputs.results[1].value | default('none') }}"
                            third: "${{ steps.each.outputs.results[2].value }}"
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(Arrays.asList(Map.of("value", 1L), null, Map.of("value", 3L)),
                result.getStepOutputs("each").get("results"));
        assertEquals(2L, result.getStepOutputs("each").get("success_count"));
        assertEquals("none", result.getVariables().get("second"));
        assertEquals(3L, result.getVariables().get("third"));
    }

    @Test
    void testLoopIsTruncatedToConfiguredMaximum() throws Exception {
        WorkflowRun result = run("""
                name: long-loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: [1, 2, 3, 4, 5]
                        uses: test/echo
                        with:
                          value: "${{ loop.item }}"
                          total: "${{ loop.total }}"
                          last: "${{ loop.last }}"
                """);

        assertEquals(3L, result.getStepOutputs("each").get("iterations"));
        assertEquals(false, result.getStepOutputs("each").get("break_early"));
        List<?> results = (List<?>) result.getStepOutputs("each").get("results");
        assertEquals(Map.of("value", 3L, "total", 3L, "last", true), results.get(2));
        assertEquals(false, ((Map<?, ?>) results.get(1)).get("last"));
    }

    @Test
    void testDocumentLoopLimitOverridesConfiguredMaximum() throws Exception {
        WorkflowRun result = run("""
                name: bounded-loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: [1, 2, 3, 4, 5]
                        max_iterations: 4
                        uses: test/echo
                        with:
                          value: "${{ loop.item }}"
                """);

        assertEquals(4L, result.getStepOutputs("each").get("iterations"));
    }

    @Test
    void testContinueOnErrorCollectsIterationErrors() throws Exception {
        WorkflowRun result = run("""
                name: tolerant-loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: [1, 2, 3]
                        continue_on_error: true
                        uses: test/boom
                        with:
                          fail_on: 2
                          value: "${{ loop.item }}"
                """);

        Map<String, Object> outputs = result.getStepOutputs("each");
        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(3L, outputs.get("iterations"));
        assertEquals(2L, outputs.get("success_count"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> errors = (List<Map<String, Object>>) outputs.get("errors");
        assertEquals(1, errors.size());
        assertEquals(2L, errors.get(0).get("index"));
        assertEquals(2L, errors.get(0).get("item"));
        assertEquals(ActionException.KIND_IO, errors.get(0).get("kind"));
    }

    @Test
    void testNonListLoopSourceFailsTheStep() throws Exception {
        WorkflowRun result = run("""
                name: bad-loop
                inputs:
                  items:
                    type: string
                    default: abc
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: "${{ inputs.items }}"
                        uses: test/echo
                        with: {value: x}
                """);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        StepExecution each = result.getStep("main", "each").orElseThrow();
        assertEquals(Optional.of(ActionException.KIND_EXPRESSION), each.getErrorKind());
        assertThat(each.getErrorMessage().orElseThrow()).contains("must evaluate to a list");
    }

    // ========== Failure handling ==========

    @Test
    void testOnFailureJumpsToHandlerWithErrorContext() throws Exception {
        WorkflowRun result = run("""
                name: recover
                jobs:
                  main:
                    steps:
                      - id: risky
                        uses: test/boom
                        on_failure: recover
                      - id: skipped
                        uses: test/echo
                        with: {text: never}
                      - id: recover
                        uses: state/set
                        with:
                          variables:
                            handled: "${{ error.message }}"
                            kind: "${{ error.kind }}"
                            failed_step: "${{ error.step }}"
                      - id: after
                        uses: state/set
                        with:
                          variables:
                            error_cleared: "${{ error == null }}"
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(StepOutcome.FAILED, result.getStep("main", "risky").orElseThrow().getOutcome());
        assertTrue(result.getStep("main", "skipped").isEmpty());
        assertEquals("disk full", result.getVariables().get("handled"));
        assertEquals("io", result.getVariables().get("kind"));
        assertEquals("risky", result.getVariables().get("failed_step"));
        assertEquals(true, result.getVariables().get("error_cleared"));
    }

    @Test
    void testUnhandledFailureRunsJobHooks() throws Exception {
        WorkflowRun result = run("""
                name: unhandled
                jobs:
                  main:
                    steps:
                      - id: risky
                        uses: test/boom
                      - id: never
                        uses: test/echo
                        with: {text: never}
                    on_failure:
                      - id: notify
                        uses: state/set
                        with:
                          variables:
                            notified: "${{ error.step }}"
                    finally:
                      - id: cleanup
                        uses: state/set
                        with:
                          variables:
                            cleaned: true
                on_complete:
                  - id: celebrate
                    uses: test/echo
                    with: {text: done}
                """);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals("risky", result.getVariables().get("notified"));
        assertEquals(true, result.getVariables().get("cleaned"));
        assertTrue(result.getStep("never").isEmpty());
        assertTrue(result.getStep("celebrate").isEmpty());
        assertThat(result.getErrorMessage().orElseThrow()).contains("step 'risky' failed (io): disk full");
        assertEquals(1, result.getFailedStepCount());
    }

    @Test
    void testRetryEventuallySucceeds() throws Exception {
        WorkflowRun result = run("""
                name: retrying
                jobs:
                  main:
                    steps:
                      - id: flaky
                        uses: test/flaky
                        retry:
                          max_attempts: 3
                          delay: 0
                """);

        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(3, result.getStep("main", "flaky").orElseThrow().getAttempts());
        assertEquals(3, flaky.calls.get());
        assertEquals(2, eventTypes().stream().filter(WorkflowEvent.Type.STEP_RETRYING::equals).count());
    }

    @Test
    void testRetryGivesUpAfterMaxAttempts() throws Exception {
        WorkflowRun result = run("""
                name: exhausted
                jobs:
                  main:
                    steps:
                      - id: flaky
                        uses: test/flaky
                        retry:
                          max_attempts: 2
                          delay: 0
                """);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(2, flaky.calls.get());
        assertEquals(Optional.of("io"), result.getStep("main", "flaky").orElseThrow().getErrorKind());
    }

    @Test
    void testStepTimeout() throws Exception {
        WorkflowRun result = run("""
                name: slow
                jobs:
                  main:
                    steps:
                      - id: slow
                        uses: test/slow
                        timeout: 1
                """);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        StepExecution slow = result.getStep("main", "slow").orElseThrow();
        assertEquals(Optional.of(ActionException.KIND_TIMEOUT), slow.getErrorKind());
        assertThat(slow.getErrorMessage().orElseThrow()).startsWith("timed out after");
    }

    @Test
    void testGuardrailViolationFailsStep() throws Exception {
        WorkflowRun result = run("""
                name: leaky
                jobs:
                  main:
                    steps:
                      - id: leak
                        uses: test/echo
                        with:
                          text: "here it is password=hunter2hunter2"
                        guardrails:
                          output:
                            secrets: {}
                """);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(Optional.of(ActionException.KIND_GUARDRAIL),
                result.getStep("main", "leak").orElseThrow().getErrorKind());
        WorkflowEvent violation = events.stream()
                .filter(event -> event.getType() == WorkflowEvent.Type.GUARDRAIL_VIOLATION)
                .findFirst().orElseThrow();
        assertEquals("secrets", violation.getDetails().get("scanner"));
        assertEquals("output", violation.getDetails().get("phase"));
    }

    // ========== Control actions ==========

    @Test
    void testExitEndsRunEarlyButRunsFinally() throws Exception {
        WorkflowRun result = run("""
                name: early-exit
                jobs:
                  main:
                    steps:
                      - id: stop
                        uses: control/exit
                        with:
                          status: success
                          message: nothing to do
                          outputs: {reason: up-to-date}
                      - id: never
                        uses: test/echo
                        with: {text: never}
                    finally:
                      - id: cleanup
                        uses: test/echo
                        with: {text: cleaned}
                on_complete:
                  - id: celebrate
                    uses: test/echo
                    with: {text: done}
                """);

        assertEquals(WorkflowStatus.EXITED, result.getStatus());
        assertEquals(Optional.of("success"), result.getExitStatus());
        assertEquals(Map.of("reason", "up-to-date"), result.getExitOutputs());
        assertEquals(Optional.of("nothing to do"), result.getErrorMessage());
        assertTrue(result.getStep("never").isEmpty());
        assertTrue(result.getStep("cleanup").isPresent());
        assertTrue(result.getStep("celebrate").isEmpty());
    }

    @Test
    void testFailBypassesOnFailureHandlers() throws Exception {
        WorkflowRun result = run("""
                name: explicit-fail
                jobs:
                  main:
                    steps:
                      - id: guard
                        uses: control/fail
                        on_failure: handler
                        with:
                          message: bad input
                          error_code: E_BAD
                      - id: handler
                        uses: test/echo
                        with: {text: handled}
                    on_failure:
                      - id: capture
                        uses: state/set
                        with:
                          variables:
                            failure_kind: "${{ error.kind }}"
                """);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(Optional.of("bad input"), result.getErrorMessage());
        assertTrue(result.getStep("handler").isEmpty());
        assertEquals("E_BAD", result.getVariables().get("failure_kind"));
        assertEquals(Optional.of("E_BAD"), result.getStep("main", "guard").orElseThrow().getErrorKind());
    }

    // ========== Suspension ==========

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
                  - id: record
                    uses: state/set
                    with:
                      variables:
                        approved: "${{ steps.approve.outputs.response }}"
            """;

    @Test
    void testSuspendAndResumeMatchesImmediateAnswer() throws Exception {
        engine.shutdown();
        Path checkpoints = tempDir.resolve("checkpoints");
        engine = newEngine(new FileCheckpointStore(checkpoints, false));
        WorkflowDefinition definition = parser.parseFromString(APPROVAL);

        WorkflowRun suspended = run(definition, ExecutionContext.builder().runId("approval-1").build());

        assertEquals(WorkflowStatus.SUSPENDED, suspended.getStatus());
        assertTrue(suspended.isSuspended());
        SuspensionState suspension = suspended.getSuspension().orElseThrow();
        assertEquals("approve", suspension.stepId());
        assertEquals("Ship it?", suspension.prompt());
        assertEquals(WorkflowStatus.SUSPENDED, engine.getStatus("approval-1"));
        assertTrue(events.stream().anyMatch(event -> event.getType() == WorkflowEvent.Type.RUN_SUSPENDED));

        // a fresh engine on the same directory picks the run up
        engine.shutdown();
        engine = newEngine(new FileCheckpointStore(checkpoints, false));
        WorkflowRun resumed = engine.resume(definition, "approval-1", Map.of("approve", "yes"))
                .get(10, TimeUnit.SECONDS);

        WorkflowRun immediate = run(definition, ExecutionContext.builder()
                .runId("approval-2").answer("approve", "yes").build());

        assertEquals(WorkflowStatus.SUCCEEDED, resumed.getStatus());
        assertEquals(true, resumed.getVariables().get("approved"));
        assertEquals(immediate.getStatus(), resumed.getStatus());
        assertEquals(immediate.getVariables(), resumed.getVariables());
        assertEquals(immediate.getStepOutputs("approve"), resumed.getStepOutputs("approve"));
        assertTrue(events.stream().anyMatch(event -> event.getType() == WorkflowEvent.Type.RUN_RESUMED));
    }

    @Test
    void testResumeWithoutAnswerSuspendsAgain() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(APPROVAL);
        run(definition, ExecutionContext.builder().runId("again").build());

        WorkflowRun resumed = engine.resume(definition, "again", Map.of()).get(10, TimeUnit.SECONDS);

        assertEquals(WorkflowStatus.SUSPENDED, resumed.getStatus());
        assertEquals("approve", resumed.getSuspension().orElseThrow().stepId());
    }

    @Test
    void testResumeRejectsChangedWorkflow() throws Exception {
        run(parser.parseFromString(APPROVAL), ExecutionContext.builder().runId("changed").build());
        WorkflowDefinition edited = parser.parseFromString(APPROVAL.replace("Ship it?", "Release it?"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> engine.resume(edited, "changed", Map.of("approve", "yes")).get(10, TimeUnit.SECONDS));

        assertInstanceOf(WorkflowExecutionException.class, e.getCause());
        assertThat(e.getCause().getMessage()).contains("has changed since run changed");
    }

    @Test
    void testResumeRejectsUnknownAndFinishedRuns() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(APPROVAL);
        run(definition, ExecutionContext.builder().runId("done").answer("approve", "no").build());

        ExecutionException unknown = assertThrows(ExecutionException.class,
                () -> engine.resume(definition, "nosuch", Map.of()).get(10, TimeUnit.SECONDS));
        ExecutionException finished = assertThrows(ExecutionException.class,
                () -> engine.resume(definition, "done", Map.of()).get(10, TimeUnit.SECONDS));

        assertThat(unknown.getCause().getMessage()).contains("No checkpoint found");
        assertThat(finished.getCause().getMessage()).contains("already finished with status SUCCEEDED");
    }

    @Test
    void testCancelOfSuspendedRunFinishesItFromCheckpoint() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(APPROVAL);
        run(definition, ExecutionContext.builder().runId("parked").build());
        assertEquals(WorkflowStatus.SUSPENDED, engine.getStatus("parked"));

        assertTrue(engine.cancel("parked"));

        assertEquals(WorkflowStatus.CANCELLED, engine.getStatus("parked"));
        assertFalse(engine.cancel("parked"));
        WorkflowEvent last = events.get(events.size() - 1);
        assertEquals(WorkflowEvent.Type.RUN_FINISHED, last.getType());
        assertEquals("CANCELLED", last.getDetails().get("status"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> engine.resume(definition, "parked", Map.of("approve", "yes")).get(10, TimeUnit.SECONDS));
        assertThat(e.getCause().getMessage()).contains("already finished with status CANCELLED");
    }

    @Test
    void testCancelWithDefinitionWalksFinallySteps() throws Exception {
        WorkflowDefinition definition = parser.parseFromString("""
                name: approval-with-cleanup
                jobs:
                  main:
                    steps:
                      - id: approve
                        uses: human/input
                        with:
                          prompt: "Ship it?"
                          input_type: confirm
                      - id: ship
                        uses: test/echo
                        with: {text: shipped}
                    finally:
                      - id: cleanup
                        uses: test/echo
                        with: {text: cleaned}
                """);
        run(definition, ExecutionContext.builder().runId("parked-2").build());

        WorkflowRun cancelled = engine.cancel(definition, "parked-2").get(10, TimeUnit.SECONDS);

        assertEquals(WorkflowStatus.CANCELLED, cancelled.getStatus());
        assertTrue(cancelled.getStep("ship").isEmpty());
        assertEquals("cleaned", cancelled.getStepOutputs("cleanup").get("text"));
        StepExecution approve = cancelled.getStep("main", "approve").orElseThrow();
        assertEquals(StepOutcome.FAILED, approve.getOutcome());
        assertEquals(WorkflowStatus.CANCELLED, engine.getStatus("parked-2"));
    }

    @Test
    void testCancelOfUnknownRunReturnsFalse() {
        assertFalse(engine.cancel("never-started"));
    }

    // ========== Metrics ==========

    @Test
    void testResumedRunIsCountedOnceAsActive() throws Exception {
        WorkflowMetrics metrics = spy(new WorkflowMetrics(OpenTelemetry.noop()));
        GraphWorkflowEngine metered = GraphWorkflowEngine.builder()
                .configuration(configuration)
                .actionRegistry(registry)
                .checkpointStore(new InMemoryCheckpointStore())
                .metrics(metrics)
                .build();
        try {
            WorkflowDefinition definition = parser.parseFromString(APPROVAL);
            metered.execute(definition, ExecutionContext.builder().runId("metered").build())
                    .get(10, TimeUnit.SECONDS);
            assertEquals(0, metrics.getActiveRuns());

            WorkflowRun resumed = metered.resume(definition, "metered", Map.of("approve", "yes"))
                    .get(10, TimeUnit.SECONDS);

            assertEquals(WorkflowStatus.SUCCEEDED, resumed.getStatus());
            assertEquals(0, metrics.getActiveRuns());
            verify(metrics, times(1)).recordRunStarted("approval");
            verify(metrics, times(1)).recordRunResumed("approval");
            verify(metrics, times(1)).recordRunSuspended("approval");
        } finally {
            metered.shutdown();
        }
    }

    @Test
    void testCancellingSuspendedRunLeavesActiveCountUnchanged() throws Exception {
        WorkflowMetrics metrics = new WorkflowMetrics(OpenTelemetry.noop());
        GraphWorkflowEngine metered = GraphWorkflowEngine.builder()
                .configuration(configuration)
                .actionRegistry(registry)
                .checkpointStore(new InMemoryCheckpointStore())
                .metrics(metrics)
                .build();
        try {
            metered.execute(parser.parseFromString(APPROVAL), ExecutionContext.builder().runId("parked").build())
                    .get(10, TimeUnit.SECONDS);

            assertTrue(metered.cancel("parked"));

            assertEquals(0, metrics.getActiveRuns());
        } finally {
            metered.shutdown();
        }
    }

    // ========== Engine operations ==========

    @Test
    void testCancelStopsBeforeNextStep() throws Exception {
        WorkflowDefinition definition = parser.parseFromString("""
                name: cancellable
                jobs:
                  main:
                    steps:
                      - id: wait
                        uses: test/blocking
                      - id: after
                        uses: test/echo
                        with: {text: never}
                    finally:
                      - id: cleanup
                        uses: test/echo
                        with: {text: cleaned}
                """);

        CompletableFuture<WorkflowRun> future = engine.execute(definition,
                ExecutionContext.builder().runId("cancel-me").build());
        await().atMost(5, TimeUnit.SECONDS).until(() -> blocking.started.getCount() == 0);

        assertEquals(WorkflowStatus.RUNNING, engine.getStatus("cancel-me"));
        ExecutionException duplicate = assertThrows(ExecutionException.class,
                () -> engine.execute(definition, ExecutionContext.builder().runId("cancel-me").build())
                        .get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, duplicate.getCause());

        assertTrue(engine.cancel("cancel-me"));
        blocking.release.countDown();
        WorkflowRun result = future.get(10, TimeUnit.SECONDS);

        assertEquals(WorkflowStatus.CANCELLED, result.getStatus());
        assertTrue(result.getStep("after").isEmpty());
        assertTrue(result.getStep("cleanup").isPresent());
        assertFalse(engine.cancel("cancel-me"));
        assertEquals(WorkflowStatus.CANCELLED, engine.getStatus("cancel-me"));
    }

    @Test
    void testUnknownInputIsRejected() throws Exception {
        WorkflowDefinition definition = parser.parseFromString("""
                name: strict-inputs
                inputs:
                  name:
                    type: string
                    default: world
                jobs:
                  main:
                    steps:
                      - uses: test/echo
                        with: {text: hi}
                """);

        ExecutionException e = assertThrows(ExecutionException.class, () -> run(definition,
                ExecutionContext.builder().input("colour", "blue").build()));

        InputValidationException cause = assertInstanceOf(InputValidationException.class, e.getCause());
        assertEquals(List.of("unknown input 'colour'"), cause.getProblems());
        assertFalse(eventTypes().contains(WorkflowEvent.Type.RUN_STARTED));
    }

    @Test
    void testAllInputProblemsAreReportedTogether() throws Exception {
        WorkflowDefinition definition = parser.parseFromString("""
                name: required-inputs
                inputs:
                  name:
                    type: string
                jobs:
                  main:
                    steps:
                      - uses: test/echo
                        with: {text: "${{ inputs.name }}"}
                """);

        ExecutionException e = assertThrows(ExecutionException.class, () -> run(definition,
                ExecutionContext.builder().input("colour", "blue").build()));

        InputValidationException cause = assertInstanceOf(InputValidationException.class, e.getCause());
        assertThat(cause.getProblems()).containsExactlyInAnyOrder("unknown input 'colour'",
                "input 'name' is required");
    }

    @Test
    void testListenerReceivesOrderedEvents() throws Exception {
        WorkflowEventListener failing = mock(WorkflowEventListener.class);
        doThrow(new IllegalStateException("listener failure is contained")).when(failing).onEvent(any());
        engine.addListener(failing);

        WorkflowRun result = run("""
                name: observed
                jobs:
                  main:
                    steps:
                      - id: a
                        uses: test/echo
                        with: {text: a}
                      - id: b
                        uses: test/echo
                        with: {text: b}
                """);

        List<WorkflowEvent.Type> types = eventTypes();
        assertEquals(WorkflowStatus.SUCCEEDED, result.getStatus());
        assertEquals(WorkflowEvent.Type.RUN_STARTED, types.get(0));
        assertEquals(WorkflowEvent.Type.RUN_FINISHED, types.get(types.size() - 1));
        assertEquals(2, types.stream().filter(WorkflowEvent.Type.STEP_COMPLETED::equals).count());
        assertThat(types).contains(WorkflowEvent.Type.CHECKPOINT_WRITTEN);
        assertEquals("SUCCEEDED", events.get(events.size() - 1).getDetails().get("status"));
        assertTrue(events.stream().allMatch(event -> result.getRunId().equals(event.getRunId())));
        verify(failing).onEvent(argThat(event -> event.getType() == WorkflowEvent.Type.RUN_FINISHED));
        verify(failing, times(events.size())).onEvent(any());
    }

    @Test
    void testGetStatusOfUnknownRun() {
        assertNull(engine.getStatus("never-started"));
        assertFalse(engine.cancel("never-started"));
    }

    @Test
    void testDryRunCompilesWithoutExecuting() throws Exception {
        CompiledWorkflow compiled = engine.dryRun(parser.parseFromString("""
                name: plan
                jobs:
                  main:
                    steps:
                      - id: a
                        uses: test/boom
                """));

        assertEquals(1, compiled.getJobs().size());
        assertTrue(events.isEmpty());
    }

    @Test
    void testExecuteAfterShutdownFails() throws Exception {
        WorkflowDefinition definition = parser.parseFromString("""
                name: late
                jobs:
                  main:
                    steps:
                      - uses: test/echo
                        with: {text: hi}
                """);
        engine.shutdown();

        ExecutionException e = assertThrows(ExecutionException.class, () -> run(definition,
                ExecutionContext.builder().build()));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    // ========== Test actions ==========

    /** Returns its parameters as outputs. */
    static class EchoAction implements WorkflowAction {
        @Override
        public String getActionId() {
            return "test/echo";
        }

        @Override
        public boolean isInline() {
            return true;
        }

        @Override
        public ActionResult execute(ActionRequest request) {
            return ActionResult.of(request.getWith());
        }
    }

    /** Fails with an I/O error, optionally only for one {@code fail_on} value. */
    static class BoomAction implements WorkflowAction {
        @Override
        public String getActionId() {
            return "test/boom";
        }

        @Override
        public ActionResult execute(ActionRequest request) throws ActionException {
            Object failOn = request.getParameters().get("fail_on");
            Object value = request.getParameters().get("value");
            if (failOn == null || String.valueOf(failOn).equals(String.valueOf(value))) {
                throw new ActionException(getActionId(), ActionException.KIND_IO, "disk full");
            }
            return ActionResult.of(request.getWith());
        }
    }

    static class FlakyAction implements WorkflowAction {
        private final int failures;
        final AtomicInteger calls = new AtomicInteger();

        FlakyAction(int failures) {
            this.failures = failures;
        }

        @Override
        public String getActionId() {
            return "test/flaky";
        }

        @Override
        public ActionResult execute(ActionRequest request) throws ActionException {
            int call = calls.incrementAndGet();
            if (call <= failures) {
                throw new ActionException(getActionId(), ActionException.KIND_IO, "attempt " + call + " failed");
            }
            return ActionResult.of(Map.of("attempt", (long) call));
        }
    }

    static class SlowAction implements WorkflowAction {
        @Override
        public String getActionId() {
            return "test/slow";
        }

        @Override
        public ActionResult execute(ActionRequest request) throws ActionException {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionException(getActionId(), ActionException.KIND_INTERRUPTED, "interrupted", e);
            }
            return ActionResult.empty();
        }
    }

    /** Blocks until released so a test can act while the step is in flight. */
    static class BlockingAction implements WorkflowAction {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public String getActionId() {
            return "test/blocking";
        }

        @Override
        public ActionResult execute(ActionRequest request) throws ActionException {
            started.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new ActionException(getActionId(), ActionException.KIND_TIMEOUT, "never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionException(getActionId(), ActionException.KIND_INTERRUPTED, "interrupted", e);
            }
            return ActionResult.empty();
        }
    }
}
