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

import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.ControlSignal;
import dev.mars.stepflow.action.SuspensionRequest;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.Values;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.core.exceptions.ActionTimeoutException;
import dev.mars.stepflow.workflow.Step;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.checkpoint.Checkpoint;
import dev.mars.stepflow.workflow.checkpoint.CheckpointException;
import dev.mars.stepflow.workflow.expression.ExpressionException;
import dev.mars.stepflow.workflow.graph.ActionNode;
import dev.mars.stepflow.workflow.graph.BranchNode;
import dev.mars.stepflow.workflow.graph.CompiledWorkflow;
import dev.mars.stepflow.workflow.graph.FailureRoute;
import dev.mars.stepflow.workflow.graph.GraphCompiler;
import dev.mars.stepflow.workflow.graph.GraphNode;
import dev.mars.stepflow.workflow.graph.JumpNode;
import dev.mars.stepflow.workflow.graph.LoopHeadNode;
import dev.mars.stepflow.workflow.graph.LoopTailNode;
import dev.mars.stepflow.workflow.graph.Phase;
import dev.mars.stepflow.workflow.graph.Subgraph;
import dev.mars.stepflow.workflow.guardrail.GuardrailConfig;
import dev.mars.stepflow.workflow.guardrail.GuardrailOutcome;
import dev.mars.stepflow.workflow.guardrail.GuardrailPhase;
import dev.mars.stepflow.workflow.guardrail.GuardrailViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one run through its compiled workflow. Each node is visited, the run
 * context updated and a checkpoint appended before the cursor moves on.
 *
 * <p>An executor is used by one thread at a time; only {@link #requestCancel()}
 * may be called from elsewhere.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
final class RunExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RunExecutor.class);

    private static final String KIND_LOOP = "loop";
    private static final String KIND_CANCELLED = "cancelled";
    private static final String KIND_FAILED = "failed";

    private final GraphWorkflowEngine engine;
    private final CompiledWorkflow compiled;
    private final WorkflowDefinition definition;
    private final RunContext run;
    private final EnvScope env;
    private final SecretsScope secrets;
    private long sequence;
    private String interruptedNode;
    private SuspensionState pendingSuspension;
    private volatile boolean cancelRequested;

    RunExecutor(GraphWorkflowEngine engine, CompiledWorkflow compiled, RunContext run, long nextSequence,
                boolean resumed) {
        this.engine = engine;
        this.compiled = compiled;
        this.definition = compiled.getDefinition();
        this.run = run;
        this.sequence = nextSequence;
        this.secrets = new SecretsScope(engine.getSecretProvider());
        this.env = new EnvScope(definition.getEnv(), run.getInputs(), secrets, engine.getEvaluator(),
                engine.getClock());
        if (resumed) {
            this.interruptedNode = run.getInFlight().orElse(null);
            this.pendingSuspension = run.getSuspension().orElse(null);
        }
    }

    RunContext getRun() {
        return run;
    }

    /**
     * Asks the run to stop before its next dispatch.
     *
     * @return false if the run had already finished
     */
    boolean requestCancel() {
        if (run.getStatus().isTerminal()) {
            return false;
        }
        cancelRequested = true;
        return true;
    }

    /**
     * Walks the graph until the run finishes or suspends.
     *
     * @throws WorkflowExecutionException if a checkpoint cannot be written or the
     *                                    compiled graph and the run state disagree
     */
    WorkflowRun execute() throws WorkflowExecutionException {
        String runId = run.getRunId();
        run.setStatus(WorkflowStatus.RUNNING);
        run.setSuspension(null);

        Cursor cursor = run.getCursor();
        if (cursor == null) {
            engine.getMetrics().recordRunStarted(run.getWorkflowName());
            cursor = compiled.getJobs().isEmpty()
                    ? enter(CompiledWorkflow.WORKFLOW_SCOPE, Phase.ON_COMPLETE)
                    : enter(compiled.getJobs().keySet().iterator().next(), Phase.MAIN);
            run.setCursor(cursor);
            logger.info("Starting run {} of workflow '{}'", runId, run.getWorkflowName());
            fire(WorkflowEvent.Type.RUN_STARTED, null, null, Map.of("jobs", (long) compiled.getJobs().size()));
        } else {
            engine.getMetrics().recordRunResumed(run.getWorkflowName());
            logger.info("Resuming run {} of workflow '{}' at {}", runId, run.getWorkflowName(), cursor);
            fire(WorkflowEvent.Type.RUN_RESUMED, cursor.job(), null, Map.of("cursor", cursor.toString()));
        }
        checkpoint();

        while (cursor != null) {
            if (GraphNode.END.equals(cursor.nodeId())) {
                cursor = advance(cursor);
                if (cursor != null) {
                    run.setCursor(cursor);
                    checkpoint();
                }
                continue;
            }
            Subgraph subgraph = compiled.getSubgraph(cursor.job(), cursor.phase());
            GraphNode node;
            try {
                node = subgraph.getNode(cursor.nodeId());
            } catch (IllegalArgumentException e) {
                throw new WorkflowExecutionException(runId, "Cursor " + cursor + " does not match the workflow", e);
            }
            String next = visit(cursor, subgraph, node);
            if (next == null) {
                return WorkflowRun.of(run, null);
            }
            cursor = cursor.at(next);
            run.setCursor(cursor);
            checkpoint();
        }
        return finish();
    }

    private WorkflowRun finish() throws WorkflowExecutionException {
        Instant now = engine.getClock().instant();
        run.setStatus(run.finalStatus());
        run.setFinishedAt(now);
        checkpoint();
        try {
            engine.getCheckpointStore().archive(run.getRunId());
        } catch (CheckpointException e) {
            logger.warn("Could not archive checkpoints of run {}: {}", run.getRunId(), e.getMessage());
            logger.debug("Archive failure details", e);
        }

        double seconds = Duration.between(run.getStartedAt(), now).toMillis() / 1000.0;
        engine.getMetrics().recordRunFinished(run.getWorkflowName(), run.getStatus().name(), seconds);
        fire(WorkflowEvent.Type.RUN_FINISHED, null, null, details("status", run.getStatus().name(),
                "message", run.getTerminationMessage().orElse(null)));
        if (run.getStatus() == WorkflowStatus.FAILED) {
            logger.error("Run {} failed: {}", run.getRunId(), run.getTerminationMessage().orElse("unknown error"));
        } else {
            logger.info("Run {} finished with status {} in {}s", run.getRunId(), run.getStatus(), seconds);
        }
        return WorkflowRun.of(run, null);
    }

    // Phase order

    private Cursor advance(Cursor cursor) {
        if (cancelRequested && run.terminate(RunContext.Termination.CANCELLED, "Run cancelled")) {
            logger.info("Run {} cancelled", run.getRunId());
        }
        String job = cursor.job();
        if (CompiledWorkflow.WORKFLOW_SCOPE.equals(job)) {
            if (cursor.phase() == Phase.FINALLY) {
                return null;
            }
            return enter(job, Phase.FINALLY);
        }
        switch (cursor.phase()) {
            case MAIN:
                if (run.getTermination() == RunContext.Termination.NONE) {
                    return enter(job, Phase.ON_COMPLETE);
                }
                if (run.getTermination() == RunContext.Termination.FAILED) {
                    return enter(job, Phase.ON_FAILURE);
                }
                return enter(job, Phase.FINALLY);
            case ON_COMPLETE:
            case ON_FAILURE:
                return enter(job, Phase.FINALLY);
            default:
                String nextJob = nextJob(job);
                if (nextJob != null && run.getTermination() == RunContext.Termination.NONE) {
                    return enter(nextJob, Phase.MAIN);
                }
                switch (run.getTermination()) {
                    case NONE:
                        return enter(CompiledWorkflow.WORKFLOW_SCOPE, Phase.ON_COMPLETE);
                    case FAILED:
                        return enter(CompiledWorkflow.WORKFLOW_SCOPE, Phase.ON_FAILURE);
                    default:
                        return enter(CompiledWorkflow.WORKFLOW_SCOPE, Phase.FINALLY);
                }
        }
    }

    private Cursor enter(String job, Phase phase) {
        Subgraph subgraph = compiled.getSubgraph(job, phase);
        if (!subgraph.isEmpty()) {
            logger.debug("Run {} entering {} of {}", run.getRunId(), phase.getKey(), job);
        }
        return new Cursor(job, phase, subgraph.getEntry());
    }

    private String nextJob(String job) {
        boolean found = false;
        for (String name : compiled.getJobs().keySet()) {
            if (found) {
                return name;
            }
            found = name.equals(job);
        }
        return null;
    }

    // Nodes

    /**
     * Visits one node and returns the id of the next node, or {@code null} when
     * the run suspended.
     */
    private String visit(Cursor cursor, Subgraph subgraph, GraphNode node) throws WorkflowExecutionException {
        switch (node.getType()) {
            case BRANCH:
                return visitBranch(cursor, (BranchNode) node);
            case LOOP_HEAD:
                return visitLoopHead(cursor, (LoopHeadNode) node);
            case LOOP_TAIL:
                return visitLoopTail(cursor, (LoopTailNode) node);
            case JUMP:
                return ((JumpNode) node).target();
            case ACTION:
                return visitAction(cursor, subgraph, (ActionNode) node);
            default:
                throw new WorkflowExecutionException(run.getRunId(), "Unsupported node type " + node.getType());
        }
    }

    private String visitBranch(Cursor cursor, BranchNode branch) {
        String stepId = branch.stepId();
        boolean take;
        try {
            take = engine.getEvaluator().evaluateCondition(branch.condition(), evaluationContext(cursor.job()));
        } catch (ExpressionException e) {
            return fail(cursor, stepId, null, branch.failure(), branch.failureRoute(), true,
                    ActionException.KIND_EXPRESSION, "if: " + e.getMessage(), Map.of());
        }
        if (take) {
            return branch.whenTrue();
        }
        Optional<LoopFrame> frame = iterationFrame(stepId);
        if (frame.isPresent()) {
            logger.debug("Step '{}' iteration {} skipped by condition", stepId, frame.get().getIndex() + 1);
            frame.get().recordSkip();
            return branch.whenFalse();
        }
        run.putStep(cursor.job(), StepExecution.skipped(stepId, engine.getClock().instant()));
        run.stepFinished(stepId);
        logger.info("Step '{}' skipped: condition is false", stepId);
        fire(WorkflowEvent.Type.STEP_SKIPPED, cursor.job(), stepId, Map.of());
        return branch.whenFalse();
    }

    private String visitLoopHead(Cursor cursor, LoopHeadNode head) {
        String stepId = head.stepId();
        Object value;
        try {
            RunEvaluationContext context = evaluationContext(cursor.job());
            value = head.items() instanceof String
                    ? engine.getEvaluator().evaluateBare((String) head.items(), context)
                    : engine.getEvaluator().resolve(head.items(), context);
        } catch (ExpressionException e) {
            return fail(cursor, stepId, null, head.failure(), head.failureRoute(), false,
                    ActionException.KIND_EXPRESSION, "loop: " + e.getMessage(), Map.of());
        }
        if (!(value instanceof List)) {
            String type = value == null ? "null" : value.getClass().getSimpleName();
            return fail(cursor, stepId, null, head.failure(), head.failureRoute(), false,
                    ActionException.KIND_EXPRESSION, "loop must evaluate to a list, got " + type, Map.of());
        }
        @SuppressWarnings("unchecked")
        List<Object> items = (List<Object>) Values.normalize(value);
        int maxIterations = head.maxIterations() > 0 ? head.maxIterations()
                : engine.getConfiguration().getMaxLoopIterations();
        LoopFrame frame = new LoopFrame(stepId, items, maxIterations);
        if (frame.isTruncated()) {
            logger.warn("Loop of step '{}' has {} items, only the first {} will run", stepId, items.size(),
                    maxIterations);
        }
        run.pushLoop(frame);
        run.putStep(cursor.job(), StepExecution.running(stepId, 1, engine.getClock().instant()));
        fire(WorkflowEvent.Type.STEP_STARTED, cursor.job(), stepId, Map.of("items", (long) items.size()));
        logger.debug("Step '{}' looping over {} item(s)", stepId, frame.getLimit());
        return frame.getLimit() > 0 ? head.body() : head.tail();
    }

    private String visitLoopTail(Cursor cursor, LoopTailNode tail) throws WorkflowExecutionException {
        String stepId = tail.stepId();
        LoopFrame frame = iterationFrame(stepId).orElseThrow(() -> new WorkflowExecutionException(
                run.getRunId(), "No active loop for step '" + stepId + "' at " + cursor));
        if (frame.getLimit() > 0) {
            fire(WorkflowEvent.Type.LOOP_ITERATION, cursor.job(), stepId, details(
                    "index", (long) frame.getIndex() + 1, "succeeded", frame.isLastSucceeded()));
        }
        if (frame.isBreakEarly()) {
            return exitLoop(cursor, tail, frame);
        }
        if (tail.breakIf() != null && frame.isLastSucceeded()) {
            boolean stop;
            try {
                stop = engine.getEvaluator().evaluateCondition(tail.breakIf(), evaluationContext(cursor.job()));
            } catch (ExpressionException e) {
                return fail(cursor, stepId, null, tail.failure(), tail.failureRoute(), false,
                        ActionException.KIND_EXPRESSION, "break_if: " + e.getMessage(), Map.of());
            }
            if (stop) {
                frame.requestBreak();
                logger.info("Step '{}' loop stopped by break_if at iteration {}", stepId, frame.getIndex() + 1);
                return exitLoop(cursor, tail, frame);
            }
        }
        if (frame.advance()) {
            return tail.again();
        }
        return exitLoop(cursor, tail, frame);
    }

    private String exitLoop(Cursor cursor, LoopTailNode tail, LoopFrame frame) {
        String stepId = tail.stepId();
        if (frame.allFailed()) {
            return fail(cursor, stepId, null, tail.failure(), tail.failureRoute(), false, KIND_LOOP,
                    "all " + frame.getCompleted() + " iterations failed", Map.of());
        }
        run.popLoop();
        StepExecution current = currentExecution(cursor.job(), stepId, 1);
        run.putStep(cursor.job(), current.succeeded(frame.toOutputs(), engine.getClock().instant()));
        run.stepFinished(stepId);
        logger.info("Step '{}' completed {} iteration(s)", stepId, frame.getCompleted());
        fire(WorkflowEvent.Type.STEP_COMPLETED, cursor.job(), stepId,
                Map.of("iterations", (long) frame.getCompleted()));
        return tail.exit();
    }

    private String visitAction(Cursor cursor, Subgraph subgraph, ActionNode node) throws WorkflowExecutionException {
        Step step = node.step();
        String stepId = step.getId();
        String job = cursor.job();
        Optional<LoopFrame> frame = iterationFrame(stepId);

        if (cancelRequested && cursor.phase() != Phase.FINALLY) {
            return cancelBefore(cursor, step, frame);
        }
        if (node.id().equals(interruptedNode)) {
            interruptedNode = null;
            run.setInFlight(null);
            if (!step.isIdempotent()) {
                logger.warn("Step '{}' of run {} was interrupted mid-dispatch and is not idempotent",
                        stepId, run.getRunId());
                return fail(cursor, stepId, step.getActionId(), node.failure(), node.failureRoute(), true,
                        ActionException.KIND_INTERRUPTED, "interrupted before its result was recorded", Map.of());
            }
            logger.info("Re-dispatching idempotent step '{}' interrupted by a crash", stepId);
        }

        GuardrailConfig guardrails;
        try {
            guardrails = GuardrailConfig.effective(definition.getGuardrails(), step);
        } catch (IllegalArgumentException e) {
            return fail(cursor, stepId, step.getActionId(), node.failure(), node.failureRoute(), true,
                    ActionException.KIND_CONFIGURATION, e.getMessage(), Map.of());
        }

        int attempt = 0;
        int retries = 0;
        int guardrailRetries = 0;
        while (true) {
            attempt++;
            Instant started = engine.getClock().instant();
            run.setInFlight(node.id());
            if (frame.isEmpty()) {
                run.putStep(job, StepExecution.running(stepId, attempt, started));
            }
            fire(WorkflowEvent.Type.STEP_STARTED, job, stepId, details("action", step.getActionId(),
                    "attempt", (long) attempt,
                    "iteration", frame.map(f -> (Object) ((long) f.getIndex() + 1)).orElse(null)));
            checkpoint();

            long startNanos = System.nanoTime();
            try {
                ActionResult result = dispatch(cursor, step, guardrails);
                run.setInFlight(null);
                engine.getMetrics().recordStepExecuted(run.getWorkflowName(), step.getActionId(),
                        (System.nanoTime() - startNanos) / 1_000_000_000.0);
                return onResult(cursor, subgraph, node, frame, result);
            } catch (GuardrailViolationException e) {
                run.setInFlight(null);
                int maxRetries = guardrails.getMaxRetries(engine.getConfiguration().getGuardrailMaxRetries());
                if (GuardrailConfig.ON_FAIL_RETRY.equals(guardrails.getOnFail()) && guardrailRetries < maxRetries) {
                    guardrailRetries++;
                    logger.warn("Guardrail '{}' rejected step '{}', retry {}/{}", e.getScanner(), stepId,
                            guardrailRetries, maxRetries);
                    fire(WorkflowEvent.Type.STEP_RETRYING, job, stepId,
                            Map.of("reason", ActionException.KIND_GUARDRAIL, "retry", (long) guardrailRetries));
                    continue;
                }
                if (guardrails.isJumpOnFail()) {
                    return guardrailJump(cursor, subgraph, step, frame, guardrails.getOnFail(), e);
                }
                return fail(cursor, stepId, step.getActionId(), node.failure(), node.failureRoute(), true,
                        e.getKind(), e.getReason(), e.getOutputs());
            } catch (ActionException e) {
                run.setInFlight(null);
                if (isRetryable(e) && retries + 1 < step.getRetry().getMaxAttempts() && !cancelRequested) {
                    retries++;
                    Duration delay = step.getRetry().delayBefore(retries + 1);
                    logger.warn("Step '{}' failed ({}), retry {}/{} in {} ms", stepId, e.getReason(), retries,
                            step.getRetry().getMaxAttempts() - 1, delay.toMillis());
                    fire(WorkflowEvent.Type.STEP_RETRYING, job, stepId,
                            Map.of("reason", e.getKind(), "retry", (long) retries));
                    if (!pause(delay)) {
                        return fail(cursor, stepId, step.getActionId(), node.failure(), node.failureRoute(), true,
                                ActionException.KIND_INTERRUPTED, "interrupted while waiting to retry", Map.of());
                    }
                    continue;
                }
                return fail(cursor, stepId, step.getActionId(), node.failure(), node.failureRoute(), true,
                        e.getKind(), e.getReason(), e.getOutputs());
            }
        }
    }

    private static boolean isRetryable(ActionException e) {
        return !ActionException.KIND_EXPRESSION.equals(e.getKind())
                && !ActionException.KIND_INTERRUPTED.equals(e.getKind());
    }

    private boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Run {} interrupted during retry delay", run.getRunId());
            return false;
        }
    }

    // Dispatch

    private ActionResult dispatch(Cursor cursor, Step step, GuardrailConfig guardrails) throws ActionException {
        String actionId = step.getActionId();
        WorkflowAction action = engine.getActionRegistry().getAction(actionId)
                .orElseThrow(() -> new ActionException(actionId, ActionException.KIND_CONFIGURATION,
                        "Unknown action '" + actionId + "'"));
        RunEvaluationContext context = evaluationContext(cursor.job());

        Map<String, Object> with;
        Object command = null;
        try {
            with = engine.getEvaluator().resolveMap(step.getWith(), context);
            if (step.getRun() != null) {
                command = step.isShellForm()
                        ? engine.getEvaluator().renderShellCommand((String) step.getRun(), context,
                                definition.getShellSafety() == WorkflowDefinition.ShellSafety.AUTO_QUOTE)
                        : engine.getEvaluator().resolve(step.getRun(), context);
            }
        } catch (ExpressionException e) {
            throw new ActionException(actionId, ActionException.KIND_EXPRESSION, e.getMessage(), e);
        }

        if (!guardrails.getScanners(GuardrailPhase.INPUT).isEmpty()) {
            if (command != null) {
                command = scanCommand(cursor, step, guardrails, command);
            } else {
                with = applyGuardrails(cursor, step, guardrails,
                        engine.getGuardrailPipeline().scan(guardrails, GuardrailPhase.INPUT, with));
            }
        }

        Duration timeout = step.getTimeout() != null ? step.getTimeout() : definition.getDefaultTimeout();
        ActionRequest.Builder request = ActionRequest.builder()
                .actionId(actionId)
                .runId(run.getRunId())
                .stepId(step.getId())
                .with(with)
                .command(command)
                .timeout(timeout)
                .captureMode(step.getCaptureMode())
                .interactive(step.isInteractive())
                .workingDirectory(engine.getConfiguration().getWorkspace())
                .context(new StepActionContext(run, cursor.job(), actionId, context, engine.getEvaluator(),
                        engine.getSecretProvider(), () -> cancelRequested))
                .suspensionExpired(isSuspensionExpired(cursor, step));
        if (run.hasAnswer(step.getId())) {
            request.answer(run.takeAnswer(step.getId()));
        }

        ActionResult result = action.isInline()
                ? invokeInline(action, request.build())
                : invokeWithTimeout(action, request.build(), timeout);

        if (!result.isSuspended() && !guardrails.getScanners(GuardrailPhase.OUTPUT).isEmpty()) {
            result = result.withOutputs(applyGuardrails(cursor, step, guardrails,
                    engine.getGuardrailPipeline().scan(guardrails, GuardrailPhase.OUTPUT, result.getOutputs())));
        }
        return result;
    }

    private Object scanCommand(Cursor cursor, Step step, GuardrailConfig guardrails, Object command)
            throws ActionException {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (command instanceof List) {
            List<?> tokens = (List<?>) command;
            for (int i = 0; i < tokens.size(); i++) {
                payload.put("run[" + i + "]", tokens.get(i));
            }
        } else {
            payload.put("run", command);
        }
        Map<String, Object> scanned = applyGuardrails(cursor, step, guardrails,
                engine.getGuardrailPipeline().scan(guardrails, GuardrailPhase.INPUT, payload));
        if (command instanceof List) {
            List<Object> tokens = new ArrayList<>();
            for (int i = 0; i < scanned.size(); i++) {
                tokens.add(scanned.get("run[" + i + "]"));
            }
            return tokens;
        }
        return scanned.get("run");
    }

    private Map<String, Object> applyGuardrails(Cursor cursor, Step step, GuardrailConfig guardrails,
                                                GuardrailOutcome outcome) throws GuardrailViolationException {
        if (outcome.isPassed()) {
            return outcome.getValues();
        }
        String phase = outcome.getPhase().toYamlValue();
        for (GuardrailOutcome.Violation violation : outcome.getViolations()) {
            engine.getMetrics().recordGuardrailViolation(run.getWorkflowName(), violation.scanner(), phase);
            fire(WorkflowEvent.Type.GUARDRAIL_VIOLATION, cursor.job(), step.getId(), details(
                    "scanner", violation.scanner(), "phase", phase, "severity", violation.severity().name(),
                    "message", violation.message()));
        }
        if (GuardrailConfig.ON_FAIL_CONTINUE.equals(guardrails.getOnFail())) {
            logger.warn("Guardrail violations on {} of step '{}' ignored (on_fail: continue): {}", phase,
                    step.getId(), outcome.getViolations().size());
            return outcome.getValues();
        }
        throw outcome.toException();
    }

    private boolean isSuspensionExpired(Cursor cursor, Step step) {
        SuspensionState suspension = pendingSuspension;
        if (suspension == null || !suspension.stepId().equals(step.getId())
                || !suspension.job().equals(cursor.job())) {
            return false;
        }
        pendingSuspension = null;
        return suspension.isExpired(engine.getClock().instant());
    }

    private ActionResult invokeInline(WorkflowAction action, ActionRequest request) throws ActionException {
        try {
            return action.execute(request);
        } catch (RuntimeException e) {
            throw new ActionException(action.getActionId(), ActionException.KIND_INTERNAL,
                    "Unexpected error: " + e.getMessage(), e);
        }
    }

    private ActionResult invokeWithTimeout(WorkflowAction action, ActionRequest request, Duration timeout)
            throws ActionException {
        Future<ActionResult> future;
        try {
            future = engine.getActionExecutor().submit(() -> action.execute(request));
        } catch (RejectedExecutionException e) {
            throw new ActionException(action.getActionId(), ActionException.KIND_INTERRUPTED,
                    "Engine is shutting down", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ActionTimeoutException(action.getActionId(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ActionException) {
                throw (ActionException) cause;
            }
            throw new ActionException(action.getActionId(), ActionException.KIND_INTERNAL,
                    "Unexpected error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ActionException(action.getActionId(), ActionException.KIND_INTERRUPTED,
                    "Interrupted while waiting for the action", e);
        }
    }

    // Results

    private String onResult(Cursor cursor, Subgraph subgraph, ActionNode node, Optional<LoopFrame> frame,
                            ActionResult result) throws WorkflowExecutionException {
        Step step = node.step();
        String job = cursor.job();
        result.getVariableUpdates().forEach(run::setVariable);
        Map<String, Object> outputs = Values.normalizeMap(result.getOutputs());

        if (result.hasControlSignal()) {
            return onControlSignal(cursor, subgraph, node, frame, result.getControlSignal(), outputs);
        }
        if (result.isSuspended()) {
            suspend(cursor, step, frame, result.getSuspension());
            return null;
        }
        if (frame.isPresent()) {
            frame.get().recordSuccess(outputs);
            return node.next();
        }
        StepExecution current = currentExecution(job, step.getId(), 1);
        run.putStep(job, current.succeeded(outputs, engine.getClock().instant()));
        run.stepFinished(step.getId());
        logger.info("Step '{}' completed", step.getId());
        fire(WorkflowEvent.Type.STEP_COMPLETED, job, step.getId(), Map.of("action", step.getActionId()));
        return node.next();
    }

    private String onControlSignal(Cursor cursor, Subgraph subgraph, ActionNode node, Optional<LoopFrame> frame,
                                   ControlSignal signal, Map<String, Object> outputs)
            throws WorkflowExecutionException {
        Step step = node.step();
        String job = cursor.job();
        Map<String, Object> signalOutputs = new LinkedHashMap<>(outputs);
        signalOutputs.putAll(Values.normalizeMap(signal.getOutputs()));
        Instant now = engine.getClock().instant();

        if (signal.isLoopControl()) {
            return onLoopControl(cursor, node, frame, signal, signalOutputs);
        }
        if (signal.getType() == ControlSignal.Type.FAIL) {
            String kind = signal.getErrorCode() != null ? signal.getErrorCode() : KIND_FAILED;
            String message = signal.getMessage() != null ? signal.getMessage()
                    : "workflow failed at step '" + step.getId() + "'";
            Map<String, Object> stepOutputs = signalOutputs;
            if (frame.isPresent()) {
                frame.get().recordFailure(kind, message, signalOutputs);
                run.popLoop();
                stepOutputs = frame.get().toOutputs();
            }
            recordFailed(job, step.getId(), kind, message, stepOutputs, now);
            run.terminate(RunContext.Termination.FAILED, message);
            run.setErrorContext(message, kind, step.getId(), job, null);
            engine.getMetrics().recordStepFailed(run.getWorkflowName(), step.getActionId(), kind);
            logger.error("Step '{}' failed the run: {}", step.getId(), message);
            fire(WorkflowEvent.Type.STEP_FAILED, job, step.getId(), details("kind", kind, "message", message));
            if (cursor.phase() == Phase.MAIN) {
                return GraphNode.END;
            }
            return frame.isPresent() ? loopExit(subgraph, step.getId()) : node.next();
        }

        Map<String, Object> stepOutputs = signalOutputs;
        if (frame.isPresent()) {
            frame.get().recordSuccess(signalOutputs);
            run.popLoop();
            stepOutputs = frame.get().toOutputs();
        }
        StepExecution current = currentExecution(job, step.getId(), 1);
        run.putStep(job, current.succeeded(stepOutputs, now));
        run.stepFinished(step.getId());
        String message = signal.getMessage() != null ? signal.getMessage()
                : "exited at step '" + step.getId() + "' with status " + signal.getStatus();
        if (run.terminate(RunContext.Termination.EXITED, message)) {
            run.setExit(signal.getStatus(), signal.getOutputs());
            logger.info("Run {} exiting at step '{}': {}", run.getRunId(), step.getId(), message);
        } else {
            logger.info("Step '{}' ended the {} list of {}", step.getId(), cursor.phase().getKey(), job);
        }
        fire(WorkflowEvent.Type.STEP_COMPLETED, job, step.getId(),
                details("action", step.getActionId(), "exit_status", signal.getStatus()));
        return GraphNode.END;
    }

    /**
     * Break and continue act on the loop of the step that issued them. Outside a
     * loop the step simply succeeds.
     */
    private String onLoopControl(Cursor cursor, ActionNode node, Optional<LoopFrame> frame, ControlSignal signal,
                                 Map<String, Object> outputs) {
        Step step = node.step();
        if (frame.isEmpty()) {
            logger.warn("Step '{}' used {} outside a loop", step.getId(), step.getActionId());
            StepExecution current = currentExecution(cursor.job(), step.getId(), 1);
            run.putStep(cursor.job(), current.succeeded(outputs, engine.getClock().instant()));
            run.stepFinished(step.getId());
            fire(WorkflowEvent.Type.STEP_COMPLETED, cursor.job(), step.getId(), Map.of("action", step.getActionId()));
            return node.next();
        }
        LoopFrame loop = frame.get();
        if (signal.getType() == ControlSignal.Type.CONTINUE) {
            logger.debug("Step '{}' iteration {} skipped: {}", step.getId(), loop.getIndex() + 1,
                    signal.getMessage());
            loop.recordSkip();
        } else {
            loop.recordSuccess(outputs);
            loop.requestBreak();
            logger.info("Step '{}' loop stopped by {} at iteration {}", step.getId(), step.getActionId(),
                    loop.getIndex() + 1);
        }
        return node.next();
    }

    private void suspend(Cursor cursor, Step step, Optional<LoopFrame> frame, SuspensionRequest request)
            throws WorkflowExecutionException {
        Instant now = engine.getClock().instant();
        Instant expiresAt = request.getTimeout() != null ? now.plus(request.getTimeout()) : null;
        run.setSuspension(new SuspensionState(cursor.job(), cursor.phase(), step.getId(), request.getPrompt(),
                request.getInputType(), request.getChoices(), now, expiresAt));
        if (frame.isEmpty()) {
            run.putStep(cursor.job(), currentExecution(cursor.job(), step.getId(), 1).suspended());
        }
        run.setStatus(WorkflowStatus.SUSPENDED);
        run.setInFlight(null);
        checkpoint();
        engine.getMetrics().recordRunSuspended(run.getWorkflowName());
        logger.info("Run {} suspended at step '{}' waiting for input", run.getRunId(), step.getId());
        fire(WorkflowEvent.Type.RUN_SUSPENDED, cursor.job(), step.getId(), details("prompt", request.getPrompt(),
                "expires_at", expiresAt != null ? expiresAt.toString() : null));
    }

    // Failures

    /**
     * Records a node failure and returns the node to continue with, following the
     * node's failure route.
     *
     * @param iteration whether the failure belongs to the current loop iteration
     */
    private String fail(Cursor cursor, String stepId, String actionId, String failure, FailureRoute route,
                        boolean iteration, String kind, String message, Map<String, Object> outputs) {
        String job = cursor.job();
        Instant now = engine.getClock().instant();
        Optional<LoopFrame> frame = iterationFrame(stepId);
        if (actionId != null) {
            engine.getMetrics().recordStepFailed(run.getWorkflowName(), actionId, kind);
        }

        if (route == FailureRoute.LOOP_CONTINUE && frame.isPresent()) {
            frame.get().recordFailure(kind, message, outputs);
            logger.warn("Step '{}' iteration {} failed ({}): {}", stepId, frame.get().getIndex() + 1, kind, message);
            fire(WorkflowEvent.Type.STEP_FAILED, job, stepId, details("kind", kind, "message", message,
                    "iteration", (long) frame.get().getIndex() + 1));
            return failure;
        }

        Map<String, Object> stepOutputs = outputs;
        if (frame.isPresent()) {
            if (iteration) {
                frame.get().recordFailure(kind, message, outputs);
            }
            run.popLoop();
            stepOutputs = frame.get().toOutputs();
        }
        recordFailed(job, stepId, kind, message, stepOutputs, now);
        fire(WorkflowEvent.Type.STEP_FAILED, job, stepId, details("kind", kind, "message", message));
        String description = "step '" + stepId + "' failed (" + kind + "): " + message;

        switch (route) {
            case JUMP: {
                String handler = handlerStep(cursor, failure);
                logger.warn("Step '{}' failed ({}): {}, continuing at '{}'", stepId, kind, message, handler);
                run.setErrorContext(message, kind, stepId, job, handler);
                return failure;
            }
            case HOOK_CONTINUE:
                logger.error("Hook {}", description);
                run.terminate(RunContext.Termination.FAILED, description);
                if (run.getErrorContext().isEmpty()) {
                    run.setErrorContext(message, kind, stepId, job, null);
                }
                return failure;
            default:
                logger.error("Job '{}' aborted: {}", job, description);
                run.terminate(RunContext.Termination.FAILED, description);
                run.setErrorContext(message, kind, stepId, job, null);
                return GraphNode.END;
        }
    }

    private String guardrailJump(Cursor cursor, Subgraph subgraph, Step step, Optional<LoopFrame> frame,
                                 String target, GuardrailViolationException e) {
        String job = cursor.job();
        Map<String, Object> outputs = e.getOutputs();
        if (frame.isPresent()) {
            frame.get().recordFailure(e.getKind(), e.getReason(), outputs);
            run.popLoop();
            outputs = frame.get().toOutputs();
        }
        recordFailed(job, step.getId(), e.getKind(), e.getReason(), outputs, engine.getClock().instant());
        engine.getMetrics().recordStepFailed(run.getWorkflowName(), step.getActionId(), e.getKind());
        logger.warn("Guardrail '{}' rejected step '{}', continuing at '{}'", e.getScanner(), step.getId(), target);
        fire(WorkflowEvent.Type.STEP_FAILED, job, step.getId(), details("kind", e.getKind(), "message", e.getReason()));
        run.setErrorContext(e.getReason(), e.getKind(), step.getId(), job, target);
        return subgraph.entryOf(target);
    }

    private String cancelBefore(Cursor cursor, Step step, Optional<LoopFrame> frame) {
        String message = "cancelled before step '" + step.getId() + "'";
        run.terminate(RunContext.Termination.CANCELLED, "Run " + message);
        if (frame.isPresent()) {
            run.popLoop();
            recordFailed(cursor.job(), step.getId(), KIND_CANCELLED, message, frame.get().toOutputs(),
                    engine.getClock().instant());
        } else if (run.getStep(cursor.job(), step.getId())
                .filter(execution -> execution.getOutcome() == StepOutcome.SUSPENDED).isPresent()) {
            recordFailed(cursor.job(), step.getId(), KIND_CANCELLED, "cancelled while waiting for input", Map.of(),
                    engine.getClock().instant());
        }
        logger.info("Run {} {}", run.getRunId(), message);
        return GraphNode.END;
    }

    private void recordFailed(String job, String stepId, String kind, String message, Map<String, Object> outputs,
                              Instant now) {
        StepExecution current = currentExecution(job, stepId, 1);
        run.stepFinished(stepId);
        run.putStep(job, current.failed(kind, message, Values.normalizeMap(outputs), now));
    }

    private String handlerStep(Cursor cursor, String failureNode) {
        Subgraph subgraph = compiled.getSubgraph(cursor.job(), cursor.phase());
        GraphNode jump = subgraph.getNode(failureNode);
        return subgraph.getNode(jump.getNext()).getStepId();
    }

    private String loopExit(Subgraph subgraph, String stepId) {
        return ((LoopTailNode) subgraph.getNode(stepId + GraphCompiler.TAIL_SUFFIX)).exit();
    }

    // Helpers

    private Optional<LoopFrame> iterationFrame(String stepId) {
        return run.currentLoop().filter(frame -> frame.getStepId().equals(stepId));
    }

    private StepExecution currentExecution(String job, String stepId, int attempt) {
        return run.getStep(job, stepId)
                .filter(execution -> execution.getOutcome() == StepOutcome.RUNNING
                        || execution.getOutcome() == StepOutcome.SUSPENDED)
                .orElseGet(() -> StepExecution.running(stepId, attempt, engine.getClock().instant()));
    }

    private RunEvaluationContext evaluationContext(String job) {
        return new RunEvaluationContext(run, job, env, secrets, engine.getClock());
    }

    private void checkpoint() throws WorkflowExecutionException {
        Checkpoint checkpoint = new Checkpoint(run.getRunId(), sequence++, engine.getClock().instant(),
                run.getStatus().name(), run.getWorkflowName(), run.getFingerprint(), run.toState());
        try {
            engine.getCheckpointStore().append(checkpoint);
        } catch (CheckpointException e) {
            throw new WorkflowExecutionException(run.getRunId(),
                    "Failed to write checkpoint " + checkpoint.sequence() + ": " + e.getMessage(), e);
        }
        logger.trace("Checkpoint {} of run {} at {}", checkpoint.sequence(), run.getRunId(), run.getCursor());
        fire(WorkflowEvent.Type.CHECKPOINT_WRITTEN, null, null, Map.of("sequence", checkpoint.sequence()));
    }

    private void fire(WorkflowEvent.Type type, String job, String stepId, Map<String, Object> details) {
        engine.publish(new WorkflowEvent(type, run.getRunId(), run.getWorkflowName(), job, stepId,
                engine.getClock().instant(), details));
    }

    /**
     * Builds event details from key/value pairs, dropping null values.
     */
    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return details;
    }
}
