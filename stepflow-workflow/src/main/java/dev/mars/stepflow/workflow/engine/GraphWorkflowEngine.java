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
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.secrets.EnvironmentSecretProvider;
import dev.mars.stepflow.secrets.SecretProvider;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.checkpoint.Checkpoint;
import dev.mars.stepflow.workflow.checkpoint.CheckpointException;
import dev.mars.stepflow.workflow.checkpoint.CheckpointStore;
import dev.mars.stepflow.workflow.checkpoint.InMemoryCheckpointStore;
import dev.mars.stepflow.workflow.expression.ExpressionEvaluator;
import dev.mars.stepflow.workflow.graph.CompiledWorkflow;
import dev.mars.stepflow.workflow.graph.GraphCompiler;
import dev.mars.stepflow.workflow.guardrail.GuardrailPipeline;
import dev.mars.stepflow.workflow.guardrail.ScannerRegistry;
import dev.mars.stepflow.workflow.observability.WorkflowMetrics;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Workflow engine that compiles each definition into step graphs and walks them
 * with a checkpoint after every node. Runs execute on the engine's run executor;
 * actions that perform I/O execute on a separate executor so step timeouts can
 * be enforced.
 *
 * <p>Independent runs execute concurrently and share nothing but the registries,
 * the evaluator and the checkpoint store.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GraphWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(GraphWorkflowEngine.class);

    private final StepflowConfiguration configuration;
    private final ActionRegistry actionRegistry;
    private final GuardrailPipeline guardrailPipeline;
    private final CheckpointStore checkpointStore;
    private final SecretProvider secretProvider;
    private final ExpressionEvaluator evaluator;
    private final GraphCompiler compiler;
    private final InputResolver inputResolver;
    private final Clock clock;
    private final WorkflowMetrics metrics;
    private final List<WorkflowEventListener> listeners;
    private final ExecutorService runExecutor;
    private final ExecutorService actionExecutor;
    private final Map<String, RunExecutor> activeRuns = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public GraphWorkflowEngine(ActionRegistry actionRegistry) {
        this(builder().actionRegistry(actionRegistry));
    }

    private GraphWorkflowEngine(Builder builder) {
        this.configuration = builder.configuration != null ? builder.configuration : new StepflowConfiguration();
        this.actionRegistry = builder.actionRegistry != null ? builder.actionRegistry
                : ActionRegistry.withBuiltins(configuration, null, null);
        this.guardrailPipeline = builder.guardrailPipeline != null ? builder.guardrailPipeline
                : new GuardrailPipeline(ScannerRegistry.withBuiltins());
        this.checkpointStore = builder.checkpointStore != null ? builder.checkpointStore
                : new InMemoryCheckpointStore();
        this.secretProvider = builder.secretProvider != null ? builder.secretProvider
                : new EnvironmentSecretProvider("STEPFLOW_SECRET_");
        this.evaluator = builder.evaluator != null ? builder.evaluator : new ExpressionEvaluator();
        this.compiler = new GraphCompiler();
        this.inputResolver = new InputResolver(configuration.getWorkspace());
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.metrics != null) {
            this.metrics = builder.metrics;
        } else {
            this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance()
                    : new WorkflowMetrics(OpenTelemetry.noop());
        }
        this.listeners = new CopyOnWriteArrayList<>(builder.listeners);
        int threads = configuration.getEngineThreads();
        this.runExecutor = threads > 0 ? Executors.newFixedThreadPool(threads) : Executors.newCachedThreadPool();
        this.actionExecutor = Executors.newCachedThreadPool();
        logger.info("GraphWorkflowEngine started with {} actions and checkpoint store {}",
                actionRegistry.getActionIds().size(), checkpointStore.getClass().getSimpleName());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletableFuture<WorkflowRun> execute(WorkflowDefinition definition, ExecutionContext context) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");
        return submit(context.getRunId(), future -> start(definition, context, future));
    }

    @Override
    public CompletableFuture<WorkflowRun> resume(WorkflowDefinition definition, String runId,
                                                 Map<String, Object> answers) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(runId, "Run ID cannot be null");
        return submit(runId, future -> restart(definition, runId, answers, false, future));
    }

    @Override
    public CompiledWorkflow dryRun(WorkflowDefinition definition) {
        CompiledWorkflow compiled = compiler.compile(definition);
        logger.info("Dry run of workflow '{}': {} job(s) compiled", definition.getName(), compiled.getJobs().size());
        return compiled;
    }

    @Override
    public WorkflowStatus getStatus(String runId) {
        RunExecutor executor = activeRuns.get(runId);
        if (executor != null) {
            return executor.getRun().getStatus();
        }
        try {
            return checkpointStore.latest(runId).map(checkpoint -> WorkflowStatus.valueOf(checkpoint.status()))
                    .orElse(null);
        } catch (CheckpointException e) {
            logger.warn("Could not read status of run {}: {}", runId, e.getMessage());
            logger.debug("Checkpoint read failure details", e);
            return null;
        }
    }

    @Override
    public boolean cancel(String runId) {
        RunExecutor executor = activeRuns.get(runId);
        if (executor != null) {
            if (executor.requestCancel()) {
                logger.info("Cancelling workflow run: {}", runId);
                return true;
            }
            return false;
        }
        return cancelSuspended(runId);
    }

    @Override
    public CompletableFuture<WorkflowRun> cancel(WorkflowDefinition definition, String runId) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(runId, "Run ID cannot be null");
        RunExecutor executor = activeRuns.get(runId);
        if (executor != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Run " + runId
                    + " is in flight; use cancel(runId)"));
        }
        return submit(runId, future -> restart(definition, runId, Map.of(), true, future));
    }

    /**
     * Writes a terminal checkpoint for a run whose latest checkpoint is suspended.
     */
    private synchronized boolean cancelSuspended(String runId) {
        try {
            Optional<Checkpoint> latest = checkpointStore.latest(runId);
            if (latest.isEmpty() || !WorkflowStatus.SUSPENDED.name().equals(latest.get().status())) {
                return false;
            }
            Checkpoint checkpoint = latest.get();
            RunContext run = RunContext.fromState(checkpoint.state(), List.of());
            Instant now = clock.instant();
            run.terminate(RunContext.Termination.CANCELLED, "Run cancelled while suspended");
            run.setSuspension(null);
            run.setStatus(WorkflowStatus.CANCELLED);
            run.setFinishedAt(now);
            checkpointStore.append(new Checkpoint(runId, checkpoint.sequence() + 1, now,
                    WorkflowStatus.CANCELLED.name(), checkpoint.workflowName(), checkpoint.fingerprint(),
                    run.toState()));
            checkpointStore.archive(runId);

            double seconds = Duration.between(run.getStartedAt(), now).toMillis() / 1000.0;
            metrics.recordSuspendedRunFinished(run.getWorkflowName(), WorkflowStatus.CANCELLED.name(), seconds);
            publish(new WorkflowEvent(WorkflowEvent.Type.RUN_FINISHED, runId, run.getWorkflowName(), null, null,
                    now, Map.of("status", WorkflowStatus.CANCELLED.name(),
                    "message", "Run cancelled while suspended")));
            logger.info("Cancelled suspended workflow run: {}", runId);
            return true;
        } catch (CheckpointException e) {
            logger.warn("Could not cancel suspended run {}: {}", runId, e.getMessage());
            logger.debug("Checkpoint failure details", e);
            return false;
        }
    }

    @Override
    public void shutdown() {
        shutdown = true;
        activeRuns.values().forEach(RunExecutor::requestCancel);
        runExecutor.shutdown();
        actionExecutor.shutdown();
        logger.info("GraphWorkflowEngine shutdown initiated");
    }

    public void addListener(WorkflowEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(WorkflowEventListener listener) {
        listeners.remove(listener);
    }

    private CompletableFuture<WorkflowRun> submit(String runId,
                                                  Consumer<CompletableFuture<WorkflowRun>> task) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        if (activeRuns.containsKey(runId)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Run " + runId + " is already active"));
        }
        CompletableFuture<WorkflowRun> future = new CompletableFuture<>();
        try {
            runExecutor.execute(() -> task.accept(future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new IllegalStateException("Workflow engine is shutdown", e));
        }
        return future;
    }

    private void start(WorkflowDefinition definition, ExecutionContext context, CompletableFuture<WorkflowRun> future) {
        String runId = context.getRunId();
        try {
            Map<String, Object> inputs = inputResolver.resolve(definition.getInputs(), context.getInputs());
            CompiledWorkflow compiled = compiler.compile(definition);
            RunContext run = new RunContext(runId, definition.getName(), definition.getFingerprint(),
                    new ArrayList<>(definition.getJobs().keySet()), inputs, clock.instant());
            run.queueAnswers(context.getAnswers());
            drive(new RunExecutor(this, compiled, run, 0L, false), future);
        } catch (InputValidationException e) {
            logger.error("Run {} rejected: {}", runId, e.getMessage());
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            logger.error("Run {} could not start: {}", runId, e.getMessage());
            logger.debug("Run start failure details", e);
            future.completeExceptionally(new WorkflowExecutionException(runId,
                    "Run could not start: " + e.getMessage(), e));
        }
    }

    private void restart(WorkflowDefinition definition, String runId, Map<String, Object> answers, boolean cancel,
                         CompletableFuture<WorkflowRun> future) {
        try {
            Optional<Checkpoint> latest = checkpointStore.latest(runId);
            if (latest.isEmpty()) {
                throw new WorkflowExecutionException(runId, "No checkpoint found for run " + runId);
            }
            Checkpoint checkpoint = latest.get();
            WorkflowStatus status = WorkflowStatus.valueOf(checkpoint.status());
            if (status.isTerminal()) {
                throw new WorkflowExecutionException(runId, "Run " + runId + " already finished with status " + status);
            }
            if (!Objects.equals(checkpoint.fingerprint(), definition.getFingerprint())) {
                throw new WorkflowExecutionException(runId, "Workflow '" + definition.getName()
                        + "' has changed since run " + runId + " was checkpointed");
            }
            CompiledWorkflow compiled = compiler.compile(definition);
            RunContext run = RunContext.fromState(checkpoint.state(), new ArrayList<>(definition.getJobs().keySet()));
            run.queueAnswers(answers);
            RunExecutor executor = new RunExecutor(this, compiled, run, checkpoint.sequence() + 1, true);
            if (cancel) {
                executor.requestCancel();
                logger.info("Cancelling run {} from checkpoint {} ({})", runId, checkpoint.sequence(), status);
            } else {
                logger.info("Resuming run {} from checkpoint {} ({})", runId, checkpoint.sequence(), status);
            }
            drive(executor, future);
        } catch (WorkflowExecutionException e) {
            logger.error("Run {} cannot be resumed: {}", runId, e.getMessage());
            future.completeExceptionally(e);
        } catch (CheckpointException e) {
            logger.error("Run {} cannot be resumed: {}", runId, e.getMessage());
            logger.debug("Checkpoint read failure details", e);
            future.completeExceptionally(new WorkflowExecutionException(runId,
                    "Cannot read checkpoints of run " + runId + ": " + e.getMessage(), e));
        } catch (RuntimeException e) {
            logger.error("Run {} cannot be resumed: {}", runId, e.getMessage());
            logger.debug("Resume failure details", e);
            future.completeExceptionally(new WorkflowExecutionException(runId,
                    "Checkpoint of run " + runId + " is not usable: " + e.getMessage(), e));
        }
    }

    private void drive(RunExecutor executor, CompletableFuture<WorkflowRun> future) {
        String runId = executor.getRun().getRunId();
        if (activeRuns.putIfAbsent(runId, executor) != null) {
            future.completeExceptionally(new IllegalStateException("Run " + runId + " is already active"));
            return;
        }
        WorkflowRun result = null;
        Throwable failure = null;
        try {
            result = executor.execute();
        } catch (WorkflowExecutionException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new WorkflowExecutionException(runId, "Engine error: " + e.getMessage(), e);
        } finally {
            activeRuns.remove(runId);
        }
        if (failure != null) {
            logger.error("Run {} aborted by engine error: {}", runId, failure.getMessage());
            logger.debug("Engine error details", failure);
            metrics.recordRunFinished(executor.getRun().getWorkflowName(), WorkflowStatus.FAILED.name(), 0.0);
            future.completeExceptionally(failure);
        } else {
            future.complete(result);
        }
    }

    void publish(WorkflowEvent event) {
        for (WorkflowEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Workflow event listener failed on {}: {}", event.getType(), e.getMessage());
                logger.debug("Listener failure details", e);
            }
        }
    }

    StepflowConfiguration getConfiguration() {
        return configuration;
    }

    ActionRegistry getActionRegistry() {
        return actionRegistry;
    }

    GuardrailPipeline getGuardrailPipeline() {
        return guardrailPipeline;
    }

    CheckpointStore getCheckpointStore() {
        return checkpointStore;
    }

    SecretProvider getSecretProvider() {
        return secretProvider;
    }

    ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    Clock getClock() {
        return clock;
    }

    WorkflowMetrics getMetrics() {
        return metrics;
    }

    ExecutorService getActionExecutor() {
        return actionExecutor;
    }

    /**
     * Builder for GraphWorkflowEngine. Every collaborator is optional.
     */
    public static class Builder {
        private StepflowConfiguration configuration;
        private ActionRegistry actionRegistry;
        private GuardrailPipeline guardrailPipeline;
        private CheckpointStore checkpointStore;
        private SecretProvider secretProvider;
        private ExpressionEvaluator evaluator;
        private Clock clock;
        private WorkflowMetrics metrics;
        private final List<WorkflowEventListener> listeners = new ArrayList<>();

        public Builder configuration(StepflowConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder actionRegistry(ActionRegistry actionRegistry) {
            this.actionRegistry = actionRegistry;
            return this;
        }

        public Builder guardrailPipeline(GuardrailPipeline guardrailPipeline) {
            this.guardrailPipeline = guardrailPipeline;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder secretProvider(SecretProvider secretProvider) {
            this.secretProvider = secretProvider;
            return this;
        }

        public Builder evaluator(ExpressionEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder listener(WorkflowEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public GraphWorkflowEngine build() {
            return new GraphWorkflowEngine(this);
        }
    }
}
