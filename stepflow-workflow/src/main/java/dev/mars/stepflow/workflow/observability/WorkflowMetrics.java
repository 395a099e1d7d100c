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

package dev.mars.stepflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Stepflow execution engine.
 *
 * Provides the following metrics:
 * - stepflow.runs.active (gauge) - Runs currently walking their graph
 * - stepflow.runs.started (counter) - Runs started
 * - stepflow.runs.resumed (counter) - Suspended or interrupted runs picked up again
 * - stepflow.runs.completed (counter) - Runs that reached a terminal state, by status
 * - stepflow.runs.failed (counter) - Runs that ended failed
 * - stepflow.runs.suspended (counter) - Suspensions waiting for input
 * - stepflow.steps.executed (counter) - Action dispatches
 * - stepflow.steps.failed (counter) - Failed dispatches, by error kind
 * - stepflow.guardrails.violations (counter) - Guardrail violations, by scanner
 * - stepflow.run.duration.seconds (histogram) - Run duration distribution
 * - stepflow.step.duration.seconds (histogram) - Step duration distribution
 *
 * Without an OpenTelemetry SDK on the classpath every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "stepflow-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter runsStarted;
    private final LongCounter runsResumed;
    private final LongCounter runsCompleted;
    private final LongCounter runsFailed;
    private final LongCounter runsSuspended;
    private final LongCounter stepsExecuted;
    private final LongCounter stepsFailed;
    private final LongCounter guardrailViolations;

    // Histograms
    private final DoubleHistogram runDuration;
    private final DoubleHistogram stepDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeRuns = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> RUN_STATUS_KEY = AttributeKey.stringKey("run.status");
    private static final AttributeKey<String> ACTION_KEY = AttributeKey.stringKey("step.action");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");
    private static final AttributeKey<String> SCANNER_KEY = AttributeKey.stringKey("guardrail.scanner");
    private static final AttributeKey<String> PHASE_KEY = AttributeKey.stringKey("guardrail.phase");

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        runsStarted = meter.counterBuilder("stepflow.runs.started")
                .setDescription("Number of runs started")
                .setUnit("1")
                .build();

        runsResumed = meter.counterBuilder("stepflow.runs.resumed")
                .setDescription("Number of runs resumed from a checkpoint")
                .setUnit("1")
                .build();

        runsCompleted = meter.counterBuilder("stepflow.runs.completed")
                .setDescription("Number of runs that reached a terminal state")
                .setUnit("1")
                .build();

        runsFailed = meter.counterBuilder("stepflow.runs.failed")
                .setDescription("Number of failed runs")
                .setUnit("1")
                .build();

        runsSuspended = meter.counterBuilder("stepflow.runs.suspended")
                .setDescription("Number of suspensions waiting for external input")
                .setUnit("1")
                .build();

        stepsExecuted = meter.counterBuilder("stepflow.steps.executed")
                .setDescription("Number of action dispatches")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("stepflow.steps.failed")
                .setDescription("Number of failed action dispatches")
                .setUnit("1")
                .build();

        guardrailViolations = meter.counterBuilder("stepflow.guardrails.violations")
                .setDescription("Number of guardrail violations")
                .setUnit("1")
                .build();

        runDuration = meter.histogramBuilder("stepflow.run.duration.seconds")
                .setDescription("Run duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("stepflow.step.duration.seconds")
                .setDescription("Step duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("stepflow.runs.active")
                .setDescription("Number of runs currently executing")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Get the shared instance bound to {@link GlobalOpenTelemetry}.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.get());
        }
        return instance;
    }

    /**
     * Record a new run.
     */
    public void recordRunStarted(String workflowName) {
        runsStarted.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeRuns.incrementAndGet();
    }

    /**
     * Record a run picked up again from its checkpoint.
     */
    public void recordRunResumed(String workflowName) {
        runsResumed.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeRuns.incrementAndGet();
    }

    /**
     * Record a run suspended waiting for input. The run stops counting as active.
     */
    public void recordRunSuspended(String workflowName) {
        activeRuns.decrementAndGet();
        runsSuspended.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
    }

    /**
     * Record a run that reached a terminal state.
     */
    public void recordRunFinished(String workflowName, String status, double durationSeconds) {
        activeRuns.decrementAndGet();
        recordCompletion(workflowName, status, durationSeconds);
    }

    /**
     * Record a suspended run finished without being resumed, as when it is cancelled.
     * It was no longer counted as active.
     */
    public void recordSuspendedRunFinished(String workflowName, String status, double durationSeconds) {
        recordCompletion(workflowName, status, durationSeconds);
    }

    private void recordCompletion(String workflowName, String status, double durationSeconds) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(RUN_STATUS_KEY, status)
                .build();

        runsCompleted.add(1, attrs);
        runDuration.record(durationSeconds, attrs);
        if ("FAILED".equals(status)) {
            runsFailed.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        }
    }

    /**
     * Record one action dispatch.
     */
    public void recordStepExecuted(String workflowName, String actionId, double durationSeconds) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(ACTION_KEY, actionId)
                .build();

        stepsExecuted.add(1, attrs);
        stepDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a failed action dispatch.
     */
    public void recordStepFailed(String workflowName, String actionId, String errorKind) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(ACTION_KEY, actionId)
                .put(ERROR_KIND_KEY, errorKind != null ? errorKind : "unknown")
                .build();

        stepsFailed.add(1, attrs);
    }

    public void recordGuardrailViolation(String workflowName, String scanner, String phase) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(SCANNER_KEY, scanner)
                .put(PHASE_KEY, phase)
                .build();

        guardrailViolations.add(1, attrs);
    }

    /**
     * Get the current number of active runs.
     */
    public long getActiveRuns() {
        return activeRuns.get();
    }
}
