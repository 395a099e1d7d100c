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

/**
 * Enumeration of workflow run statuses.
 */
public enum WorkflowStatus {

    /**
     * Run is created but has not started walking its graph.
     */
    PENDING,

    /**
     * Run is currently executing.
     */
    RUNNING,

    /**
     * Run is waiting for externally supplied input. No thread is held.
     */
    SUSPENDED,

    /**
     * Run has completed successfully.
     */
    SUCCEEDED,

    /**
     * Run has failed.
     */
    FAILED,

    /**
     * Run was terminated early by {@code control/exit}.
     */
    EXITED,

    /**
     * Run was cancelled.
     */
    CANCELLED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == EXITED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING || this == SUSPENDED;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == SUCCEEDED;
    }
}
