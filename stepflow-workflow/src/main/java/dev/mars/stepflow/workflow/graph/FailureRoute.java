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

package dev.mars.stepflow.workflow.graph;

/**
 * What happens when a node fails.
 */
public enum FailureRoute {
    /** Propagate: the job aborts to its hooks. */
    ABORT,
    /** Follow the failure edge to the step's {@code on_failure} handler. */
    JUMP,
    /** Record the failed iteration and continue with the next one. */
    LOOP_CONTINUE,
    /** Record the failure and carry on with the next hook step. */
    HOOK_CONTINUE
}
