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

import dev.mars.stepflow.workflow.Step;

import java.util.Objects;

/**
 * Dispatches one step to its action.
 *
 * @param failure successor when the action fails, {@code null} when the failure aborts the job
 */
public record ActionNode(String id, Step step, String next, String failure, FailureRoute failureRoute)
        implements GraphNode {

    public ActionNode {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(step, "Step cannot be null");
        Objects.requireNonNull(next, "Next cannot be null");
        Objects.requireNonNull(failureRoute, "Failure route cannot be null");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getStepId() {
        return step.getId();
    }

    @Override
    public NodeType getType() {
        return NodeType.ACTION;
    }

    @Override
    public String getNext() {
        return next;
    }
}
