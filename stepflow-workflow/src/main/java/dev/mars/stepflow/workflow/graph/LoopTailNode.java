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

import java.util.Objects;

/**
 * Closes one iteration: checks {@code break_if} and either takes the back edge
 * ({@code again}) or leaves the loop ({@code exit}).
 */
public record LoopTailNode(String id, String stepId, String breakIf, boolean continueOnError, String again,
                           String exit, String failure, FailureRoute failureRoute) implements GraphNode {

    public LoopTailNode {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(again, "Back edge cannot be null");
        Objects.requireNonNull(exit, "Exit cannot be null");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getStepId() {
        return stepId;
    }

    @Override
    public NodeType getType() {
        return NodeType.LOOP_TAIL;
    }

    @Override
    public String getNext() {
        return exit;
    }
}
