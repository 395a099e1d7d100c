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
 * Materialises a loop's sequence once and opens its loop frame.
 *
 * @param items the {@code loop} value: an expression string or a literal list
 * @param body first node of the loop body
 * @param tail the matching {@link LoopTailNode}, entered directly for an empty sequence
 */
public record LoopHeadNode(String id, String stepId, Object items, int maxIterations, String body, String tail,
                           String failure, FailureRoute failureRoute) implements GraphNode {

    public LoopHeadNode {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(items, "Items cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
        Objects.requireNonNull(tail, "Tail cannot be null");
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
        return NodeType.LOOP_HEAD;
    }

    @Override
    public String getNext() {
        return body;
    }
}
