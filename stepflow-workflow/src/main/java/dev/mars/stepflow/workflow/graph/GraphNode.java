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
 * A node of a compiled step graph. Node ids are derived from step ids so two
 * compilations of the same job produce identical graphs.
 */
public interface GraphNode {

    /**
     * Marks the end of a subgraph when used as a successor id.
     */
    String END = "__end__";

    String getId();

    /**
     * Id of the step this node was lowered from.
     */
    String getStepId();

    NodeType getType();

    /**
     * Successor when the node completes normally.
     */
    String getNext();

    enum NodeType {
        ACTION, BRANCH, LOOP_HEAD, LOOP_TAIL, JUMP
    }
}
