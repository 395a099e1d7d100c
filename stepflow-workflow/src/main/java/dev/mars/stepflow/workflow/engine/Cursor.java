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

import dev.mars.stepflow.workflow.graph.Phase;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Position of a run in its compiled workflow: a job (or the document scope),
 * one of its step lists, and a node of that list's subgraph.
 */
public record Cursor(String job, Phase phase, String nodeId) {

    public Cursor {
        Objects.requireNonNull(job, "Job cannot be null");
        Objects.requireNonNull(phase, "Phase cannot be null");
        Objects.requireNonNull(nodeId, "Node id cannot be null");
    }

    public Cursor at(String nextNodeId) {
        return new Cursor(job, phase, nextNodeId);
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("job", job);
        map.put("phase", phase.name());
        map.put("node", nodeId);
        return map;
    }

    static Cursor fromMap(Map<String, Object> map) {
        return new Cursor((String) map.get("job"), Phase.valueOf((String) map.get("phase")), (String) map.get("node"));
    }

    @Override
    public String toString() {
        return job + "/" + phase.getKey() + "/" + nodeId;
    }
}
