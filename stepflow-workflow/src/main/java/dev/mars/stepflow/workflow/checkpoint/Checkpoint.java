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

package dev.mars.stepflow.workflow.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One persisted snapshot of a run.
 *
 * @param sequence position in the run's checkpoint stream, starting at 1
 * @param status run status when the snapshot was taken
 * @param state the run context as plain values
 */
public record Checkpoint(@JsonProperty("run_id") String runId,
                         @JsonProperty("sequence") long sequence,
                         @JsonProperty("created_at") Instant createdAt,
                         @JsonProperty("status") String status,
                         @JsonProperty("workflow_name") String workflowName,
                         @JsonProperty("fingerprint") String fingerprint,
                         @JsonProperty("state") Map<String, Object> state) {

    public Checkpoint {
        Objects.requireNonNull(runId, "Run ID cannot be null");
        Objects.requireNonNull(createdAt, "Created time cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(state, "State cannot be null");
    }
}
