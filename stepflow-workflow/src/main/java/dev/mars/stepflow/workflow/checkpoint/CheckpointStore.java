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

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for run checkpoints. Each run owns its own stream; the
 * latest checkpoint wins on resume.
 */
public interface CheckpointStore {

    /**
     * Appends a checkpoint. When this returns the checkpoint is durable to the
     * degree the implementation promises.
     */
    void append(Checkpoint checkpoint) throws CheckpointException;

    /**
     * The most recent checkpoint of a run, looking in the archive as well.
     *
     * @throws CheckpointCorruptedException if a complete record fails verification
     */
    Optional<Checkpoint> latest(String runId) throws CheckpointException;

    /**
     * Every checkpoint of a run, oldest first.
     */
    List<Checkpoint> history(String runId) throws CheckpointException;

    /**
     * Moves a terminal run's stream out of the active set.
     */
    void archive(String runId) throws CheckpointException;

    /**
     * Runs with an active (not archived) checkpoint stream.
     */
    List<String> listRuns() throws CheckpointException;
}
