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

/**
 * A complete checkpoint record failed its checksum or could not be decoded.
 */
public class CheckpointCorruptedException extends CheckpointException {

    private final long line;

    public CheckpointCorruptedException(String runId, long line, String message) {
        super(runId, "Checkpoint for run " + runId + " is corrupt at line " + line + ": " + message);
        this.line = line;
    }

    public CheckpointCorruptedException(String runId, long line, String message, Throwable cause) {
        super(runId, "Checkpoint for run " + runId + " is corrupt at line " + line + ": " + message, cause);
        this.line = line;
    }

    public long getLine() {
        return line;
    }
}
