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

import dev.mars.stepflow.core.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Checkpoint store held in memory. Used by tests and by embedders that do not need
 * runs to survive the process.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, List<Checkpoint>> streams = new ConcurrentHashMap<>();
    private final Set<String> archived = ConcurrentHashMap.newKeySet();

    @Override
    public void append(Checkpoint checkpoint) {
        Checkpoint copy = new Checkpoint(checkpoint.runId(), checkpoint.sequence(), checkpoint.createdAt(),
                checkpoint.status(), checkpoint.workflowName(), checkpoint.fingerprint(),
                Values.normalizeMap(checkpoint.state()));
        streams.computeIfAbsent(checkpoint.runId(), id -> new ArrayList<>());
        synchronized (streams.get(checkpoint.runId())) {
            streams.get(checkpoint.runId()).add(copy);
        }
        archived.remove(checkpoint.runId());
    }

    @Override
    public Optional<Checkpoint> latest(String runId) {
        List<Checkpoint> stream = streams.get(runId);
        if (stream == null) {
            return Optional.empty();
        }
        synchronized (stream) {
            return stream.isEmpty() ? Optional.empty() : Optional.of(stream.get(stream.size() - 1));
        }
    }

    @Override
    public List<Checkpoint> history(String runId) {
        List<Checkpoint> stream = streams.get(runId);
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            return List.copyOf(stream);
        }
    }

    @Override
    public void archive(String runId) {
        if (streams.containsKey(runId)) {
            archived.add(runId);
        }
    }

    @Override
    public List<String> listRuns() {
        return streams.keySet().stream()
                .filter(runId -> !archived.contains(runId))
                .sorted()
                .collect(Collectors.toList());
    }
}
