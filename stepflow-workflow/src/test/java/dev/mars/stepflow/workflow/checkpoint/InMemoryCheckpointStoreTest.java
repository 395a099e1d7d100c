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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    @Test
    void testStoredStateIsDetachedFromCaller() {
        Map<String, Object> state = new HashMap<>();
        state.put("count", 1);
        store.append(new Checkpoint("run-1", 1, Instant.EPOCH, "RUNNING", "demo", null, state));
        state.put("count", 2);

        assertEquals(1L, store.latest("run-1").orElseThrow().state().get("count"));
    }

    @Test
    void testHistoryAndArchive() {
        store.append(new Checkpoint("run-1", 1, Instant.EPOCH, "RUNNING", "demo", null, Map.of()));
        store.append(new Checkpoint("run-1", 2, Instant.EPOCH, "COMPLETED", "demo", null, Map.of()));
        store.append(new Checkpoint("run-2", 1, Instant.EPOCH, "RUNNING", "demo", null, Map.of()));

        store.archive("run-1");

        assertEquals(2, store.history("run-1").size());
        assertEquals("COMPLETED", store.latest("run-1").orElseThrow().status());
        assertEquals(List.of("run-2"), store.listRuns());
        assertTrue(store.latest("unknown").isEmpty());
    }
}
