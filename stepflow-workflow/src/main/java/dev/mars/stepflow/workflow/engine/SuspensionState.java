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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Why and where a run is suspended: the waiting step, its prompt, and when the
 * answer window closes.
 */
public record SuspensionState(String job, Phase phase, String stepId, String prompt, String inputType,
                              List<String> choices, Instant suspendedAt, Instant expiresAt) {

    public SuspensionState {
        choices = choices != null ? List.copyOf(choices) : List.of();
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("job", job);
        map.put("phase", phase.name());
        map.put("step", stepId);
        map.put("prompt", prompt);
        map.put("input_type", inputType);
        map.put("choices", new ArrayList<Object>(choices));
        map.put("suspended_at", suspendedAt.toString());
        map.put("expires_at", expiresAt != null ? expiresAt.toString() : null);
        return map;
    }

    @SuppressWarnings("unchecked")
    static SuspensionState fromMap(Map<String, Object> map) {
        Object expires = map.get("expires_at");
        return new SuspensionState((String) map.get("job"), Phase.valueOf((String) map.get("phase")),
                (String) map.get("step"), (String) map.get("prompt"), (String) map.get("input_type"),
                (List<String>) map.get("choices"), Instant.parse((String) map.get("suspended_at")),
                expires != null ? Instant.parse((String) expires) : null);
    }
}
