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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of a checkpoint. Integral numbers decode as {@code Long} so a state
 * read back compares equal to the state written.
 */
public final class CheckpointCodec {

    private final ObjectMapper mapper;

    public CheckpointCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Checkpoint checkpoint) throws CheckpointException {
        try {
            return mapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new CheckpointException(checkpoint.runId(), "Cannot encode checkpoint: " + e.getOriginalMessage(), e);
        }
    }

    public Checkpoint decode(String json) throws JsonProcessingException {
        return mapper.readValue(json, Checkpoint.class);
    }
}
