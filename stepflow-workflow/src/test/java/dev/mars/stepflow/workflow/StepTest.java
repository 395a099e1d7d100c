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

package dev.mars.stepflow.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepTest {

    private static Step.Builder fetch() {
        return Step.builder("fetch")
                .uses("http/request")
                .with(Map.of("url", "https://example.com"))
                .loop(List.of("a", "b"))
                .timeout(Duration.ofSeconds(30))
                .retry(new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10)));
    }

    @Test
    void testStepsWithSameContentAreEqual() {
        Step first = fetch().build();
        Step second = fetch().build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void testStepsDifferingInOneFieldAreNotEqual() {
        Step base = fetch().build();

        assertNotEquals(base, fetch().maxIterations(5).build());
        assertNotEquals(base, fetch().with(Map.of("url", "https://example.org")).build());
        assertNotEquals(base, fetch().retry(RetryPolicy.NONE).build());
        assertNotEquals(base, fetch().idempotent(false).build());
    }

    @Test
    void testLoopLimitIsUnsetByDefault() {
        assertEquals(0, fetch().build().getMaxIterations());
        assertEquals(5, fetch().maxIterations(5).build().getMaxIterations());
    }
}
