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

package dev.mars.stepflow.workflow.guardrail;

import dev.mars.stepflow.core.exceptions.ActionException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GuardrailPipeline chaining and violation collection.
 */
class GuardrailPipelineTest {

    private final GuardrailPipeline pipeline = new GuardrailPipeline(ScannerRegistry.withBuiltins());

    private static GuardrailConfig config(GuardrailPhase phase, Map<String, Object> scanners) {
        return GuardrailConfig.fromMap(Map.of(phase.toYamlValue(), scanners));
    }

    @Test
    void testRewritingScannersFeedTheNextScanner() throws ActionException {
        Map<String, Object> scanners = new LinkedHashMap<>();
        scanners.put("invisible_text", null);
        scanners.put("ban_substrings", Map.of("substrings", List.of("drop table")));

        GuardrailOutcome outcome = pipeline.scan(config(GuardrailPhase.INPUT, scanners), GuardrailPhase.INPUT,
                Map.of("query", "DROP\u200B TABLE users"));

        assertFalse(outcome.isPassed());
        assertEquals("DROP TABLE users", outcome.getValues().get("query"));
        assertEquals("ban_substrings", outcome.getViolations().get(0).scanner());
    }

    @Test
    void testRedactionPassesWithRewrittenValue() throws ActionException {
        GuardrailOutcome outcome = pipeline.scan(
                config(GuardrailPhase.OUTPUT, Map.of("pii", Map.of("redact", true, "types", List.of("email")))),
                GuardrailPhase.OUTPUT, Map.of("stdout", "contact ada@example.com today", "exit_code", 0L));

        assertTrue(outcome.isPassed());
        assertEquals("contact [REDACTED] today", outcome.getValues().get("stdout"));
        assertEquals(0L, outcome.getValues().get("exit_code"));
    }

    @Test
    void testMostSevereViolationBecomesTheException() throws ActionException {
        Map<String, Object> scanners = new LinkedHashMap<>();
        scanners.put("token_limit", Map.of("limit", 2L));
        scanners.put("secrets", null);

        GuardrailOutcome outcome = pipeline.scan(config(GuardrailPhase.OUTPUT, scanners), GuardrailPhase.OUTPUT,
                Map.of("stdout", "here it is password=hunter2hunter2"));

        assertThat(outcome.getViolations()).hasSize(2);
        GuardrailViolationException exception = outcome.toException();
        assertEquals("secrets", exception.getScanner());
        assertEquals(Severity.CRITICAL, exception.getSeverity());
        assertEquals(GuardrailPhase.OUTPUT, exception.getPhase());
        assertThat(exception.getMessage()).contains("'stdout'");
    }

    @Test
    void testUnknownScannerIsConfigurationError() {
        ActionException e = assertThrows(ActionException.class, () -> pipeline.scan(
                config(GuardrailPhase.INPUT, Map.of("nosuch", Map.of())), GuardrailPhase.INPUT, Map.of("a", "b")));

        assertEquals(ActionException.KIND_CONFIGURATION, e.getKind());
    }

    @Test
    void testInvalidParametersAreConfigurationErrors() {
        ActionException e = assertThrows(ActionException.class, () -> pipeline.scan(
                config(GuardrailPhase.INPUT, Map.of("regex", Map.of("patterns", List.of("(")))),
                GuardrailPhase.INPUT, Map.of("a", "b")));

        assertEquals(ActionException.KIND_CONFIGURATION, e.getKind());
    }

    @Test
    void testEmptyPhasePassesEverything() throws ActionException {
        GuardrailOutcome outcome = pipeline.scan(config(GuardrailPhase.INPUT, Map.of("pii", Map.of())),
                GuardrailPhase.OUTPUT, Map.of("stdout", "ada@example.com"));

        assertTrue(outcome.isPassed());
        assertThrows(IllegalStateException.class, outcome::toException);
    }
}
