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

import dev.mars.stepflow.workflow.Step;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GuardrailConfigTest {

    private static Map<String, Object> scanners(String phase, String... names) {
        Map<String, Object> selected = new LinkedHashMap<>();
        for (String name : names) {
            selected.put(name, null);
        }
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(phase, selected);
        return config;
    }

    @Test
    void testStepScannersAddToWorkflowDefaults() {
        Map<String, Object> defaults = scanners("output", "secrets");
        Step step = Step.builder("scan").run("echo hi").guardrails(scanners("output", "pii", "json")).build();

        GuardrailConfig effective = GuardrailConfig.effective(defaults, step);

        assertEquals(3, effective.getScannerCount());
        assertEquals(Set.of("secrets", "pii", "json"), effective.getOutputScanners().keySet());
        assertTrue(effective.getInputScanners().isEmpty());
    }

    @Test
    void testDisabledStepHasNoScanners() {
        Map<String, Object> defaults = scanners("input", "secrets");
        Step step = Step.builder("raw").run("echo hi").guardrailsDisabled(true).build();

        GuardrailConfig effective = GuardrailConfig.effective(defaults, step);

        assertEquals(0, effective.getScannerCount());
        assertTrue(effective.isEmpty());
    }

    @Test
    void testOverrideCanSwitchOffInheritedScanner() {
        Map<String, Object> override = new LinkedHashMap<>();
        override.put("output", Map.of("secrets", false));
        Step step = Step.builder("s").run("echo").guardrails(override).build();

        GuardrailConfig effective = GuardrailConfig.effective(scanners("output", "secrets", "pii"), step);

        assertEquals(Set.of("pii"), effective.getOutputScanners().keySet());
    }

    @Test
    void testNestedParametersMergeKeyByKey() {
        Map<String, Object> base = Map.of("output", Map.of("pii", Map.of("redact", true, "severity", "low")));
        Map<String, Object> override = Map.of("output", Map.of("pii", Map.of("severity", "high")));

        GuardrailConfig config = GuardrailConfig.fromMap(GuardrailConfig.merge(base, override));

        assertEquals(Map.of("redact", true, "severity", "high"), config.getOutputScanners().get("pii"));
    }

    @Test
    void testOnFailPolicies() {
        assertEquals(GuardrailConfig.ON_FAIL_ABORT, GuardrailConfig.fromMap(scanners("input", "pii")).getOnFail());

        Map<String, Object> jump = scanners("input", "pii");
        jump.put("on_fail", "handle_leak");
        jump.put("max_retries", 2L);
        GuardrailConfig config = GuardrailConfig.fromMap(jump);

        assertTrue(config.isJumpOnFail());
        assertEquals(2, config.getMaxRetries(5));

        jump.put("on_fail", "retry");
        assertFalse(GuardrailConfig.fromMap(jump).isJumpOnFail());
    }

    @Test
    void testMalformedConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> GuardrailConfig.fromMap(Map.of("inputs", Map.of())));
        assertThrows(IllegalArgumentException.class, () -> GuardrailConfig.fromMap(Map.of("input", "secrets")));
        assertThrows(IllegalArgumentException.class,
                () -> GuardrailConfig.fromMap(Map.of("input", Map.of("pii", "yes"))));
        assertThrows(IllegalArgumentException.class,
                () -> GuardrailConfig.fromMap(Map.of("input", Map.of(), "max_retries", -1L)));
    }

    @Test
    void testDisabledValues() {
        assertTrue(GuardrailConfig.isDisabledValue(false));
        assertTrue(GuardrailConfig.isDisabledValue("off"));
        assertTrue(GuardrailConfig.isDisabledValue(0L));
        assertFalse(GuardrailConfig.isDisabledValue(Map.of()));
        assertFalse(GuardrailConfig.isDisabledValue(true));
    }
}
