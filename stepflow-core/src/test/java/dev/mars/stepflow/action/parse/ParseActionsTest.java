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


package dev.mars.stepflow.action.parse;

import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the parse/json and parse/regex actions.
 */
class ParseActionsTest {

    private final ParseJsonAction json = new ParseJsonAction();
    private final ParseRegexAction regex = new ParseRegexAction();

    private static ActionRequest request(String actionId, Map<String, Object> with) {
        return ActionRequest.builder().actionId(actionId).stepId("parse").with(with).build();
    }

    // ========== parse/json ==========

    @Test
    void testJsonQueriesExtractValues() throws ActionException {
        ActionResult result = json.execute(request(ParseJsonAction.ACTION_ID, Map.of(
                "input", "{\"hosts\": [{\"name\": \"alpha\", \"ports\": [22, 443]}], \"total\": 1}",
                "queries", Map.of("first", "hosts[0].name", "port", "hosts[0].ports[1]", "total", "total"))));

        assertEquals("alpha", result.getOutputs().get("first"));
        assertEquals(443L, result.getOutputs().get("port"));
        assertEquals(1L, result.getOutputs().get("total"));
        assertThat(result.getOutputs().get("parsed")).isInstanceOf(Map.class);
    }

    @Test
    void testJsonMissingPathUsesDefault() throws ActionException {
        ActionResult result = json.execute(request(ParseJsonAction.ACTION_ID, Map.of(
                "input", "{\"a\": {}}",
                "queries", Map.of("b", "a.b", "c", "a.c"),
                "defaults", Map.of("b", "none"))));

        assertEquals("none", result.getOutputs().get("b"));
        assertTrue(result.getOutputs().containsKey("c"));
        assertNull(result.getOutputs().get("c"));
    }

    @Test
    void testJsonAcceptsStructuredInput() throws ActionException {
        ActionResult result = json.execute(request(ParseJsonAction.ACTION_ID, Map.of(
                "input", List.of(Map.of("id", 3)), "queries", Map.of("id", "[0].id"))));

        assertEquals(3L, result.getOutputs().get("id"));
    }

    @Test
    void testInvalidJsonFails() {
        ActionException e = assertThrows(ActionException.class,
                () -> json.execute(request(ParseJsonAction.ACTION_ID, Map.of("input", "{not json"))));

        assertEquals(ActionException.KIND_VALIDATION, e.getKind());
        assertThat(e.getMessage()).contains("Invalid JSON");
        assertEquals("{not json", e.getOutputs().get("raw"));
    }

    @Test
    void testPathWalking() {
        Map<String, Object> data = Map.of("a", Map.of("b", List.of("x", "y")));

        assertEquals("y", ParseJsonAction.extract(data, "a.b[1]"));
        assertEquals(data, ParseJsonAction.extract(data, "@"));
        assertNull(ParseJsonAction.extract(data, "a.b[5]"));
        assertNull(ParseJsonAction.extract(data, "a..b"));
        assertNull(ParseJsonAction.extract(data, "a.b.c"));
    }

    // ========== parse/regex ==========

    @Test
    void testRegexAllMatches() throws ActionException {
        ActionResult result = regex.execute(request(ParseRegexAction.ACTION_ID,
                Map.of("input", "ports 22, 80 and 443", "pattern", "\\d+")));

        assertEquals(List.of("22", "80", "443"), result.getOutputs().get("matches"));
        assertEquals(3L, result.getOutputs().get("count"));
    }

    @Test
    void testRegexFirstWithNamedGroups() throws ActionException {
        ActionResult result = regex.execute(request(ParseRegexAction.ACTION_ID, Map.of(
                "input", "10.0.0.1:8080 10.0.0.2:9090",
                "pattern", "(?<host>[\\d.]+):(?<port>\\d+)",
                "mode", "first")));

        assertEquals(Map.of("host", "10.0.0.1", "port", "8080"), result.getOutputs().get("match"));
    }

    @Test
    void testRegexNoMatchYieldsNull() throws ActionException {
        ActionResult result = regex.execute(request(ParseRegexAction.ACTION_ID,
                Map.of("input", "nothing here", "pattern", "\\d+", "mode", "first")));

        assertTrue(result.getOutputs().containsKey("match"));
        assertNull(result.getOutputs().get("match"));
    }

    @Test
    void testRegexRejectsBadPatternAndMode() {
        ActionException badPattern = assertThrows(ActionException.class, () -> regex.execute(request(
                ParseRegexAction.ACTION_ID, Map.of("input", "x", "pattern", "("))));
        ActionException badMode = assertThrows(ActionException.class, () -> regex.execute(request(
                ParseRegexAction.ACTION_ID, Map.of("input", "x", "pattern", "x", "mode", "some"))));

        assertEquals(ActionException.KIND_VALIDATION, badPattern.getKind());
        assertThat(badPattern.getMessage()).contains("Invalid regex pattern");
        assertThat(badMode.getMessage()).contains("mode must be one of first, all");
    }
}
