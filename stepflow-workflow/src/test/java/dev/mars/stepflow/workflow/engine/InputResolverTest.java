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

import dev.mars.stepflow.workflow.InputDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InputResolverTest {

    @TempDir
    Path workspace;

    private InputResolver resolver;
    private Map<String, InputDefinition> definitions;

    @BeforeEach
    void setUp() {
        resolver = new InputResolver(workspace);
        definitions = new LinkedHashMap<>();
        definitions.put("name", InputDefinition.builder("name").required(true).pattern("[a-z]+").build());
        definitions.put("count", InputDefinition.builder("count").type(InputDefinition.InputType.INTEGER)
                .defaultValue(3L).min(1L).max(10L).build());
        definitions.put("verbose", InputDefinition.builder("verbose").type(InputDefinition.InputType.BOOLEAN)
                .defaultValue(false).build());
        definitions.put("level", InputDefinition.builder("level").required(false)
                .allowedValues(List.of("low", "high")).build());
    }

    @Test
    void testDefaultsAreApplied() throws InputValidationException {
        Map<String, Object> resolved = resolver.resolve(definitions, Map.of("name", "ada"));

        assertEquals("ada", resolved.get("name"));
        assertEquals(3L, resolved.get("count"));
        assertEquals(false, resolved.get("verbose"));
        assertTrue(resolved.containsKey("level"));
        assertNull(resolved.get("level"));
    }

    @Test
    void testStringValuesAreCoerced() throws InputValidationException {
        Map<String, Object> resolved = resolver.resolve(definitions,
                Map.of("name", "ada", "count", " 7 ", "verbose", "Yes", "level", "high"));

        assertEquals(7L, resolved.get("count"));
        assertEquals(true, resolved.get("verbose"));
        assertEquals("high", resolved.get("level"));
    }

    @Test
    void testWholeDoublesAreIntegers() throws InputValidationException {
        assertEquals(4L, resolver.resolve(definitions, Map.of("name", "ada", "count", 4.0)).get("count"));
    }

    @Test
    void testAllProblemsAreReportedTogether() {
        Map<String, Object> supplied = new HashMap<>();
        supplied.put("count", "eleven");
        supplied.put("verbose", "maybe");
        supplied.put("level", "medium");
        supplied.put("colour", "red");

        InputValidationException e = assertThrows(InputValidationException.class,
                () -> resolver.resolve(definitions, supplied));

        assertThat(e.getProblems()).containsExactlyInAnyOrder(
                "unknown input 'colour'",
                "input 'name' is required",
                "input 'count': expected an integer, got 'eleven'",
                "input 'verbose': expected a boolean, got 'maybe'",
                "input 'level': value must be one of [low, high]");
        assertTrue(e.getMessage().startsWith("Invalid workflow inputs: "));
    }

    @Test
    void testRangeAndPattern() {
        InputValidationException e = assertThrows(InputValidationException.class,
                () -> resolver.resolve(definitions, Map.of("name", "Ada", "count", 11L)));

        assertThat(e.getProblems()).containsExactly(
                "input 'name': value does not match pattern [a-z]+",
                "input 'count': 11 is above the maximum 10");
    }

    @Test
    void testFileInputsMustExist() throws Exception {
        Map<String, InputDefinition> files = Map.of("config",
                InputDefinition.builder("config").type(InputDefinition.InputType.FILE).build());
        Files.writeString(workspace.resolve("present.yaml"), "x: 1");

        assertEquals("present.yaml", resolver.resolve(files, Map.of("config", "present.yaml")).get("config"));
        assertThrows(InputValidationException.class, () -> resolver.resolve(files, Map.of("config", "absent.yaml")));
    }

    @Test
    void testStructuredValuesAreNotStrings() {
        assertThrows(InputValidationException.class,
                () -> resolver.resolve(definitions, Map.of("name", List.of("a"))));
    }
}
