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

package dev.mars.stepflow.action;

import dev.mars.stepflow.core.exceptions.ActionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionParametersTest {

    private ActionParameters params(Map<String, Object> values) {
        return new ActionParameters("test/action", values);
    }

    @Test
    void testTypedAccessors() throws ActionException {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("count", 3L);
        values.put("ratio", "0.5");
        values.put("flag", "yes");
        values.put("items", List.of("a", 1L));
        values.put("nested", Map.of("k", "v"));
        ActionParameters params = params(values);

        assertEquals(3L, params.getLong("count", 0));
        assertEquals(0.5, params.getDouble("ratio", 0));
        assertTrue(params.getBoolean("flag", false));
        assertEquals(List.of("a", "1"), params.getStringList("items"));
        assertEquals(Map.of("k", "v"), params.getMap("nested"));
        assertEquals(7L, params.getLong("missing", 7));
    }

    @Test
    void testSecondsAcceptFractions() throws ActionException {
        ActionParameters params = params(Map.of("timeout", 1.5));

        assertEquals(Duration.ofMillis(1500), params.getSeconds("timeout", Duration.ZERO));
        assertEquals(Duration.ofSeconds(9), params.getSeconds("other", Duration.ofSeconds(9)));
    }

    @Test
    void testNegativeSecondsRejected() {
        ActionException e = assertThrows(ActionException.class,
                () -> params(Map.of("timeout", -1L)).getSeconds("timeout", null));

        assertEquals(ActionException.KIND_VALIDATION, e.getKind());
    }

    @Test
    void testTypeMismatchIsValidationError() {
        ActionParameters params = params(Map.of("count", "lots", "items", "not-a-list"));

        ActionException notNumber = assertThrows(ActionException.class, () -> params.getLong("count", 0));
        ActionException notList = assertThrows(ActionException.class, () -> params.getList("items"));

        assertEquals(ActionException.KIND_VALIDATION, notNumber.getKind());
        assertEquals("test/action", notList.getActionId());
    }

    @Test
    void testRequireString() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("blank", "  ");
        values.put("nothing", null);
        ActionParameters params = params(values);

        assertThrows(ActionException.class, () -> params.requireString("blank"));
        assertThrows(ActionException.class, () -> params.requireString("nothing"));
        assertFalse(params.has("nothing"));
    }
}
