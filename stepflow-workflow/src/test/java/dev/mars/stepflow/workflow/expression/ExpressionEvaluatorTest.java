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

package dev.mars.stepflow.workflow.expression;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionEvaluator: operators, paths, templates and undefined handling.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("name", "Ada");
        inputs.put("count", 3L);
        inputs.put("ratio", 0.5);
        inputs.put("flag", false);
        inputs.put("empty", "");
        inputs.put("items", List.of(1L, 2L, 3L));
        inputs.put("nested", Map.of("key", "value"));
        inputs.put("nothing", null);

        Map<String, Object> build = new LinkedHashMap<>();
        build.put("outcome", "succeeded");
        build.put("outputs", Map.of("stdout", "ok\n", "exit_code", 0L));

        Map<String, Object> roots = new LinkedHashMap<>();
        roots.put("inputs", inputs);
        roots.put("steps", Map.of("build", build));
        roots.put("variables", Map.of("total", 10L));
        context = new MapEvaluationContext(roots,
                Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneOffset.UTC));
    }

    private Object eval(String expression) {
        return evaluator.evaluate(expression, context);
    }

    // ========== Operators ==========

    @Test
    void testArithmetic() {
        assertEquals(7L, eval("1 + 2 * 3"));
        assertEquals(9L, eval("(1 + 2) * 3"));
        assertEquals(3.5, eval("7 / 2"));
        assertEquals(3L, eval("7 // 2"));
        assertEquals(-4L, eval("-7 // 2"));
        assertEquals(2L, eval("-7 % 3"));
        assertEquals(1.5, eval("inputs.count * inputs.ratio"));
        assertEquals(-3L, eval("-inputs.count"));
    }

    @Test
    void testStringAndListConcatenation() {
        assertEquals("Ada!", eval("inputs.name + '!'"));
        assertEquals("n=3", eval("'n=' ~ inputs.count"));
        assertEquals(List.of(1L, 2L, 3L, 4L), eval("inputs.items + [4]"));
    }

    @Test
    void testComparisonAndMembership() {
        assertEquals(true, eval("inputs.count >= 3"));
        assertEquals(true, eval("inputs.count == 3.0"));
        assertEquals(true, eval("'Ad' < 'B'"));
        assertEquals(true, eval("2 in inputs.items"));
        assertEquals(true, eval("'key' in inputs.nested"));
        assertEquals(true, eval("'z' not in inputs.name"));
        assertEquals(true, eval("inputs.nothing == null"));
        assertEquals(true, eval("inputs.missing == none"));
    }

    @Test
    void testLogicalOperatorsReturnOperands() {
        assertEquals("fallback", eval("inputs.empty or 'fallback'"));
        assertEquals("", eval("inputs.empty and 'never'"));
        assertEquals(true, eval("not inputs.flag"));
        assertEquals(true, eval("!inputs.flag && inputs.count > 1"));
    }

    @Test
    void testShortCircuitSkipsErrors() {
        assertEquals(false, eval("inputs.flag and (1 / 0)"));
    }

    // ========== Paths ==========

    @Test
    void testPathsAndIndexing() {
        assertEquals("ok\n", eval("steps.build.outputs.stdout"));
        assertEquals("succeeded", eval("steps['build'].outcome"));
        assertEquals(1L, eval("inputs.items[0]"));
        assertEquals(3L, eval("inputs.items[-1]"));
        assertEquals("d", eval("inputs.name[1]"));
        assertEquals(10L, eval("variables.total"));
    }

    @Test
    void testMissingValuesAreUndefined() {
        assertNull(eval("inputs.missing"));
        assertNull(eval("inputs.missing.deeper.still"));
        assertNull(eval("inputs.items[10]"));
        assertNull(eval("steps.unknown.outputs.stdout"));
        assertNull(eval("loop.index"));
        assertEquals("none", eval("inputs.missing | default('none')"));
    }

    @Test
    void testUnknownIdentifierFails() {
        ExpressionException e = assertThrows(ExpressionException.class, () -> eval("foo.bar"));

        assertTrue(e.getMessage().contains("unknown identifier 'foo'"));
        assertEquals("foo.bar", e.getExpression());
    }

    @Test
    void testTypeErrors() {
        assertThrows(ExpressionException.class, () -> eval("inputs.name.length"));
        assertThrows(ExpressionException.class, () -> eval("'a' < 1"));
        assertThrows(ExpressionException.class, () -> eval("inputs.name - 1"));
        assertThrows(ExpressionException.class, () -> eval("true + 1"));
        assertThrows(ExpressionException.class, () -> eval("inputs.items['x']"));
        assertThrows(ExpressionException.class, () -> eval("-inputs.name"));
    }

    @Test
    void testDivisionByZeroAndOverflow() {
        ExpressionException zero = assertThrows(ExpressionException.class, () -> eval("1 / 0"));
        ExpressionException overflow = assertThrows(ExpressionException.class,
                () -> eval("9223372036854775807 + 1"));

        assertTrue(zero.getMessage().contains("division by zero"));
        assertTrue(overflow.getMessage().contains("integer overflow"));
    }

    @Test
    void testNowUsesContextClock() {
        assertEquals("2025-01-02T03:04:05Z", eval("now()"));
    }

    @Test
    void testFunctionCallSyntaxForFilters() {
        assertEquals("1-2-3", eval("join(inputs.items, '-')"));
        assertThrows(ExpressionException.class, () -> eval("nosuch(1)"));
    }

    // ========== Templates ==========

    @Test
    void testRenderSplicesText() {
        assertEquals("Hello Ada, 3 items: [1,2,3]",
                evaluator.render("Hello ${{ inputs.name }}, ${{ inputs.count }} items: ${{ inputs.items }}", context));
        assertEquals("missing=[]", evaluator.render("missing=[${{ inputs.missing }}]", context));
    }

    @Test
    void testSingleInterpolationKeepsType() {
        assertEquals(3L, evaluator.render("${{ inputs.count }}", context));
        assertEquals(List.of(1L, 2L, 3L), evaluator.render("  ${{ inputs.items }} ", context));
        assertEquals("plain", evaluator.render("plain", context));
    }

    @Test
    void testQuotedBracesInsideInterpolation() {
        assertEquals("a}}b!", evaluator.render("${{ 'a}}b' }}!", context));
    }

    @Test
    void testUnterminatedInterpolation() {
        assertThrows(ExpressionException.class, () -> evaluator.render("x ${{ inputs.name", context));
    }

    @Test
    void testConditionsAcceptBothForms() {
        assertTrue(evaluator.evaluateCondition("inputs.count > 2", context));
        assertTrue(evaluator.evaluateCondition("${{ inputs.count > 2 }}", context));
        assertFalse(evaluator.evaluateCondition("inputs.missing", context));
        assertTrue(evaluator.evaluateCondition("${{ inputs.name }}-suffix", context));
    }

    @Test
    void testEvaluateBare() {
        assertEquals(List.of(1L, 2L, 3L), evaluator.evaluateBare("inputs.items", context));
        assertEquals(List.of(1L, 2L, 3L), evaluator.evaluateBare("${{ inputs.items }}", context));
    }

    @Test
    void testResolveWalksNestedValues() {
        Map<String, Object> with = new LinkedHashMap<>();
        with.put("greeting", "hi ${{ inputs.name }}");
        with.put("list", List.of("${{ inputs.count }}", 5L));
        with.put("nested", Map.of("flag", "${{ inputs.flag }}"));

        Map<String, Object> resolved = evaluator.resolveMap(with, context);

        assertEquals("hi Ada", resolved.get("greeting"));
        assertEquals(List.of(3L, 5L), resolved.get("list"));
        assertEquals(Map.of("flag", false), resolved.get("nested"));
    }

    @Test
    void testEvaluationDoesNotMutateContext() {
        Object before = evaluator.evaluate("inputs", context);
        evaluator.evaluate("inputs.items + [4]", context);

        assertEquals(before, evaluator.evaluate("inputs", context));
    }
}
