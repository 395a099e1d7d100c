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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionAnalyzerTest {

    @Test
    void testCollectsStepReferences() {
        ExpressionAnalyzer.References refs = ExpressionAnalyzer.analyzeTemplate(
                "${{ steps.build.outputs.stdout }} and ${{ steps['test'].outcome | default('none') }}");

        assertEquals(Set.of("build", "test"), refs.getSteps());
        assertEquals(Set.of("steps"), refs.getRoots());
        assertEquals(Set.of("default"), refs.getFilters());
        assertFalse(refs.hasDynamicStepAccess());
    }

    @Test
    void testDynamicStepAccess() {
        ExpressionAnalyzer.References refs = ExpressionAnalyzer.analyzeExpression("steps[inputs.name].outcome");

        assertTrue(refs.hasDynamicStepAccess());
        assertEquals(Set.of("steps", "inputs"), refs.getRoots());
    }

    @Test
    void testFunctions() {
        ExpressionAnalyzer.References refs = ExpressionAnalyzer.analyzeBare("${{ join(inputs.tags, ',') ~ now() }}");

        assertEquals(Set.of("join", "now"), refs.getFunctions());
    }

    @Test
    void testShellQuotedDetection() {
        assertTrue(ExpressionAnalyzer.isShellQuoted("inputs.x | shell_quote"));
        assertTrue(ExpressionAnalyzer.isShellQuoted("shell_quote(inputs.x)"));
        assertTrue(ExpressionAnalyzer.isShellQuoted("'literal'"));
        assertFalse(ExpressionAnalyzer.isShellQuoted("inputs.x | shell_quote | upper"));
        assertFalse(ExpressionAnalyzer.isShellQuoted("inputs.x"));
        assertFalse(ExpressionAnalyzer.isShellQuoted("broken ("));
    }

    @Test
    void testTemplateSplitting() {
        List<Template.Segment> segments = Template.split("a ${{ x }} b");

        assertEquals(3, segments.size());
        assertFalse(segments.get(0).expression());
        assertEquals("x", segments.get(1).text());
        assertEquals(" b", segments.get(2).text());
        assertEquals("inputs.a", Template.bareExpression("${{ inputs.a }}"));
        assertEquals("inputs.a", Template.bareExpression(" inputs.a "));
        assertTrue(Template.singleExpression("${{ a }} ${{ b }}").isEmpty());
    }
}
