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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionParser precedence and error reporting.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class ExpressionParserTest {

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        ExpressionNode node = ExpressionParser.parse("1 + 2 * 3");

        ExpressionNode.Binary sum = assertInstanceOf(ExpressionNode.Binary.class, node);
        assertEquals("+", sum.operator());
        assertEquals("*", assertInstanceOf(ExpressionNode.Binary.class, sum.right()).operator());
    }

    @Test
    void testFilterBindsTighterThanComparison() {
        ExpressionNode node = ExpressionParser.parse("inputs.items | length > 2");

        ExpressionNode.Binary comparison = assertInstanceOf(ExpressionNode.Binary.class, node);
        assertEquals(">", comparison.operator());
        ExpressionNode.Filter filter = assertInstanceOf(ExpressionNode.Filter.class, comparison.left());
        assertEquals("length", filter.name());
    }

    @Test
    void testNotIn() {
        ExpressionNode.Binary node = assertInstanceOf(ExpressionNode.Binary.class,
                ExpressionParser.parse("'x' not in inputs.tags"));

        assertEquals("not in", node.operator());
    }

    @Test
    void testAndBindsTighterThanOr() {
        ExpressionNode.Binary node = assertInstanceOf(ExpressionNode.Binary.class,
                ExpressionParser.parse("a or b and c"));

        assertEquals("or", node.operator());
        assertEquals("and", assertInstanceOf(ExpressionNode.Binary.class, node.right()).operator());
    }

    @Test
    void testFunctionCallAndListLiteral() {
        ExpressionNode.Call call = assertInstanceOf(ExpressionNode.Call.class,
                ExpressionParser.parse("join([1, 2, 3], '-')"));

        assertEquals("join", call.name());
        assertEquals(2, call.arguments().size());
        assertInstanceOf(ExpressionNode.ListLiteral.class, call.arguments().get(0));
    }

    @Test
    void testKeywordLiterals() {
        assertEquals(Boolean.TRUE, ((ExpressionNode.Literal) ExpressionParser.parse("True")).value());
        assertNull(((ExpressionNode.Literal) ExpressionParser.parse("none")).value());
    }

    @ParameterizedTest
    @ValueSource(strings = {"a +", "(1", "[1, 2", "a.", "x | ", "and 1", "1 2", ""})
    void testMalformedExpressionsAreRejected(String expression) {
        assertThrows(ExpressionException.class, () -> ExpressionParser.parse(expression));
    }

    @Test
    void testNestingIsBounded() {
        String deep = "(".repeat(ExpressionParser.MAX_DEPTH + 5) + "1" + ")".repeat(ExpressionParser.MAX_DEPTH + 5);

        ExpressionException e = assertThrows(ExpressionException.class, () -> ExpressionParser.parse(deep));

        assertTrue(e.getMessage().contains("nested too deeply"));
    }

    @Test
    void testErrorCarriesPosition() {
        ExpressionException e = assertThrows(ExpressionException.class,
                () -> ExpressionParser.parse("inputs.a == == 1"));

        assertEquals(12, e.getPosition());
        assertEquals("inputs.a == == 1", e.getExpression());
    }
}
