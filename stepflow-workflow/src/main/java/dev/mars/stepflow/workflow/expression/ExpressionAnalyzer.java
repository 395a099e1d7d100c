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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static inspection of expressions without binding any identifiers. Used by the
 * validator to check syntax, roots, step references and filter names before a
 * run starts.
 */
public final class ExpressionAnalyzer {

    /**
     * Names found in one expression or template.
     */
    public static final class References {
        private final Set<String> roots = new LinkedHashSet<>();
        private final Set<String> steps = new LinkedHashSet<>();
        private final Set<String> filters = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private boolean dynamicStepAccess;

        public Set<String> getRoots() {
            return Collections.unmodifiableSet(roots);
        }

        /**
         * Step ids referenced as {@code steps.<id>} or {@code steps['<id>']}.
         */
        public Set<String> getSteps() {
            return Collections.unmodifiableSet(steps);
        }

        public Set<String> getFilters() {
            return Collections.unmodifiableSet(filters);
        }

        public Set<String> getFunctions() {
            return Collections.unmodifiableSet(functions);
        }

        /**
         * Whether {@code steps} is indexed by a computed key.
         */
        public boolean hasDynamicStepAccess() {
            return dynamicStepAccess;
        }

        void merge(References other) {
            roots.addAll(other.roots);
            steps.addAll(other.steps);
            filters.addAll(other.filters);
            functions.addAll(other.functions);
            dynamicStepAccess |= other.dynamicStepAccess;
        }
    }

    private static final String SHELL_QUOTE = "shell_quote";

    private ExpressionAnalyzer() {
    }

    /**
     * Analyses a bare expression.
     *
     * @throws ExpressionException if it does not parse
     */
    public static References analyzeExpression(String expression) {
        References references = new References();
        collect(ExpressionParser.parse(expression), references);
        return references;
    }

    /**
     * Analyses every interpolation of a template string.
     *
     * @throws ExpressionException if an interpolation is malformed
     */
    public static References analyzeTemplate(String template) {
        References references = new References();
        for (Template.Segment segment : Template.split(template)) {
            if (segment.expression()) {
                try {
                    references.merge(analyzeExpression(segment.text()));
                } catch (ExpressionException e) {
                    throw e.withExpression(segment.text());
                }
            }
        }
        return references;
    }

    /**
     * Analyses a value written either bare or as a single interpolation.
     */
    public static References analyzeBare(String value) {
        if (Template.containsExpression(value) && Template.singleExpression(value).isEmpty()) {
            return analyzeTemplate(value);
        }
        return analyzeExpression(Template.bareExpression(value));
    }

    /**
     * Whether the outermost operation of an interpolation is {@code shell_quote},
     * or the expression is a literal, so it is safe to splice into a shell command.
     * Expressions that do not parse are reported as unquoted.
     */
    public static boolean isShellQuoted(String expression) {
        ExpressionNode node;
        try {
            node = ExpressionParser.parse(expression);
        } catch (ExpressionException e) {
            return false;
        }
        if (node instanceof ExpressionNode.Filter filter) {
            return filter.name().equals(SHELL_QUOTE);
        }
        if (node instanceof ExpressionNode.Call call) {
            return call.name().equals(SHELL_QUOTE);
        }
        return node instanceof ExpressionNode.Literal;
    }

    private static void collect(ExpressionNode root, References references) {
        Deque<ExpressionNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ExpressionNode node = pending.pop();
            if (node instanceof ExpressionNode.Identifier identifier) {
                references.roots.add(identifier.name());
            } else if (node instanceof ExpressionNode.Attribute attribute && isStepsRoot(attribute.target())) {
                references.steps.add(attribute.name());
            } else if (node instanceof ExpressionNode.Index index && isStepsRoot(index.target())) {
                if (index.index() instanceof ExpressionNode.Literal literal && literal.value() instanceof String id) {
                    references.steps.add(id);
                } else {
                    references.dynamicStepAccess = true;
                }
            } else if (node instanceof ExpressionNode.Filter filter) {
                references.filters.add(filter.name());
            } else if (node instanceof ExpressionNode.Call call) {
                references.functions.add(call.name());
            }
            node.children().forEach(pending::push);
        }
    }

    private static boolean isStepsRoot(ExpressionNode node) {
        return node instanceof ExpressionNode.Identifier identifier && identifier.name().equals("steps");
    }
}
