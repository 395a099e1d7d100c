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

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax tree of a parsed expression. Nodes are immutable and can be shared
 * between threads.
 */
public interface ExpressionNode {

    List<ExpressionNode> children();

    /**
     * Offset of the node in the expression text.
     */
    int position();

    record Literal(Object value, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return List.of();
        }
    }

    record Identifier(String name, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return List.of();
        }
    }

    record Attribute(ExpressionNode target, String name, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return List.of(target);
        }
    }

    record Index(ExpressionNode target, ExpressionNode index, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return List.of(target, index);
        }
    }

    record Unary(String operator, ExpressionNode operand, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return List.of(operand);
        }
    }

    record Binary(String operator, ExpressionNode left, ExpressionNode right, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return List.of(left, right);
        }
    }

    record Filter(ExpressionNode subject, String name, List<ExpressionNode> arguments, int position)
            implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            List<ExpressionNode> children = new ArrayList<>();
            children.add(subject);
            children.addAll(arguments);
            return children;
        }
    }

    record Call(String name, List<ExpressionNode> arguments, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return arguments;
        }
    }

    record ListLiteral(List<ExpressionNode> items, int position) implements ExpressionNode {
        @Override
        public List<ExpressionNode> children() {
            return items;
        }
    }
}
