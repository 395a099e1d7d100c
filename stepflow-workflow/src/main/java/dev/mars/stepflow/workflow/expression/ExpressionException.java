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

/**
 * Thrown when an expression cannot be parsed or evaluated: unknown identifiers,
 * type mismatches, division by zero or misuse of a filter.
 */
public class ExpressionException extends RuntimeException {

    private final String expression;
    private final int position;

    public ExpressionException(String message) {
        this(message, null, -1, null);
    }

    public ExpressionException(String message, Throwable cause) {
        this(message, null, -1, cause);
    }

    public ExpressionException(String message, String expression, int position) {
        this(message, expression, position, null);
    }

    public ExpressionException(String message, String expression, int position, Throwable cause) {
        super(message, cause);
        this.expression = expression;
        this.position = position;
    }

    /**
     * Copy of this exception attributed to the given expression text.
     */
    public ExpressionException withExpression(String expressionText) {
        if (this.expression != null) {
            return this;
        }
        ExpressionException copy = new ExpressionException(getReason(), expressionText, position, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Character offset of the problem within the expression, or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }

    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (expression == null) {
            return super.getMessage();
        }
        String where = position >= 0 ? " at position " + position : "";
        return super.getMessage() + where + " in expression '" + expression + "'";
    }
}
