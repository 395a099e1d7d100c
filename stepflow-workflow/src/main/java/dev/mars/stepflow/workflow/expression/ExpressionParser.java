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

import dev.mars.stepflow.workflow.expression.ExpressionLexer.Token;
import dev.mars.stepflow.workflow.expression.ExpressionLexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the expression language.
 *
 * <pre>
 * or         := and (("or" | "||") and)*
 * and        := not (("and" | "&amp;&amp;") not)*
 * not        := ("not" | "!") not | comparison
 * comparison := concat (("==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=" | "in" | "not in") concat)?
 * concat     := additive ("~" additive)*
 * additive   := term (("+" | "-") term)*
 * term       := unary (("*" | "/" | "//" | "%") unary)*
 * unary      := "-" unary | postfix
 * postfix    := primary ("." name | "[" or "]" | "|" name ("(" args ")")?)*
 * primary    := number | string | true | false | null | none | list | "(" or ")" | name ("(" args ")")?
 * </pre>
 */
public final class ExpressionParser {

    static final int MAX_DEPTH = 64;

    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private final String source;
    private final List<Token> tokens;
    private int current;
    private int depth;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new ExpressionLexer(source).tokenize();
    }

    /**
     * Parses a bare expression (without the {@code ${{ }}} delimiters).
     *
     * @throws ExpressionException if the text is not a well-formed expression
     */
    public static ExpressionNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionException("empty expression", expression, 0);
        }
        ExpressionParser parser = new ExpressionParser(expression);
        ExpressionNode node = parser.or();
        if (!parser.peek().is(TokenType.EOF)) {
            throw parser.error("unexpected '" + parser.peek().text() + "'");
        }
        return node;
    }

    private ExpressionNode or() {
        enter();
        ExpressionNode left = and();
        while (peek().isKeyword("or") || peek().isOperator("||")) {
            Token operator = advance();
            left = new ExpressionNode.Binary("or", left, and(), operator.position());
        }
        leave();
        return left;
    }

    private ExpressionNode and() {
        ExpressionNode left = not();
        while (peek().isKeyword("and") || peek().isOperator("&&")) {
            Token operator = advance();
            left = new ExpressionNode.Binary("and", left, not(), operator.position());
        }
        return left;
    }

    private ExpressionNode not() {
        if (peek().isKeyword("not") || peek().isOperator("!")) {
            Token operator = advance();
            enter();
            ExpressionNode operand = not();
            leave();
            return new ExpressionNode.Unary("not", operand, operator.position());
        }
        return comparison();
    }

    private ExpressionNode comparison() {
        ExpressionNode left = concat();
        Token token = peek();
        if (token.is(TokenType.OPERATOR) && COMPARISONS.contains(token.text())) {
            advance();
            return new ExpressionNode.Binary(token.text(), left, concat(), token.position());
        }
        if (token.isKeyword("in")) {
            advance();
            return new ExpressionNode.Binary("in", left, concat(), token.position());
        }
        if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
            advance();
            advance();
            return new ExpressionNode.Binary("not in", left, concat(), token.position());
        }
        return left;
    }

    private ExpressionNode concat() {
        ExpressionNode left = additive();
        while (peek().isOperator("~")) {
            Token operator = advance();
            left = new ExpressionNode.Binary("~", left, additive(), operator.position());
        }
        return left;
    }

    private ExpressionNode additive() {
        ExpressionNode left = term();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            Token operator = advance();
            left = new ExpressionNode.Binary(operator.text(), left, term(), operator.position());
        }
        return left;
    }

    private ExpressionNode term() {
        ExpressionNode left = unary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("//")
                || peek().isOperator("%")) {
            Token operator = advance();
            left = new ExpressionNode.Binary(operator.text(), left, unary(), operator.position());
        }
        return left;
    }

    private ExpressionNode unary() {
        if (peek().isOperator("-")) {
            Token operator = advance();
            enter();
            ExpressionNode operand = unary();
            leave();
            return new ExpressionNode.Unary("-", operand, operator.position());
        }
        return postfix();
    }

    private ExpressionNode postfix() {
        ExpressionNode node = primary();
        while (true) {
            Token token = peek();
            if (token.is(TokenType.DOT)) {
                advance();
                Token name = expect(TokenType.IDENTIFIER, "attribute name");
                node = new ExpressionNode.Attribute(node, name.text(), token.position());
            } else if (token.is(TokenType.LBRACKET)) {
                advance();
                ExpressionNode index = or();
                expect(TokenType.RBRACKET, "']'");
                node = new ExpressionNode.Index(node, index, token.position());
            } else if (token.is(TokenType.PIPE)) {
                advance();
                Token name = expect(TokenType.IDENTIFIER, "filter name");
                List<ExpressionNode> arguments = List.of();
                if (peek().is(TokenType.LPAREN)) {
                    advance();
                    arguments = arguments();
                }
                node = new ExpressionNode.Filter(node, name.text(), arguments, name.position());
            } else {
                return node;
            }
        }
    }

    private ExpressionNode primary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
            case STRING:
                return new ExpressionNode.Literal(token.value(), token.position());
            case LPAREN: {
                ExpressionNode inner = or();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case LBRACKET: {
                List<ExpressionNode> items = new ArrayList<>();
                if (!peek().is(TokenType.RBRACKET)) {
                    do {
                        items.add(or());
                    } while (match(TokenType.COMMA) && !peek().is(TokenType.RBRACKET));
                }
                expect(TokenType.RBRACKET, "']'");
                return new ExpressionNode.ListLiteral(items, token.position());
            }
            case IDENTIFIER:
                return identifier(token);
            default:
                throw new ExpressionException(token.is(TokenType.EOF)
                        ? "unexpected end of expression"
                        : "unexpected '" + token.text() + "'", source, token.position());
        }
    }

    private ExpressionNode identifier(Token token) {
        switch (token.text()) {
            case "true":
            case "True":
                return new ExpressionNode.Literal(Boolean.TRUE, token.position());
            case "false":
            case "False":
                return new ExpressionNode.Literal(Boolean.FALSE, token.position());
            case "null":
            case "none":
            case "None":
                return new ExpressionNode.Literal(null, token.position());
            case "and":
            case "or":
            case "not":
            case "in":
                throw new ExpressionException("unexpected keyword '" + token.text() + "'", source, token.position());
            default:
                break;
        }
        if (peek().is(TokenType.LPAREN)) {
            advance();
            return new ExpressionNode.Call(token.text(), arguments(), token.position());
        }
        return new ExpressionNode.Identifier(token.text(), token.position());
    }

    /**
     * Parses a comma separated argument list; the opening parenthesis is consumed.
     */
    private List<ExpressionNode> arguments() {
        List<ExpressionNode> arguments = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return arguments;
        }
        do {
            arguments.add(or());
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN, "')'");
        return arguments;
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("expression nested too deeply");
        }
    }

    private void leave() {
        depth--;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String description) {
        if (!peek().is(type)) {
            throw error("expected " + description + " but found "
                    + (peek().is(TokenType.EOF) ? "end of expression" : "'" + peek().text() + "'"));
        }
        return advance();
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message, source, peek().position());
    }
}
