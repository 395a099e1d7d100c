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
 * Splits expression text into tokens.
 */
final class ExpressionLexer {

    enum TokenType {
        NUMBER, STRING, IDENTIFIER, OPERATOR, DOT, COMMA, LPAREN, RPAREN, LBRACKET, RBRACKET, PIPE, EOF
    }

    record Token(TokenType type, String text, Object value, int position) {

        boolean is(TokenType expected) {
            return type == expected;
        }

        boolean isOperator(String operator) {
            return type == TokenType.OPERATOR && text.equals(operator);
        }

        boolean isKeyword(String keyword) {
            return type == TokenType.IDENTIFIER && text.equals(keyword);
        }
    }

    private static final String[] OPERATORS = {
            "==", "!=", "<=", ">=", "//", "&&", "||", "<", ">", "+", "-", "*", "/", "%", "~", "!"
    };

    private final String source;
    private int position;

    ExpressionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, position));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = source.charAt(position);
        int start = position;

        if (Character.isDigit(c)) {
            return number();
        }
        if (c == '\'' || c == '"') {
            return string(c);
        }
        if (Character.isLetter(c) || c == '_') {
            while (position < source.length()
                    && (Character.isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_')) {
                position++;
            }
            String word = source.substring(start, position);
            return new Token(TokenType.IDENTIFIER, word, word, start);
        }

        switch (c) {
            case '.':
                position++;
                return new Token(TokenType.DOT, ".", null, start);
            case ',':
                position++;
                return new Token(TokenType.COMMA, ",", null, start);
            case '(':
                position++;
                return new Token(TokenType.LPAREN, "(", null, start);
            case ')':
                position++;
                return new Token(TokenType.RPAREN, ")", null, start);
            case '[':
                position++;
                return new Token(TokenType.LBRACKET, "[", null, start);
            case ']':
                position++;
                return new Token(TokenType.RBRACKET, "]", null, start);
            default:
                break;
        }

        if (c == '|' && !source.startsWith("||", position)) {
            position++;
            return new Token(TokenType.PIPE, "|", null, start);
        }
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                position += operator.length();
                return new Token(TokenType.OPERATOR, operator, null, start);
            }
        }
        throw new ExpressionException("unexpected character '" + c + "'", source, start);
    }

    private Token number() {
        int start = position;
        while (position < source.length() && Character.isDigit(source.charAt(position))) {
            position++;
        }
        boolean decimal = false;
        if (position + 1 < source.length() && source.charAt(position) == '.'
                && Character.isDigit(source.charAt(position + 1))) {
            decimal = true;
            position++;
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }
        String text = source.substring(start, position);
        try {
            Object value = decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, value, start);
        } catch (NumberFormatException e) {
            throw new ExpressionException("number out of range: " + text, source, start, e);
        }
    }

    private Token string(char quote) {
        int start = position;
        position++;
        StringBuilder value = new StringBuilder();
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == quote) {
                position++;
                return new Token(TokenType.STRING, source.substring(start, position), value.toString(), start);
            }
            if (c == '\\' && position + 1 < source.length()) {
                char escaped = source.charAt(position + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '\\', '\'', '"' -> value.append(escaped);
                    default -> value.append('\\').append(escaped);
                }
                position += 2;
                continue;
            }
            value.append(c);
            position++;
        }
        throw new ExpressionException("unterminated string literal", source, start);
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }
}
