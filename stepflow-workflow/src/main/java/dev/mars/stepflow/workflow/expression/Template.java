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
import java.util.Optional;

/**
 * Splits strings containing {@code ${{ expr }}} interpolations into literal and
 * expression segments. Quotes inside an interpolation are honoured, so
 * {@code ${{ 'a}}b' }} } is a single expression.
 */
public final class Template {

    static final String OPEN = "${{";
    static final String CLOSE = "}}";

    /**
     * A literal run of text or the body of one interpolation.
     */
    public record Segment(boolean expression, String text, int offset) {
    }

    private Template() {
    }

    public static boolean containsExpression(String text) {
        return text != null && text.contains(OPEN);
    }

    /**
     * Returns the body of the interpolation if the whole (trimmed) string is
     * exactly one interpolation.
     */
    public static Optional<String> singleExpression(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith(OPEN) || !trimmed.endsWith(CLOSE)) {
            return Optional.empty();
        }
        List<Segment> segments = split(trimmed);
        if (segments.size() == 1 && segments.get(0).expression()) {
            return Optional.of(segments.get(0).text());
        }
        return Optional.empty();
    }

    /**
     * Strips the delimiters from a value that may be written either as a bare
     * expression or as a single interpolation, as {@code if}, {@code loop} and
     * {@code break_if} allow.
     */
    public static String bareExpression(String text) {
        return singleExpression(text).orElse(text.strip());
    }

    /**
     * @throws ExpressionException if an interpolation is not terminated
     */
    public static List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            int open = text.indexOf(OPEN, position);
            if (open < 0) {
                segments.add(new Segment(false, text.substring(position), position));
                break;
            }
            if (open > position) {
                segments.add(new Segment(false, text.substring(position, open), position));
            }
            int bodyStart = open + OPEN.length();
            int close = findClose(text, bodyStart);
            if (close < 0) {
                throw new ExpressionException("unterminated '${{' interpolation", text, open);
            }
            segments.add(new Segment(true, text.substring(bodyStart, close).strip(), bodyStart));
            position = close + CLOSE.length();
        }
        return segments;
    }

    private static int findClose(String text, int from) {
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (text.startsWith(CLOSE, i)) {
                return i;
            }
        }
        return -1;
    }
}
