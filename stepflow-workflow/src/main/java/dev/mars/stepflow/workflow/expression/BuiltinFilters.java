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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.stepflow.core.Values;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The built-in filter set.
 */
final class BuiltinFilters {

    static final int MAX_REGEX_INPUT = 100_000;

    private static final int MAX_FORMAT_ARGUMENTS = 32;
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f]");
    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern FORMAT_PLACEHOLDER = Pattern.compile("\\{\\{|\\}\\}|\\{(\\d+)\\}");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off", "0", "");

    private BuiltinFilters() {
    }

    static void registerAll(FilterRegistry registry) {
        registry.register("shell_quote", 0, 0, (subject, args) -> ShellQuoting.quote(text(subject)));
        registry.register("length", 0, 0, (subject, args) -> length(subject));
        registry.register("default", 1, 2, BuiltinFilters::defaultValue);
        registry.register("keys", 0, 0, (subject, args) -> keys(subject, "keys"));
        registry.register("values", 0, 0, (subject, args) -> values(subject));
        registry.register("first", 0, 0, (subject, args) -> element(subject, true));
        registry.register("last", 0, 0, (subject, args) -> element(subject, false));
        registry.register("join", 0, 1, BuiltinFilters::join);
        registry.register("contains", 1, 1, (subject, args) -> contains(subject, args.get(0)));
        registry.register("startsWith", 1, 1, (subject, args) -> text(subject).startsWith(text(args.get(0))));
        registry.register("endsWith", 1, 1, (subject, args) -> text(subject).endsWith(text(args.get(0))));
        registry.register("format", 0, MAX_FORMAT_ARGUMENTS, BuiltinFilters::format);
        registry.register("toJSON", 0, 0, (subject, args) -> ExpressionValues.toJson(subject));
        registry.register("fromJSON", 0, 0, (subject, args) -> fromJson(subject));

        registry.register("lower", 0, 0, (subject, args) -> text(subject).toLowerCase(Locale.ROOT));
        registry.register("upper", 0, 0, (subject, args) -> text(subject).toUpperCase(Locale.ROOT));
        registry.register("trim", 0, 0, (subject, args) -> text(subject).strip());
        registry.register("split", 0, 1, BuiltinFilters::split);
        registry.register("lines", 0, 0, (subject, args) -> lines(subject));
        registry.register("sort", 0, 0, (subject, args) -> sort(subject));
        registry.register("unique", 0, 0, (subject, args) -> unique(subject));
        registry.register("reverse", 0, 0, (subject, args) -> reverse(subject));
        registry.register("int", 0, 1, BuiltinFilters::toInteger);
        registry.register("float", 0, 1, BuiltinFilters::toFloat);
        registry.register("string", 0, 0, (subject, args) -> text(subject));
        registry.register("bool", 0, 0, (subject, args) -> toBoolean(subject));
        registry.register("safe_filename", 0, 0, (subject, args) -> safeFilename(subject));
        registry.register("truncate", 0, 2, BuiltinFilters::truncate);
        registry.register("replace", 2, 2,
                (subject, args) -> text(subject).replace(text(args.get(0)), text(args.get(1))));
        registry.register("regex_replace", 2, 2, BuiltinFilters::regexReplace);
        registry.register("regex_match", 1, 1, BuiltinFilters::regexMatch);
        registry.register("b64encode", 0, 0, (subject, args) ->
                Base64.getEncoder().encodeToString(text(subject).getBytes(StandardCharsets.UTF_8)));
        registry.register("b64decode", 0, 0, (subject, args) -> base64Decode(subject));
        registry.register("urlencode", 0, 0, (subject, args) -> urlEncode(subject));
        registry.register("urldecode", 0, 0, (subject, args) ->
                URLDecoder.decode(text(subject).replace("+", "%2B"), StandardCharsets.UTF_8));
    }

    static String text(Object value) {
        return ExpressionValues.toText(value);
    }

    private static long length(Object subject) {
        if (Undefined.isMissing(subject)) {
            return 0;
        }
        if (subject instanceof CharSequence s) {
            return s.length();
        }
        if (subject instanceof Collection<?> c) {
            return c.size();
        }
        if (subject instanceof Map<?, ?> m) {
            return m.size();
        }
        if (subject instanceof LazyScope scope) {
            return scope.keys().size();
        }
        throw new ExpressionException("length is not defined for " + ExpressionValues.typeName(subject));
    }

    private static Object defaultValue(Object subject, List<Object> args) {
        boolean replaceFalsy = args.size() > 1 && ExpressionValues.isTruthy(args.get(1));
        if (Undefined.isMissing(subject) || (replaceFalsy && !ExpressionValues.isTruthy(subject))) {
            return args.get(0);
        }
        return subject;
    }

    static List<Object> keys(Object subject, String filter) {
        if (subject instanceof Map<?, ?> map) {
            List<Object> keys = new ArrayList<>();
            map.keySet().forEach(key -> keys.add(String.valueOf(key)));
            return keys;
        }
        if (subject instanceof LazyScope scope) {
            return new ArrayList<>(scope.keys());
        }
        if (Undefined.isMissing(subject)) {
            return new ArrayList<>();
        }
        throw new ExpressionException(filter + " requires a mapping, got " + ExpressionValues.typeName(subject));
    }

    private static List<Object> values(Object subject) {
        if (subject instanceof Map<?, ?> map) {
            return new ArrayList<>(map.values());
        }
        if (subject instanceof LazyScope scope) {
            List<Object> values = new ArrayList<>();
            scope.keys().forEach(key -> values.add(scope.get(key)));
            return values;
        }
        if (Undefined.isMissing(subject)) {
            return new ArrayList<>();
        }
        throw new ExpressionException("values requires a mapping, got " + ExpressionValues.typeName(subject));
    }

    private static Object element(Object subject, boolean first) {
        if (subject instanceof List<?> list) {
            if (list.isEmpty()) {
                return Undefined.INSTANCE;
            }
            return first ? list.get(0) : list.get(list.size() - 1);
        }
        if (subject instanceof String s) {
            if (s.isEmpty()) {
                return Undefined.INSTANCE;
            }
            return String.valueOf(first ? s.charAt(0) : s.charAt(s.length() - 1));
        }
        if (Undefined.isMissing(subject)) {
            return Undefined.INSTANCE;
        }
        throw new ExpressionException((first ? "first" : "last") + " requires a list or string, got "
                + ExpressionValues.typeName(subject));
    }

    private static String join(Object subject, List<Object> args) {
        String separator = args.isEmpty() ? "," : text(args.get(0));
        List<String> parts = new ArrayList<>();
        for (Object item : list(subject, "join")) {
            parts.add(text(item));
        }
        return String.join(separator, parts);
    }

    static boolean contains(Object subject, Object needle) {
        if (subject instanceof String s) {
            return s.contains(text(needle));
        }
        if (subject instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (ExpressionValues.valuesEqual(item, needle)) {
                    return true;
                }
            }
            return false;
        }
        if (subject instanceof Map<?, ?> map) {
            return map.containsKey(text(needle));
        }
        if (subject instanceof LazyScope scope) {
            return !Undefined.isMissing(scope.get(text(needle)));
        }
        if (Undefined.isMissing(subject)) {
            return false;
        }
        throw new ExpressionException("contains is not defined for " + ExpressionValues.typeName(subject));
    }

    private static String format(Object subject, List<Object> args) {
        String template = text(subject);
        Matcher matcher = FORMAT_PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            if (matcher.group(1) == null) {
                replacement = matcher.group().substring(0, 1);
            } else {
                int index = Integer.parseInt(matcher.group(1));
                if (index >= args.size()) {
                    throw new ExpressionException("format placeholder {" + index + "} has no argument");
                }
                replacement = text(args.get(index));
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Object fromJson(Object subject) {
        String json = text(subject);
        try {
            return Values.normalize(ExpressionValues.JSON.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new ExpressionException("fromJSON: invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static List<Object> split(Object subject, List<Object> args) {
        String value = text(subject);
        List<Object> parts = new ArrayList<>();
        if (args.isEmpty() || Undefined.isMissing(args.get(0))) {
            for (String part : value.strip().split("\\s+")) {
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            return parts;
        }
        String separator = text(args.get(0));
        if (separator.isEmpty()) {
            throw new ExpressionException("split separator cannot be empty");
        }
        Collections.addAll(parts, (Object[]) value.split(Pattern.quote(separator), -1));
        return parts;
    }

    private static List<Object> lines(Object subject) {
        String value = text(subject);
        List<Object> lines = new ArrayList<>();
        if (value.isEmpty()) {
            return lines;
        }
        Collections.addAll(lines, (Object[]) value.split("\\r\\n|\\r|\\n", -1));
        if (lines.size() > 1 && "".equals(lines.get(lines.size() - 1))) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static List<Object> sort(Object subject) {
        List<Object> sorted = new ArrayList<>(list(subject, "sort"));
        sorted.sort(ExpressionValues::compare);
        return sorted;
    }

    private static List<Object> unique(Object subject) {
        List<Object> unique = new ArrayList<>();
        for (Object item : list(subject, "unique")) {
            if (!contains(unique, item)) {
                unique.add(item);
            }
        }
        return unique;
    }

    private static Object reverse(Object subject) {
        if (subject instanceof String s) {
            return new StringBuilder(s).reverse().toString();
        }
        List<Object> reversed = new ArrayList<>(list(subject, "reverse"));
        Collections.reverse(reversed);
        return reversed;
    }

    private static Object toInteger(Object subject, List<Object> args) {
        try {
            if (subject instanceof Boolean b) {
                return b ? 1L : 0L;
            }
            if (subject instanceof Number n) {
                return n.longValue();
            }
            String value = text(subject).strip();
            if (value.contains(".") || value.contains("e") || value.contains("E")) {
                return (long) Double.parseDouble(value);
            }
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            if (!args.isEmpty()) {
                return args.get(0);
            }
            throw new ExpressionException("cannot convert '" + text(subject) + "' to an integer", e);
        }
    }

    private static Object toFloat(Object subject, List<Object> args) {
        try {
            if (subject instanceof Boolean b) {
                return b ? 1.0 : 0.0;
            }
            if (subject instanceof Number n) {
                return n.doubleValue();
            }
            return Double.parseDouble(text(subject).strip());
        } catch (NumberFormatException e) {
            if (!args.isEmpty()) {
                return args.get(0);
            }
            throw new ExpressionException("cannot convert '" + text(subject) + "' to a number", e);
        }
    }

    private static boolean toBoolean(Object subject) {
        if (subject instanceof String s) {
            return !FALSE_WORDS.contains(s.strip().toLowerCase(Locale.ROOT));
        }
        return ExpressionValues.isTruthy(subject);
    }

    private static String safeFilename(Object subject) {
        String value = CONTROL_CHARS.matcher(text(subject)).replaceAll("");
        value = UNSAFE_FILENAME_CHARS.matcher(value).replaceAll("_");
        value = stripChars(value, ". ");
        if (value.length() > 255) {
            value = value.substring(0, 255);
        }
        return value.isEmpty() ? "unnamed" : value;
    }

    private static String stripChars(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    private static String truncate(Object subject, List<Object> args) {
        String value = text(subject);
        int length = args.isEmpty() ? 80 : asInt(args.get(0), "truncate");
        String suffix = args.size() > 1 ? text(args.get(1)) : "...";
        if (value.length() <= length) {
            return value;
        }
        return value.substring(0, Math.max(0, length - suffix.length())) + suffix;
    }

    private static String regexReplace(Object subject, List<Object> args) {
        String value = boundedRegexInput(subject, "regex_replace");
        Pattern pattern = compile(text(args.get(0)), "regex_replace");
        try {
            return pattern.matcher(value).replaceAll(translateReplacement(text(args.get(1))));
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new ExpressionException("regex_replace: invalid replacement: " + e.getMessage(), e);
        }
    }

    private static boolean regexMatch(Object subject, List<Object> args) {
        String value = boundedRegexInput(subject, "regex_match");
        return compile(text(args.get(0)), "regex_match").matcher(value).find();
    }

    /**
     * Translates group references written as {@code \1} or {@code \g<name>} into
     * {@link Matcher} syntax and makes a literal {@code $} literal.
     */
    static String translateReplacement(String replacement) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < replacement.length(); i++) {
            char c = replacement.charAt(i);
            if (c == '$') {
                result.append("\\$");
            } else if (c == '\\' && i + 1 < replacement.length()) {
                char next = replacement.charAt(i + 1);
                if (Character.isDigit(next)) {
                    result.append('$').append(next);
                    i++;
                } else if (next == 'g' && replacement.startsWith("<", i + 2) && replacement.indexOf('>', i + 3) > 0) {
                    int close = replacement.indexOf('>', i + 3);
                    String group = replacement.substring(i + 3, close);
                    result.append(group.chars().allMatch(Character::isDigit) ? "$" + group : "${" + group + "}");
                    i = close;
                } else if (next == 'n') {
                    result.append('\n');
                    i++;
                } else if (next == 't') {
                    result.append('\t');
                    i++;
                } else {
                    result.append("\\\\");
                }
            } else if (c == '\\') {
                result.append("\\\\");
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static String boundedRegexInput(Object subject, String filter) {
        String value = text(subject);
        if (value.length() > MAX_REGEX_INPUT) {
            throw new ExpressionException(filter + ": input exceeds " + MAX_REGEX_INPUT + " characters");
        }
        return value;
    }

    private static Pattern compile(String regex, String filter) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ExpressionException(filter + ": invalid pattern: " + e.getDescription(), e);
        }
    }

    private static String base64Decode(Object subject) {
        try {
            return new String(Base64.getDecoder().decode(text(subject).strip()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ExpressionException("b64decode: invalid base64 input", e);
        }
    }

    private static String urlEncode(Object subject) {
        return URLEncoder.encode(text(subject), StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~")
                .replace("%2F", "/");
    }

    private static List<?> list(Object subject, String filter) {
        if (subject instanceof List<?> list) {
            return list;
        }
        if (Undefined.isMissing(subject)) {
            return List.of();
        }
        throw new ExpressionException(filter + " requires a list, got " + ExpressionValues.typeName(subject));
    }

    static int asInt(Object value, String filter) {
        if (value instanceof Number n && ExpressionValues.isIntegral(n)) {
            return Math.toIntExact(n.longValue());
        }
        throw new ExpressionException(filter + " expects an integer argument, got " + ExpressionValues.typeName(value));
    }
}
