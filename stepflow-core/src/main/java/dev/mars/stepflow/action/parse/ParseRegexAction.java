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


package dev.mars.stepflow.action.parse;

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.Values;
import dev.mars.stepflow.core.exceptions.ActionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches a regular expression against {@code with.input}.
 *
 * <p>With {@code with.mode: first} the output {@code match} holds the first match;
 * with {@code all} (default) {@code matches} holds every match and {@code count}
 * their number. When the pattern has named groups each match is a mapping of
 * group name to text, otherwise the whole matched text.</p>
 */
public class ParseRegexAction implements WorkflowAction {

    public static final String ACTION_ID = "parse/regex";

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public boolean isInline() {
        return true;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        if (!params.has("input")) {
            throw params.invalid("'input' is required");
        }
        String expression = params.requireString("pattern");
        String mode = params.getString("mode", "all");
        if (!mode.equals("first") && !mode.equals("all")) {
            throw params.invalid("mode must be one of first, all");
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(expression);
        } catch (PatternSyntaxException e) {
            throw params.invalid("Invalid regex pattern: " + e.getDescription());
        }
        List<String> groupNames = groupNames(expression);
        Matcher matcher = pattern.matcher(Values.asText(params.get("input")));

        Map<String, Object> outputs = new LinkedHashMap<>();
        if (mode.equals("first")) {
            outputs.put("match", matcher.find() ? toMatch(matcher, groupNames) : null);
            return ActionResult.of(outputs);
        }
        List<Object> matches = new ArrayList<>();
        while (matcher.find()) {
            matches.add(toMatch(matcher, groupNames));
        }
        outputs.put("matches", matches);
        outputs.put("count", (long) matches.size());
        return ActionResult.of(outputs);
    }

    private static Object toMatch(Matcher matcher, List<String> groupNames) {
        if (groupNames.isEmpty()) {
            return matcher.group();
        }
        Map<String, Object> groups = new LinkedHashMap<>();
        for (String name : groupNames) {
            groups.put(name, matcher.group(name));
        }
        return groups;
    }

    private static List<String> groupNames(String expression) {
        List<String> names = new ArrayList<>();
        Matcher matcher = GROUP_NAME.matcher(expression);
        while (matcher.find()) {
            if (!names.contains(matcher.group(1))) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }
}
