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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.core.Values;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses JSON text and extracts named values from it.
 *
 * <p>Each entry of {@code with.queries} maps an output name to a path such as
 * {@code items[0].name}. A path that does not match yields the entry of
 * {@code with.defaults} with the same name, or {@code null}. The whole document
 * is returned as {@code parsed}.</p>
 */
public class ParseJsonAction implements WorkflowAction {

    private static final Logger logger = LoggerFactory.getLogger(ParseJsonAction.class);

    public static final String ACTION_ID = "parse/json";

    private static final Pattern SEGMENT = Pattern.compile("([^.\\[\\]]+)|\\[(\\d+)]");

    private final ObjectMapper objectMapper = new ObjectMapper();

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
        Object data = parse(params.get("input"));
        Map<String, Object> defaults = params.getMap("defaults");

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("parsed", data);
        for (Map.Entry<String, Object> query : params.getMap("queries").entrySet()) {
            String name = query.getKey();
            Object value = query.getValue() != null ? extract(data, query.getValue().toString()) : null;
            if (value == null) {
                logger.debug("Query '{}' matched nothing", name);
                value = Values.normalize(defaults.get(name));
            }
            outputs.put(name, value);
        }
        return ActionResult.of(outputs);
    }

    private Object parse(Object input) throws ActionException {
        if (!(input instanceof String)) {
            return Values.normalize(input);
        }
        try {
            return Values.normalize(objectMapper.readValue((String) input, Object.class));
        } catch (JsonProcessingException e) {
            String text = (String) input;
            throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION,
                    "Invalid JSON: " + e.getOriginalMessage(),
                    Map.of("raw", text.length() > 200 ? text.substring(0, 200) : text));
        }
    }

    /**
     * Walks a dotted path with optional list indexes. Returns {@code null} when any
     * segment is missing.
     */
    static Object extract(Object data, String path) {
        String trimmed = path.trim();
        if (trimmed.isEmpty() || trimmed.equals("@")) {
            return data;
        }
        Object current = data;
        Matcher matcher = SEGMENT.matcher(trimmed);
        int consumed = 0;
        while (matcher.find()) {
            String between = trimmed.substring(consumed, matcher.start());
            if (!between.isEmpty() && !between.equals(".")) {
                return null;
            }
            consumed = matcher.end();
            if (matcher.group(1) != null) {
                if (!(current instanceof Map)) {
                    return null;
                }
                current = ((Map<?, ?>) current).get(matcher.group(1));
            } else {
                if (!(current instanceof List)) {
                    return null;
                }
                List<?> list = (List<?>) current;
                int index = Integer.parseInt(matcher.group(2));
                current = index < list.size() ? list.get(index) : null;
            }
            if (current == null) {
                return null;
            }
        }
        return consumed == trimmed.length() ? current : null;
    }
}
