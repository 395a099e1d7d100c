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

package dev.mars.stepflow.workflow;

import dev.mars.stepflow.action.CaptureMode;
import dev.mars.stepflow.workflow.guardrail.GuardrailConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a loaded document tree (plain maps and lists) onto the workflow model.
 * Generated step ids are assigned here so the validator and the engine agree on them.
 */
final class WorkflowDocumentMapper {

    private WorkflowDocumentMapper() {
    }

    static WorkflowDefinition toDefinition(Map<String, Object> document, Duration fallbackTimeout)
            throws WorkflowParseException {
        String name = getString(document, "name");
        if (name == null || name.isBlank()) {
            throw new WorkflowParseException("name", "Workflow name is required");
        }
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(name)
                .version(getString(document, "version"))
                .schemaVersion(getString(document, "schema_version"))
                .description(getString(document, "description"))
                .author(getString(document, "author"))
                .guardrails(getMap(document, "guardrails", "guardrails"))
                .fingerprint(WorkflowFingerprint.of(document));

        try {
            builder.shellSafety(WorkflowDefinition.ShellSafety.fromString(getString(document, "shell_safety")));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("shell_safety", e.getMessage());
        }
        builder.defaultTimeout(document.containsKey("default_timeout")
                ? parseTimeout(document.get("default_timeout"), "default_timeout")
                : fallbackTimeout);

        Map<String, Object> inputs = getMap(document, "inputs", "inputs");
        if (inputs != null) {
            for (Map.Entry<String, Object> entry : inputs.entrySet()) {
                builder.input(toInput(entry.getKey(), entry.getValue()));
            }
        }
        Map<String, Object> env = getMap(document, "env", "env");
        if (env != null) {
            env.forEach(builder::env);
        }

        Map<String, Object> jobs = getMap(document, "jobs", "jobs");
        if (jobs == null || jobs.isEmpty()) {
            throw new WorkflowParseException("jobs", "At least one job is required");
        }
        for (Map.Entry<String, Object> entry : jobs.entrySet()) {
            builder.job(toJob(entry.getKey(), entry.getValue()));
        }

        IdAllocator workflowIds = new IdAllocator();
        for (String list : List.of("on_complete", "on_failure", "finally")) {
            workflowIds.reserveDeclared(document.get(list));
        }
        builder.onComplete(toSteps(document.get("on_complete"), "on_complete", workflowIds));
        builder.onFailure(toSteps(document.get("on_failure"), "on_failure", workflowIds));
        builder.finallySteps(toSteps(document.get("finally"), "finally", workflowIds));
        return builder.build();
    }

    private static InputDefinition toInput(String name, Object value) throws WorkflowParseException {
        String path = "inputs." + name;
        InputDefinition.Builder builder = InputDefinition.builder(name);
        if (value == null) {
            return builder.build();
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Input declaration must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) value;
        try {
            builder.type(InputDefinition.InputType.fromString(getString(data, "type")));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".type", e.getMessage());
        }
        if (data.containsKey("required")) {
            builder.required(getBoolean(data, "required", true));
        }
        if (data.containsKey("default")) {
            builder.defaultValue(data.get("default"));
        }
        builder.description(getString(data, "description"))
                .pattern(getString(data, "pattern"))
                .min(getLong(data, "min", path + ".min"))
                .max(getLong(data, "max", path + ".max"))
                .secret(getBoolean(data, "secret", false));
        Object allowed = data.get("enum");
        if (allowed instanceof List) {
            builder.allowedValues(new ArrayList<>((List<?>) allowed));
        }
        return builder.build();
    }

    private static Job toJob(String name, Object value) throws WorkflowParseException {
        String path = "jobs." + name;
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Job must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) value;
        IdAllocator ids = new IdAllocator();
        for (String list : List.of("steps", "on_complete", "on_failure", "finally")) {
            ids.reserveDeclared(data.get(list));
        }
        List<Step> steps = toSteps(data.get("steps"), path + ".steps", ids);
        if (steps.isEmpty()) {
            throw new WorkflowParseException(path + ".steps", "Job must declare at least one step");
        }
        return new Job(name,
                steps,
                toSteps(data.get("on_complete"), path + ".on_complete", ids),
                toSteps(data.get("on_failure"), path + ".on_failure", ids),
                toSteps(data.get("finally"), path + ".finally", ids));
    }

    private static List<Step> toSteps(Object value, String path, IdAllocator ids) throws WorkflowParseException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Expected a list of steps");
        }
        List<?> items = (List<?>) value;
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            String stepPath = path + "[" + i + "]";
            if (!(items.get(i) instanceof Map)) {
                throw new WorkflowParseException(stepPath, "Step must be a mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> data = (Map<String, Object>) items.get(i);
            steps.add(toStep(data, stepPath, ids));
        }
        return steps;
    }

    @SuppressWarnings("unchecked")
    private static Step toStep(Map<String, Object> data, String path, IdAllocator ids) throws WorkflowParseException {
        String declaredId = getString(data, "id");
        String name = getString(data, "name");
        String id = declaredId != null ? declaredId : ids.generate(name);
        if (declaredId != null) {
            ids.reserve(declaredId);
        }

        Step.Builder builder = Step.builder(id)
                .generatedId(declaredId == null)
                .name(name)
                .run(data.get("run"))
                .uses(getString(data, "uses"))
                .with(getMap(data, "with", path + ".with"))
                .condition(getString(data, "if"))
                .loop(data.get("loop") instanceof List ? data.get("loop") : getString(data, "loop"))
                .breakIf(getString(data, "break_if"))
                .continueOnError(getBoolean(data, "continue_on_error", false))
                .onFailure(getString(data, "on_failure"))
                .interactive(getBoolean(data, "interactive", false))
                .idempotent(getBoolean(data, "idempotent", true));

        if (data.containsKey("timeout")) {
            builder.timeout(parseTimeout(data.get("timeout"), path + ".timeout"));
        }
        if (data.containsKey("capture_mode")) {
            try {
                builder.captureMode(CaptureMode.fromString(getString(data, "capture_mode")));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(path + ".capture_mode", e.getMessage());
            }
        }
        if (data.containsKey("max_iterations")) {
            Long max = getLong(data, "max_iterations", path + ".max_iterations");
            if (max != null) {
                builder.maxIterations((int) Math.min(max, Integer.MAX_VALUE));
            }
        }
        Object guardrails = data.get("guardrails");
        if (guardrails != null) {
            if (GuardrailConfig.isDisabledValue(guardrails)) {
                builder.guardrailsDisabled(true);
            } else if (guardrails instanceof Map) {
                builder.guardrails((Map<String, Object>) guardrails);
            } else {
                throw new WorkflowParseException(path + ".guardrails", "Expected a mapping or false");
            }
        }
        if (data.get("retry") instanceof Map) {
            builder.retry(toRetry((Map<String, Object>) data.get("retry"), path + ".retry"));
        }
        return builder.build();
    }

    private static RetryPolicy toRetry(Map<String, Object> data, String path) throws WorkflowParseException {
        Long attempts = getLong(data, "max_attempts", path + ".max_attempts");
        try {
            return new RetryPolicy(attempts != null ? attempts.intValue() : 3,
                    seconds(data.get("delay"), Duration.ofSeconds(1)),
                    data.get("backoff") instanceof Number ? ((Number) data.get("backoff")).doubleValue() : 2.0,
                    seconds(data.get("max_delay"), Duration.ofMinutes(5)));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage());
        }
    }

    private static Duration seconds(Object value, Duration defaultValue) {
        if (value instanceof Number) {
            return Duration.ofMillis((long) (((Number) value).doubleValue() * 1000));
        }
        return defaultValue;
    }

    /**
     * Parses a timeout written as whole seconds or with an {@code s}, {@code m} or
     * {@code h} suffix.
     */
    static Duration parseTimeout(Object value, String path) throws WorkflowParseException {
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        String text = value != null ? value.toString().trim().toLowerCase(Locale.ROOT) : "";
        try {
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1)));
            } else if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1)));
            } else if (text.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Invalid timeout: " + value);
        }
    }

    private static String getString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Expected a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static boolean getBoolean(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private static Long getLong(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Expected an integer, got " + value);
        }
    }

    /**
     * Hands out generated ids for steps without one: the slugified name, or
     * {@code step_<n>}, made unique within the job.
     */
    private static final class IdAllocator {
        private final Set<String> used = new HashSet<>();
        private int counter;

        void reserve(String id) {
            used.add(id);
        }

        void reserveDeclared(Object steps) {
            if (steps instanceof List) {
                for (Object step : (List<?>) steps) {
                    if (step instanceof Map && ((Map<?, ?>) step).get("id") != null) {
                        used.add(((Map<?, ?>) step).get("id").toString());
                    }
                }
            }
        }

        String generate(String name) {
            counter++;
            String base = slug(name);
            if (base.isEmpty()) {
                base = "step_" + counter;
            }
            String candidate = base;
            int suffix = 2;
            while (used.contains(candidate)) {
                candidate = base + "_" + suffix++;
            }
            used.add(candidate);
            return candidate;
        }

        private static String slug(String name) {
            if (name == null) {
                return "";
            }
            String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
            if (!slug.isEmpty() && !Character.isLetter(slug.charAt(0))) {
                slug = "step_" + slug;
            }
            return slug;
        }
    }
}
