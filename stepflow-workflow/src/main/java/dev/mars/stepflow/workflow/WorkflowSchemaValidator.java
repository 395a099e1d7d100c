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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.mars.stepflow.action.ActionRegistry;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.workflow.expression.EvaluationContext;
import dev.mars.stepflow.workflow.expression.ExpressionAnalyzer;
import dev.mars.stepflow.workflow.expression.ExpressionException;
import dev.mars.stepflow.workflow.expression.ExpressionNode;
import dev.mars.stepflow.workflow.expression.ExpressionParser;
import dev.mars.stepflow.workflow.expression.FilterRegistry;
import dev.mars.stepflow.workflow.expression.Template;
import dev.mars.stepflow.workflow.guardrail.GuardrailConfig;
import dev.mars.stepflow.workflow.guardrail.ScannerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates workflow documents in two passes: the structural shape against the
 * bundled JSON schema, then the semantic rules (ids, references, expressions,
 * inputs, jump targets, guardrails and shell safety).
 *
 * <p>All problems are collected into a {@link ValidationResult}; nothing is
 * thrown for an invalid document.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowSchemaValidator {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowSchemaValidator.class);

    public static final String SCHEMA_RESOURCE = "/schema/workflow-schema.json";

    public static final String E_SCHEMA = "E_SCHEMA";
    public static final String E_STRUCTURE = "E_STRUCTURE";
    public static final String E_SCHEMA_VERSION = "E_SCHEMA_VERSION";
    public static final String E_DUPLICATE_ID = "E_DUPLICATE_ID";
    public static final String E_RESERVED_ID = "E_RESERVED_ID";
    public static final String E_RUN_USES = "E_RUN_USES";
    public static final String E_UNKNOWN_ACTION = "E_UNKNOWN_ACTION";
    public static final String E_TIMEOUT_RANGE = "E_TIMEOUT_RANGE";
    public static final String E_MAX_ITERATIONS = "E_MAX_ITERATIONS";
    public static final String E_EXPRESSION_SYNTAX = "E_EXPRESSION_SYNTAX";
    public static final String E_UNKNOWN_ROOT = "E_UNKNOWN_ROOT";
    public static final String E_UNKNOWN_FILTER = "E_UNKNOWN_FILTER";
    public static final String E_UNKNOWN_FUNCTION = "E_UNKNOWN_FUNCTION";
    public static final String E_ENV_REFERENCE = "E_ENV_REFERENCE";
    public static final String E_ENV_CYCLE = "E_ENV_CYCLE";
    public static final String E_UNKNOWN_STEP = "E_UNKNOWN_STEP";
    public static final String E_FORWARD_REFERENCE = "E_FORWARD_REFERENCE";
    public static final String E_JUMP_TARGET = "E_JUMP_TARGET";
    public static final String E_GUARDRAIL_SCANNER = "E_GUARDRAIL_SCANNER";
    public static final String E_GUARDRAIL_ON_FAIL = "E_GUARDRAIL_ON_FAIL";
    public static final String E_INPUT = "E_INPUT";
    public static final String E_SHELL_INJECTION = "E_SHELL_INJECTION";
    public static final String W_SHELL_INJECTION = "W_SHELL_INJECTION";
    public static final String W_LOOP_MODIFIER = "W_LOOP_MODIFIER";
    public static final String W_LOOP_CONTEXT = "W_LOOP_CONTEXT";
    public static final String W_ERROR_CONTEXT = "W_ERROR_CONTEXT";
    public static final String W_HARDCODED_SECRET = "W_HARDCODED_SECRET";

    private static final Set<String> SUPPORTED_SCHEMA_VERSIONS = Set.of("1.0", "1");
    private static final Set<String> ENV_ROOTS = Set.of("inputs", "env", "secrets");
    private static final Pattern STEP_ID = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_-]*$");
    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("(?i)(password|passwd|secret|api[_-]?key|token)\\s*[=:]\\s*['\"]?[A-Za-z0-9/+_-]{8,}"),
            Pattern.compile("AKIA[0-9A-Z]{16}"),
            Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----"));

    private static volatile JsonSchema schema;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ActionRegistry actionRegistry;
    private final ScannerRegistry scannerRegistry;
    private final FilterRegistry filterRegistry;
    private final Duration defaultTimeout;
    private final long maxTimeoutSeconds;

    /**
     * Validator without action or scanner registries: unknown action ids and
     * scanner names are not reported.
     */
    public WorkflowSchemaValidator() {
        this(null, null, new StepflowConfiguration());
    }

    public WorkflowSchemaValidator(ActionRegistry actionRegistry, ScannerRegistry scannerRegistry,
                                   StepflowConfiguration configuration) {
        this(actionRegistry, scannerRegistry, FilterRegistry.defaults(), configuration);
    }

    public WorkflowSchemaValidator(ActionRegistry actionRegistry, ScannerRegistry scannerRegistry,
                                   FilterRegistry filterRegistry, StepflowConfiguration configuration) {
        this.actionRegistry = actionRegistry;
        this.scannerRegistry = scannerRegistry;
        this.filterRegistry = filterRegistry;
        this.defaultTimeout = configuration.getDefaultStepTimeout();
        this.maxTimeoutSeconds = configuration.getMaxStepTimeoutSeconds();
    }

    /**
     * The draft-07 JSON schema describing the document grammar.
     */
    public static JsonSchema getSchema() {
        JsonSchema loaded = schema;
        if (loaded == null) {
            synchronized (WorkflowSchemaValidator.class) {
                loaded = schema;
                if (loaded == null) {
                    try (InputStream in = WorkflowSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (in == null) {
                            throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
                        }
                        loaded = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(in);
                        schema = loaded;
                    } catch (IOException e) {
                        throw new IllegalStateException("Failed to load " + SCHEMA_RESOURCE, e);
                    }
                }
            }
        }
        return loaded;
    }

    /**
     * Validates a loaded document tree.
     */
    public ValidationResult validate(Map<String, Object> document) {
        ValidationResult result = new ValidationResult();
        validateStructure(document, result);
        if (!result.isValid()) {
            return result;
        }
        WorkflowDefinition definition;
        try {
            definition = WorkflowDocumentMapper.toDefinition(document, defaultTimeout);
        } catch (WorkflowParseException e) {
            result.addError(E_STRUCTURE, e.getFieldPath(), e.getMessage());
            return result;
        } catch (IllegalArgumentException e) {
            result.addError(E_STRUCTURE, null, e.getMessage());
            return result;
        }
        result.merge(validate(definition));
        return result;
    }

    /**
     * Runs the semantic checks on an already built definition.
     */
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (!SUPPORTED_SCHEMA_VERSIONS.contains(definition.getSchemaVersion())) {
            result.addError(E_SCHEMA_VERSION, "schema_version",
                    "Unsupported schema_version '" + definition.getSchemaVersion() + "', expected "
                            + WorkflowDefinition.SUPPORTED_SCHEMA_VERSION);
        }
        validateInputs(definition, result);
        validateEnv(definition, result);

        Map<String, Set<String>> jobStepIds = new HashMap<>();
        Set<String> earlierJobIds = new LinkedHashSet<>();
        for (Job job : definition.getJobs().values()) {
            Set<String> ids = validateStepIds("jobs." + job.getName(), job.getAllSteps(), result);
            jobStepIds.put(job.getName(), ids);
            Set<String> known = new LinkedHashSet<>(earlierJobIds);
            known.addAll(ids);

            Set<String> visible = new LinkedHashSet<>(earlierJobIds);
            String prefix = "jobs." + job.getName();
            validateStepList(definition, prefix + ".steps", job.getSteps(), visible, known, false, result);
            Set<String> afterMain = new LinkedHashSet<>(visible);
            addIds(afterMain, job.getSteps());
            validateStepList(definition, prefix + ".on_complete", job.getOnComplete(),
                    new LinkedHashSet<>(afterMain), known, false, result);
            validateStepList(definition, prefix + ".on_failure", job.getOnFailure(),
                    new LinkedHashSet<>(afterMain), known, true, result);
            Set<String> beforeFinally = new LinkedHashSet<>(afterMain);
            addIds(beforeFinally, job.getOnComplete());
            addIds(beforeFinally, job.getOnFailure());
            validateStepList(definition, prefix + ".finally", job.getFinally(), beforeFinally, known, true, result);

            earlierJobIds.addAll(ids);
        }

        Set<String> workflowIds = validateStepIds("workflow", definition.getWorkflowHookSteps(), result);
        Set<String> known = new LinkedHashSet<>(earlierJobIds);
        known.addAll(workflowIds);
        validateStepList(definition, "on_complete", definition.getOnComplete(),
                new LinkedHashSet<>(earlierJobIds), known, false, result);
        validateStepList(definition, "on_failure", definition.getOnFailure(),
                new LinkedHashSet<>(earlierJobIds), known, true, result);
        Set<String> beforeFinally = new LinkedHashSet<>(earlierJobIds);
        addIds(beforeFinally, definition.getOnComplete());
        addIds(beforeFinally, definition.getOnFailure());
        validateStepList(definition, "finally", definition.getFinally(), beforeFinally, known, true, result);

        validateGuardrailConfig("guardrails", definition.getGuardrails(), result);

        logger.debug("Validated workflow '{}': {} errors, {} warnings", definition.getName(),
                result.getErrorCount(), result.getWarningCount());
        return result;
    }

    private void validateStructure(Map<String, Object> document, ValidationResult result) {
        JsonNode node = objectMapper.valueToTree(document);
        Set<ValidationMessage> messages = getSchema().validate(node);
        for (ValidationMessage message : messages) {
            result.addError(E_SCHEMA, null, message.getMessage());
        }
    }

    private void validateInputs(WorkflowDefinition definition, ValidationResult result) {
        for (InputDefinition input : definition.getInputs().values()) {
            String path = "inputs." + input.getName();
            InputDefinition.InputType type = input.getType();
            Pattern pattern = null;
            if (input.getPattern() != null) {
                if (type != InputDefinition.InputType.STRING) {
                    result.addError(E_INPUT, path + ".pattern", "'pattern' is only allowed on string inputs");
                } else {
                    try {
                        pattern = Pattern.compile(input.getPattern());
                    } catch (PatternSyntaxException e) {
                        result.addError(E_INPUT, path + ".pattern",
                                "Invalid regular expression: " + e.getDescription());
                    }
                }
            }
            if ((input.getMin() != null || input.getMax() != null) && type != InputDefinition.InputType.INTEGER) {
                result.addError(E_INPUT, path, "'min' and 'max' are only allowed on integer inputs");
            }
            if (input.getMin() != null && input.getMax() != null && input.getMin() > input.getMax()) {
                result.addError(E_INPUT, path, "'min' is greater than 'max'");
            }
            if (input.hasDefault() && input.getDefaultValue() != null) {
                String problem = checkDefault(input, pattern);
                if (problem != null) {
                    result.addError(E_INPUT, path + ".default", problem);
                }
            }
        }
    }

    private static String checkDefault(InputDefinition input, Pattern pattern) {
        Object value = input.getDefaultValue();
        switch (input.getType()) {
            case INTEGER:
                if (!(value instanceof Long)) {
                    return "Default must be an integer";
                }
                long number = (Long) value;
                if (input.getMin() != null && number < input.getMin()) {
                    return "Default " + number + " is below min " + input.getMin();
                }
                if (input.getMax() != null && number > input.getMax()) {
                    return "Default " + number + " is above max " + input.getMax();
                }
                break;
            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    return "Default must be a boolean";
                }
                break;
            default:
                if (!(value instanceof String)) {
                    return "Default must be a string";
                }
                if (pattern != null && !pattern.matcher((String) value).matches()) {
                    return "Default does not match pattern " + pattern.pattern();
                }
                break;
        }
        if (!input.getAllowedValues().isEmpty() && !input.getAllowedValues().contains(value)) {
            return "Default is not one of " + input.getAllowedValues();
        }
        return null;
    }

    private void validateEnv(WorkflowDefinition definition, ValidationResult result) {
        Map<String, Set<String>> envDependencies = new HashMap<>();
        for (Map.Entry<String, Object> entry : definition.getEnv().entrySet()) {
            String path = "env." + entry.getKey();
            if (!(entry.getValue() instanceof String) || !Template.containsExpression((String) entry.getValue())) {
                continue;
            }
            String template = (String) entry.getValue();
            ExpressionAnalyzer.References references = analyze(template, false, path, result);
            if (references == null) {
                continue;
            }
            for (String root : references.getRoots()) {
                if (EvaluationContext.ROOTS.contains(root) && !ENV_ROOTS.contains(root)) {
                    result.addError(E_ENV_REFERENCE, path,
                            "env values may only reference inputs, env and secrets, found '" + root + "'");
                }
            }
            envDependencies.put(entry.getKey(), envReferences(template));
        }
        for (Map.Entry<String, Set<String>> entry : envDependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!definition.getEnv().containsKey(dependency)) {
                    result.addError(E_ENV_REFERENCE, "env." + entry.getKey(),
                            "Unknown env variable '" + dependency + "'");
                }
            }
        }
        Set<String> reported = new HashSet<>();
        for (String key : envDependencies.keySet()) {
            if (!reported.contains(key) && reachesItself(key, envDependencies)) {
                reported.add(key);
                result.addError(E_ENV_CYCLE, "env." + key, "env variable '" + key + "' depends on itself");
            }
        }
    }

    private static Set<String> envReferences(String template) {
        Set<String> names = new LinkedHashSet<>();
        for (Template.Segment segment : Template.split(template)) {
            if (segment.expression()) {
                collectEnvNames(ExpressionParser.parse(segment.text()), names);
            }
        }
        return names;
    }

    private static void collectEnvNames(ExpressionNode node, Set<String> names) {
        if (node instanceof ExpressionNode.Attribute attribute
                && attribute.target() instanceof ExpressionNode.Identifier identifier
                && identifier.name().equals("env")) {
            names.add(attribute.name());
        }
        node.children().forEach(child -> collectEnvNames(child, names));
    }

    private static boolean reachesItself(String start, Map<String, Set<String>> graph) {
        Set<String> seen = new HashSet<>();
        List<String> pending = new ArrayList<>(graph.getOrDefault(start, Set.of()));
        while (!pending.isEmpty()) {
            String current = pending.remove(pending.size() - 1);
            if (current.equals(start)) {
                return true;
            }
            if (seen.add(current)) {
                pending.addAll(graph.getOrDefault(current, Set.of()));
            }
        }
        return false;
    }

    private Set<String> validateStepIds(String scope, List<Step> steps, ValidationResult result) {
        Set<String> ids = new LinkedHashSet<>();
        for (Step step : steps) {
            String id = step.getId();
            if (!ids.add(id)) {
                result.addError(E_DUPLICATE_ID, scope, "Duplicate step id '" + id + "'");
            }
            if (id.startsWith("__") || EvaluationContext.ROOTS.contains(id)) {
                result.addError(E_RESERVED_ID, scope, "Step id '" + id + "' is reserved");
            } else if (!step.isGeneratedId() && !STEP_ID.matcher(id).matches()) {
                result.addError(E_RESERVED_ID, scope, "Step id '" + id + "' must match " + STEP_ID.pattern());
            }
        }
        return ids;
    }

    private void validateStepList(WorkflowDefinition definition, String listPath, List<Step> steps,
                                  Set<String> visible, Set<String> known, boolean handlerList,
                                  ValidationResult result) {
        Set<String> jumpTargets = new HashSet<>();
        for (Step step : steps) {
            if (step.getOnFailure() != null) {
                jumpTargets.add(step.getOnFailure());
            }
        }
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            String path = listPath + "[" + i + "]";
            boolean handler = handlerList || jumpTargets.contains(step.getId());
            validateStep(definition, step, path, steps, i, visible, known, handler, result);
            visible.add(step.getId());
        }
    }

    private void validateStep(WorkflowDefinition definition, Step step, String path, List<Step> siblings,
                              int index, Set<String> visible, Set<String> known, boolean handler,
                              ValidationResult result) {
        boolean hasRun = step.getRun() != null;
        boolean hasUses = step.getUses() != null;
        if (hasRun == hasUses) {
            result.addError(E_RUN_USES, path, hasRun
                    ? "Step '" + step.getId() + "' declares both 'run' and 'uses'"
                    : "Step '" + step.getId() + "' must declare 'run' or 'uses'");
        }
        if (actionRegistry != null && hasUses && !actionRegistry.isSupported(step.getUses())) {
            result.addError(E_UNKNOWN_ACTION, path + ".uses", "Unknown action '" + step.getUses() + "'");
        }
        if (step.getTimeout() != null) {
            long seconds = step.getTimeout().getSeconds();
            if (seconds < 1 || seconds > maxTimeoutSeconds) {
                result.addError(E_TIMEOUT_RANGE, path + ".timeout",
                        "Timeout must be between 1 and " + maxTimeoutSeconds + " seconds");
            }
        }
        if (step.getMaxIterations() < 0) {
            result.addError(E_MAX_ITERATIONS, path + ".max_iterations", "max_iterations must be at least 1");
        }
        if (!step.isLoop() && (step.getBreakIf() != null || step.isContinueOnError())) {
            result.addWarning(W_LOOP_MODIFIER, path,
                    "'break_if' and 'continue_on_error' have no effect without 'loop'");
        }

        Set<String> before = new LinkedHashSet<>(visible);
        List<LocatedReferences> stepReferences = new ArrayList<>();
        if (step.getCondition() != null) {
            addIfPresent(stepReferences, path + ".if", analyze(step.getCondition(), true, path + ".if", result));
        }
        if (step.getLoop() instanceof String) {
            addIfPresent(stepReferences, path + ".loop",
                    analyze((String) step.getLoop(), true, path + ".loop", result));
        } else if (step.getLoop() instanceof List) {
            analyzeValue(step.getLoop(), path + ".loop", stepReferences, result);
        }
        analyzeValue(step.getRun(), path + ".run", stepReferences, result);
        analyzeValue(step.getWith(), path + ".with", stepReferences, result);
        checkReferences(step, stepReferences, before, known, handler, result);

        if (step.getBreakIf() != null) {
            ExpressionAnalyzer.References breakRefs = analyze(step.getBreakIf(), true, path + ".break_if", result);
            if (breakRefs != null) {
                Set<String> withSelf = new LinkedHashSet<>(before);
                withSelf.add(step.getId());
                checkReferences(step, List.of(new LocatedReferences(path + ".break_if", breakRefs)), withSelf,
                        known, handler, result);
            }
        }

        if (step.getOnFailure() != null) {
            checkJumpTarget(step.getOnFailure(), path + ".on_failure", siblings, index, result);
        }
        validateStepGuardrails(definition, step, path, siblings, index, result);
        checkShellSafety(definition, step, path, result);
        checkHardcodedSecrets(step, path, result);
    }

    /**
     * References found in one expression, with the field path they were read from.
     */
    private record LocatedReferences(String path, ExpressionAnalyzer.References references) {
    }

    private static void addIfPresent(List<LocatedReferences> list, String path, ExpressionAnalyzer.References refs) {
        if (refs != null) {
            list.add(new LocatedReferences(path, refs));
        }
    }

    private void analyzeValue(Object value, String path, List<LocatedReferences> out,
                              ValidationResult result) {
        if (value instanceof String) {
            if (Template.containsExpression((String) value)) {
                addIfPresent(out, path, analyze((String) value, false, path, result));
            }
        } else if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                analyzeValue(entry.getValue(), path + "." + entry.getKey(), out, result);
            }
        } else if (value instanceof List) {
            List<?> list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                analyzeValue(list.get(i), path + "[" + i + "]", out, result);
            }
        }
    }

    /**
     * Parses and inspects an expression, reporting syntax errors, unknown roots,
     * filters and functions. Returns {@code null} when it does not parse.
     */
    private ExpressionAnalyzer.References analyze(String text, boolean bare, String path, ValidationResult result) {
        ExpressionAnalyzer.References references;
        try {
            references = bare ? ExpressionAnalyzer.analyzeBare(text) : ExpressionAnalyzer.analyzeTemplate(text);
        } catch (ExpressionException e) {
            result.addError(E_EXPRESSION_SYNTAX, path, e.getMessage());
            return null;
        }
        for (String root : references.getRoots()) {
            if (!EvaluationContext.ROOTS.contains(root)) {
                result.addError(E_UNKNOWN_ROOT, path, "Unknown identifier '" + root + "', expected one of "
                        + new TreeSet<>(EvaluationContext.ROOTS));
            }
        }
        for (String filter : references.getFilters()) {
            if (!filterRegistry.contains(filter)) {
                result.addError(E_UNKNOWN_FILTER, path, "Unknown filter '" + filter + "'");
            }
        }
        for (String function : references.getFunctions()) {
            if (!function.equals("now") && !filterRegistry.contains(function)) {
                result.addError(E_UNKNOWN_FUNCTION, path, "Unknown function '" + function + "'");
            }
        }
        return references;
    }

    private void checkReferences(Step step, List<LocatedReferences> references, Set<String> visible,
                                 Set<String> known, boolean handler, ValidationResult result) {
        for (LocatedReferences located : references) {
            String path = located.path();
            ExpressionAnalyzer.References refs = located.references();
            for (String id : refs.getSteps()) {
                if (!known.contains(id)) {
                    result.addError(E_UNKNOWN_STEP, path, "Reference to unknown step '" + id + "'");
                } else if (!visible.contains(id)) {
                    result.addError(E_FORWARD_REFERENCE, path, "Step '" + step.getId()
                            + "' references step '" + id + "' which has not necessarily run yet");
                }
            }
            if (refs.getRoots().contains("loop") && !step.isLoop()) {
                result.addWarning(W_LOOP_CONTEXT, path, "'loop' is undefined outside a loop step");
            }
            if (refs.getRoots().contains("error") && !handler) {
                result.addWarning(W_ERROR_CONTEXT, path, "'error' is only defined inside failure handlers");
            }
        }
    }

    private static void checkJumpTarget(String target, String path, List<Step> siblings, int index,
                                        ValidationResult result) {
        for (int i = 0; i < siblings.size(); i++) {
            Step candidate = siblings.get(i);
            if (!candidate.getId().equals(target)) {
                continue;
            }
            if (candidate.isGeneratedId()) {
                result.addError(E_JUMP_TARGET, path, "Jump target '" + target + "' has no declared id");
            } else if (i <= index) {
                result.addError(E_JUMP_TARGET, path, "Jump target '" + target
                        + "' must come after the failing step");
            }
            return;
        }
        result.addError(E_JUMP_TARGET, path, "Jump target '" + target + "' is not a step of the same list");
    }

    private void validateStepGuardrails(WorkflowDefinition definition, Step step, String path,
                                        List<Step> siblings, int index, ValidationResult result) {
        if (step.getGuardrails() != null) {
            validateGuardrailConfig(path + ".guardrails", step.getGuardrails(), result);
        }
        GuardrailConfig effective = GuardrailConfig.effective(definition.getGuardrails(), step);
        if (effective.isEmpty() || !effective.isJumpOnFail()) {
            return;
        }
        String target = effective.getOnFail();
        ValidationResult jumpResult = new ValidationResult();
        checkJumpTarget(target, path + ".guardrails.on_fail", siblings, index, jumpResult);
        for (ValidationResult.ValidationIssue issue : jumpResult.getErrors()) {
            result.addError(E_GUARDRAIL_ON_FAIL, issue.getFieldPath(), issue.getMessage());
        }
    }

    private void validateGuardrailConfig(String path, Map<String, Object> config, ValidationResult result) {
        if (config == null || config.isEmpty()) {
            return;
        }
        GuardrailConfig parsed;
        try {
            parsed = GuardrailConfig.fromMap(config);
        } catch (IllegalArgumentException e) {
            result.addError(E_GUARDRAIL_SCANNER, path, e.getMessage());
            return;
        }
        if (scannerRegistry == null) {
            return;
        }
        for (String scanner : parsed.getScannerNames()) {
            if (!scannerRegistry.isRegistered(scanner)) {
                result.addError(E_GUARDRAIL_SCANNER, path, "Unknown guardrail scanner '" + scanner + "'");
            }
        }
    }

    private static void checkShellSafety(WorkflowDefinition definition, Step step, String path,
                                         ValidationResult result) {
        if (!step.isShellForm() || definition.getShellSafety() == WorkflowDefinition.ShellSafety.AUTO_QUOTE) {
            return;
        }
        String command = (String) step.getRun();
        List<Template.Segment> segments;
        try {
            segments = Template.split(command);
        } catch (ExpressionException e) {
            logger.debug("Skipping shell safety check at {}: {}", path, e.getMessage());
            return;
        }
        for (Template.Segment segment : segments) {
            if (!segment.expression() || ExpressionAnalyzer.isShellQuoted(segment.text())) {
                continue;
            }
            String message = "Unquoted interpolation '${{ " + segment.text()
                    + " }}' in shell command; use '| shell_quote'"
                    + " or the list form of 'run'";
            if (definition.getShellSafety() == WorkflowDefinition.ShellSafety.STRICT) {
                result.addError(E_SHELL_INJECTION, path + ".run", message);
            } else {
                result.addWarning(W_SHELL_INJECTION, path + ".run", message);
            }
        }
    }

    private static void checkHardcodedSecrets(Step step, String path, ValidationResult result) {
        List<String> texts = new ArrayList<>();
        if (step.getRun() instanceof String) {
            texts.add((String) step.getRun());
        } else if (step.getRun() instanceof List) {
            ((List<?>) step.getRun()).forEach(token -> texts.add(String.valueOf(token)));
        }
        step.getWith().values().forEach(value -> {
            if (value instanceof String) {
                texts.add((String) value);
            }
        });
        for (String text : texts) {
            for (Pattern pattern : SECRET_PATTERNS) {
                if (pattern.matcher(text).find()) {
                    result.addWarning(W_HARDCODED_SECRET, path,
                            "Possible hardcoded secret; pass it through inputs or secrets instead");
                    return;
                }
            }
        }
    }

    private static void addIds(Set<String> target, List<Step> steps) {
        for (Step step : steps) {
            target.add(step.getId());
        }
    }
}
