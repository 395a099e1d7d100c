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

import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML workflow documents using SnakeYAML's safe constructor, validates
 * them with a {@link WorkflowSchemaValidator} and maps them to the immutable model.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {
    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    public static final String E_YAML = "E_YAML";

    private static final int MAX_ALIASES = 50;

    private final WorkflowSchemaValidator validator;
    private final Duration defaultTimeout;

    public YamlWorkflowDefinitionParser() {
        this(new WorkflowSchemaValidator(), new StepflowConfiguration());
    }

    public YamlWorkflowDefinitionParser(WorkflowSchemaValidator validator, StepflowConfiguration configuration) {
        this.validator = validator;
        this.defaultTimeout = configuration.getDefaultStepTimeout();
    }

    @Override
    public WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException, WorkflowValidationException {
        String content;
        try {
            content = Files.readString(yamlFile);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
        return parseFromString(content);
    }

    @Override
    public WorkflowDefinition parseFromString(String yamlContent)
            throws WorkflowParseException, WorkflowValidationException {
        Map<String, Object> document = load(yamlContent);
        ValidationResult result = validator.validate(document);
        String name = document.get("name") != null ? String.valueOf(document.get("name")) : "<unnamed>";
        if (!result.isValid()) {
            throw new WorkflowValidationException(name, result);
        }
        for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
            logger.warn("Workflow '{}': {}", name, warning);
        }
        return WorkflowDocumentMapper.toDefinition(document, defaultTimeout);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> load(String yamlContent) throws WorkflowParseException {
        Object data;
        try {
            data = newYaml().load(yamlContent);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            int line = mark != null ? mark.getLine() + 1 : -1;
            throw new WorkflowParseException(line, null, "YAML parsing failed: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Workflow document must be a mapping");
        }
        return Values.normalizeMap((Map<String, ?>) data);
    }

    @Override
    public ValidationResult validate(String yamlContent) {
        ValidationResult result = new ValidationResult();
        Map<String, Object> document;
        try {
            document = load(yamlContent);
        } catch (WorkflowParseException e) {
            result.addError(E_YAML, null, e.getMessage());
            return result;
        }
        result.merge(validator.validate(document));
        return result;
    }

    // Yaml instances are not thread-safe
    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }
}
