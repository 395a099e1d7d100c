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

import java.nio.file.Path;
import java.util.Map;

public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException, WorkflowValidationException;

    WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException, WorkflowValidationException;

    /**
     * Loads the raw document tree without validating it.
     *
     * @param yamlContent the YAML content to load
     * @return the normalised document
     * @throws WorkflowParseException if the content is not a YAML mapping
     */
    Map<String, Object> load(String yamlContent) throws WorkflowParseException;

    /**
     * Validates the YAML content structurally and semantically.
     * Unparseable YAML is reported as an {@code E_YAML} error.
     *
     * @param yamlContent the YAML content to validate
     * @return validation result
     */
    ValidationResult validate(String yamlContent);
}
