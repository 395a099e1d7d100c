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

import dev.mars.stepflow.action.ActionRegistry;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.workflow.guardrail.ScannerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the structural and semantic checks of WorkflowSchemaValidator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class WorkflowSchemaValidatorTest {

    private YamlWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        StepflowConfiguration configuration = new StepflowConfiguration();
        WorkflowSchemaValidator validator = new WorkflowSchemaValidator(
                ActionRegistry.withBuiltins(configuration, null, null), ScannerRegistry.withBuiltins(), configuration);
        parser = new YamlWorkflowDefinitionParser(validator, configuration);
    }

    private ValidationResult validate(String yaml) {
        return parser.validate(yaml);
    }

    private static String singleStep(String stepBody) {
        return "name: test\njobs:\n  main:\n    steps:\n      - " + stepBody.replace("\n", "\n        ") + "\n";
    }

    // ========== Structure ==========

    @Test
    void testMinimalWorkflowIsValid() {
        ValidationResult result = validate(singleStep("run: echo hello"));

        assertTrue(result.isValid(), result.toString());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testSchemaRejectsUnknownKeys() {
        ValidationResult result = validate("name: test\nstages: {}\njobs:\n  main:\n    steps:\n      - run: echo\n");

        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_SCHEMA));
    }

    @Test
    void testSchemaRequiresJobs() {
        assertTrue(validate("name: test\n").hasErrorCode(WorkflowSchemaValidator.E_SCHEMA));
        assertTrue(validate("name: test\njobs:\n  main:\n    steps: []\n")
                .hasErrorCode(WorkflowSchemaValidator.E_SCHEMA));
    }

    @Test
    void testUnsupportedSchemaVersion() {
        ValidationResult result = validate("schema_version: '2.0'\n" + singleStep("run: echo"));

        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_SCHEMA_VERSION));
    }

    // ========== Steps ==========

    @Test
    void testRunAndUsesAreExclusive() {
        assertTrue(validate(singleStep("run: echo\nuses: state/set"))
                .hasErrorCode(WorkflowSchemaValidator.E_RUN_USES));
        assertTrue(validate(singleStep("name: nothing"))
                .hasErrorCode(WorkflowSchemaValidator.E_RUN_USES));
    }

    @Test
    void testUnknownAction() {
        ValidationResult result = validate(singleStep("uses: deploy/kubernetes"));

        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_UNKNOWN_ACTION));
    }

    @Test
    void testDuplicateAndReservedIds() {
        String yaml = """
                name: test
                jobs:
                  main:
                    steps:
                      - id: build
                        run: make
                      - id: build
                        run: make again
                      - id: inputs
                        run: echo
                """;

        ValidationResult result = validate(yaml);

        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_DUPLICATE_ID));
        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_RESERVED_ID));
    }

    @Test
    void testTimeoutRange() {
        assertTrue(validate(singleStep("run: echo\ntimeout: 48h"))
                .hasErrorCode(WorkflowSchemaValidator.E_TIMEOUT_RANGE));
        assertTrue(validate(singleStep("run: echo\ntimeout: 10m")).isValid());
    }

    @Test
    void testLoopModifiersWithoutLoopWarn() {
        ValidationResult result = validate(singleStep("run: echo\nbreak_if: 'true'"));

        assertTrue(result.isValid());
        assertTrue(result.hasWarningCode(WorkflowSchemaValidator.W_LOOP_MODIFIER));
    }

    @Test
    void testLoopContextOutsideLoopWarns() {
        ValidationResult result = validate(singleStep("run: \"echo ${{ loop.item | shell_quote }}\""));

        assertTrue(result.hasWarningCode(WorkflowSchemaValidator.W_LOOP_CONTEXT));
    }

    // ========== Expressions ==========

    @Test
    void testExpressionProblems() {
        assertTrue(validate(singleStep("run: echo\nif: 'inputs.a =='"))
                .hasErrorCode(WorkflowSchemaValidator.E_EXPRESSION_SYNTAX));
        assertTrue(validate(singleStep("run: echo\nif: 'context.user'"))
                .hasErrorCode(WorkflowSchemaValidator.E_UNKNOWN_ROOT));
        assertTrue(validate(singleStep("run: echo\nif: \"inputs.a | shout\""))
                .hasErrorCode(WorkflowSchemaValidator.E_UNKNOWN_FILTER));
        assertTrue(validate(singleStep("run: echo\nif: 'shout(inputs.a)'"))
                .hasErrorCode(WorkflowSchemaValidator.E_UNKNOWN_FUNCTION));
    }

    @Test
    void testStepReferencesMustPointBackwards() throws Exception {
        String yaml = """
                name: test
                jobs:
                  first:
                    steps:
                      - id: a
                        run: echo a
                  second:
                    steps:
                      - id: b
                        uses: state/set
                        with:
                          variables:
                            from_a: "${{ steps.a.outputs.stdout }}"
                            from_c: "${{ steps.c.outputs.stdout }}"
                      - id: c
                        run: echo c
                """;

        ValidationResult result = validate(yaml);

        assertEquals(1, result.getErrorCount(), result.toString());
        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_FORWARD_REFERENCE));
    }

    @Test
    void testBreakIfMaySeeItsOwnStep() {
        String yaml = singleStep("id: poll\nloop: '[1, 2, 3]'\nrun: echo\n"
                + "break_if: \"steps.poll.outcome == 'succeeded'\"");

        assertTrue(validate(yaml).isValid());
    }

    @Test
    void testErrorContextOnlyInHandlers() {
        String yaml = """
                name: test
                jobs:
                  main:
                    steps:
                      - id: risky
                        run: "false"
                        on_failure: recover
                      - id: plain
                        uses: state/set
                        with: {variables: {e: "${{ error.message }}"}}
                      - id: recover
                        uses: state/set
                        with: {variables: {e: "${{ error.message }}"}}
                    on_failure:
                      - uses: state/set
                        with: {variables: {e: "${{ error.step }}"}}
                """;

        ValidationResult result = validate(yaml);

        assertTrue(result.isValid(), result.toString());
        assertEquals(1, result.getWarningCount(), result.toString());
        assertEquals("jobs.main.steps[1].with.variables.e", result.getWarnings().get(0).getFieldPath());
    }

    @Test
    void testJumpTargets() {
        String backwards = """
                name: test
                jobs:
                  main:
                    steps:
                      - id: start
                        run: echo
                      - id: risky
                        run: "false"
                        on_failure: start
                """;
        String missing = singleStep("run: echo\non_failure: nowhere");

        assertTrue(validate(backwards).hasErrorCode(WorkflowSchemaValidator.E_JUMP_TARGET));
        assertTrue(validate(missing).hasErrorCode(WorkflowSchemaValidator.E_JUMP_TARGET));
    }

    // ========== Inputs and env ==========

    @Test
    void testInputDeclarations() {
        String yaml = """
                name: test
                inputs:
                  count:
                    type: integer
                    min: 5
                    default: 2
                  label:
                    type: string
                    pattern: "["
                  flag:
                    type: boolean
                    max: 3
                jobs:
                  main:
                    steps:
                      - run: echo
                """;

        ValidationResult result = validate(yaml);

        assertEquals(3, result.getErrorCount(), result.toString());
        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_INPUT));
    }

    @Test
    void testEnvReferencesAndCycles() {
        String yaml = """
                name: test
                env:
                  A: "${{ env.B }}"
                  B: "${{ env.A }}"
                  C: "${{ steps.x.outputs.stdout }}"
                  D: "${{ env.UNKNOWN }}"
                jobs:
                  main:
                    steps:
                      - run: echo
                """;

        ValidationResult result = validate(yaml);

        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_ENV_CYCLE));
        assertTrue(result.hasErrorCode(WorkflowSchemaValidator.E_ENV_REFERENCE));
    }

    // ========== Guardrails ==========

    @Test
    void testGuardrailScannersMustExist() {
        String yaml = """
                name: test
                guardrails:
                  input:
                    telepathy: {}
                jobs:
                  main:
                    steps:
                      - run: echo
                """;

        assertTrue(validate(yaml).hasErrorCode(WorkflowSchemaValidator.E_GUARDRAIL_SCANNER));
    }

    @Test
    void testGuardrailJumpTargetIsChecked() {
        String yaml = """
                name: test
                jobs:
                  main:
                    steps:
                      - id: generate
                        run: echo
                        guardrails:
                          output: {secrets: {}}
                          on_fail: leak_handler
                """;

        assertTrue(validate(yaml).hasErrorCode(WorkflowSchemaValidator.E_GUARDRAIL_ON_FAIL));
    }

    // ========== Shell safety ==========

    @Test
    void testShellSafetyModes() {
        String step = "run: \"echo ${{ inputs.name }}\"";

        assertTrue(validate(singleStep(step)).hasWarningCode(WorkflowSchemaValidator.W_SHELL_INJECTION));
        assertTrue(validate("shell_safety: strict\n" + singleStep(step))
                .hasErrorCode(WorkflowSchemaValidator.E_SHELL_INJECTION));
        ValidationResult autoQuote = validate("shell_safety: auto_quote\n" + singleStep(step));
        assertTrue(autoQuote.isValid());
        assertFalse(autoQuote.hasWarnings());
        assertFalse(validate(singleStep("run: \"echo ${{ inputs.name | shell_quote }}\"")).hasWarnings());
    }

    @Test
    void testHardcodedSecretWarning() {
        ValidationResult result = validate(
                singleStep("run: \"curl -H 'token: abcdefgh12345678' https://example.com\""));

        assertTrue(result.hasWarningCode(WorkflowSchemaValidator.W_HARDCODED_SECRET));
    }

    @Test
    void testStrictModePromotesWarnings() {
        ValidationResult strict = validate(singleStep("run: echo\nbreak_if: 'true'")).promoteWarnings();

        assertFalse(strict.isValid());
        assertTrue(strict.hasErrorCode(WorkflowSchemaValidator.W_LOOP_MODIFIER));
    }
}
