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

package dev.mars.stepflow.workflow.graph;

import dev.mars.stepflow.workflow.Job;
import dev.mars.stepflow.workflow.Step;
import dev.mars.stepflow.workflow.WorkflowDefinition;
import dev.mars.stepflow.workflow.YamlWorkflowDefinitionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphCompiler lowering rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class GraphCompilerTest {

    private GraphCompiler compiler;
    private YamlWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        compiler = new GraphCompiler();
        parser = new YamlWorkflowDefinitionParser();
    }

    private CompiledWorkflow compile(String yaml) throws Exception {
        return compiler.compile(parser.parseFromString(yaml));
    }

    // ========== Lowering ==========

    @Test
    void testSequentialSteps() throws Exception {
        CompiledWorkflow compiled = compile("""
                name: seq
                jobs:
                  main:
                    steps:
                      - id: a
                        run: echo a
                      - id: b
                        run: echo b
                """);
        Subgraph main = compiled.getJob("main").getMain();

        assertEquals("a", main.getEntry());
        ActionNode a = assertInstanceOf(ActionNode.class, main.getNode("a"));
        assertEquals("b", a.next());
        assertEquals(FailureRoute.ABORT, a.failureRoute());
        assertNull(a.failure());
        assertEquals(GraphNode.END, main.getNode("b").getNext());
        assertEquals(GraphNode.END, compiled.getJob("main").getSubgraph(Phase.FINALLY).getEntry());
    }

    @Test
    void testConditionalStepSkipsToNext() throws Exception {
        Subgraph main = compile("""
                name: cond
                jobs:
                  main:
                    steps:
                      - id: a
                        if: inputs.enabled
                        run: echo a
                      - id: b
                        run: echo b
                """).getJob("main").getMain();

        assertEquals("a#if", main.getEntry());
        BranchNode branch = assertInstanceOf(BranchNode.class, main.getNode("a#if"));
        assertEquals("inputs.enabled", branch.condition());
        assertEquals("a", branch.whenTrue());
        assertEquals("b", branch.whenFalse());
        assertEquals("a", branch.getStepId());
    }

    @Test
    void testLoopLowering() throws Exception {
        Subgraph main = compile("""
                name: loop
                jobs:
                  main:
                    steps:
                      - id: each
                        loop: "${{ inputs.items }}"
                        if: "loop.item != 'skip'"
                        break_if: "loop.index >= 2"
                        continue_on_error: true
                        max_iterations: 7
                        run: echo item
                      - id: after
                        run: echo done
                """).getJob("main").getMain();

        assertEquals(List.of("each#loop", "each#if", "each", "each#tail", "each#next", "after"),
                List.copyOf(main.getNodes().keySet()));
        LoopHeadNode head = assertInstanceOf(LoopHeadNode.class, main.getNode("each#loop"));
        assertEquals("each#if", head.body());
        assertEquals("each#tail", head.tail());
        assertEquals(7, head.maxIterations());
        assertEquals(FailureRoute.ABORT, head.failureRoute());

        BranchNode branch = assertInstanceOf(BranchNode.class, main.getNode("each#if"));
        assertEquals("each#tail", branch.whenFalse());

        ActionNode body = assertInstanceOf(ActionNode.class, main.getNode("each"));
        assertEquals(FailureRoute.LOOP_CONTINUE, body.failureRoute());
        assertEquals("each#tail", body.failure());

        LoopTailNode tail = assertInstanceOf(LoopTailNode.class, main.getNode("each#tail"));
        assertEquals("loop.index >= 2", tail.breakIf());
        assertEquals("each#next", tail.again());
        assertEquals("after", tail.exit());

        JumpNode back = assertInstanceOf(JumpNode.class, main.getNode("each#next"));
        assertEquals(JumpNode.Kind.LOOP_BACK, back.kind());
        assertEquals("each#if", back.target());
    }

    @Test
    void testOnFailureJumpTargetsHandlerEntry() throws Exception {
        Subgraph main = compile("""
                name: jump
                jobs:
                  main:
                    steps:
                      - id: risky
                        loop: [1, 2]
                        continue_on_error: true
                        on_failure: recover
                        run: "false"
                      - id: skipped
                        run: echo never
                      - id: recover
                        if: "error.kind == 'exit_code'"
                        run: echo recovering
                """).getJob("main").getMain();

        JumpNode jump = assertInstanceOf(JumpNode.class, main.getNode("risky#fail"));
        assertEquals(JumpNode.Kind.FAILURE, jump.kind());
        assertEquals("recover#if", jump.target());

        ActionNode body = assertInstanceOf(ActionNode.class, main.getNode("risky"));
        assertEquals(FailureRoute.JUMP, body.failureRoute());
        assertEquals("risky#fail", body.failure());
    }

    @Test
    void testHookFailuresContinueWithNextHook() throws Exception {
        CompiledWorkflow compiled = compile("""
                name: hooks
                jobs:
                  main:
                    steps:
                      - run: echo main
                    finally:
                      - id: first
                        run: "false"
                      - id: second
                        run: echo cleanup
                finally:
                  - id: report
                    run: echo report
                """);
        Subgraph jobFinally = compiled.getJob("main").getSubgraph(Phase.FINALLY);

        ActionNode first = assertInstanceOf(ActionNode.class, jobFinally.getNode("first"));
        assertEquals(FailureRoute.HOOK_CONTINUE, first.failureRoute());
        assertEquals("second", first.failure());

        Subgraph workflowFinally = compiled.getSubgraph(CompiledWorkflow.WORKFLOW_SCOPE, Phase.FINALLY);
        assertEquals("report", workflowFinally.getEntry());
        assertTrue(compiled.getWorkflowHooks().getMain().isEmpty());
    }

    @Test
    void testJumpOutsideListIsRejected() {
        Step risky = Step.builder("risky").run("false").onFailure("elsewhere").build();
        Job job = new Job("main", List.of(risky), List.of(), List.of(), List.of());

        assertThrows(IllegalArgumentException.class, () -> compiler.compile(job));
    }

    @Test
    void testUnknownLookups() throws Exception {
        CompiledWorkflow compiled = compile("name: x\njobs:\n  main:\n    steps:\n      - id: a\n        run: echo\n");

        assertThrows(IllegalArgumentException.class, () -> compiled.getJob("other"));
        assertThrows(IllegalArgumentException.class, () -> compiled.getJob("main").getMain().getNode("zz"));
        assertThrows(IllegalArgumentException.class, () -> compiled.getJob("main").getMain().entryOf("zz"));
        assertEquals("a", compiled.getJob("main").getMain().entryOf("a"));
    }

    // ========== Determinism ==========

    @Test
    void testCompilationIsDeterministic() throws Exception {
        String yaml = """
                name: twice
                version: "2"
                jobs:
                  build:
                    steps:
                      - id: each
                        loop: [a, b]
                        run: echo
                      - name: Check
                        if: "steps.each.outcome == 'succeeded'"
                        run: echo ok
                    on_failure:
                      - run: echo failed
                on_complete:
                  - run: echo complete
                """;
        WorkflowDefinition definition = parser.parseFromString(yaml);

        CompiledWorkflow first = compiler.compile(definition);
        CompiledWorkflow second = compiler.compile(parser.parseFromString(yaml));

        assertEquals(first.getJobs(), second.getJobs());
        assertEquals(first.getWorkflowHooks(), second.getWorkflowHooks());
        assertEquals(first.describe(), second.describe());
    }

    @Test
    void testDescribe() throws Exception {
        String description = compile("""
                name: described
                version: "3"
                jobs:
                  main:
                    steps:
                      - id: a
                        uses: state/set
                        with: {variables: {x: 1}}
                finally:
                  - id: z
                    run: echo bye
                """).describe();

        assertTrue(description.startsWith("workflow described (3)\n"));
        assertTrue(description.contains("  job main\n"));
        assertTrue(description.contains("action  uses state/set -> __end__"));
        assertTrue(description.contains("  workflow hooks\n"));
        assertTrue(description.contains("finally:"));
        assertFalse(description.contains("on_complete:"));
    }
}
