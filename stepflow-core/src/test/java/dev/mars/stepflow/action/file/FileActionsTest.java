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


package dev.mars.stepflow.action.file;

import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the file/read and file/write actions.
 */
class FileActionsTest {

    @TempDir
    Path workspace;

    private FileReadAction read;
    private FileWriteAction write;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty("stepflow.workspace", workspace.toString());
        StepflowConfiguration configuration = new StepflowConfiguration(properties);
        read = new FileReadAction(configuration);
        write = new FileWriteAction(configuration);
    }

    private static ActionRequest request(String actionId, Map<String, Object> with) {
        return ActionRequest.builder().actionId(actionId).stepId("file").with(with).build();
    }

    // ========== file/read ==========

    @Test
    void testReadResolvesAgainstWorkspace() throws Exception {
        Files.writeString(workspace.resolve("notes.txt"), "hello");

        ActionResult result = read.execute(request(FileReadAction.ACTION_ID, Map.of("path", "notes.txt")));

        assertEquals("hello", result.getOutputs().get("content"));
        assertEquals(5L, result.getOutputs().get("size"));
        assertEquals("utf-8", result.getOutputs().get("encoding"));
        assertEquals(workspace.resolve("notes.txt").toAbsolutePath().normalize().toString(),
                result.getOutputs().get("path"));
    }

    @Test
    void testReadBinaryIsBase64() throws Exception {
        byte[] bytes = {(byte) 0xff, 0x00, 0x10};
        Files.write(workspace.resolve("blob.bin"), bytes);

        ActionResult binary = read.execute(request(FileReadAction.ACTION_ID,
                Map.of("path", "blob.bin", "encoding", "binary")));
        ActionResult auto = read.execute(request(FileReadAction.ACTION_ID,
                Map.of("path", "blob.bin", "encoding", "auto")));

        assertEquals(Base64.getEncoder().encodeToString(bytes), binary.getOutputs().get("content"));
        assertEquals("binary", auto.getOutputs().get("encoding"));
        ActionException e = assertThrows(ActionException.class,
                () -> read.execute(request(FileReadAction.ACTION_ID, Map.of("path", "blob.bin"))));
        assertEquals(ActionException.KIND_IO, e.getKind());
    }

    @Test
    void testReadFailures() throws Exception {
        ActionException missing = assertThrows(ActionException.class,
                () -> read.execute(request(FileReadAction.ACTION_ID, Map.of("path", "absent.txt"))));
        assertThat(missing.getMessage()).contains("File not found");

        Files.writeString(workspace.resolve("big.txt"), "0123456789");
        ActionException tooLarge = assertThrows(ActionException.class,
                () -> read.execute(request(FileReadAction.ACTION_ID, Map.of("path", "big.txt", "max_size", 4L))));
        assertThat(tooLarge.getMessage()).contains("File too large: 10 bytes");
        assertEquals(10L, tooLarge.getOutputs().get("size"));

        ActionException invalid = assertThrows(ActionException.class,
                () -> read.execute(request(FileReadAction.ACTION_ID, Map.of("path", "big.txt", "encoding", "latin1"))));
        assertEquals(ActionException.KIND_VALIDATION, invalid.getKind());
    }

    // ========== file/write ==========

    @Test
    void testWriteOverwritesAndAppends() throws Exception {
        write.execute(request(FileWriteAction.ACTION_ID, Map.of("path", "out.txt", "content", "one")));
        ActionResult second = write.execute(request(FileWriteAction.ACTION_ID,
                Map.of("path", "out.txt", "content", "-two", "mode", "append")));

        assertEquals("one-two", Files.readString(workspace.resolve("out.txt")));
        assertEquals(true, second.getOutputs().get("existed"));
        assertEquals(4L, second.getOutputs().get("size"));

        write.execute(request(FileWriteAction.ACTION_ID, Map.of("path", "out.txt", "content", "fresh")));
        assertEquals("fresh", Files.readString(workspace.resolve("out.txt")));
    }

    @Test
    void testWriteCreateRefusesExistingFile() throws Exception {
        Files.writeString(workspace.resolve("keep.txt"), "original");

        ActionException e = assertThrows(ActionException.class, () -> write.execute(request(
                FileWriteAction.ACTION_ID, Map.of("path", "keep.txt", "content", "x", "mode", "create"))));

        assertThat(e.getMessage()).contains("File already exists");
        assertEquals("original", Files.readString(workspace.resolve("keep.txt")));
    }

    @Test
    void testWriteCreatesParentsAndRendersStructuredContent() throws Exception {
        write.execute(request(FileWriteAction.ACTION_ID, Map.of("path", "reports/out.json", "mkdir", true,
                "content", Map.of("hosts", List.of("a", "b")))));

        String written = Files.readString(workspace.resolve("reports/out.json"), StandardCharsets.UTF_8);
        assertThat(written).contains("\"hosts\"").contains("\"a\"");
    }

    @Test
    void testWriteWithoutParentFails() {
        ActionException e = assertThrows(ActionException.class, () -> write.execute(request(
                FileWriteAction.ACTION_ID, Map.of("path", "missing/out.txt", "content", "x"))));

        assertEquals(ActionException.KIND_IO, e.getKind());
    }
}
