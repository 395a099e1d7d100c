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

import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads a file into the step outputs.
 *
 * <p>{@code with.encoding} is {@code utf-8} (default), {@code binary} for base64
 * content, or {@code auto} to fall back to base64 when the bytes are not valid UTF-8.
 * Files larger than {@code with.max_size} bytes are refused.</p>
 */
public class FileReadAction extends AbstractFileAction {

    private static final Logger logger = LoggerFactory.getLogger(FileReadAction.class);

    public static final String ACTION_ID = "file/read";
    public static final long DEFAULT_MAX_SIZE = 10L * 1024 * 1024;

    private static final Set<String> ENCODINGS = Set.of("utf-8", "binary", "auto");

    public FileReadAction(StepflowConfiguration configuration) {
        super(configuration);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String encoding = params.getString("encoding", "utf-8");
        if (!ENCODINGS.contains(encoding)) {
            throw params.invalid("encoding must be one of utf-8, binary, auto");
        }
        long maxSize = params.getLong("max_size", DEFAULT_MAX_SIZE);
        Path path = resolve(request, params.requireString("path"));

        try {
            long size = Files.size(path);
            if (size > maxSize) {
                throw new ActionException(ACTION_ID, ActionException.KIND_IO,
                        "File too large: " + size + " bytes (limit: " + maxSize + " bytes)",
                        Map.of("path", path.toString(), "size", size, "max_size", maxSize));
            }
            byte[] bytes = Files.readAllBytes(path);

            String content;
            String actualEncoding;
            if ("binary".equals(encoding)) {
                content = Base64.getEncoder().encodeToString(bytes);
                actualEncoding = "binary";
            } else {
                String text = decodeUtf8(bytes);
                if (text == null && "utf-8".equals(encoding)) {
                    throw new ActionException(ACTION_ID, ActionException.KIND_IO,
                            "File is not valid UTF-8: " + path, Map.of("path", path.toString()));
                }
                content = text != null ? text : Base64.getEncoder().encodeToString(bytes);
                actualEncoding = text != null ? "utf-8" : "binary";
            }
            logger.debug("Read {} bytes from {}", size, path);

            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("content", content);
            outputs.put("size", size);
            outputs.put("path", path.toString());
            outputs.put("encoding", actualEncoding);
            return ActionResult.of(outputs);
        } catch (NoSuchFileException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO, "File not found: " + path,
                    Map.of("path", path.toString()));
        } catch (AccessDeniedException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO, "Permission denied: " + path,
                    Map.of("path", path.toString()));
        } catch (IOException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO,
                    "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
