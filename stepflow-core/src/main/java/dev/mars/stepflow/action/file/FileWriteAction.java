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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code with.content} to a file as UTF-8. Mappings and lists are written as JSON.
 *
 * <p>{@code with.mode} is {@code overwrite} (default), {@code append}, or
 * {@code create}, which fails when the file already exists. With
 * {@code with.mkdir: true} missing parent directories are created.</p>
 */
public class FileWriteAction extends AbstractFileAction {

    private static final Logger logger = LoggerFactory.getLogger(FileWriteAction.class);

    public static final String ACTION_ID = "file/write";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileWriteAction(StepflowConfiguration configuration) {
        super(configuration);
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String mode = params.getString("mode", "overwrite");
        StandardOpenOption[] options;
        switch (mode) {
            case "overwrite":
                options = new StandardOpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE};
                break;
            case "append":
                options = new StandardOpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND};
                break;
            case "create":
                options = new StandardOpenOption[]{StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE};
                break;
            default:
                throw params.invalid("mode must be one of overwrite, append, create");
        }
        Path path = resolve(request, params.requireString("path"));
        String content = render(params.get("content"));
        boolean existed = Files.exists(path);
        if ("create".equals(mode) && existed) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO, "File already exists: " + path,
                    Map.of("path", path.toString(), "existed", true));
        }

        try {
            if (params.getBoolean("mkdir", false) && path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            Files.write(path, bytes, options);
            logger.debug("{} {} bytes to {}", "append".equals(mode) ? "Appended" : "Wrote", bytes.length, path);

            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("path", path.toString());
            outputs.put("size", (long) bytes.length);
            outputs.put("existed", existed);
            return ActionResult.of(outputs);
        } catch (AccessDeniedException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO, "Permission denied: " + path,
                    Map.of("path", path.toString()));
        } catch (IOException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO,
                    "Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    private String render(Object content) throws ActionException {
        if (content == null) {
            return "";
        }
        if (content instanceof Map || content instanceof Iterable) {
            try {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(content);
            } catch (JsonProcessingException e) {
                throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION,
                        "content cannot be written as JSON: " + e.getOriginalMessage(), e);
            }
        }
        return content.toString();
    }
}
