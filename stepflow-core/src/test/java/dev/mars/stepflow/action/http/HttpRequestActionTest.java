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

package dev.mars.stepflow.action.http;

import com.sun.net.httpserver.HttpServer;
import dev.mars.stepflow.action.ActionContext;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for HttpRequestAction against an in-process HTTP server.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class HttpRequestActionTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private HttpRequestAction action;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/json", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] body = "{\"ok\": true, \"items\": [1, 2]}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/missing", exchange -> {
            byte[] body = "not here".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(404, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        action = new HttpRequestAction(new StepflowConfiguration(new Properties()));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private ActionRequest.Builder request(Map<String, Object> with) {
        return ActionRequest.builder().actionId(HttpRequestAction.ACTION_ID).stepId("call").with(with);
    }

    @Test
    void testPostJsonAndParseResponse() throws ActionException {
        ActionResult result = action.execute(request(Map.of(
                "url", baseUrl + "/json", "method", "post", "json", Map.of("name", "stepflow"))).build());

        assertEquals(200L, result.getOutputs().get("status_code"));
        assertEquals(Map.of("ok", true, "items", List.of(1, 2)), result.getOutputs().get("json"));
        assertEquals("{\"name\":\"stepflow\"}", lastBody.get());
    }

    @Test
    void testSecretHeaderResolvedFromContext() throws ActionException {
        ActionContext context = mock(ActionContext.class);
        when(context.getSecret("API_TOKEN")).thenReturn(Optional.of("Bearer xyz"));

        action.execute(request(Map.of("url", baseUrl + "/json",
                "secret_headers", Map.of("Authorization", "API_TOKEN"))).context(context).build());

        assertEquals("Bearer xyz", lastAuthorization.get());
    }

    @Test
    void testMissingSecretIsValidationError() {
        ActionContext context = mock(ActionContext.class);
        when(context.getSecret("API_TOKEN")).thenReturn(Optional.empty());

        ActionException e = assertThrows(ActionException.class, () -> action.execute(request(Map.of(
                "url", baseUrl + "/json", "secret_headers", Map.of("Authorization", "API_TOKEN")))
                .context(context).build()));

        assertEquals(ActionException.KIND_VALIDATION, e.getKind());
    }

    @Test
    void testErrorStatusFailsWithOutputs() {
        ActionException e = assertThrows(ActionException.class,
                () -> action.execute(request(Map.of("url", baseUrl + "/missing")).build()));

        assertEquals(ActionException.KIND_HTTP, e.getKind());
        assertEquals(404L, e.getOutputs().get("status_code"));
        assertEquals("not here", e.getOutputs().get("body"));
    }

    @Test
    void testErrorStatusToleratedWhenRequested() throws ActionException {
        ActionResult result = action.execute(request(Map.of(
                "url", baseUrl + "/missing", "fail_on_status", false)).build());

        assertEquals(404L, result.getOutputs().get("status_code"));
    }

    @Test
    void testRejectsNonHttpUrl() {
        ActionException e = assertThrows(ActionException.class,
                () -> action.execute(request(Map.of("url", "file:///etc/passwd")).build()));

        assertEquals(ActionException.KIND_VALIDATION, e.getKind());
    }

    @Test
    void testRejectsUnknownMethod() {
        assertThrows(ActionException.class,
                () -> action.execute(request(Map.of("url", baseUrl + "/json", "method", "BREW")).build()));
    }
}
