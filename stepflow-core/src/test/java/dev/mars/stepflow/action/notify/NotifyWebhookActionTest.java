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


package dev.mars.stepflow.action.notify;

import com.sun.net.httpserver.HttpServer;
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
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NotifyWebhookAction against an in-process HTTP server.
 */
class NotifyWebhookActionTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private NotifyWebhookAction action;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            lastMethod.set(exchange.getRequestMethod());
            byte[] body = "accepted".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(202, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/broken", exchange -> {
            byte[] body = "boom".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(500, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        action = new NotifyWebhookAction(new StepflowConfiguration(new Properties()));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private ActionRequest request(Map<String, Object> with) {
        return ActionRequest.builder().actionId(NotifyWebhookAction.ACTION_ID).stepId("notify").with(with).build();
    }

    @Test
    void testPostsJsonBody() throws ActionException {
        ActionResult result = action.execute(request(Map.of("url", baseUrl + "/hook",
                "body", Map.of("text", "scan finished", "hosts", List.of("a")))));

        assertEquals(202L, result.getOutputs().get("status_code"));
        assertEquals(true, result.getOutputs().get("success"));
        assertEquals("accepted", result.getOutputs().get("response"));
        assertEquals("POST", lastMethod.get());
        assertEquals("application/json", lastContentType.get());
        assertTrue(lastBody.get().contains("\"text\":\"scan finished\""));
    }

    @Test
    void testPlainBodyWithPut() throws ActionException {
        action.execute(request(Map.of("url", baseUrl + "/hook", "method", "put", "body", "done")));

        assertEquals("PUT", lastMethod.get());
        assertEquals("done", lastBody.get());
    }

    @Test
    void testErrorStatusFailsWithOutputs() {
        ActionException e = assertThrows(ActionException.class,
                () -> action.execute(request(Map.of("url", baseUrl + "/broken", "body", "x"))));

        assertEquals(ActionException.KIND_HTTP, e.getKind());
        assertEquals(500L, e.getOutputs().get("status_code"));
        assertEquals(false, e.getOutputs().get("success"));
    }

    @Test
    void testRejectsUnsupportedMethodAndScheme() {
        ActionException method = assertThrows(ActionException.class,
                () -> action.execute(request(Map.of("url", baseUrl + "/hook", "method", "GET"))));
        ActionException scheme = assertThrows(ActionException.class,
                () -> action.execute(request(Map.of("url", "ftp://example.com/hook"))));

        assertEquals(ActionException.KIND_VALIDATION, method.getKind());
        assertEquals(ActionException.KIND_VALIDATION, scheme.getKind());
    }
}
