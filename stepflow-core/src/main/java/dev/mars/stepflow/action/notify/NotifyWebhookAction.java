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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.action.ActionParameters;
import dev.mars.stepflow.action.ActionRequest;
import dev.mars.stepflow.action.ActionResult;
import dev.mars.stepflow.action.WorkflowAction;
import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.exceptions.ActionException;
import dev.mars.stepflow.core.exceptions.ActionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Sends a notification to a webhook. Mapping and list bodies are sent as JSON.
 * A non-2xx answer fails the step with kind {@code http}; the outputs
 * ({@code status_code}, {@code success}, {@code response}) are kept on the failure.
 */
public class NotifyWebhookAction implements WorkflowAction {

    private static final Logger logger = LoggerFactory.getLogger(NotifyWebhookAction.class);

    public static final String ACTION_ID = "notify/webhook";

    private static final Set<String> METHODS = Set.of("POST", "PUT", "PATCH");
    private static final int MAX_RESPONSE_CHARS = 1000;

    private final HttpClient client;
    private final Duration defaultTimeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public NotifyWebhookAction(StepflowConfiguration configuration) {
        this.defaultTimeout = configuration.getHttpTimeout();
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(defaultTimeout)
                .build();
    }

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionResult execute(ActionRequest request) throws ActionException {
        ActionParameters params = request.getParameters();
        String url = params.requireString("url");
        String method = params.getString("method", "POST").trim().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw params.invalid("method must be one of POST, PUT, PATCH");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw params.invalid("invalid URL: " + url);
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw params.invalid("only http and https URLs are supported: " + url);
        }
        Duration timeout = params.getSeconds("timeout", defaultTimeout);

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);
        params.getMap("headers").forEach((name, value) -> builder.header(name, value != null ? value.toString() : ""));
        builder.method(method, body(params, builder));

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ActionTimeoutException(ACTION_ID, timeout);
        } catch (IOException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO,
                    "Webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException(ACTION_ID, ActionException.KIND_INTERRUPTED, "webhook interrupted", e);
        }

        int status = response.statusCode();
        boolean success = status >= 200 && status < 300;
        String text = response.body() != null ? response.body() : "";
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("status_code", (long) status);
        outputs.put("success", success);
        outputs.put("response", text.length() > MAX_RESPONSE_CHARS ? text.substring(0, MAX_RESPONSE_CHARS) : text);

        if (!success) {
            logger.warn("Webhook {} {} returned {}", method, uri, status);
            throw new ActionException(ACTION_ID, ActionException.KIND_HTTP, "Webhook returned " + status, outputs);
        }
        logger.debug("Webhook {} {} returned {}", method, uri, status);
        return ActionResult.of(outputs);
    }

    private HttpRequest.BodyPublisher body(ActionParameters params, HttpRequest.Builder builder)
            throws ActionException {
        if (!params.has("body")) {
            return HttpRequest.BodyPublishers.noBody();
        }
        Object body = params.get("body");
        if (body instanceof Map || body instanceof List) {
            try {
                builder.header("Content-Type", "application/json");
                return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
            } catch (JsonProcessingException e) {
                throw params.invalid("body cannot be serialised as JSON: " + e.getOriginalMessage());
            }
        }
        return HttpRequest.BodyPublishers.ofString(body.toString());
    }
}
