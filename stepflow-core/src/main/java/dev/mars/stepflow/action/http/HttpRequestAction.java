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
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Performs an HTTP request using the JDK {@link HttpClient}.
 *
 * <p>Outputs {@code status_code}, {@code body}, {@code headers}, {@code url} and,
 * when the body is JSON, {@code json}. Responses with a status of 400 or above
 * fail the step unless {@code fail_on_status: false} is given; the outputs are
 * still recorded on the failure.</p>
 */
public class HttpRequestAction implements WorkflowAction {
    private static final Logger logger = LoggerFactory.getLogger(HttpRequestAction.class);

    public static final String ACTION_ID = "http/request";

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private final HttpClient followingClient;
    private final HttpClient nonFollowingClient;
    private final Duration defaultTimeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpRequestAction(StepflowConfiguration configuration) {
        this.defaultTimeout = configuration.getHttpTimeout();
        this.followingClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(defaultTimeout)
                .build();
        this.nonFollowingClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
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
        URI uri = parseUri(params.requireString("url"));
        String method = params.getString("method", "GET").trim().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw params.invalid("unsupported HTTP method: " + method);
        }
        Duration timeout = params.getSeconds("timeout", defaultTimeout);

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);
        params.getMap("headers").forEach((name, value) -> builder.header(name, value != null ? value.toString() : ""));
        for (Map.Entry<String, Object> entry : params.getMap("secret_headers").entrySet()) {
            String secretName = String.valueOf(entry.getValue());
            Optional<String> secret = request.getContext() != null
                    ? request.getContext().getSecret(secretName)
                    : Optional.empty();
            builder.header(entry.getKey(), secret.orElseThrow(() ->
                    params.invalid("secret '" + secretName + "' for header " + entry.getKey() + " is not available")));
        }
        builder.method(method, bodyPublisher(params, builder));

        HttpClient client = params.getBoolean("follow_redirects", true) ? followingClient : nonFollowingClient;
        logger.debug("HTTP {} {}", method, uri);

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ActionTimeoutException(ACTION_ID, timeout);
        } catch (IOException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_IO,
                    "request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException(ACTION_ID, ActionException.KIND_INTERRUPTED, "request interrupted", e);
        }

        Map<String, Object> outputs = toOutputs(response);
        if (response.statusCode() >= 400 && params.getBoolean("fail_on_status", true)) {
            throw new ActionException(ACTION_ID, ActionException.KIND_HTTP,
                    "HTTP " + response.statusCode() + " from " + uri, outputs);
        }
        return ActionResult.of(outputs);
    }

    private URI parseUri(String url) throws ActionException {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION,
                        "only http and https URLs are supported: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ActionException(ACTION_ID, ActionException.KIND_VALIDATION, "invalid URL: " + url, e);
        }
    }

    private HttpRequest.BodyPublisher bodyPublisher(ActionParameters params, HttpRequest.Builder builder)
            throws ActionException {
        try {
            if (params.has("json")) {
                builder.header("Content-Type", "application/json");
                return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(params.get("json")));
            }
            if (params.has("body")) {
                Object body = params.get("body");
                if (body instanceof Map || body instanceof List) {
                    builder.header("Content-Type", "application/json");
                    return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
                }
                return HttpRequest.BodyPublishers.ofString(body.toString());
            }
        } catch (JsonProcessingException e) {
            throw params.invalid("request body cannot be serialised as JSON: " + e.getOriginalMessage());
        }
        return HttpRequest.BodyPublishers.noBody();
    }

    private Map<String, Object> toOutputs(HttpResponse<String> response) {
        Map<String, Object> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) ->
                headers.put(name.toLowerCase(Locale.ROOT),
                        values.size() == 1 ? values.get(0) : String.join(", ", values)));

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("status_code", (long) response.statusCode());
        outputs.put("body", response.body());
        outputs.put("headers", headers);
        outputs.put("url", response.uri().toString());

        String contentType = response.headers().firstValue("content-type").orElse("");
        if (contentType.contains("json") && response.body() != null && !response.body().isBlank()) {
            try {
                outputs.put("json", objectMapper.readValue(response.body(), Object.class));
            } catch (JsonProcessingException e) {
                logger.debug("Response declared JSON but did not parse: {}", e.getOriginalMessage());
            }
        }
        return outputs;
    }
}
