/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.automation.handler.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.exception.NodeExecutionException;
import org.fireflyframework.automation.handler.NodeHandler;
import org.fireflyframework.automation.model.ExecutionNode;
import org.fireflyframework.automation.model.config.HttpRequestConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code http-request}: performs an HTTP call and emits {@code {status, body, headers}}.
 * <p>
 * JSON response bodies are parsed into maps and lists. A non-2xx status fails the node with a
 * {@link NodeExecutionException}, which makes it eligible for retry.
 */
@Slf4j
public class HttpRequestNodeHandler implements NodeHandler {

    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration defaultTimeout;

    public HttpRequestNodeHandler(WebClient webClient, ObjectMapper objectMapper, Duration defaultTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutionNode node, Map<String, Object> inputs) {
        if (!(node.typedConfig() instanceof HttpRequestConfig config) || config.url() == null || config.url().isBlank()) {
            return Mono.error(new NodeExecutionException(node.id(), "missing 'url' in node configuration", null));
        }
        String method = config.method().toUpperCase();
        Object body = config.body() != null ? config.body() : inputs.get("data");
        Duration timeout = config.timeout() != null ? config.timeout() : defaultTimeout;

        log.debug("HTTP_REQUEST: nodeId={}, method={}, url={}", node.id(), method, config.url());

        WebClient.RequestBodySpec request = webClient.method(HttpMethod.valueOf(method))
                .uri(config.url())
                .headers(headers -> config.headers().forEach(headers::set));
        WebClient.RequestHeadersSpec<?> exchange = request;
        if (METHODS_WITH_BODY.contains(method) && body != null) {
            exchange = body instanceof String text
                    ? request.bodyValue(text)
                    : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        }

        return exchange.exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> toOutput(node, config, response, text)))
                .timeout(timeout, Mono.error(() -> new NodeExecutionException(node.id(),
                        method + " " + config.url() + " timed out after " + timeout.toMillis() + "ms", null)));
    }

    private Map<String, Object> toOutput(ExecutionNode node, HttpRequestConfig config, ClientResponse response, String text) {
        int status = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            throw new NodeExecutionException(node.id(),
                    "HTTP " + status + " from " + config.method().toUpperCase() + " " + config.url(), null);
        }
        HttpHeaders responseHeaders = response.headers().asHttpHeaders();
        Map<String, Object> headers = new LinkedHashMap<>();
        responseHeaders.forEach((name, values) -> headers.put(name.toLowerCase(), String.join(", ", values)));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", status);
        output.put("body", parseBody(node, responseHeaders.getContentType(), text));
        output.put("headers", headers);
        return output;
    }

    private Object parseBody(ExecutionNode node, MediaType contentType, String text) {
        boolean json = contentType != null
                && (MediaType.APPLICATION_JSON.isCompatibleWith(contentType) || contentType.getSubtype().endsWith("+json"));
        if (!json || text.isEmpty()) {
            return text;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException(node.id(), "invalid JSON response body: " + e.getOriginalMessage(), e);
        }
    }
}
