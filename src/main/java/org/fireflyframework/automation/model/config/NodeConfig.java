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

package org.fireflyframework.automation.model.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node configuration interpreted per node type.
 * <p>
 * Known types map to a dedicated variant; anything else becomes a {@link GenericConfig} that
 * keeps the raw key-value pairs, so extension handlers can still read their own fields.
 */
public sealed interface NodeConfig
        permits InputConfig, ConditionConfig, ExpressionConfig, TransformConfig, HttpRequestConfig,
        DelayConfig, GenericConfig {

    /**
     * Interprets a raw configuration map for the given node type.
     */
    static NodeConfig from(String type, Map<String, Object> raw) {
        Map<String, Object> values = raw != null ? raw : Map.of();
        return switch (type) {
            case "input", "trigger", "webhook" -> new InputConfig(values.get("defaultValue"), values.get("mockData"));
            case "condition" -> new ConditionConfig(string(values, "condition"));
            case "expression", "code" -> new ExpressionConfig(
                    firstString(values, "expression", "code"), string(values, "language"));
            case "data-transform", "transform" -> new TransformConfig(
                    string(values, "transformType"), string(values, "template"), string(values, "expression"),
                    string(values, "predicate"), string(values, "reducer"), values.get("initialValue"));
            case "http-request" -> new HttpRequestConfig(
                    string(values, "url"), string(values, "method"), headers(values.get("headers")),
                    values.get("body"), millis(values.get("timeout")));
            case "delay" -> new DelayConfig(millis(values.get("delay")));
            default -> new GenericConfig(values);
        };
    }

    private static String string(Map<String, Object> values, String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    private static String firstString(Map<String, Object> values, String... keys) {
        for (String key : keys) {
            String value = string(values, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Map<String, String> headers(Object raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                if (key != null && value != null) {
                    headers.put(key.toString(), value.toString());
                }
            });
        }
        return headers;
    }

    private static Duration millis(Object raw) {
        if (raw instanceof Duration duration) {
            return duration;
        }
        if (raw instanceof Number number) {
            return Duration.ofMillis(number.longValue());
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Duration.ofMillis(Long.parseLong(s.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid duration in milliseconds: " + s, e);
            }
        }
        return null;
    }
}
