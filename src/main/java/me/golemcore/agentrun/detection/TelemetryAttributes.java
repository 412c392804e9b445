package me.golemcore.agentrun.detection;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Locates the attribute map of a telemetry event across the schema variants
 * emitted by different CLIs.
 */
public final class TelemetryAttributes {

    private static final String ATTRIBUTES = "attributes";

    private TelemetryAttributes() {
    }

    /**
     * Probes {@code attributes}, {@code resource.attributes} and
     * {@code body.attributes} in that order.
     *
     * @return the first attribute object found, or {@code null}
     */
    public static JsonNode extractAttributes(JsonNode event) {
        if (event == null || !event.isObject()) {
            return null;
        }
        JsonNode direct = event.path(ATTRIBUTES);
        if (direct.isObject()) {
            return direct;
        }
        JsonNode resource = event.path("resource").path(ATTRIBUTES);
        if (resource.isObject()) {
            return resource;
        }
        JsonNode body = event.path("body").path(ATTRIBUTES);
        if (body.isObject()) {
            return body;
        }
        return null;
    }

    /**
     * First string value among the candidate keys, e.g.
     * {@code chooseAttr(attrs, "event.name", "event_name")}.
     */
    public static String chooseAttr(JsonNode attrs, String... keys) {
        if (attrs == null || !attrs.isObject()) {
            return null;
        }
        for (String key : keys) {
            JsonNode value = attrs.get(key);
            if (value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }
}
