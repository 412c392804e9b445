package me.golemcore.agentrun.detection.idle;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentrun.domain.model.AgentMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps raw session messages onto {@link AgentMessage}. Accepts both bare
 * message objects and envelopes that keep the message under {@code info}.
 */
public class AgentMessageNormalizer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AgentMessageNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AgentMessage normalize(JsonNode raw) {
        JsonNode info = raw != null && raw.path("info").isObject() ? raw.get("info") : raw;
        if (info == null || !info.isObject()) {
            return AgentMessage.builder().build();
        }

        JsonNode completed = info.path("time").path("completed");
        JsonNode error = info.path("error");
        return AgentMessage.builder()
                .id(text(info, "id"))
                .role(text(info, "role"))
                .finish(text(info, "finish"))
                .completedAt(completed.isNumber() ? completed.asLong() : null)
                .error(error.isObject() ? objectMapper.convertValue(error, MAP_TYPE) : null)
                .build();
    }

    /**
     * Normalizes every element of a JSON array; anything else yields no messages.
     */
    public List<AgentMessage> normalizeAll(JsonNode array) {
        List<AgentMessage> messages = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return messages;
        }
        for (JsonNode raw : array) {
            messages.add(normalize(raw));
        }
        return messages;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
