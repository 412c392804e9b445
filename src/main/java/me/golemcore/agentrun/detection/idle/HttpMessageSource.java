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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.AgentMessage;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Second tier: the agent's local REST server.
 *
 * <p>
 * Lists sessions with {@code GET /session}, then reads each session's messages
 * with {@code GET /session/{id}/message}. Failed message fetches are skipped,
 * but when every fetch fails the source gives up so storage is consulted.
 */
@Slf4j
public class HttpMessageSource implements MessageSource {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AgentMessageNormalizer normalizer;
    private final String baseUrl;

    public HttpMessageSource(OkHttpClient httpClient, ObjectMapper objectMapper, AgentMessageNormalizer normalizer,
            String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String name() {
        return "http-api";
    }

    @Override
    public List<AgentMessage> fetchMessages() throws MessageSourceException {
        JsonNode sessionData;
        try {
            sessionData = getJson(baseUrl + "/session");
        } catch (IOException e) {
            throw new MessageSourceException("Session API failed: " + e.getMessage(), e);
        }

        List<String> sessionIds = sessionIds(sessionData);
        List<AgentMessage> messages = new ArrayList<>();
        boolean anyFetchOk = false;
        for (String sessionId : sessionIds) {
            try {
                messages.addAll(normalizer.normalizeAll(getJson(baseUrl + "/session/" + sessionId + "/message")));
                anyFetchOk = true;
            } catch (IOException e) {
                log.debug("[IdleGuard] Message fetch failed for session {}: {}", sessionId, e.getMessage());
            }
        }

        if (!anyFetchOk && !sessionIds.isEmpty()) {
            throw new MessageSourceException(
                    "All HTTP message fetches failed for " + sessionIds.size() + " session(s)");
        }
        return messages;
    }

    private JsonNode getJson(String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
            return objectMapper.readTree(body.string());
        }
    }

    private static List<String> sessionIds(JsonNode sessionData) {
        List<String> ids = new ArrayList<>();
        if (sessionData == null) {
            return ids;
        }
        if (sessionData.isArray()) {
            for (JsonNode session : sessionData) {
                addId(ids, session);
            }
        } else {
            addId(ids, sessionData);
        }
        return ids;
    }

    private static void addId(List<String> ids, JsonNode session) {
        JsonNode id = session.path("id");
        if (id.isTextual() && !id.asText().isBlank()) {
            ids.add(id.asText());
        }
    }
}
