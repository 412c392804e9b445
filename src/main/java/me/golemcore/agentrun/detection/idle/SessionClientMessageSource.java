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
import me.golemcore.agentrun.domain.model.AgentMessage;
import me.golemcore.agentrun.port.outbound.AgentSessionPort;

import java.util.ArrayList;
import java.util.List;

/**
 * First tier: the in-process session client. Some client versions return empty
 * results instead of failing, so zero messages across existing sessions is
 * treated as a failure too.
 */
public class SessionClientMessageSource implements MessageSource {

    private final AgentSessionPort sessionPort;
    private final AgentMessageNormalizer normalizer;

    public SessionClientMessageSource(AgentSessionPort sessionPort, AgentMessageNormalizer normalizer) {
        this.sessionPort = sessionPort;
        this.normalizer = normalizer;
    }

    @Override
    public String name() {
        return "session-client";
    }

    @Override
    public List<AgentMessage> fetchMessages() throws MessageSourceException {
        List<String> sessionIds;
        List<AgentMessage> messages = new ArrayList<>();
        try {
            sessionIds = sessionPort.listSessionIds();
            for (String sessionId : sessionIds) {
                if (sessionId == null || sessionId.isBlank()) {
                    continue;
                }
                List<JsonNode> rawMessages = sessionPort.listMessages(sessionId);
                if (rawMessages == null) {
                    continue;
                }
                for (JsonNode raw : rawMessages) {
                    messages.add(normalizer.normalize(raw));
                }
            }
        } catch (RuntimeException e) {
            throw new MessageSourceException("Session client failed: " + e.getMessage(), e);
        }

        if (messages.isEmpty() && sessionIds != null && !sessionIds.isEmpty()) {
            throw new MessageSourceException(
                    "Session client returned 0 messages for " + sessionIds.size() + " session(s)");
        }
        return messages;
    }
}
