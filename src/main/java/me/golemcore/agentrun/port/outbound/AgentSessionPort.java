package me.golemcore.agentrun.port.outbound;

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

import java.util.List;

/**
 * Port for an in-process client of a running agent's session API.
 *
 * <p>
 * No adapter ships with this library. A host that embeds such a client
 * registers it as a bean and {@code IdleCompletionGuardFactory} puts it in
 * front of the HTTP and on-disk storage sources. Without one, the guard starts
 * at the HTTP source.
 */
public interface AgentSessionPort {

    /**
     * Ids of all sessions known to the agent.
     */
    List<String> listSessionIds();

    /**
     * Raw messages of a session, either bare message objects or
     * {@code {"info": {...}, "parts": [...]}} envelopes.
     */
    List<JsonNode> listMessages(String sessionId);
}
