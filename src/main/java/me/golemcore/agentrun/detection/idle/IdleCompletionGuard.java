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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.AgentMessage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides whether an idle signal from an agent session means the task is done.
 *
 * <p>
 * An agent also goes idle after failing, e.g. when the upstream API rejects the
 * key. On every idle event the guard reads the session messages through its
 * {@link MessageSource} tiers and runs the completion action only if some
 * assistant message finished without an error. When no tier can be read, or the
 * messages are inconclusive, the guard stays silent.
 *
 * <p>
 * The completion action runs at most once per guard, even when idle events
 * arrive concurrently.
 */
@Slf4j
public class IdleCompletionGuard {

    private static final String SESSION_IDLE = "session.idle";
    private static final String SESSION_STATUS = "session.status";
    private static final String STATUS_IDLE = "idle";

    private final List<MessageSource> sources;
    private final Runnable completionAction;
    private final AtomicBoolean fired = new AtomicBoolean();

    public IdleCompletionGuard(List<MessageSource> sources, Runnable completionAction) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one message source is required");
        }
        this.sources = List.copyOf(sources);
        this.completionAction = completionAction;
    }

    /**
     * Handles one agent event.
     *
     * @return {@code true} if this call ran the completion action
     */
    public boolean onEvent(JsonNode event) {
        if (fired.get() || !isIdleEvent(event)) {
            return false;
        }
        log.debug("[IdleGuard] Idle event received");

        Optional<List<AgentMessage>> messages = readMessages();
        if (messages.isEmpty() || !hasSuccessfulCompletion(messages.get())) {
            return false;
        }
        if (!fired.compareAndSet(false, true)) {
            return false;
        }

        log.info("[IdleGuard] Session finished successfully, running completion action");
        try {
            completionAction.run();
        } catch (RuntimeException e) {
            log.error("[IdleGuard] Completion action failed", e);
        }
        return true;
    }

    public boolean hasFired() {
        return fired.get();
    }

    /**
     * {@code session.idle}, or {@code session.status} whose status (or status
     * type) is {@code idle}.
     */
    public static boolean isIdleEvent(JsonNode event) {
        if (event == null || !event.isObject()) {
            return false;
        }
        String type = event.path("type").asText("");
        if (SESSION_IDLE.equals(type)) {
            return true;
        }
        return SESSION_STATUS.equals(type) && STATUS_IDLE.equals(statusType(event));
    }

    private static String statusType(JsonNode event) {
        JsonNode properties = event.path("properties");
        for (JsonNode status : List.of(properties.path("status"), event.path("status"))) {
            if (status.isObject() && status.path("type").isTextual()) {
                return status.get("type").asText();
            }
            if (status.isTextual()) {
                return status.asText();
            }
        }
        return null;
    }

    /**
     * Messages from the first source that answers. Empty when every source failed.
     */
    Optional<List<AgentMessage>> readMessages() {
        for (MessageSource source : sources) {
            try {
                List<AgentMessage> messages = source.fetchMessages();
                log.debug("[IdleGuard] Got {} messages from {}", messages.size(), source.name());
                return Optional.of(messages);
            } catch (MessageSourceException e) {
                log.debug("[IdleGuard] Source {} failed: {}", source.name(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[IdleGuard] Source {} failed unexpectedly: {}", source.name(), e.getMessage());
            }
        }
        log.warn("[IdleGuard] No message source could be read, not completing");
        return Optional.empty();
    }

    static boolean hasSuccessfulCompletion(List<AgentMessage> messages) {
        List<AgentMessage> assistantMessages = messages.stream().filter(AgentMessage::isAssistant).toList();
        if (assistantMessages.isEmpty()) {
            log.debug("[IdleGuard] No assistant messages, skipping completion");
            return false;
        }
        for (AgentMessage message : assistantMessages) {
            if (message.hasExplicitError()) {
                log.debug("[IdleGuard] Message {} has error {}", message.getId(), message.getError().get("name"));
            } else if (message.isSuccessfulCompletion()) {
                return true;
            }
        }
        log.debug("[IdleGuard] No successful assistant message among {}", assistantMessages.size());
        return false;
    }
}
