package me.golemcore.agentrun.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Normalized view of one message from an agent session, regardless of which
 * source produced it.
 */
@Value
@Builder
public class AgentMessage {

    private static final String ROLE_ASSISTANT = "assistant";
    private static final String FINISH_ERROR = "error";

    String id;
    String role;
    /** Finish reason reported by the agent, {@code null} while running. */
    String finish;
    /** Epoch millis of completion, {@code null} while running. */
    Long completedAt;
    /** Structured error object, {@code null} when the message did not fail. */
    Map<String, Object> error;

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean hasExplicitError() {
        return error != null;
    }

    /**
     * An assistant message without an error that either finished with a non-error
     * reason or carries a completion timestamp.
     */
    public boolean isSuccessfulCompletion() {
        if (!isAssistant() || hasExplicitError()) {
            return false;
        }
        boolean hasFinish = finish != null && !finish.isBlank() && !FINISH_ERROR.equals(finish);
        return hasFinish || completedAt != null;
    }
}
