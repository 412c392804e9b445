package me.golemcore.agentrun.provider;

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

import java.util.Map;
import java.util.Optional;

/**
 * Maps the prefix of an agent name to the provider that serves it.
 */
public final class AgentProviderPrefixes {

    private static final Map<String, String> PROVIDER_BY_PREFIX = Map.of(
            "claude", "anthropic",
            "codex", "openai",
            "gemini", "gemini",
            "opencode", "openrouter",
            "qwen", "qwen",
            "amp", "amp",
            "cursor", "cursor");

    private AgentProviderPrefixes() {
    }

    /**
     * Provider id for an agent name such as {@code claude/opus-4.6}.
     */
    public static Optional<String> providerIdFor(String agentName) {
        if (agentName == null || agentName.isBlank()) {
            return Optional.empty();
        }
        int slash = agentName.indexOf('/');
        String prefix = slash >= 0 ? agentName.substring(0, slash) : agentName;
        return Optional.ofNullable(PROVIDER_BY_PREFIX.get(prefix));
    }
}
