package me.golemcore.agentrun.plugin.builtin.opencode;

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

import me.golemcore.agentrun.domain.model.AgentEnvironment;
import me.golemcore.agentrun.domain.model.AgentEnvironmentContext;
import me.golemcore.agentrun.domain.model.ApiKeyDescriptor;
import me.golemcore.agentrun.plugin.api.AgentCapabilities;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;
import me.golemcore.agentrun.plugin.builtin.EnvironmentFiles;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * OpenCode runs as a local server. Completion detection subscribes to its event
 * stream; the idle completion guard writes {@code opencode-complete-<taskRunId>}
 * once an idle session produced a successful assistant message.
 */
final class OpenCodeCapabilities implements AgentCapabilities {

    static final String MARKER_PREFIX = "opencode-complete-";

    private static final Map<String, ApiKeyDescriptor> AUTH_PROVIDERS = Map.of(
            "anthropic", ApiKeys.ANTHROPIC_API_KEY,
            "openai", ApiKeys.OPENAI_API_KEY,
            "openrouter", ApiKeys.OPENROUTER_API_KEY,
            "xai", ApiKeys.XAI_API_KEY);

    private final ApiKeyDescriptor requiredKey;

    /**
     * @param requiredKey
     *            key the model needs, {@code null} for free models that skip auth
     */
    OpenCodeCapabilities(ApiKeyDescriptor requiredKey) {
        this.requiredKey = requiredKey;
    }

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        AgentEnvironment.AgentEnvironmentBuilder environment = AgentEnvironment.builder()
                .startupCommand("mkdir -p " + context.getLifecycleDir());
        if (requiredKey == null) {
            return environment.build();
        }

        Map<String, Object> auth = new LinkedHashMap<>();
        AUTH_PROVIDERS.forEach((provider, key) -> {
            if (context.hasApiKey(key.getEnvVar())) {
                auth.put(provider, Map.of("type", "api", "key", context.apiKey(key.getEnvVar())));
            }
        });
        if (!auth.isEmpty()) {
            environment.file(EnvironmentFiles.json("$HOME/.local/share/opencode/auth.json", auth));
        }
        return environment.build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return requiredKey == null ? List.of() : ApiKeys.requireAny(context, requiredKey);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitIdleSession(detectors.lifecycleDir().resolve(MARKER_PREFIX + taskRunId)));
    }
}
