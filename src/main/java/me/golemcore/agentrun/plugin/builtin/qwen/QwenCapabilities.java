package me.golemcore.agentrun.plugin.builtin.qwen;

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

import me.golemcore.agentrun.detection.CompletionEventPredicates;
import me.golemcore.agentrun.domain.model.AgentEnvironment;
import me.golemcore.agentrun.domain.model.AgentEnvironmentContext;
import me.golemcore.agentrun.domain.model.ApiKeyDescriptor;
import me.golemcore.agentrun.domain.model.ResolvedProvider;
import me.golemcore.agentrun.plugin.api.AgentCapabilities;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;
import me.golemcore.agentrun.plugin.builtin.EnvironmentFiles;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Qwen Code speaks the OpenAI protocol to whichever backend serves the model,
 * and logs telemetry the same way Gemini CLI does.
 */
final class QwenCapabilities implements AgentCapabilities {

    private final ApiKeyDescriptor apiKey;
    private final String baseUrl;
    private final String model;

    QwenCapabilities(ApiKeyDescriptor apiKey, String baseUrl, String model) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
    }

    static String telemetryFileName(String taskRunId) {
        return "qwen-telemetry-" + taskRunId + ".log";
    }

    static String telemetryPath(AgentEnvironmentContext context) {
        return context.getTelemetryDir() + "/" + telemetryFileName(context.getTaskRunId());
    }

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        ResolvedProvider provider = context.getProvider();
        String effectiveBaseUrl = provider != null && provider.isOverridden() && provider.getBaseUrl() != null
                && !provider.getBaseUrl().isBlank() ? provider.getBaseUrl() : baseUrl;

        Map<String, Object> settings = Map.of(
                "telemetry", Map.of(
                        "enabled", true,
                        "target", "local",
                        "otlpEndpoint", "",
                        "outfile", telemetryPath(context)),
                "security", Map.of("auth", Map.of("selectedType", "openai")));

        AgentEnvironment.AgentEnvironmentBuilder environment = AgentEnvironment.builder()
                .file(EnvironmentFiles.json("$HOME/.qwen/settings.json", settings))
                .env("OPENAI_BASE_URL", effectiveBaseUrl)
                .env("OPENAI_MODEL", model);
        String key = context.apiKey(apiKey.getEnvVar());
        if (key != null && !key.isBlank()) {
            environment.env("OPENAI_API_KEY", key);
        }
        return environment.build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return ApiKeys.requireAny(context, apiKey);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitTelemetryEvent(
                detectors.telemetryDir().resolve(telemetryFileName(taskRunId)),
                CompletionEventPredicates.nextSpeakerIsUser()));
    }
}
