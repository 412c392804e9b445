package me.golemcore.agentrun.plugin.builtin.gemini;

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
import me.golemcore.agentrun.plugin.api.AgentCapabilities;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;
import me.golemcore.agentrun.plugin.builtin.EnvironmentFiles;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Gemini CLI writes local OpenTelemetry logs. A turn is over when the CLI hands
 * the next turn back to the user or the agent finishes with a {@code GOAL}
 * termination.
 */
final class GeminiCapabilities implements AgentCapabilities {

    static String telemetryFileName(String taskRunId) {
        return "gemini-telemetry-" + taskRunId + ".log";
    }

    static String telemetryPath(AgentEnvironmentContext context) {
        return context.getTelemetryDir() + "/" + telemetryFileName(context.getTaskRunId());
    }

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        Map<String, Object> settings = Map.of(
                "telemetry", Map.of(
                        "enabled", true,
                        "target", "local",
                        "otlpEndpoint", "",
                        "outfile", telemetryPath(context)),
                "security", Map.of("auth", Map.of("selectedType", "gemini-api-key")));
        return AgentEnvironment.builder()
                .file(EnvironmentFiles.json("$HOME/.gemini/settings.json", settings))
                .env("GEMINI_CLI_NO_RELAUNCH", "true")
                .build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return ApiKeys.requireAny(context, ApiKeys.GEMINI_API_KEY);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitTelemetryEvent(
                detectors.telemetryDir().resolve(telemetryFileName(taskRunId)),
                CompletionEventPredicates.anyOf(
                        CompletionEventPredicates.nextSpeakerIsUser(),
                        CompletionEventPredicates.goalTermination())));
    }
}
