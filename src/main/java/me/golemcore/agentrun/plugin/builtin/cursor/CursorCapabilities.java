package me.golemcore.agentrun.plugin.builtin.cursor;

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
 * Cursor agents are given a {@code complete_task} tool through MCP and finish
 * by calling it. Tool calls land in the telemetry log as
 * {@code function_name=complete_task}.
 */
final class CursorCapabilities implements AgentCapabilities {

    static String telemetryFileName(String taskRunId) {
        return "cursor-telemetry-" + taskRunId + ".log";
    }

    static String telemetryPath(AgentEnvironmentContext context) {
        return context.getTelemetryDir() + "/" + telemetryFileName(context.getTaskRunId());
    }

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        Map<String, Object> cliConfig = Map.of(
                "telemetry", Map.of(
                        "enabled", true,
                        "outfile", telemetryPath(context)));
        return AgentEnvironment.builder()
                .file(EnvironmentFiles.json("$HOME/.cursor/cli-config.json", cliConfig))
                .build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return ApiKeys.requireAny(context, ApiKeys.CURSOR_API_KEY);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitTelemetryEvent(
                detectors.telemetryDir().resolve(telemetryFileName(taskRunId)),
                CompletionEventPredicates.taskToolCall()));
    }
}
