package me.golemcore.agentrun.plugin.builtin.anthropic;

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
import me.golemcore.agentrun.domain.model.ResolvedProvider;
import me.golemcore.agentrun.plugin.api.AgentCapabilities;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;
import me.golemcore.agentrun.plugin.builtin.EnvironmentFiles;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Claude Code signals the end of a turn through its {@code Stop} hook, which
 * writes {@code claude-complete-<taskRunId>} into the lifecycle directory.
 */
final class ClaudeCapabilities implements AgentCapabilities {

    static final String MARKER_PREFIX = "claude-complete-";
    private static final String STOP_HOOK = "/root/lifecycle/claude/stop-hook.sh";

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        String marker = context.getLifecycleDir() + "/" + MARKER_PREFIX + context.getTaskRunId();
        Map<String, Object> settings = Map.of(
                "hooks", Map.of("Stop", List.of(Map.of(
                        "hooks", List.of(Map.of("type", "command", "command", STOP_HOOK))))));

        AgentEnvironment.AgentEnvironmentBuilder environment = AgentEnvironment.builder()
                .file(EnvironmentFiles.markerScript(STOP_HOOK, marker))
                .file(EnvironmentFiles.json("$HOME/.claude/settings.json", settings))
                .env("DISABLE_AUTOUPDATER", "1")
                .startupCommand("mkdir -p " + context.getLifecycleDir());

        ResolvedProvider provider = context.getProvider();
        if (provider != null && provider.isOverridden()) {
            if (provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()) {
                environment.env("ANTHROPIC_BASE_URL", provider.getBaseUrl());
            }
            if (provider.getCustomHeaders() != null && !provider.getCustomHeaders().isEmpty()) {
                environment.env("ANTHROPIC_CUSTOM_HEADERS", provider.getCustomHeaders().entrySet().stream()
                        .map(header -> header.getKey() + ": " + header.getValue())
                        .collect(Collectors.joining("\n")));
            }
        }
        return environment.build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return ApiKeys.requireAny(context, ApiKeys.ANTHROPIC_API_KEY, ApiKeys.CLAUDE_CODE_OAUTH_TOKEN);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitMarker(detectors.lifecycleDir().resolve(MARKER_PREFIX + taskRunId)));
    }
}
