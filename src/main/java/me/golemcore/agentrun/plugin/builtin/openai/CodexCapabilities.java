package me.golemcore.agentrun.plugin.builtin.openai;

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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Codex reports finished turns to its {@code notify} program. The script
 * installed here writes {@code codex-complete-<taskRunId>} on
 * {@code agent-turn-complete}.
 */
final class CodexCapabilities implements AgentCapabilities {

    static final String MARKER_PREFIX = "codex-complete-";
    private static final String NOTIFY_SCRIPT = "/root/lifecycle/codex/notify.sh";

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        String marker = context.getLifecycleDir() + "/" + MARKER_PREFIX + context.getTaskRunId();
        String notify = "#!/bin/bash\n"
                + "set -eu\n"
                + "case \"${1:-}\" in\n"
                + "  *'\"agent-turn-complete\"'*)\n"
                + "    mkdir -p '" + context.getLifecycleDir() + "'\n"
                + "    printf '%s\\n' completed > '" + marker + "'\n"
                + "    ;;\n"
                + "esac\n";
        String config = "notify = [\"" + NOTIFY_SCRIPT + "\"]\n"
                + "approval_policy = \"never\"\n"
                + "sandbox_mode = \"danger-full-access\"\n";

        AgentEnvironment.AgentEnvironmentBuilder environment = AgentEnvironment.builder()
                .file(EnvironmentFiles.script(NOTIFY_SCRIPT, notify))
                .file(EnvironmentFiles.text("$HOME/.codex/config.toml", config));

        if (context.hasApiKey(ApiKeys.CODEX_AUTH_JSON.getEnvVar())) {
            environment.file(EnvironmentFiles.text("$HOME/.codex/auth.json",
                    context.apiKey(ApiKeys.CODEX_AUTH_JSON.getEnvVar())));
        }
        ResolvedProvider provider = context.getProvider();
        if (provider != null && provider.isOverridden() && provider.getBaseUrl() != null
                && !provider.getBaseUrl().isBlank()) {
            environment.env("OPENAI_BASE_URL", provider.getBaseUrl());
        }
        return environment.build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return ApiKeys.requireAny(context, ApiKeys.OPENAI_API_KEY, ApiKeys.CODEX_AUTH_JSON);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitMarker(detectors.lifecycleDir().resolve(MARKER_PREFIX + taskRunId)));
    }
}
