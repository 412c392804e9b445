package me.golemcore.agentrun.plugin.builtin.amp;

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
import me.golemcore.agentrun.plugin.api.AgentCapabilities;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;
import me.golemcore.agentrun.plugin.builtin.EnvironmentFiles;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Amp runs in execute mode through a wrapper that writes
 * {@code amp-complete-<taskRunId>} when the CLI exits cleanly.
 */
final class AmpCapabilities implements AgentCapabilities {

    static final String MARKER_PREFIX = "amp-complete-";
    static final String WRAPPER = "/root/lifecycle/amp/run.sh";

    @Override
    public AgentEnvironment environment(AgentEnvironmentContext context) {
        String marker = context.getLifecycleDir() + "/" + MARKER_PREFIX + context.getTaskRunId();
        String wrapper = "#!/bin/bash\n"
                + "set -u\n"
                + "amp \"$@\"\n"
                + "status=$?\n"
                + "if [ \"$status\" -eq 0 ]; then\n"
                + "  mkdir -p '" + context.getLifecycleDir() + "'\n"
                + "  printf '%s\\n' completed > '" + marker + "'\n"
                + "fi\n"
                + "exit \"$status\"\n";
        return AgentEnvironment.builder()
                .file(EnvironmentFiles.script(WRAPPER, wrapper))
                .env("AMP_SKIP_UPDATE_CHECK", "1")
                .build();
    }

    @Override
    public List<String> checkRequirements(AgentEnvironmentContext context) {
        return ApiKeys.requireAny(context, ApiKeys.AMP_API_KEY);
    }

    @Override
    public Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId, CompletionDetectors detectors) {
        return Optional.of(detectors.awaitMarker(detectors.lifecycleDir().resolve(MARKER_PREFIX + taskRunId)));
    }
}
