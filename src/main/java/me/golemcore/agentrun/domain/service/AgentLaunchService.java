package me.golemcore.agentrun.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.AgentEnvironment;
import me.golemcore.agentrun.domain.model.AgentEnvironmentContext;
import me.golemcore.agentrun.domain.model.AgentLaunchPlan;
import me.golemcore.agentrun.domain.model.ProviderOverride;
import me.golemcore.agentrun.domain.model.ResolvedProvider;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import me.golemcore.agentrun.plugin.api.AgentCapabilities;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import me.golemcore.agentrun.plugin.context.ConfigSource;
import me.golemcore.agentrun.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Prepares agent runs and starts their completion detection.
 *
 * <p>
 * Preparing a run looks up the agent config in the active
 * {@link ConfigSource}, resolves its provider with the team's overrides, checks
 * requirements and builds the sandbox environment through the agent's
 * {@link AgentCapabilities}.
 */
@Service
@Slf4j
public class AgentLaunchService {

    private final ConfigSource configSource;
    private final ProviderRegistry providerRegistry;
    private final CompletionDetectors completionDetectors;
    private final AgentRunProperties properties;

    public AgentLaunchService(ConfigSource configSource, ProviderRegistry providerRegistry,
            CompletionDetectors completionDetectors, AgentRunProperties properties) {
        this.configSource = configSource;
        this.providerRegistry = providerRegistry;
        this.completionDetectors = completionDetectors;
        this.properties = properties;
    }

    /**
     * @throws IllegalArgumentException
     *             if no config has this name
     * @throws IllegalStateException
     *             if the agent is disabled or its requirements are not met
     */
    public AgentLaunchPlan prepare(String agentName, List<ProviderOverride> overrides,
            AgentEnvironmentContext context) {
        AgentConfig config = configSource.findConfig(agentName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentName));
        if (config.isDisabled()) {
            String reason = config.getDisabledReason() != null ? ": " + config.getDisabledReason() : "";
            throw new IllegalStateException("Agent " + agentName + " is disabled" + reason);
        }

        ResolvedProvider provider = providerRegistry.resolveForAgent(agentName, overrides).orElse(null);
        AgentEnvironmentContext runContext = context.toBuilder()
                .provider(provider)
                .lifecycleDir(properties.getDetection().getLifecycleDir())
                .telemetryDir(properties.getDetection().getTelemetryDir())
                .build();

        AgentCapabilities capabilities = config.getCapabilities();
        List<String> missing = capabilities.checkRequirements(runContext);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Agent " + agentName + " cannot run: " + String.join(", ", missing));
        }

        AgentEnvironment environment = capabilities.environment(runContext);
        Map<String, String> exportedEnv = new LinkedHashMap<>(
                capabilities.applyApiKeys(config.getApiKeys(), runContext.getApiKeys()));
        exportedEnv.putAll(environment.getEnvVars());

        log.info("[Launch] Prepared {} for task run {} (provider: {}, overridden: {})", agentName,
                runContext.getTaskRunId(), provider != null ? provider.getId() : "none",
                provider != null && provider.isOverridden());
        return AgentLaunchPlan.builder()
                .config(config)
                .provider(provider)
                .environment(environment)
                .exportedEnv(exportedEnv)
                .build();
    }

    /**
     * Starts the agent's completion detector for a task run.
     *
     * @return empty if the agent has no way to signal completion
     */
    public Optional<CompletableFuture<Void>> startCompletionDetection(AgentConfig config, String taskRunId) {
        Optional<CompletableFuture<Void>> detection = config.getCapabilities()
                .startCompletionDetector(taskRunId, completionDetectors);
        if (detection.isEmpty()) {
            log.debug("[Launch] {} has no completion detector", config.getName());
            return detection;
        }
        log.info("[Completion] Detection started for {} (task run {})", config.getName(), taskRunId);
        detection.get().whenComplete((ignored, error) -> {
            if (error == null) {
                log.info("[Completion] Task run {} completed", taskRunId);
            } else {
                log.warn("[Completion] Detection for task run {} ended without completion: {}", taskRunId,
                        error.getMessage());
            }
        });
        return detection;
    }
}
