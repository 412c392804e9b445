package me.golemcore.agentrun.plugin.api;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Optional behaviour an agent config may support. Every method has a neutral
 * default, so an agent only overrides what it actually does.
 */
public interface AgentCapabilities {

    AgentCapabilities NONE = new AgentCapabilities() {
    };

    /**
     * Files, variables and commands the sandbox needs before the agent starts.
     */
    default AgentEnvironment environment(AgentEnvironmentContext context) {
        return AgentEnvironment.empty();
    }

    /**
     * Maps available credentials onto the variables the agent reads. The default
     * exports every declared key that has a value, renamed through
     * {@link ApiKeyDescriptor#getMapToEnvVar()} when set.
     */
    default Map<String, String> applyApiKeys(List<ApiKeyDescriptor> declaredKeys, Map<String, String> available) {
        Map<String, String> exported = new LinkedHashMap<>();
        for (ApiKeyDescriptor key : declaredKeys) {
            String value = available.get(key.getEnvVar());
            if (value != null && !value.isBlank()) {
                exported.put(key.targetEnvVar(), value);
            }
        }
        return exported;
    }

    /**
     * Human-readable list of unmet requirements. Empty when the agent can run.
     */
    default List<String> checkRequirements(AgentEnvironmentContext context) {
        return List.of();
    }

    /**
     * Starts the detector that signals the end of the run, when the agent has one.
     */
    default Optional<CompletableFuture<Void>> startCompletionDetector(String taskRunId,
            CompletionDetectors detectors) {
        return Optional.empty();
    }
}
