package me.golemcore.agentrun.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Inputs available to capability hooks when an agent run is being prepared.
 */
@Value
@Builder(toBuilder = true)
public class AgentEnvironmentContext {

    String taskRunId;
    String prompt;
    /** Credential values available to the run, keyed by variable name. */
    @Singular
    Map<String, String> apiKeys;
    /** Provider resolved for the run, {@code null} when none applies. */
    ResolvedProvider provider;
    /** Directory inside the sandbox where completion markers are written. */
    @Builder.Default
    String lifecycleDir = "/root/lifecycle";
    /** Directory inside the sandbox where agents write telemetry logs. */
    @Builder.Default
    String telemetryDir = "/tmp";

    public String apiKey(String envVar) {
        return apiKeys.get(envVar);
    }

    public boolean hasApiKey(String envVar) {
        String value = apiKeys.get(envVar);
        return value != null && !value.isBlank();
    }
}
