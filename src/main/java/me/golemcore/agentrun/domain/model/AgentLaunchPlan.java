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
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start one agent run in a sandbox.
 */
@Value
@Builder
public class AgentLaunchPlan {

    AgentConfig config;
    /** {@code null} for agents whose name maps to no provider. */
    ResolvedProvider provider;
    AgentEnvironment environment;
    /**
     * Variables to export before launch: credentials mapped by the agent, then
     * the environment hook's own variables.
     */
    Map<String, String> exportedEnv;

    public List<String> commandLine() {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(config.getCommand());
        commandLine.addAll(config.getArgs());
        return commandLine;
    }
}
