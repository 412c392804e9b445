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

import java.util.List;
import java.util.Map;

/**
 * Sandbox preparation produced by an agent's environment hook.
 */
@Value
@Builder(toBuilder = true)
public class AgentEnvironment {

    @Singular("env")
    Map<String, String> envVars;
    @Singular
    List<EnvironmentFile> files;
    @Singular
    List<String> startupCommands;
    /** Commands run after the agent process is up, e.g. prompt submission. */
    @Singular
    List<String> postStartCommands;

    public static AgentEnvironment empty() {
        return AgentEnvironment.builder().build();
    }
}
