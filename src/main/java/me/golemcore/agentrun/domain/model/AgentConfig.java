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
import me.golemcore.agentrun.plugin.api.AgentCapabilities;

import java.util.List;

/**
 * Execution config of one selectable agent: the CLI to launch and the optional
 * capabilities it supports.
 */
@Value
@Builder(toBuilder = true)
public class AgentConfig {

    /**
     * Unique name in the form {@code prefix[/variant][:tag]}, e.g.
     * {@code claude/opus-4.6} or {@code qwen/qwen3-coder:free}.
     */
    String name;
    String command;
    @Singular
    List<String> args;
    @Singular
    List<ApiKeyDescriptor> apiKeys;
    /** Prompt the terminal prints once the CLI is ready for input. */
    String waitForString;
    String enterKeySequence;
    @Builder.Default
    AgentCapabilities capabilities = AgentCapabilities.NONE;
    boolean disabled;
    String disabledReason;

    /**
     * Prefix before the first slash, e.g. {@code claude} for
     * {@code claude/opus-4.6}.
     */
    public String namePrefix() {
        if (name == null) {
            return null;
        }
        int slash = name.indexOf('/');
        return slash >= 0 ? name.substring(0, slash) : name;
    }
}
