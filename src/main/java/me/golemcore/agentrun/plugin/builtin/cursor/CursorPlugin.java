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

import me.golemcore.agentrun.domain.model.AgentCatalogEntry;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.AgentVendor;
import me.golemcore.agentrun.domain.model.ApiFormat;
import me.golemcore.agentrun.domain.model.ModelTier;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.builtin.AbstractProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;

/**
 * Built-in plugin for Cursor CLI agents.
 */
public final class CursorPlugin extends AbstractProviderPlugin {

    private static final CursorCapabilities CAPABILITIES = new CursorCapabilities();

    public CursorPlugin() {
        super(
                "cursor",
                "Cursor",
                "cursor-agent CLI, completion read from its tool-call telemetry.",
                ProviderSpec.builder()
                        .id("cursor")
                        .name("Cursor")
                        .defaultBaseUrl("https://api2.cursor.sh")
                        .apiFormat(ApiFormat.PASSTHROUGH)
                        .authEnvVar("CURSOR_API_KEY")
                        .apiKey(ApiKeys.CURSOR_API_KEY)
                        .build());

        addCursor("opus-4.1", "opus-4.1", "Cursor Opus 4.1");
        addCursor("gpt-5", "gpt-5", "Cursor GPT-5");
        addCursor("sonnet-4", "sonnet-4", "Cursor Sonnet 4");
    }

    private void addCursor(String variant, String model, String displayName) {
        String name = "cursor/" + variant;
        addAgent(
                AgentConfig.builder()
                        .name(name)
                        .command("cursor-agent")
                        .arg("--force")
                        .arg("--model")
                        .arg(model)
                        .apiKey(ApiKeys.CURSOR_API_KEY)
                        .capabilities(CAPABILITIES)
                        .build(),
                AgentCatalogEntry.builder()
                        .name(name)
                        .displayName(displayName)
                        .vendor(AgentVendor.CURSOR)
                        .requiredApiKey("CURSOR_API_KEY")
                        .tier(ModelTier.PAID)
                        .build());
    }
}
