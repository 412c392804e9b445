package me.golemcore.agentrun.plugin.builtin.gemini;

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
 * Built-in plugin for Gemini CLI agents.
 */
public final class GeminiPlugin extends AbstractProviderPlugin {

    private static final GeminiCapabilities CAPABILITIES = new GeminiCapabilities();

    public GeminiPlugin() {
        super(
                "gemini",
                "Google Gemini",
                "Gemini CLI backed by the Gemini API, completion read from local telemetry.",
                ProviderSpec.builder()
                        .id("gemini")
                        .name("Google Gemini")
                        .defaultBaseUrl("https://generativelanguage.googleapis.com")
                        .apiFormat(ApiFormat.PASSTHROUGH)
                        .authEnvVar("GEMINI_API_KEY")
                        .apiKey(ApiKeys.GEMINI_API_KEY)
                        .build());

        addGemini("2.5-pro", "gemini-2.5-pro", "Gemini 2.5 Pro", ModelTier.PAID);
        addGemini("2.5-flash", "gemini-2.5-flash", "Gemini 2.5 Flash", ModelTier.FREE);
    }

    private void addGemini(String variant, String model, String displayName, ModelTier tier) {
        String name = "gemini/" + variant;
        addAgent(
                AgentConfig.builder()
                        .name(name)
                        .command("gemini")
                        .arg("--model")
                        .arg(model)
                        .arg("--yolo")
                        .apiKey(ApiKeys.GEMINI_API_KEY)
                        .waitForString("Type your message")
                        .capabilities(CAPABILITIES)
                        .build(),
                AgentCatalogEntry.builder()
                        .name(name)
                        .displayName(displayName)
                        .vendor(AgentVendor.GOOGLE)
                        .requiredApiKey("GEMINI_API_KEY")
                        .tier(tier)
                        .build());
    }
}
