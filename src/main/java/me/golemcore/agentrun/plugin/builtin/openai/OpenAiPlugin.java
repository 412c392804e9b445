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

import me.golemcore.agentrun.domain.model.AgentCatalogEntry;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.AgentVendor;
import me.golemcore.agentrun.domain.model.ApiFormat;
import me.golemcore.agentrun.domain.model.ModelTier;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.builtin.AbstractProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;

/**
 * Built-in plugin for Codex CLI agents on the OpenAI API.
 */
public final class OpenAiPlugin extends AbstractProviderPlugin {

    private static final CodexCapabilities CAPABILITIES = new CodexCapabilities();

    public OpenAiPlugin() {
        super(
                "openai",
                "OpenAI",
                "Codex CLI backed by the OpenAI Responses API.",
                ProviderSpec.builder()
                        .id("openai")
                        .name("OpenAI")
                        .defaultBaseUrl("https://api.openai.com/v1")
                        .apiFormat(ApiFormat.OPENAI)
                        .authEnvVar("OPENAI_API_KEY")
                        .apiKey(ApiKeys.OPENAI_API_KEY)
                        .apiKey(ApiKeys.CODEX_AUTH_JSON)
                        .build());

        addCodex("gpt-5.2-codex", "GPT-5.2 Codex");
        addCodex("gpt-5.2", "GPT-5.2");
        addCodex("gpt-5.1-codex-mini", "GPT-5.1 Codex Mini");
    }

    private void addCodex(String model, String displayName) {
        String name = "codex/" + model;
        addAgent(
                AgentConfig.builder()
                        .name(name)
                        .command("codex")
                        .arg("--model")
                        .arg(model)
                        .arg("--dangerously-bypass-approvals-and-sandbox")
                        .apiKey(ApiKeys.OPENAI_API_KEY)
                        .apiKey(ApiKeys.CODEX_AUTH_JSON)
                        .capabilities(CAPABILITIES)
                        .build(),
                AgentCatalogEntry.builder()
                        .name(name)
                        .displayName(displayName)
                        .vendor(AgentVendor.OPENAI)
                        .requiredApiKey("OPENAI_API_KEY")
                        .tier(ModelTier.PAID)
                        .defaultVariant("medium")
                        .build());
    }
}
