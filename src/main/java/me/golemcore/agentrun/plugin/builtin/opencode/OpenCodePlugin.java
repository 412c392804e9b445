package me.golemcore.agentrun.plugin.builtin.opencode;

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
import me.golemcore.agentrun.domain.model.ApiKeyDescriptor;
import me.golemcore.agentrun.domain.model.ModelTier;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.builtin.AbstractProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;

import java.util.List;

/**
 * Built-in plugin for OpenCode agents. OpenCode routes each model to its own
 * upstream, so a config only needs the key of the model it runs.
 */
public final class OpenCodePlugin extends AbstractProviderPlugin {

    static final String HTTP_HOST = "127.0.0.1";
    static final int HTTP_PORT = 4096;

    private static final List<String> BASE_ARGS = List.of("--hostname", HTTP_HOST, "--port",
            String.valueOf(HTTP_PORT));

    public OpenCodePlugin() {
        super(
                "opencode",
                "OpenCode",
                "OpenCode server with free Zen models and bring-your-own-key upstreams.",
                ProviderSpec.builder()
                        .id("opencode")
                        .name("OpenCode")
                        .defaultBaseUrl("https://opencode.ai/zen/v1")
                        .apiFormat(ApiFormat.OPENAI)
                        .authEnvVar("OPENROUTER_API_KEY")
                        .apiKey(ApiKeys.OPENROUTER_API_KEY)
                        .apiKey(ApiKeys.ANTHROPIC_API_KEY)
                        .apiKey(ApiKeys.OPENAI_API_KEY)
                        .apiKey(ApiKeys.XAI_API_KEY)
                        .build());

        addOpenCode("big-pickle", "opencode/big-pickle", "Big Pickle", AgentVendor.OPENCODE, null);
        addOpenCode("grok-code", "opencode/grok-code", "Grok Code Fast", AgentVendor.XAI, null);
        addOpenCode("sonnet-4", "anthropic/claude-sonnet-4-20250514", "Claude Sonnet 4 (OpenCode)",
                AgentVendor.ANTHROPIC, ApiKeys.ANTHROPIC_API_KEY);
        addOpenCode("gpt-5", "openai/gpt-5", "GPT-5 (OpenCode)", AgentVendor.OPENAI, ApiKeys.OPENAI_API_KEY);
        addOpenCode("kimi-k2", "openrouter/moonshotai/kimi-k2", "Kimi K2 (OpenCode)", AgentVendor.OPENROUTER,
                ApiKeys.OPENROUTER_API_KEY);
    }

    private void addOpenCode(String variant, String model, String displayName, AgentVendor vendor,
            ApiKeyDescriptor requiredKey) {
        String name = "opencode/" + variant;
        AgentConfig.AgentConfigBuilder config = AgentConfig.builder()
                .name(name)
                .command("opencode")
                .args(BASE_ARGS)
                .arg("--model")
                .arg(model)
                .capabilities(new OpenCodeCapabilities(requiredKey));
        AgentCatalogEntry.AgentCatalogEntryBuilder entry = AgentCatalogEntry.builder()
                .name(name)
                .displayName(displayName)
                .vendor(vendor);
        if (requiredKey == null) {
            entry.tier(ModelTier.FREE).tag("free");
        } else {
            config.apiKey(requiredKey);
            entry.tier(ModelTier.PAID).requiredApiKey(requiredKey.getEnvVar());
        }
        addAgent(config.build(), entry.build());
    }
}
