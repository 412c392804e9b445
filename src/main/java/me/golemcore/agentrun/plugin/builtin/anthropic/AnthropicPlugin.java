package me.golemcore.agentrun.plugin.builtin.anthropic;

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
 * Built-in plugin for Claude Code agents on the Anthropic API.
 */
public final class AnthropicPlugin extends AbstractProviderPlugin {

    private static final ClaudeCapabilities CAPABILITIES = new ClaudeCapabilities();

    public AnthropicPlugin() {
        super(
                "anthropic",
                "Anthropic",
                "Claude Code CLI backed by the Anthropic Messages API.",
                ProviderSpec.builder()
                        .id("anthropic")
                        .name("Anthropic")
                        .defaultBaseUrl("https://api.anthropic.com")
                        .apiFormat(ApiFormat.ANTHROPIC)
                        .authEnvVar("ANTHROPIC_API_KEY")
                        .authEnvVar("CLAUDE_CODE_OAUTH_TOKEN")
                        .apiKey(ApiKeys.ANTHROPIC_API_KEY)
                        .apiKey(ApiKeys.CLAUDE_CODE_OAUTH_TOKEN)
                        .build());

        addClaude("opus-4.6", "claude-opus-4-6", "Claude Opus 4.6", true);
        addClaude("sonnet-4.5", "claude-sonnet-4-5", "Claude Sonnet 4.5", false);
        addClaude("haiku-4.5", "claude-haiku-4-5", "Claude Haiku 4.5", false);
    }

    private void addClaude(String variant, String model, String displayName, boolean recommended) {
        String name = "claude/" + variant;
        AgentConfig config = AgentConfig.builder()
                .name(name)
                .command("claude")
                .arg("--model")
                .arg(model)
                .arg("--dangerously-skip-permissions")
                .apiKey(ApiKeys.ANTHROPIC_API_KEY)
                .apiKey(ApiKeys.CLAUDE_CODE_OAUTH_TOKEN)
                .capabilities(CAPABILITIES)
                .build();
        AgentCatalogEntry.AgentCatalogEntryBuilder entry = AgentCatalogEntry.builder()
                .name(name)
                .displayName(displayName)
                .vendor(AgentVendor.ANTHROPIC)
                .requiredApiKey("ANTHROPIC_API_KEY")
                .tier(ModelTier.PAID);
        if (recommended) {
            entry.tag("recommended");
        }
        addAgent(config, entry.build());
    }
}
