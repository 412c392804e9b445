package me.golemcore.agentrun.plugin.builtin.amp;

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
 * Built-in plugin for the Amp agent.
 */
public final class AmpPlugin extends AbstractProviderPlugin {

    public AmpPlugin() {
        super(
                "amp",
                "Amp",
                "Sourcegraph Amp CLI.",
                ProviderSpec.builder()
                        .id("amp")
                        .name("Amp")
                        .defaultBaseUrl("https://ampcode.com")
                        .apiFormat(ApiFormat.PASSTHROUGH)
                        .authEnvVar("AMP_API_KEY")
                        .apiKey(ApiKeys.AMP_API_KEY)
                        .build());

        addAgent(
                AgentConfig.builder()
                        .name("amp")
                        .command(AmpCapabilities.WRAPPER)
                        .arg("--dangerously-allow-all")
                        .apiKey(ApiKeys.AMP_API_KEY)
                        .capabilities(new AmpCapabilities())
                        .build(),
                AgentCatalogEntry.builder()
                        .name("amp")
                        .displayName("Amp")
                        .vendor(AgentVendor.AMP)
                        .requiredApiKey("AMP_API_KEY")
                        .tier(ModelTier.PAID)
                        .build());
    }
}
