package me.golemcore.agentrun.plugin.builtin;

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
import me.golemcore.agentrun.domain.model.PluginManifest;
import me.golemcore.agentrun.domain.model.PluginType;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.api.ProviderPlugin;

import java.util.ArrayList;
import java.util.List;

public abstract class AbstractProviderPlugin implements ProviderPlugin {

    private static final String DEFAULT_PLUGIN_VERSION = "1.0.0";

    private final PluginManifest pluginManifest;
    private final ProviderSpec providerSpec;
    private final List<AgentConfig> agentConfigs = new ArrayList<>();
    private final List<AgentCatalogEntry> catalogEntries = new ArrayList<>();

    protected AbstractProviderPlugin(String id, String name, String description, ProviderSpec providerSpec) {
        this.pluginManifest = PluginManifest.builder()
                .id(id)
                .name(name)
                .version(DEFAULT_PLUGIN_VERSION)
                .description(description)
                .type(PluginType.BUILTIN)
                .build();
        this.providerSpec = providerSpec;
    }

    @Override
    public PluginManifest manifest() {
        return pluginManifest;
    }

    @Override
    public ProviderSpec provider() {
        return providerSpec;
    }

    @Override
    public List<AgentConfig> configs() {
        return List.copyOf(agentConfigs);
    }

    @Override
    public List<AgentCatalogEntry> catalog() {
        return List.copyOf(catalogEntries);
    }

    protected void addAgent(AgentConfig config, AgentCatalogEntry entry) {
        agentConfigs.add(config);
        catalogEntries.add(entry);
    }
}
