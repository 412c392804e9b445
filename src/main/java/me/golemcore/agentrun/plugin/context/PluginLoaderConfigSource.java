package me.golemcore.agentrun.plugin.context;

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
import me.golemcore.agentrun.domain.model.ProviderSpec;

import java.util.List;

/**
 * Serves validated plugins through the {@link PluginLoader}, loading them on
 * first use.
 */
public class PluginLoaderConfigSource implements ConfigSource {

    private final PluginLoader pluginLoader;

    public PluginLoaderConfigSource(PluginLoader pluginLoader) {
        this.pluginLoader = pluginLoader;
    }

    @Override
    public String name() {
        return "plugin-loader";
    }

    @Override
    public List<AgentConfig> getAllConfigs() {
        pluginLoader.loadAll();
        return pluginLoader.getAllConfigs();
    }

    @Override
    public List<AgentCatalogEntry> getAllCatalog() {
        pluginLoader.loadAll();
        return pluginLoader.getAllCatalog();
    }

    @Override
    public List<ProviderSpec> getProviderSpecs() {
        pluginLoader.loadAll();
        return pluginLoader.getAllProviderSpecs();
    }
}
