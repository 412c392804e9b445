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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.AgentCatalogEntry;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.api.ProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.BuiltinPluginCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves the builtin plugin tables as they are, without validation or
 * lifecycle hooks.
 */
@Slf4j
public class StaticConfigSource implements ConfigSource {

    private final List<ProviderPlugin> plugins;

    public StaticConfigSource(BuiltinPluginCatalog catalog) {
        Map<String, ProviderPlugin> byId = new LinkedHashMap<>();
        for (ProviderPlugin plugin : catalog.createPlugins()) {
            byId.put(plugin.manifest().getId(), plugin);
        }
        this.plugins = PluginOrder.sort(byId);
        log.info("[Plugins] Using static config tables from {} builtin plugins", plugins.size());
    }

    @Override
    public String name() {
        return "static";
    }

    @Override
    public List<AgentConfig> getAllConfigs() {
        return plugins.stream().flatMap(plugin -> plugin.configs().stream()).toList();
    }

    @Override
    public List<AgentCatalogEntry> getAllCatalog() {
        return plugins.stream().flatMap(plugin -> plugin.catalog().stream()).toList();
    }

    @Override
    public List<ProviderSpec> getProviderSpecs() {
        return plugins.stream()
                .map(plugin -> plugin.provider().toBuilder()
                        .id(plugin.manifest().getId())
                        .name(plugin.manifest().getName())
                        .build())
                .toList();
    }
}
