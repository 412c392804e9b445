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
import lombok.Value;
import me.golemcore.agentrun.plugin.api.ProviderPlugin;

import java.time.Instant;
import java.util.List;

/**
 * A validated plugin together with the runtime metadata the loader tracks for
 * it.
 */
@Value
@Builder(toBuilder = true)
public class LoadedPlugin {

    ProviderPlugin plugin;
    String loadedFrom;
    Instant loadedAt;
    boolean initialized;
    /** Message of the failed {@code initialize} hook, {@code null} otherwise. */
    String initError;

    public PluginManifest getManifest() {
        return plugin.manifest();
    }

    public ProviderSpec getProvider() {
        return plugin.provider();
    }

    public List<AgentConfig> getConfigs() {
        return plugin.configs();
    }

    public List<AgentCatalogEntry> getCatalog() {
        return plugin.catalog();
    }
}
