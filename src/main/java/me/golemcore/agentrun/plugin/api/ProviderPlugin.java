package me.golemcore.agentrun.plugin.api;

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
import me.golemcore.agentrun.domain.model.ProviderSpec;

import java.util.List;
import java.util.Optional;

/**
 * Bundle of one provider's connection spec, agent configs and catalog entries.
 * This is the only contract a new provider implements to join the registry.
 */
public interface ProviderPlugin {

    PluginManifest manifest();

    ProviderSpec provider();

    List<AgentConfig> configs();

    List<AgentCatalogEntry> catalog();

    /**
     * Optional lifecycle hooks. Plugins without them are considered initialized as
     * soon as they are loaded.
     */
    default Optional<PluginLifecycle> lifecycle() {
        return Optional.empty();
    }
}
