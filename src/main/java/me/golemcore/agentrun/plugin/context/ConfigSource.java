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
import java.util.Optional;

/**
 * Where agent configs, catalog entries and provider specs come from. One
 * implementation is selected at start-up by
 * {@code agentrun.plugins.dynamic-loading}.
 */
public interface ConfigSource {

    String name();

    List<AgentConfig> getAllConfigs();

    List<AgentCatalogEntry> getAllCatalog();

    List<ProviderSpec> getProviderSpecs();

    default Optional<AgentConfig> findConfig(String agentName) {
        return getAllConfigs().stream()
                .filter(config -> config.getName().equals(agentName))
                .findFirst();
    }

    default Optional<AgentCatalogEntry> findCatalogEntry(String agentName) {
        return getAllCatalog().stream()
                .filter(entry -> entry.getName().equals(agentName))
                .findFirst();
    }
}
