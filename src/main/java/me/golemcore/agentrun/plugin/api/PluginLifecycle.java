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

import me.golemcore.agentrun.domain.model.PluginHealth;

import java.util.Optional;

/**
 * Lifecycle hooks a provider plugin may implement. Every hook is optional.
 */
public interface PluginLifecycle {

    /**
     * Called once after the plugin passed validation.
     */
    default void initialize() throws Exception {
    }

    /**
     * Plugin-specific health probe. An empty result means the plugin defines no
     * health check.
     */
    default Optional<PluginHealth> healthCheck() throws Exception {
        return Optional.empty();
    }

    /**
     * Called when the loader shuts down.
     */
    default void shutdown() throws Exception {
    }
}
