package me.golemcore.agentrun.plugin.validation;

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

/**
 * Knobs for {@link PluginValidator}.
 *
 * @param strictCatalogMatch
 *            treat an enabled config without a catalog entry as an error
 *            instead of a warning. Off by default because plugins that discover
 *            models at runtime register configs the static catalog cannot list.
 */
public record PluginValidationOptions(boolean strictCatalogMatch) {

    public static final PluginValidationOptions DEFAULT = new PluginValidationOptions(false);

    public static PluginValidationOptions strict() {
        return new PluginValidationOptions(true);
    }
}
