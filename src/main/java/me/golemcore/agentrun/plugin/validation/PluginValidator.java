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

import me.golemcore.agentrun.domain.model.AgentCatalogEntry;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.ApiKeyDescriptor;
import me.golemcore.agentrun.domain.model.PluginManifest;
import me.golemcore.agentrun.domain.model.PluginValidationResult;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.api.ProviderPlugin;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates provider plugins before the loader accepts them.
 *
 * <p>
 * Validation runs in two phases:
 * <ol>
 * <li>Structure: manifest identity, provider connection fields, and the shape
 * of every config and catalog entry. Any structural error ends validation
 * there.</li>
 * <li>Cross checks between configs and catalog:
 * <ul>
 * <li>a catalog entry without a config is always an error</li>
 * <li>an enabled config without a catalog entry is a warning, or an error in
 * strict mode</li>
 * <li>an unknown agent name prefix is a warning</li>
 * </ul>
 * </li>
 * </ol>
 *
 * <p>
 * Errors are reported as {@code path: message}, e.g.
 * {@code configs.2.command: Command is required}.
 */
@Component
public class PluginValidator {

    private static final Pattern PLUGIN_ID = Pattern.compile("^[a-z][a-z0-9-]*$");
    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Pattern AGENT_NAME = Pattern.compile("^[a-z][a-z0-9-]*(/[a-z0-9.:_-]+)?$");

    static final Set<String> KNOWN_PREFIXES = Set.of("claude", "codex", "gemini", "opencode", "amp", "cursor",
            "qwen");

    public PluginValidationResult validate(ProviderPlugin plugin) {
        return validate(plugin, PluginValidationOptions.DEFAULT);
    }

    public PluginValidationResult validate(ProviderPlugin plugin, PluginValidationOptions options) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (plugin == null) {
            errors.add("plugin: Plugin is required");
            return PluginValidationResult.of(errors, warnings);
        }

        List<AgentConfig> configs = plugin.configs();
        List<AgentCatalogEntry> catalog = plugin.catalog();
        validateManifest(plugin.manifest(), errors);
        validateProvider(plugin.provider(), errors);
        validateConfigs(configs, errors);
        validateCatalog(catalog, errors);
        if (!errors.isEmpty()) {
            return PluginValidationResult.of(errors, warnings);
        }

        Set<String> catalogNames = catalog.stream().map(AgentCatalogEntry::getName).collect(Collectors.toSet());
        for (AgentConfig config : configs) {
            if (config.isDisabled() || catalogNames.contains(config.getName())) {
                continue;
            }
            String message = "Config '" + config.getName() + "' has no matching catalog entry";
            if (options.strictCatalogMatch()) {
                errors.add(message);
            } else {
                warnings.add(message);
            }
        }

        Set<String> configNames = configs.stream().map(AgentConfig::getName).collect(Collectors.toSet());
        for (AgentCatalogEntry entry : catalog) {
            if (!configNames.contains(entry.getName())) {
                errors.add("Catalog entry '" + entry.getName() + "' has no matching config");
            }
        }

        for (AgentConfig config : configs) {
            String prefix = config.namePrefix();
            if (!KNOWN_PREFIXES.contains(prefix)) {
                warnings.add("Config '" + config.getName() + "' has non-standard prefix '" + prefix + "'");
            }
        }

        return PluginValidationResult.of(errors, warnings);
    }

    /**
     * @throws IllegalArgumentException
     *             listing every error, one per line, when the plugin is invalid
     */
    public void assertValidPlugin(ProviderPlugin plugin, PluginValidationOptions options) {
        PluginValidationResult result = validate(plugin, options);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid plugin:\n" + String.join("\n", result.errors()));
        }
    }

    private void validateManifest(PluginManifest manifest, List<String> errors) {
        if (manifest == null) {
            errors.add("manifest: Manifest is required");
            return;
        }
        if (isBlank(manifest.getId())) {
            errors.add("manifest.id: Plugin ID is required");
        } else if (!PLUGIN_ID.matcher(manifest.getId()).matches()) {
            errors.add("manifest.id: Plugin ID must start with lowercase letter and contain only lowercase "
                    + "letters, numbers, and hyphens");
        }
        if (isBlank(manifest.getName())) {
            errors.add("manifest.name: Plugin name is required");
        }
        if (manifest.getVersion() == null || !SEMVER.matcher(manifest.getVersion()).matches()) {
            errors.add("manifest.version: Version must be in semver format (e.g., 1.0.0)");
        }
        if (manifest.getType() == null) {
            errors.add("manifest.type: Plugin type is required");
        }
    }

    private void validateProvider(ProviderSpec provider, List<String> errors) {
        if (provider == null) {
            errors.add("provider: Provider spec is required");
            return;
        }
        if (isBlank(provider.getId())) {
            errors.add("provider.id: Provider ID is required");
        }
        if (!isAbsoluteUrl(provider.getDefaultBaseUrl())) {
            errors.add("provider.defaultBaseUrl: Default base URL must be a valid URL");
        }
        if (provider.getApiFormat() == null) {
            errors.add("provider.apiFormat: API format is required");
        }
        List<String> authEnvVars = provider.getAuthEnvVars();
        if (authEnvVars == null || authEnvVars.isEmpty()) {
            errors.add("provider.authEnvVars: At least one auth env var required");
        } else {
            for (int i = 0; i < authEnvVars.size(); i++) {
                if (isBlank(authEnvVars.get(i))) {
                    errors.add("provider.authEnvVars." + i + ": Env var name is required");
                }
            }
        }
        validateApiKeys("provider.apiKeys", provider.getApiKeys(), errors);
        if (provider.getBaseUrlKey() != null) {
            validateApiKey("provider.baseUrlKey", provider.getBaseUrlKey(), errors);
        }
    }

    private void validateConfigs(List<AgentConfig> configs, List<String> errors) {
        if (configs == null || configs.isEmpty()) {
            errors.add("configs: At least one agent config required");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < configs.size(); i++) {
            String path = "configs." + i;
            AgentConfig config = configs.get(i);
            if (config == null) {
                errors.add(path + ": Config is required");
                continue;
            }
            if (!isAgentName(config.getName())) {
                errors.add(path + ".name: Agent name must be in format 'provider', 'provider/model', or "
                        + "'provider/model:variant'");
            } else if (!seen.add(config.getName())) {
                errors.add(path + ".name: Duplicate agent name '" + config.getName() + "'");
            }
            if (isBlank(config.getCommand())) {
                errors.add(path + ".command: Command is required");
            }
            validateApiKeys(path + ".apiKeys", config.getApiKeys(), errors);
        }
    }

    private void validateCatalog(List<AgentCatalogEntry> catalog, List<String> errors) {
        if (catalog == null || catalog.isEmpty()) {
            errors.add("catalog: At least one catalog entry required");
            return;
        }
        for (int i = 0; i < catalog.size(); i++) {
            String path = "catalog." + i;
            AgentCatalogEntry entry = catalog.get(i);
            if (entry == null) {
                errors.add(path + ": Catalog entry is required");
                continue;
            }
            if (!isAgentName(entry.getName())) {
                errors.add(path + ".name: Invalid agent name '" + entry.getName() + "'");
            }
            if (isBlank(entry.getDisplayName())) {
                errors.add(path + ".displayName: Display name is required");
            }
            if (entry.getVendor() == null) {
                errors.add(path + ".vendor: Vendor is required");
            }
            if (entry.getTier() == null) {
                errors.add(path + ".tier: Tier is required");
            }
        }
    }

    private void validateApiKeys(String path, List<ApiKeyDescriptor> keys, List<String> errors) {
        if (keys == null) {
            return;
        }
        for (int i = 0; i < keys.size(); i++) {
            validateApiKey(path + "." + i, keys.get(i), errors);
        }
    }

    private void validateApiKey(String path, ApiKeyDescriptor key, List<String> errors) {
        if (key == null) {
            errors.add(path + ": API key descriptor is required");
            return;
        }
        if (isBlank(key.getEnvVar())) {
            errors.add(path + ".envVar: Env var name is required");
        }
        if (isBlank(key.getDisplayName())) {
            errors.add(path + ".displayName: Display name is required");
        }
    }

    private static boolean isAgentName(String name) {
        return name != null && AGENT_NAME.matcher(name).matches();
    }

    private static boolean isAbsoluteUrl(String value) {
        if (isBlank(value)) {
            return false;
        }
        try {
            URI uri = new URI(value);
            return uri.isAbsolute() && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
