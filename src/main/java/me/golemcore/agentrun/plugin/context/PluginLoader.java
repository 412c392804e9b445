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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.AgentCatalogEntry;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.LoadedPlugin;
import me.golemcore.agentrun.domain.model.PluginHealth;
import me.golemcore.agentrun.domain.model.PluginHealthCheckResult;
import me.golemcore.agentrun.domain.model.PluginManifest;
import me.golemcore.agentrun.domain.model.PluginValidationResult;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import me.golemcore.agentrun.plugin.api.PluginLifecycle;
import me.golemcore.agentrun.plugin.api.ProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.agentrun.plugin.validation.PluginValidationOptions;
import me.golemcore.agentrun.plugin.validation.PluginValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Discovers, validates and initializes provider plugins, and aggregates their
 * configs, catalog entries and provider specs.
 *
 * <p>
 * {@link #loadAll()} runs once; until then every query returns empty. A plugin that cannot be created or fails
 * validation is recorded in {@link #getLoadErrors()} and skipped; the others
 * still load. A failing {@code initialize} hook keeps the plugin loaded with
 * {@code initialized=false}.
 */
@Component
@Slf4j
public class PluginLoader {

    private static final String NO_HEALTH_CHECK = "No health check defined";

    private final BuiltinPluginCatalog catalog;
    private final PluginValidator validator;
    private final PluginValidationOptions validationOptions;
    private final Clock clock;

    private boolean loaded;
    private Map<String, LoadedPlugin> pluginsById = new LinkedHashMap<>();
    private Map<String, String> loadErrors = new LinkedHashMap<>();

    @Autowired
    public PluginLoader(BuiltinPluginCatalog catalog, PluginValidator validator, AgentRunProperties properties,
            Clock clock) {
        this(catalog, validator, new PluginValidationOptions(properties.getPlugins().isStrictCatalogMatch()), clock);
    }

    PluginLoader(BuiltinPluginCatalog catalog, PluginValidator validator, PluginValidationOptions validationOptions,
            Clock clock) {
        this.catalog = catalog;
        this.validator = validator;
        this.validationOptions = validationOptions;
        this.clock = clock;
    }

    public synchronized void loadAll() {
        if (loaded) {
            return;
        }

        for (BuiltinPluginCatalog.Registration registration : catalog.registrations()) {
            try {
                loadPlugin(registration);
            } catch (RuntimeException e) {
                String message = "Failed to load plugin '" + registration.id() + "': " + e.getMessage();
                loadErrors.put(registration.id(), message);
                log.error("[Plugins] {}", message);
            }
        }
        loaded = true;

        log.info("[Plugins] Loaded {} provider plugins: {}", pluginsById.size(), pluginsById.keySet());
        if (!loadErrors.isEmpty()) {
            log.warn("[Plugins] {} plugin(s) failed to load: {}", loadErrors.size(), loadErrors.keySet());
        }
    }

    private void loadPlugin(BuiltinPluginCatalog.Registration registration) {
        ProviderPlugin plugin = registration.factory().get();
        if (plugin == null) {
            throw new IllegalStateException("factory returned no plugin");
        }

        PluginValidationResult validation = validator.validate(plugin, validationOptions);
        if (!validation.valid()) {
            throw new IllegalArgumentException("validation failed:\n" + String.join("\n", validation.errors()));
        }
        for (String warning : validation.warnings()) {
            log.debug("[Plugins] {}: {}", registration.id(), warning);
        }

        String pluginId = plugin.manifest().getId();
        if (pluginsById.containsKey(pluginId)) {
            throw new IllegalStateException("Duplicate plugin id: " + pluginId);
        }

        LoadedPlugin.LoadedPluginBuilder loadedPlugin = LoadedPlugin.builder()
                .plugin(plugin)
                .loadedFrom("builtin:" + plugin.getClass().getName())
                .loadedAt(clock.instant());

        Optional<PluginLifecycle> lifecycle = plugin.lifecycle();
        if (lifecycle.isPresent()) {
            try {
                lifecycle.get().initialize();
                loadedPlugin.initialized(true);
            } catch (Exception e) {
                loadedPlugin.initialized(false).initError(messageOf(e));
                log.error("[Plugins] Plugin '{}' initialization failed: {}", pluginId, messageOf(e));
            }
        } else {
            loadedPlugin.initialized(true);
        }

        pluginsById.put(pluginId, loadedPlugin.build());
        log.debug("[Plugins] Loaded {} v{}", pluginId, plugin.manifest().getVersion());
    }

    public synchronized boolean isLoaded() {
        return loaded;
    }

    public synchronized Optional<LoadedPlugin> getPlugin(String pluginId) {
        return Optional.ofNullable(pluginsById.get(pluginId));
    }

    public synchronized List<LoadedPlugin> getAllPlugins() {
        return List.copyOf(pluginsById.values());
    }

    public synchronized List<String> getPluginIds() {
        return List.copyOf(pluginsById.keySet());
    }

    /**
     * Configs of all loaded plugins in the order anthropic, openai, amp, opencode,
     * gemini, qwen, cursor, followed by any other plugin in registration order.
     */
    public synchronized List<AgentConfig> getAllConfigs() {
        return collectOrdered(LoadedPlugin::getConfigs);
    }

    /**
     * Catalog entries in the same order as {@link #getAllConfigs()}.
     */
    public synchronized List<AgentCatalogEntry> getAllCatalog() {
        return collectOrdered(LoadedPlugin::getCatalog);
    }

    /**
     * Provider specs keyed by plugin identity, one per loaded plugin.
     */
    public synchronized List<ProviderSpec> getAllProviderSpecs() {
        List<ProviderSpec> specs = new ArrayList<>();
        for (LoadedPlugin plugin : pluginsById.values()) {
            PluginManifest manifest = plugin.getManifest();
            specs.add(plugin.getProvider().toBuilder()
                    .id(manifest.getId())
                    .name(manifest.getName())
                    .build());
        }
        return specs;
    }

    public synchronized Map<String, String> getLoadErrors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(loadErrors));
    }

    /**
     * All load errors joined with {@code "; "}, or empty when every plugin loaded.
     */
    public synchronized Optional<String> getLoadError() {
        if (loadErrors.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("; ", loadErrors.values()));
    }

    public synchronized List<PluginHealthCheckResult> healthCheckAll() {
        List<PluginHealthCheckResult> results = new ArrayList<>();
        for (Map.Entry<String, LoadedPlugin> entry : pluginsById.entrySet()) {
            results.add(healthCheck(entry.getKey(), entry.getValue()));
        }
        return results;
    }

    private PluginHealthCheckResult healthCheck(String pluginId, LoadedPlugin plugin) {
        Optional<PluginLifecycle> lifecycle = plugin.getPlugin().lifecycle();
        try {
            Optional<PluginHealth> health = lifecycle.isPresent() ? lifecycle.get().healthCheck() : Optional.empty();
            if (health.isEmpty()) {
                return PluginHealthCheckResult.builder()
                        .pluginId(pluginId)
                        .healthy(true)
                        .message(NO_HEALTH_CHECK)
                        .build();
            }
            return PluginHealthCheckResult.builder()
                    .pluginId(pluginId)
                    .healthy(health.get().healthy())
                    .message(health.get().message())
                    .build();
        } catch (Exception e) {
            log.warn("[Plugins] Health check of '{}' failed: {}", pluginId, messageOf(e));
            return PluginHealthCheckResult.builder()
                    .pluginId(pluginId)
                    .healthy(false)
                    .error(messageOf(e))
                    .build();
        }
    }

    /**
     * Runs every shutdown hook and forgets all plugins, so a later
     * {@link #loadAll()} starts from scratch.
     *
     * @throws IllegalStateException
     *             after all hooks ran, if any of them failed
     */
    public synchronized void shutdown() {
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, LoadedPlugin> entry : pluginsById.entrySet()) {
            Optional<PluginLifecycle> lifecycle = entry.getValue().getPlugin().lifecycle();
            if (lifecycle.isEmpty()) {
                continue;
            }
            try {
                lifecycle.get().shutdown();
            } catch (Exception e) {
                String message = "Plugin '" + entry.getKey() + "' shutdown failed: " + messageOf(e);
                errors.add(message);
                log.error("[Plugins] {}", message);
            }
        }

        pluginsById = new LinkedHashMap<>();
        loadErrors = new LinkedHashMap<>();
        loaded = false;

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Shutdown errors:\n" + String.join("\n", errors));
        }
    }

    @PreDestroy
    public void close() {
        try {
            shutdown();
        } catch (IllegalStateException e) {
            log.warn("[Plugins] {}", e.getMessage());
        }
    }

    private <T> List<T> collectOrdered(Function<LoadedPlugin, List<T>> extractor) {
        List<T> result = new ArrayList<>();
        for (LoadedPlugin plugin : PluginOrder.sort(pluginsById)) {
            result.addAll(extractor.apply(plugin));
        }
        return result;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
