package me.golemcore.agentrun.provider;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.ApiFormat;
import me.golemcore.agentrun.domain.model.ProviderFallback;
import me.golemcore.agentrun.domain.model.ProviderOverride;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.domain.model.ResolvedProvider;
import me.golemcore.agentrun.plugin.context.ConfigSource;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves provider ids into connection specs, applying team overrides.
 *
 * <p>
 * The base map starts from {@link BaseProviders} and is extended with the
 * provider specs of the active {@link ConfigSource} on {@link #initialize()}.
 * Overrides are merged per call and never stored, so one team's override can
 * not leak into another team's resolution.
 */
@Service
@Slf4j
public class ProviderRegistry {

    private final ConfigSource configSource;
    private final Map<String, ProviderSpec> baseProviders = new LinkedHashMap<>();
    private boolean initialized;

    public ProviderRegistry(ConfigSource configSource) {
        this.configSource = configSource;
        for (ProviderSpec spec : BaseProviders.ALL) {
            baseProviders.put(spec.getId(), spec);
        }
    }

    @PostConstruct
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        for (ProviderSpec spec : configSource.getProviderSpecs()) {
            baseProviders.put(spec.getId(), spec);
        }
        initialized = true;
        log.info("[Providers] Registry initialized from {} with providers: {}", configSource.name(),
                baseProviders.keySet());
    }

    public synchronized List<String> getProviderIds() {
        return List.copyOf(baseProviders.keySet());
    }

    public synchronized Optional<ProviderSpec> getBaseProvider(String providerId) {
        return Optional.ofNullable(baseProviders.get(providerId));
    }

    /**
     * Merges a provider's base spec with an optional override.
     *
     * <ul>
     * <li>base only: the base values, not marked overridden</li>
     * <li>base and override: override fields win where set, credentials
     * descriptors always come from the base</li>
     * <li>override only: a custom provider built from the override alone</li>
     * </ul>
     *
     * @throws IllegalArgumentException
     *             if there is neither a base spec nor an override
     */
    public ResolvedProvider resolve(String providerId, ProviderOverride override) {
        ProviderSpec base = getBaseProvider(providerId).orElse(null);
        if (base == null) {
            if (override == null) {
                throw new IllegalArgumentException("Unknown provider: " + providerId);
            }
            return customProvider(providerId, override);
        }

        if (override == null) {
            return ResolvedProvider.builder()
                    .id(base.getId())
                    .name(base.getName())
                    .baseUrl(base.getDefaultBaseUrl())
                    .apiFormat(base.getApiFormat())
                    .authEnvVars(base.getAuthEnvVars())
                    .apiKeys(base.getApiKeys())
                    .customHeaders(Map.of())
                    .fallbacks(List.of())
                    .overridden(false)
                    .build();
        }

        return ResolvedProvider.builder()
                .id(base.getId())
                .name(base.getName())
                .baseUrl(override.getBaseUrl() != null ? override.getBaseUrl() : base.getDefaultBaseUrl())
                .apiFormat(override.getApiFormat() != null ? override.getApiFormat() : base.getApiFormat())
                .authEnvVars(override.getApiKeyEnvVar() != null
                        ? List.of(override.getApiKeyEnvVar())
                        : base.getAuthEnvVars())
                .apiKeys(base.getApiKeys())
                .customHeaders(headersOf(override))
                .fallbacks(sortedFallbacks(override))
                .overridden(true)
                .build();
    }

    /**
     * Resolves the provider behind an agent name, using the first enabled
     * override for that provider.
     *
     * @return empty when the agent name has no known provider prefix
     */
    public Optional<ResolvedProvider> resolveForAgent(String agentName, List<ProviderOverride> overrides) {
        Optional<String> providerId = getProviderIdForAgent(agentName);
        if (providerId.isEmpty()) {
            log.debug("[Providers] No provider mapping for agent {}", agentName);
            return Optional.empty();
        }
        ProviderOverride override = findOverride(providerId.get(), overrides).orElse(null);
        return Optional.of(resolve(providerId.get(), override));
    }

    public Optional<String> getProviderIdForAgent(String agentName) {
        return AgentProviderPrefixes.providerIdFor(agentName);
    }

    public Optional<ProviderOverride> findOverride(String providerId, List<ProviderOverride> overrides) {
        if (overrides == null) {
            return Optional.empty();
        }
        return overrides.stream()
                .filter(override -> override.isEnabled() && providerId.equals(override.getProviderId()))
                .findFirst();
    }

    private ResolvedProvider customProvider(String providerId, ProviderOverride override) {
        log.debug("[Providers] Resolving custom provider {}", providerId);
        return ResolvedProvider.builder()
                .id(providerId)
                .name(providerId)
                .baseUrl(override.getBaseUrl() != null ? override.getBaseUrl() : "")
                .apiFormat(override.getApiFormat() != null ? override.getApiFormat() : ApiFormat.OPENAI)
                .authEnvVars(override.getApiKeyEnvVar() != null ? List.of(override.getApiKeyEnvVar()) : List.of())
                .apiKeys(List.of())
                .customHeaders(headersOf(override))
                .fallbacks(sortedFallbacks(override))
                .overridden(true)
                .build();
    }

    private static Map<String, String> headersOf(ProviderOverride override) {
        return override.getCustomHeaders() != null ? Map.copyOf(override.getCustomHeaders()) : Map.of();
    }

    private static List<ProviderFallback> sortedFallbacks(ProviderOverride override) {
        if (override.getFallbacks() == null) {
            return List.of();
        }
        return override.getFallbacks().stream()
                .sorted(Comparator.comparingInt(ProviderFallback::priority))
                .toList();
    }
}
