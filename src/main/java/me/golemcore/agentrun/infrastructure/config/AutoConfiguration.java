package me.golemcore.agentrun.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.agentrun.plugin.context.ConfigSource;
import me.golemcore.agentrun.plugin.context.PluginLoader;
import me.golemcore.agentrun.plugin.context.PluginLoaderConfigSource;
import me.golemcore.agentrun.plugin.context.StaticConfigSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans and start-up logging.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Selects the {@link ConfigSource} once, from
 * {@code agentrun.plugins.dynamic-loading}</li>
 * <li>Logs the detection directories and timing on start-up</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentRunProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ConfigSource configSource(PluginLoader pluginLoader, BuiltinPluginCatalog builtinPluginCatalog) {
        if (properties.getPlugins().isDynamicLoading()) {
            return new PluginLoaderConfigSource(pluginLoader);
        }
        return new StaticConfigSource(builtinPluginCatalog);
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        AgentRunProperties.DetectionProperties detection = properties.getDetection();
        log.info("GolemCore AgentRun v{} starting...", version);
        log.info("Dynamic plugin loading: {}", properties.getPlugins().isDynamicLoading());
        log.info("Lifecycle dir: {}, telemetry dir: {}", detection.getLifecycleDir(), detection.getTelemetryDir());
        log.info("Telemetry poll interval: {}, timeout: {}", detection.getPollInterval(),
                detection.getTelemetryTimeout());
    }
}
