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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agentrun.*} prefix:
 * <ul>
 * <li>{@link PluginsProperties} - plugin discovery and validation</li>
 * <li>{@link DetectionProperties} - completion detector paths and timing</li>
 * <li>{@link OpenCodeProperties} - local OpenCode server and storage used by
 * the idle completion guard</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agentrun")
@Data
public class AgentRunProperties {

    private PluginsProperties plugins = new PluginsProperties();
    private DetectionProperties detection = new DetectionProperties();
    private OpenCodeProperties opencode = new OpenCodeProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class PluginsProperties {
        /**
         * Resolve configs through the plugin loader. When false, the static builtin
         * tables are served without validation.
         */
        private boolean dynamicLoading = true;
        private boolean strictCatalogMatch = false;
    }

    @Data
    public static class DetectionProperties {
        private String lifecycleDir = "/root/lifecycle";
        private String telemetryDir = "/tmp";
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration telemetryTimeout = Duration.ofMinutes(5);
        private int maxBufferChars = 1024 * 1024;
    }

    @Data
    public static class OpenCodeProperties {
        private String baseUrl = "http://127.0.0.1:4096";
        private String storageDir = System.getProperty("user.home") + "/.local/share/opencode/storage";
        /** Pause before reconnecting to the server's event stream. */
        private Duration eventReconnectDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 5000;
        private long readTimeout = 15000;
        private long writeTimeout = 15000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
