package me.golemcore.agentrun.detection.idle;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import me.golemcore.agentrun.port.outbound.AgentSessionPort;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds {@link IdleCompletionGuard}s for OpenCode runs and the event stream that
 * feeds them. The default completion action writes the
 * {@code opencode-complete-<taskRunId>} marker that the OpenCode completion
 * detector waits for.
 */
@Component
@Slf4j
public class IdleCompletionGuardFactory {

    public static final String MARKER_PREFIX = "opencode-complete-";

    private final AgentRunProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<AgentSessionPort> sessionPortProvider;

    public IdleCompletionGuardFactory(AgentRunProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper, ObjectProvider<AgentSessionPort> sessionPortProvider) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.sessionPortProvider = sessionPortProvider;
    }

    public IdleCompletionGuard create(String taskRunId) {
        return createForMarker(markerPath(taskRunId));
    }

    public IdleCompletionGuard createForMarker(Path marker) {
        return create(() -> writeMarker(marker));
    }

    public IdleCompletionGuard create(Runnable completionAction) {
        return new IdleCompletionGuard(messageSources(), completionAction);
    }

    public Path markerPath(String taskRunId) {
        return Path.of(properties.getDetection().getLifecycleDir()).resolve(MARKER_PREFIX + taskRunId);
    }

    /**
     * Event stream of the local OpenCode server. The caller runs it and closes it.
     */
    public AgentEventStream openEventStream(Consumer<JsonNode> onEvent) {
        AgentRunProperties.OpenCodeProperties opencode = properties.getOpencode();
        return new AgentEventStream(httpClient, objectMapper, opencode.getBaseUrl(),
                opencode.getEventReconnectDelay(), onEvent);
    }

    List<MessageSource> messageSources() {
        AgentMessageNormalizer normalizer = new AgentMessageNormalizer(objectMapper);
        List<MessageSource> sources = new ArrayList<>();
        AgentSessionPort sessionPort = sessionPortProvider.getIfAvailable();
        if (sessionPort != null) {
            sources.add(new SessionClientMessageSource(sessionPort, normalizer));
        }
        AgentRunProperties.OpenCodeProperties opencode = properties.getOpencode();
        sources.add(new HttpMessageSource(httpClient, objectMapper, normalizer, opencode.getBaseUrl()));
        sources.add(new StorageMessageSource(Path.of(opencode.getStorageDir()), objectMapper, normalizer));
        return sources;
    }

    private static void writeMarker(Path marker) {
        try {
            Files.createDirectories(marker.getParent());
            Files.writeString(marker, "completed\n", StandardCharsets.UTF_8);
            log.info("[IdleGuard] Wrote completion marker {}", marker);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write completion marker " + marker, e);
        }
    }
}
