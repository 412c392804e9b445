package me.golemcore.agentrun.detection;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.detection.idle.AgentEventStream;
import me.golemcore.agentrun.detection.idle.IdleCompletionGuard;
import me.golemcore.agentrun.detection.idle.IdleCompletionGuardFactory;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import me.golemcore.agentrun.plugin.api.CompletionDetectors;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;

/**
 * Entry point that provider capabilities use to wait for the end of a run.
 */
@Service
@Slf4j
public class CompletionDetectionService implements CompletionDetectors {

    private final FileMarkerCompletionDetector markerDetector;
    private final TelemetryFileCompletionDetector telemetryDetector;
    private final IdleCompletionGuardFactory idleGuardFactory;
    private final CompletionDetectionExecutors executors;
    private final Path lifecycleDir;
    private final Path telemetryDir;

    public CompletionDetectionService(FileMarkerCompletionDetector markerDetector,
            TelemetryFileCompletionDetector telemetryDetector, IdleCompletionGuardFactory idleGuardFactory,
            CompletionDetectionExecutors executors, AgentRunProperties properties) {
        this.markerDetector = markerDetector;
        this.telemetryDetector = telemetryDetector;
        this.idleGuardFactory = idleGuardFactory;
        this.executors = executors;
        this.lifecycleDir = Path.of(properties.getDetection().getLifecycleDir());
        this.telemetryDir = Path.of(properties.getDetection().getTelemetryDir());
    }

    @Override
    public CompletableFuture<Void> awaitMarker(Path markerPath) {
        Path absolute = markerPath.toAbsolutePath();
        log.debug("[Completion] Awaiting marker {}", absolute);
        return markerDetector.detect(absolute, absolute.getParent(), absolute.getFileName().toString());
    }

    @Override
    public CompletableFuture<Void> awaitTelemetryEvent(Path telemetryPath, Predicate<JsonNode> isCompletionEvent) {
        log.debug("[Completion] Awaiting telemetry event in {}", telemetryPath);
        return telemetryDetector.detect(telemetryPath, isCompletionEvent);
    }

    @Override
    public CompletableFuture<Void> awaitIdleSession(Path markerPath) {
        Path absolute = markerPath.toAbsolutePath();
        CompletableFuture<Void> marker = awaitMarker(absolute);
        if (marker.isDone()) {
            return marker;
        }

        IdleCompletionGuard guard = idleGuardFactory.createForMarker(absolute);
        AgentEventStream events = idleGuardFactory.openEventStream(guard::onEvent);
        try {
            executors.watchExecutor().execute(events::run);
        } catch (RejectedExecutionException e) {
            events.close();
            marker.completeExceptionally(new IllegalStateException("Detection executors are shut down", e));
            return marker;
        }
        marker.whenComplete((ignored, error) -> events.close());
        log.debug("[Completion] Awaiting idle session for {}", absolute);
        return marker;
    }

    @Override
    public Path lifecycleDir() {
        return lifecycleDir;
    }

    @Override
    public Path telemetryDir() {
        return telemetryDir;
    }
}
