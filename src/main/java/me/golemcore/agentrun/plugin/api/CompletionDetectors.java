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

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Completion-detection engine as seen by provider capability hooks.
 */
public interface CompletionDetectors {

    /**
     * Completes once the sentinel file at {@code markerPath} exists.
     */
    CompletableFuture<Void> awaitMarker(Path markerPath);

    /**
     * Completes once the append-only telemetry file contains an object accepted by
     * {@code isCompletionEvent}. Fails with
     * {@link me.golemcore.agentrun.detection.CompletionDetectionTimeoutException}
     * when no such object shows up within the configured timeout.
     */
    CompletableFuture<Void> awaitTelemetryEvent(Path telemetryPath, Predicate<JsonNode> isCompletionEvent);

    /**
     * Completes once the agent's local server reports an idle session whose
     * messages show a successful assistant turn. The idle completion guard then
     * writes {@code markerPath}, so a marker written by other means resolves the
     * future as well.
     */
    CompletableFuture<Void> awaitIdleSession(Path markerPath);

    /**
     * Directory where lifecycle marker files are written, e.g.
     * {@code /root/lifecycle}.
     */
    Path lifecycleDir();

    /**
     * Directory where agents write telemetry logs, e.g. {@code /tmp}.
     */
    Path telemetryDir();
}
