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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolves when an agent's sentinel file appears in the lifecycle directory.
 *
 * <p>
 * The marker is checked synchronously first, so a run that already finished
 * resolves without attaching anything. Otherwise a directory watch waits for an
 * entry with the marker's name, and the marker is checked again right after
 * the watch is attached to cover files created in between. If no watch can be
 * attached, or the watch ends because the directory was deleted, the detector
 * polls at {@code agentrun.detection.poll-interval}.
 *
 * <p>
 * There is no built-in timeout. Cancelling the returned future, or completing
 * it through {@code orTimeout}, releases the watch and poll.
 */
@Component
@Slf4j
public class FileMarkerCompletionDetector {

    private final CompletionDetectionExecutors executors;
    private final Duration pollInterval;

    @Autowired
    public FileMarkerCompletionDetector(CompletionDetectionExecutors executors, AgentRunProperties properties) {
        this(executors, properties.getDetection().getPollInterval());
    }

    FileMarkerCompletionDetector(CompletionDetectionExecutors executors, Duration pollInterval) {
        this.executors = executors;
        this.pollInterval = pollInterval;
    }

    public CompletableFuture<Void> detect(Path markerPath, Path watchDir, String markerFilename) {
        MarkerRun run = new MarkerRun(markerPath, watchDir, markerFilename);
        run.start();
        return run.future;
    }

    private final class MarkerRun {

        private final Path markerPath;
        private final Path watchDir;
        private final String markerFilename;
        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private final AtomicBoolean stopped = new AtomicBoolean();
        private final AtomicBoolean polling = new AtomicBoolean();
        private volatile DirectoryWatch watch;
        private volatile ScheduledFuture<?> poll;

        private MarkerRun(Path markerPath, Path watchDir, String markerFilename) {
            this.markerPath = markerPath;
            this.watchDir = watchDir;
            this.markerFilename = markerFilename;
            future.whenComplete((ignored, error) -> release());
        }

        private void start() {
            if (Files.exists(markerPath)) {
                log.debug("[Completion] Marker {} already present", markerPath);
                resolve();
                return;
            }

            try {
                watch = DirectoryWatch.open(watchDir, executors.watchExecutor(), this::onEntryChanged,
                        this::onWatchLost);
                log.debug("[Completion] Watching {} for {}", watchDir, markerFilename);
            } catch (IOException | RuntimeException e) {
                log.warn("[Completion] Cannot watch {} ({}), polling every {}", watchDir, e.getMessage(),
                        pollInterval);
                startPolling();
            }
            if (stopped.get()) {
                closeAttached();
                return;
            }

            if (Files.exists(markerPath)) {
                resolve();
            }
        }

        private void onWatchLost() {
            if (stopped.get()) {
                return;
            }
            log.info("[Completion] Watch on {} lost, polling every {}", watchDir, pollInterval);
            startPolling();
            checkMarker();
        }

        private void startPolling() {
            if (!polling.compareAndSet(false, true)) {
                return;
            }
            long millis = pollInterval.toMillis();
            try {
                poll = executors.scheduler().scheduleWithFixedDelay(this::checkMarker, millis, millis,
                        TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                future.completeExceptionally(new IllegalStateException("Detection executors are shut down", e));
                return;
            }
            if (stopped.get()) {
                poll.cancel(false);
            }
        }

        private void onEntryChanged(Path name) {
            if (name == null) {
                checkMarker();
            } else if (markerFilename.equals(name.toString())) {
                resolve();
            }
        }

        private void checkMarker() {
            if (Files.exists(markerPath)) {
                resolve();
            }
        }

        private void resolve() {
            if (future.complete(null)) {
                log.info("[Completion] Marker {} detected", markerPath);
            }
        }

        private void release() {
            stopped.set(true);
            closeAttached();
        }

        private void closeAttached() {
            DirectoryWatch currentWatch = watch;
            if (currentWatch != null) {
                currentWatch.close();
            }
            ScheduledFuture<?> currentPoll = poll;
            if (currentPoll != null) {
                currentPoll.cancel(false);
            }
        }
    }
}
