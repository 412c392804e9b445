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


import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Create/modify watch on a single directory, delivering the names of changed
 * entries to a listener on a background thread. A {@code null} name means
 * events were lost and the listener should re-check whatever it watches.
 *
 * <p>
 * When the watch loop ends without {@link #close()} (the directory was
 * deleted, or the watch could not be registered) {@code onLost} runs once.
 */
@Slf4j
final class DirectoryWatch implements Closeable {

    private final Path directory;
    private final Consumer<Path> listener;
    private final DirectoryWatcher watcher;
    private volatile boolean closed;

    private DirectoryWatch(Path directory, Consumer<Path> listener) throws IOException {
        this.directory = directory;
        this.listener = listener;
        this.watcher = DirectoryWatcher.builder()
                .path(directory)
                .listener(this::dispatch)
                .fileHashing(false)
                .build();
    }

    static DirectoryWatch open(Path directory, Executor executor, Consumer<Path> listener, Runnable onLost)
            throws IOException {
        Path root = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString());
        }
        DirectoryWatch watch = new DirectoryWatch(root, listener);
        CompletableFuture<Void> loop;
        try {
            loop = watch.watcher.watchAsync(executor);
        } catch (RuntimeException e) {
            watch.close();
            throw e;
        }
        loop.whenComplete((ignored, error) -> watch.onLoopEnded(error, onLost));
        return watch;
    }

    private void dispatch(DirectoryChangeEvent event) {
        if (closed) {
            return;
        }
        switch (event.eventType()) {
            case OVERFLOW -> listener.accept(null);
            case CREATE, MODIFY -> {
                Path name = entryName(event.path());
                if (name != null) {
                    listener.accept(name);
                }
            }
            default -> log.trace("[Completion] Ignoring {} on {}", event.eventType(), event.path());
        }
    }

    private Path entryName(Path changed) {
        if (changed == null) {
            return null;
        }
        if (!changed.startsWith(directory)) {
            return changed.getFileName();
        }
        Path relative = directory.relativize(changed);
        // entries of nested directories are not ours
        return relative.getNameCount() == 1 ? relative : null;
    }

    private void onLoopEnded(Throwable error, Runnable onLost) {
        if (closed) {
            log.trace("[Completion] Watch on {} closed", directory);
            return;
        }
        if (error != null) {
            log.debug("[Completion] Watch on {} failed: {}", directory, error.getMessage());
        } else {
            log.debug("[Completion] Watch on {} ended, directory is gone", directory);
        }
        onLost.run();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            watcher.close();
        } catch (IOException e) {
            log.debug("[Completion] Failed to close watch on {}: {}", directory, e.getMessage());
        }
    }
}
