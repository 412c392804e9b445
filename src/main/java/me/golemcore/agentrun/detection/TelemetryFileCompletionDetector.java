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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Tails an append-only telemetry log and resolves on the first event accepted
 * by a provider predicate.
 *
 * <p>
 * Three triggers drive the same idempotent read:
 * <ul>
 * <li>a directory watch firing when the file is created or written</li>
 * <li>a fixed-delay poll, for filesystems where watches are slow or
 * missing</li>
 * <li>one read at start, for files that already exist</li>
 * </ul>
 * Each read continues from the last consumed byte, so no event is delivered
 * twice. A trailing incomplete UTF-8 sequence stays unread until the rest of
 * it is written.
 *
 * <p>
 * Without a matching event the future fails with
 * {@link CompletionDetectionTimeoutException} after
 * {@code agentrun.detection.telemetry-timeout}.
 */
@Component
@Slf4j
public class TelemetryFileCompletionDetector {

    private static final int READ_CHUNK_BYTES = 64 * 1024;

    private final CompletionDetectionExecutors executors;
    private final ObjectMapper objectMapper;
    private final Duration pollInterval;
    private final Duration timeout;
    private final int maxBufferChars;

    @Autowired
    public TelemetryFileCompletionDetector(CompletionDetectionExecutors executors, ObjectMapper objectMapper,
            AgentRunProperties properties) {
        this(executors, objectMapper, properties.getDetection().getPollInterval(),
                properties.getDetection().getTelemetryTimeout(), properties.getDetection().getMaxBufferChars());
    }

    TelemetryFileCompletionDetector(CompletionDetectionExecutors executors, ObjectMapper objectMapper,
            Duration pollInterval, Duration timeout, int maxBufferChars) {
        this.executors = executors;
        this.objectMapper = objectMapper;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.maxBufferChars = maxBufferChars;
    }

    public CompletableFuture<Void> detect(Path telemetryPath, Predicate<JsonNode> isCompletionEvent) {
        TelemetryRun run = new TelemetryRun(telemetryPath, isCompletionEvent);
        run.start();
        return run.future;
    }

    private final class TelemetryRun {

        private final Path path;
        private final String fileName;
        private final Predicate<JsonNode> isCompletionEvent;
        private final JsonObjectStreamParser parser;
        private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private final AtomicBoolean stopped = new AtomicBoolean();

        private volatile DirectoryWatch watch;
        private volatile ScheduledFuture<?> poll;
        private volatile ScheduledFuture<?> deadline;

        // guarded by this
        private long lastSize;
        private boolean fileSeen;
        private volatile int eventsSeen;

        private TelemetryRun(Path path, Predicate<JsonNode> isCompletionEvent) {
            this.path = path;
            this.fileName = path.getFileName().toString();
            this.isCompletionEvent = isCompletionEvent;
            this.parser = new JsonObjectStreamParser(objectMapper, maxBufferChars, this::onEvent);
            future.whenComplete((ignored, error) -> release());
        }

        private void start() {
            ScheduledExecutorService scheduler = executors.scheduler();
            long pollMillis = pollInterval.toMillis();
            try {
                deadline = scheduler.schedule(this::onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
                poll = scheduler.scheduleWithFixedDelay(this::readNew, pollMillis, pollMillis,
                        TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                future.completeExceptionally(new IllegalStateException("Detection executors are shut down", e));
                return;
            }

            Path directory = path.toAbsolutePath().getParent();
            try {
                watch = DirectoryWatch.open(directory, executors.watchExecutor(), this::onEntryChanged,
                        () -> log.debug("[Telemetry] Watch on {} lost, relying on {} poll", directory,
                                pollInterval));
                log.debug("[Telemetry] Watching {} for {}", directory, fileName);
            } catch (IOException | RuntimeException e) {
                log.warn("[Telemetry] Cannot watch {} ({}), relying on {} poll", directory, e.getMessage(),
                        pollInterval);
            }
            if (stopped.get()) {
                closeAttached();
                return;
            }

            readNew();
        }

        private void onEntryChanged(Path name) {
            if (name == null || fileName.equals(name.toString())) {
                readNew();
            }
        }

        private synchronized void readNew() {
            if (stopped.get()) {
                return;
            }
            long size;
            try {
                size = Files.size(path);
            } catch (NoSuchFileException e) {
                return;
            } catch (IOException e) {
                log.debug("[Telemetry] Cannot stat {}: {}", path, e.getMessage());
                return;
            }

            if (!fileSeen) {
                fileSeen = true;
                log.info("[Telemetry] Tailing {}", path);
            }
            if (size < lastSize) {
                log.warn("[Telemetry] {} shrank from {} to {} bytes, waiting for new data", path, lastSize, size);
                return;
            }
            if (size == lastSize) {
                return;
            }

            try {
                lastSize = consume(lastSize, size);
            } catch (IOException e) {
                log.debug("[Telemetry] Read of {} failed, retrying on next trigger: {}", path, e.getMessage());
            }
        }

        /**
         * Decodes bytes {@code [from, to)} into the parser and returns the offset
         * just past the last fully decoded character.
         */
        private long consume(long from, long to) throws IOException {
            decoder.reset();
            ByteBuffer bytes = ByteBuffer.allocate(READ_CHUNK_BYTES);
            CharBuffer chars = CharBuffer.allocate(READ_CHUNK_BYTES);
            long readPosition = from;
            long consumed = from;

            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
                while (readPosition < to && !stopped.get()) {
                    int wanted = (int) Math.min(bytes.remaining(), to - readPosition);
                    ByteBuffer window = bytes.duplicate();
                    window.limit(bytes.position() + wanted);
                    int read = channel.read(window, readPosition);
                    if (read <= 0) {
                        break;
                    }
                    readPosition += read;
                    bytes.position(bytes.position() + read);

                    bytes.flip();
                    int available = bytes.remaining();
                    decoder.decode(bytes, chars, false);
                    consumed += available - bytes.remaining();
                    bytes.compact();

                    chars.flip();
                    parser.feed(chars);
                    chars.clear();
                }
            }
            return consumed;
        }

        private void onEvent(JsonNode event) {
            eventsSeen++;
            boolean matched;
            try {
                matched = isCompletionEvent.test(event);
            } catch (RuntimeException e) {
                log.debug("[Telemetry] Completion predicate failed on event from {}: {}", path, e.getMessage());
                return;
            }
            if (matched && future.complete(null)) {
                log.info("[Telemetry] Completion event detected in {} after {} events", path, eventsSeen);
            }
        }

        private void onTimeout() {
            CompletionDetectionTimeoutException timeoutError = new CompletionDetectionTimeoutException(path,
                    timeout, eventsSeen);
            if (future.completeExceptionally(timeoutError)) {
                log.warn("[Telemetry] {}", timeoutError.getMessage());
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
            cancel(poll);
            cancel(deadline);
        }

        private void cancel(ScheduledFuture<?> task) {
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
