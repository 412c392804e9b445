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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared daemon threads for completion detectors. Directory watch loops block
 * until closed and get a thread each; polls and timeouts share a small
 * scheduler. Neither keeps the JVM alive.
 */
@Component
@Slf4j
public class CompletionDetectionExecutors {

    private static final int SCHEDULER_THREADS = 2;
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final ExecutorService watchExecutor;
    private final ScheduledExecutorService scheduler;

    public CompletionDetectionExecutors() {
        this.watchExecutor = Executors.newCachedThreadPool(daemonThreads("completion-watch"));
        this.scheduler = Executors.newScheduledThreadPool(SCHEDULER_THREADS, daemonThreads("completion-timer"));
    }

    public ExecutorService watchExecutor() {
        return watchExecutor;
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    @PreDestroy
    public void shutdown() {
        // blocked watch loops only leave on interrupt
        watchExecutor.shutdownNow();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Completion] Detection executors shut down");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
