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

import lombok.Getter;

import java.nio.file.Path;
import java.time.Duration;

/**
 * A telemetry detector gave up waiting for its completion event.
 */
@Getter
public class CompletionDetectionTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;
    private final Duration timeout;
    private final int eventsSeen;

    public CompletionDetectionTimeoutException(Path path, Duration timeout, int eventsSeen) {
        super("No completion event in " + path + " after " + timeout + " (" + eventsSeen + " events seen)");
        this.path = path;
        this.timeout = timeout;
        this.eventsSeen = eventsSeen;
    }
}
