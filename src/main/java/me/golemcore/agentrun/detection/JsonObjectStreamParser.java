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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Incremental scanner that turns arbitrarily split text into complete top-level
 * JSON objects.
 *
 * <p>
 * Input is a stream of concatenated objects with no delimiter between them.
 * Braces are counted only outside string literals, and a backslash inside a
 * string makes the next character literal. When the depth returns to zero the
 * accumulated text is parsed and handed to the callback exactly once.
 *
 * <p>
 * The parser never throws out of {@link #feed(CharSequence)}:
 * <ul>
 * <li>a malformed object is dropped and scanning resumes at the next
 * {@code '{'}</li>
 * <li>an object longer than {@code maxBufferChars} is dropped whole: the
 * rest of it is still scanned for braces but nothing inside it is emitted</li>
 * <li>text between objects is ignored</li>
 * </ul>
 *
 * <p>
 * Not thread-safe; each detector run owns its own instance.
 */
@Slf4j
public class JsonObjectStreamParser {

    private static final int LOG_PREVIEW_CHARS = 200;

    private final ObjectMapper objectMapper;
    private final int maxBufferChars;
    private final Consumer<JsonNode> onObject;

    private final StringBuilder buffer = new StringBuilder();
    private int depth;
    private boolean inString;
    private boolean escape;
    private boolean discarding;

    public JsonObjectStreamParser(ObjectMapper objectMapper, int maxBufferChars, Consumer<JsonNode> onObject) {
        if (maxBufferChars <= 0) {
            throw new IllegalArgumentException("maxBufferChars must be positive: " + maxBufferChars);
        }
        this.objectMapper = objectMapper;
        this.maxBufferChars = maxBufferChars;
        this.onObject = onObject;
    }

    public void feed(CharSequence chunk) {
        if (chunk == null) {
            return;
        }
        for (int i = 0; i < chunk.length(); i++) {
            accept(chunk.charAt(i));
        }
    }

    /**
     * Characters currently held for an unfinished object.
     */
    public int bufferedChars() {
        return buffer.length();
    }

    public void reset() {
        buffer.setLength(0);
        depth = 0;
        inString = false;
        escape = false;
        discarding = false;
    }

    private void accept(char ch) {
        if (depth == 0) {
            if (ch == '{') {
                depth = 1;
                buffer.append(ch);
            }
            return;
        }

        if (!discarding) {
            buffer.append(ch);
            if (buffer.length() > maxBufferChars) {
                log.warn("[Telemetry] Dropping object larger than {} chars", maxBufferChars);
                buffer.setLength(0);
                discarding = true;
            }
        }

        if (inString) {
            if (escape) {
                escape = false;
            } else if (ch == '\\') {
                escape = true;
            } else if (ch == '"') {
                inString = false;
            }
            return;
        }

        if (ch == '"') {
            inString = true;
        } else if (ch == '{') {
            depth++;
        } else if (ch == '}') {
            depth--;
            if (depth == 0) {
                if (discarding) {
                    discarding = false;
                } else {
                    emit(buffer.toString());
                }
                buffer.setLength(0);
            }
        }
    }

    private void emit(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("[Telemetry] Skipping malformed object: {} (buffer: {})", e.getOriginalMessage(),
                    preview(json));
            return;
        }
        if (node == null || !node.isObject()) {
            return;
        }
        try {
            onObject.accept(node);
        } catch (RuntimeException e) {
            log.warn("[Telemetry] Object callback failed: {}", e.getMessage());
        }
    }

    private static String preview(String json) {
        return json.length() <= LOG_PREVIEW_CHARS ? json : json.substring(0, LOG_PREVIEW_CHARS) + "...";
    }
}
