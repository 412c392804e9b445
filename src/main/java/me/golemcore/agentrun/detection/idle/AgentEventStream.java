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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Reads the agent server's server-sent event stream ({@code GET /event}) and
 * hands every {@code data:} payload that parses as a JSON object to a consumer.
 *
 * <p>
 * {@link #run()} blocks until {@link #close()}. A dropped or refused connection
 * is retried after the reconnect delay. Comment lines and the {@code event:},
 * {@code id:} and {@code retry:} fields are ignored.
 */
@Slf4j
public class AgentEventStream implements Closeable {

    private static final String DATA_FIELD = "data:";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String eventUrl;
    private final Duration reconnectDelay;
    private final Consumer<JsonNode> onEvent;

    private volatile boolean closed;
    private volatile Call currentCall;

    public AgentEventStream(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
            Duration reconnectDelay, Consumer<JsonNode> onEvent) {
        // the stream stays silent between events
        this.httpClient = httpClient.newBuilder().readTimeout(Duration.ZERO).build();
        this.objectMapper = objectMapper;
        this.eventUrl = (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl) + "/event";
        this.reconnectDelay = reconnectDelay;
        this.onEvent = onEvent;
    }

    public void run() {
        log.debug("[IdleGuard] Subscribing to {}", eventUrl);
        while (!closed) {
            try {
                readStream();
            } catch (IOException e) {
                if (closed) {
                    break;
                }
                log.debug("[IdleGuard] Event stream {} failed: {}", eventUrl, e.getMessage());
            }
            if (closed) {
                break;
            }
            try {
                Thread.sleep(reconnectDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("[IdleGuard] Event stream {} stopped", eventUrl);
    }

    private void readStream() throws IOException {
        Request request = new Request.Builder()
                .url(eventUrl)
                .header("Accept", "text/event-stream")
                .get()
                .build();
        Call call = httpClient.newCall(request);
        currentCall = call;
        if (closed) {
            call.cancel();
            return;
        }

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("HTTP " + response.code() + " from " + eventUrl);
            }
            BufferedSource source = body.source();
            StringBuilder data = new StringBuilder();
            String line;
            while (!closed && (line = source.readUtf8Line()) != null) {
                if (line.isEmpty()) {
                    dispatch(data);
                } else if (line.startsWith(DATA_FIELD)) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    String value = line.substring(DATA_FIELD.length());
                    data.append(value.startsWith(" ") ? value.substring(1) : value);
                }
            }
            if (!closed) {
                dispatch(data);
            }
        }
    }

    private void dispatch(StringBuilder data) {
        if (data.length() == 0) {
            return;
        }
        String payload = data.toString();
        data.setLength(0);

        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("[IdleGuard] Skipping malformed event: {}", e.getOriginalMessage());
            return;
        }
        if (event == null || !event.isObject()) {
            return;
        }
        try {
            onEvent.accept(event);
        } catch (RuntimeException e) {
            log.warn("[IdleGuard] Event handler failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        closed = true;
        Call call = currentCall;
        if (call != null) {
            call.cancel();
        }
    }
}
