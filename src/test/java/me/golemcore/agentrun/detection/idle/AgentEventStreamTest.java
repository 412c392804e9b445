package me.golemcore.agentrun.detection.idle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentrun.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class AgentEventStreamTest {

    private static final String BASE_URL = "http://127.0.0.1:4096/";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<JsonNode> events = new CopyOnWriteArrayList<>();
    private OkHttpMockEngine engine;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
    }

    private AgentEventStream stream() {
        return new AgentEventStream(engine.client(), objectMapper, BASE_URL, Duration.ofMillis(20), events::add);
    }

    private static Thread runInBackground(AgentEventStream stream) {
        Thread thread = new Thread(stream::run, "event-stream-test");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 10s");
            }
            Thread.sleep(10);
        }
    }

    // ===== Frames =====

    @Test
    void shouldDeliverDataFramesInOrder() throws Exception {
        engine.respondJson("/event", 200, ": keep-alive\n"
                + "event: message\n"
                + "data: {\"type\":\"server.connected\"}\n\n"
                + "id: 7\n"
                + "data: {\"type\":\"session.idle\",\"properties\":{\"sessionID\":\"ses_1\"}}\n\n");
        AgentEventStream stream = stream();

        Thread thread = runInBackground(stream);
        awaitCondition(() -> events.size() >= 2);
        stream.close();
        thread.join(5000);

        assertEquals("server.connected", events.get(0).path("type").asText());
        assertEquals("session.idle", events.get(1).path("type").asText());
        assertEquals("ses_1", events.get(1).path("properties").path("sessionID").asText());
        assertFalse(thread.isAlive());
    }

    @Test
    void shouldJoinMultiLineDataAndSkipMalformedPayloads() throws Exception {
        engine.respondJson("/event", 200, "data: not json\n\n"
                + "data: {\"type\":\n"
                + "data: \"session.status\",\"status\":\"idle\"}\n\n"
                + "data: [1,2]\n\n");
        AgentEventStream stream = stream();

        Thread thread = runInBackground(stream);
        awaitCondition(() -> !events.isEmpty());
        stream.close();
        thread.join(5000);

        JsonNode first = events.get(0);
        assertEquals("session.status", first.path("type").asText());
        assertEquals("idle", first.path("status").asText());
        assertTrue(events.stream().allMatch(JsonNode::isObject));
    }

    @Test
    void shouldDeliverTrailingFrameWithoutBlankLine() throws Exception {
        engine.respondJson("/event", 200, "data: {\"type\":\"session.idle\"}");
        AgentEventStream stream = stream();

        Thread thread = runInBackground(stream);
        awaitCondition(() -> !events.isEmpty());
        stream.close();
        thread.join(5000);

        assertEquals("session.idle", events.get(0).path("type").asText());
    }

    // ===== Reconnect =====

    @Test
    void shouldReconnectAfterFailures() throws Exception {
        engine.fail("/event", new IOException("connection refused"));
        AgentEventStream stream = stream();

        Thread thread = runInBackground(stream);
        awaitCondition(() -> engine.requestedPaths().size() >= 3);
        engine.respondJson("/event", 200, "data: {\"type\":\"session.idle\"}\n\n");
        awaitCondition(() -> !events.isEmpty());
        stream.close();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertTrue(engine.requestedPaths().stream().allMatch("/event"::equals));
    }

    @Test
    void shouldKeepReadingWhenHandlerThrows() throws Exception {
        engine.respondJson("/event", 200, "data: {\"n\":1}\n\ndata: {\"n\":2}\n\n");
        List<Integer> seen = new CopyOnWriteArrayList<>();
        AgentEventStream stream = new AgentEventStream(engine.client(), objectMapper, BASE_URL,
                Duration.ofMillis(20), event -> {
                    seen.add(event.path("n").asInt());
                    if (event.path("n").asInt() == 1) {
                        throw new IllegalStateException("handler failure");
                    }
                });

        Thread thread = runInBackground(stream);
        awaitCondition(() -> seen.contains(2));
        stream.close();
        thread.join(5000);

        assertEquals(List.of(1, 2), seen.subList(0, 2));
    }

    @Test
    void shouldNotConnectAfterClose() throws Exception {
        engine.respondJson("/event", 200, "");
        AgentEventStream stream = stream();
        stream.close();

        stream.run();

        assertTrue(engine.requestedPaths().isEmpty());
    }
}
