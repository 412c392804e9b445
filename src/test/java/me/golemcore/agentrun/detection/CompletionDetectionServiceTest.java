package me.golemcore.agentrun.detection;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentrun.detection.idle.IdleCompletionGuardFactory;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import me.golemcore.agentrun.port.outbound.AgentSessionPort;
import me.golemcore.agentrun.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CompletionDetectionServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private CompletionDetectionExecutors executors;
    private CompletionDetectionService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        AgentRunProperties properties = new AgentRunProperties();
        properties.getDetection().setLifecycleDir(tempDir.resolve("lifecycle").toString());
        properties.getDetection().setTelemetryDir(tempDir.toString());
        properties.getDetection().setPollInterval(Duration.ofMillis(50));
        properties.getDetection().setTelemetryTimeout(Duration.ofSeconds(30));
        properties.getOpencode().setStorageDir(tempDir.resolve("storage").toString());
        properties.getOpencode().setEventReconnectDelay(Duration.ofMillis(50));
        engine = new OkHttpMockEngine();
        executors = new CompletionDetectionExecutors();
        ObjectProvider<AgentSessionPort> noSessionPort = mock(ObjectProvider.class);
        IdleCompletionGuardFactory idleGuardFactory = new IdleCompletionGuardFactory(properties, engine.client(),
                objectMapper, noSessionPort);
        service = new CompletionDetectionService(
                new FileMarkerCompletionDetector(executors, properties),
                new TelemetryFileCompletionDetector(executors, objectMapper, properties),
                idleGuardFactory, executors, properties);
    }

    @AfterEach
    void tearDown() {
        executors.shutdown();
    }

    @Test
    void shouldExposeConfiguredDirectories() {
        assertEquals(tempDir.resolve("lifecycle"), service.lifecycleDir());
        assertEquals(tempDir, service.telemetryDir());
    }

    @Test
    void shouldAwaitMarkerInsideLifecycleDirectory() throws Exception {
        Files.createDirectories(service.lifecycleDir());
        Path marker = service.lifecycleDir().resolve("codex-complete-run-3");

        CompletableFuture<Void> future = service.awaitMarker(marker);
        Files.writeString(marker, "completed\n");

        future.get(10, TimeUnit.SECONDS);
    }

    @Test
    void shouldAwaitTelemetryEvent() throws Exception {
        Path telemetry = service.telemetryDir().resolve("cursor-telemetry-run-3.log");

        CompletableFuture<Void> future = service.awaitTelemetryEvent(telemetry,
                CompletionEventPredicates.taskToolCall());
        Files.writeString(telemetry, "{\"attributes\":{\"function_name\":\"complete_task\"}}\n");

        future.get(10, TimeUnit.SECONDS);
    }

    // ===== Idle session =====

    @Test
    void shouldCompleteIdleSessionFromServerEventStream() throws Exception {
        engine.respondJson("/event", 200, "data: {\"type\":\"server.connected\"}\n\n"
                + "data: {\"type\":\"session.idle\",\"properties\":{\"sessionID\":\"ses_1\"}}\n\n");
        engine.respondJson("/session", 200, "[{\"id\":\"ses_1\"}]");
        engine.respondJson("/session/ses_1/message", 200, "[{\"role\":\"assistant\",\"finish\":\"stop\"}]");
        Path marker = service.lifecycleDir().resolve("opencode-complete-run-5");

        CompletableFuture<Void> future = service.awaitIdleSession(marker);

        future.get(10, TimeUnit.SECONDS);
        assertEquals("completed\n", Files.readString(marker));
    }

    @Test
    void shouldNotCompleteIdleSessionWhenAssistantFailed() throws Exception {
        engine.respondJson("/event", 200, "data: {\"type\":\"session.idle\"}\n\n");
        engine.respondJson("/session", 200, "[{\"id\":\"ses_1\"}]");
        engine.respondJson("/session/ses_1/message", 200,
                "[{\"role\":\"assistant\",\"error\":{\"name\":\"ProviderAuthError\"}}]");
        Path marker = service.lifecycleDir().resolve("opencode-complete-run-6");

        CompletableFuture<Void> future = service.awaitIdleSession(marker);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!engine.requestedPaths().contains("/session/ses_1/message")) {
            if (System.nanoTime() > deadline) {
                fail("Idle event never checked session messages");
            }
            Thread.sleep(10);
        }

        assertFalse(future.isDone());
        assertFalse(Files.exists(marker));
        future.cancel(true);
    }

    @Test
    void shouldResolveIdleSessionWhenMarkerAlreadyExists() throws Exception {
        Files.createDirectories(service.lifecycleDir());
        Path marker = Files.writeString(service.lifecycleDir().resolve("opencode-complete-run-7"), "completed\n");

        CompletableFuture<Void> future = service.awaitIdleSession(marker);

        assertTrue(future.isDone());
        assertTrue(engine.requestedPaths().isEmpty());
    }
}
