package me.golemcore.agentrun.detection.idle;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import me.golemcore.agentrun.port.outbound.AgentSessionPort;
import me.golemcore.agentrun.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IdleCompletionGuardFactoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AgentRunProperties properties;
    private OkHttpMockEngine engine;
    private ObjectProvider<AgentSessionPort> sessionPortProvider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new AgentRunProperties();
        properties.getDetection().setLifecycleDir(tempDir.resolve("lifecycle").toString());
        properties.getOpencode().setStorageDir(tempDir.resolve("storage").toString());
        engine = new OkHttpMockEngine();
        sessionPortProvider = mock(ObjectProvider.class);
    }

    private IdleCompletionGuardFactory factory() {
        return new IdleCompletionGuardFactory(properties, engine.client(), objectMapper, sessionPortProvider);
    }

    @Test
    void shouldOrderSourcesFromSessionClientToFilesystem() {
        when(sessionPortProvider.getIfAvailable()).thenReturn(mock(AgentSessionPort.class));

        List<String> names = factory().messageSources().stream().map(MessageSource::name).toList();

        assertEquals(List.of("session-client", "http-api", "filesystem"), names);
    }

    @Test
    void shouldSkipSessionClientWhenNoPortIsAvailable() {
        List<String> names = factory().messageSources().stream().map(MessageSource::name).toList();

        assertEquals(List.of("http-api", "filesystem"), names);
    }

    @Test
    void shouldWriteMarkerWhenGuardFires() throws Exception {
        engine.respondJson("/session", 200, "[{\"id\":\"ses_1\"}]");
        engine.respondJson("/session/ses_1/message", 200, "[{\"role\":\"assistant\",\"finish\":\"stop\"}]");
        IdleCompletionGuardFactory factory = factory();

        IdleCompletionGuard guard = factory.create("run-42");
        boolean fired = guard.onEvent(objectMapper.readTree("{\"type\":\"session.idle\"}"));

        Path marker = factory.markerPath("run-42");
        assertTrue(fired);
        assertEquals(tempDir.resolve("lifecycle").resolve("opencode-complete-run-42"), marker);
        assertEquals("completed\n", Files.readString(marker));
    }

    @Test
    void shouldFallBackToStorageWhenHttpIsDown() throws Exception {
        engine.fail("/session", new IOException("connection refused"));
        Path session = Files.createDirectories(tempDir.resolve("storage/message/ses_1"));
        Files.writeString(session.resolve("m.json"), "{\"role\":\"assistant\",\"finish\":\"stop\"}");
        IdleCompletionGuardFactory factory = factory();

        IdleCompletionGuard guard = factory.create("run-7");

        assertTrue(guard.onEvent(objectMapper.readTree("{\"type\":\"session.idle\"}")));
        assertTrue(Files.exists(factory.markerPath("run-7")));
    }
}
