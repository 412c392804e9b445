package me.golemcore.agentrun.infrastructure.http;

import me.golemcore.agentrun.infrastructure.config.AgentRunProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        AgentRunProperties properties = new AgentRunProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
        assertEquals(15000, client.writeTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
    }
}
