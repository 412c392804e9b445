package me.golemcore.agentrun.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentrun.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.agentrun.plugin.context.ConfigSource;
import me.golemcore.agentrun.plugin.context.PluginLoader;
import me.golemcore.agentrun.plugin.context.PluginLoaderConfigSource;
import me.golemcore.agentrun.plugin.context.StaticConfigSource;
import me.golemcore.agentrun.plugin.validation.PluginValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private ObjectProvider<BuildProperties> buildPropertiesProvider;

    private final BuiltinPluginCatalog catalog = new BuiltinPluginCatalog();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(null);
    }

    private PluginLoader pluginLoader(AgentRunProperties properties) {
        return new PluginLoader(catalog, new PluginValidator(), properties, Clock.systemUTC());
    }

    @Test
    void shouldServeConfigsThroughPluginLoaderByDefault() {
        AgentRunProperties properties = new AgentRunProperties();
        AutoConfiguration autoConfiguration = new AutoConfiguration(properties, buildPropertiesProvider);

        ConfigSource source = autoConfiguration.configSource(pluginLoader(properties), catalog);

        assertInstanceOf(PluginLoaderConfigSource.class, source);
    }

    @Test
    void shouldServeStaticTablesWhenDynamicLoadingDisabled() {
        AgentRunProperties properties = new AgentRunProperties();
        properties.getPlugins().setDynamicLoading(false);
        AutoConfiguration autoConfiguration = new AutoConfiguration(properties, buildPropertiesProvider);

        ConfigSource source = autoConfiguration.configSource(pluginLoader(properties), catalog);

        assertInstanceOf(StaticConfigSource.class, source);
        assertFalse(source.getAllConfigs().isEmpty());
    }

    @Test
    void shouldInitWithoutBuildProperties() {
        AutoConfiguration autoConfiguration = new AutoConfiguration(new AgentRunProperties(), buildPropertiesProvider);

        assertDoesNotThrow(autoConfiguration::init);
    }

    @Test
    void shouldSerializeInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-02-01T10:00:00Z\"", mapper.writeValueAsString(Instant.parse("2026-02-01T10:00:00Z")));
        assertEquals("x", mapper.readTree("{\"id\":\"x\",\"extra\":1}").get("id").asText());
    }
}
