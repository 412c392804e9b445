package me.golemcore.agentrun.plugin.context;

import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.LoadedPlugin;
import me.golemcore.agentrun.domain.model.PluginHealth;
import me.golemcore.agentrun.domain.model.PluginHealthCheckResult;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.api.PluginLifecycle;
import me.golemcore.agentrun.plugin.api.ProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.agentrun.plugin.builtin.BuiltinPluginCatalog.Registration;
import me.golemcore.agentrun.plugin.validation.PluginValidationOptions;
import me.golemcore.agentrun.plugin.validation.PluginValidator;
import me.golemcore.agentrun.testsupport.plugin.TestProviderPlugin;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static me.golemcore.agentrun.testsupport.plugin.TestProviderPlugin.entry;
import static org.junit.jupiter.api.Assertions.*;

class PluginLoaderTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private PluginLoader loader(Registration... registrations) {
        return new PluginLoader(new BuiltinPluginCatalog(List.of(registrations)), new PluginValidator(),
                PluginValidationOptions.DEFAULT, clock);
    }

    private static Registration registration(String id, Supplier<ProviderPlugin> factory) {
        return new Registration(id, factory);
    }

    // ===== Loading =====

    @Test
    void shouldReturnNothingBeforeLoad() {
        PluginLoader loader = loader(registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a")));

        assertFalse(loader.isLoaded());
        assertTrue(loader.getAllPlugins().isEmpty());
        assertTrue(loader.getAllConfigs().isEmpty());
    }

    @Test
    void shouldLoadPluginsWithMetadata() {
        PluginLoader loader = loader(registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a")));

        loader.loadAll();

        assertTrue(loader.isLoaded());
        LoadedPlugin plugin = loader.getPlugin("anthropic").orElseThrow();
        assertEquals(NOW, plugin.getLoadedAt());
        assertEquals("builtin:" + TestProviderPlugin.class.getName(), plugin.getLoadedFrom());
        assertTrue(plugin.isInitialized());
        assertNull(plugin.getInitError());
        assertEquals(List.of("anthropic"), loader.getPluginIds());
        assertTrue(loader.getLoadError().isEmpty());
    }

    @Test
    void shouldLoadOnlyOnceAcrossRepeatedCalls() {
        AtomicInteger created = new AtomicInteger();
        PluginLoader loader = loader(registration("anthropic", () -> {
            created.incrementAndGet();
            return TestProviderPlugin.of("anthropic", "claude/a");
        }));

        loader.loadAll();
        List<AgentConfig> first = loader.getAllConfigs();
        loader.loadAll();
        loader.loadAll();

        assertEquals(1, created.get());
        assertEquals(first, loader.getAllConfigs());
        assertEquals(1, loader.getAllPlugins().size());
    }

    // ===== Failure isolation =====

    @Test
    void shouldIsolateFailingPlugins() {
        PluginLoader loader = loader(
                registration("broken", () -> {
                    throw new IllegalStateException("constructor exploded");
                }),
                registration("invalid", () -> TestProviderPlugin.of("invalid", "codex/a")
                        .withCatalog(entry("codex/a"), entry("codex/ghost"))),
                registration("openai", () -> TestProviderPlugin.of("openai", "codex/ok")));

        loader.loadAll();

        assertTrue(loader.isLoaded());
        assertEquals(List.of("openai"), loader.getPluginIds());
        Map<String, String> errors = loader.getLoadErrors();
        assertEquals(2, errors.size());
        assertEquals("Failed to load plugin 'broken': constructor exploded", errors.get("broken"));
        assertEquals("Failed to load plugin 'invalid': validation failed:\n"
                + "Catalog entry 'codex/ghost' has no matching config", errors.get("invalid"));
        assertTrue(loader.getLoadError().orElseThrow().contains("; "));
    }

    @Test
    void shouldRecordNullFactoryResult() {
        PluginLoader loader = loader(registration("empty", () -> null));

        loader.loadAll();

        assertEquals("Failed to load plugin 'empty': factory returned no plugin", loader.getLoadErrors().get("empty"));
    }

    @Test
    void shouldRejectDuplicatePluginIds() {
        PluginLoader loader = loader(
                registration("first", () -> TestProviderPlugin.of("same", "claude/a")),
                registration("second", () -> TestProviderPlugin.of("same", "claude/b")));

        loader.loadAll();

        assertEquals(List.of("same"), loader.getPluginIds());
        assertEquals("Failed to load plugin 'second': Duplicate plugin id: same", loader.getLoadErrors().get("second"));
        assertEquals(List.of("claude/a"), loader.getAllConfigs().stream().map(AgentConfig::getName).toList());
    }

    @Test
    void shouldApplyStrictCatalogMatchWhenConfigured() {
        Supplier<ProviderPlugin> hiddenConfig = () -> TestProviderPlugin.of("openai", "codex/a")
                .withConfigs(TestProviderPlugin.config("codex/a"), TestProviderPlugin.config("codex/hidden"));
        PluginLoader lenient = loader(registration("openai", hiddenConfig));
        PluginLoader strict = new PluginLoader(
                new BuiltinPluginCatalog(List.of(registration("openai", hiddenConfig))), new PluginValidator(),
                PluginValidationOptions.strict(), clock);

        lenient.loadAll();
        strict.loadAll();

        assertEquals(List.of("openai"), lenient.getPluginIds());
        assertTrue(strict.getPluginIds().isEmpty());
        assertTrue(strict.getLoadErrors().get("openai").contains("has no matching catalog entry"));
    }

    @Test
    void shouldKeepPluginWhenInitializationFails() {
        PluginLifecycle failingInit = new PluginLifecycle() {
            @Override
            public void initialize() throws Exception {
                throw new Exception("cannot reach registry");
            }
        };
        PluginLoader loader = loader(
                registration("gemini", () -> TestProviderPlugin.of("gemini", "gemini/a").withLifecycle(failingInit)));

        loader.loadAll();

        LoadedPlugin plugin = loader.getPlugin("gemini").orElseThrow();
        assertFalse(plugin.isInitialized());
        assertEquals("cannot reach registry", plugin.getInitError());
        assertTrue(loader.getLoadErrors().isEmpty());
        assertEquals(1, loader.getAllConfigs().size());
    }

    // ===== Aggregation =====

    @Test
    void shouldOrderConfigsByPreferredPluginOrder() {
        PluginLoader loader = loader(
                registration("zeta", () -> TestProviderPlugin.of("zeta", "zeta/one")),
                registration("cursor", () -> TestProviderPlugin.of("cursor", "cursor/a")),
                registration("alpha", () -> TestProviderPlugin.of("alpha", "alpha/one")),
                registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a", "claude/b")),
                registration("openai", () -> TestProviderPlugin.of("openai", "codex/a")));

        loader.loadAll();

        assertEquals(List.of("claude/a", "claude/b", "codex/a", "cursor/a", "zeta/one", "alpha/one"),
                loader.getAllConfigs().stream().map(AgentConfig::getName).toList());
        assertEquals(List.of("claude/a", "claude/b", "codex/a", "cursor/a", "zeta/one", "alpha/one"),
                loader.getAllCatalog().stream().map(entry -> entry.getName()).toList());
    }

    @Test
    void shouldKeyProviderSpecsByPluginIdentity() {
        PluginLoader loader = loader(registration("qwen", () -> TestProviderPlugin.of("qwen", "qwen/a")
                .withProvider(TestProviderPlugin.provider("dashscope"))));

        loader.loadAll();

        List<ProviderSpec> specs = loader.getAllProviderSpecs();
        assertEquals(1, specs.size());
        assertEquals("qwen", specs.get(0).getId());
        assertEquals("Test qwen", specs.get(0).getName());
        assertEquals("https://api.example.com", specs.get(0).getDefaultBaseUrl());
    }

    // ===== Health =====

    @Test
    void shouldReportHealthForEveryPlugin() {
        PluginLifecycle unhealthy = new PluginLifecycle() {
            @Override
            public Optional<PluginHealth> healthCheck() {
                return Optional.of(PluginHealth.unhealthy("quota exhausted"));
            }
        };
        PluginLifecycle throwing = new PluginLifecycle() {
            @Override
            public Optional<PluginHealth> healthCheck() throws Exception {
                throw new Exception("probe timed out");
            }
        };
        PluginLoader loader = loader(
                registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a")),
                registration("openai", () -> TestProviderPlugin.of("openai", "codex/a").withLifecycle(unhealthy)),
                registration("gemini", () -> TestProviderPlugin.of("gemini", "gemini/a").withLifecycle(throwing)));
        loader.loadAll();

        List<PluginHealthCheckResult> results = loader.healthCheckAll();

        assertEquals(3, results.size());
        assertTrue(results.get(0).isHealthy());
        assertEquals("No health check defined", results.get(0).getMessage());
        assertFalse(results.get(1).isHealthy());
        assertEquals("quota exhausted", results.get(1).getMessage());
        assertFalse(results.get(2).isHealthy());
        assertEquals("probe timed out", results.get(2).getError());
    }

    // ===== Shutdown =====

    @Test
    void shouldRunShutdownHooksAndClearState() {
        List<String> shutdowns = new ArrayList<>();
        PluginLoader loader = loader(
                registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a")
                        .withLifecycle(lifecycleRecording("anthropic", shutdowns))),
                registration("openai", () -> TestProviderPlugin.of("openai", "codex/a")
                        .withLifecycle(lifecycleRecording("openai", shutdowns))),
                registration("broken", () -> {
                    throw new IllegalStateException("nope");
                }));
        loader.loadAll();

        loader.shutdown();

        assertEquals(List.of("anthropic", "openai"), shutdowns);
        assertFalse(loader.isLoaded());
        assertTrue(loader.getAllPlugins().isEmpty());
        assertTrue(loader.getLoadErrors().isEmpty());
    }

    @Test
    void shouldAggregateShutdownFailuresAfterRunningAllHooks() {
        List<String> shutdowns = new ArrayList<>();
        PluginLifecycle failing = new PluginLifecycle() {
            @Override
            public void shutdown() throws Exception {
                throw new Exception("socket stuck");
            }
        };
        PluginLoader loader = loader(
                registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a").withLifecycle(failing)),
                registration("openai", () -> TestProviderPlugin.of("openai", "codex/a")
                        .withLifecycle(lifecycleRecording("openai", shutdowns))));
        loader.loadAll();

        IllegalStateException error = assertThrows(IllegalStateException.class, loader::shutdown);

        assertEquals("Shutdown errors:\nPlugin 'anthropic' shutdown failed: socket stuck", error.getMessage());
        assertEquals(List.of("openai"), shutdowns);
        assertFalse(loader.isLoaded());
    }

    @Test
    void shouldReloadFromScratchAfterShutdown() {
        AtomicInteger created = new AtomicInteger();
        PluginLoader loader = loader(registration("anthropic", () -> {
            created.incrementAndGet();
            return TestProviderPlugin.of("anthropic", "claude/a");
        }));
        loader.loadAll();
        loader.shutdown();

        loader.loadAll();

        assertEquals(2, created.get());
        assertEquals(List.of("anthropic"), loader.getPluginIds());
    }

    @Test
    void shouldSwallowShutdownFailuresOnClose() {
        PluginLifecycle failing = new PluginLifecycle() {
            @Override
            public void shutdown() throws Exception {
                throw new Exception("socket stuck");
            }
        };
        PluginLoader loader = loader(
                registration("anthropic", () -> TestProviderPlugin.of("anthropic", "claude/a").withLifecycle(failing)));
        loader.loadAll();

        assertDoesNotThrow(loader::close);
        assertFalse(loader.isLoaded());
    }

    private static PluginLifecycle lifecycleRecording(String id, List<String> shutdowns) {
        return new PluginLifecycle() {
            @Override
            public void shutdown() {
                shutdowns.add(id);
            }
        };
    }
}
