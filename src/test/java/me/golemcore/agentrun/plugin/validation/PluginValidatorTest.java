package me.golemcore.agentrun.plugin.validation;

import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.ApiFormat;
import me.golemcore.agentrun.domain.model.ApiKeyDescriptor;
import me.golemcore.agentrun.domain.model.PluginManifest;
import me.golemcore.agentrun.domain.model.PluginType;
import me.golemcore.agentrun.domain.model.PluginValidationResult;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.testsupport.plugin.TestProviderPlugin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.agentrun.testsupport.plugin.TestProviderPlugin.config;
import static me.golemcore.agentrun.testsupport.plugin.TestProviderPlugin.entry;
import static org.junit.jupiter.api.Assertions.*;

class PluginValidatorTest {

    private final PluginValidator validator = new PluginValidator();

    // ===== Valid plugins =====

    @Test
    void shouldAcceptWellFormedPluginWithoutWarnings() {
        PluginValidationResult result = validator.validate(
                TestProviderPlugin.of("test-provider", "claude/test-model", "claude/test-model:fast"));

        assertTrue(result.valid());
        assertEquals(List.of(), result.errors());
        assertEquals(List.of(), result.warnings());
    }

    @Test
    void shouldRejectNullPlugin() {
        PluginValidationResult result = validator.validate(null);

        assertFalse(result.valid());
        assertEquals(List.of("plugin: Plugin is required"), result.errors());
    }

    // ===== Manifest =====

    @Test
    void shouldRejectInvalidPluginId() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withManifest(manifest("Bad_Id", "1.0.0"));

        PluginValidationResult result = validator.validate(plugin);

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).startsWith("manifest.id: Plugin ID must start with lowercase letter"));
    }

    @Test
    void shouldRejectNonSemverVersion() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x").withManifest(manifest("test", "1.0"));

        PluginValidationResult result = validator.validate(plugin);

        assertEquals(List.of("manifest.version: Version must be in semver format (e.g., 1.0.0)"), result.errors());
    }

    // ===== Provider =====

    @Test
    void shouldRejectInvalidBaseUrlAndMissingAuthVars() {
        ProviderSpec provider = ProviderSpec.builder()
                .id("test")
                .name("Test")
                .defaultBaseUrl("not a url")
                .apiFormat(ApiFormat.OPENAI)
                .build();
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x").withProvider(provider);

        PluginValidationResult result = validator.validate(plugin);

        assertTrue(result.errors().contains("provider.defaultBaseUrl: Default base URL must be a valid URL"));
        assertTrue(result.errors().contains("provider.authEnvVars: At least one auth env var required"));
    }

    @Test
    void shouldRejectRelativeBaseUrl() {
        ProviderSpec provider = TestProviderPlugin.provider("test").toBuilder().defaultBaseUrl("/v1").build();

        PluginValidationResult result = validator.validate(TestProviderPlugin.of("test", "claude/x")
                .withProvider(provider));

        assertEquals(List.of("provider.defaultBaseUrl: Default base URL must be a valid URL"), result.errors());
    }

    @Test
    void shouldRejectApiKeyWithoutEnvVar() {
        ProviderSpec provider = TestProviderPlugin.provider("test").toBuilder()
                .apiKey(ApiKeyDescriptor.builder().displayName("Broken").build())
                .build();

        PluginValidationResult result = validator.validate(TestProviderPlugin.of("test", "claude/x")
                .withProvider(provider));

        assertEquals(List.of("provider.apiKeys.1.envVar: Env var name is required"), result.errors());
    }

    // ===== Configs and catalog =====

    @Test
    void shouldRequireConfigsAndCatalog() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test");

        PluginValidationResult result = validator.validate(plugin);

        assertEquals(List.of("configs: At least one agent config required",
                "catalog: At least one catalog entry required"), result.errors());
    }

    @Test
    void shouldReportMissingCommandWithIndexedPath() {
        AgentConfig noCommand = AgentConfig.builder().name("claude/y").build();
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x", "claude/y")
                .withConfigs(config("claude/x"), noCommand);

        PluginValidationResult result = validator.validate(plugin);

        assertEquals(List.of("configs.1.command: Command is required"), result.errors());
    }

    @Test
    void shouldRejectInvalidAndDuplicateAgentNames() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withConfigs(config("claude/x"), config("claude/x"), config("Claude/Upper"));

        PluginValidationResult result = validator.validate(plugin);

        assertTrue(result.errors().contains("configs.1.name: Duplicate agent name 'claude/x'"));
        assertTrue(result.errors().stream().anyMatch(error -> error.startsWith("configs.2.name: Agent name must be")));
    }

    @Test
    void shouldSkipCrossChecksWhenStructureIsInvalid() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withManifest(manifest("test", "x"))
                .withCatalog(entry("claude/x"), entry("claude/orphan"));

        PluginValidationResult result = validator.validate(plugin);

        assertEquals(1, result.errors().size());
        assertTrue(result.warnings().isEmpty());
    }

    // ===== Cross-checks =====

    @Test
    void shouldWarnForConfigWithoutCatalogEntry() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withConfigs(config("claude/x"), config("claude/hidden"));

        PluginValidationResult result = validator.validate(plugin);

        assertTrue(result.valid());
        assertEquals(List.of("Config 'claude/hidden' has no matching catalog entry"), result.warnings());
    }

    @Test
    void shouldFailConfigWithoutCatalogEntryInStrictMode() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withConfigs(config("claude/x"), config("claude/hidden"));

        PluginValidationResult result = validator.validate(plugin, PluginValidationOptions.strict());

        assertFalse(result.valid());
        assertEquals(List.of("Config 'claude/hidden' has no matching catalog entry"), result.errors());
    }

    @Test
    void shouldExemptDisabledConfigsFromCatalogMatch() {
        AgentConfig disabled = config("claude/retired").toBuilder()
                .disabled(true)
                .disabledReason("Model retired")
                .build();
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x").withConfigs(config("claude/x"), disabled);

        PluginValidationResult result = validator.validate(plugin, PluginValidationOptions.strict());

        assertTrue(result.valid());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void shouldFailCatalogEntryWithoutConfigInBothModes() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withCatalog(entry("claude/x"), entry("claude/ghost"));

        PluginValidationResult lenient = validator.validate(plugin);
        PluginValidationResult strict = validator.validate(plugin, PluginValidationOptions.strict());

        assertEquals(List.of("Catalog entry 'claude/ghost' has no matching config"), lenient.errors());
        assertEquals(lenient.errors(), strict.errors());
    }

    @Test
    void shouldWarnAboutNonStandardPrefix() {
        PluginValidationResult result = validator.validate(TestProviderPlugin.of("test", "mystery/model"));

        assertTrue(result.valid());
        assertEquals(List.of("Config 'mystery/model' has non-standard prefix 'mystery'"), result.warnings());
    }

    // ===== Assertion =====

    @Test
    void shouldThrowWithAllErrorsWhenAssertingInvalidPlugin() {
        TestProviderPlugin plugin = TestProviderPlugin.of("test", "claude/x")
                .withCatalog(entry("claude/x"), entry("claude/a"), entry("claude/b"));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> validator.assertValidPlugin(plugin, PluginValidationOptions.DEFAULT));

        assertEquals("Invalid plugin:\nCatalog entry 'claude/a' has no matching config\n"
                + "Catalog entry 'claude/b' has no matching config", error.getMessage());
    }

    @Test
    void shouldNotThrowWhenAssertingValidPlugin() {
        assertDoesNotThrow(() -> validator.assertValidPlugin(TestProviderPlugin.of("test", "codex/x"),
                PluginValidationOptions.strict()));
    }

    private static PluginManifest manifest(String id, String version) {
        return PluginManifest.builder()
                .id(id)
                .name("Test")
                .version(version)
                .type(PluginType.BUILTIN)
                .build();
    }
}
