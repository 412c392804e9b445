package me.golemcore.agentrun.plugin.builtin;

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

import me.golemcore.agentrun.plugin.api.ProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.amp.AmpPlugin;
import me.golemcore.agentrun.plugin.builtin.anthropic.AnthropicPlugin;
import me.golemcore.agentrun.plugin.builtin.cursor.CursorPlugin;
import me.golemcore.agentrun.plugin.builtin.gemini.GeminiPlugin;
import me.golemcore.agentrun.plugin.builtin.openai.OpenAiPlugin;
import me.golemcore.agentrun.plugin.builtin.opencode.OpenCodePlugin;
import me.golemcore.agentrun.plugin.builtin.qwen.QwenPlugin;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Built-in provider plugins shipped with the default distribution, in
 * registration order.
 */
@Component
public class BuiltinPluginCatalog {

    private final List<Registration> registrations;

    public BuiltinPluginCatalog() {
        this(List.of(
                new Registration("anthropic", AnthropicPlugin::new),
                new Registration("openai", OpenAiPlugin::new),
                new Registration("gemini", GeminiPlugin::new),
                new Registration("opencode", OpenCodePlugin::new),
                new Registration("amp", AmpPlugin::new),
                new Registration("cursor", CursorPlugin::new),
                new Registration("qwen", QwenPlugin::new)));
    }

    public BuiltinPluginCatalog(List<Registration> registrations) {
        this.registrations = List.copyOf(registrations);
    }

    public List<Registration> registrations() {
        return registrations;
    }

    /**
     * Instantiates every plugin. Fails on the first plugin that cannot be
     * created.
     */
    public List<ProviderPlugin> createPlugins() {
        return registrations.stream()
                .map(registration -> registration.factory().get())
                .toList();
    }

    /**
     * A plugin id together with the factory that creates it. Creation is deferred
     * so one broken plugin cannot keep the others from loading.
     */
    public record Registration(String id, Supplier<ProviderPlugin> factory) {
    }
}
