package me.golemcore.agentrun.provider;

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

import me.golemcore.agentrun.domain.model.ApiFormat;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;

import java.util.List;

/**
 * Provider specs known without any plugin. Plugin specs with the same id
 * replace these when the registry initializes.
 */
public final class BaseProviders {

    public static final List<ProviderSpec> ALL = List.of(
            ProviderSpec.builder()
                    .id("anthropic")
                    .name("Anthropic")
                    .defaultBaseUrl("https://api.anthropic.com")
                    .apiFormat(ApiFormat.ANTHROPIC)
                    .authEnvVar("ANTHROPIC_API_KEY")
                    .apiKey(ApiKeys.ANTHROPIC_API_KEY)
                    .build(),
            ProviderSpec.builder()
                    .id("openai")
                    .name("OpenAI")
                    .defaultBaseUrl("https://api.openai.com/v1")
                    .apiFormat(ApiFormat.OPENAI)
                    .authEnvVar("OPENAI_API_KEY")
                    .apiKey(ApiKeys.OPENAI_API_KEY)
                    .build(),
            ProviderSpec.builder()
                    .id("gemini")
                    .name("Google Gemini")
                    .defaultBaseUrl("https://generativelanguage.googleapis.com")
                    .apiFormat(ApiFormat.PASSTHROUGH)
                    .authEnvVar("GEMINI_API_KEY")
                    .apiKey(ApiKeys.GEMINI_API_KEY)
                    .build(),
            ProviderSpec.builder()
                    .id("openrouter")
                    .name("OpenRouter")
                    .defaultBaseUrl("https://openrouter.ai/api/v1")
                    .apiFormat(ApiFormat.OPENAI)
                    .authEnvVar("OPENROUTER_API_KEY")
                    .apiKey(ApiKeys.OPENROUTER_API_KEY)
                    .build(),
            ProviderSpec.builder()
                    .id("xai")
                    .name("xAI")
                    .defaultBaseUrl("https://api.x.ai/v1")
                    .apiFormat(ApiFormat.OPENAI)
                    .authEnvVar("XAI_API_KEY")
                    .apiKey(ApiKeys.XAI_API_KEY)
                    .build());

    private BaseProviders() {
    }
}
