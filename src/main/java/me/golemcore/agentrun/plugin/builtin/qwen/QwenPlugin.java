package me.golemcore.agentrun.plugin.builtin.qwen;

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

import me.golemcore.agentrun.domain.model.AgentCatalogEntry;
import me.golemcore.agentrun.domain.model.AgentConfig;
import me.golemcore.agentrun.domain.model.AgentVendor;
import me.golemcore.agentrun.domain.model.ApiFormat;
import me.golemcore.agentrun.domain.model.ModelTier;
import me.golemcore.agentrun.domain.model.ProviderSpec;
import me.golemcore.agentrun.plugin.builtin.AbstractProviderPlugin;
import me.golemcore.agentrun.plugin.builtin.ApiKeys;

/**
 * Built-in plugin for Qwen Code agents, served either by Alibaba Model Studio
 * or by OpenRouter's free tier.
 */
public final class QwenPlugin extends AbstractProviderPlugin {

    private static final String MODEL_STUDIO_URL = "https://dashscope-intl.aliyuncs.com/compatible-mode/v1";
    private static final String OPENROUTER_URL = "https://openrouter.ai/api/v1";

    public QwenPlugin() {
        super(
                "qwen",
                "Qwen",
                "Qwen Code CLI on OpenAI-compatible endpoints, completion read from local telemetry.",
                ProviderSpec.builder()
                        .id("qwen")
                        .name("Qwen")
                        .defaultBaseUrl(MODEL_STUDIO_URL)
                        .apiFormat(ApiFormat.OPENAI)
                        .authEnvVar("MODEL_STUDIO_API_KEY")
                        .apiKey(ApiKeys.MODEL_STUDIO_API_KEY)
                        .build());

        addAgent(
                AgentConfig.builder()
                        .name("qwen/qwen3-coder-plus")
                        .command("qwen")
                        .arg("--yolo")
                        .apiKey(ApiKeys.MODEL_STUDIO_API_KEY)
                        .capabilities(new QwenCapabilities(ApiKeys.MODEL_STUDIO_API_KEY, MODEL_STUDIO_URL,
                                "qwen3-coder-plus"))
                        .build(),
                AgentCatalogEntry.builder()
                        .name("qwen/qwen3-coder-plus")
                        .displayName("Qwen3 Coder Plus")
                        .vendor(AgentVendor.QWEN)
                        .requiredApiKey("MODEL_STUDIO_API_KEY")
                        .tier(ModelTier.PAID)
                        .build());

        addAgent(
                AgentConfig.builder()
                        .name("qwen/qwen3-coder:free")
                        .command("qwen")
                        .arg("--yolo")
                        .apiKey(ApiKeys.OPENROUTER_API_KEY)
                        .capabilities(new QwenCapabilities(ApiKeys.OPENROUTER_API_KEY, OPENROUTER_URL,
                                "qwen/qwen3-coder:free"))
                        .build(),
                AgentCatalogEntry.builder()
                        .name("qwen/qwen3-coder:free")
                        .displayName("Qwen3 Coder (free)")
                        .vendor(AgentVendor.QWEN)
                        .requiredApiKey("OPENROUTER_API_KEY")
                        .tier(ModelTier.FREE)
                        .tag("free")
                        .build());
    }
}
