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

import me.golemcore.agentrun.domain.model.AgentEnvironmentContext;
import me.golemcore.agentrun.domain.model.ApiKeyDescriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Credential descriptors shared by the builtin plugins.
 */
public final class ApiKeys {

    public static final ApiKeyDescriptor ANTHROPIC_API_KEY = ApiKeyDescriptor.builder()
            .envVar("ANTHROPIC_API_KEY")
            .displayName("Anthropic API Key")
            .description("API key for Claude models")
            .build();

    public static final ApiKeyDescriptor CLAUDE_CODE_OAUTH_TOKEN = ApiKeyDescriptor.builder()
            .envVar("CLAUDE_CODE_OAUTH_TOKEN")
            .displayName("Claude Code OAuth Token")
            .description("Subscription token from `claude setup-token`, used instead of an API key")
            .build();

    public static final ApiKeyDescriptor OPENAI_API_KEY = ApiKeyDescriptor.builder()
            .envVar("OPENAI_API_KEY")
            .displayName("OpenAI API Key")
            .build();

    public static final ApiKeyDescriptor CODEX_AUTH_JSON = ApiKeyDescriptor.builder()
            .envVar("CODEX_AUTH_JSON")
            .displayName("Codex auth.json")
            .description("Contents of ~/.codex/auth.json for ChatGPT subscription login")
            .build();

    public static final ApiKeyDescriptor GEMINI_API_KEY = ApiKeyDescriptor.of("GEMINI_API_KEY", "Gemini API Key");

    public static final ApiKeyDescriptor OPENROUTER_API_KEY = ApiKeyDescriptor.of("OPENROUTER_API_KEY",
            "OpenRouter API Key");

    public static final ApiKeyDescriptor MODEL_STUDIO_API_KEY = ApiKeyDescriptor.builder()
            .envVar("MODEL_STUDIO_API_KEY")
            .displayName("Alibaba Model Studio API Key")
            .description("DashScope key for Qwen models")
            .mapToEnvVar("DASHSCOPE_API_KEY")
            .build();

    public static final ApiKeyDescriptor XAI_API_KEY = ApiKeyDescriptor.of("XAI_API_KEY", "xAI API Key");

    public static final ApiKeyDescriptor AMP_API_KEY = ApiKeyDescriptor.of("AMP_API_KEY", "Amp API Key");

    public static final ApiKeyDescriptor CURSOR_API_KEY = ApiKeyDescriptor.of("CURSOR_API_KEY", "Cursor API Key");

    private ApiKeys() {
    }

    /**
     * Requirement message when none of the alternative keys is available, e.g.
     * {@code "Anthropic API Key or Claude Code OAuth Token is required"}.
     */
    public static List<String> requireAny(AgentEnvironmentContext context, ApiKeyDescriptor... alternatives) {
        for (ApiKeyDescriptor key : alternatives) {
            if (context.hasApiKey(key.getEnvVar())) {
                return List.of();
            }
        }
        String names = List.of(alternatives).stream()
                .map(ApiKeyDescriptor::getDisplayName)
                .collect(Collectors.joining(" or "));
        return List.of(names + " is required");
    }
}
