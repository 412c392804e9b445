package me.golemcore.agentrun.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vendor used for grouping and logo selection in agent pickers.
 */
public enum AgentVendor {
    ANTHROPIC("anthropic"), OPENAI("openai"), GOOGLE("google"), OPENCODE("opencode"), QWEN("qwen"), CURSOR("cursor"), AMP("amp"), XAI("xai"), OPENROUTER("openrouter");

    private final String code;

    AgentVendor(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
