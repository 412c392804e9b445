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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Wire format spoken by an upstream provider endpoint.
 */
public enum ApiFormat {
    ANTHROPIC("anthropic"), OPENAI("openai"), BEDROCK("bedrock"), VERTEX("vertex"), PASSTHROUGH("passthrough");

    private final String code;

    ApiFormat(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ApiFormat fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("ApiFormat code must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ApiFormat value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ApiFormat: " + code);
    }
}
