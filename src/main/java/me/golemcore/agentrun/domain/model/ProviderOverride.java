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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Team-specific partial replacement of a provider's default connection spec.
 * Supplied by an external store; only merged here, never persisted.
 */
@Value
@Builder
public class ProviderOverride {

    String teamId;
    String providerId;
    String baseUrl;
    ApiFormat apiFormat;
    String apiKeyEnvVar;
    Map<String, String> customHeaders;
    @Singular
    List<ProviderFallback> fallbacks;
    boolean enabled;
}
