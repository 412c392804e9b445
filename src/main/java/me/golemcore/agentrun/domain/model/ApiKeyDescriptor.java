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
import lombok.Value;

/**
 * Describes one credential field an agent or provider consumes.
 */
@Value
@Builder
public class ApiKeyDescriptor {

    /** Name of the variable the credential is stored under. */
    String envVar;
    String displayName;
    String description;
    /**
     * Variable name the value is exported under inside the sandbox, when it
     * differs from {@link #envVar}.
     */
    String mapToEnvVar;

    public String targetEnvVar() {
        return mapToEnvVar != null && !mapToEnvVar.isBlank() ? mapToEnvVar : envVar;
    }

    public static ApiKeyDescriptor of(String envVar, String displayName) {
        return ApiKeyDescriptor.builder()
                .envVar(envVar)
                .displayName(displayName)
                .build();
    }
}
