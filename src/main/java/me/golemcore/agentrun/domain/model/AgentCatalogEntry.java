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

/**
 * UI-facing metadata twin of an {@link AgentConfig}. Carries no execution
 * logic so it can be listed without touching provider hooks.
 */
@Value
@Builder
public class AgentCatalogEntry {

    /** Must equal the name of exactly one config in the same plugin. */
    String name;
    String displayName;
    AgentVendor vendor;
    @Singular
    List<String> requiredApiKeys;
    ModelTier tier;
    boolean disabled;
    String disabledReason;
    @Singular
    List<String> tags;
    @Singular
    List<ModelVariant> variants;
    String defaultVariant;

    /**
     * Own variants when declared, otherwise the vendor defaults.
     */
    public List<ModelVariant> effectiveVariants() {
        if (variants != null && !variants.isEmpty()) {
            return variants;
        }
        return ModelVariant.defaultsFor(vendor);
    }
}
