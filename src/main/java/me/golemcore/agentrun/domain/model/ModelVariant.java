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

import java.util.List;

/**
 * Thinking/reasoning mode a catalog entry can be launched with.
 *
 * @param id
 *            variant identifier, e.g. {@code high}
 * @param displayName
 *            human-readable label
 * @param description
 *            optional description, may be {@code null}
 */
public record ModelVariant(String id, String displayName, String description) {

    private static final List<ModelVariant> DEFAULT_ONLY = List.of(of("default", "Default"));

    public static ModelVariant of(String id, String displayName) {
        return new ModelVariant(id, displayName, null);
    }

    /**
     * Vendor-wide variants used when a catalog entry declares none of its own.
     */
    public static List<ModelVariant> defaultsFor(AgentVendor vendor) {
        if (vendor == null) {
            return DEFAULT_ONLY;
        }
        return switch (vendor) {
        case ANTHROPIC -> List.of(
                of("default", "Default"),
                new ModelVariant("high", "High Thinking", "Higher thinking budget"),
                new ModelVariant("max", "Max Thinking", "Maximum thinking budget"));
        case OPENAI -> List.of(
                of("none", "No Reasoning"),
                new ModelVariant("low", "Low", "Low reasoning effort"),
                new ModelVariant("medium", "Medium", "Medium reasoning effort"),
                new ModelVariant("high", "High", "High reasoning effort"));
        case GOOGLE -> List.of(
                of("default", "Default"),
                new ModelVariant("low", "Low Budget", "Lower token budget"),
                new ModelVariant("high", "High Budget", "Higher token budget"));
        default -> DEFAULT_ONLY;
        };
    }
}
