package me.golemcore.agentrun.plugin.context;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Display order of plugins: the well-known providers first, then everything
 * else in registration order.
 */
final class PluginOrder {

    static final List<String> PREFERRED = List.of("anthropic", "openai", "amp", "opencode", "gemini", "qwen",
            "cursor");

    private PluginOrder() {
    }

    /**
     * @param byId
     *            plugins keyed by id, iterated in registration order
     */
    static <P> List<P> sort(Map<String, P> byId) {
        List<P> ordered = new ArrayList<>(byId.size());
        for (String id : PREFERRED) {
            P plugin = byId.get(id);
            if (plugin != null) {
                ordered.add(plugin);
            }
        }
        for (Map.Entry<String, P> entry : byId.entrySet()) {
            if (!PREFERRED.contains(entry.getKey())) {
                ordered.add(entry.getValue());
            }
        }
        return ordered;
    }
}
