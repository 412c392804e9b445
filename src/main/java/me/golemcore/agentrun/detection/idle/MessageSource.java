package me.golemcore.agentrun.detection.idle;

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

import me.golemcore.agentrun.domain.model.AgentMessage;

import java.util.List;

/**
 * One tier of session message lookup. Sources are tried in order until one
 * answers without throwing.
 */
public interface MessageSource {

    /**
     * Short label used in logs, e.g. {@code http-api}.
     */
    String name();

    List<AgentMessage> fetchMessages() throws MessageSourceException;
}
