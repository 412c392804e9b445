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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentrun.domain.model.AgentMessage;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Last tier: message files persisted by older agent versions under
 * {@code <storage>/message/ses_<id>/<msg>.json}. Never fails; unreadable files
 * are skipped and a missing directory means no messages.
 */
@Slf4j
public class StorageMessageSource implements MessageSource {

    private static final String SESSION_DIR_PREFIX = "ses_";

    private final Path storageDir;
    private final ObjectMapper objectMapper;
    private final AgentMessageNormalizer normalizer;

    public StorageMessageSource(Path storageDir, ObjectMapper objectMapper, AgentMessageNormalizer normalizer) {
        this.storageDir = storageDir;
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
    }

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public List<AgentMessage> fetchMessages() {
        Path messageDir = storageDir.resolve("message");
        List<AgentMessage> messages = new ArrayList<>();
        if (!Files.isDirectory(messageDir)) {
            log.debug("[IdleGuard] No message storage at {}", messageDir);
            return messages;
        }

        try (DirectoryStream<Path> sessions = Files.newDirectoryStream(messageDir, SESSION_DIR_PREFIX + "*")) {
            for (Path sessionDir : sessions) {
                if (Files.isDirectory(sessionDir)) {
                    readSession(sessionDir, messages);
                }
            }
        } catch (IOException e) {
            log.warn("[IdleGuard] Error reading message storage {}: {}", messageDir, e.getMessage());
        }
        return messages;
    }

    private void readSession(Path sessionDir, List<AgentMessage> messages) {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(sessionDir, "*.json")) {
            for (Path file : files) {
                try {
                    messages.add(normalizer.normalize(objectMapper.readTree(file.toFile())));
                } catch (IOException e) {
                    log.debug("[IdleGuard] Failed to parse message file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("[IdleGuard] Error reading session directory {}: {}", sessionDir, e.getMessage());
        }
    }
}
