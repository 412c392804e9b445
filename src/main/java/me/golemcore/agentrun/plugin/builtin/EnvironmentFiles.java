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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.agentrun.domain.model.EnvironmentFile;

/**
 * Builders for the files builtin plugins drop into the sandbox.
 */
public final class EnvironmentFiles {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private EnvironmentFiles() {
    }

    public static EnvironmentFile json(String destinationPath, Object content) {
        try {
            return EnvironmentFile.text(destinationPath, JSON.writeValueAsString(content) + "\n", "644");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + destinationPath, e);
        }
    }

    public static EnvironmentFile script(String destinationPath, String content) {
        return EnvironmentFile.text(destinationPath, content, "755");
    }

    public static EnvironmentFile text(String destinationPath, String content) {
        return EnvironmentFile.text(destinationPath, content, "644");
    }

    /**
     * Shell script that creates a completion marker, e.g.
     * {@code /root/lifecycle/claude-complete-<taskRunId>}.
     */
    public static EnvironmentFile markerScript(String destinationPath, String markerPath) {
        String parent = markerPath.substring(0, Math.max(markerPath.lastIndexOf('/'), 1));
        return script(destinationPath, "#!/bin/bash\n"
                + "set -eu\n"
                + "mkdir -p '" + parent + "'\n"
                + "printf '%s\\n' completed > '" + markerPath + "'\n");
    }
}
