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

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * File to materialize in the sandbox before the agent starts.
 *
 * @param destinationPath
 *            absolute path inside the sandbox, {@code $HOME} is expanded there
 * @param contentBase64
 *            file content, base64 encoded
 * @param mode
 *            octal permission string, e.g. {@code 644}
 */
public record EnvironmentFile(String destinationPath, String contentBase64, String mode) {

    public static EnvironmentFile text(String destinationPath, String content, String mode) {
        String encoded = Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
        return new EnvironmentFile(destinationPath, encoded, mode);
    }

    public String decodedContent() {
        return new String(Base64.getDecoder().decode(contentBase64), StandardCharsets.UTF_8);
    }
}
