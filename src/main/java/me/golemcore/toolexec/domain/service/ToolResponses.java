package me.golemcore.toolexec.domain.service;

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

import me.golemcore.toolexec.domain.model.ToolResponse;

import java.time.Instant;

/**
 * Factories for the standard {@link ToolResponse} envelope.
 */
public final class ToolResponses {

    public static final String VERSION = "1.0.0";

    private ToolResponses() {
    }

    public static ToolResponse success(Object data, String tool, long executionTimeMillis, Instant timestamp) {
        return ToolResponse.builder()
                .data(data)
                .status(ToolResponse.Status.builder().success(true).code(200).build())
                .metadata(metadata(tool, executionTimeMillis, timestamp))
                .build();
    }

    public static ToolResponse error(String message, String tool, int code, Instant timestamp) {
        return ToolResponse.builder()
                .status(ToolResponse.Status.builder().success(false).code(code).message(message).build())
                .metadata(metadata(tool, 0, timestamp))
                .build();
    }

    /**
     * Copy of {@code response} stamped with the session it belongs to.
     */
    public static ToolResponse withSession(ToolResponse response, String sessionId) {
        return response.toBuilder()
                .context(ToolResponse.ResponseContext.builder().sessionId(sessionId).build())
                .build();
    }

    private static ToolResponse.Metadata metadata(String tool, long executionTimeMillis, Instant timestamp) {
        return ToolResponse.Metadata.builder()
                .tool(tool)
                .version(VERSION)
                .executionTime(executionTimeMillis)
                .timestamp(timestamp)
                .build();
    }
}
