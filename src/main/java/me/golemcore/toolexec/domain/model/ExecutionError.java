package me.golemcore.toolexec.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error recorded on a session when an execution leaves the executing state
 * without a result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionError {

    private String message;
    private Kind kind;
    private Instant timestamp;

    public static ExecutionError of(Kind kind, String message, Instant timestamp) {
        return ExecutionError.builder()
                .kind(kind)
                .message(message)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Why the execution ended without a result.
     */
    public enum Kind {
        EXECUTION, TIMEOUT
    }
}
