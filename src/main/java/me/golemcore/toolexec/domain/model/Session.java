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
 * A persisted session: an opaque id addressing an {@link ExecutionContext}
 * that spans multiple tool invocations. Expiration is sliding; every read or
 * write through a session store restarts the {@code ttlSeconds} window.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String id;

    @Builder.Default
    private ExecutionContext context = ExecutionContext.initial();

    private Instant createdAt;
    private Instant lastAccessedAt;
    private long ttlSeconds;

    public Session copy() {
        return toBuilder()
                .context(context != null ? context.copy() : ExecutionContext.initial())
                .build();
    }
}
