package me.golemcore.toolexec.port.outbound;

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

import me.golemcore.toolexec.domain.model.ExecutionContext;
import me.golemcore.toolexec.domain.model.Session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Port for keyed, TTL-bound persistence of session contexts. Expiration is
 * sliding: every read or write of a session restarts its TTL. A session that
 * expired is indistinguishable from one that never existed.
 *
 * <p>
 * Durable implementations convert transport failures into
 * {@link me.golemcore.toolexec.domain.exception.BackendUnavailableException}.
 */
public interface SessionStorePort {

    /**
     * Creates a session with a generated id and an empty context.
     */
    Session create();

    /**
     * Creates a session under {@code sessionId} with an empty context. If the id
     * is already live the existing session is returned unchanged.
     */
    Session create(String sessionId);

    /**
     * Strict lookup; empty when the id is unknown or expired.
     */
    Optional<Session> get(String sessionId);

    /**
     * Lookup that lazily creates an empty session on a miss.
     */
    Session getOrCreate(String sessionId);

    /**
     * Stores {@code context} under {@code sessionId}, creating the session if
     * needed, and restarts its TTL.
     */
    Session save(String sessionId, ExecutionContext context);

    /**
     * @return true if a live session was removed
     */
    boolean delete(String sessionId);

    /**
     * Ids of all live sessions.
     */
    List<String> list();

    /**
     * Restarts the TTL of a live session with a new duration.
     *
     * @return false if the session does not exist
     */
    boolean extendTtl(String sessionId, Duration ttl);

    /**
     * Remaining time to live, empty if the session does not exist.
     */
    Optional<Duration> remainingTtl(String sessionId);

    /**
     * Whether sessions survive a process restart and are shared across
     * processes.
     */
    boolean isDurable();

    /**
     * Releases resources held by the store.
     */
    void close();
}
