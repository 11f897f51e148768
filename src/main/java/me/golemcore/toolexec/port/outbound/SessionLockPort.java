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

import me.golemcore.toolexec.domain.model.SessionLock;

import java.time.Duration;
import java.util.Optional;

/**
 * Port for the advisory, TTL-bounded per-session execution lock shared by all
 * processes using the same backend. The lock is best-effort: if it expires
 * before being released or renewed, another process may acquire it.
 */
public interface SessionLockPort {

    /**
     * Tries once to take the lock; never waits.
     *
     * @return the lock if acquired, empty if another holder owns it
     */
    Optional<SessionLock> tryAcquire(String sessionId, Duration ttl);

    /**
     * Extends the lock TTL if {@code lock} is still the current holder.
     */
    boolean renew(SessionLock lock, Duration ttl);

    /**
     * Releases the lock if {@code lock} is still the current holder.
     */
    boolean release(SessionLock lock);
}
