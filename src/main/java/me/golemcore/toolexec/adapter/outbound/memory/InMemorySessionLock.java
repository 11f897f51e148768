package me.golemcore.toolexec.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.SessionLock;
import me.golemcore.toolexec.port.outbound.SessionLockPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionLockPort} backed by a process-local map with clock-based expiry.
 * Gives the same token semantics as the Redis lock for services that share one
 * in-process store.
 */
@Slf4j
public class InMemorySessionLock implements SessionLockPort {

    private final Map<String, Holder> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<SessionLock> tryAcquire(String sessionId, Duration ttl) {
        Instant now = clock.instant();
        String token = UUID.randomUUID().toString();
        Holder candidate = new Holder(token, now.plus(ttl));
        Holder current = locks.compute(sessionId, (id, existing) -> {
            if (existing != null && now.isBefore(existing.expiresAt())) {
                return existing;
            }
            return candidate;
        });
        if (current != candidate) {
            log.debug("[Lock] memory lock for {} is held", sessionId);
            return Optional.empty();
        }
        return Optional.of(new SessionLock(sessionId, token, now));
    }

    @Override
    public boolean renew(SessionLock lock, Duration ttl) {
        Instant now = clock.instant();
        Holder renewed = locks.computeIfPresent(lock.sessionId(), (id, existing) -> {
            if (existing.token().equals(lock.token()) && now.isBefore(existing.expiresAt())) {
                return new Holder(existing.token(), now.plus(ttl));
            }
            return existing;
        });
        return renewed != null && renewed.token().equals(lock.token()) && now.isBefore(renewed.expiresAt());
    }

    @Override
    public boolean release(SessionLock lock) {
        Holder current = locks.get(lock.sessionId());
        if (current == null || !current.token().equals(lock.token())) {
            return false;
        }
        return locks.remove(lock.sessionId(), current);
    }

    private record Holder(String token, Instant expiresAt) {
    }
}
