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
import me.golemcore.toolexec.domain.model.ExecutionContext;
import me.golemcore.toolexec.domain.model.Session;
import me.golemcore.toolexec.port.outbound.SessionStorePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link SessionStorePort} used when the durable backend is
 * unreachable at startup or explicitly disabled. Sessions are lost on restart
 * and are not visible to other processes.
 *
 * <p>
 * TTL semantics match the durable store: expiry is checked on every access and
 * an optional sweeper evicts sessions nobody reads any more.
 */
@Slf4j
public class InMemorySessionStore implements SessionStorePort {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long defaultTtlSeconds;

    private volatile ScheduledFuture<?> sweepTask;

    public InMemorySessionStore(Clock clock, long defaultTtlSeconds) {
        this.clock = clock;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    /**
     * Schedules periodic removal of expired sessions on {@code scheduler}.
     */
    public void startSweeper(ScheduledExecutorService scheduler, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        long millis = interval.toMillis();
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepExpired, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("[SessionStore] memory sweeper scheduled every {} ms", millis);
    }

    @Override
    public Session create() {
        return create(UUID.randomUUID().toString());
    }

    @Override
    public Session create(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        Session stored = sessions.compute(sessionId, (id, existing) -> {
            if (existing != null && !isExpired(existing, now)) {
                existing.setLastAccessedAt(now);
                return existing;
            }
            log.debug("[SessionStore] created memory session {}", id);
            return newSession(id, ExecutionContext.initial(), now);
        });
        return stored.copy();
    }

    @Override
    public Optional<Session> get(String sessionId) {
        Instant now = clock.instant();
        Session stored = sessions.computeIfPresent(sessionId, (id, existing) -> {
            if (isExpired(existing, now)) {
                log.debug("[SessionStore] memory session {} expired", id);
                return null;
            }
            existing.setLastAccessedAt(now);
            return existing;
        });
        return Optional.ofNullable(stored).map(Session::copy);
    }

    @Override
    public Session getOrCreate(String sessionId) {
        return create(sessionId);
    }

    @Override
    public Session save(String sessionId, ExecutionContext context) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        ExecutionContext snapshot = context != null ? context.copy() : ExecutionContext.initial();
        Session stored = sessions.compute(sessionId, (id, existing) -> {
            if (existing == null || isExpired(existing, now)) {
                return newSession(id, snapshot, now);
            }
            existing.setContext(snapshot);
            existing.setLastAccessedAt(now);
            return existing;
        });
        return stored.copy();
    }

    @Override
    public boolean delete(String sessionId) {
        Session removed = sessions.remove(sessionId);
        return removed != null && !isExpired(removed, clock.instant());
    }

    @Override
    public List<String> list() {
        Instant now = clock.instant();
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            if (isExpired(entry.getValue(), now)) {
                sessions.remove(entry.getKey(), entry.getValue());
            } else {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    @Override
    public boolean extendTtl(String sessionId, Duration ttl) {
        Instant now = clock.instant();
        Session stored = sessions.computeIfPresent(sessionId, (id, existing) -> {
            if (isExpired(existing, now)) {
                return null;
            }
            existing.setTtlSeconds(ttl.toSeconds());
            existing.setLastAccessedAt(now);
            return existing;
        });
        return stored != null;
    }

    @Override
    public Optional<Duration> remainingTtl(String sessionId) {
        Session stored = sessions.get(sessionId);
        Instant now = clock.instant();
        if (stored == null || isExpired(stored, now)) {
            return Optional.empty();
        }
        if (stored.getTtlSeconds() <= 0) {
            return Optional.of(Duration.ZERO);
        }
        Instant expiresAt = stored.getLastAccessedAt().plusSeconds(stored.getTtlSeconds());
        return Optional.of(Duration.between(now, expiresAt));
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    @Override
    public void close() {
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
        }
        sessions.clear();
    }

    /**
     * Removes every expired session.
     *
     * @return number of sessions removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            if (isExpired(entry.getValue(), now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[SessionStore] swept {} expired memory sessions", removed);
        }
        return removed;
    }

    private Session newSession(String sessionId, ExecutionContext context, Instant now) {
        return Session.builder()
                .id(sessionId)
                .context(context)
                .createdAt(now)
                .lastAccessedAt(now)
                .ttlSeconds(defaultTtlSeconds)
                .build();
    }

    private static boolean isExpired(Session session, Instant now) {
        if (session.getTtlSeconds() <= 0) {
            return false;
        }
        return !now.isBefore(session.getLastAccessedAt().plusSeconds(session.getTtlSeconds()));
    }
}
