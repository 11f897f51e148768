package me.golemcore.toolexec.adapter.outbound.redis;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.BackendUnavailableException;
import me.golemcore.toolexec.domain.model.ExecutionContext;
import me.golemcore.toolexec.domain.model.Session;
import me.golemcore.toolexec.port.outbound.SessionStorePort;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis implementation of {@link SessionStorePort}.
 *
 * <p>
 * Layout under the configured prefix:
 * <ul>
 * <li>{@code <prefix>session:<id>} - JSON session record with a Redis TTL</li>
 * <li>{@code <prefix>session-index} - set of ids written through this
 * store</li>
 * </ul>
 *
 * <p>
 * Record keys expire on their own, so the index can hold ids whose record is
 * gone. Those are dropped from the index lazily, when {@link #get} misses or
 * {@link #list()} checks the index. Reads slide the TTL with {@code EXPIRE}
 * instead of rewriting the record so a read never overwrites a concurrent
 * write from another process.
 */
@Slf4j
public class RedisSessionStore implements SessionStorePort {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final String indexKey;
    private final long defaultTtlSeconds;

    public RedisSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock,
            String keyPrefix, String indexKey, long defaultTtlSeconds) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.indexKey = indexKey;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    @Override
    public Session create() {
        return create(UUID.randomUUID().toString());
    }

    @Override
    public Session create(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        Session session = Session.builder()
                .id(sessionId)
                .context(ExecutionContext.initial())
                .createdAt(now)
                .lastAccessedAt(now)
                .ttlSeconds(defaultTtlSeconds)
                .build();
        String payload = write(session);
        Boolean created = call("create", sessionId, () -> defaultTtlSeconds > 0
                ? redisTemplate.opsForValue().setIfAbsent(key(sessionId), payload,
                        Duration.ofSeconds(defaultTtlSeconds))
                : redisTemplate.opsForValue().setIfAbsent(key(sessionId), payload));
        call("index", sessionId, () -> redisTemplate.opsForSet().add(indexKey, sessionId));
        if (Boolean.TRUE.equals(created)) {
            log.debug("[SessionStore] created session {}", sessionId);
            return session;
        }
        return get(sessionId).orElseGet(() -> save(sessionId, ExecutionContext.initial()));
    }

    @Override
    public Optional<Session> get(String sessionId) {
        String key = key(sessionId);
        String payload = call("get", sessionId, () -> redisTemplate.opsForValue().get(key));
        if (payload == null) {
            call("index", sessionId, () -> redisTemplate.opsForSet().remove(indexKey, sessionId));
            return Optional.empty();
        }
        Optional<Session> session = read(payload, sessionId);
        session.ifPresent(found -> {
            long ttl = found.getTtlSeconds() > 0 ? found.getTtlSeconds() : defaultTtlSeconds;
            if (ttl > 0) {
                call("touch", sessionId, () -> redisTemplate.expire(key, Duration.ofSeconds(ttl)));
            }
            found.setLastAccessedAt(clock.instant());
        });
        return session;
    }

    @Override
    public Session getOrCreate(String sessionId) {
        return get(sessionId).orElseGet(() -> create(sessionId));
    }

    @Override
    public Session save(String sessionId, ExecutionContext context) {
        Objects.requireNonNull(sessionId, "sessionId");
        String key = key(sessionId);
        Instant now = clock.instant();
        Optional<Session> existing = Optional
                .ofNullable(call("get", sessionId, () -> redisTemplate.opsForValue().get(key)))
                .flatMap(payload -> read(payload, sessionId));
        long ttl = existing.map(Session::getTtlSeconds).filter(value -> value > 0).orElse(defaultTtlSeconds);

        Session session = Session.builder()
                .id(sessionId)
                .context(context != null ? context.copy() : ExecutionContext.initial())
                .createdAt(existing.map(Session::getCreatedAt).orElse(now))
                .lastAccessedAt(now)
                .ttlSeconds(ttl)
                .build();
        writeRecord(sessionId, session);
        call("index", sessionId, () -> redisTemplate.opsForSet().add(indexKey, sessionId));
        return session;
    }

    @Override
    public boolean delete(String sessionId) {
        Boolean deleted = call("delete", sessionId, () -> redisTemplate.delete(key(sessionId)));
        call("index", sessionId, () -> redisTemplate.opsForSet().remove(indexKey, sessionId));
        if (Boolean.TRUE.equals(deleted)) {
            log.debug("[SessionStore] deleted session {}", sessionId);
        }
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public List<String> list() {
        Set<String> members = call("list", "*", () -> redisTemplate.opsForSet().members(indexKey));
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<String> live = new ArrayList<>();
        for (String sessionId : members) {
            Boolean exists = call("list", sessionId, () -> redisTemplate.hasKey(key(sessionId)));
            if (Boolean.TRUE.equals(exists)) {
                live.add(sessionId);
            } else {
                call("index", sessionId, () -> redisTemplate.opsForSet().remove(indexKey, sessionId));
                log.debug("[SessionStore] dropped expired session {} from index", sessionId);
            }
        }
        return live;
    }

    @Override
    public boolean extendTtl(String sessionId, Duration ttl) {
        Optional<Session> existing = Optional
                .ofNullable(call("get", sessionId, () -> redisTemplate.opsForValue().get(key(sessionId))))
                .flatMap(payload -> read(payload, sessionId));
        if (existing.isEmpty()) {
            return false;
        }
        Session session = existing.get();
        session.setTtlSeconds(ttl.toSeconds());
        session.setLastAccessedAt(clock.instant());
        writeRecord(sessionId, session);
        return true;
    }

    @Override
    public Optional<Duration> remainingTtl(String sessionId) {
        Long seconds = call("ttl", sessionId, () -> redisTemplate.getExpire(key(sessionId), TimeUnit.SECONDS));
        if (seconds == null || seconds == -2) {
            return Optional.empty();
        }
        return Optional.of(seconds < 0 ? Duration.ZERO : Duration.ofSeconds(seconds));
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    @Override
    public void close() {
        // the connection factory is owned by the application context
        log.debug("[SessionStore] redis session store closed");
    }

    private void writeRecord(String sessionId, Session session) {
        String payload = write(session);
        long ttl = session.getTtlSeconds();
        call("save", sessionId, () -> {
            if (ttl > 0) {
                redisTemplate.opsForValue().set(key(sessionId), payload, Duration.ofSeconds(ttl));
            } else {
                redisTemplate.opsForValue().set(key(sessionId), payload);
            }
            return null;
        });
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }

    private String write(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Session " + session.getId() + " is not serializable", e);
        }
    }

    private Optional<Session> read(String payload, String sessionId) {
        try {
            return Optional.of(objectMapper.readValue(payload, Session.class));
        } catch (JsonProcessingException e) {
            log.warn("[SessionStore] unreadable record for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T call(String operation, String sessionId, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("[SessionStore] redis {} failed for session {}: {}", operation, sessionId, e.getMessage());
            throw new BackendUnavailableException(
                    "Session store " + operation + " failed for " + sessionId + ": " + e.getMessage(), e);
        }
    }
}
