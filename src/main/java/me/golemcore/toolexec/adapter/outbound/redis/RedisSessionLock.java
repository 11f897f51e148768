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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.BackendUnavailableException;
import me.golemcore.toolexec.domain.model.SessionLock;
import me.golemcore.toolexec.port.outbound.SessionLockPort;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis implementation of {@link SessionLockPort}: {@code SET key token NX PX}
 * to acquire, and token-checked Lua scripts to renew and release so a process
 * never touches a lock that has passed to another holder.
 */
@Slf4j
public class RedisSessionLock implements SessionLockPort {

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final String keyPrefix;

    public RedisSessionLock(StringRedisTemplate redisTemplate, Clock clock, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<SessionLock> tryAcquire(String sessionId, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(key(sessionId), token, ttl);
        } catch (DataAccessException e) {
            log.warn("[Lock] acquire failed for session {}: {}", sessionId, e.getMessage());
            throw new BackendUnavailableException("Lock acquire failed for " + sessionId + ": " + e.getMessage(), e);
        }
        if (!Boolean.TRUE.equals(acquired)) {
            log.debug("[Lock] session {} is locked by another holder", sessionId);
            return Optional.empty();
        }
        log.debug("[Lock] acquired lock for session {} (ttl={} ms)", sessionId, ttl.toMillis());
        return Optional.of(new SessionLock(sessionId, token, clock.instant()));
    }

    @Override
    public boolean renew(SessionLock lock, Duration ttl) {
        try {
            Long result = redisTemplate.execute(RENEW_SCRIPT, List.of(key(lock.sessionId())), lock.token(),
                    String.valueOf(ttl.toMillis()));
            return result != null && result == 1L;
        } catch (DataAccessException e) {
            log.warn("[Lock] renew failed for session {}: {}", lock.sessionId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean release(SessionLock lock) {
        try {
            Long result = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(lock.sessionId())), lock.token());
            boolean released = result != null && result == 1L;
            if (!released) {
                log.debug("[Lock] lock for session {} was no longer held by this token", lock.sessionId());
            }
            return released;
        } catch (DataAccessException e) {
            // the key still expires through its own TTL
            log.warn("[Lock] release failed for session {}: {}", lock.sessionId(), e.getMessage());
            return false;
        }
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }
}
