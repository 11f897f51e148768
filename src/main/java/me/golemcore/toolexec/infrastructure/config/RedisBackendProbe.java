package me.golemcore.toolexec.infrastructure.config;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends {@code PING} through a fresh connection and waits at most the given
 * timeout for {@code PONG}.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisBackendProbe implements BackendProbe {

    private final RedisConnectionFactory connectionFactory;

    @Override
    public boolean isReachable(Duration timeout) {
        CompletableFuture<String> ping = CompletableFuture.supplyAsync(this::ping);
        try {
            return "PONG".equalsIgnoreCase(ping.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("[SessionStore] redis ping failed: {}", cause.getMessage());
            return false;
        } catch (TimeoutException e) {
            ping.cancel(true);
            log.debug("[SessionStore] redis ping timed out after {} ms", timeout.toMillis());
            return false;
        }
    }

    private String ping() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            return connection.ping();
        }
    }
}
