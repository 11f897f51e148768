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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.adapter.outbound.memory.InMemorySessionStore;
import me.golemcore.toolexec.adapter.outbound.redis.RedisSessionStore;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Chooses the session store once, at startup.
 *
 * <p>
 * {@code toolexec.session.force-memory} selects the in-memory store outright.
 * Otherwise the backend is probed with the connect timeout: Redis when it
 * answers, the in-memory store when it does not. The choice is never revisited
 * while the process runs.
 */
@Slf4j
public class SessionStoreFactory {

    private final ToolExecProperties properties;
    private final BackendProbe backendProbe;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public SessionStoreFactory(ToolExecProperties properties, BackendProbe backendProbe,
            StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock,
            ScheduledExecutorService scheduler) {
        this.properties = properties;
        this.backendProbe = backendProbe;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public SessionStoreSelection create() {
        ToolExecProperties.SessionProperties session = properties.getSession();
        if (session.isForceMemory()) {
            logSelection("[SessionStore] using in-memory session store (forced)");
            return new SessionStoreSelection(memoryStore(), false);
        }
        if (!backendProbe.isReachable(properties.getBackend().getConnectTimeout())) {
            log.warn("[SessionStore] backend not reachable, falling back to in-memory session store");
            return new SessionStoreSelection(memoryStore(), false);
        }
        logSelection("[SessionStore] using redis session store");
        RedisSessionStore store = new RedisSessionStore(redisTemplate, objectMapper, clock,
                properties.sessionKeyPrefix(), properties.sessionIndexKey(), session.getTtlSeconds());
        return new SessionStoreSelection(store, true);
    }

    private InMemorySessionStore memoryStore() {
        InMemorySessionStore store = new InMemorySessionStore(clock, properties.getSession().getTtlSeconds());
        store.startSweeper(scheduler, properties.getSession().getSweepInterval());
        return store;
    }

    private void logSelection(String message) {
        if (properties.isVerbose()) {
            log.info(message);
        } else {
            log.debug(message);
        }
    }
}
